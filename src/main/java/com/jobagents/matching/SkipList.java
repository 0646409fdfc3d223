package com.jobagents.matching;

import com.jobagents.model.Candidate;
import com.jobagents.model.Fingerprint;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Postings that must never be sent downstream, keyed by normalized title and company.
 *
 * <p>Entries are written {@code Title|Company}. Matching ignores case and extra whitespace,
 * and does not look at the candidate id: every posting with the same title at the same
 * company is blocked.</p>
 */
public class SkipList {

    private final Set<String> keys = ConcurrentHashMap.newKeySet();

    public static SkipList empty() {
        return new SkipList();
    }

    /**
     * @param entries {@code Title|Company} strings; blank entries are ignored
     */
    public static SkipList of(Collection<String> entries) {
        SkipList list = new SkipList();
        for (String entry : entries) {
            list.addEntry(entry);
        }
        return list;
    }

    /**
     * Parse a {@code ;}-separated list, e.g. {@code "Data Engineer|Acme;Intern|Initech"}.
     */
    public static SkipList parse(String entries) {
        SkipList list = new SkipList();
        if (entries == null) {
            return list;
        }
        for (String entry : entries.split(";")) {
            list.addEntry(entry);
        }
        return list;
    }

    public void add(String title, String company) {
        keys.add(Fingerprint.titleCompanyKey(title, company));
    }

    private void addEntry(String entry) {
        if (entry == null || entry.isBlank()) {
            return;
        }
        int separator = entry.indexOf('|');
        if (separator < 0) {
            add(entry, "");
        } else {
            add(entry.substring(0, separator), entry.substring(separator + 1));
        }
    }

    public boolean contains(Candidate candidate) {
        return keys.contains(Fingerprint.titleCompanyKey(candidate.getTitle(), candidate.getCompany()));
    }

    public int size() {
        return keys.size();
    }
}
