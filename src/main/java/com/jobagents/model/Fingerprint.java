package com.jobagents.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * Stable identity hashes for postings.
 *
 * <p>The fingerprint is a SHA-256 over {@code title|company|description}, trimmed and
 * lower-cased. The source URL is deliberately left out: search APIs hand out a new
 * redirect URL for the same posting on every fetch.</p>
 */
public final class Fingerprint {

    private Fingerprint() {
    }

    /**
     * @return lower-case hex SHA-256 of the normalized identity fields
     */
    public static String of(Candidate candidate) {
        String key = (candidate.getTitle() + "|" + candidate.getCompany() + "|" + candidate.getDescription())
                .strip()
                .toLowerCase(Locale.ROOT);
        return sha256Hex(key);
    }

    /**
     * Normalized (title, company) pair used by the matcher's skip list.
     * Whitespace is collapsed and case folded, so "Data  Engineer" at "ACME" and
     * "data engineer" at "acme " are the same key.
     */
    public static String titleCompanyKey(String title, String company) {
        return normalize(title) + "|" + normalize(company);
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
