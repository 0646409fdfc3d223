package com.jobagents.agents;

import com.jobagents.client.CandidateSink;
import com.jobagents.client.ListingSource;
import com.jobagents.core.AgentConfig;
import com.jobagents.core.BaseAgent;
import com.jobagents.core.Result;
import com.jobagents.core.StateStoreException;
import com.jobagents.core.StepOutcome;
import com.jobagents.model.Candidate;
import com.jobagents.model.Fingerprint;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Discovers postings from a listing source and submits the new ones to the backend.
 *
 * <p><b>Dedup:</b> each listing is fingerprinted from title, company and description
 * (never the URL, which changes between fetches). A fingerprint is remembered only
 * after the backend accepted the listing or reported it as a duplicate, so a failed
 * submit is retried on the next step. The remembered list is capped: above
 * {@value #MAX_SEEN} entries only the newest {@value #KEEP_SEEN} are kept.</p>
 */
public class JobFetcherAgent extends BaseAgent {
    private static final Logger logger = Logger.getLogger(JobFetcherAgent.class.getName());

    public static final String SEEN = "seen_job_hashes";
    static final int MAX_SEEN = 2000;
    static final int KEEP_SEEN = 1000;
    static final int MAX_DESCRIPTION_LENGTH = 4000;

    private final ListingSource listings;
    private final CandidateSink sink;

    // Insertion ordered; the index mirrors it for lookups
    private List<String> seen;
    private final Set<String> seenIndex;

    public JobFetcherAgent(AgentConfig config, ListingSource listings, CandidateSink sink) {
        super(config);
        this.listings = listings;
        this.sink = sink;
        this.seen = getState().getStringList(SEEN);
        this.seenIndex = new HashSet<>(seen);
    }

    @Override
    public StepOutcome step() {
        Result<List<Candidate>> fetched = listings.fetchListings();
        if (fetched.isFailure()) {
            logger.warning("Listing fetch failed: " + fetched.getError());
            return StepOutcome.SKIPPED;
        }
        if (fetched.get().isEmpty()) {
            logger.info("No listings found");
            return StepOutcome.SKIPPED;
        }

        int inserted = 0;
        int duplicates = 0;
        int alreadySeen = 0;
        int failed = 0;

        for (Candidate listing : fetched.get()) {
            String fingerprint = Fingerprint.of(listing);
            if (seenIndex.contains(fingerprint)) {
                alreadySeen++;
                continue;
            }

            Result<CandidateSink.SubmitStatus> submitted = sink.submit(listing.truncatedTo(MAX_DESCRIPTION_LENGTH));
            if (submitted.isFailure()) {
                logger.warning("Failed to submit '" + listing.getTitle() + "': " + submitted.getError());
                failed++;
                continue;
            }

            if (submitted.get() == CandidateSink.SubmitStatus.DUPLICATE) {
                logger.info("Backend already has '" + listing.getTitle() + "'");
                duplicates++;
            } else {
                logger.info("Inserted '" + listing.getTitle() + "' at " + listing.getCompany());
                inserted++;
            }
            remember(fingerprint);
        }

        logger.info("Fetch cycle complete: " + inserted + " inserted, " + duplicates + " duplicates, "
                + alreadySeen + " already seen, " + failed + " failed");
        return failed == 0 ? StepOutcome.COMPLETED : StepOutcome.FAILED;
    }

    private void remember(String fingerprint) {
        seen.add(fingerprint);
        seenIndex.add(fingerprint);
        if (seen.size() > MAX_SEEN) {
            seen = new ArrayList<>(seen.subList(seen.size() - KEEP_SEEN, seen.size()));
            seenIndex.clear();
            seenIndex.addAll(seen);
        }

        getState().putStringList(SEEN, seen);
        try {
            getState().flush();
        } catch (StateStoreException e) {
            logger.log(Level.SEVERE, "Failed to persist fetcher state", e);
        }
    }

    public boolean hasSeen(Candidate listing) {
        return seenIndex.contains(Fingerprint.of(listing));
    }

    public int seenCount() {
        return seen.size();
    }
}
