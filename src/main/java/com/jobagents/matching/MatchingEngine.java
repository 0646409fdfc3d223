package com.jobagents.matching;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.jobagents.client.CandidateSource;
import com.jobagents.client.MatchScorer;
import com.jobagents.core.AgentConfig;
import com.jobagents.core.BaseAgent;
import com.jobagents.core.Result;
import com.jobagents.core.StateStoreException;
import com.jobagents.core.StepOutcome;
import com.jobagents.model.Candidate;
import com.jobagents.model.MatchResult;
import com.jobagents.model.ReferenceMatch;
import com.jobagents.queue.WorkItem;
import com.jobagents.queue.WorkQueue;
import com.jobagents.state.JsonFiles;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scores every new candidate against the reference corpus and forwards strong matches.
 *
 * <p>Each step fetches the full candidate list and partitions it:</p>
 * <ul>
 *   <li>already scored (present in {@code processed_jobs}): ignored</li>
 *   <li>description shorter than the minimum: recorded with score 0, no scoring call</li>
 *   <li>everything else: scored on a fixed-size pool, once per id even if upstream
 *       lists it twice</li>
 * </ul>
 *
 * <p>Entries of {@code processed_jobs}, {@code queued_jobs} and {@code skipped_jobs}
 * whose candidate is no longer returned upstream are dropped before scoring.</p>
 *
 * <p><b>Recording a result</b> happens under one lock for the whole engine: the result is
 * written to {@code processed_jobs} and flushed immediately, then the skip list and the
 * {@code queued_jobs} map are checked, and a candidate scoring at or above the threshold
 * is pushed to the downstream queue and recorded as queued. A candidate is therefore
 * pushed at most once for as long as its state entry exists.</p>
 *
 * <p><b>Error Handling:</b> a scoring failure is logged and leaves the candidate
 * unscored, so the next step retries it. If the downstream push fails, the recorded
 * result is removed again with the same effect. It never aborts the rest of the batch, and the
 * step itself always returns.</p>
 *
 * <p><b>Thread Safety:</b> pool threads only call the scorer outside the lock; every
 * read and write of the task state goes through {@link #stateLock}.</p>
 *
 * @see ScoreCombiner
 * @see SkipList
 */
public class MatchingEngine extends BaseAgent {
    private static final Logger logger = Logger.getLogger(MatchingEngine.class.getName());

    public static final String PROCESSED = "processed_jobs";
    public static final String QUEUED = "queued_jobs";
    public static final String SKIPPED = "skipped_jobs";

    private final CandidateSource source;
    private final MatchScorer scorer;
    private final WorkQueue downstream;
    private final SkipList skipList;
    private final MatcherSettings settings;
    private final ScoreCombiner combiner;

    // Guards all task state access from pool threads
    private final ReentrantLock stateLock = new ReentrantLock();

    public MatchingEngine(AgentConfig config, CandidateSource source, MatchScorer scorer, WorkQueue downstream,
                          SkipList skipList, MatcherSettings settings) {
        super(config);
        this.source = source;
        this.scorer = scorer;
        this.downstream = downstream;
        this.skipList = skipList;
        this.settings = settings;
        this.combiner = new ScoreCombiner(settings.getSkillWeight());

        stateLock.lock();
        try {
            getState().section(PROCESSED);
        } finally {
            stateLock.unlock();
        }
        logger.info("Matching engine initialized: " + settings);
    }

    @Override
    public StepOutcome step() {
        Result<List<Candidate>> fetched = source.fetchCandidates();
        if (fetched.isFailure()) {
            logger.warning("Could not fetch candidates: " + fetched.getError());
            return StepOutcome.SKIPPED;
        }
        List<Candidate> candidates = fetched.get();
        logger.info("Fetched " + candidates.size() + " candidates");

        List<Candidate> eligible = new ArrayList<>();
        Set<String> eligibleKeys = new HashSet<>();
        int malformed = 0;
        int tooShort = 0;
        int repeated = 0;

        stateLock.lock();
        try {
            collectGarbage(candidates);

            JsonObject processed = getState().section(PROCESSED);
            for (Candidate candidate : candidates) {
                if (candidate == null || candidate.getId() == null) {
                    malformed++;
                    continue;
                }
                String key = String.valueOf(candidate.getId());
                if (processed.has(key)) {
                    continue;
                }
                // Upstream may list the same id twice; score it once
                if (!eligibleKeys.add(key)) {
                    repeated++;
                    continue;
                }
                if (candidate.getDescription().length() < settings.getMinDescriptionLength()) {
                    logger.info("Candidate " + key + " has a too short description, scoring 0");
                    processed.add(key, processedEntry(new MatchResult(candidate.getId(), 0.0, List.of())));
                    flushState();
                    tooShort++;
                    continue;
                }
                eligible.add(candidate);
            }
        } finally {
            stateLock.unlock();
        }

        if (malformed > 0) {
            logger.warning("Skipped " + malformed + " candidates without an id");
        }
        if (repeated > 0) {
            logger.warning("Ignored " + repeated + " repeated candidate ids in this batch");
        }

        if (eligible.isEmpty()) {
            logger.info("No candidates to score (" + tooShort + " too short)");
            return StepOutcome.COMPLETED;
        }

        int failures = scoreAll(eligible);
        logger.info("Matching step complete: " + eligible.size() + " scored, " + failures + " failed, "
                + tooShort + " too short");
        return failures == 0 ? StepOutcome.COMPLETED : StepOutcome.FAILED;
    }

    /**
     * Score candidates on the pool and wait for all of them.
     *
     * @return number of candidates left unscored
     */
    private int scoreAll(List<Candidate> eligible) {
        ExecutorService pool = Executors.newFixedThreadPool(settings.getPoolWidth(), new ScoringThreadFactory(getName()));
        AtomicInteger failures = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (Candidate candidate : eligible) {
                futures.add(pool.submit(() -> {
                    if (!scoreOne(candidate)) {
                        failures.incrementAndGet();
                    }
                }));
            }

            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    logger.log(Level.SEVERE, "Scoring task failed", e.getCause());
                    failures.incrementAndGet();
                }
            }
        } catch (InterruptedException e) {
            logger.warning("Interrupted while waiting for scoring tasks");
            Thread.currentThread().interrupt();
        } finally {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                pool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        return failures.get();
    }

    /**
     * @return true if the candidate was scored and recorded
     */
    private boolean scoreOne(Candidate candidate) {
        long id = candidate.getId();
        try {
            Result<List<ReferenceMatch>> scored = scorer.score(candidate);
            if (scored.isFailure()) {
                logger.warning("Scoring failed for candidate " + id + ": " + scored.getError());
                return false;
            }

            List<ReferenceMatch> matches = scored.get();
            MatchResult result = new MatchResult(id, combiner.combine(matches), matches);
            logger.info("Candidate " + id + " (" + candidate.getTitle() + ") scored "
                    + String.format("%.4f", result.getScore()));
            return record(candidate, result);

        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected error scoring candidate " + id, e);
            return false;
        }
    }

    /**
     * @return false if a strong match could not be pushed; its result is then withdrawn
     *         so the next step scores it again
     */
    private boolean record(Candidate candidate, MatchResult result) {
        String key = String.valueOf(result.getCandidateId());

        stateLock.lock();
        try {
            getState().section(PROCESSED).add(key, processedEntry(result));
            flushState();

            if (skipList.contains(candidate)) {
                JsonObject entry = new JsonObject();
                entry.addProperty("title", candidate.getTitle());
                entry.addProperty("company", candidate.getCompany());
                entry.addProperty("score", result.getScore());
                entry.addProperty("reason", "skip_list");
                getState().section(SKIPPED).add(key, entry);
                flushState();
                logger.info("Candidate " + key + " is on the skip list, not forwarding");
                return true;
            }

            JsonObject queued = getState().section(QUEUED);
            if (queued.has(key)) {
                logger.fine("Candidate " + key + " already queued");
                return true;
            }

            if (result.getScore() >= settings.getThreshold()) {
                try {
                    downstream.push(WorkItem.of(result.getCandidateId(), result.getScore())
                            .with("title", candidate.getTitle())
                            .with("company", candidate.getCompany()));
                } catch (RuntimeException e) {
                    logger.log(Level.SEVERE, "Failed to push candidate " + key + " to " + downstream.getName()
                            + ", it will be scored again", e);
                    getState().section(PROCESSED).remove(key);
                    flushState();
                    return false;
                }

                JsonObject entry = new JsonObject();
                entry.addProperty("score", result.getScore());
                entry.addProperty("queued_at", Instant.now().toString());
                queued.add(key, entry);
                flushState();
                logger.info("Strong match " + key + " (score=" + String.format("%.4f", result.getScore())
                        + ") pushed to " + downstream.getName());
            }
            return true;
        } finally {
            stateLock.unlock();
        }
    }

    // Drops tracking entries for candidates no longer returned upstream
    private void collectGarbage(List<Candidate> candidates) {
        Set<String> live = new HashSet<>();
        for (Candidate candidate : candidates) {
            if (candidate != null && candidate.getId() != null) {
                live.add(String.valueOf(candidate.getId()));
            }
        }

        int removed = 0;
        for (String sectionName : List.of(PROCESSED, QUEUED, SKIPPED)) {
            if (!getState().contains(sectionName)) {
                continue;
            }
            JsonObject section = getState().section(sectionName);
            for (String key : new ArrayList<>(section.keySet())) {
                if (!live.contains(key)) {
                    section.remove(key);
                    removed++;
                }
            }
        }
        if (removed > 0) {
            logger.info("Removed " + removed + " stale state entries");
        }
    }

    private JsonObject processedEntry(MatchResult result) {
        JsonObject entry = new JsonObject();
        entry.addProperty("score", result.getScore());
        entry.add("matches", JsonFiles.gson().toJsonTree(result.getEvidence()));
        return entry;
    }

    private void flushState() {
        try {
            getState().flush();
        } catch (StateStoreException e) {
            logger.log(Level.SEVERE, "Failed to persist matcher state", e);
        }
    }

    /**
     * @return true if the candidate has a recorded score
     */
    public boolean isProcessed(long candidateId) {
        stateLock.lock();
        try {
            return getState().section(PROCESSED).has(String.valueOf(candidateId));
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * @return the recorded score, or null if the candidate was not scored yet
     */
    public Double getRecordedScore(long candidateId) {
        stateLock.lock();
        try {
            JsonElement entry = getState().section(PROCESSED).get(String.valueOf(candidateId));
            if (entry == null || !entry.isJsonObject() || !entry.getAsJsonObject().has("score")) {
                return null;
            }
            return entry.getAsJsonObject().get("score").getAsDouble();
        } finally {
            stateLock.unlock();
        }
    }

    private static final class ScoringThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        ScoringThreadFactory(String agentName) {
            this.prefix = agentName + "-scorer-";
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
