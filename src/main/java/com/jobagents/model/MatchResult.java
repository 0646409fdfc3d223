package com.jobagents.model;

import java.util.Collections;
import java.util.List;

/**
 * Score of one candidate against the reference corpus, with the matches it was derived from.
 *
 * <p>The score is in [0, 1] and is a pure function of the evidence, so re-scoring a
 * candidate against an unchanged corpus gives the same result.</p>
 */
public final class MatchResult {
    private final long candidateId;
    private final double score;
    private final List<ReferenceMatch> evidence;

    public MatchResult(long candidateId, double score, List<ReferenceMatch> evidence) {
        this.candidateId = candidateId;
        this.score = score;
        this.evidence = evidence == null ? List.of() : Collections.unmodifiableList(List.copyOf(evidence));
    }

    public long getCandidateId() {
        return candidateId;
    }

    public double getScore() {
        return score;
    }

    public List<ReferenceMatch> getEvidence() {
        return evidence;
    }

    @Override
    public String toString() {
        return "MatchResult{candidateId=" + candidateId + ", score=" + String.format("%.4f", score)
                + ", evidence=" + evidence.size() + "}";
    }
}
