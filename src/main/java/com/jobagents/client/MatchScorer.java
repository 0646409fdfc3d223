package com.jobagents.client;

import com.jobagents.core.Result;
import com.jobagents.model.Candidate;
import com.jobagents.model.ReferenceMatch;

import java.util.List;

/**
 * Scoring service: finds the reference artifacts most relevant to a posting and scores
 * each of them. Combining the per-reference scores is up to the caller.
 */
public interface MatchScorer {

    /**
     * @return the reference matches (possibly empty), or a failure
     */
    Result<List<ReferenceMatch>> score(Candidate candidate);
}
