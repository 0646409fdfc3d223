package com.jobagents.client;

import com.jobagents.core.Result;
import com.jobagents.model.Candidate;

import java.util.List;

/**
 * Read side of the posting store: the stored postings the matcher scores and the
 * generation agents look up.
 */
public interface CandidateSource {

    /**
     * @return every posting currently stored, or a failure
     */
    Result<List<Candidate>> fetchCandidates();

    /**
     * @return one posting by id, or a failure (including "not found")
     */
    Result<Candidate> fetchCandidate(long id);
}
