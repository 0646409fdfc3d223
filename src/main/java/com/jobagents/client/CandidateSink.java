package com.jobagents.client;

import com.jobagents.core.Result;
import com.jobagents.model.Candidate;

/**
 * Write side of the posting store, fed by the fetcher agent.
 */
public interface CandidateSink {

    enum SubmitStatus {
        INSERTED,
        DUPLICATE
    }

    /**
     * Store a newly discovered posting.
     *
     * @return INSERTED, DUPLICATE if the store already had it, or a failure
     */
    Result<SubmitStatus> submit(Candidate listing);
}
