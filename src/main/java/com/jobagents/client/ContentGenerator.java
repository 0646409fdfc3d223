package com.jobagents.client;

import com.jobagents.core.Result;
import com.jobagents.model.Candidate;
import com.jobagents.model.GenerationKind;

/**
 * Text synthesis service behind the generation endpoints.
 */
public interface ContentGenerator {

    /**
     * @return the generated document text, or a failure
     */
    Result<String> generate(Candidate candidate, GenerationKind kind);
}
