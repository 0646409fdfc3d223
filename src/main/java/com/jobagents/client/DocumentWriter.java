package com.jobagents.client;

import com.jobagents.core.Result;
import com.jobagents.model.Candidate;
import com.jobagents.model.GenerationKind;

import java.nio.file.Path;

/**
 * Renders generated text to a file.
 */
public interface DocumentWriter {

    /**
     * @return the written file, or a failure
     */
    Result<Path> write(GenerationKind kind, Candidate candidate, String text);
}
