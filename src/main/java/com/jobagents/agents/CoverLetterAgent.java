package com.jobagents.agents;

import com.jobagents.client.CandidateSource;
import com.jobagents.client.ContentGenerator;
import com.jobagents.client.DocumentWriter;
import com.jobagents.client.PackageStore;
import com.jobagents.core.AgentConfig;
import com.jobagents.model.GenerationKind;
import com.jobagents.queue.WorkQueue;

// Generates cover letters for postings that already have a resume
public class CoverLetterAgent extends GenerationAgent {

    public CoverLetterAgent(AgentConfig config, WorkQueue input, CandidateSource candidates,
                            ContentGenerator generator, DocumentWriter writer, PackageStore packages) {
        super(config, GenerationKind.COVER_LETTER, input, candidates, generator, writer, packages);
    }

    @Override
    protected String completedSection() {
        return "completed_cover_letters";
    }
}
