package com.jobagents.agents;

import com.jobagents.client.CandidateSource;
import com.jobagents.client.ContentGenerator;
import com.jobagents.client.DocumentWriter;
import com.jobagents.client.PackageStore;
import com.jobagents.core.AgentConfig;
import com.jobagents.model.Candidate;
import com.jobagents.model.GenerationKind;
import com.jobagents.queue.WorkItem;
import com.jobagents.queue.WorkQueue;

import java.util.logging.Logger;

/**
 * Generates a resume for every strong match and hands the posting on to the
 * cover letter queue.
 */
public class ResumeAgent extends GenerationAgent {
    private static final Logger logger = Logger.getLogger(ResumeAgent.class.getName());

    private final WorkQueue followUp;

    public ResumeAgent(AgentConfig config, WorkQueue input, WorkQueue followUp, CandidateSource candidates,
                       ContentGenerator generator, DocumentWriter writer, PackageStore packages) {
        super(config, GenerationKind.RESUME, input, candidates, generator, writer, packages);
        this.followUp = followUp;
    }

    @Override
    protected String completedSection() {
        return "completed_resumes";
    }

    @Override
    protected void afterCompletion(WorkItem item, Candidate candidate) {
        WorkItem next = WorkItem.of(candidate.getId(), item.getScore() == null ? 0.0 : item.getScore())
                .with("title", candidate.getTitle())
                .with("company", candidate.getCompany());
        followUp.push(next);
        logger.info("Candidate " + candidate.getId() + " forwarded to " + followUp.getName());
    }
}
