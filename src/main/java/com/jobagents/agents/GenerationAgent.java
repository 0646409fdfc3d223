package com.jobagents.agents;

import com.google.gson.JsonObject;
import com.jobagents.client.CandidateSource;
import com.jobagents.client.ContentGenerator;
import com.jobagents.client.DocumentWriter;
import com.jobagents.client.PackageStore;
import com.jobagents.core.AgentConfig;
import com.jobagents.core.BaseAgent;
import com.jobagents.core.Result;
import com.jobagents.core.StepOutcome;
import com.jobagents.model.ApplicationPackage;
import com.jobagents.model.Candidate;
import com.jobagents.model.GenerationKind;
import com.jobagents.queue.WorkItem;
import com.jobagents.queue.WorkQueue;

import java.nio.file.Path;
import java.time.Instant;
import java.util.logging.Logger;

/**
 * Base class for agents that turn queued matches into generated documents.
 *
 * <p><b>Per step</b> one item is taken from the input queue and processed:</p>
 * <ol>
 *   <li>pop an item; an empty queue, an item without id or an already completed id
 *       end the step without touching state</li>
 *   <li>fetch the posting by id</li>
 *   <li>generate the document text</li>
 *   <li>write the document to disk</li>
 *   <li>persist an {@link ApplicationPackage} record</li>
 *   <li>record the id as completed and run {@link #afterCompletion(WorkItem, Candidate)}</li>
 * </ol>
 *
 * <p><b>Retry:</b> if any collaborator fails, the item goes back to the tail of the
 * input queue with an incremented {@code attempts} field and is dropped after
 * {@value #MAX_ATTEMPTS} attempts.</p>
 */
public abstract class GenerationAgent extends BaseAgent {
    private static final Logger logger = Logger.getLogger(GenerationAgent.class.getName());

    static final String ATTEMPTS = "attempts";
    static final int MAX_ATTEMPTS = 3;

    private final GenerationKind kind;
    private final WorkQueue input;
    private final CandidateSource candidates;
    private final ContentGenerator generator;
    private final DocumentWriter writer;
    private final PackageStore packages;

    protected GenerationAgent(AgentConfig config, GenerationKind kind, WorkQueue input, CandidateSource candidates,
                              ContentGenerator generator, DocumentWriter writer, PackageStore packages) {
        super(config);
        this.kind = kind;
        this.input = input;
        this.candidates = candidates;
        this.generator = generator;
        this.writer = writer;
        this.packages = packages;
    }

    /**
     * @return state section holding completed ids, e.g. "completed_resumes"
     */
    protected abstract String completedSection();

    /**
     * Called once a document was generated and recorded. Default does nothing.
     */
    protected void afterCompletion(WorkItem item, Candidate candidate) {
    }

    @Override
    public StepOutcome step() {
        WorkItem item = input.pop();
        if (item == null) {
            logger.fine(getName() + ": nothing queued in " + input.getName());
            return StepOutcome.SKIPPED;
        }

        Long id = item.getId();
        if (id == null) {
            logger.warning(getName() + ": dropping item without id: " + item);
            return StepOutcome.SKIPPED;
        }
        if (isCompleted(id)) {
            logger.info(getName() + ": candidate " + id + " already done");
            return StepOutcome.SKIPPED;
        }

        Result<Candidate> fetched = candidates.fetchCandidate(id);
        if (fetched.isFailure()) {
            return retryLater(item, "fetch failed: " + fetched.getError());
        }
        Candidate candidate = withId(fetched.get(), id);

        Result<String> text = generator.generate(candidate, kind);
        if (text.isFailure()) {
            return retryLater(item, kind.getDisplayName() + " generation failed: " + text.getError());
        }

        Result<Path> written = writer.write(kind, candidate, text.get());
        if (written.isFailure()) {
            return retryLater(item, "write failed: " + written.getError());
        }

        double score = item.getScore() == null ? 0.0 : item.getScore();
        ApplicationPackage record = ApplicationPackage.forDocument(kind, candidate, score,
                written.get().toString(), getName());
        Result<Long> stored = packages.persist(record);
        if (stored.isFailure()) {
            return retryLater(item, "persist failed: " + stored.getError());
        }

        JsonObject entry = new JsonObject();
        entry.addProperty("title", candidate.getTitle());
        entry.addProperty("company", candidate.getCompany());
        entry.addProperty("path", written.get().toString());
        entry.addProperty("score", score);
        entry.addProperty("package_id", stored.get());
        entry.addProperty("completed_at", Instant.now().toString());
        getState().section(completedSection()).add(String.valueOf(id), entry);

        logger.info(getName() + ": saved " + kind.getDisplayName().toLowerCase() + " for candidate " + id
                + " at " + written.get());
        afterCompletion(item, candidate);
        return StepOutcome.COMPLETED;
    }

    private StepOutcome retryLater(WorkItem item, String reason) {
        int attempts = item.getInt(ATTEMPTS, 0) + 1;
        if (attempts >= MAX_ATTEMPTS) {
            logger.severe(getName() + ": giving up on candidate " + item.getId() + " after " + attempts
                    + " attempts (" + reason + ")");
        } else {
            logger.warning(getName() + ": candidate " + item.getId() + " " + reason + ", requeued (attempt "
                    + attempts + "/" + MAX_ATTEMPTS + ")");
            input.push(item.with(ATTEMPTS, attempts));
        }
        return StepOutcome.FAILED;
    }

    // The backend may omit the id in single-posting responses
    private static Candidate withId(Candidate candidate, long id) {
        if (candidate.getId() != null && candidate.getId() == id) {
            return candidate;
        }
        return new Candidate(id, candidate.getTitle(), candidate.getCompany(), candidate.getLocation(),
                candidate.getDescription(), candidate.getSourceUrl());
    }

    public boolean isCompleted(long id) {
        return getState().section(completedSection()).has(String.valueOf(id));
    }

    public GenerationKind getKind() {
        return kind;
    }
}
