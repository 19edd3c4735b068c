package com.archflow.core.state;

import com.archflow.core.model.DesignBundle;
import com.archflow.core.model.DesignConfiguration;
import com.archflow.core.model.DesignRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * The single mutable record threaded through the agent graph for one run.
 * <p>
 * Input fields are fixed at construction. Output slots, control fields and the
 * revision feedback are mutated only by the executor's merge step ({@link #apply})
 * and revision bookkeeping; the {@link Transcript} is the only part sibling nodes
 * may append to concurrently.
 */
public class RunState {

    private final String runId;
    private final String fingerprint;
    private final String requirements;
    private final String userAnswers;
    private final DesignConfiguration configuration;

    private final Map<DesignField, String> outputs = new ConcurrentHashMap<>();
    private final Transcript transcript = new Transcript();
    private final List<String> revisionFeedback = new ArrayList<>();
    private final AtomicReference<String> historicalContext = new AtomicReference<>();

    private volatile RunStatus status = RunStatus.PENDING;
    private volatile int revisionCount;
    private volatile boolean clarificationNeeded;

    public RunState(String runId, String fingerprint, DesignRequest request) {
        this.runId = runId;
        this.fingerprint = fingerprint;
        this.requirements = request.text();
        this.userAnswers = request.userAnswers();
        this.configuration = request.configuration();
    }

    // ── Inputs ───────────────────────────────────────────────────────

    public String runId() {
        return runId;
    }

    public String fingerprint() {
        return fingerprint;
    }

    public String requirements() {
        return requirements;
    }

    public Optional<String> userAnswers() {
        return userAnswers == null || userAnswers.isBlank() ? Optional.empty() : Optional.of(userAnswers);
    }

    public DesignConfiguration configuration() {
        return configuration;
    }

    /**
     * Refined requirements when the requirements stage produced them, otherwise the raw text.
     */
    public String effectiveRequirements() {
        return output(DesignField.REFINED_REQUIREMENTS).filter(s -> !s.isBlank()).orElse(requirements);
    }

    // ── Outputs ──────────────────────────────────────────────────────

    public Optional<String> output(DesignField field) {
        return Optional.ofNullable(outputs.get(field));
    }

    public String outputOrEmpty(DesignField field) {
        return outputs.getOrDefault(field, "");
    }

    public Transcript transcript() {
        return transcript;
    }

    // ── Control ──────────────────────────────────────────────────────

    public RunStatus status() {
        return status;
    }

    public void status(RunStatus status) {
        this.status = status;
    }

    public int revisionCount() {
        return revisionCount;
    }

    public boolean clarificationNeeded() {
        return clarificationNeeded;
    }

    public synchronized List<String> revisionFeedback() {
        return List.copyOf(revisionFeedback);
    }

    /**
     * Records a rejected pass: bumps the revision counter and keeps the decision
     * node's feedback as extra context for the re-entered stage.
     */
    public synchronized void recordRevision(String feedback) {
        revisionCount++;
        if (feedback != null && !feedback.isBlank()) {
            revisionFeedback.add(feedback);
        }
    }

    /**
     * Returns the memoized historical-feedback context, computing it on first use.
     */
    public String historicalContext(Supplier<String> loader) {
        String current = historicalContext.get();
        if (current != null) {
            return current;
        }
        String loaded = loader.get();
        historicalContext.compareAndSet(null, loaded != null ? loaded : "");
        return historicalContext.get();
    }

    /**
     * Merges a node's delta. Called by the graph executor at stage barriers.
     */
    public void apply(StateDelta delta) {
        outputs.putAll(delta.fields());
        delta.status().ifPresent(this::status);
        delta.clarificationNeeded().ifPresent(flag -> this.clarificationNeeded = flag);
        if (!delta.transcript().isEmpty()) {
            transcript.appendAll(delta.transcript());
        }
    }

    public DesignBundle toBundle() {
        return new DesignBundle(
                outputs.get(DesignField.REFINED_REQUIREMENTS),
                outputs.get(DesignField.CLARIFYING_QUESTIONS),
                outputOrEmpty(DesignField.DESIGN),
                outputOrEmpty(DesignField.ALTERNATIVE_DESIGN),
                outputOrEmpty(DesignField.SECURITY_REPORT),
                outputOrEmpty(DesignField.COST_REPORT),
                outputOrEmpty(DesignField.RELIABILITY_REPORT),
                auditStatus(),
                outputOrEmpty(DesignField.AUDIT_REPORT),
                outputOrEmpty(DesignField.RECOMMENDATION),
                outputOrEmpty(DesignField.TERRAFORM_CODE),
                transcript.render(),
                revisionCount,
                clarificationNeeded);
    }

    private String auditStatus() {
        // a completed run only got past the decision stage on an approval
        return status == RunStatus.COMPLETE ? RunStatus.APPROVED.wireName() : status.wireName();
    }
}
