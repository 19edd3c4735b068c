package com.archflow.core.nodes;

import com.archflow.core.events.StreamEvent;
import com.archflow.core.llm.ChatCompletionClient;
import com.archflow.core.llm.ChatMessage;
import com.archflow.core.llm.ModelRole;
import com.archflow.core.llm.ModelServiceException;
import com.archflow.core.logging.MdcContext;
import com.archflow.core.pool.PooledClient;
import com.archflow.core.state.DesignField;
import com.archflow.core.state.RunState;
import com.archflow.core.state.StateDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.BackOffInterruptedException;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base for agent nodes that make one model call and write one primary field.
 * <p>
 * Handles the lifecycle common to every agent: leasing a pool client for exactly the
 * duration of the call, streaming tokens to the event sink, retrying transient
 * failures with backoff (only while no token of the failed attempt reached the sink),
 * and publishing {@code agent_start}, {@code field_update}
 * and {@code agent_complete}.
 */
public abstract class AbstractAgentNode implements AgentNode {

    private static final Logger log = LoggerFactory.getLogger(AbstractAgentNode.class);

    private final String id;
    private final String label;
    private final ModelRole role;
    private final DesignField primaryField;
    protected final AgentRuntime runtime;

    protected AbstractAgentNode(String id, String label, ModelRole role, DesignField primaryField,
                                AgentRuntime runtime) {
        this.id = id;
        this.label = label;
        this.role = role;
        this.primaryField = primaryField;
        this.runtime = runtime;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public ModelRole role() {
        return role;
    }

    public String label() {
        return label;
    }

    @Override
    public Set<DesignField> outputFields() {
        return Set.of(primaryField);
    }

    protected DesignField primaryField() {
        return primaryField;
    }

    /** Builds the conversation for this node from the current state. */
    protected abstract List<ChatMessage> messages(RunState state);

    /**
     * Turns the model's text into a delta. The default writes the text to the primary
     * field and appends it to the transcript.
     */
    protected StateDelta toDelta(String text, RunState state) {
        return StateDelta.builder()
                .field(primaryField, text)
                .transcript(id, label, text)
                .build();
    }

    /** Whether tokens are streamed to the sink as they arrive. */
    protected boolean streaming() {
        return true;
    }

    @Override
    public StateDelta execute(RunState state, NodeContext context) {
        MdcContext.setNode(state.runId(), id, role.name());
        long start = System.currentTimeMillis();
        try {
            context.checkCancelled();
            context.publish(StreamEvent.agentStart(context.runId(), id));
            List<ChatMessage> messages = messages(state);

            String text = callWithRetry(messages, context);
            StateDelta delta = toDelta(text, state);

            delta.fields().forEach((field, value) ->
                    context.publish(StreamEvent.fieldUpdate(context.runId(), id, field.wireName(), value)));
            context.publish(StreamEvent.agentComplete(context.runId(), id,
                    Map.of("field", primaryField.wireName(), "length", text.length())));
            log.info("Agent {} finished ({} chars, {} ms)", id, text.length(), System.currentTimeMillis() - start);
            return delta;
        } finally {
            runtime.metrics().recordNodeDuration(id, System.currentTimeMillis() - start);
            MdcContext.clearNode();
        }
    }

    private String callWithRetry(List<ChatMessage> messages, NodeContext context) {
        try {
            return runtime.retryTemplate().execute(retryContext -> {
                context.checkCancelled();
                if (retryContext.getRetryCount() > 0) {
                    runtime.metrics().incrementNodeRetries(id);
                    log.warn("Retrying agent {} (attempt {}) after: {}", id, retryContext.getRetryCount() + 1,
                            retryContext.getLastThrowable() != null
                                    ? retryContext.getLastThrowable().getMessage() : "unknown");
                }
                AtomicBoolean streamed = new AtomicBoolean();
                try (PooledClient lease = runtime.pool().acquire(role)) {
                    ChatCompletionClient client = lease.client();
                    if (streaming()) {
                        return client.stream(messages, runtime.callTimeout(), token -> {
                            streamed.set(true);
                            context.publish(StreamEvent.token(context.runId(), id, token));
                        });
                    }
                    return client.call(messages, runtime.callTimeout());
                } catch (ModelServiceException e) {
                    if (streamed.get()) {
                        // a second attempt would repeat tokens already on the feed
                        log.error("Agent {} failed mid-stream, not retrying: {}", id, e.getMessage());
                        throw new NodeExecutionException(id, e.kind(), e);
                    }
                    throw e;
                }
            });
        } catch (ModelServiceException e) {
            log.error("Agent {} failed: {}", id, e.getMessage());
            throw new NodeExecutionException(id, e.kind(), e);
        } catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Run " + context.runId() + " cancelled during backoff");
        }
    }

    protected static String section(String title, String body) {
        return "=== " + title + " ===\n" + (body != null ? body : "") + "\n\n";
    }
}
