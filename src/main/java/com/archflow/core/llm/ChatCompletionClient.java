package com.archflow.core.llm;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * A client to the chat-completion service, bound to one {@link ModelRole}.
 * <p>
 * Implementations throw {@link TransientServiceException} for timeouts, rate limits
 * and server-side failures, and {@link PermanentServiceException} for requests the
 * service will never accept.
 */
public interface ChatCompletionClient {

    ModelRole role();

    /**
     * Request/response completion.
     *
     * @param messages conversation to complete
     * @param deadline upper bound for the whole call
     * @return the completion text, never blank
     */
    String call(List<ChatMessage> messages, Duration deadline);

    /**
     * Token-stream completion. Each token is handed to {@code onToken} as soon as it
     * arrives, on the calling thread's behalf.
     *
     * @param messages conversation to complete
     * @param deadline upper bound for the whole stream
     * @param onToken  receives every token in arrival order
     * @return the concatenated completion text
     */
    String stream(List<ChatMessage> messages, Duration deadline, Consumer<String> onToken);
}
