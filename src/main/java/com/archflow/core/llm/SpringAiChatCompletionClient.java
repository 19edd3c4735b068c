package com.archflow.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

/**
 * {@link ChatCompletionClient} backed by a Spring AI {@link ChatClient} whose default
 * options (model, temperature) are fixed for one role.
 */
public class SpringAiChatCompletionClient implements ChatCompletionClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiChatCompletionClient.class);

    private final ModelRole role;
    private final String model;
    private final ChatClient chatClient;

    public SpringAiChatCompletionClient(ModelRole role, String model, ChatClient chatClient) {
        this.role = role;
        this.model = model;
        this.chatClient = chatClient;
    }

    @Override
    public ModelRole role() {
        return role;
    }

    @Override
    public String call(List<ChatMessage> messages, Duration deadline) {
        long start = System.currentTimeMillis();
        try {
            String content = Mono.fromCallable(() -> prompt(messages).call().content())
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(deadline)
                    .block();
            log.debug("Model call complete [{} / {}] ({} ms)", role, model, System.currentTimeMillis() - start);
            return requireContent(content);
        } catch (RuntimeException e) {
            throw ModelErrorClassifier.classify(e);
        }
    }

    @Override
    public String stream(List<ChatMessage> messages, Duration deadline, Consumer<String> onToken) {
        long start = System.currentTimeMillis();
        Instant deadlineAt = Instant.now().plus(deadline);
        var response = new StringBuilder();
        try {
            prompt(messages).stream().content()
                    .timeout(Mono.delay(deadline), token -> Mono.delay(remaining(deadlineAt)))
                    .doOnNext(token -> {
                        if (token != null && !token.isEmpty()) {
                            response.append(token);
                            onToken.accept(token);
                        }
                    })
                    .blockLast();
        } catch (RuntimeException e) {
            throw ModelErrorClassifier.classify(e);
        }
        log.debug("Model stream complete [{} / {}] ({} chars, {} ms)",
                role, model, response.length(), System.currentTimeMillis() - start);
        return requireContent(response.toString());
    }

    private ChatClient.ChatClientRequestSpec prompt(List<ChatMessage> messages) {
        List<Message> converted = messages.stream().map(SpringAiChatCompletionClient::toMessage).toList();
        return chatClient.prompt().messages(converted);
    }

    private static Message toMessage(ChatMessage message) {
        return switch (message.type()) {
            case SYSTEM -> new SystemMessage(message.content());
            case USER -> new UserMessage(message.content());
            case ASSISTANT -> new AssistantMessage(message.content());
        };
    }

    private String requireContent(String content) {
        if (content == null || content.isBlank()) {
            throw new TransientServiceException(TransientServiceException.Cause.SERVICE_ERROR,
                    "Model " + model + " returned empty content for role " + role);
        }
        return content;
    }

    private static Duration remaining(Instant deadlineAt) {
        Duration left = Duration.between(Instant.now(), deadlineAt);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
