package com.archflow.core.llm;

import com.archflow.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;

/**
 * Builds role-bound chat clients on top of the auto-configured Spring AI {@link ChatModel}.
 */
public class SpringAiModelClientFactory implements ModelClientFactory {

    private static final Logger log = LoggerFactory.getLogger(SpringAiModelClientFactory.class);

    private final ChatModel chatModel;
    private final PipelineProperties.Pool poolProperties;

    public SpringAiModelClientFactory(ChatModel chatModel, PipelineProperties.Pool poolProperties) {
        this.chatModel = chatModel;
        this.poolProperties = poolProperties;
    }

    @Override
    public ChatCompletionClient create(ModelRole role) {
        PipelineProperties.Model model = poolProperties.modelFor(role);
        ChatClient chatClient = ChatClient.builder(chatModel)
                .defaultOptions(ChatOptions.builder()
                        .model(model.getName())
                        .temperature(model.getTemperature())
                        .build())
                .build();
        log.debug("Created {} client (model={}, temperature={})", role, model.getName(), model.getTemperature());
        return new SpringAiChatCompletionClient(role, model.getName(), chatClient);
    }
}
