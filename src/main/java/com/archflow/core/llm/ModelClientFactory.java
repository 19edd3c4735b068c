package com.archflow.core.llm;

/**
 * Creates chat-completion clients for a role. Used by the pool both to pre-warm
 * entries and to fabricate temporary clients on exhaustion.
 */
@FunctionalInterface
public interface ModelClientFactory {

    ChatCompletionClient create(ModelRole role);
}
