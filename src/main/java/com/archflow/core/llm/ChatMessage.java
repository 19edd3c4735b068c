package com.archflow.core.llm;

/**
 * Provider-neutral chat message.
 */
public record ChatMessage(Type type, String content) {

    public enum Type {
        SYSTEM,
        USER,
        ASSISTANT
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(Type.SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(Type.USER, content);
    }
}
