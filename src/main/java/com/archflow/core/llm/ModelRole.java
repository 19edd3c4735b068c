package com.archflow.core.llm;

/**
 * Partitions of the chat-completion client pool.
 */
public enum ModelRole {
    /** Capable model for design, audit, recommendation and code generation. */
    MAIN,
    /** Capable model at a higher sampling temperature for the competing design. */
    CREATIVE,
    /** Cheap, fast model for requirements and specialist reviews. */
    MINI
}
