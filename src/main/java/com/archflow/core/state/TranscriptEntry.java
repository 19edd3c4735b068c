package com.archflow.core.state;

/**
 * One agent-labelled chunk of the run transcript.
 *
 * @param agentId node id that produced the chunk
 * @param label   human-readable speaker label
 * @param text    the chunk text
 */
public record TranscriptEntry(String agentId, String label, String text) {
}
