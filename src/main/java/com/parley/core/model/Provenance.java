package com.parley.core.model;

/**
 * Who produced a stored conversation message.
 *
 * <p>{@link #SUBAGENT} messages are included in later prompts but never start processing
 * on their own; {@link #ASSISTANT} messages are never fed back into prompts.
 */
public enum Provenance {
    USER,
    ASSISTANT,
    SUBAGENT
}
