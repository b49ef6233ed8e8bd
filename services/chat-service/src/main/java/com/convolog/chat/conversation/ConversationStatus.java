package com.convolog.chat.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a conversation. {@link #ARCHIVED} is terminal.
 */
public enum ConversationStatus {
    /** No creation event yet. */
    NEW("new"),
    CREATED("created"),
    ACTIVE("active"),
    STREAMING("streaming"),
    ARCHIVED("archived");

    private final String value;

    ConversationStatus(String value) {
        this.value = value;
    }

    /** Lower-case form used in snapshots and projection rows. */
    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ConversationStatus fromValue(String value) {
        for (ConversationStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown conversation status: " + value);
    }
}
