package com.convolog.aggregate;

/**
 * A command broke a business rule. Nothing was appended.
 *
 * <p>{@link #reason()} is a stable machine-readable code such as {@code conversation_archived};
 * callers surface it as-is.
 */
public class CommandRejectedException extends RuntimeException {

    private final String reason;

    public CommandRejectedException(String reason) {
        this(reason, "Command rejected: " + reason);
    }

    public CommandRejectedException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
