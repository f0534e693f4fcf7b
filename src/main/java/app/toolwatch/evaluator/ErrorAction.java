package app.toolwatch.evaluator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the remote evaluator decides when the collector cannot answer.
 */
public enum ErrorAction {
    /** Tool call läuft trotzdem. */
    ALLOW("allow"),
    /** Tool call wird blockiert (Standard). */
    BLOCK("block");

    private final String value;

    ErrorAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ErrorAction fromValue(String value) {
        if (value == null) {
            return BLOCK;
        }
        for (ErrorAction action : values()) {
            if (action.value.equalsIgnoreCase(value.trim())) {
                return action;
            }
        }
        throw new IllegalArgumentException("Invalid error action: " + value);
    }
}
