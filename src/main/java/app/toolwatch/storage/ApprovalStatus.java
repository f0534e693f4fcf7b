package app.toolwatch.storage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Approval state of a persisted tool call.
 *
 * <p>Erlaubte Übergänge: nur {@code PENDING -> APPROVED} oder {@code PENDING -> DENIED},
 * genau einmal. Alles andere ist unveränderlich (siehe
 * {@link ToolCallRepository#updateApprovalStatus}).
 */
public enum ApprovalStatus {
    PENDING("pending"),
    APPROVED("approved"),
    DENIED("denied");

    private final String value;

    ApprovalStatus(String value) {
        this.value = value;
    }

    /**
     * Column and JSON value.
     *
     * @return "pending", "approved" or "denied"
     */
    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Parse status from its column value.
     *
     * @param value "pending", "approved", "denied" or null
     * @return matching status, {@code null} for a null or blank value
     * @throws IllegalArgumentException if value is unknown
     */
    @JsonCreator
    public static ApprovalStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (ApprovalStatus status : values()) {
            if (status.value.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Invalid approval status: " + value);
    }
}
