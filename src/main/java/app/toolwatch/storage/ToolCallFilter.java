package app.toolwatch.storage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AND-composed filter over {@code tool_calls}. Every {@code null} field is ignored.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ToolCallFilter {

    public static final int DEFAULT_LIMIT = 100;

    private String user;

    private String tool;

    private String model;

    private Boolean isError;

    private ApprovalStatus approvalStatus;

    /**
     * Substring searched in the serialized params.
     */
    private String search;

    /**
     * Inclusive lower bound on {@code ts}.
     */
    private Long from;

    /**
     * Inclusive upper bound on {@code ts}.
     */
    private Long to;

    /**
     * Exclusive upper bound on {@code ts}, used by retention.
     */
    private Long before;

    private Integer limit;

    private Integer offset;

    public boolean hasCriteria() {
        return hasText(user) || hasText(tool) || hasText(model) || isError != null || approvalStatus != null
                || hasText(search) || from != null || to != null || before != null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
