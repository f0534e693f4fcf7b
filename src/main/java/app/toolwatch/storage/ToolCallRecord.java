package app.toolwatch.storage;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row of the {@code tool_calls} table: the original call plus result and approval fields.
 * Result fields stay {@code null} until the matching {@code tool_result} arrives, which may
 * be never for a denied call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCallRecord {

    private Long id;

    private String toolCallId;

    private long ts;

    private String user;

    private String hostname;

    private String session;

    private String cwd;

    private String model;

    private String tool;

    private JsonNode params;

    private Boolean isError;

    private Long durationMs;

    private Integer exitCode;

    private Long resultTs;

    private ApprovalStatus approvalStatus;

    private String approvalReason;
}
