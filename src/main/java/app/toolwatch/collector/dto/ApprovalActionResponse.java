package app.toolwatch.collector.dto;

/**
 * Antwort auf {@code POST /approve/{id}} und {@code POST /deny/{id}}.
 */
public record ApprovalActionResponse(boolean success) {
}
