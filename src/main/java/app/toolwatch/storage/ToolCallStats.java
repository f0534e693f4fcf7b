package app.toolwatch.storage;

/**
 * Aggregate counts for the dashboard header.
 */
public record ToolCallStats(long total, long users, long tools, long errors) {
}
