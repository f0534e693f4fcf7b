package app.toolwatch.collector.dto;

public record ErrorResponse(String error) {
}
