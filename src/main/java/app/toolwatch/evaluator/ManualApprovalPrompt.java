package app.toolwatch.evaluator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import app.toolwatch.event.ToolCallEvent;
import reactor.core.publisher.Mono;

/**
 * Asks a human in front of the agent whether a tool call may run.
 */
public interface ManualApprovalPrompt {

    int MAX_VALUE_LENGTH = 100;

    /**
     * Prompt for headless runs; every manual rule ends in a denial.
     */
    ManualApprovalPrompt NON_INTERACTIVE = new ManualApprovalPrompt() {
        @Override
        public boolean isInteractive() {
            return false;
        }

        @Override
        public Mono<Boolean> confirm(String title, String message) {
            return Mono.just(false);
        }
    };

    boolean isInteractive();

    /**
     * @return {@code true} if the user allowed the call
     */
    Mono<Boolean> confirm(String title, String message);

    /**
     * One-line summary such as {@code bash: command=ls -la, timeout=30}. Long values are
     * cut at {@value #MAX_VALUE_LENGTH} characters.
     */
    static String describe(ToolCallEvent event) {
        JsonNode params = event.params();
        if (params == null || params.isEmpty()) {
            return event.tool() + ": (no params)";
        }
        List<String> parts = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = params.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            String text = value.isTextual() ? value.asText() : value.toString();
            if (text.length() > MAX_VALUE_LENGTH) {
                text = text.substring(0, MAX_VALUE_LENGTH) + "...";
            }
            parts.add(field.getKey() + "=" + text);
        }
        return event.tool() + ": " + String.join(", ", parts);
    }
}
