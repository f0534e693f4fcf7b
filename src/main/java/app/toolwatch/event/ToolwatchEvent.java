package app.toolwatch.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Gemeinsamer Typ für alle Events, die der Host-Agent an toolwatch meldet.
 *
 * <p>Auf dem Wire wird der konkrete Typ über das Feld {@code type} unterschieden:
 * <ul>
 *   <li>{@code tool_call} - ein Tool soll ausgeführt werden (wird ggf. gegated)</li>
 *   <li>{@code tool_result} - ein Tool ist fertig (wird nur auditiert)</li>
 * </ul>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ToolCallEvent.class, name = ToolwatchEvent.TOOL_CALL),
        @JsonSubTypes.Type(value = ToolResultEvent.class, name = ToolwatchEvent.TOOL_RESULT)
})
public interface ToolwatchEvent {

    String TOOL_CALL = "tool_call";
    String TOOL_RESULT = "tool_result";

    String toolCallId();

    /**
     * Epoch millis at which the host observed the event.
     */
    long ts();
}
