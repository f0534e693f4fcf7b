package app.toolwatch.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What happens when a rule matches.
 */
public enum RuleAction {
    /**
     * Tool läuft sofort, Kommentar der Regel wird als Grund zurückgegeben.
     */
    ALLOW("allow"),

    /**
     * Tool wird blockiert.
     */
    DENY("deny"),

    /**
     * Ein Mensch muss bestätigen (lokal per Terminal, remote über den Collector).
     */
    MANUAL("manual"),

    /**
     * Entscheidung wird an ein benanntes {@code ApprovalPlugin} delegiert.
     */
    PLUGIN("plugin");

    private final String value;

    RuleAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse action from its JSON value.
     *
     * @param value "allow", "deny", "manual" or "plugin"
     * @return matching RuleAction
     * @throws IllegalArgumentException if value is unknown
     */
    @JsonCreator
    public static RuleAction fromValue(String value) {
        if (value != null) {
            for (RuleAction action : values()) {
                if (action.value.equalsIgnoreCase(value.trim())) {
                    return action;
                }
            }
        }
        throw new IllegalArgumentException("Invalid rule action: " + value);
    }
}
