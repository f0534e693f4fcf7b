package app.toolwatch.rules;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Declarative policy unit as it appears in {@code rules.json}.
 *
 * <pre>{@code
 * { "comment": "No shell", "match": { "tool": "bash" }, "action": "deny", "reason": "Bash is denied" }
 * }</pre>
 *
 * @param comment human-readable note, doubles as reason for allow/deny
 * @param match   dotted field path to pattern(s); absent or empty matches every event
 * @param action  what to do on match
 * @param plugin  plugin name, required for {@link RuleAction#PLUGIN}
 * @param reason  reason returned on deny
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Rule(
        String comment,
        Map<String, MatchValue> match,
        RuleAction action,
        String plugin,
        String reason
) {

    public Rule {
        if (action == null) {
            throw new IllegalArgumentException("Rule action is required");
        }
    }

    public static Rule allowAll() {
        return new Rule(null, null, RuleAction.ALLOW, null, null);
    }

    @JsonIgnore
    public boolean matchesEverything() {
        return match == null || match.isEmpty();
    }
}
