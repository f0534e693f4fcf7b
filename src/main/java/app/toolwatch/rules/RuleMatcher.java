package app.toolwatch.rules;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import app.toolwatch.approval.ApprovalResponse;
import app.toolwatch.event.ToolCallEvent;

/**
 * Stateless first-match rule engine.
 *
 * <p>Rules are checked in list order and the first one whose {@code match} is empty or
 * fully satisfied wins; there is no specificity ranking. Within a rule every field must
 * match (AND), within a field any listed pattern may match (OR).
 *
 * <p>Fields are addressed by dotted paths into the event's JSON form, e.g. {@code tool},
 * {@code user} or {@code params.command}.
 */
public final class RuleMatcher {

    static final String DENIED_BY_POLICY = "Denied by policy";
    static final String PLUGIN_NOT_SPECIFIED = "Plugin not specified";

    private static final ObjectMapper TREE_MAPPER = new ObjectMapper();

    private RuleMatcher() {
    }

    public static Rule findMatchingRule(ToolCallEvent event, List<Rule> rules) {
        return findMatchingRule(TREE_MAPPER.valueToTree(event), rules);
    }

    public static Rule findMatchingRule(JsonNode event, List<Rule> rules) {
        if (rules == null) {
            return null;
        }
        for (Rule rule : rules) {
            if (rule.matchesEverything() || matchesCondition(event, rule.match())) {
                return rule;
            }
        }
        return null;
    }

    public static RulesResult evaluateRules(ToolCallEvent event, List<Rule> rules) {
        Rule rule = findMatchingRule(event, rules);
        if (rule == null) {
            return RulesResult.immediate(ApprovalResponse.approve(), null);
        }

        return switch (rule.action()) {
            case ALLOW -> RulesResult.immediate(ApprovalResponse.approve(rule.comment()), rule);
            case DENY -> RulesResult.immediate(ApprovalResponse.deny(denyReason(rule)), rule);
            case MANUAL -> RulesResult.manual(rule);
            case PLUGIN -> rule.plugin() == null || rule.plugin().isBlank()
                    ? RulesResult.immediate(ApprovalResponse.deny(PLUGIN_NOT_SPECIFIED), rule)
                    : RulesResult.plugin(rule.plugin(), rule);
        };
    }

    private static String denyReason(Rule rule) {
        if (rule.reason() != null) {
            return rule.reason();
        }
        return rule.comment() != null ? rule.comment() : DENIED_BY_POLICY;
    }

    private static boolean matchesCondition(JsonNode event, Map<String, MatchValue> condition) {
        for (Map.Entry<String, MatchValue> entry : condition.entrySet()) {
            JsonNode value = valueAtPath(event, entry.getKey());
            if (!matchesValue(value, entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    static JsonNode valueAtPath(JsonNode root, String path) {
        JsonNode current = root;
        for (String part : path.split("\\.", -1)) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(part);
        }
        return current;
    }

    private static boolean matchesValue(JsonNode value, MatchValue matchValue) {
        for (String pattern : matchValue.patterns()) {
            if (matchesPattern(value, pattern)) {
                return true;
            }
        }
        return false;
    }

    static boolean matchesPattern(JsonNode value, String pattern) {
        if (value == null || value.isNull() || value.isMissingNode() || pattern == null) {
            return false;
        }
        String text = asString(value);

        if (pattern.startsWith("/") && pattern.endsWith("/")) {
            // a lone "/" is an empty regex and matches anything
            String body = pattern.length() > 1 ? pattern.substring(1, pattern.length() - 1) : "";
            try {
                return Pattern.compile(body).matcher(text).find();
            } catch (PatternSyntaxException ex) {
                // broken regex only ever matches its own literal text
                return text.equals(pattern);
            }
        }
        return text.equals(pattern);
    }

    private static String asString(JsonNode value) {
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
