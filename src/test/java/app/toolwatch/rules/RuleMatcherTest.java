package app.toolwatch.rules;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import app.toolwatch.event.ToolCallEvent;
import app.toolwatch.support.TestEvents;

class RuleMatcherTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void firstMatchingRuleWinsRegardlessOfSpecificity() {
        Rule catchAll = new Rule("everything", null, RuleAction.ALLOW, null, null);
        Rule denyBash = new Rule(null, Map.of("tool", MatchValue.of("bash")), RuleAction.DENY, null, "no shell");

        Rule matched = RuleMatcher.findMatchingRule(TestEvents.bash("c1", "ls"), List.of(catchAll, denyBash));

        assertThat(matched).isSameAs(catchAll);
    }

    @Test
    void allFieldsOfARuleMustMatch() {
        Rule rule = new Rule(null, Map.of(
                "tool", MatchValue.of("bash"),
                "params.command", MatchValue.of("/^rm /")), RuleAction.DENY, null, null);

        assertThat(RuleMatcher.findMatchingRule(TestEvents.bash("c1", "rm -rf /tmp/x"), List.of(rule))).isSameAs(rule);
        assertThat(RuleMatcher.findMatchingRule(TestEvents.bash("c2", "ls"), List.of(rule))).isNull();
    }

    @Test
    void arrayValueMatchesAnyPattern() {
        Rule rule = new Rule(null, Map.of("tool", MatchValue.anyOf("write", "edit")), RuleAction.MANUAL, null, null);
        ObjectNode params = JsonNodeFactory.instance.objectNode().put("path", "a.txt");

        assertThat(RuleMatcher.findMatchingRule(TestEvents.toolCall("c1", "edit", params), List.of(rule))).isSameAs(rule);
        assertThat(RuleMatcher.findMatchingRule(TestEvents.toolCall("c2", "read", params), List.of(rule))).isNull();
    }

    @Test
    void regexUsesFindSemantics() {
        JsonNode text = JsonNodeFactory.instance.textNode("git push --force origin");

        assertThat(RuleMatcher.matchesPattern(text, "/--force/")).isTrue();
        assertThat(RuleMatcher.matchesPattern(text, "/^push/")).isFalse();
        assertThat(RuleMatcher.matchesPattern(text, "--force")).isFalse();
    }

    @Test
    void singleSlashIsAnEmptyRegexMatchingEverything() {
        assertThat(RuleMatcher.matchesPattern(JsonNodeFactory.instance.textNode("ls -la"), "/")).isTrue();
        assertThat(RuleMatcher.matchesPattern(JsonNodeFactory.instance.textNode(""), "/")).isTrue();
        assertThat(RuleMatcher.matchesPattern(JsonNodeFactory.instance.textNode("x"), "//")).isTrue();
    }

    @Test
    void invalidRegexFallsBackToLiteralComparison() {
        assertThat(RuleMatcher.matchesPattern(JsonNodeFactory.instance.textNode("/[unclosed/"), "/[unclosed/")).isTrue();
        assertThat(RuleMatcher.matchesPattern(JsonNodeFactory.instance.textNode("[unclosed"), "/[unclosed/")).isFalse();
    }

    @Test
    void nonStringValuesAreComparedByTheirTextForm() {
        ObjectNode params = JsonNodeFactory.instance.objectNode();
        params.put("timeout", 30);
        params.put("force", true);
        params.putObject("nested").put("a", 1);

        assertThat(RuleMatcher.matchesPattern(params.get("timeout"), "30")).isTrue();
        assertThat(RuleMatcher.matchesPattern(params.get("force"), "true")).isTrue();
        assertThat(RuleMatcher.matchesPattern(params.get("nested"), "{\"a\":1}")).isTrue();
        assertThat(RuleMatcher.matchesPattern(JsonNodeFactory.instance.nullNode(), "null")).isFalse();
    }

    @Test
    void missingPathNeverMatches() throws Exception {
        JsonNode event = objectMapper.readTree("{\"tool\":\"bash\",\"params\":{\"command\":\"ls\"}}");

        assertThat(RuleMatcher.valueAtPath(event, "params.command").asText()).isEqualTo("ls");
        assertThat(RuleMatcher.valueAtPath(event, "params.missing")).isNull();
        assertThat(RuleMatcher.valueAtPath(event, "tool.name")).isNull();
        Rule rule = new Rule(null, Map.of("params.cwd", MatchValue.of("/.*/")), RuleAction.DENY, null, null);
        assertThat(RuleMatcher.findMatchingRule(event, List.of(rule))).isNull();
    }

    @Test
    void noMatchingRuleApproves() {
        RulesResult result = RuleMatcher.evaluateRules(TestEvents.bash("c1", "ls"), List.of());

        assertThat(result.response().approved()).isTrue();
        assertThat(result.response().reason()).isNull();
        assertThat(result.matchedRule()).isNull();
    }

    @Test
    void allowReturnsCommentAsReason() {
        Rule rule = new Rule("reads are fine", null, RuleAction.ALLOW, null, null);

        RulesResult result = RuleMatcher.evaluateRules(TestEvents.bash("c1", "ls"), List.of(rule));

        assertThat(result.response().approved()).isTrue();
        assertThat(result.response().reason()).isEqualTo("reads are fine");
    }

    @Test
    void denyReasonPrefersReasonThenCommentThenDefault() {
        ToolCallEvent event = TestEvents.bash("c1", "ls");

        assertThat(RuleMatcher.evaluateRules(event,
                List.of(new Rule("comment", null, RuleAction.DENY, null, "reason"))).response().reason())
                .isEqualTo("reason");
        assertThat(RuleMatcher.evaluateRules(event,
                List.of(new Rule("comment", null, RuleAction.DENY, null, null))).response().reason())
                .isEqualTo("comment");
        assertThat(RuleMatcher.evaluateRules(event,
                List.of(new Rule(null, null, RuleAction.DENY, null, null))).response().reason())
                .isEqualTo("Denied by policy");
    }

    @Test
    void manualAndPluginRulesAreDeferred() {
        ToolCallEvent event = TestEvents.bash("c1", "ls");

        RulesResult manual = RuleMatcher.evaluateRules(event, List.of(new Rule(null, null, RuleAction.MANUAL, null, null)));
        assertThat(manual.requiresManual()).isTrue();
        assertThat(manual.response().approved()).isFalse();

        RulesResult plugin = RuleMatcher.evaluateRules(event, List.of(new Rule(null, null, RuleAction.PLUGIN, "checker", null)));
        assertThat(plugin.requiresPlugin()).isTrue();
        assertThat(plugin.pluginName()).isEqualTo("checker");

        RulesResult unnamed = RuleMatcher.evaluateRules(event, List.of(new Rule(null, null, RuleAction.PLUGIN, null, null)));
        assertThat(unnamed.requiresPlugin()).isFalse();
        assertThat(unnamed.response().approved()).isFalse();
        assertThat(unnamed.response().reason()).isEqualTo("Plugin not specified");
    }
}
