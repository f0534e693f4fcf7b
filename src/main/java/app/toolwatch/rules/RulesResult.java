package app.toolwatch.rules;

import app.toolwatch.approval.ApprovalResponse;

/**
 * Outcome of running the rules against one event.
 *
 * <p>For {@code manual} and named {@code plugin} rules {@link #response()} is only a
 * placeholder denial; the caller has to replace it with the real decision.
 */
public record RulesResult(
        ApprovalResponse response,
        String pluginName,
        boolean requiresManual,
        Rule matchedRule
) {

    static RulesResult immediate(ApprovalResponse response, Rule matchedRule) {
        return new RulesResult(response, null, false, matchedRule);
    }

    static RulesResult manual(Rule matchedRule) {
        return new RulesResult(new ApprovalResponse(false, null), null, true, matchedRule);
    }

    static RulesResult plugin(String pluginName, Rule matchedRule) {
        return new RulesResult(new ApprovalResponse(false, null), pluginName, false, matchedRule);
    }

    public boolean requiresPlugin() {
        return pluginName != null;
    }
}
