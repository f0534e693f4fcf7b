package app.toolwatch.evaluator;

import java.nio.file.Path;
import java.util.Optional;

import app.toolwatch.approval.ApprovalPlugin;
import app.toolwatch.approval.ApprovalResponse;
import app.toolwatch.event.ToolCallEvent;
import app.toolwatch.plugin.PluginRegistry;
import app.toolwatch.rules.RuleMatcher;
import app.toolwatch.rules.RulesConfig;
import app.toolwatch.rules.RulesResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Evaluates tool calls in-process against the agent's own rules file.
 *
 * <p>Der zurückgegebene Mono endet nie mit einem Fehler: jede Störung wird zu einer
 * Ablehnung mit Begründung.
 */
@Slf4j
public class LocalEvaluator {

    static final String MANUAL_TITLE = "Manual Approval Required";
    static final String REQUIRES_UI = "Manual approval requires interactive UI";
    static final String MANUALLY_DENIED = "Manually denied by user";

    private final RulesConfig rulesConfig;
    private final PluginRegistry pluginRegistry;
    private final ManualApprovalPrompt prompt;
    private final Path pluginBasePath;

    public LocalEvaluator(RulesConfig rulesConfig, PluginRegistry pluginRegistry,
                          ManualApprovalPrompt prompt, Path pluginBasePath) {
        this.rulesConfig = rulesConfig;
        this.pluginRegistry = pluginRegistry;
        this.prompt = prompt != null ? prompt : ManualApprovalPrompt.NON_INTERACTIVE;
        this.pluginBasePath = pluginBasePath;
    }

    public Mono<ApprovalResponse> evaluate(ToolCallEvent event) {
        RulesResult result = RuleMatcher.evaluateRules(event, rulesConfig.rules());

        if (result.requiresManual()) {
            return manualApproval(event);
        }
        if (result.requiresPlugin()) {
            return invokePlugin(result.pluginName(), event);
        }
        return Mono.just(result.response());
    }

    private Mono<ApprovalResponse> manualApproval(ToolCallEvent event) {
        if (!prompt.isInteractive()) {
            return Mono.just(ApprovalResponse.deny(REQUIRES_UI));
        }
        return Mono.defer(() -> prompt.confirm(MANUAL_TITLE, ManualApprovalPrompt.describe(event)))
                .map(approved -> approved ? ApprovalResponse.approve() : ApprovalResponse.deny(MANUALLY_DENIED))
                .defaultIfEmpty(ApprovalResponse.deny(MANUALLY_DENIED))
                .onErrorResume(ex -> Mono.just(ApprovalResponse.deny("Approval dialog error: " + ex.getMessage())));
    }

    private Mono<ApprovalResponse> invokePlugin(String name, ToolCallEvent event) {
        Optional<ApprovalPlugin> plugin = pluginRegistry.load(name, rulesConfig.plugins().get(name), pluginBasePath);
        if (plugin.isEmpty()) {
            return Mono.just(ApprovalResponse.deny("Plugin not found: " + name));
        }
        return Mono.defer(() -> plugin.get().evaluate(event))
                .switchIfEmpty(Mono.fromSupplier(() -> ApprovalResponse.deny("Plugin error: no decision")))
                .onErrorResume(ex -> {
                    log.error("Plugin {} failed for tool call {}", name, event.toolCallId(), ex);
                    return Mono.just(ApprovalResponse.deny("Plugin error: " + ex.getMessage()));
                });
    }
}
