package app.toolwatch.collector;

import java.nio.file.Path;

import org.springframework.stereotype.Service;

import app.toolwatch.approval.ApprovalPlugin;
import app.toolwatch.approval.ApprovalResponse;
import app.toolwatch.config.CollectorProperties;
import app.toolwatch.event.ToolCallEvent;
import app.toolwatch.event.ToolResultEvent;
import app.toolwatch.manual.ManualApprovalCoordinator;
import app.toolwatch.plugin.PluginRegistry;
import app.toolwatch.rules.RuleMatcher;
import app.toolwatch.rules.RulesConfig;
import app.toolwatch.rules.RulesResult;
import app.toolwatch.storage.ApprovalStatus;
import app.toolwatch.storage.DuplicateToolCallException;
import app.toolwatch.storage.ToolCallRepository;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Collector-side evaluation and recording of agent events.
 *
 * <p>Every evaluated tool call is stored before (or together with) its decision:
 * {@code pending} while a human or plugin decides, otherwise directly with the terminal
 * status and reason.
 */
@Slf4j
@Service
public class CollectorService {

    private final ToolCallRepository repository;
    private final RulesConfig rulesConfig;
    private final PluginRegistry pluginRegistry;
    private final ManualApprovalCoordinator coordinator;
    private final Path pluginBasePath;

    public CollectorService(ToolCallRepository repository,
                            RulesConfig rulesConfig,
                            PluginRegistry pluginRegistry,
                            ManualApprovalCoordinator coordinator,
                            CollectorProperties properties) {
        this.repository = repository;
        this.rulesConfig = rulesConfig;
        this.pluginRegistry = pluginRegistry;
        this.coordinator = coordinator;
        this.pluginBasePath = properties.pluginBasePath();
    }

    /**
     * Decide on a tool call and record it.
     *
     * @return the decision; errors only with {@link DuplicateToolCallException} or storage failures
     */
    public Mono<ApprovalResponse> evaluateToolCall(ToolCallEvent event) {
        RulesResult result = RuleMatcher.evaluateRules(event, rulesConfig.rules());

        if (result.requiresManual()) {
            log.info("[rules] {}: manual approval required ({})", event.tool(), event.toolCallId());
            return insert(event, ApprovalStatus.PENDING, null)
                    .then(Mono.defer(() -> coordinator.evaluate(event)))
                    // covers answers the coordinator never stored (not initialized, shutdown)
                    .flatMap(response -> storeVerdict(event, response).thenReturn(response));
        }
        if (result.requiresPlugin()) {
            return evaluateWithPlugin(result.pluginName(), event);
        }

        ApprovalResponse response = result.response();
        log.info("[rules] {}: {}{}", event.tool(), response.approved() ? "allow" : "deny",
                response.reason() != null ? " - " + response.reason() : "");
        return insert(event, response.approved() ? ApprovalStatus.APPROVED : ApprovalStatus.DENIED, response.reason())
                .thenReturn(response);
    }

    /**
     * Store a tool call that was already decided by the agent. Repeated deliveries of the
     * same id are ignored.
     */
    public Mono<Void> recordAuditOnly(ToolCallEvent event) {
        return Mono.fromRunnable(() -> {
                    try {
                        repository.insert(event, ApprovalStatus.APPROVED, null);
                    } catch (DuplicateToolCallException ex) {
                        log.debug("Audit event for {} already recorded", event.toolCallId());
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    public Mono<Boolean> recordResult(ToolResultEvent result) {
        return Mono.fromCallable(() -> repository.updateResult(result))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<ApprovalResponse> evaluateWithPlugin(String name, ToolCallEvent event) {
        return Mono.fromCallable(() -> pluginRegistry.load(name, rulesConfig.plugins().get(name), pluginBasePath))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(plugin -> plugin.isPresent()
                        ? invokePlugin(name, plugin.get(), event)
                        : pluginNotFound(name, event));
    }

    private Mono<ApprovalResponse> pluginNotFound(String name, ToolCallEvent event) {
        log.error("[rules] Plugin not found: {}, denying {}", name, event.toolCallId());
        ApprovalResponse denial = ApprovalResponse.deny("Plugin not found: " + name);
        return insert(event, ApprovalStatus.DENIED, denial.reason()).thenReturn(denial);
    }

    private Mono<ApprovalResponse> invokePlugin(String name, ApprovalPlugin plugin, ToolCallEvent event) {
        log.info("[rules] {}: invoking plugin \"{}\" ({})", event.tool(), name, event.toolCallId());
        Mono<ApprovalResponse> decision = Mono.defer(() -> plugin.evaluate(event))
                .switchIfEmpty(Mono.fromSupplier(() -> ApprovalResponse.deny("Plugin error: no decision")))
                .onErrorResume(ex -> {
                    log.error("Plugin {} failed for tool call {}", name, event.toolCallId(), ex);
                    return Mono.just(ApprovalResponse.deny("Plugin error: " + ex.getMessage()));
                });
        return insert(event, ApprovalStatus.PENDING, null)
                .then(decision)
                .flatMap(response -> storeVerdict(event, response).thenReturn(response));
    }

    // no-op when the decision was already stored, e.g. by the manual coordinator
    private Mono<Boolean> storeVerdict(ToolCallEvent event, ApprovalResponse response) {
        ApprovalStatus status = response.approved() ? ApprovalStatus.APPROVED : ApprovalStatus.DENIED;
        return Mono.fromCallable(() -> repository.updateApprovalStatus(event.toolCallId(), status, response.reason()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<Void> insert(ToolCallEvent event, ApprovalStatus status, String reason) {
        return Mono.fromRunnable(() -> repository.insert(event, status, reason))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }
}
