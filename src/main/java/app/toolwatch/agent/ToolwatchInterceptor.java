package app.toolwatch.agent;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import app.toolwatch.approval.ApprovalResponse;
import app.toolwatch.audit.AuditMode;
import app.toolwatch.audit.AuditSender;
import app.toolwatch.evaluator.LocalEvaluator;
import app.toolwatch.evaluator.RemoteEvaluationResult;
import app.toolwatch.evaluator.RemoteEvaluator;
import app.toolwatch.evaluator.RulesMode;
import app.toolwatch.event.ToolCallEvent;
import app.toolwatch.event.ToolResultEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Entry point for the host agent. Called before every tool runs and after it finished.
 *
 * <p>Ablauf je Modus:
 * <ul>
 *   <li>{@code local} - lokale Regeln auswerten, danach auditieren</li>
 *   <li>{@code remote} - Collector entscheidet und protokolliert selbst; lokal wird nur die
 *       Audit-Datei geschrieben, wenn konfiguriert oder der Collector nicht erreichbar war</li>
 *   <li>{@code none} - nur auditieren, nie blockieren</li>
 * </ul>
 */
@Slf4j
public class ToolwatchInterceptor {

    static final String DEFAULT_BLOCK_REASON = "Blocked by toolwatch policy";
    static final String REMOTE_NOT_CONFIGURED = "Remote rules not configured";
    static final String UNKNOWN_MODEL = "unknown";

    private final Set<String> tools;
    private final RulesMode rulesMode;
    private final LocalEvaluator localEvaluator;
    private final RemoteEvaluator remoteEvaluator;
    private final AuditSender auditSender;
    private final HostIdentity identity;
    private final Clock clock;
    private final Map<String, Long> callTimestamps = new ConcurrentHashMap<>();

    /**
     * @param tools           watched tools, empty for all
     * @param localEvaluator  required for {@link RulesMode#LOCAL}
     * @param remoteEvaluator {@code null} when no collector URL is configured
     */
    public ToolwatchInterceptor(List<String> tools,
                                RulesMode rulesMode,
                                LocalEvaluator localEvaluator,
                                RemoteEvaluator remoteEvaluator,
                                AuditSender auditSender,
                                HostIdentity identity,
                                Clock clock) {
        this.tools = tools != null ? Set.copyOf(tools) : Set.of();
        this.rulesMode = rulesMode != null ? rulesMode : RulesMode.NONE;
        this.localEvaluator = localEvaluator;
        this.remoteEvaluator = remoteEvaluator;
        this.auditSender = auditSender;
        this.identity = identity;
        this.clock = clock;
        if (this.rulesMode == RulesMode.LOCAL && localEvaluator == null) {
            throw new IllegalArgumentException("Local rules mode requires a LocalEvaluator");
        }
    }

    public boolean watches(String toolName) {
        return tools.isEmpty() || tools.contains(toolName);
    }

    /**
     * Decide whether the tool may run. Never errors; unwatched tools always proceed.
     */
    public Mono<ToolVerdict> onToolCall(ToolInvocation invocation) {
        if (!watches(invocation.toolName())) {
            return Mono.just(ToolVerdict.proceed());
        }

        long ts = clock.millis();
        callTimestamps.put(invocation.toolCallId(), ts);
        ToolCallEvent event = new ToolCallEvent(
                invocation.toolCallId(),
                ts,
                identity.user(),
                identity.hostname(),
                invocation.session(),
                invocation.cwd() != null ? invocation.cwd() : System.getProperty("user.dir"),
                invocation.model() != null ? invocation.model() : UNKNOWN_MODEL,
                invocation.toolName(),
                ParamFilter.filter(invocation.toolName(), invocation.input()));

        Mono<ToolVerdict> verdict = switch (rulesMode) {
            case LOCAL -> localEvaluator.evaluate(event)
                    .doOnNext(response -> auditSender.send(event))
                    .map(ToolwatchInterceptor::toVerdict);
            case REMOTE -> evaluateRemote(event);
            case NONE -> {
                auditSender.send(event);
                yield Mono.just(ToolVerdict.proceed());
            }
        };
        // blockierte Calls laufen nie, es kommt also kein Result mehr
        return verdict
                .doOnNext(decided -> {
                    if (decided.block()) {
                        callTimestamps.remove(invocation.toolCallId());
                    }
                })
                .doOnCancel(() -> callTimestamps.remove(invocation.toolCallId()));
    }

    int trackedCalls() {
        return callTimestamps.size();
    }

    /**
     * Audit the completion of an earlier call. Fire-and-forget.
     */
    public void onToolResult(ToolCompletion completion) {
        if (!watches(completion.toolName())) {
            return;
        }
        long ts = clock.millis();
        Long callTs = callTimestamps.remove(completion.toolCallId());
        ToolResultEvent result = new ToolResultEvent(
                completion.toolCallId(),
                ts,
                completion.isError(),
                callTs != null ? ts - callTs : -1,
                completion.exitCode());
        auditSender.send(result);
    }

    private Mono<ToolVerdict> evaluateRemote(ToolCallEvent event) {
        if (remoteEvaluator == null) {
            log.error("Remote rules mode requires a collector URL (toolwatch.agent.audit.http-url)");
            return Mono.just(ToolVerdict.block(REMOTE_NOT_CONFIGURED));
        }
        return remoteEvaluator.evaluate(event)
                .doOnNext(result -> {
                    if (shouldWriteFile(result)) {
                        auditSender.writeFile(event).subscribe();
                    }
                })
                .map(RemoteEvaluationResult::toResponse)
                .map(ToolwatchInterceptor::toVerdict);
    }

    private boolean shouldWriteFile(RemoteEvaluationResult result) {
        AuditMode mode = auditSender.getMode();
        return mode.writesFile() || (mode == AuditMode.HTTP_WITH_FALLBACK && result.auditFailed());
    }

    private static ToolVerdict toVerdict(ApprovalResponse response) {
        if (response.approved()) {
            return ToolVerdict.proceed();
        }
        return ToolVerdict.block(response.reason() != null ? response.reason() : DEFAULT_BLOCK_REASON);
    }
}
