package app.toolwatch.manual;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import app.toolwatch.approval.ApprovalPlugin;
import app.toolwatch.approval.ApprovalResponse;
import app.toolwatch.event.ToolCallEvent;
import app.toolwatch.manual.events.PendingApprovalsPublisher;
import app.toolwatch.storage.ApprovalState;
import app.toolwatch.storage.ApprovalStatus;
import app.toolwatch.storage.ToolCallRecord;
import app.toolwatch.storage.ToolCallRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.scheduler.Schedulers;

/**
 * Collector-side manual approval, registered as the {@code manual} plugin.
 *
 * <p>Ein Aufruf von {@link #evaluate} wartet, bis ein Mensch den Tool Call freigibt oder
 * ablehnt. Die Entscheidung kommt entweder über {@link #approve}/{@link #deny} in dieser
 * Instanz oder wird durch Polling der Datenbank erkannt (andere Collector-Instanz auf
 * derselben Datei).
 *
 * <p>Jeder Resolver wird genau einmal abgeschlossen: nur der Aufrufer, dessen
 * {@code resolvers.remove(id)} den Sink liefert, darf ihn abschließen.
 */
@Slf4j
@Component
public class ManualApprovalCoordinator implements ApprovalPlugin {

    public static final String PLUGIN_NAME = "manual";

    static final String NOT_INITIALIZED = "Manual approval not initialized";
    static final String MANUALLY_DENIED = "Manually denied by user";
    static final String SHUTTING_DOWN = "Collector shutting down";

    private final ToolCallRepository repository;
    private final PendingApprovalsPublisher publisher;
    private final Map<String, MonoSink<ApprovalResponse>> resolvers = new ConcurrentHashMap<>();
    private volatile boolean started;

    public ManualApprovalCoordinator(ToolCallRepository repository, PendingApprovalsPublisher publisher) {
        this.repository = repository;
        this.publisher = publisher;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        started = true;
        log.info("Manual approval ready, {} call(s) pending in storage", repository.findPending().size());
    }

    public boolean isStarted() {
        return started;
    }

    /**
     * Waits for a human decision. The record must already exist with status
     * {@code pending}. Cancelling the returned Mono only drops the local resolver.
     */
    @Override
    public Mono<ApprovalResponse> evaluate(ToolCallEvent event) {
        if (!started) {
            return Mono.just(ApprovalResponse.deny(NOT_INITIALIZED));
        }
        String toolCallId = event.toolCallId();
        return Mono.<ApprovalResponse>create(sink -> {
                    sink.onCancel(() -> {
                        if (resolvers.remove(toolCallId, sink)) {
                            log.debug("Stopped waiting for approval of {}", toolCallId);
                        }
                    });
                    MonoSink<ApprovalResponse> previous = resolvers.put(toolCallId, sink);
                    if (previous != null) {
                        previous.success(ApprovalResponse.deny("Superseded by a newer request"));
                    }
                    log.info("Waiting for approval: {} ({})", event.tool(), toolCallId);
                    broadcastPending();
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * @return {@code true} if this call moved the record from pending to approved
     */
    public boolean approve(String toolCallId, String reason) {
        return decide(toolCallId, ApprovalStatus.APPROVED, reason);
    }

    /**
     * @return {@code true} if this call moved the record from pending to denied
     */
    public boolean deny(String toolCallId, String reason) {
        return decide(toolCallId, ApprovalStatus.DENIED, reason != null ? reason : MANUALLY_DENIED);
    }

    private boolean decide(String toolCallId, ApprovalStatus status, String reason) {
        if (!started) {
            return false;
        }
        boolean updated = repository.updateApprovalStatus(toolCallId, status, reason);
        ApprovalResponse requested = new ApprovalResponse(status == ApprovalStatus.APPROVED, reason);

        if (updated) {
            log.info("Tool call {} {} manually", toolCallId, status.getValue());
            complete(toolCallId, requested);
        } else if (resolvers.containsKey(toolCallId)) {
            // someone else decided first; the stored decision wins
            Optional<ApprovalState> stored = repository.findApprovalStatus(toolCallId);
            complete(toolCallId, stored.filter(ApprovalState::isResolved)
                    .map(ApprovalState::toResponse)
                    .orElse(requested));
        }

        broadcastPending();
        return updated;
    }

    /**
     * Picks up decisions written by other collector instances.
     */
    @Scheduled(fixedDelayString = "${toolwatch.collector.manual-poll-interval-ms:500}")
    public void pollForDecisions() {
        if (!started || resolvers.isEmpty()) {
            return;
        }
        int resolved = 0;
        for (String toolCallId : List.copyOf(resolvers.keySet())) {
            try {
                Optional<ApprovalState> state = repository.findApprovalStatus(toolCallId);
                if (state.isPresent() && state.get().isResolved()
                        && complete(toolCallId, state.get().toResponse())) {
                    log.info("Tool call {} {} by another instance", toolCallId, state.get().status().getValue());
                    resolved++;
                }
            } catch (DataAccessException ex) {
                log.warn("Failed to poll approval status of {}: {}", toolCallId, ex.getMessage());
            }
        }
        if (resolved > 0) {
            broadcastPending();
        }
    }

    public List<ToolCallRecord> pending() {
        return repository.findPending();
    }

    int waitingCount() {
        return resolvers.size();
    }

    @PreDestroy
    public void shutdown() {
        started = false;
        if (!resolvers.isEmpty()) {
            log.info("Releasing {} waiting approval(s) on shutdown", resolvers.size());
        }
        for (String toolCallId : List.copyOf(resolvers.keySet())) {
            complete(toolCallId, ApprovalResponse.deny(SHUTTING_DOWN));
        }
    }

    private boolean complete(String toolCallId, ApprovalResponse response) {
        MonoSink<ApprovalResponse> sink = resolvers.remove(toolCallId);
        if (sink == null) {
            return false;
        }
        sink.success(response);
        return true;
    }

    private void broadcastPending() {
        try {
            publisher.publishPending(repository.findPending());
        } catch (DataAccessException ex) {
            log.warn("Failed to broadcast pending approvals: {}", ex.getMessage());
        }
    }
}
