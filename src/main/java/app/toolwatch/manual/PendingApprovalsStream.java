package app.toolwatch.manual;

import java.util.List;

import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import app.toolwatch.manual.events.PendingApprovalsChangedEvent;
import app.toolwatch.storage.ToolCallRecord;
import app.toolwatch.storage.ToolCallRepository;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

/**
 * Fan-out der Pending-Liste an alle verbundenen Viewer (WebSocket und SSE).
 */
@Slf4j
@Component
public class PendingApprovalsStream {

    // Replay-Sink: neue Viewer bekommen sofort den letzten Stand, danach jede Änderung
    private final Sinks.Many<PendingApprovalsMessage> sink = Sinks.many().replay().limit(1);

    private final ToolCallRepository repository;

    // bumped on every emission; a snapshot read is only published if nothing was emitted meanwhile
    private long version;

    public PendingApprovalsStream(ToolCallRepository repository) {
        this.repository = repository;
    }

    /**
     * Current pending list from storage, followed by every later change.
     */
    public Flux<PendingApprovalsMessage> subscribe() {
        return Mono.fromRunnable(this::refreshFromStorage)
                .subscribeOn(Schedulers.boundedElastic())
                .thenMany(Flux.defer(sink::asFlux));
    }

    @EventListener
    public void handlePendingChanged(PendingApprovalsChangedEvent event) {
        log.debug("Broadcasting {} pending approval(s) to {} viewer(s)",
                event.getPending().size(), viewerCount());
        synchronized (this) {
            emit(event.getPending());
        }
    }

    int viewerCount() {
        return sink.currentSubscriberCount();
    }

    private void refreshFromStorage() {
        long seen;
        synchronized (this) {
            seen = version;
        }
        List<ToolCallRecord> pending;
        try {
            pending = repository.findPending();
        } catch (DataAccessException ex) {
            log.warn("Failed to read pending approvals for new viewer: {}", ex.getMessage());
            return;
        }
        synchronized (this) {
            if (seen == version) {
                emit(pending);
            } else {
                log.debug("Pending list changed while reading snapshot, keeping the newer broadcast");
            }
        }
    }

    // caller holds the monitor
    private void emit(List<ToolCallRecord> pending) {
        version++;
        Sinks.EmitResult result = sink.tryEmitNext(PendingApprovalsMessage.of(pending));
        if (result.isFailure()) {
            log.warn("Failed to emit pending approvals: {}", result);
        }
    }
}
