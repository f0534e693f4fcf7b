package app.toolwatch.manual.events;

import java.time.Instant;
import java.util.List;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import app.toolwatch.storage.ToolCallRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Published Änderungen der Pending-Liste als Spring Application Event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PendingApprovalsPublisher {

    private final ApplicationEventPublisher eventPublisher;

    public void publishPending(List<ToolCallRecord> pending) {
        PendingApprovalsChangedEvent event = PendingApprovalsChangedEvent.builder()
                .pending(List.copyOf(pending))
                .timestamp(Instant.now())
                .build();

        log.debug("Publishing pending approvals event with {} entries", pending.size());
        eventPublisher.publishEvent(event);
    }
}
