package app.toolwatch.manual;

import java.time.Duration;

import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

/**
 * Server-Sent Events mit der Pending-Liste, Alternative zum WebSocket unter {@code /ws}.
 */
@RestController
@CrossOrigin
@RequiredArgsConstructor
@Slf4j
public class PendingApprovalsStreamController {

    private static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(15);

    private final PendingApprovalsStream stream;

    @GetMapping(value = "/api/pending/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<PendingApprovalsMessage>> streamPending() {
        Flux<ServerSentEvent<PendingApprovalsMessage>> updates = stream.subscribe()
                .map(message -> ServerSentEvent.<PendingApprovalsMessage>builder()
                        .id(String.valueOf(System.currentTimeMillis()))
                        .data(message)
                        .build());

        Flux<ServerSentEvent<PendingApprovalsMessage>> heartbeat = Flux.interval(HEARTBEAT_INTERVAL)
                .map(tick -> ServerSentEvent.<PendingApprovalsMessage>builder()
                        .event("heartbeat")
                        .comment("keep-alive")
                        .build());

        return Flux.merge(updates, heartbeat)
                .doOnSubscribe(subscription -> log.info("Client connected to pending approvals stream"))
                .doOnCancel(() -> log.info("Client disconnected from pending approvals stream"))
                .doOnError(error -> log.warn("Pending approvals stream error", error));
    }
}
