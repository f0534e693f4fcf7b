package app.toolwatch.manual;

import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * WebSocket unter {@code /ws}: sendet beim Verbinden die aktuelle Pending-Liste und danach
 * jede Änderung. Eingehende Nachrichten werden ignoriert.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PendingApprovalsWebSocketHandler implements WebSocketHandler {

    private final PendingApprovalsStream stream;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        log.info("Dashboard viewer {} connected", session.getId());

        Flux<WebSocketMessage> outbound = stream.subscribe()
                .concatMap(message -> toJson(message).map(session::textMessage));

        return session.send(outbound)
                .and(session.receive().then())
                .doFinally(signal -> log.info("Dashboard viewer {} disconnected ({})", session.getId(), signal));
    }

    private Mono<String> toJson(PendingApprovalsMessage message) {
        try {
            return Mono.just(objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException ex) {
            log.warn("Skipping pending approvals update that could not be serialized: {}", ex.getOriginalMessage());
            return Mono.empty();
        }
    }
}
