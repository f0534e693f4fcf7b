package app.toolwatch.audit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import app.toolwatch.event.ToolwatchEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Delivers audit events according to the configured {@link AuditMode}.
 *
 * <p>Audit darf den Agenten nie aufhalten: {@link #send} kehrt sofort zurück und
 * {@link #deliver} endet nie mit einem Fehler. Fehlschläge werden gezählt und geloggt.
 */
@Slf4j
public class AuditSender {

    /**
     * Marks a POST to {@code /events} as audit-only, so the collector records it without
     * evaluating rules.
     */
    public static final String AUDIT_HEADER = "X-Toolwatch-Audit";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final AuditMode mode;
    private final String httpUrl;
    private final Path filePath;

    private final AtomicLong httpFailures = new AtomicLong();
    private final AtomicLong fileFailures = new AtomicLong();
    private final AtomicLong fallbackWrites = new AtomicLong();

    public AuditSender(WebClient webClient, ObjectMapper objectMapper, AuditMode mode, String httpUrl, Path filePath) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.mode = mode != null ? mode : AuditMode.NONE;
        this.httpUrl = httpUrl;
        this.filePath = filePath;
    }

    /**
     * Fire-and-forget.
     */
    public void send(ToolwatchEvent event) {
        deliver(event).subscribe(null, ex -> {
            long failures = fileFailures.incrementAndGet();
            log.warn("Audit delivery of {} failed ({} failure(s) so far): {}", event.toolCallId(), failures,
                    ex.getMessage());
        });
    }

    /**
     * Deliver one event; completes once every configured destination was tried.
     */
    public Mono<Void> deliver(ToolwatchEvent event) {
        if (mode == AuditMode.NONE) {
            return Mono.empty();
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException ex) {
            log.warn("Dropping audit event {} that could not be serialized: {}", event.toolCallId(),
                    ex.getOriginalMessage());
            return Mono.empty();
        }

        return switch (mode) {
            case FILE -> appendToFile(payload).then();
            case HTTP -> post(payload).then();
            case BOTH -> Mono.when(post(payload), appendToFile(payload));
            case HTTP_WITH_FALLBACK -> sendWithFallback(payload);
            case NONE -> Mono.empty();
        };
    }

    /**
     * Write to the audit file only, regardless of mode. Used when the collector already
     * received the event through remote evaluation.
     */
    public Mono<Void> writeFile(ToolwatchEvent event) {
        try {
            return appendToFile(objectMapper.writeValueAsString(event)).then();
        } catch (JsonProcessingException ex) {
            log.warn("Dropping audit event {} that could not be serialized: {}", event.toolCallId(),
                    ex.getOriginalMessage());
            return Mono.empty();
        }
    }

    public AuditMode getMode() {
        return mode;
    }

    public long getHttpFailures() {
        return httpFailures.get();
    }

    public long getFileFailures() {
        return fileFailures.get();
    }

    public long getFallbackWrites() {
        return fallbackWrites.get();
    }

    private Mono<Void> sendWithFallback(String payload) {
        if (httpUrl == null || httpUrl.isBlank()) {
            return appendToFile(payload).then();
        }
        return post(payload)
                .flatMap(delivered -> {
                    if (delivered) {
                        return Mono.<Void>empty();
                    }
                    fallbackWrites.incrementAndGet();
                    return appendToFile(payload).then();
                });
    }

    /**
     * @return {@code true} on a 2xx answer
     */
    private Mono<Boolean> post(String payload) {
        if (httpUrl == null || httpUrl.isBlank()) {
            return Mono.just(false);
        }
        return webClient.post()
                .uri(httpUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .header(AUDIT_HEADER, "true")
                .bodyValue(payload)
                .exchangeToMono(response -> response.releaseBody()
                        .thenReturn(response.statusCode().is2xxSuccessful()))
                .doOnNext(delivered -> {
                    if (!delivered) {
                        long failures = httpFailures.incrementAndGet();
                        log.warn("Audit POST to {} rejected ({} failure(s) so far)", httpUrl, failures);
                    }
                })
                .onErrorResume(ex -> {
                    long failures = httpFailures.incrementAndGet();
                    log.warn("Audit POST to {} failed ({} failure(s) so far): {}", httpUrl, failures, ex.getMessage());
                    return Mono.just(false);
                });
    }

    /**
     * @return {@code true} if the line was written
     */
    private Mono<Boolean> appendToFile(String payload) {
        if (filePath == null) {
            return Mono.just(false);
        }
        return Mono.fromCallable(() -> {
                    append(payload);
                    return true;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(ex -> {
                    long failures = fileFailures.incrementAndGet();
                    log.warn("Audit write to {} failed ({} failure(s) so far): {}", filePath, failures, ex.getMessage());
                    return Mono.just(false);
                });
    }

    // one writer at a time so lines never interleave
    private synchronized void append(String payload) throws IOException {
        Path parent = filePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(filePath, payload + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }
}
