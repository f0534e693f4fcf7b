package app.toolwatch.audit;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Resends the lines of the fallback audit file to the collector, one by one and in order.
 * Lines that still fail stay in the file; an empty result deletes it.
 */
@Slf4j
public class AuditDrainService {

    private final WebClient webClient;
    private final String httpUrl;
    private final Path filePath;

    public AuditDrainService(WebClient webClient, String httpUrl, Path filePath) {
        this.webClient = webClient;
        this.httpUrl = httpUrl;
        this.filePath = filePath;
    }

    /**
     * Blocking; meant for the {@code drain} command.
     *
     * @throws UncheckedIOException if the file cannot be read or rewritten
     */
    public DrainResult drain() {
        if (filePath == null || !Files.isRegularFile(filePath)) {
            log.info("No fallback log found at {}", filePath);
            return DrainResult.empty();
        }
        if (httpUrl == null || httpUrl.isBlank()) {
            throw new IllegalStateException("No collector URL configured for drain");
        }

        List<String> lines = readLines();
        if (lines.isEmpty()) {
            log.info("No events to drain");
            // nur Leerzeilen: Datei trotzdem aufräumen
            rewrite(List.of());
            return DrainResult.empty();
        }

        log.info("Draining {} event(s) from {} to {}", lines.size(), filePath, httpUrl);
        List<String> failed = new ArrayList<>();
        Integer sent = Flux.fromIterable(lines)
                .concatMap(line -> post(line).doOnNext(ok -> {
                    if (!ok) {
                        failed.add(line);
                    }
                }))
                .filter(Boolean::booleanValue)
                .count()
                .map(Long::intValue)
                .block();
        int sentCount = sent != null ? sent : 0;

        rewrite(failed);
        if (failed.isEmpty()) {
            log.info("All {} event(s) sent, fallback log deleted", sentCount);
        } else {
            log.warn("{} sent, {} still pending in {}", sentCount, failed.size(), filePath);
        }
        return new DrainResult(sentCount, failed.size());
    }

    private Mono<Boolean> post(String line) {
        return webClient.post()
                .uri(httpUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .header(AuditSender.AUDIT_HEADER, "true")
                .bodyValue(line)
                .exchangeToMono(response -> response.releaseBody()
                        .thenReturn(response.statusCode().is2xxSuccessful()))
                .onErrorResume(ex -> {
                    log.debug("Resend failed: {}", ex.getMessage());
                    return Mono.just(false);
                });
    }

    private List<String> readLines() {
        try {
            return Files.readAllLines(filePath, StandardCharsets.UTF_8).stream()
                    .filter(line -> !line.isBlank())
                    .toList();
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read " + filePath, ex);
        }
    }

    private void rewrite(List<String> failed) {
        try {
            if (failed.isEmpty()) {
                Files.deleteIfExists(filePath);
            } else {
                Files.write(filePath, failed, StandardCharsets.UTF_8);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot rewrite " + filePath, ex);
        }
    }
}
