package app.toolwatch.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import app.toolwatch.event.ToolResultEvent;
import app.toolwatch.support.TestEvents;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class AuditSenderTest {

    private static final String URL = "http://collector.test/events";

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    @Test
    void fileModeAppendsOneJsonLinePerEvent() throws IOException {
        Path file = tempDir.resolve("logs/audit.jsonl");
        AuditSender sender = sender(status(HttpStatus.OK), AuditMode.FILE, file);

        StepVerifier.create(sender.deliver(TestEvents.bash("c1", "ls"))).verifyComplete();
        StepVerifier.create(sender.deliver(new ToolResultEvent("c1", 2L, false, 10, 0))).verifyComplete();

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        JsonNode call = objectMapper.readTree(lines.get(0));
        assertThat(call.get("type").asText()).isEqualTo("tool_call");
        assertThat(call.get("params").get("command").asText()).isEqualTo("ls");
        assertThat(objectMapper.readTree(lines.get(1)).get("type").asText()).isEqualTo("tool_result");
        assertThat(requests).isEmpty();
    }

    @Test
    void httpModeMarksRequestsAsAuditOnly() {
        AuditSender sender = sender(status(HttpStatus.OK), AuditMode.HTTP, tempDir.resolve("audit.jsonl"));

        StepVerifier.create(sender.deliver(TestEvents.bash("c1", "ls"))).verifyComplete();

        assertThat(requests).singleElement()
                .satisfies(request -> assertThat(request.headers().getFirst(AuditSender.AUDIT_HEADER)).isEqualTo("true"));
        assertThat(Files.exists(tempDir.resolve("audit.jsonl"))).isFalse();
        assertThat(sender.getHttpFailures()).isZero();
    }

    @Test
    void httpFailureIsCountedButNeverSurfaces() {
        ExchangeFunction failing = request -> Mono.error(new IllegalStateException("Connection refused"));
        AuditSender sender = sender(failing, AuditMode.HTTP, null);

        StepVerifier.create(sender.deliver(TestEvents.bash("c1", "ls"))).verifyComplete();

        assertThat(sender.getHttpFailures()).isEqualTo(1);
    }

    @Test
    void fallbackWritesFileOnlyWhenHttpFails() throws IOException {
        Path file = tempDir.resolve("audit.jsonl");

        AuditSender healthy = sender(status(HttpStatus.OK), AuditMode.HTTP_WITH_FALLBACK, file);
        StepVerifier.create(healthy.deliver(TestEvents.bash("c1", "ls"))).verifyComplete();
        assertThat(Files.exists(file)).isFalse();

        AuditSender broken = sender(status(HttpStatus.SERVICE_UNAVAILABLE), AuditMode.HTTP_WITH_FALLBACK, file);
        StepVerifier.create(broken.deliver(TestEvents.bash("c2", "pwd"))).verifyComplete();

        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8)).singleElement()
                .satisfies(line -> assertThat(line).contains("\"c2\""));
        assertThat(broken.getFallbackWrites()).isEqualTo(1);
        assertThat(broken.getHttpFailures()).isEqualTo(1);
    }

    @Test
    void bothModeWritesFileAndPosts() throws IOException {
        Path file = tempDir.resolve("audit.jsonl");
        AuditSender sender = sender(status(HttpStatus.OK), AuditMode.BOTH, file);

        StepVerifier.create(sender.deliver(TestEvents.bash("c1", "ls"))).verifyComplete();

        assertThat(requests).hasSize(1);
        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8)).hasSize(1);
    }

    @Test
    void noneModeDoesNothing() {
        AuditSender sender = sender(status(HttpStatus.OK), AuditMode.NONE, tempDir.resolve("audit.jsonl"));

        StepVerifier.create(sender.deliver(TestEvents.bash("c1", "ls"))).verifyComplete();

        assertThat(requests).isEmpty();
        assertThat(Files.exists(tempDir.resolve("audit.jsonl"))).isFalse();
    }

    @Test
    void unwritableFileIsCounted() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");
        AuditSender sender = sender(status(HttpStatus.OK), AuditMode.FILE, blocker.resolve("audit.jsonl"));

        StepVerifier.create(sender.deliver(TestEvents.bash("c1", "ls"))).verifyComplete();

        assertThat(sender.getFileFailures()).isEqualTo(1);
    }

    @Test
    void unexpectedFileErrorIsCountedLikeAnIoFailure() {
        Path file = mock(Path.class);
        given(file.toAbsolutePath()).willThrow(new SecurityException("write access denied"));
        AuditSender sender = sender(status(HttpStatus.OK), AuditMode.FILE, file);

        StepVerifier.create(sender.deliver(TestEvents.bash("c1", "ls"))).verifyComplete();

        assertThat(sender.getFileFailures()).isEqualTo(1);
    }

    @Test
    void fireAndForgetNeverLeavesAFailureUnaccounted() {
        Path file = mock(Path.class);
        given(file.toAbsolutePath()).willThrow(new SecurityException("write access denied"));
        AuditSender sender = sender(status(HttpStatus.OK), AuditMode.FILE, file);

        sender.send(TestEvents.bash("c1", "ls"));

        await().atMost(Duration.ofSeconds(5)).until(() -> sender.getFileFailures() == 1);
    }

    private AuditSender sender(ExchangeFunction exchange, AuditMode mode, Path file) {
        WebClient client = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return exchange.exchange(request);
                })
                .build();
        return new AuditSender(client, objectMapper, mode, URL, file);
    }

    private static ExchangeFunction status(HttpStatus status) {
        return request -> Mono.just(ClientResponse.create(status).build());
    }
}
