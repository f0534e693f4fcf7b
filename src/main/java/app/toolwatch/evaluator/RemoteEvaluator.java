package app.toolwatch.evaluator;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import app.toolwatch.approval.ApprovalResponse;
import app.toolwatch.event.ToolCallEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Sends the tool call to the collector's {@code /events} endpoint and returns its decision.
 * The collector records the call as part of evaluating it, so a successful answer also
 * means the audit record exists.
 */
@Slf4j
public class RemoteEvaluator {

    static final String TIMEOUT_REASON = "Approval timeout";

    private final WebClient webClient;
    private final String url;
    private final Duration timeout;
    private final ErrorAction errorAction;

    /**
     * @param timeout {@code null} or zero waits for the collector indefinitely
     */
    public RemoteEvaluator(WebClient webClient, String url, Duration timeout, ErrorAction errorAction) {
        this.webClient = webClient;
        this.url = url;
        this.timeout = timeout;
        this.errorAction = errorAction != null ? errorAction : ErrorAction.BLOCK;
    }

    public Mono<RemoteEvaluationResult> evaluate(ToolCallEvent event) {
        Mono<ApprovalResponse> request = webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(event)
                .exchangeToMono(response -> {
                    if (!response.statusCode().is2xxSuccessful()) {
                        return response.releaseBody()
                                .then(Mono.<ApprovalResponse>error(
                                        new RemoteApprovalException("HTTP " + response.statusCode().value())));
                    }
                    return response.bodyToMono(ApprovalResponse.class);
                })
                .switchIfEmpty(Mono.error(new RemoteApprovalException("Empty response")));

        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            request = request.timeout(timeout);
        }

        return request
                .map(RemoteEvaluationResult::of)
                .onErrorResume(this::onFailure);
    }

    private Mono<RemoteEvaluationResult> onFailure(Throwable ex) {
        String reason = ex instanceof TimeoutException ? TIMEOUT_REASON : "Approval error: " + ex.getMessage();
        log.warn("Remote evaluation via {} failed ({}), applying error action {}", url, reason, errorAction);
        return Mono.just(new RemoteEvaluationResult(errorAction == ErrorAction.ALLOW, reason, true));
    }
}
