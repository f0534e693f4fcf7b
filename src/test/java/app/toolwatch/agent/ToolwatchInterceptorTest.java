package app.toolwatch.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import app.toolwatch.approval.ApprovalResponse;
import app.toolwatch.audit.AuditMode;
import app.toolwatch.audit.AuditSender;
import app.toolwatch.evaluator.LocalEvaluator;
import app.toolwatch.evaluator.RemoteEvaluationResult;
import app.toolwatch.evaluator.RemoteEvaluator;
import app.toolwatch.evaluator.RulesMode;
import app.toolwatch.event.ToolCallEvent;
import app.toolwatch.event.ToolResultEvent;
import app.toolwatch.event.ToolwatchEvent;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class ToolwatchInterceptorTest {

    private static final HostIdentity IDENTITY = new HostIdentity("alice", "devbox");

    private LocalEvaluator localEvaluator;
    private RemoteEvaluator remoteEvaluator;
    private AuditSender auditSender;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        localEvaluator = mock(LocalEvaluator.class);
        remoteEvaluator = mock(RemoteEvaluator.class);
        auditSender = mock(AuditSender.class);
        clock = new MutableClock(1_700_000_000_000L);
        given(auditSender.writeFile(any())).willReturn(Mono.empty());
    }

    @Test
    void localDenyBlocksAndIsAudited() {
        given(localEvaluator.evaluate(any())).willReturn(Mono.just(ApprovalResponse.deny("No rm")));
        ToolwatchInterceptor interceptor = interceptor(List.of(), RulesMode.LOCAL);

        StepVerifier.create(interceptor.onToolCall(bash("c1", "rm -rf /")))
                .expectNext(ToolVerdict.block("No rm"))
                .verifyComplete();

        ArgumentCaptor<ToolwatchEvent> captor = ArgumentCaptor.forClass(ToolwatchEvent.class);
        verify(auditSender).send(captor.capture());
        ToolCallEvent event = (ToolCallEvent) captor.getValue();
        assertThat(event.user()).isEqualTo("alice");
        assertThat(event.hostname()).isEqualTo("devbox");
        assertThat(event.ts()).isEqualTo(1_700_000_000_000L);
        assertThat(event.model()).isEqualTo("unknown");
        assertThat(event.params().has("description")).isFalse();
    }

    @Test
    void denyWithoutReasonUsesDefault() {
        given(localEvaluator.evaluate(any())).willReturn(Mono.just(new ApprovalResponse(false, null)));
        ToolwatchInterceptor interceptor = interceptor(List.of(), RulesMode.LOCAL);

        StepVerifier.create(interceptor.onToolCall(bash("c1", "ls")))
                .expectNext(ToolVerdict.block("Blocked by toolwatch policy"))
                .verifyComplete();
    }

    @Test
    void unwatchedToolsProceedSilently() {
        ToolwatchInterceptor interceptor = interceptor(List.of("write"), RulesMode.LOCAL);

        StepVerifier.create(interceptor.onToolCall(bash("c1", "ls")))
                .expectNext(ToolVerdict.proceed())
                .verifyComplete();
        interceptor.onToolResult(new ToolCompletion("c1", "bash", false, 0));

        verifyNoInteractions(localEvaluator, auditSender);
    }

    @Test
    void noneModeOnlyAudits() {
        ToolwatchInterceptor interceptor = interceptor(List.of(), RulesMode.NONE);

        StepVerifier.create(interceptor.onToolCall(bash("c1", "rm -rf /")))
                .expectNext(ToolVerdict.proceed())
                .verifyComplete();

        verify(auditSender).send(any(ToolCallEvent.class));
        verifyNoInteractions(localEvaluator, remoteEvaluator);
    }

    @Test
    void remoteModeWritesFileOnlyWhenCollectorWasUnreachable() {
        given(auditSender.getMode()).willReturn(AuditMode.HTTP_WITH_FALLBACK);
        given(remoteEvaluator.evaluate(any()))
                .willReturn(Mono.just(new RemoteEvaluationResult(true, null, false)))
                .willReturn(Mono.just(new RemoteEvaluationResult(false, "Approval timeout", true)));
        ToolwatchInterceptor interceptor = interceptor(List.of(), RulesMode.REMOTE);

        StepVerifier.create(interceptor.onToolCall(bash("c1", "ls")))
                .expectNext(ToolVerdict.proceed())
                .verifyComplete();
        verify(auditSender, never()).writeFile(any());

        StepVerifier.create(interceptor.onToolCall(bash("c2", "ls")))
                .expectNext(ToolVerdict.block("Approval timeout"))
                .verifyComplete();
        verify(auditSender).writeFile(any(ToolCallEvent.class));
        verify(auditSender, never()).send(any());
    }

    @Test
    void remoteModeWithoutCollectorBlocks() {
        ToolwatchInterceptor interceptor = new ToolwatchInterceptor(List.of(), RulesMode.REMOTE, null, null,
                auditSender, IDENTITY, clock);

        StepVerifier.create(interceptor.onToolCall(bash("c1", "ls")))
                .expectNext(ToolVerdict.block("Remote rules not configured"))
                .verifyComplete();
    }

    @Test
    void resultCarriesDurationSinceCall() {
        ToolwatchInterceptor interceptor = interceptor(List.of(), RulesMode.NONE);

        interceptor.onToolCall(bash("c1", "sleep 1")).block();
        clock.advance(1_250L);
        interceptor.onToolResult(new ToolCompletion("c1", "bash", true, 2));
        interceptor.onToolResult(new ToolCompletion("never-seen", "bash", false, 0));

        ArgumentCaptor<ToolwatchEvent> captor = ArgumentCaptor.forClass(ToolwatchEvent.class);
        verify(auditSender, times(3)).send(captor.capture());
        assertThat(captor.getAllValues().get(1))
                .isEqualTo(new ToolResultEvent("c1", 1_700_000_001_250L, true, 1_250L, 2));
        assertThat(((ToolResultEvent) captor.getAllValues().get(2)).durationMs()).isEqualTo(-1L);
    }

    @Test
    void blockedCallsAreNotTrackedForDuration() {
        given(localEvaluator.evaluate(any()))
                .willReturn(Mono.just(ApprovalResponse.deny("No rm")))
                .willReturn(Mono.just(ApprovalResponse.approve()));
        ToolwatchInterceptor interceptor = interceptor(List.of(), RulesMode.LOCAL);

        interceptor.onToolCall(bash("c1", "rm -rf /")).block();
        assertThat(interceptor.trackedCalls()).isZero();

        interceptor.onToolCall(bash("c2", "ls")).block();
        assertThat(interceptor.trackedCalls()).isEqualTo(1);
        interceptor.onToolResult(new ToolCompletion("c2", "bash", false, 0));
        assertThat(interceptor.trackedCalls()).isZero();
    }

    @Test
    void localModeNeedsEvaluator() {
        assertThatThrownBy(() -> new ToolwatchInterceptor(List.of(), RulesMode.LOCAL, null, null,
                auditSender, IDENTITY, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private ToolwatchInterceptor interceptor(List<String> tools, RulesMode mode) {
        return new ToolwatchInterceptor(tools, mode, localEvaluator, remoteEvaluator, auditSender, IDENTITY, clock);
    }

    private static ToolInvocation bash(String toolCallId, String command) {
        return new ToolInvocation(toolCallId, "bash",
                JsonNodeFactory.instance.objectNode().put("command", command).put("description", "run it"),
                "session-1", "/work", null);
    }

    private static final class MutableClock extends Clock {

        private long millis;

        MutableClock(long millis) {
            this.millis = millis;
        }

        void advance(long delta) {
            millis += delta;
        }

        @Override
        public long millis() {
            return millis;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
