package app.toolwatch.approval;

import app.toolwatch.event.ToolCallEvent;
import reactor.core.publisher.Mono;

/**
 * Strategy for rules with {@code "action": "plugin"}.
 *
 * <p>Implementations may complete immediately or suspend for as long as they need
 * (the manual approval coordinator waits for a human). toolwatch imposes no timeout on
 * plugins itself. Errors signalled by the returned {@link Mono} or thrown directly are
 * turned into denials by the caller.
 *
 * <p>Plugins loaded from a jar are discovered through
 * {@code META-INF/services/app.toolwatch.approval.ApprovalPlugin} and need a public
 * no-arg constructor.
 */
@FunctionalInterface
public interface ApprovalPlugin {

    Mono<ApprovalResponse> evaluate(ToolCallEvent event);
}
