package app.toolwatch.evaluator;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * y/n confirmation on the controlling terminal. Only interactive when a console is attached.
 */
public class TerminalManualApprovalPrompt implements ManualApprovalPrompt {

    private final BufferedReader reader;
    private final PrintStream out;
    private final boolean interactive;

    public TerminalManualApprovalPrompt() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out,
                System.console() != null);
    }

    public TerminalManualApprovalPrompt(BufferedReader reader, PrintStream out, boolean interactive) {
        this.reader = reader;
        this.out = out;
        this.interactive = interactive;
    }

    @Override
    public boolean isInteractive() {
        return interactive;
    }

    @Override
    public Mono<Boolean> confirm(String title, String message) {
        return Mono.fromCallable(() -> ask(title, message))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private synchronized boolean ask(String title, String message) throws IOException {
        out.printf("[%s] %s%n", title, message);
        out.print("  Allow? (y/n): ");
        out.flush();
        String line = reader.readLine();
        if (line == null) {
            throw new IOException("Input closed");
        }
        String answer = line.trim();
        return answer.equalsIgnoreCase("y") || answer.equalsIgnoreCase("yes");
    }
}
