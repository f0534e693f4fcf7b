package app.toolwatch.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import app.toolwatch.audit.AuditDrainService;
import app.toolwatch.audit.DrainResult;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs {@code drain}, {@code db export} and {@code db delete} when the jar is started with
 * one of them; does nothing for a normal collector start.
 */
@Slf4j
@Component
public class OperatorCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String USAGE = """
            Usage:
              toolwatch drain
              toolwatch db export [options]
              toolwatch db delete [options] [--dry-run]

            Options:
              --user=<name>        Filter by user
              --tool=<name>        Filter by tool
              --model=<name>       Filter by model
              --approval=<status>  Filter by approval status (pending|approved|denied)
              --error              Errors only
              --success            Successes only
              --before=<date>      Before date (ISO date, ISO instant or epoch millis)
              --after=<date>       At or after date
              --search=<text>      Search in params
              --limit=<n>          Limit results (export only)
              --output=<file>      Output file (export only, default: stdout)
              --dry-run            Show what would be deleted without deleting""";

    private final AuditDrainService drainService;
    private final DbToolService dbToolService;
    private final PrintStream out;
    private final PrintStream err;
    private int exitCode;

    public OperatorCommandRunner(AuditDrainService drainService, DbToolService dbToolService) {
        this(drainService, dbToolService, System.out, System.err);
    }

    OperatorCommandRunner(AuditDrainService drainService, DbToolService dbToolService,
                          PrintStream out, PrintStream err) {
        this.drainService = drainService;
        this.dbToolService = dbToolService;
        this.out = out;
        this.err = err;
    }

    public static boolean isOperatorCommand(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                return "drain".equals(arg) || "db".equals(arg);
            }
        }
        return false;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> command = args.getNonOptionArgs();
        if (command.isEmpty() || !isOperatorCommand(command.get(0))) {
            return;
        }
        try {
            exitCode = dispatch(command, args);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            err.println("Error: " + ex.getMessage());
            exitCode = 1;
        } catch (IOException | UncheckedIOException ex) {
            log.error("Command {} failed", command, ex);
            err.println("Failed: " + ex.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int dispatch(List<String> command, ApplicationArguments args) throws IOException {
        if ("drain".equals(command.get(0))) {
            return drain();
        }
        if (command.size() < 2) {
            err.println(USAGE);
            return 1;
        }
        switch (command.get(1)) {
            case "export" -> {
                dbToolService.export(DbToolOptions.from(args), out, err);
                return 0;
            }
            case "delete" -> {
                dbToolService.delete(DbToolOptions.from(args), out, err);
                return 0;
            }
            default -> {
                err.println("Unknown command: " + command.get(1));
                err.println(USAGE);
                return 1;
            }
        }
    }

    private int drain() {
        DrainResult result = drainService.drain();
        if (result.sent() == 0 && result.failed() == 0) {
            out.println("No events to drain");
            return 0;
        }
        if (result.complete()) {
            out.printf("Done. All %d events sent. Fallback log deleted.%n", result.sent());
            return 0;
        }
        out.printf("Done. %d sent, %d still pending.%n", result.sent(), result.failed());
        return 1;
    }
}
