package app.toolwatch.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;

import app.toolwatch.storage.ToolCallFilter;
import app.toolwatch.storage.ToolCallRecord;
import app.toolwatch.storage.ToolCallRepository;
import lombok.RequiredArgsConstructor;

/**
 * Export and retention on the collector database.
 */
@Service
@RequiredArgsConstructor
public class DbToolService {

    static final int DRY_RUN_SAMPLES = 10;

    private final ToolCallRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Writes matching records as a pretty-printed JSON array, newest first.
     *
     * @return number of exported records
     */
    public int export(DbToolOptions options, PrintStream out, PrintStream err) throws IOException {
        List<ToolCallRecord> records = repository.findAll(options.toFilter());
        if (options.output() != null) {
            Path output = Path.of(options.output());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), records);
            err.printf("Exported %d records to %s%n", records.size(), output);
        } else {
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(records));
        }
        return records.size();
    }

    /**
     * Deletes matching records, or only reports them with {@code --dry-run}.
     *
     * @return number of deleted (or, on a dry run, matching) records
     * @throws IllegalArgumentException if no filter was given
     */
    public long delete(DbToolOptions options, PrintStream out, PrintStream err) {
        ToolCallFilter filter = options.toFilter().toBuilder().limit(null).build();
        if (!filter.hasCriteria()) {
            throw new IllegalArgumentException(
                    "Delete requires at least one filter (--before, --after, --user, --tool, --approval, ...)");
        }

        long count = repository.count(filter);
        if (options.dryRun()) {
            out.printf("Dry run: would delete %d records%n", count);
            List<ToolCallRecord> samples = repository.query(filter.toBuilder().limit(DRY_RUN_SAMPLES).offset(0).build());
            if (!samples.isEmpty()) {
                out.println();
                out.println("Sample records that would be deleted:");
                for (ToolCallRecord sample : samples) {
                    out.printf("  %s | %s | %s | %s%n", Instant.ofEpochMilli(sample.getTs()), sample.getUser(),
                            sample.getTool(), sample.getApprovalStatus() != null ? sample.getApprovalStatus().getValue() : "-");
                }
                if (count > DRY_RUN_SAMPLES) {
                    out.printf("  ... and %d more%n", count - DRY_RUN_SAMPLES);
                }
            }
            return count;
        }

        err.printf("About to delete %d records.%n", count);
        int deleted = repository.delete(filter);
        out.printf("Deleted %d records%n", deleted);
        return deleted;
    }
}
