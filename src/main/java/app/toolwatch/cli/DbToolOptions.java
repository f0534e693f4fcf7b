package app.toolwatch.cli;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;

import org.springframework.boot.ApplicationArguments;

import app.toolwatch.storage.ApprovalStatus;
import app.toolwatch.storage.ToolCallFilter;

/**
 * Options of {@code db export} and {@code db delete}, given as {@code --name=value}.
 *
 * @param before exclusive upper bound on {@code ts}
 * @param after  inclusive lower bound on {@code ts}
 */
public record DbToolOptions(
        String user,
        String tool,
        String model,
        ApprovalStatus approval,
        Boolean isError,
        Long before,
        Long after,
        String search,
        Integer limit,
        String output,
        boolean dryRun
) {

    /**
     * @throws IllegalArgumentException on an invalid date, status or limit
     */
    public static DbToolOptions from(ApplicationArguments args) {
        if (args.containsOption("error") && args.containsOption("success")) {
            throw new IllegalArgumentException("--error and --success are mutually exclusive");
        }
        Boolean isError = null;
        if (args.containsOption("error")) {
            isError = true;
        } else if (args.containsOption("success")) {
            isError = false;
        }
        String limit = value(args, "limit");
        return new DbToolOptions(
                value(args, "user"),
                value(args, "tool"),
                value(args, "model"),
                ApprovalStatus.fromValue(value(args, "approval")),
                isError,
                parseDate(value(args, "before")),
                parseDate(value(args, "after")),
                value(args, "search"),
                limit != null ? parseLimit(limit) : null,
                value(args, "output"),
                args.containsOption("dry-run"));
    }

    public ToolCallFilter toFilter() {
        return ToolCallFilter.builder()
                .user(user)
                .tool(tool)
                .model(model)
                .approvalStatus(approval)
                .isError(isError)
                .before(before)
                .from(after)
                .search(search)
                .limit(limit)
                .build();
    }

    /**
     * Epoch millis, an ISO date (midnight UTC) or an ISO instant.
     */
    static Long parseDate(String value) {
        if (value == null) {
            return null;
        }
        if (value.chars().allMatch(Character::isDigit)) {
            return Long.parseLong(value);
        }
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
            }
            return Instant.parse(value).toEpochMilli();
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid date: " + value, ex);
        }
    }

    private static Integer parseLimit(String value) {
        try {
            int limit = Integer.parseInt(value);
            if (limit <= 0) {
                throw new IllegalArgumentException("Invalid limit: " + value);
            }
            return limit;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid limit: " + value, ex);
        }
    }

    private static String value(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isEmpty() ? null : value;
    }
}
