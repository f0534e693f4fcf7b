package app.toolwatch.storage;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import app.toolwatch.event.ToolCallEvent;
import app.toolwatch.event.ToolResultEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * Blocking repository for {@code tool_calls}. Callers on the reactive path wrap these calls
 * in {@code Mono.fromCallable(...).subscribeOn(Schedulers.boundedElastic())}.
 *
 * <p>SQLite erlaubt nur einen Schreiber gleichzeitig; Schreibzugriffe werden deshalb
 * prozessintern über {@link #writeLock} serialisiert.
 */
@Slf4j
@Repository
public class ToolCallRepository {

    private static final String SELECT_COLUMNS = """
            SELECT id, tool_call_id, ts, user, hostname, session, cwd, model, tool, params,
                   is_error, duration_ms, exit_code, result_ts, approval_status, approval_reason
            FROM tool_calls""";

    private static final String INSERT_SQL = """
            INSERT OR IGNORE INTO tool_calls
                (tool_call_id, ts, user, hostname, session, cwd, model, tool, params, approval_status, approval_reason)
            VALUES
                (:toolCallId, :ts, :user, :hostname, :session, :cwd, :model, :tool, :params, :approvalStatus, :approvalReason)""";

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final RowMapper<ToolCallRecord> rowMapper = this::mapRow;

    public ToolCallRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    /**
     * Persist a new tool call.
     *
     * @throws DuplicateToolCallException if the id is already stored
     */
    public void insert(ToolCallEvent event, ApprovalStatus status, String reason) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("toolCallId", event.toolCallId())
                .addValue("ts", event.ts())
                .addValue("user", event.user())
                .addValue("hostname", event.hostname())
                .addValue("session", event.session())
                .addValue("cwd", event.cwd())
                .addValue("model", event.model())
                .addValue("tool", event.tool())
                .addValue("params", writeParams(event.params()))
                .addValue("approvalStatus", status != null ? status.getValue() : null)
                .addValue("approvalReason", reason);

        int inserted = locked(() -> jdbc.update(INSERT_SQL, params));
        if (inserted == 0) {
            throw new DuplicateToolCallException(event.toolCallId());
        }
    }

    /**
     * Store the result fields of an earlier call. Unknown ids are ignored.
     *
     * @return {@code true} if a row was updated
     */
    public boolean updateResult(ToolResultEvent result) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("toolCallId", result.toolCallId())
                .addValue("isError", result.isError() ? 1 : 0)
                .addValue("durationMs", result.durationMs())
                .addValue("exitCode", result.exitCode())
                .addValue("resultTs", result.ts());
        int updated = locked(() -> jdbc.update("""
                UPDATE tool_calls
                SET is_error = :isError, duration_ms = :durationMs, exit_code = :exitCode, result_ts = :resultTs
                WHERE tool_call_id = :toolCallId""", params));
        if (updated == 0) {
            log.debug("Result for unknown tool call {} ignored", result.toolCallId());
        }
        return updated > 0;
    }

    /**
     * Compare-and-set from {@code pending} to a terminal status.
     *
     * @return {@code true} only for the single caller that performed the transition
     */
    public boolean updateApprovalStatus(String toolCallId, ApprovalStatus status, String reason) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Target status must be approved or denied: " + status);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("toolCallId", toolCallId)
                .addValue("status", status.getValue())
                .addValue("reason", reason);
        int updated = locked(() -> jdbc.update("""
                UPDATE tool_calls
                SET approval_status = :status, approval_reason = :reason
                WHERE tool_call_id = :toolCallId AND approval_status = 'pending'""", params));
        return updated > 0;
    }

    public Optional<ApprovalState> findApprovalStatus(String toolCallId) {
        List<ApprovalState> states = jdbc.query(
                "SELECT approval_status, approval_reason FROM tool_calls WHERE tool_call_id = :toolCallId",
                new MapSqlParameterSource("toolCallId", toolCallId),
                (rs, rowNum) -> new ApprovalState(
                        ApprovalStatus.fromValue(rs.getString("approval_status")),
                        rs.getString("approval_reason")));
        return states.stream().findFirst();
    }

    public Optional<ToolCallRecord> findByToolCallId(String toolCallId) {
        return jdbc.query(SELECT_COLUMNS + " WHERE tool_call_id = :toolCallId",
                new MapSqlParameterSource("toolCallId", toolCallId), rowMapper).stream().findFirst();
    }

    /**
     * All calls waiting for a decision, oldest first.
     */
    public List<ToolCallRecord> findPending() {
        return jdbc.query(SELECT_COLUMNS + " WHERE approval_status = 'pending' ORDER BY ts ASC",
                new MapSqlParameterSource(), rowMapper);
    }

    /**
     * Newest first, paged by {@code limit} (default {@value ToolCallFilter#DEFAULT_LIMIT})
     * and {@code offset}.
     */
    public List<ToolCallRecord> query(ToolCallFilter filter) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String where = whereClause(filter, params);
        int limit = filter.getLimit() != null ? filter.getLimit() : ToolCallFilter.DEFAULT_LIMIT;
        int offset = filter.getOffset() != null ? filter.getOffset() : 0;
        params.addValue("limit", limit);
        params.addValue("offset", offset);
        return jdbc.query(SELECT_COLUMNS + where + " ORDER BY ts DESC LIMIT :limit OFFSET :offset",
                params, rowMapper);
    }

    /**
     * Every matching row, newest first; limit and offset only apply when set.
     */
    public List<ToolCallRecord> findAll(ToolCallFilter filter) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String where = whereClause(filter, params);
        params.addValue("limit", filter.getLimit() != null ? filter.getLimit() : -1);
        params.addValue("offset", filter.getOffset() != null ? filter.getOffset() : 0);
        return jdbc.query(SELECT_COLUMNS + where + " ORDER BY ts DESC LIMIT :limit OFFSET :offset",
                params, rowMapper);
    }

    public long count(ToolCallFilter filter) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        String where = whereClause(filter, params);
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM tool_calls" + where, params, Long.class);
        return count != null ? count : 0L;
    }

    /**
     * Retention delete.
     *
     * @throws IllegalArgumentException if the filter has no criteria
     */
    public int delete(ToolCallFilter filter) {
        if (filter == null || !filter.hasCriteria()) {
            throw new IllegalArgumentException("Refusing to delete without a filter");
        }
        MapSqlParameterSource params = new MapSqlParameterSource();
        String where = whereClause(filter, params);
        int deleted = locked(() -> jdbc.update("DELETE FROM tool_calls" + where, params));
        log.info("Deleted {} tool call(s)", deleted);
        return deleted;
    }

    public List<String> distinctUsers() {
        return distinct("user");
    }

    public List<String> distinctTools() {
        return distinct("tool");
    }

    public List<String> distinctModels() {
        return distinct("model");
    }

    public FilterOptions filterOptions() {
        return new FilterOptions(distinctUsers(), distinctTools(), distinctModels());
    }

    public ToolCallStats stats() {
        return jdbc.queryForObject("""
                SELECT COUNT(*) AS total,
                       COUNT(DISTINCT user) AS users,
                       COUNT(DISTINCT tool) AS tools,
                       COALESCE(SUM(CASE WHEN is_error = 1 THEN 1 ELSE 0 END), 0) AS errors
                FROM tool_calls""",
                new MapSqlParameterSource(),
                (rs, rowNum) -> new ToolCallStats(
                        rs.getLong("total"), rs.getLong("users"), rs.getLong("tools"), rs.getLong("errors")));
    }

    // column is one of three constants, never user input
    private List<String> distinct(String column) {
        return jdbc.queryForList("SELECT DISTINCT " + column + " FROM tool_calls ORDER BY " + column,
                new MapSqlParameterSource(), String.class);
    }

    private String whereClause(ToolCallFilter filter, MapSqlParameterSource params) {
        if (filter == null) {
            return "";
        }
        List<String> conditions = new ArrayList<>();
        if (hasText(filter.getUser())) {
            conditions.add("user = :user");
            params.addValue("user", filter.getUser());
        }
        if (hasText(filter.getTool())) {
            conditions.add("tool = :tool");
            params.addValue("tool", filter.getTool());
        }
        if (hasText(filter.getModel())) {
            conditions.add("model = :model");
            params.addValue("model", filter.getModel());
        }
        if (filter.getIsError() != null) {
            conditions.add("is_error = :isError");
            params.addValue("isError", filter.getIsError() ? 1 : 0);
        }
        if (filter.getApprovalStatus() != null) {
            conditions.add("approval_status = :approvalStatus");
            params.addValue("approvalStatus", filter.getApprovalStatus().getValue());
        }
        if (hasText(filter.getSearch())) {
            conditions.add("params LIKE :search");
            params.addValue("search", "%" + filter.getSearch() + "%");
        }
        if (filter.getFrom() != null) {
            conditions.add("ts >= :from");
            params.addValue("from", filter.getFrom());
        }
        if (filter.getTo() != null) {
            conditions.add("ts <= :to");
            params.addValue("to", filter.getTo());
        }
        if (filter.getBefore() != null) {
            conditions.add("ts < :before");
            params.addValue("before", filter.getBefore());
        }
        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    private ToolCallRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        Integer isError = nullableInt(rs, "is_error");
        return ToolCallRecord.builder()
                .id(rs.getLong("id"))
                .toolCallId(rs.getString("tool_call_id"))
                .ts(rs.getLong("ts"))
                .user(rs.getString("user"))
                .hostname(rs.getString("hostname"))
                .session(rs.getString("session"))
                .cwd(rs.getString("cwd"))
                .model(rs.getString("model"))
                .tool(rs.getString("tool"))
                .params(readParams(rs.getString("params")))
                .isError(isError == null ? null : isError != 0)
                .durationMs(nullableLong(rs, "duration_ms"))
                .exitCode(nullableInt(rs, "exit_code"))
                .resultTs(nullableLong(rs, "result_ts"))
                .approvalStatus(ApprovalStatus.fromValue(rs.getString("approval_status")))
                .approvalReason(rs.getString("approval_reason"))
                .build();
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private String writeParams(JsonNode params) {
        try {
            return objectMapper.writeValueAsString(params);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialize params", ex);
        }
    }

    private JsonNode readParams(String json) {
        if (json == null) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            log.warn("Stored params are not valid JSON, returning raw text: {}", ex.getOriginalMessage());
            return objectMapper.getNodeFactory().textNode(json);
        }
    }

    private <T> T locked(Supplier<T> action) {
        writeLock.lock();
        try {
            return action.get();
        } finally {
            writeLock.unlock();
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
