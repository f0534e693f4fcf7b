package app.toolwatch.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import app.toolwatch.event.ToolResultEvent;
import app.toolwatch.support.SqliteTestDatabase;
import app.toolwatch.support.TestEvents;

class ToolCallRepositoryTest {

    @TempDir
    Path tempDir;

    private ToolCallRepository repository;

    @BeforeEach
    void setUp() {
        repository = SqliteTestDatabase.repository(tempDir);
    }

    @Test
    void insertsAndReadsBackParamsAsJson() {
        ObjectNode params = JsonNodeFactory.instance.objectNode().put("command", "ls -la");
        params.put("timeout", 30);
        repository.insert(TestEvents.toolCall("c1", "bash", params), ApprovalStatus.APPROVED, "fine");

        ToolCallRecord record = repository.findByToolCallId("c1").orElseThrow();

        assertThat(record.getParams().get("command").asText()).isEqualTo("ls -la");
        assertThat(record.getParams().get("timeout").asInt()).isEqualTo(30);
        assertThat(record.getApprovalStatus()).isEqualTo(ApprovalStatus.APPROVED);
        assertThat(record.getApprovalReason()).isEqualTo("fine");
        assertThat(record.getIsError()).isNull();
        assertThat(record.getResultTs()).isNull();
        assertThat(record.getSession()).isEqualTo("session-1");
    }

    @Test
    void duplicateToolCallIdIsRejected() {
        repository.insert(TestEvents.bash("c1", "ls"), ApprovalStatus.PENDING, null);

        assertThatThrownBy(() -> repository.insert(TestEvents.bash("c1", "pwd"), ApprovalStatus.APPROVED, null))
                .isInstanceOf(DuplicateToolCallException.class)
                .hasMessageContaining("c1");
        assertThat(repository.findByToolCallId("c1").orElseThrow().getApprovalStatus())
                .isEqualTo(ApprovalStatus.PENDING);
    }

    @Test
    void resultUpdateIsIndependentOfApproval() {
        repository.insert(TestEvents.bash("c1", "false"), ApprovalStatus.APPROVED, null);

        assertThat(repository.updateResult(new ToolResultEvent("c1", 1_700_000_000_500L, true, 500, 1))).isTrue();
        assertThat(repository.updateResult(new ToolResultEvent("unknown", 1L, false, 1, null))).isFalse();

        ToolCallRecord record = repository.findByToolCallId("c1").orElseThrow();
        assertThat(record.getIsError()).isTrue();
        assertThat(record.getDurationMs()).isEqualTo(500L);
        assertThat(record.getExitCode()).isEqualTo(1);
        assertThat(record.getResultTs()).isEqualTo(1_700_000_000_500L);
        assertThat(record.getApprovalStatus()).isEqualTo(ApprovalStatus.APPROVED);
    }

    @Test
    void approvalTransitionHappensExactlyOnce() {
        repository.insert(TestEvents.bash("c1", "ls"), ApprovalStatus.PENDING, null);

        assertThat(repository.updateApprovalStatus("c1", ApprovalStatus.APPROVED, "ok")).isTrue();
        assertThat(repository.updateApprovalStatus("c1", ApprovalStatus.DENIED, "too late")).isFalse();
        assertThat(repository.updateApprovalStatus("missing", ApprovalStatus.DENIED, null)).isFalse();

        assertThat(repository.findApprovalStatus("c1"))
                .contains(new ApprovalState(ApprovalStatus.APPROVED, "ok"));
        assertThat(repository.findApprovalStatus("missing")).isEmpty();
    }

    @Test
    void terminalRecordsCannotBeChanged() {
        repository.insert(TestEvents.bash("c1", "ls"), ApprovalStatus.DENIED, "policy");

        assertThat(repository.updateApprovalStatus("c1", ApprovalStatus.APPROVED, null)).isFalse();
        assertThatThrownBy(() -> repository.updateApprovalStatus("c1", ApprovalStatus.PENDING, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pendingAreOldestFirstAndQueriesNewestFirst() {
        repository.insert(TestEvents.toolCall("late", 300L, "alice", "bash", params("b")), ApprovalStatus.PENDING, null);
        repository.insert(TestEvents.toolCall("early", 100L, "bob", "write", params("a")), ApprovalStatus.PENDING, null);
        repository.insert(TestEvents.toolCall("done", 200L, "alice", "read", params("c")), ApprovalStatus.APPROVED, null);

        assertThat(repository.findPending()).extracting(ToolCallRecord::getToolCallId).containsExactly("early", "late");
        assertThat(repository.query(new ToolCallFilter()))
                .extracting(ToolCallRecord::getToolCallId)
                .containsExactly("late", "done", "early");
    }

    @Test
    void filtersCombineWithAnd() {
        repository.insert(TestEvents.toolCall("c1", 100L, "alice", "bash", params("git status")), ApprovalStatus.APPROVED, null);
        repository.insert(TestEvents.toolCall("c2", 200L, "alice", "bash", params("git push")), ApprovalStatus.DENIED, null);
        repository.insert(TestEvents.toolCall("c3", 300L, "bob", "bash", params("git push")), ApprovalStatus.APPROVED, null);
        repository.updateResult(new ToolResultEvent("c3", 301L, true, 1, 1));

        assertThat(ids(ToolCallFilter.builder().user("alice").search("push").build())).containsExactly("c2");
        assertThat(ids(ToolCallFilter.builder().approvalStatus(ApprovalStatus.APPROVED).build())).containsExactly("c3", "c1");
        assertThat(ids(ToolCallFilter.builder().isError(true).build())).containsExactly("c3");
        assertThat(ids(ToolCallFilter.builder().from(200L).to(300L).build())).containsExactly("c3", "c2");
        assertThat(ids(ToolCallFilter.builder().before(200L).build())).containsExactly("c1");
        assertThat(ids(ToolCallFilter.builder().limit(1).offset(1).build())).containsExactly("c2");
        assertThat(repository.count(ToolCallFilter.builder().tool("bash").build())).isEqualTo(3);
    }

    @Test
    void statsAndFilterOptions() {
        assertThat(repository.stats()).isEqualTo(new ToolCallStats(0, 0, 0, 0));

        repository.insert(TestEvents.toolCall("c1", 100L, "alice", "bash", params("a")), ApprovalStatus.APPROVED, null);
        repository.insert(TestEvents.toolCall("c2", 200L, "bob", "read", params("b")), ApprovalStatus.APPROVED, null);
        repository.insert(TestEvents.toolCall("c3", 300L, "bob", "read", params("c")), ApprovalStatus.APPROVED, null);
        repository.updateResult(new ToolResultEvent("c2", 201L, true, 1, null));

        assertThat(repository.stats()).isEqualTo(new ToolCallStats(3, 2, 2, 1));
        assertThat(repository.filterOptions()).isEqualTo(
                new FilterOptions(List.of("alice", "bob"), List.of("bash", "read"), List.of("gpt-test")));
    }

    @Test
    void deleteRequiresAFilter() {
        repository.insert(TestEvents.toolCall("old", 100L, "alice", "bash", params("a")), ApprovalStatus.APPROVED, null);
        repository.insert(TestEvents.toolCall("new", 900L, "alice", "bash", params("b")), ApprovalStatus.APPROVED, null);

        assertThatThrownBy(() -> repository.delete(new ToolCallFilter()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(repository.delete(ToolCallFilter.builder().before(500L).build())).isEqualTo(1);
        assertThat(ids(new ToolCallFilter())).containsExactly("new");
    }

    private List<String> ids(ToolCallFilter filter) {
        return repository.query(filter).stream().map(ToolCallRecord::getToolCallId).toList();
    }

    private static ObjectNode params(String command) {
        return JsonNodeFactory.instance.objectNode().put("command", command);
    }
}
