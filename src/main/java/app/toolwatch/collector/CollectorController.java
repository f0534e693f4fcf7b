package app.toolwatch.collector;

import java.util.List;
import java.util.concurrent.Callable;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import app.toolwatch.approval.ApprovalResponse;
import app.toolwatch.audit.AuditSender;
import app.toolwatch.collector.dto.ApprovalActionResponse;
import app.toolwatch.collector.dto.ErrorResponse;
import app.toolwatch.event.ToolCallEvent;
import app.toolwatch.event.ToolResultEvent;
import app.toolwatch.event.ToolwatchEvent;
import app.toolwatch.manual.ManualApprovalCoordinator;
import app.toolwatch.storage.ApprovalStatus;
import app.toolwatch.storage.DuplicateToolCallException;
import app.toolwatch.storage.FilterOptions;
import app.toolwatch.storage.ToolCallFilter;
import app.toolwatch.storage.ToolCallRecord;
import app.toolwatch.storage.ToolCallRepository;
import app.toolwatch.storage.ToolCallStats;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * HTTP-Schnittstelle des Collectors: Events der Agenten, manuelle Freigaben und Abfragen
 * für das Dashboard.
 */
@Slf4j
@RestController
@CrossOrigin(origins = "*",
        allowedHeaders = {HttpHeaders.CONTENT_TYPE, AuditSender.AUDIT_HEADER},
        methods = {RequestMethod.GET, RequestMethod.POST, RequestMethod.OPTIONS})
public class CollectorController {

    private final CollectorService collectorService;
    private final ManualApprovalCoordinator coordinator;
    private final ToolCallRepository repository;
    private final ObjectMapper objectMapper;

    public CollectorController(CollectorService collectorService,
                               ManualApprovalCoordinator coordinator,
                               ToolCallRepository repository,
                               ObjectMapper objectMapper) {
        this.collectorService = collectorService;
        this.coordinator = coordinator;
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    /**
     * Tool call: evaluated (or only recorded with {@code X-Toolwatch-Audit: true}).
     * Tool result: recorded. Both answer with an {@link ApprovalResponse}.
     */
    @PostMapping(path = "/events", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> receiveEvent(@RequestBody JsonNode body,
                                                     @RequestHeader HttpHeaders headers) {
        String type = body.path("type").asText("");
        boolean auditOnly = headers.getOrEmpty(AuditSender.AUDIT_HEADER).contains("true");

        switch (type) {
            case ToolwatchEvent.TOOL_CALL -> {
                ToolCallEvent event;
                try {
                    event = objectMapper.treeToValue(body, ToolCallEvent.class);
                } catch (JsonProcessingException | IllegalArgumentException ex) {
                    return Mono.just(badRequest("Invalid tool_call event"));
                }
                if (!event.hasRequiredFields()) {
                    return Mono.just(badRequest("Invalid tool_call event"));
                }
                if (auditOnly) {
                    return collectorService.recordAuditOnly(event)
                            .thenReturn(ResponseEntity.ok((Object) ApprovalResponse.approve()));
                }
                return collectorService.evaluateToolCall(event)
                        .map(response -> ResponseEntity.ok((Object) response))
                        .onErrorResume(DuplicateToolCallException.class, ex -> Mono.just(
                                ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse(ex.getMessage()))));
            }
            case ToolwatchEvent.TOOL_RESULT -> {
                ToolResultEvent result;
                try {
                    result = objectMapper.treeToValue(body, ToolResultEvent.class);
                } catch (JsonProcessingException | IllegalArgumentException ex) {
                    return Mono.just(badRequest("Invalid tool_result event"));
                }
                if (result.toolCallId() == null) {
                    return Mono.just(badRequest("Invalid tool_result event"));
                }
                return collectorService.recordResult(result)
                        .thenReturn(ResponseEntity.ok((Object) ApprovalResponse.approve()));
            }
            default -> {
                return Mono.just(badRequest("Unknown event type"));
            }
        }
    }

    @PostMapping(path = "/approve/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApprovalActionResponse>> approve(@PathVariable("id") String toolCallId,
                                                                @RequestParam(required = false) String reason) {
        return Mono.fromCallable(() -> coordinator.approve(toolCallId, reason))
                .subscribeOn(Schedulers.boundedElastic())
                .map(this::actionResponse);
    }

    @PostMapping(path = "/deny/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApprovalActionResponse>> deny(@PathVariable("id") String toolCallId,
                                                             @RequestParam(required = false) String reason) {
        return Mono.fromCallable(() -> coordinator.deny(toolCallId, reason))
                .subscribeOn(Schedulers.boundedElastic())
                .map(this::actionResponse);
    }

    @GetMapping(path = "/api/pending", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<ToolCallRecord>> pending() {
        return blocking(repository::findPending);
    }

    @GetMapping(path = "/api/calls", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<ToolCallRecord>> calls(@RequestParam(required = false) String user,
                                            @RequestParam(required = false) String tool,
                                            @RequestParam(required = false) String model,
                                            @RequestParam(required = false) String isError,
                                            @RequestParam(required = false) String approval,
                                            @RequestParam(required = false) String search,
                                            @RequestParam(required = false) Long from,
                                            @RequestParam(required = false) Long to,
                                            @RequestParam(required = false) Integer limit,
                                            @RequestParam(required = false) Integer offset) {
        ToolCallFilter filter = ToolCallFilter.builder()
                .user(emptyToNull(user))
                .tool(emptyToNull(tool))
                .model(emptyToNull(model))
                .isError(isError == null || isError.isEmpty() ? null : Boolean.valueOf("true".equals(isError)))
                .approvalStatus(parseApproval(approval))
                .search(emptyToNull(search))
                .from(from)
                .to(to)
                .limit(limit != null ? limit : ToolCallFilter.DEFAULT_LIMIT)
                .offset(offset != null ? offset : 0)
                .build();
        return blocking(() -> repository.query(filter));
    }

    @GetMapping(path = "/api/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ToolCallStats> stats() {
        return blocking(repository::stats);
    }

    @GetMapping(path = "/api/filters", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<FilterOptions> filters() {
        return blocking(repository::filterOptions);
    }

    private ResponseEntity<ApprovalActionResponse> actionResponse(boolean success) {
        return ResponseEntity.status(success ? HttpStatus.OK : HttpStatus.NOT_FOUND)
                .body(new ApprovalActionResponse(success));
    }

    private static ResponseEntity<Object> badRequest(String error) {
        return ResponseEntity.badRequest().body(new ErrorResponse(error));
    }

    private static ApprovalStatus parseApproval(String approval) {
        try {
            return ApprovalStatus.fromValue(approval);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static <T> Mono<T> blocking(Callable<T> query) {
        return Mono.fromCallable(query).subscribeOn(Schedulers.boundedElastic());
    }
}
