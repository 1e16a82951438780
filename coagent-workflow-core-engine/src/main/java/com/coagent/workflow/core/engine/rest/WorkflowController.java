package com.coagent.workflow.core.engine.rest;

import com.coagent.workflow.core.engine.checkpoint.ICoAgentCheckpointStore;
import com.coagent.workflow.core.engine.config.CoAgentEngineSettings;
import com.coagent.workflow.core.engine.execution.ICoAgentExecutionEngine;
import com.coagent.workflow.core.engine.registry.CoAgentValidatedState;
import com.coagent.workflow.core.engine.registry.ICoAgentWorkflowRegistry;
import com.coagent.workflow.core.engine.rest.dto.ApiResponse;
import com.coagent.workflow.core.engine.rest.dto.ExecuteRequest;
import com.coagent.workflow.core.engine.rest.dto.ExecutionResultDto;
import com.coagent.workflow.core.engine.rest.dto.ResumeRequest;
import com.coagent.workflow.core.engine.rest.dto.WorkflowSummaryDto;
import com.coagent.workflow.core.engine.stream.ICoAgentProgressStream;
import com.coagent.workflow.core.exception.CoAgentInvalidRequestException;
import com.coagent.workflow.core.exception.CoAgentWorkflowException;
import com.coagent.workflow.core.exception.execution.CoAgentInvalidResumeException;
import com.coagent.workflow.integration.enumerations.CoAgentApprovalDecisionType;
import com.coagent.workflow.integration.enumerations.CoAgentProgressEventType;
import com.coagent.workflow.integration.models.approval.CoAgentApprovalDecision;
import com.coagent.workflow.integration.models.events.CoAgentProgressEvent;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionConfig;
import com.coagent.workflow.integration.models.execution.CoAgentExecutionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST controller of the workflow engine.
 *
 * <h2>API Endpoints</h2>
 * <table border="1">
 *   <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 *   <tr><td>GET</td><td>/api/v1</td><td>Health and registry statistics</td></tr>
 *   <tr><td>GET</td><td>/api/v1/workflows?tag=</td><td>List workflows, optionally by industry or tag</td></tr>
 *   <tr><td>GET</td><td>/api/v1/workflows/{name}</td><td>Describe one workflow</td></tr>
 *   <tr><td>POST</td><td>/api/v1/execute</td><td>Start a thread; JSON result or server-sent events</td></tr>
 *   <tr><td>POST</td><td>/api/v1/resume</td><td>Approve or reject a suspended thread</td></tr>
 *   <tr><td>POST</td><td>/api/v1/threads/{threadId}/recover</td><td>Continue a thread left running by a failed write</td></tr>
 *   <tr><td>POST</td><td>/api/v1/threads/{threadId}/cancel</td><td>Cancel a thread</td></tr>
 *   <tr><td>GET</td><td>/api/v1/threads/{threadId}</td><td>Latest result of a thread</td></tr>
 *   <tr><td>GET</td><td>/api/v1/threads/{threadId}/events?since=</td><td>Replay and follow progress events</td></tr>
 * </table>
 *
 * <p>Errors use the status of the error code: validation 400, not found 404, invalid resume and
 * conflicts 409, node and recursion failures 500, notification delivery 502, checkpoint store 503.
 * A body that cannot be read is answered with 400 and error type {@code INVALID_REQUEST}.</p>
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class WorkflowController {

    private static final String SERVICE_NAME = "coagent-workflows";

    private final ICoAgentExecutionEngine executionEngine;
    private final ICoAgentWorkflowRegistry workflowRegistry;
    private final ICoAgentProgressStream progressStream;
    private final ICoAgentCheckpointStore checkpointStore;
    private final CoAgentEngineSettings settings;
    private final CoAgentRequestValidator requestValidator = CoAgentRequestValidator.getInstance();

    // ========================================================================
    // CATALOGUE ENDPOINTS
    // ========================================================================

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<Map<String, Object>>>> health() {
        return checkpointStore.healthCheck()
                .onErrorReturn(false)
                .map(storeHealthy -> {
                    Map<String, Object> health = new LinkedHashMap<>();
                    health.put("status", storeHealthy ? "healthy" : "degraded");
                    health.put("service", SERVICE_NAME);
                    health.put("stats", workflowRegistry.stats());
                    return ResponseEntity.ok(ApiResponse.success(health));
                });
    }

    @GetMapping(value = "/workflows", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<Map<String, Object>>>> listWorkflows(
            @RequestParam(required = false) String tag) {

        log.debug("Listing workflows: tag={}", tag);

        return Mono.fromCallable(() -> {
                    List<WorkflowSummaryDto> workflows = workflowRegistry.list(tag).stream()
                            .map(WorkflowSummaryDto::fromSummary)
                            .collect(Collectors.toList());
                    Map<String, Long> byIndustry = workflows.stream()
                            .collect(Collectors.groupingBy(WorkflowSummaryDto::getIndustry, TreeMap::new, Collectors.counting()));

                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("workflows", workflows);
                    body.put("total", workflows.size());
                    body.put("by_industry", byIndustry);
                    return ResponseEntity.ok(ApiResponse.success(body));
                })
                .onErrorResume(e -> Mono.just(errorResponse("listing workflows", e)));
    }

    @GetMapping(value = "/workflows/{name}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<WorkflowSummaryDto>>> describeWorkflow(@PathVariable String name) {
        log.debug("Describing workflow: name={}", name);

        return Mono.fromCallable(() -> ResponseEntity.ok(ApiResponse.success(
                        WorkflowSummaryDto.fromSummary(workflowRegistry.describe(name)))))
                .onErrorResume(e -> Mono.just(errorResponse("describing workflow " + name, e)));
    }

    // ========================================================================
    // THREAD ACTION ENDPOINTS
    // ========================================================================

    /**
     * Starts a thread. With {@code stream: true} the answer is a server-sent event stream of the
     * thread's progress events, closed by a {@code result} frame (or an {@code error} frame when
     * the call failed).
     */
    @PostMapping(value = "/execute", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> execute(@RequestBody ExecuteRequest request) {
        return Mono.fromCallable(() -> requestValidator.validate(request))
                .flatMap(valid -> {
                    String threadId = valid.getThreadId() != null ? valid.getThreadId() : "thread-" + UUID.randomUUID();
                    Map<String, Object> initialState = valid.getInitialState() != null ? valid.getInitialState() : Map.of();
                    CoAgentValidatedState validated = workflowRegistry.validate(valid.getWorkflowName(), initialState);
                    CoAgentExecutionConfig config = CoAgentExecutionConfig.builder()
                            .threadId(threadId)
                            .recursionLimit(valid.getRecursionLimit() != null ? valid.getRecursionLimit() : settings.getRecursionLimit())
                            .emitEvents(true)
                            .sessionContext(valid.getSessionContext() != null ? valid.getSessionContext() : Map.of())
                            .build();

                    log.info("Executing workflow: name={}, threadId={}, stream={}", valid.getWorkflowName(), threadId, valid.streamRequested());
                    Mono<CoAgentExecutionResult> execution = executionEngine.execute(
                            workflowRegistry.load(valid.getWorkflowName()), validated, config);

                    if (valid.streamRequested()) {
                        return Mono.just(ResponseEntity.ok()
                                .contentType(MediaType.TEXT_EVENT_STREAM)
                                .<Object>body(streamExecution(threadId, execution)));
                    }
                    return execution.map(result -> ResponseEntity.ok().<Object>body(ApiResponse.success(ExecutionResultDto.fromResult(result))));
                })
                .onErrorResume(e -> Mono.just(asObjectResponse(errorResponse("executing workflow", e))));
    }

    @PostMapping(value = "/resume", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<ExecutionResultDto>>> resume(@RequestBody ResumeRequest request) {
        return Mono.fromCallable(() -> toDecision(requestValidator.validate(request)))
                .flatMap(decision -> {
                    log.info("Resuming thread: threadId={}, decision={}", decision.getThreadId(), decision.getDecision().getValue());
                    return executionEngine.resume(decision);
                })
                .map(result -> ResponseEntity.ok(ApiResponse.success(ExecutionResultDto.fromResult(result))))
                .onErrorResume(e -> Mono.just(errorResponse("resuming thread", e)));
    }

    @PostMapping(value = "/threads/{threadId}/recover", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<ExecutionResultDto>>> recover(@PathVariable String threadId) {
        log.info("Recovering thread: threadId={}", threadId);

        return executionEngine.recover(threadId)
                .map(result -> ResponseEntity.ok(ApiResponse.success(ExecutionResultDto.fromResult(result))))
                .onErrorResume(e -> Mono.just(errorResponse("recovering thread " + threadId, e)));
    }

    @PostMapping(value = "/threads/{threadId}/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<ExecutionResultDto>>> cancel(@PathVariable String threadId) {
        log.info("Cancelling thread: threadId={}", threadId);

        return executionEngine.cancel(threadId)
                .map(result -> ResponseEntity.ok(ApiResponse.success(ExecutionResultDto.fromResult(result))))
                .onErrorResume(e -> Mono.just(errorResponse("cancelling thread " + threadId, e)));
    }

    @GetMapping(value = "/threads/{threadId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ApiResponse<ExecutionResultDto>>> getThread(@PathVariable String threadId) {
        log.debug("Getting thread: threadId={}", threadId);

        return executionEngine.getResult(threadId)
                .map(result -> ResponseEntity.ok(ApiResponse.success(ExecutionResultDto.fromResult(result))))
                .onErrorResume(e -> Mono.just(errorResponse("getting thread " + threadId, e)));
    }

    /**
     * Replays the buffered events after {@code since}, then follows live events until a terminal one.
     * For a finished thread only the retained history is replayed.
     */
    @GetMapping(value = "/threads/{threadId}/events")
    public Mono<ResponseEntity<Object>> events(
            @PathVariable String threadId,
            @RequestParam(defaultValue = "0") long since) {

        log.debug("Streaming events: threadId={}, since={}", threadId, since);

        return executionEngine.getResult(threadId)
                .map(result -> {
                    Flux<CoAgentProgressEvent> events = result.getStatus() != null && result.getStatus().isTerminal()
                            ? Flux.fromIterable(progressStream.history(threadId)).filter(event -> event.getSequence() > since)
                            : progressStream.events(threadId, since);
                    return ResponseEntity.ok()
                            .contentType(MediaType.TEXT_EVENT_STREAM)
                            .<Object>body(events.map(WorkflowController::toFrame));
                })
                .onErrorResume(e -> Mono.just(asObjectResponse(errorResponse("streaming events of " + threadId, e))));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiResponse<Object>> unreadableRequest(ServerWebInputException error) {
        String reason = error.getMostSpecificCause().getMessage();
        return errorResponse("reading request", new CoAgentInvalidRequestException(
                "request body could not be read: " + (reason != null ? reason : error.getReason()), Map.of()));
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private Flux<ServerSentEvent<Object>> streamExecution(String threadId, Mono<CoAgentExecutionResult> execution) {
        Mono<CoAgentExecutionResult> outcome = execution.cache();
        Flux<ServerSentEvent<Object>> progress = progressStream.events(threadId, progressStream.lastSequence(threadId))
                .takeUntil(event -> event.isTerminal() || event.getType() == CoAgentProgressEventType.INTERRUPT)
                .map(WorkflowController::toFrame);

        return Flux.merge(progress, outcome.then(Mono.<ServerSentEvent<Object>>empty()))
                .concatWith(outcome.map(result -> ServerSentEvent.<Object>builder(ExecutionResultDto.fromResult(result))
                        .event("result")
                        .build()))
                .onErrorResume(e -> {
                    ResponseEntity<ApiResponse<Object>> failure = errorResponse("streaming workflow " + threadId, e);
                    return Mono.just(ServerSentEvent.<Object>builder(failure.getBody()).event("error").build());
                });
    }

    private static ServerSentEvent<Object> toFrame(CoAgentProgressEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", event.getType().getValue());
        data.put("thread_id", event.getThreadId());
        data.put("sequence", event.getSequence());
        data.put("payload", event.getPayload());
        data.put("timestamp", String.valueOf(event.getTimestamp()));
        return ServerSentEvent.<Object>builder(data)
                .id(String.valueOf(event.getSequence()))
                .event(event.getType().getValue())
                .build();
    }

    private static CoAgentApprovalDecision toDecision(ResumeRequest request) {
        CoAgentApprovalDecisionType decision = CoAgentApprovalDecisionType.fromValue(request.getDecision())
                .orElseThrow(() -> new CoAgentInvalidResumeException(request.getThreadId(), "decision must be approve or reject"));
        return CoAgentApprovalDecision.builder()
                .threadId(request.getThreadId())
                .decision(decision)
                .comment(request.getComment())
                .decidedBy(request.getDecidedBy())
                .expectedVersion(request.getExpectedVersion())
                .build();
    }

    private static <T> ResponseEntity<ApiResponse<T>> errorResponse(String operation, Throwable error) {
        if (error instanceof CoAgentWorkflowException) {
            CoAgentWorkflowException workflowError = (CoAgentWorkflowException) error;
            int status = workflowError.getErrorInfo().getHttpStatus().getStatus();
            if (status >= 500) {
                log.error("Error {}: {}", operation, workflowError.getMessage(), workflowError);
            } else {
                log.info("Rejected {}: {}", operation, workflowError.getMessage());
            }
            return ResponseEntity.status(status).body(ApiResponse.error(workflowError));
        }
        log.error("Error {}", operation, error);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(error.getMessage(), "INTERNAL_ERROR"));
    }

    private static ResponseEntity<Object> asObjectResponse(ResponseEntity<? extends ApiResponse<?>> response) {
        return ResponseEntity.status(response.getStatusCode()).body(response.getBody());
    }
}
