package com.example.agentflow.api.v1;

import com.example.agentflow.api.v1.dto.CancelWorkflowResponse;
import com.example.agentflow.api.v1.dto.SimpleChainRequest;
import com.example.agentflow.api.v1.dto.TemplateExecuteRequest;
import com.example.agentflow.api.v1.dto.WorkflowExecuteRequest;
import com.example.agentflow.api.v1.dto.WorkflowHistoryResponse;
import com.example.agentflow.api.v1.dto.WorkflowResponse;
import com.example.agentflow.api.v1.dto.WorkflowStatusResponse;
import com.example.agentflow.api.v1.dto.WorkflowTemplateDto;
import com.example.agentflow.api.v1.dto.WorkflowTemplateListResponse;
import com.example.agentflow.service.WorkflowOrchestrator;
import com.example.agentflow.service.WorkflowQueryService;
import com.example.agentflow.service.WorkflowTemplate;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for running and inspecting workflows.
 * <p>
 * Exposes {@code /api/v1/workflows}: execute (POST /execute), simple chains (POST /simple-chain), templates
 * (GET /templates, POST /templates/{key}), history (GET /history), details (GET /{id}), live status
 * (GET /{id}/status), cancellation (POST /{id}/cancel) and delete (DELETE /{id}). All of them are scoped to the
 * caller named by the {@code X-User-Id} header.
 * </p>
 */
@RestController
@RequestMapping("/api/v1/workflows")
@RequiredArgsConstructor
@Slf4j
public class WorkflowController {

    private final WorkflowOrchestrator orchestrator;
    private final WorkflowQueryService queryService;

    @PostMapping("/execute")
    public ResponseEntity<WorkflowResponse> execute(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                                    @Valid @RequestBody WorkflowExecuteRequest request) {
        log.info("Executing workflow name={} steps={} parallel={} owner={}",
                request.name(), request.steps().size(), request.parallel(), userId);
        return ResponseEntity.ok(orchestrator.executeWorkflow(request, userId));
    }

    @PostMapping("/simple-chain")
    public ResponseEntity<WorkflowResponse> simpleChain(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                                        @RequestBody SimpleChainRequest request) {
        log.info("Executing simple chain agents={} parallel={} owner={}",
                request.agentIds() != null ? request.agentIds().size() : 0, request.parallel(), userId);
        return ResponseEntity.ok(orchestrator.executeSimpleChain(request, userId));
    }

    @GetMapping("/templates")
    public ResponseEntity<WorkflowTemplateListResponse> templates() {
        log.debug("Listing workflow templates");
        return ResponseEntity.ok(new WorkflowTemplateListResponse(
                orchestrator.listTemplates().stream().map(WorkflowController::toDto).toList()));
    }

    @PostMapping("/templates/{key}")
    public ResponseEntity<WorkflowResponse> executeTemplate(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                                            @PathVariable String key,
                                                            @RequestBody(required = false) TemplateExecuteRequest request) {
        log.info("Executing template key={} owner={}", key, userId);
        TemplateExecuteRequest body = request != null ? request : new TemplateExecuteRequest(null, null);
        return ResponseEntity.ok(orchestrator.executeTemplate(key, body, userId));
    }

    @GetMapping("/history")
    public ResponseEntity<WorkflowHistoryResponse> history(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                                           @RequestParam(required = false) Integer limit) {
        log.debug("Workflow history owner={} limit={}", userId, limit);
        return ResponseEntity.ok(queryService.getWorkflowHistory(userId, limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<WorkflowResponse> details(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                                    @PathVariable UUID id) {
        log.debug("Workflow details id={} owner={}", id, userId);
        return ResponseEntity.ok(queryService.getWorkflowDetails(id, userId));
    }

    @GetMapping("/{id}/status")
    public ResponseEntity<WorkflowStatusResponse> status(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                                         @PathVariable UUID id) {
        return ResponseEntity.ok(queryService.getWorkflowStatus(id, userId));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<CancelWorkflowResponse> cancel(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                                         @PathVariable UUID id) {
        boolean cancelled = orchestrator.cancelWorkflow(id, userId);
        log.info("Cancel requested workflowId={} owner={} cancelled={}", id, userId, cancelled);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new CancelWorkflowResponse(id, cancelled));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@RequestHeader(ApiHeaders.USER_ID) UUID userId, @PathVariable UUID id) {
        log.info("Deleting workflow id={} owner={}", id, userId);
        queryService.deleteWorkflow(id, userId);
        return ResponseEntity.noContent().build();
    }

    private static WorkflowTemplateDto toDto(WorkflowTemplate template) {
        return new WorkflowTemplateDto(
                template.key(),
                template.name(),
                template.description(),
                template.requiredParams(),
                template.steps().stream().map(WorkflowTemplate.StepBlueprint::stepName).toList()
        );
    }
}
