package com.example.agentflow.api.v1;

import com.example.agentflow.api.v1.dto.AgentCreateRequest;
import com.example.agentflow.api.v1.dto.AgentListResponse;
import com.example.agentflow.api.v1.dto.AgentResponse;
import com.example.agentflow.api.v1.dto.AgentStatusUpdateRequest;
import com.example.agentflow.service.AgentDirectoryService;

import jakarta.validation.Valid;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for the caller's agents: register, list, get and change status.
 */
@RestController
@RequestMapping("/api/v1/agents")
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    private final AgentDirectoryService agentDirectory;

    @PostMapping
    public ResponseEntity<AgentResponse> register(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                                  @Valid @RequestBody AgentCreateRequest request) {
        log.info("Registering agent name={} owner={}", request.name(), userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(agentDirectory.registerAgent(userId, request));
    }

    @GetMapping
    public ResponseEntity<AgentListResponse> list(@RequestHeader(ApiHeaders.USER_ID) UUID userId) {
        return ResponseEntity.ok(agentDirectory.listAgents(userId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AgentResponse> get(@RequestHeader(ApiHeaders.USER_ID) UUID userId, @PathVariable UUID id) {
        return ResponseEntity.ok(agentDirectory.getAgent(id, userId));
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<AgentResponse> updateStatus(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                                      @PathVariable UUID id,
                                                      @Valid @RequestBody AgentStatusUpdateRequest request) {
        log.info("Updating agent status id={} status={} owner={}", id, request.status(), userId);
        return ResponseEntity.ok(agentDirectory.updateStatus(id, userId, request.status()));
    }
}
