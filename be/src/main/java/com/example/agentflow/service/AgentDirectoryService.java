package com.example.agentflow.service;

import com.example.agentflow.agent.AgentHandleCache;
import com.example.agentflow.agent.tools.ToolRegistry;
import com.example.agentflow.api.AgentNotFoundException;
import com.example.agentflow.api.v1.dto.AgentCreateRequest;
import com.example.agentflow.api.v1.dto.AgentListResponse;
import com.example.agentflow.api.v1.dto.AgentResponse;
import com.example.agentflow.domain.Agent;
import com.example.agentflow.domain.AgentStatus;
import com.example.agentflow.repository.AgentRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Agents owned by users: registration, lookup, status changes and the status lookup used to validate workflows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentDirectoryService {

    private final AgentRepository repository;
    private final ToolRegistry toolRegistry;
    private final AgentHandleCache handleCache;

    @Transactional
    public AgentResponse registerAgent(UUID ownerId, AgentCreateRequest request) {
        List<String> toolIds = request.toolIds() != null ? List.copyOf(request.toolIds()) : List.of();
        for (String toolId : toolIds) {
            if (!toolRegistry.isKnown(toolId)) {
                throw new IllegalArgumentException("Unknown tool id: " + toolId);
            }
        }
        Agent agent = new Agent(UUID.randomUUID(), ownerId, request.name().trim(), request.instructions(),
                request.modelName(), toolIds, AgentStatus.ACTIVE, Instant.now());
        repository.save(agent);
        log.info("Registered agent id={} owner={} tools={}", agent.getId(), ownerId, toolIds);
        return toResponse(agent);
    }

    @Transactional(readOnly = true)
    public AgentListResponse listAgents(UUID ownerId) {
        List<AgentResponse> agents = repository.findByOwnerIdOrderByCreatedAtDesc(ownerId).stream()
                .map(AgentDirectoryService::toResponse)
                .toList();
        log.debug("listAgents owner={} returned {}", ownerId, agents.size());
        return new AgentListResponse(agents);
    }

    @Transactional(readOnly = true)
    public AgentResponse getAgent(UUID agentId, UUID ownerId) {
        return toResponse(load(agentId, ownerId));
    }

    @Transactional
    public AgentResponse updateStatus(UUID agentId, UUID ownerId, AgentStatus status) {
        Agent agent = load(agentId, ownerId);
        agent.changeStatus(Objects.requireNonNull(status, "status"), Instant.now());
        handleCache.evict(agentId);
        log.info("Agent status changed id={} status={}", agentId, status.value());
        return toResponse(agent);
    }

    /**
     * Status of every referenced agent the caller owns, keyed by the id exactly as referenced (trimmed).
     * Different spellings of the same id (letter case) each get an entry. Malformed ids and agents owned by
     * someone else are absent from the result.
     */
    @Transactional(readOnly = true)
    public Map<String, AgentStatus> resolveStatuses(UUID ownerId, Collection<String> agentIds) {
        Map<UUID, Set<String>> requested = new HashMap<>();
        for (String raw : agentIds) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String trimmed = raw.trim();
            try {
                requested.computeIfAbsent(UUID.fromString(trimmed), id -> new HashSet<>()).add(trimmed);
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring malformed agent id {}", trimmed);
            }
        }
        if (requested.isEmpty()) {
            return Map.of();
        }
        Map<String, AgentStatus> statuses = new HashMap<>();
        for (Agent agent : repository.findByOwnerIdAndIdIn(ownerId, requested.keySet())) {
            requested.get(agent.getId()).forEach(spelling -> statuses.put(spelling, agent.getStatus()));
        }
        return statuses;
    }

    private Agent load(UUID agentId, UUID ownerId) {
        return repository.findByIdAndOwnerId(agentId, ownerId)
                .orElseThrow(() -> new AgentNotFoundException(agentId));
    }

    private static AgentResponse toResponse(Agent agent) {
        return new AgentResponse(
                agent.getId(),
                agent.getName(),
                agent.getInstructions(),
                agent.getModelName(),
                agent.getToolIds(),
                agent.getStatus(),
                agent.getTotalConversations(),
                agent.getLastConversationAt(),
                agent.getCreatedAt(),
                agent.getUpdatedAt()
        );
    }
}
