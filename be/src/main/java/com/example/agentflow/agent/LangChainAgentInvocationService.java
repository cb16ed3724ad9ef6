package com.example.agentflow.agent;

import com.example.agentflow.domain.Agent;
import com.example.agentflow.domain.AgentStatus;
import com.example.agentflow.repository.AgentRepository;

import dev.langchain4j.service.Result;
import dev.langchain4j.service.tool.ToolExecution;

import lombok.extern.slf4j.Slf4j;

import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * {@link AgentInvocationService} backed by LangChain4j assistants for agents registered in the database.
 */
@Service
@Slf4j
public class LangChainAgentInvocationService implements AgentInvocationService {

    private final AgentRepository agentRepository;
    private final AgentHandleCache handleCache;
    private final TransactionTemplate counterTx;

    public LangChainAgentInvocationService(AgentRepository agentRepository,
                                           AgentHandleCache handleCache,
                                           PlatformTransactionManager transactionManager) {
        this.agentRepository = agentRepository;
        this.handleCache = handleCache;
        this.counterTx = new TransactionTemplate(transactionManager);
        this.counterTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public AgentReply invoke(String agentId, String message, UUID callerId, String conversationId) {
        UUID id = parseAgentId(agentId);
        Agent agent = agentRepository.findByIdAndOwnerId(id, callerId)
                .orElseThrow(() -> new AgentInvocationException(agentId, "Agent not found"));
        if (agent.getStatus() != AgentStatus.ACTIVE) {
            throw new AgentInvocationException(agentId, "Agent is not active (status: " + agent.getStatus().value() + ")");
        }
        boolean oneShot = conversationId == null || conversationId.isBlank();
        String conversation = oneShot ? "conv_" + agentId + "_" + UUID.randomUUID() : conversationId;

        AgentAssistant assistant = handleCache.getOrCreate(agent);
        Result<String> result;
        try {
            result = assistant.chat(conversation, message);
        } catch (RuntimeException e) {
            throw new AgentInvocationException(agentId, "Agent call failed: " + e.getMessage(), e);
        } finally {
            if (oneShot) {
                // a generated conversation ends with this call
                assistant.evictChatMemory(conversation);
            }
        }
        List<String> tools = toolNames(result.toolExecutions());
        log.debug("Agent replied agentId={} conversationId={} tools={}", agentId, conversation, tools);
        recordConversation(id);
        return new AgentReply(result.content(), tools, conversation);
    }

    private void recordConversation(UUID agentId) {
        try {
            counterTx.executeWithoutResult(status -> agentRepository.findById(agentId)
                    .ifPresent(a -> a.recordConversation(Instant.now())));
        } catch (DataAccessException e) {
            log.warn("Could not update conversation counters agentId={}: {}", agentId, e.getMessage());
        }
    }

    private static List<String> toolNames(List<ToolExecution> executions) {
        if (executions == null || executions.isEmpty()) {
            return List.of();
        }
        return executions.stream()
                .map(execution -> execution.request().name())
                .toList();
    }

    private static UUID parseAgentId(String agentId) {
        if (agentId == null) {
            throw new AgentInvocationException(null, "Agent id is required");
        }
        try {
            return UUID.fromString(agentId.trim());
        } catch (IllegalArgumentException e) {
            throw new AgentInvocationException(agentId, "Agent not found");
        }
    }
}
