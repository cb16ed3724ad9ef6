package com.example.agentflow.agent;

import com.example.agentflow.agent.tools.ToolRegistry;
import com.example.agentflow.domain.Agent;

import dev.langchain4j.memory.chat.MessageWindowChatMemory;
import dev.langchain4j.service.AiServices;

import jakarta.annotation.PreDestroy;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Built {@link AgentAssistant}s keyed by agent id.
 * <p>
 * Handles are built on first use, evicted when an agent's status changes and dropped when the
 * application context shuts down.
 * </p>
 */
@Component
@Slf4j
public class AgentHandleCache {

    private final ConcurrentMap<UUID, AgentAssistant> handles = new ConcurrentHashMap<>();
    private final OpenRouterChatModelFactory chatModelFactory;
    private final ToolRegistry toolRegistry;
    private final int memoryWindow;

    public AgentHandleCache(OpenRouterChatModelFactory chatModelFactory,
                            ToolRegistry toolRegistry,
                            @Value("${agentflow.agent.memory-window:20}") int memoryWindow) {
        this.chatModelFactory = chatModelFactory;
        this.toolRegistry = toolRegistry;
        this.memoryWindow = Math.max(1, memoryWindow);
    }

    public AgentAssistant getOrCreate(Agent agent) {
        return handles.computeIfAbsent(agent.getId(), id -> build(agent));
    }

    public void evict(UUID agentId) {
        if (handles.remove(agentId) != null) {
            log.debug("Evicted agent handle agentId={}", agentId);
        }
    }

    public int size() {
        return handles.size();
    }

    @PreDestroy
    public void clear() {
        log.info("Clearing {} cached agent handles", handles.size());
        handles.clear();
    }

    private AgentAssistant build(Agent agent) {
        log.debug("Building agent handle agentId={} model={} tools={}", agent.getId(), agent.getModelName(), agent.getToolIds());
        var builder = AiServices.builder(AgentAssistant.class)
                .chatModel(chatModelFactory.build(agent.getModelName()))
                .chatMemoryProvider(memoryId -> MessageWindowChatMemory.builder()
                        .id(memoryId)
                        .maxMessages(memoryWindow)
                        .build());
        String instructions = systemMessage(agent);
        builder.systemMessageProvider(memoryId -> instructions);
        Object[] tools = toolRegistry.getTools(agent.getToolIds());
        if (tools.length > 0) {
            builder.tools(tools);
        }
        return builder.build();
    }

    private static String systemMessage(Agent agent) {
        String explicit = agent.getInstructions();
        if (explicit != null && !explicit.isBlank()) {
            return explicit.trim();
        }
        return "You are " + agent.getName() + ", a helpful assistant.";
    }
}
