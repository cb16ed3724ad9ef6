package com.example.agentflow.agent;

import dev.langchain4j.service.MemoryId;
import dev.langchain4j.service.Result;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.memory.ChatMemoryAccess;

/**
 * LangChain4j AI service backing one registered agent. Chat memory is kept per conversation id until it is
 * evicted through {@link ChatMemoryAccess}.
 */
public interface AgentAssistant extends ChatMemoryAccess {

    Result<String> chat(@MemoryId String conversationId, @UserMessage String message);
}
