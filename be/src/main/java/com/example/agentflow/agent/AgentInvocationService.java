package com.example.agentflow.agent;

import java.util.UUID;

/**
 * Sends one message to one agent on behalf of a caller.
 * <p>
 * Called at most once per workflow step; implementations do not retry. A {@code null} conversation id
 * asks the implementation to start a fresh conversation that is discarded once the call returns.
 * </p>
 */
public interface AgentInvocationService {

    /**
     * @throws AgentInvocationException if the agent cannot be resolved or the backend fails
     */
    AgentReply invoke(String agentId, String message, UUID callerId, String conversationId);
}
