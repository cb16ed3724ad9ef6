package com.example.agentflow.agent;

import java.util.List;

/**
 * Answer of one agent invocation: response text, tools the agent called (in call order) and the
 * conversation id the answer belongs to.
 */
public record AgentReply(String response, List<String> toolsUsed, String conversationId) {
    public AgentReply {
        response = response != null ? response : "";
        toolsUsed = toolsUsed != null ? List.copyOf(toolsUsed) : List.of();
    }
}
