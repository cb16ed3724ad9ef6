package com.example.agentflow.agent.tools;

import com.example.agentflow.api.v1.dto.ToolInfoDto;

import java.util.List;

/**
 * Registry of tools by id. Used when building an agent to resolve the agent's tool ids.
 */
public interface ToolRegistry {

    /**
     * Returns tool instances for the given ids, in order. Unknown ids are skipped.
     */
    Object[] getTools(List<String> toolIds);

    /**
     * Returns the tools that can be assigned to agents, sorted by id.
     */
    List<ToolInfoDto> describeTools();

    boolean isKnown(String toolId);
}
