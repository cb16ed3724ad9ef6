package com.example.agentflow.agent.tools;

import com.example.agentflow.api.v1.dto.ToolInfoDto;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Default implementation of {@link ToolRegistry} registering the "time" and "word_count" tools.
 */
@Component
public class DefaultToolRegistry implements ToolRegistry {

    private record Registration(String description, Object tool) {
    }

    private static final Map<String, Registration> TOOLS = Map.of(
            "time", new Registration("Current date and time, optionally in a given time zone", new TimeTool()),
            "word_count", new Registration("Count words and characters of a text", new WordCountTool())
    );

    @Override
    public Object[] getTools(List<String> toolIds) {
        if (toolIds == null || toolIds.isEmpty()) {
            return new Object[0];
        }
        List<Object> result = new ArrayList<>();
        for (String id : toolIds) {
            Registration registration = id != null ? TOOLS.get(id) : null;
            if (registration != null && !result.contains(registration.tool())) {
                result.add(registration.tool());
            }
        }
        return result.toArray();
    }

    @Override
    public List<ToolInfoDto> describeTools() {
        return TOOLS.entrySet().stream()
                .map(e -> new ToolInfoDto(e.getKey(), e.getValue().description()))
                .sorted(Comparator.comparing(ToolInfoDto::id))
                .toList();
    }

    @Override
    public boolean isKnown(String toolId) {
        return toolId != null && TOOLS.containsKey(toolId);
    }
}
