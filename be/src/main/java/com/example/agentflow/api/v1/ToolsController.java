package com.example.agentflow.api.v1;

import com.example.agentflow.agent.tools.ToolRegistry;
import com.example.agentflow.api.v1.dto.ToolInfoDto;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Lists the tools that can be assigned to agents.
 */
@RestController
@RequestMapping("/api/v1/tools")
@RequiredArgsConstructor
@Slf4j
public class ToolsController {

    private final ToolRegistry toolRegistry;

    @GetMapping
    public List<ToolInfoDto> list() {
        List<ToolInfoDto> tools = toolRegistry.describeTools();
        log.debug("Listing available tools count={}", tools.size());
        return tools;
    }
}
