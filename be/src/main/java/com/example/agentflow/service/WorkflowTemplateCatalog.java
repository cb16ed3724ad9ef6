package com.example.agentflow.service;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Workflow templates known to this instance, keyed and listed by template key.
 */
@Component
@Slf4j
public class WorkflowTemplateCatalog {

    private final Map<String, WorkflowTemplate> templates = new ConcurrentSkipListMap<>();

    public void register(WorkflowTemplate template) {
        WorkflowTemplate previous = templates.put(template.key(), template);
        log.debug("{} workflow template {}", previous == null ? "Registered" : "Replaced", template.key());
    }

    public Optional<WorkflowTemplate> find(String key) {
        return key != null ? Optional.ofNullable(templates.get(key)) : Optional.empty();
    }

    public List<WorkflowTemplate> list() {
        return List.copyOf(templates.values());
    }

    public List<String> keys() {
        return List.copyOf(templates.keySet());
    }
}
