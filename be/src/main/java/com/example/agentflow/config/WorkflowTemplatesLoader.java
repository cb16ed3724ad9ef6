package com.example.agentflow.config;

import com.example.agentflow.service.WorkflowTemplate;
import com.example.agentflow.service.WorkflowTemplateCatalog;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Loads the bundled workflow templates from classpath resources into the {@link WorkflowTemplateCatalog} at startup.
 * A template that cannot be read is logged and left out.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowTemplatesLoader implements ApplicationRunner {

    private static final String TEMPLATES_DIR = "templates/";
    private static final List<String> TEMPLATE_FILES = List.of(
            "github-to-slack.json",
            "code-review-workflow.json"
    );

    private final WorkflowTemplateCatalog catalog;
    private final JsonMapper jsonMapper;

    @Override
    public void run(ApplicationArguments args) {
        for (String filename : TEMPLATE_FILES) {
            loadTemplate(TEMPLATES_DIR + filename);
        }
        log.info("Workflow templates available: {}", catalog.keys());
    }

    private void loadTemplate(String path) {
        Resource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            log.warn("Workflow template resource not found: {}", path);
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            WorkflowTemplate template = jsonMapper.readValue(in, WorkflowTemplate.class);
            catalog.register(template);
        } catch (JacksonException e) {
            log.error("Failed to parse workflow template {}: {}", path, e.getMessage());
        } catch (IOException e) {
            log.error("Failed to read workflow template {}: {}", path, e.getMessage());
        }
    }
}
