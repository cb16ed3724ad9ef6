package com.example.agentflow.api;

import lombok.Getter;

import java.util.Collection;

@Getter
public class TemplateNotFoundException extends RuntimeException {

    private final String templateKey;

    public TemplateNotFoundException(String templateKey, Collection<String> available) {
        super("Template '" + templateKey + "' not found. Available templates: " + available);
        this.templateKey = templateKey;
    }
}
