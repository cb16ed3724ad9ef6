package com.example.agentflow.agent.tools;

import dev.langchain4j.agent.tool.P;
import dev.langchain4j.agent.tool.Tool;

/**
 * Tool that counts words and characters of a text.
 */
public class WordCountTool {

    @Tool("Count the words and characters of a text")
    public String countWords(@P("Text to measure") String text) {
        if (text == null || text.isBlank()) {
            return "words=0, characters=0";
        }
        int words = text.trim().split("\\s+").length;
        return "words=" + words + ", characters=" + text.length();
    }
}
