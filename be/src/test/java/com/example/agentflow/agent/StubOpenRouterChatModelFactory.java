package com.example.agentflow.agent;

import dev.langchain4j.model.chat.ChatModel;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double: always returns the same {@link ChatModel} and remembers the model names asked for.
 */
public class StubOpenRouterChatModelFactory extends OpenRouterChatModelFactory {

    private final ChatModel stub;
    private final List<String> requestedModels = new CopyOnWriteArrayList<>();

    public StubOpenRouterChatModelFactory(ChatModel stub) {
        super("test-key", "https://test", "test-model", Duration.ofSeconds(5));
        this.stub = stub;
    }

    @Override
    public ChatModel build(String modelName) {
        requestedModels.add(modelName);
        return stub;
    }

    public List<String> requestedModels() {
        return List.copyOf(requestedModels);
    }
}
