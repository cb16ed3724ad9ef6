package com.example.agentflow.orchestration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RunningWorkflowRegistry")
class RunningWorkflowRegistryTest {

    private final RunningWorkflowRegistry registry = new RunningWorkflowRegistry();
    private final UUID owner = UUID.randomUUID();

    @Test
    @DisplayName("cancels a registered run of the same owner once")
    void cancelOnce() {
        UUID workflowId = UUID.randomUUID();
        CancellationToken token = registry.register(workflowId, owner);

        assertThat(registry.isRunning(workflowId)).isTrue();
        assertThat(registry.cancel(workflowId, owner)).isTrue();
        assertThat(token.isCancelled()).isTrue();
        assertThat(registry.cancel(workflowId, owner)).isFalse();
    }

    @Test
    @DisplayName("refuses to cancel another owner's run")
    void otherOwner() {
        UUID workflowId = UUID.randomUUID();
        CancellationToken token = registry.register(workflowId, owner);

        assertThat(registry.cancel(workflowId, UUID.randomUUID())).isFalse();
        assertThat(token.isCancelled()).isFalse();
    }

    @Test
    @DisplayName("unknown or finished runs cannot be cancelled")
    void notRunning() {
        UUID workflowId = UUID.randomUUID();
        registry.register(workflowId, owner);
        registry.unregister(workflowId);

        assertThat(registry.isRunning(workflowId)).isFalse();
        assertThat(registry.cancel(workflowId, owner)).isFalse();
        assertThat(registry.cancel(UUID.randomUUID(), owner)).isFalse();
        assertThat(registry.size()).isZero();
    }
}
