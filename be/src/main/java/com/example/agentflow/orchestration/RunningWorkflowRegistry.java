package com.example.agentflow.orchestration;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cancellation tokens of the workflows currently running in this process, keyed by workflow id.
 */
@Slf4j
public class RunningWorkflowRegistry {

    private record Entry(UUID ownerId, CancellationToken token) {
    }

    private final Map<UUID, Entry> running = new ConcurrentHashMap<>();

    public CancellationToken register(UUID workflowId, UUID ownerId) {
        CancellationToken token = new CancellationToken();
        running.put(Objects.requireNonNull(workflowId, "workflowId"), new Entry(Objects.requireNonNull(ownerId, "ownerId"), token));
        return token;
    }

    public void unregister(UUID workflowId) {
        running.remove(workflowId);
    }

    public boolean isRunning(UUID workflowId) {
        return running.containsKey(workflowId);
    }

    /**
     * Requests cancellation of a running workflow owned by {@code ownerId}.
     *
     * @return false if the workflow is not running here, belongs to someone else, or was already cancelled
     */
    public boolean cancel(UUID workflowId, UUID ownerId) {
        Entry entry = running.get(workflowId);
        if (entry == null || !entry.ownerId().equals(ownerId)) {
            return false;
        }
        boolean cancelled = entry.token().cancel();
        if (cancelled) {
            log.info("Cancellation requested workflowId={}", workflowId);
        }
        return cancelled;
    }

    public int size() {
        return running.size();
    }
}
