package io.agentrelay.queue;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owner stamp written onto every claimed task.
 *
 * <p>An owner counts as live while its queue manager is open in this JVM, or, for claims
 * made by another process, while that process is still running. Claims without an owner
 * are treated as abandoned.
 */
public record WorkerIdentity(String instanceId, long pid) {
    private static final Set<String> LIVE_INSTANCES = ConcurrentHashMap.newKeySet();

    static WorkerIdentity register() {
        WorkerIdentity identity = new WorkerIdentity(UUID.randomUUID().toString(), ProcessHandle.current().pid());
        LIVE_INSTANCES.add(identity.instanceId());
        return identity;
    }

    void release() {
        LIVE_INSTANCES.remove(instanceId);
    }

    public static boolean isLive(String instanceId, Long pid) {
        if (instanceId == null || instanceId.isBlank() || pid == null) {
            return false;
        }
        if (LIVE_INSTANCES.contains(instanceId)) {
            return true;
        }
        if (pid == ProcessHandle.current().pid()) {
            return false;
        }
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }
}
