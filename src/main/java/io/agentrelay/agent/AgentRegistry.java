package io.agentrelay.agent;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class AgentRegistry {
    private final Map<String, AgentHandler> handlers = new ConcurrentHashMap<>();

    public void register(String agentType, AgentHandler handler) {
        if (agentType == null || agentType.isBlank()) {
            throw new IllegalArgumentException("agentType must not be blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        handlers.put(agentType.trim(), handler);
    }

    public Optional<AgentHandler> find(String agentType) {
        if (agentType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(agentType));
    }

    public Collection<String> agentTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
