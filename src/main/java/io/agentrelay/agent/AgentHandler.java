package io.agentrelay.agent;

import java.util.Optional;
import java.util.Set;

public interface AgentHandler {
    Optional<Operation> resolveOperation(String name);

    Set<String> operationNames();
}
