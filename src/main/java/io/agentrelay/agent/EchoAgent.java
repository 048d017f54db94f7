package io.agentrelay.agent;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Built-in demo agent. {@code echo} returns its parameters; {@code fail} always throws,
 * which is handy for exercising the retry path from the command line.
 */
public final class EchoAgent implements AgentHandler {
    public static final String AGENT_TYPE = "echo";

    private final OperationTable operations = OperationTable.builder()
            .operation("echo", this::echo)
            .operation("fail", this::fail)
            .build();

    @Override
    public Optional<Operation> resolveOperation(String name) {
        return operations.resolveOperation(name);
    }

    @Override
    public Set<String> operationNames() {
        return operations.operationNames();
    }

    private Object echo(Map<String, Object> parameters) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("agent", AGENT_TYPE);
        out.put("timestamp", Instant.now().toString());
        out.put("received", parameters);
        return out;
    }

    private Object fail(Map<String, Object> parameters) {
        Object message = parameters.get("message");
        throw new IllegalStateException(message == null ? "echo agent asked to fail" : String.valueOf(message));
    }
}
