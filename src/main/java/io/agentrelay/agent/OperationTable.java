package io.agentrelay.agent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Explicit name to operation mapping. Agents declare what they can do up front; nothing is
 * looked up by reflection.
 */
public final class OperationTable implements AgentHandler {
    private final Map<String, Operation> operations;

    private OperationTable(Map<String, Operation> operations) {
        this.operations = Collections.unmodifiableMap(new LinkedHashMap<>(operations));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<Operation> resolveOperation(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(operations.get(name));
    }

    @Override
    public Set<String> operationNames() {
        return operations.keySet();
    }

    public static final class Builder {
        private final Map<String, Operation> operations = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder operation(String name, Operation operation) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("operation name must not be blank");
            }
            if (operation == null) {
                throw new IllegalArgumentException("operation must not be null: " + name);
            }
            if (operations.putIfAbsent(name, operation) != null) {
                throw new IllegalArgumentException("Duplicate operation: " + name);
            }
            return this;
        }

        public OperationTable build() {
            return new OperationTable(operations);
        }
    }
}
