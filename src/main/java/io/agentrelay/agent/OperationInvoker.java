package io.agentrelay.agent;

import io.agentrelay.agent.OperationOutcome.ErrorKind;
import io.agentrelay.model.Task;
import io.agentrelay.util.Jsons;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves a task's operation on its agent, runs it and turns the return value into a
 * JSON object suitable for storage.
 *
 * <p>Normalisation: a map is kept as is, {@code null} becomes an empty object, strings,
 * numbers, booleans, enums, collections and arrays are wrapped as {@code {"result": value}},
 * and any other object is converted through Jackson.
 */
public final class OperationInvoker {
    public static final String RESULT_KEY = "result";

    private OperationInvoker() {
    }

    public static OperationOutcome invoke(String agentType, AgentHandler handler, Task task) {
        Optional<Operation> operation = handler.resolveOperation(task.operation());
        if (operation.isEmpty()) {
            return OperationOutcome.error(ErrorKind.CONFIGURATION,
                    notFoundMessage(task.operation(), agentType));
        }
        Map<String, Object> parameters = task.parameters() == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(task.parameters());
        Object raw;
        try {
            raw = operation.get().invoke(parameters);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OperationOutcome.error(ErrorKind.HANDLER, "Interrupted: " + describe(e));
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            return OperationOutcome.error(ErrorKind.HANDLER, describe(e));
        }
        try {
            return OperationOutcome.ok(normalize(raw));
        } catch (IllegalArgumentException e) {
            return OperationOutcome.error(ErrorKind.HANDLER,
                    "Result of operation '" + task.operation() + "' is not JSON-serializable: " + e.getMessage());
        }
    }

    public static String notFoundMessage(String operation, String agentType) {
        return "Operation '" + operation + "' not found on agent '" + agentType + "'";
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> normalize(Object raw) {
        if (raw == null) {
            return new LinkedHashMap<>();
        }
        if (raw instanceof Map<?, ?> map) {
            return Jsons.roundTrip((Map<String, ?>) map);
        }
        if (raw instanceof CharSequence || raw instanceof Number || raw instanceof Boolean
                || raw instanceof Character || raw instanceof Enum<?>
                || raw instanceof Collection<?> || raw.getClass().isArray()) {
            Map<String, Object> wrapped = new LinkedHashMap<>();
            wrapped.put(RESULT_KEY, raw);
            return Jsons.roundTrip(wrapped);
        }
        return Jsons.roundTrip(Jsons.convertToMap(raw));
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
