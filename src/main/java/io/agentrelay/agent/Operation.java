package io.agentrelay.agent;

import java.util.Map;

/**
 * A single named capability of an agent. The return value is normalised by
 * {@link OperationInvoker} before it is stored as the task result.
 */
@FunctionalInterface
public interface Operation {
    Object invoke(Map<String, Object> parameters) throws Exception;
}
