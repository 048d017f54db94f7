/**
 * Execution side of the queue.
 *
 * <p>{@link io.agentrelay.runtime.WorkerPool} runs one polling loop per registered agent
 * type and maps operation outcomes onto queue transitions.
 * {@link io.agentrelay.runtime.AgentRelayRuntime} wires storage, queue, agents, workers and
 * the audit log together for the CLI and for embedding applications.
 */
package io.agentrelay.runtime;
