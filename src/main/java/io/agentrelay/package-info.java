/**
 * AgentRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentrelay.queue.QueueManager} is the task lifecycle API: submit, claim, complete, fail, recover.</li>
 *   <li>{@code io.agentrelay.runtime.WorkerPool} runs one polling loop per agent type.</li>
 *   <li>{@code io.agentrelay.workflow.WorkflowEngine} sequences dependent steps through the queue.</li>
 *   <li>{@code io.agentrelay.storage.TaskStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.agentrelay;
