package com.hivemind.core.execution;

import com.hivemind.core.model.Agent;
import com.hivemind.core.model.Task;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Hands a bound task to the agents that will perform it.
 * <p>
 * This is the seam between scheduling and real work: the orchestrator awaits the
 * returned future but never looks inside. Implementations must return promptly;
 * the call is made while the orchestrator holds its state lock. The task and agents
 * passed in are detached copies.
 */
@FunctionalInterface
public interface TaskDispatcher {

    CompletableFuture<DispatchResult> dispatch(Task task, List<Agent> agents);
}
