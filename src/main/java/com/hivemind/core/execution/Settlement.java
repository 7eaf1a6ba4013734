package com.hivemind.core.execution;

import com.hivemind.core.model.Adaptation;
import com.hivemind.core.model.Task;

import java.util.List;

/**
 * What happened when an execution outcome was applied.
 *
 * @param task        the live task after bookkeeping
 * @param outcome     final disposition of this attempt
 * @param result      the dispatcher's report
 * @param agentIds    agents released by this settlement
 * @param adaptations capability level changes applied across those agents
 */
public record Settlement(
    Task task,
    Outcome outcome,
    DispatchResult result,
    List<String> agentIds,
    List<Adaptation> adaptations
) {

    public enum Outcome {
        COMPLETED,
        FAILED,
        /** Critical task failed and went back to the front of the queue. */
        REQUEUED,
        /** Critical task failed with no retries left; terminal. */
        RETRIES_EXHAUSTED
    }

    public boolean succeeded() {
        return outcome == Outcome.COMPLETED;
    }
}
