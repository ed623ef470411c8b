package com.filterbench.engine;

import com.filterbench.concurrent.RunContext;
import com.filterbench.model.FilterTask;
import com.filterbench.model.RunOutcome;

import java.util.List;

/**
 * A policy for executing a batch of filter tasks.
 *
 * Implementations return exactly one result per task, keep going when
 * individual tasks fail, record every collected result into the run context,
 * and time the run from first dispatch to last result collected, including
 * pool start-up and teardown.
 */
public interface ExecutionStrategy {

    StrategyType getType();

    /**
     * @throws StrategyExecutionException if the strategy itself cannot run
     *         (pool construction failure, interrupted collection)
     */
    RunOutcome execute(List<FilterTask> tasks, RunContext context);
}
