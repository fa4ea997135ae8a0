package com.routewise.core.dispatch;

import com.routewise.core.model.ExecutionOutcome;
import com.routewise.core.model.TaskResult;

/**
 * What {@link ExecutionDispatcher#dispatch} produced.
 *
 * @param outcome the recorded outcome
 * @param result  the handler result; null unless {@code outcome.success()}
 * @param failure the last handler exception (fallback error, with the primary error suppressed); null when none
 */
public record DispatchResult(
    ExecutionOutcome outcome,
    TaskResult result,
    Throwable failure
) {}
