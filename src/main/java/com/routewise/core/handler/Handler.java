package com.routewise.core.handler;

import com.routewise.core.model.Task;
import com.routewise.core.model.TaskResult;

/**
 * Execution contract every routable handler implements, including the fallback handler.
 * <p>
 * The router treats the work as opaque: it only observes whether {@link #execute}
 * returns or throws, and how long it took. Handlers that block should respond to
 * thread interruption so callers can cancel a dispatch.
 */
@FunctionalInterface
public interface Handler {

    /**
     * Performs the task.
     *
     * @param task the task to execute
     * @return the handler's result
     * @throws Exception any failure; the router catches it and applies fallback semantics
     */
    TaskResult execute(Task task) throws Exception;

    /**
     * Lightweight self-check used for health reporting. Throws when the handler cannot serve.
     */
    default void selfCheck() throws Exception {
    }
}
