package com.routewise.core.dispatch;

import com.routewise.core.history.RoutingHistory;
import com.routewise.core.logging.MdcContext;
import com.routewise.core.metrics.RoutingMetrics;
import com.routewise.core.model.ErrorKind;
import com.routewise.core.model.ExecutionOutcome;
import com.routewise.core.model.HistoryRecord;
import com.routewise.core.model.RoutingDecision;
import com.routewise.core.model.Task;
import com.routewise.core.model.TaskResult;
import com.routewise.core.registry.CapabilityRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

/**
 * Invokes the selected handler and applies fallback semantics.
 * <p>
 * Flow:
 * <ol>
 *   <li>Execute the selected handler. On success the outcome is recorded and returned.</li>
 *   <li>On failure, execute the configured fallback handler once. On success the result is
 *       annotated with the primary error and the outcome has {@code fallbackUsed=true}.</li>
 *   <li>If the fallback also fails, the outcome is {@link ErrorKind#COMPLETE_ROUTING_FAILURE}
 *       with both messages preserved.</li>
 * </ol>
 * An interrupt or {@link CancellationException} during either attempt ends the dispatch with
 * {@link ErrorKind#CANCELLED}. A handler {@link Error} is a handler failure like any exception,
 * except {@link VirtualMachineError}, which is recorded and then rethrown. Every dispatch appends
 * exactly one {@link HistoryRecord}.
 * No timeout is imposed here; callers bound latency by cancelling.
 */
public class ExecutionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ExecutionDispatcher.class);

    private final CapabilityRegistry registry;
    private final RoutingHistory history;
    private final String fallbackHandlerId;
    private final RoutingMetrics metrics;

    public ExecutionDispatcher(CapabilityRegistry registry, RoutingHistory history,
                               String fallbackHandlerId, RoutingMetrics metrics) {
        this.registry = registry;
        this.history = history;
        this.fallbackHandlerId = fallbackHandlerId;
        this.metrics = metrics;
    }

    private static final class Cancelled extends Exception {
        Cancelled(Throwable cause) {
            super("Dispatch cancelled", cause);
        }
    }

    public DispatchResult dispatch(RoutingDecision decision, Task task) {
        String selectedId = decision.selectedHandlerId();
        long startedAt = System.nanoTime();

        DispatchResult result;
        Throwable primaryFailure;
        try {
            TaskResult primaryResult = invoke(selectedId, task);
            result = new DispatchResult(ExecutionOutcome.succeeded(selectedId, elapsedMs(startedAt)),
                    primaryResult, null);
            log.info("Handler {} completed task {} in {}ms", selectedId, task.id(), result.outcome().durationMs());
            return record(decision, result, "success");
        } catch (Cancelled e) {
            return record(decision, cancelled(startedAt, false, e), "cancelled");
        } catch (VirtualMachineError e) {
            throw fatal(decision, startedAt, false, describe(e), "not attempted", e);
        } catch (Exception | Error e) {
            primaryFailure = e;
        }

        String primaryError = describe(primaryFailure);
        log.warn("Handler {} failed on task {}: {}; invoking fallback {}",
                selectedId, task.id(), primaryError, fallbackHandlerId);

        String fallbackError;
        Throwable fallbackFailure;
        boolean fallbackInvoked = false;
        if (fallbackHandlerId == null || fallbackHandlerId.equals(selectedId)) {
            fallbackFailure = new IllegalStateException(
                    "fallback handler '" + fallbackHandlerId + "' is the failed primary handler");
        } else if (registry.find(fallbackHandlerId).isEmpty()) {
            fallbackFailure = new IllegalStateException(
                    "fallback handler '" + fallbackHandlerId + "' is not registered");
        } else {
            fallbackInvoked = true;
            MdcContext.setHandler(fallbackHandlerId);
            try {
                TaskResult fallbackResult = invoke(fallbackHandlerId, task)
                        .withAnnotation(TaskResult.PRIMARY_HANDLER, selectedId)
                        .withAnnotation(TaskResult.PRIMARY_ERROR, primaryError);
                if (metrics != null) {
                    metrics.recordFallback(selectedId);
                }
                log.info("Fallback {} recovered task {} after {} failed", fallbackHandlerId, task.id(), selectedId);
                result = new DispatchResult(
                        ExecutionOutcome.recovered(fallbackHandlerId, elapsedMs(startedAt), primaryError),
                        fallbackResult, primaryFailure);
                return record(decision, result, "fallback");
            } catch (Cancelled e) {
                return record(decision, cancelled(startedAt, true, e), "cancelled");
            } catch (VirtualMachineError e) {
                throw fatal(decision, startedAt, true, primaryError, describe(e), e);
            } catch (Exception | Error e) {
                fallbackFailure = e;
            } finally {
                MdcContext.setHandler(selectedId);
            }
        }

        fallbackError = describe(fallbackFailure);
        fallbackFailure.addSuppressed(primaryFailure);
        log.error("Complete routing failure for task {}: primary {} failed ({}), fallback failed ({})",
                task.id(), selectedId, primaryError, fallbackError);
        result = new DispatchResult(
                ExecutionOutcome.failed(elapsedMs(startedAt), fallbackInvoked, primaryError, fallbackError),
                null, fallbackFailure);
        return record(decision, result, "failure");
    }

    public String fallbackHandlerId() {
        return fallbackHandlerId;
    }

    private TaskResult invoke(String handlerId, Task task) throws Exception {
        var registration = registry.find(handlerId)
                .orElseThrow(() -> new IllegalStateException("Handler not registered: " + handlerId));
        if (Thread.currentThread().isInterrupted()) {
            throw new Cancelled(null);
        }
        try {
            TaskResult result = registration.handler().execute(task);
            if (result == null) {
                throw new IllegalStateException("Handler " + handlerId + " returned no result");
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new Cancelled(e);
        } catch (CancellationException e) {
            throw new Cancelled(e);
        } catch (Exception e) {
            // handlers that wrap an interrupt still leave the flag set
            if (Thread.currentThread().isInterrupted()) {
                throw new Cancelled(e);
            }
            throw e;
        }
    }

    /**
     * Records a failure for a JVM-level error before it propagates to the caller.
     */
    private VirtualMachineError fatal(RoutingDecision decision, long startedAt, boolean fallbackInvoked,
                                      String primaryError, String fallbackError, VirtualMachineError error) {
        log.error("Dispatch of {} aborted by {}", decision.selectedHandlerId(), error.toString());
        record(decision, new DispatchResult(
                ExecutionOutcome.failed(elapsedMs(startedAt), fallbackInvoked, primaryError, fallbackError),
                null, error), "failure");
        return error;
    }

    private DispatchResult cancelled(long startedAt, boolean fallbackUsed, Cancelled cause) {
        log.warn("Dispatch cancelled after {}ms", elapsedMs(startedAt));
        return new DispatchResult(ExecutionOutcome.cancelled(elapsedMs(startedAt), fallbackUsed), null,
                cause.getCause() != null ? cause.getCause() : cause);
    }

    private DispatchResult record(RoutingDecision decision, DispatchResult result, String outcomeTag) {
        history.append(new HistoryRecord(decision, result.outcome(), Instant.now()));
        if (metrics != null) {
            metrics.recordDispatch(decision.selectedHandlerId(), outcomeTag, result.outcome().durationMs());
            if (result.outcome().errorKind() == ErrorKind.COMPLETE_ROUTING_FAILURE
                    || result.outcome().errorKind() == ErrorKind.CANCELLED) {
                metrics.recordFailure(result.outcome().errorKind());
            }
        }
        return result;
    }

    private static long elapsedMs(long startedAt) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message != null && !message.isBlank() ? message : t.getClass().getSimpleName();
    }
}
