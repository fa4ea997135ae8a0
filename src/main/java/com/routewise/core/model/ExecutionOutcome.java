package com.routewise.core.model;

import java.io.Serializable;

/**
 * What happened when a routing decision was dispatched.
 *
 * @param success        whether a handler (primary or fallback) produced a result
 * @param durationMs     wall-clock time across primary and fallback attempts
 * @param errorKind      failure classification, null on a clean primary success
 * @param fallbackUsed   whether the fallback handler was invoked
 * @param errorMessage   primary and, where applicable, fallback error messages; null when none
 * @param executedBy     id of the handler whose result was returned, null on failure
 */
public record ExecutionOutcome(
    boolean success,
    long durationMs,
    ErrorKind errorKind,
    boolean fallbackUsed,
    String errorMessage,
    String executedBy
) implements Serializable {

    public static ExecutionOutcome succeeded(String handlerId, long durationMs) {
        return new ExecutionOutcome(true, durationMs, null, false, null, handlerId);
    }

    public static ExecutionOutcome recovered(String fallbackId, long durationMs, String primaryError) {
        return new ExecutionOutcome(true, durationMs, ErrorKind.HANDLER_EXECUTION_ERROR, true,
                primaryError, fallbackId);
    }

    public static ExecutionOutcome failed(long durationMs, boolean fallbackUsed,
                                          String primaryError, String fallbackError) {
        return new ExecutionOutcome(false, durationMs, ErrorKind.COMPLETE_ROUTING_FAILURE, fallbackUsed,
                "primary: " + primaryError + "; fallback: " + fallbackError, null);
    }

    public static ExecutionOutcome cancelled(long durationMs, boolean fallbackUsed) {
        return new ExecutionOutcome(false, durationMs, ErrorKind.CANCELLED, fallbackUsed,
                "Dispatch cancelled", null);
    }
}
