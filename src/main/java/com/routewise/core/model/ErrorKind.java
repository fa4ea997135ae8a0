package com.routewise.core.model;

/**
 * Failure taxonomy for a routing call.
 */
public enum ErrorKind {
    /** No handlers registered; fatal for the call, nothing is dispatched or recorded. */
    EMPTY_REGISTRY,
    /** Primary handler failed; recovered by the fallback handler. */
    HANDLER_EXECUTION_ERROR,
    /** Primary and fallback handler both failed. */
    COMPLETE_ROUTING_FAILURE,
    /** Caller cancelled the dispatch before the handler returned. */
    CANCELLED
}
