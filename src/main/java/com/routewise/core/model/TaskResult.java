package com.routewise.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a handler returns for a task.
 *
 * @param message     short human-readable summary
 * @param data        handler-specific payload
 * @param annotations router-added metadata (e.g. the primary error when a fallback produced this result)
 */
public record TaskResult(
    String message,
    Map<String, Object> data,
    Map<String, String> annotations
) implements Serializable {

    public static final String PRIMARY_ERROR = "primaryError";
    public static final String PRIMARY_HANDLER = "primaryHandler";

    public TaskResult {
        message = message == null ? "" : message;
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
    }

    public static TaskResult of(String message) {
        return new TaskResult(message, Map.of(), Map.of());
    }

    public TaskResult withAnnotation(String key, String value) {
        var merged = new LinkedHashMap<>(annotations);
        merged.put(key, value == null ? "" : value);
        return new TaskResult(message, data, merged);
    }
}
