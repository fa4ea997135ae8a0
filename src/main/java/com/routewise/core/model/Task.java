package com.routewise.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * The unit of work handed to a handler. Opaque to the router beyond its description.
 *
 * @param id          caller-assigned identifier (e.g., "TASK-001")
 * @param description free-text description of what should be done
 * @param attributes  arbitrary caller data passed through to the handler
 */
public record Task(
    String id,
    String description,
    Map<String, Object> attributes
) implements Serializable {

    public Task {
        description = description == null ? "" : description;
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static Task of(String id, String description) {
        return new Task(id, description, Map.of());
    }
}
