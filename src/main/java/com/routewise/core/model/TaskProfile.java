package com.routewise.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Structured view of a free-text task description, produced fresh per routing call.
 *
 * @param taskTypes    candidate task types, primary first, by match strength (at most 3)
 * @param domains      every domain area with at least one keyword match
 * @param technologies technologies mentioned in the description
 * @param keywords     keywords that matched the task-type table, plus detected technologies
 * @param complexity   estimated complexity tier
 * @param urgency      estimated urgency tier
 */
public record TaskProfile(
    List<String> taskTypes,
    Set<String> domains,
    List<String> technologies,
    Set<String> keywords,
    Complexity complexity,
    Urgency urgency
) implements Serializable {

    public static final String GENERAL_TASK_TYPE = "general";

    public TaskProfile {
        taskTypes = taskTypes == null || taskTypes.isEmpty() ? List.of(GENERAL_TASK_TYPE) : List.copyOf(taskTypes);
        domains = domains == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(domains));
        technologies = technologies == null ? List.of() : List.copyOf(technologies);
        keywords = keywords == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(keywords));
        complexity = complexity == null ? Complexity.MEDIUM : complexity;
        urgency = urgency == null ? Urgency.MEDIUM : urgency;
    }

    /** Profile returned for empty or unmatched input. */
    public static TaskProfile general() {
        return new TaskProfile(List.of(GENERAL_TASK_TYPE), Set.of(), List.of(), Set.of(),
                Complexity.MEDIUM, Urgency.MEDIUM);
    }

    public String primaryTaskType() {
        return taskTypes.get(0);
    }

    /**
     * True when the request spans enough task types or domains that more than one
     * handler could reasonably contribute. Informational only; routing still picks one.
     */
    public boolean multiHandlerSuggested() {
        return taskTypes.size() > 2 || domains.size() > 2;
    }
}
