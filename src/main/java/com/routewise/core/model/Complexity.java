package com.routewise.core.model;

/**
 * Estimated effort tier of a task, derived from keyword indicators in its description.
 */
public enum Complexity {
    LOW,
    MEDIUM,
    HIGH
}
