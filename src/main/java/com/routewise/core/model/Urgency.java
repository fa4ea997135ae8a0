package com.routewise.core.model;

public enum Urgency {
    LOW,
    MEDIUM,
    HIGH
}
