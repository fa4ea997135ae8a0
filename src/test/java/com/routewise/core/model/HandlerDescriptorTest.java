package com.routewise.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HandlerDescriptorTest {

    @Test
    @DisplayName("blank id is rejected")
    void blankId() {
        assertThrows(IllegalArgumentException.class,
                () -> HandlerDescriptor.of(" ", Set.of("ui-design"), Set.of()));
        assertThrows(IllegalArgumentException.class,
                () -> HandlerDescriptor.of(null, Set.of("ui-design"), Set.of()));
    }

    @Test
    @DisplayName("affinity outside [0, 1] is rejected")
    void affinityRange() {
        var ex = assertThrows(IllegalArgumentException.class, () -> new HandlerDescriptor(
                "frontend", "", Set.of(), Set.of(), Set.of(), Set.of(), Map.of("frontend", 1.5), Map.of()));
        assertTrue(ex.getMessage().contains("frontend"));
    }

    @Test
    @DisplayName("negative complexity adjustment is rejected")
    void negativeAdjustment() {
        assertThrows(IllegalArgumentException.class, () -> new HandlerDescriptor(
                "backend", "", Set.of(), Set.of(), Set.of(), Set.of(), Map.of(),
                Map.of(Complexity.HIGH, -0.1)));
    }

    @Test
    @DisplayName("defaults apply for undeclared domains and tiers")
    void defaults() {
        var descriptor = new HandlerDescriptor("backend", null, Set.of("api-development"), Set.of(),
                Set.of("api-development"), Set.of(), Map.of("backend", 0.95), Map.of(Complexity.HIGH, 1.1));

        assertEquals(0.95, descriptor.affinityFor("backend"));
        assertEquals(HandlerDescriptor.DEFAULT_DOMAIN_AFFINITY, descriptor.affinityFor("devops"));
        assertEquals(1.1, descriptor.adjustmentFor(Complexity.HIGH));
        assertEquals(1.0, descriptor.adjustmentFor(Complexity.LOW));
        assertEquals("", descriptor.description());
    }

    @Test
    @DisplayName("tags combine capabilities and tools, lower-cased")
    void tags() {
        var descriptor = new HandlerDescriptor("frontend", "", Set.of("UI-Design"), Set.of("React"),
                Set.of(), Set.of(), Map.of(), Map.of());

        assertEquals(List.of("ui-design", "react"), List.copyOf(descriptor.tags()));
        assertThrows(UnsupportedOperationException.class, () -> descriptor.capabilities().add("x"));
    }
}
