package com.routewise.core.analysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeywordTablesTest {

    @Test
    @DisplayName("short keywords match inside longer words")
    void shortKeywordsMatchSubstrings() {
        assertEquals(1, KeywordTables.countOccurrences("polish the ui today", "ui"));
        assertEquals(1, KeywordTables.countOccurrences("build the pipeline", "ui"));
        assertEquals(2, KeywordTables.countOccurrences("build uis", "ui"));
        assertEquals(1, KeywordTables.countOccurrences("write apis", "api"));
        assertEquals(1, KeywordTables.countOccurrences("qa-ready release", "qa"));
    }

    @Test
    @DisplayName("longer keywords match as substrings, non-overlapping")
    void longKeywordsMatchSubstrings() {
        assertEquals(2, KeywordTables.countOccurrences("testing the tests", "test"));
        assertEquals(1, KeywordTables.countOccurrences("authentication", "auth"));
        assertEquals(2, KeywordTables.countOccurrences("aaaa", "aa"));
        assertEquals(0, KeywordTables.countOccurrences("nothing here", "deploy"));
    }

    @Test
    @DisplayName("keywordsForTaskType returns table keywords, empty for unknown types")
    void keywordsForTaskType() {
        assertTrue(KeywordTables.keywordsForTaskType("authentication").contains("login"));
        assertTrue(KeywordTables.keywordsForTaskType("general").isEmpty());
        assertTrue(KeywordTables.findTaskType("styling").isPresent());
    }

    @Test
    @DisplayName("task type table keeps its declared order")
    void taskTypeOrder() {
        assertEquals("ui-design", KeywordTables.TASK_TYPES.get(0).label());
        assertEquals("styling", KeywordTables.TASK_TYPES.get(KeywordTables.TASK_TYPES.size() - 1).label());
    }
}
