package com.routewise.core.analysis;

import com.routewise.core.model.Complexity;
import com.routewise.core.model.Urgency;

import java.util.List;
import java.util.Optional;

/**
 * Static keyword tables driving task analysis. Table order is significant:
 * it breaks ties between equally matched task types, and the first matching
 * tier wins for complexity and urgency.
 */
public final class KeywordTables {

    /**
     * A label and the keywords that indicate it.
     */
    public record Entry<T>(T label, List<String> keywords) {}

    public static final List<Entry<String>> TASK_TYPES = List.of(
            new Entry<>("ui-design", List.of("ui", "design", "interface", "visual", "frontend", "component")),
            new Entry<>("api-development", List.of("api", "endpoint", "backend", "server", "rest", "graphql")),
            new Entry<>("database-design", List.of("database", "data", "model", "schema", "storage", "query")),
            new Entry<>("deployment", List.of("deploy", "host", "publish", "production", "launch", "live")),
            new Entry<>("testing", List.of("test", "qa", "bug", "quality", "validate", "check")),
            new Entry<>("authentication", List.of("auth", "login", "user", "security", "permission")),
            new Entry<>("performance", List.of("performance", "speed", "optimize", "fast", "slow")),
            new Entry<>("styling", List.of("style", "css", "theme", "responsive", "mobile"))
    );

    public static final List<Entry<String>> DOMAINS = List.of(
            new Entry<>("frontend", List.of("ui", "frontend", "client", "browser", "component", "design")),
            new Entry<>("backend", List.of("backend", "server", "api", "service", "logic")),
            new Entry<>("database", List.of("database", "data", "storage", "query", "model")),
            new Entry<>("devops", List.of("deploy", "host", "production", "infrastructure", "ci/cd")),
            new Entry<>("testing", List.of("test", "qa", "quality", "bug", "validate"))
    );

    public static final List<Entry<String>> TECHNOLOGIES = List.of(
            new Entry<>("react", List.of("react", "jsx", "component")),
            new Entry<>("nodejs", List.of("node", "express", "npm")),
            new Entry<>("database", List.of("sql", "mongodb", "database", "db")),
            new Entry<>("testing", List.of("jest", "cypress", "playwright", "test")),
            new Entry<>("deployment", List.of("vercel", "netlify", "heroku", "docker"))
    );

    public static final List<Entry<Complexity>> COMPLEXITY = List.of(
            new Entry<>(Complexity.HIGH, List.of("enterprise", "scale", "complex", "advanced", "multiple", "integration")),
            new Entry<>(Complexity.MEDIUM, List.of("some", "moderate", "intermediate", "several")),
            new Entry<>(Complexity.LOW, List.of("simple", "basic", "quick", "easy", "small"))
    );

    public static final List<Entry<Urgency>> URGENCY = List.of(
            new Entry<>(Urgency.HIGH, List.of("urgent", "asap", "immediately", "critical", "emergency")),
            new Entry<>(Urgency.MEDIUM, List.of("soon", "important", "priority")),
            new Entry<>(Urgency.LOW, List.of("when possible", "eventually", "future"))
    );

    private KeywordTables() {} // utility class

    /**
     * Keywords declared for a task type, empty for types outside the table (e.g. "general").
     */
    public static List<String> keywordsForTaskType(String taskType) {
        return findTaskType(taskType).map(Entry::keywords).orElse(List.of());
    }

    public static Optional<Entry<String>> findTaskType(String taskType) {
        return TASK_TYPES.stream().filter(e -> e.label().equals(taskType)).findFirst();
    }

    /**
     * Counts non-overlapping substring occurrences of a keyword in already lower-cased text,
     * so "apis" counts for "api" and "build" counts for "ui".
     */
    public static int countOccurrences(String lowerText, String keyword) {
        int count = 0;
        int from = lowerText.indexOf(keyword);
        while (from >= 0) {
            count++;
            from = lowerText.indexOf(keyword, from + keyword.length());
        }
        return count;
    }

    public static boolean matches(String lowerText, String keyword) {
        return countOccurrences(lowerText, keyword) > 0;
    }
}
