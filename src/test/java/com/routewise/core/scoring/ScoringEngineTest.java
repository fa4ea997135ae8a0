package com.routewise.core.scoring;

import com.routewise.core.analysis.TaskAnalyzer;
import com.routewise.core.model.Complexity;
import com.routewise.core.model.HandlerDescriptor;
import com.routewise.core.model.MatchLevel;
import com.routewise.core.model.Score;
import com.routewise.core.model.TaskProfile;
import com.routewise.core.model.Urgency;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScoringEngineTest {

    private final ScoringEngine engine = new ScoringEngine();
    private final TaskAnalyzer analyzer = new TaskAnalyzer();

    static final HandlerDescriptor FRONTEND = new HandlerDescriptor("frontend", "UI specialist",
            Set.of("ui-design", "component-creation", "user-experience", "accessibility"),
            Set.of("react", "css"),
            Set.of("ui-design", "styling"), Set.of("accessibility"),
            Map.of("frontend", 0.95, "testing", 0.3, "backend", 0.1),
            Map.of(Complexity.HIGH, 0.9, Complexity.MEDIUM, 1.1, Complexity.LOW, 1.2));

    static final HandlerDescriptor BACKEND = new HandlerDescriptor("backend", "API specialist",
            Set.of("api-development", "server-logic", "authentication", "security"),
            Set.of("node.js", "express", "graphql"),
            Set.of("api-development", "authentication"), Set.of("database-design"),
            Map.of("backend", 0.95, "database", 0.7, "frontend", 0.2),
            Map.of(Complexity.HIGH, 1.1));

    private static TaskProfile profile(List<String> taskTypes, Set<String> domains) {
        return new TaskProfile(taskTypes, domains, List.of(), Set.of(), Complexity.MEDIUM, Urgency.MEDIUM);
    }

    @Nested
    @DisplayName("match levels")
    class MatchLevels {

        @Test
        @DisplayName("declared primary and secondary task types")
        void declaredLevels() {
            assertEquals(MatchLevel.PRIMARY, engine.matchLevel("api-development", BACKEND));
            assertEquals(MatchLevel.SECONDARY, engine.matchLevel("database-design", BACKEND));
        }

        @Test
        @DisplayName("task type keyword among tag tokens is a capability overlap")
        void capabilityOverlap() {
            // "user-experience" yields the token "user", an authentication keyword
            assertEquals(MatchLevel.CAPABILITY_OVERLAP, engine.matchLevel("authentication", FRONTEND));
        }

        @Test
        @DisplayName("unrelated task type is no match")
        void noMatch() {
            assertEquals(MatchLevel.NONE, engine.matchLevel("deployment", FRONTEND));
            assertEquals(MatchLevel.NONE, engine.matchLevel(TaskProfile.GENERAL_TASK_TYPE, BACKEND));
        }
    }

    @Nested
    @DisplayName("confidence")
    class Confidence {

        @Test
        @DisplayName("login form: frontend clamps to 1.0, backend stays below 0.5")
        void loginForm() {
            TaskProfile profile = analyzer.analyze("Create a beautiful login form with modern design");

            Score frontend = engine.score(profile, FRONTEND);
            Score backend = engine.score(profile, BACKEND);

            assertEquals(1.0, frontend.confidence());
            assertTrue(frontend.estimatedEfficiency() > 0.9, "efficiency derives from the unclamped average");
            assertEquals("Strong fit for ui-design", frontend.reasoning());

            assertEquals(1.83 / 3.8, backend.confidence(), 1e-9);
            assertEquals(backend.confidence() * 0.9, backend.estimatedEfficiency(), 1e-9);
            assertEquals("Strong fit for authentication", backend.reasoning());
        }

        @Test
        @DisplayName("handler with no strong fit gets an evaluation reasoning")
        void evaluationReasoning() {
            Score score = engine.score(profile(List.of("deployment"), Set.of()), FRONTEND);
            assertEquals("frontend evaluation", score.reasoning());
        }

        @Test
        @DisplayName("general profile against an undeclared handler uses only default terms")
        void generalProfile() {
            var plain = HandlerDescriptor.of("plain", Set.of("misc"), Set.of());
            Score score = engine.score(TaskProfile.general(), plain);

            // (0.2 * 2 + 0 * 0.3) / 2.3
            assertEquals(0.4 / 2.3, score.confidence(), 1e-9);
        }

        @Test
        @DisplayName("declaring a task type never lowers confidence")
        void monotonicInDeclaration() {
            TaskProfile profile = profile(List.of("api-development"), Set.of("backend"));
            var none = HandlerDescriptor.of("h", Set.of("misc"), Set.of());
            var secondary = new HandlerDescriptor("h", "", Set.of("misc"), Set.of(), Set.of(),
                    Set.of("api-development"), Map.of(), Map.of());
            var primary = HandlerDescriptor.of("h", Set.of("misc"), Set.of("api-development"));

            double c0 = engine.score(profile, none).confidence();
            double c1 = engine.score(profile, secondary).confidence();
            double c2 = engine.score(profile, primary).confidence();
            assertTrue(c0 < c1, c0 + " < " + c1);
            assertTrue(c1 < c2, c1 + " < " + c2);
        }

        @Test
        @DisplayName("complexity adjustment scales the result")
        void complexityAdjustment() {
            var lowProfile = new TaskProfile(List.of("deployment"), Set.of(), List.of(), Set.of(),
                    Complexity.LOW, Urgency.MEDIUM);
            var highProfile = new TaskProfile(List.of("deployment"), Set.of(), List.of(), Set.of(),
                    Complexity.HIGH, Urgency.MEDIUM);

            assertTrue(engine.score(lowProfile, FRONTEND).confidence()
                    > engine.score(highProfile, FRONTEND).confidence());
        }

        @Test
        @DisplayName("scores stay within [0, 1] and are deterministic")
        void boundedAndDeterministic() {
            for (String text : List.of("", "Create a beautiful login form", "Deploy the API to production",
                    "Design a database schema for an enterprise integration", "fix stuff")) {
                TaskProfile profile = analyzer.analyze(text);
                for (var handler : List.of(FRONTEND, BACKEND)) {
                    Score first = engine.score(profile, handler);
                    assertTrue(first.confidence() >= 0.0 && first.confidence() <= 1.0, text);
                    assertEquals(first, engine.score(profile, handler), text);
                }
            }
        }
    }

    @Test
    @DisplayName("scoreAll keeps registry order")
    void scoreAllOrder() {
        var scores = engine.scoreAll(TaskProfile.general(), List.of(BACKEND, FRONTEND));
        assertEquals(List.of("backend", "frontend"), scores.stream().map(Score::handlerId).toList());
    }

    @Test
    @DisplayName("tag terms include whole tags and their tokens")
    void tagTerms() {
        Set<String> terms = ScoringEngine.tagTerms(BACKEND);
        assertTrue(terms.containsAll(Set.of("api-development", "api", "development", "node.js", "node", "js")));
    }

    @Test
    @DisplayName("capability overlap is the fraction of profile terms found in tags")
    void overlapFraction() {
        var profile = new TaskProfile(List.of("ui-design"), Set.of(), List.of(), Set.of("design", "beautiful", "react"),
                Complexity.MEDIUM, Urgency.MEDIUM);
        // ui-design, design, react found; beautiful not
        assertEquals(0.75, engine.capabilityOverlap(profile, ScoringEngine.tagTerms(FRONTEND)), 1e-9);
    }
}
