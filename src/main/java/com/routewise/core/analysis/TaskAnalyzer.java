package com.routewise.core.analysis;

import com.routewise.core.model.Complexity;
import com.routewise.core.model.TaskProfile;
import com.routewise.core.model.Urgency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Converts a free-text task description into a {@link TaskProfile} using the
 * static tables in {@link KeywordTables}. Matching is case-insensitive and
 * deterministic; analysis never fails.
 */
@Service
public class TaskAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TaskAnalyzer.class);

    /** Maximum number of task types kept in a profile. */
    static final int MAX_TASK_TYPES = 3;

    private record Candidate(String taskType, int matchCount, List<String> matchedKeywords) {}

    /**
     * Analyzes the given description.
     *
     * @param text the task description; null or blank yields {@link TaskProfile#general()}
     * @return the structured profile
     */
    public TaskProfile analyze(String text) {
        if (text == null || text.isBlank()) {
            return TaskProfile.general();
        }

        String lowerText = text.toLowerCase();

        var candidates = new ArrayList<Candidate>();
        for (var entry : KeywordTables.TASK_TYPES) {
            int count = 0;
            var matched = new ArrayList<String>();
            for (String keyword : entry.keywords()) {
                int occurrences = KeywordTables.countOccurrences(lowerText, keyword);
                if (occurrences > 0) {
                    count += occurrences;
                    matched.add(keyword);
                }
            }
            if (count > 0) {
                candidates.add(new Candidate(entry.label(), count, matched));
            }
        }
        // List.sort is stable: equal counts keep table order
        candidates.sort(Comparator.comparingInt(Candidate::matchCount).reversed());

        var taskTypes = new ArrayList<String>();
        var keywords = new LinkedHashSet<String>();
        for (var candidate : candidates.subList(0, Math.min(MAX_TASK_TYPES, candidates.size()))) {
            taskTypes.add(candidate.taskType());
            keywords.addAll(candidate.matchedKeywords());
        }

        List<String> technologies = labelsMatching(lowerText, KeywordTables.TECHNOLOGIES);
        keywords.addAll(technologies);

        var profile = new TaskProfile(
                taskTypes,
                new LinkedHashSet<>(labelsMatching(lowerText, KeywordTables.DOMAINS)),
                technologies,
                keywords,
                firstTier(lowerText, KeywordTables.COMPLEXITY, Complexity.MEDIUM),
                firstTier(lowerText, KeywordTables.URGENCY, Urgency.MEDIUM));

        log.debug("Analyzed task: types={}, domains={}, technologies={}, complexity={}, urgency={}",
                profile.taskTypes(), profile.domains(), profile.technologies(),
                profile.complexity(), profile.urgency());
        return profile;
    }

    private static List<String> labelsMatching(String lowerText, List<KeywordTables.Entry<String>> table) {
        var labels = new ArrayList<String>();
        for (var entry : table) {
            if (entry.keywords().stream().anyMatch(k -> KeywordTables.matches(lowerText, k))) {
                labels.add(entry.label());
            }
        }
        return labels;
    }

    private static <T> T firstTier(String lowerText, List<KeywordTables.Entry<T>> table, T fallback) {
        for (var entry : table) {
            if (entry.keywords().stream().anyMatch(k -> KeywordTables.matches(lowerText, k))) {
                return entry.label();
            }
        }
        return fallback;
    }
}
