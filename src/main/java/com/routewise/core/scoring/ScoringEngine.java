package com.routewise.core.scoring;

import com.routewise.core.analysis.KeywordTables;
import com.routewise.core.model.HandlerDescriptor;
import com.routewise.core.model.MatchLevel;
import com.routewise.core.model.Score;
import com.routewise.core.model.TaskProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes how well each handler fits a {@link TaskProfile}.
 * <p>
 * The confidence is a weighted average of three kinds of terms:
 * <ul>
 *   <li>one term per task type, valued by {@link MatchLevel}; the primary task type weighs 2, the rest 1</li>
 *   <li>one term per detected domain, valued by the handler's domain affinity, weight 0.5</li>
 *   <li>one capability-overlap term (fraction of profile keywords found in the handler's tags), weight 0.3</li>
 * </ul>
 * The weighted total is boosted by 1.2 when any task type is a primary-level match, multiplied by
 * the handler's complexity adjustment, divided by the total weight and clamped to [0, 1].
 * Scoring is pure and never fails.
 */
@Service
public class ScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    static final double PRIMARY_TASK_WEIGHT = 2.0;
    static final double OTHER_TASK_WEIGHT = 1.0;
    static final double DOMAIN_WEIGHT = 0.5;
    static final double OVERLAP_WEIGHT = 0.3;
    static final double PRIMARY_MATCH_THRESHOLD = 0.90;
    static final double PRIMARY_MATCH_BOOST = 1.2;
    static final double STRONG_FIT_THRESHOLD = 0.7;
    static final double EFFICIENCY_FACTOR = 0.9;

    /**
     * Scores every handler in the given order. The output order matches the input order,
     * which {@link com.routewise.core.selection.Selector} relies on for tie-breaking.
     */
    public List<Score> scoreAll(TaskProfile profile, List<HandlerDescriptor> handlers) {
        var scores = new ArrayList<Score>(handlers.size());
        for (var handler : handlers) {
            scores.add(score(profile, handler));
        }
        return scores;
    }

    public Score score(TaskProfile profile, HandlerDescriptor handler) {
        Set<String> tagTerms = tagTerms(handler);

        double total = 0.0;
        double weight = 0.0;
        boolean primaryLevelMatch = false;
        var reasons = new ArrayList<String>();

        List<String> taskTypes = profile.taskTypes();
        for (int i = 0; i < taskTypes.size(); i++) {
            String taskType = taskTypes.get(i);
            double confidence = matchLevel(taskType, handler, tagTerms).confidence();
            double w = i == 0 ? PRIMARY_TASK_WEIGHT : OTHER_TASK_WEIGHT;
            total += confidence * w;
            weight += w;
            if (confidence >= PRIMARY_MATCH_THRESHOLD) {
                primaryLevelMatch = true;
            }
            if (confidence > STRONG_FIT_THRESHOLD) {
                reasons.add("Strong fit for " + taskType);
            }
        }

        for (String domain : profile.domains()) {
            total += handler.affinityFor(domain) * DOMAIN_WEIGHT;
            weight += DOMAIN_WEIGHT;
        }

        total += capabilityOverlap(profile, tagTerms) * OVERLAP_WEIGHT;
        weight += OVERLAP_WEIGHT;

        if (primaryLevelMatch) {
            total *= PRIMARY_MATCH_BOOST;
        }
        total *= handler.adjustmentFor(profile.complexity());

        double average = weight > 0 ? total / weight : 0.0;
        double confidence = Math.max(0.0, Math.min(1.0, average));
        String reasoning = reasons.isEmpty() ? handler.id() + " evaluation" : String.join(", ", reasons);

        log.debug("Scored handler {}: confidence={} (raw={}): {}", handler.id(),
                String.format("%.3f", confidence), String.format("%.3f", average), reasoning);
        return new Score(handler.id(), confidence, reasoning, average * EFFICIENCY_FACTOR);
    }

    /**
     * Classifies how the handler relates to a single task type.
     */
    public MatchLevel matchLevel(String taskType, HandlerDescriptor handler) {
        return matchLevel(taskType, handler, tagTerms(handler));
    }

    private MatchLevel matchLevel(String taskType, HandlerDescriptor handler, Set<String> tagTerms) {
        if (handler.primaryTaskTypes().contains(taskType)) {
            return MatchLevel.PRIMARY;
        }
        if (handler.secondaryTaskTypes().contains(taskType)) {
            return MatchLevel.SECONDARY;
        }
        if (tagTerms.contains(taskType)) {
            return MatchLevel.CAPABILITY_OVERLAP;
        }
        for (String keyword : KeywordTables.keywordsForTaskType(taskType)) {
            if (tagTerms.contains(keyword)) {
                return MatchLevel.CAPABILITY_OVERLAP;
            }
        }
        return MatchLevel.NONE;
    }

    /**
     * Fraction of the profile's task types and matched keywords found among the handler's tags.
     */
    double capabilityOverlap(TaskProfile profile, Set<String> tagTerms) {
        var terms = new LinkedHashSet<String>(profile.taskTypes());
        terms.addAll(profile.keywords());
        if (terms.isEmpty()) {
            return 0.0;
        }
        long found = terms.stream().filter(tagTerms::contains).count();
        return (double) found / terms.size();
    }

    /**
     * Whole tags plus their hyphen/dot separated tokens, so "ui-design" also offers "ui" and "design".
     */
    static Set<String> tagTerms(HandlerDescriptor handler) {
        var terms = new LinkedHashSet<String>();
        for (String tag : handler.tags()) {
            terms.add(tag);
            for (String token : tag.split("[-._/\\s]+")) {
                if (!token.isBlank()) {
                    terms.add(token);
                }
            }
        }
        return terms;
    }
}
