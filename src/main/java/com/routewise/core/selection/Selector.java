package com.routewise.core.selection;

import com.routewise.core.engine.RoutingException;
import com.routewise.core.model.Alternative;
import com.routewise.core.model.ErrorKind;
import com.routewise.core.model.RoutingDecision;
import com.routewise.core.model.Score;
import com.routewise.core.model.TaskProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks handler scores and turns the best one into a {@link RoutingDecision}.
 * <p>
 * Ranking is a stable descending sort on confidence, so when several handlers share
 * the top confidence the one registered first wins. The minimum confidence only sets
 * {@link RoutingDecision#lowConfidence()}; a decision is always produced.
 */
public class Selector {

    private static final Logger log = LoggerFactory.getLogger(Selector.class);

    static final int MAX_ALTERNATIVES = 2;

    private final double minConfidence;
    private final Clock clock;

    public Selector(double minConfidence) {
        this(minConfidence, Clock.systemUTC());
    }

    public Selector(double minConfidence, Clock clock) {
        this.minConfidence = minConfidence;
        this.clock = clock;
    }

    /**
     * Selects the best-scoring handler.
     *
     * @param scores  one score per registered handler, in registration order
     * @param profile the profile the scores were computed for
     * @return the decision with up to two alternatives
     * @throws RoutingException with {@link ErrorKind#EMPTY_REGISTRY} when {@code scores} is empty
     */
    public RoutingDecision select(List<Score> scores, TaskProfile profile) {
        if (scores == null || scores.isEmpty()) {
            throw new RoutingException(ErrorKind.EMPTY_REGISTRY, "No handlers registered");
        }

        var ranked = new ArrayList<>(scores);
        ranked.sort(Comparator.comparingDouble(Score::confidence).reversed());

        Score selected = ranked.get(0);
        var alternatives = new ArrayList<Alternative>();
        for (Score s : ranked.subList(1, Math.min(ranked.size(), 1 + MAX_ALTERNATIVES))) {
            alternatives.add(new Alternative(s.handlerId(), s.confidence(), s.reasoning()));
        }

        boolean lowConfidence = selected.confidence() < minConfidence;
        if (lowConfidence) {
            log.info("Selected {} below minimum confidence ({} < {}); dispatching anyway",
                    selected.handlerId(), format(selected.confidence()), format(minConfidence));
        } else {
            log.info("Selected {} (confidence: {}%)", selected.handlerId(),
                    String.format("%.1f", selected.confidence() * 100));
        }

        return new RoutingDecision(selected.handlerId(), selected.confidence(), selected.reasoning(),
                alternatives, profile, lowConfidence, Instant.now(clock));
    }

    public double minConfidence() {
        return minConfidence;
    }

    private static String format(double value) {
        return String.format("%.3f", value);
    }
}
