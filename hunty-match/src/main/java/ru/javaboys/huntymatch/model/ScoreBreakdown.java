package ru.javaboys.huntymatch.model;

import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

@Value
public class ScoreBreakdown {

    public static final double MAX_SCORE = 100.0;

    @NonNull DeterministicScore deterministic;
    @NonNull SemanticScore semantic;
    @NonNull BonusScore bonus;

    public double getTotalScore() {
        return deterministic.getTotal() + semantic.getTotal() + bonus.getTotal();
    }

    /**
     * All twelve sub-scores in display order.
     */
    public Map<ScoreDimension, ScoreDetail> allDetails() {
        Map<ScoreDimension, ScoreDetail> all = new EnumMap<>(ScoreDimension.class);
        all.putAll(deterministic.details());
        all.putAll(semantic.details());
        all.putAll(bonus.details());
        return Collections.unmodifiableMap(all);
    }

    public ScoreDetail get(ScoreDimension dimension) {
        return allDetails().get(dimension);
    }
}
