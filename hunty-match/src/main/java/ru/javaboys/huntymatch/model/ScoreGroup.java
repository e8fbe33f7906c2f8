package ru.javaboys.huntymatch.model;

import java.util.Map;

/**
 * Group of sub-scores (deterministic, semantic or bonus) summed into one bounded total.
 */
public interface ScoreGroup {

    /**
     * Sub-scores keyed by dimension, in display order.
     */
    Map<ScoreDimension, ScoreDetail> details();

    double getMaxTotal();

    default double getTotal() {
        double total = 0.0;
        for (ScoreDetail detail : details().values()) {
            total += detail.getScore();
        }
        return Math.min(getMaxTotal(), total);
    }
}
