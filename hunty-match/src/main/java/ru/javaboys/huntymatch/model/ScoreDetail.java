package ru.javaboys.huntymatch.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single bounded sub-score with its explanation.
 * The score is always clamped into {@code [0, maxScore]}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ScoreDetail {

    double score;
    double maxScore;
    String explanation;
    Map<String, Object> metadata;

    public static ScoreDetail of(double score, double maxScore, String explanation) {
        return of(score, maxScore, explanation, Map.of());
    }

    public static ScoreDetail of(double score, double maxScore, String explanation, Map<String, Object> metadata) {
        if (!(maxScore >= 0)) {
            throw new IllegalArgumentException("maxScore must be non-negative: " + maxScore);
        }
        Map<String, Object> copy = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
        return new ScoreDetail(clamp(score, maxScore), maxScore,
                explanation == null ? "" : explanation,
                Collections.unmodifiableMap(copy));
    }

    public static ScoreDetail of(ScoreDimension dimension, double score, String explanation) {
        return of(score, dimension.getMaxScore(), explanation);
    }

    public static ScoreDetail of(ScoreDimension dimension, double score, String explanation, Map<String, Object> metadata) {
        return of(score, dimension.getMaxScore(), explanation, metadata);
    }

    /**
     * Zero score for a dimension whose evaluation failed.
     */
    public static ScoreDetail failed(ScoreDimension dimension, String message) {
        return of(0.0, dimension.getMaxScore(), "error: " + message);
    }

    public double getRatio() {
        return maxScore == 0 ? 0.0 : score / maxScore;
    }

    static double clamp(double value, double max) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(max, value));
    }
}
