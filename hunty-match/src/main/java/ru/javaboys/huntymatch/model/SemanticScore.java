package ru.javaboys.huntymatch.model;

import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Oracle-judged qualitative part of the match, 40 points max.
 */
@Value
public class SemanticScore implements ScoreGroup {

    public static final double MAX_TOTAL = 40.0;

    @NonNull ScoreDetail softSkillsMatch;
    @NonNull ScoreDetail cultureFit;
    @NonNull ScoreDetail growthPotential;
    @NonNull ScoreDetail projectRelevance;

    @Override
    public Map<ScoreDimension, ScoreDetail> details() {
        Map<ScoreDimension, ScoreDetail> details = new EnumMap<>(ScoreDimension.class);
        details.put(ScoreDimension.SOFT_SKILLS_MATCH, softSkillsMatch);
        details.put(ScoreDimension.CULTURE_FIT, cultureFit);
        details.put(ScoreDimension.GROWTH_POTENTIAL, growthPotential);
        details.put(ScoreDimension.PROJECT_RELEVANCE, projectRelevance);
        return Collections.unmodifiableMap(details);
    }

    @Override
    public double getMaxTotal() {
        return MAX_TOTAL;
    }
}
