package ru.javaboys.huntymatch.model;

import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Differentiating bonus part of the match, 20 points max.
 */
@Value
public class BonusScore implements ScoreGroup {

    public static final double MAX_TOTAL = 20.0;

    @NonNull ScoreDetail industryExperience;
    @NonNull ScoreDetail rareSkillsPremium;
    @NonNull ScoreDetail careerTrajectory;

    @Override
    public Map<ScoreDimension, ScoreDetail> details() {
        Map<ScoreDimension, ScoreDetail> details = new EnumMap<>(ScoreDimension.class);
        details.put(ScoreDimension.INDUSTRY_EXPERIENCE, industryExperience);
        details.put(ScoreDimension.RARE_SKILLS_PREMIUM, rareSkillsPremium);
        details.put(ScoreDimension.CAREER_TRAJECTORY, careerTrajectory);
        return Collections.unmodifiableMap(details);
    }

    @Override
    public double getMaxTotal() {
        return MAX_TOTAL;
    }
}
