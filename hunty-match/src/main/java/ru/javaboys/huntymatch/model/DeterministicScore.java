package ru.javaboys.huntymatch.model;

import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Rule-based part of the match, 40 points max.
 */
@Value
public class DeterministicScore implements ScoreGroup {

    public static final double MAX_TOTAL = 40.0;

    @NonNull ScoreDetail skillsMatching;
    @NonNull ScoreDetail experienceYears;
    @NonNull ScoreDetail educationMatch;
    @NonNull ScoreDetail salaryFit;
    @NonNull ScoreDetail locationMatch;

    @Override
    public Map<ScoreDimension, ScoreDetail> details() {
        Map<ScoreDimension, ScoreDetail> details = new EnumMap<>(ScoreDimension.class);
        details.put(ScoreDimension.SKILLS_MATCHING, skillsMatching);
        details.put(ScoreDimension.EXPERIENCE_YEARS, experienceYears);
        details.put(ScoreDimension.EDUCATION_MATCH, educationMatch);
        details.put(ScoreDimension.SALARY_FIT, salaryFit);
        details.put(ScoreDimension.LOCATION_MATCH, locationMatch);
        return Collections.unmodifiableMap(details);
    }

    @Override
    public double getMaxTotal() {
        return MAX_TOTAL;
    }
}
