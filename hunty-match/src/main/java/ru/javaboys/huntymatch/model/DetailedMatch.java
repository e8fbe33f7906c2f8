package ru.javaboys.huntymatch.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Complete result of scoring one resume against one job.
 */
@Value
@Builder
public class DetailedMatch {

    String jobTitle;
    String company;
    Integer salary;
    String location;

    @NonNull ScoreBreakdown scoreBreakdown;

    String overallExplanation;
    @NonNull List<String> strengths;
    @NonNull List<String> weaknesses;
    @NonNull MatchTier tier;

    public double getMatchScore() {
        return scoreBreakdown.getTotalScore();
    }

    public String getRecommendation() {
        return tier.getRecommendation();
    }
}
