package ru.javaboys.huntymatch.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

/**
 * Wire form of a match, snake_case as the front end expects it.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DetailedMatchDto {
    private String jobTitle;
    private String company;
    private double matchScore;
    private ScoreBreakdownDto scoreBreakdown;
    private String overallExplanation;
    private List<String> strengths;
    private List<String> weaknesses;
    private String recommendation;
    private String tier;
    private Integer salary;
    private String location;

    @Data
    public static class ScoreBreakdownDto {
        private ScoreGroupDto deterministic;
        private ScoreGroupDto semantic;
        private ScoreGroupDto bonus;
    }
}
