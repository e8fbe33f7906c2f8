package ru.javaboys.huntymatch.scoring;

import org.junit.jupiter.api.Test;
import ru.javaboys.huntymatch.MatchEngineFixture;
import ru.javaboys.huntymatch.ai.ScriptedOracleService;
import ru.javaboys.huntymatch.model.SemanticScore;

import static org.assertj.core.api.Assertions.assertThat;

class SemanticScorerTest {

    @Test
    void should_ScoreEachDimensionWithItsOwnConversation() {
        ScriptedOracleService oracle = ScriptedOracleService.available()
                .on("Analyze the soft skills match", "SCORE: 12/15\nEXPLANATION: Reliable and autonomous.")
                .on("culture fit between", "SCORE: 8\nEXPLANATION: Values aligned.")
                .on("growth potential for a role", "SCORE: 6\nEXPLANATION: Some training.")
                .on("relevance of the candidate's past projects", "SCORE: 4\nEXPLANATION: Regional deliveries.");
        SemanticScorer scorer = MatchEngineFixture.with(oracle).semanticScorer;

        SemanticScore score = scorer.score("m1", MatchEngineFixture.truckDriverJob(),
                MatchEngineFixture.TRUCK_DRIVER_RESUME);

        assertThat(score.getSoftSkillsMatch().getScore()).isEqualTo(12.0);
        assertThat(score.getSoftSkillsMatch().getExplanation()).isEqualTo("Reliable and autonomous.");
        assertThat(score.getCultureFit().getScore()).isEqualTo(8.0);
        assertThat(score.getGrowthPotential().getScore()).isEqualTo(6.0);
        assertThat(score.getProjectRelevance().getScore()).isEqualTo(4.0);
        assertThat(score.getTotal()).isEqualTo(30.0);
        assertThat(oracle.getConversationIds()).containsExactly(
                "m1-soft_skills_match", "m1-culture_fit", "m1-growth_potential", "m1-project_relevance");
    }

    @Test
    void should_ClampOutOfRangeAnswers() {
        ScriptedOracleService oracle = ScriptedOracleService.available()
                .on("Analyze the soft skills match", "SCORE: 40")
                .on("culture fit between", "SCORE: 10")
                .on("growth potential for a role", "SCORE: 10")
                .on("relevance of the candidate's past projects", "SCORE: 12");

        SemanticScore score = MatchEngineFixture.with(oracle).semanticScorer
                .score("m1", MatchEngineFixture.truckDriverJob(), "resume");

        assertThat(score.getSoftSkillsMatch().getScore()).isEqualTo(15.0);
        assertThat(score.getProjectRelevance().getScore()).isEqualTo(5.0);
        assertThat(score.getTotal()).isEqualTo(SemanticScore.MAX_TOTAL);
    }

    @Test
    void should_FlagSalvagedScore_When_NoScoreLine() {
        ScriptedOracleService oracle = ScriptedOracleService.available()
                .on("Analyze the soft skills match", "I'd say 9 out of 15.")
                .on("culture fit between", "SCORE: 5")
                .on("growth potential for a role", "SCORE: 5")
                .on("relevance of the candidate's past projects", "SCORE: 2");

        SemanticScore score = MatchEngineFixture.with(oracle).semanticScorer
                .score("m1", MatchEngineFixture.truckDriverJob(), "resume");

        assertThat(score.getSoftSkillsMatch().getScore()).isEqualTo(9.0);
        assertThat(score.getSoftSkillsMatch().getMetadata()).containsEntry("salvaged", true);
        assertThat(score.getCultureFit().getMetadata()).doesNotContainKey("salvaged");
    }

    @Test
    void should_ZeroOnlyTheFailedDimension() {
        ScriptedOracleService oracle = ScriptedOracleService.available()
                .on("Analyze the soft skills match", "SCORE: 10")
                .failOn("culture fit between", "rate limit exceeded")
                .on("growth potential for a role", "SCORE: 7")
                .on("relevance of the candidate's past projects", "SCORE: 3");

        SemanticScore score = MatchEngineFixture.with(oracle).semanticScorer
                .score("m1", MatchEngineFixture.truckDriverJob(), "resume");

        assertThat(score.getCultureFit().getScore()).isZero();
        assertThat(score.getCultureFit().getExplanation()).isEqualTo("error: rate limit exceeded");
        assertThat(score.getTotal()).isEqualTo(20.0);
    }

    @Test
    void should_ZeroEverything_When_OracleUnavailable() {
        SemanticScore score = MatchEngineFixture.with(ScriptedOracleService.unavailable()).semanticScorer
                .score("m1", MatchEngineFixture.truckDriverJob(), "resume");

        assertThat(score.getTotal()).isZero();
        score.details().values().forEach(d ->
                assertThat(d.getExplanation()).isEqualTo("error: oracle is not configured"));
    }
}
