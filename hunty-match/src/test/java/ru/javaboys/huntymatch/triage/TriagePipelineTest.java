package ru.javaboys.huntymatch.triage;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.javaboys.huntymatch.config.MatchProperties;
import ru.javaboys.huntymatch.model.BonusScore;
import ru.javaboys.huntymatch.model.CandidateContext;
import ru.javaboys.huntymatch.model.DetailedMatch;
import ru.javaboys.huntymatch.model.DeterministicScore;
import ru.javaboys.huntymatch.model.JobRecord;
import ru.javaboys.huntymatch.model.JobSearchCriteria;
import ru.javaboys.huntymatch.model.MatchTier;
import ru.javaboys.huntymatch.model.ScoreBreakdown;
import ru.javaboys.huntymatch.model.ScoreDetail;
import ru.javaboys.huntymatch.model.ScoreDimension;
import ru.javaboys.huntymatch.model.SemanticScore;
import ru.javaboys.huntymatch.scoring.SkillMatcher;
import ru.javaboys.huntymatch.service.MatchScoringService;
import ru.javaboys.huntymatch.support.MatchWorkerPool;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TriagePipelineTest {

    private static final String RESUME = "Java Spring developer";

    @Mock
    private MatchScoringService matchScoringService;

    private MatchProperties properties;
    private MatchWorkerPool workerPool;
    private TriagePipeline pipeline;

    private final JobRecord javaJob = job("java", "Backend Java", List.of("Java", "Spring"), "it");
    private final JobRecord halfJob = job("half", "Fullstack", List.of("Java", "React"), "it");
    private final JobRecord cobolJob = job("cobol", "Mainframe", List.of("Cobol"), "banking");
    private final JobRecord driverJob = job("driver", "Chauffeur", List.of("Permis C"), "transport");

    @BeforeEach
    void setUp() {
        properties = new MatchProperties();
        workerPool = new MatchWorkerPool(2);
        pipeline = new TriagePipeline(new JobCriteriaFilter(), new QuickScorer(new SkillMatcher()),
                matchScoringService, workerPool, properties);
    }

    @AfterEach
    void tearDown() {
        workerPool.shutdown();
    }

    private static JobRecord job(String id, String title, List<String> requirements, String industry) {
        return JobRecord.builder().id(id).title(title).company("Acme").industry(industry)
                .requirements(requirements).build();
    }

    private static DetailedMatch matchScoring(JobRecord job, double skills) {
        ScoreDetail zero = ScoreDetail.of(0.0, 5.0, "");
        ScoreBreakdown breakdown = new ScoreBreakdown(
                new DeterministicScore(ScoreDetail.of(ScoreDimension.SKILLS_MATCHING, skills, ""),
                        zero, zero, zero, zero),
                new SemanticScore(zero, zero, zero, zero),
                new BonusScore(zero, zero, zero));
        return DetailedMatch.builder()
                .jobTitle(job.getTitle())
                .scoreBreakdown(breakdown)
                .strengths(List.of())
                .weaknesses(List.of())
                .tier(MatchTier.of(skills))
                .build();
    }

    @Test
    void should_ReturnFirstJobsUnscored_When_NoResume() {
        TriageResult result = pipeline.triage(CandidateContext.ofResume("  "),
                List.of(javaJob, halfJob, cobolJob, driverJob));

        assertThat(result.getJobs()).extracting(RankedJob::getJob).containsExactly(javaJob, halfJob, cobolJob);
        assertThat(result.getJobs()).noneMatch(RankedJob::isScored);
        assertThat(result.isDeepScored()).isFalse();
        assertThat(result.getCatalogueSize()).isEqualTo(4);
        verifyNoInteractions(matchScoringService);
    }

    @Test
    void should_DeepScoreOnlyJobsAboveThreshold() {
        properties.getTriage().setThreshold(70.0);
        when(matchScoringService.score(eq(javaJob), any())).thenReturn(matchScoring(javaJob, 12.0));

        TriageResult result = pipeline.triage(CandidateContext.ofResume(RESUME), List.of(cobolJob, javaJob, halfJob));

        assertThat(result.getCandidatesAboveThreshold()).isEqualTo(1);
        assertThat(result.isFallbackUsed()).isFalse();
        assertThat(result.getJobs()).hasSize(1);
        assertThat(result.getJobs().get(0).getJob()).isEqualTo(javaJob);
        assertThat(result.getJobs().get(0).getQuickScore()).isEqualTo(80.0);
        verify(matchScoringService, never()).score(eq(cobolJob), any());
        verify(matchScoringService, never()).score(eq(halfJob), any());
    }

    @Test
    void should_KeepBestQuickScores_When_MoreThanTopNPass() {
        properties.getTriage().setTopN(2);
        when(matchScoringService.score(eq(javaJob), any())).thenReturn(matchScoring(javaJob, 5.0));
        when(matchScoringService.score(eq(halfJob), any())).thenReturn(matchScoring(halfJob, 9.0));

        TriageResult result = pipeline.triage(CandidateContext.ofResume(RESUME), List.of(cobolJob, halfJob, javaJob));

        assertThat(result.getCandidatesAboveThreshold()).isEqualTo(3);
        // итоговый порядок по полному скору, а не по быстрому
        assertThat(result.getJobs()).extracting(RankedJob::getJob).containsExactly(halfJob, javaJob);
        verify(matchScoringService, never()).score(eq(cobolJob), any());
    }

    @Test
    void should_FallBackToFirstFilteredJobs_When_NoneAboveThreshold() {
        properties.getTriage().setThreshold(95.0);
        properties.getTriage().setTopN(2);
        when(matchScoringService.score(eq(halfJob), any())).thenReturn(matchScoring(halfJob, 3.0));
        when(matchScoringService.score(eq(javaJob), any())).thenReturn(matchScoring(javaJob, 7.0));
        JobSearchCriteria itOnly = JobSearchCriteria.builder().industry("IT").build();

        TriageResult result = pipeline.triage(CandidateContext.ofResume(RESUME),
                List.of(cobolJob, halfJob, driverJob, javaJob), itOnly);

        assertThat(result.isFallbackUsed()).isTrue();
        assertThat(result.getCandidatesAboveThreshold()).isZero();
        assertThat(result.getCatalogueSize()).isEqualTo(2);
        assertThat(result.getJobs()).extracting(RankedJob::getJob).containsExactly(javaJob, halfJob);
    }

    @Test
    void should_ReportPerJobError_AndRankItLast() {
        when(matchScoringService.score(eq(javaJob), any())).thenReturn(matchScoring(javaJob, 4.0));
        when(matchScoringService.score(eq(halfJob), any())).thenThrow(new IllegalStateException("oracle down"));
        when(matchScoringService.score(eq(cobolJob), any())).thenReturn(matchScoring(cobolJob, 2.0));

        TriageResult result = pipeline.triage(CandidateContext.ofResume(RESUME), List.of(javaJob, halfJob, cobolJob));

        assertThat(result.getJobs()).extracting(RankedJob::getJob).containsExactly(javaJob, cobolJob, halfJob);
        RankedJob failed = result.getJobs().get(2);
        assertThat(failed.isScored()).isFalse();
        assertThat(failed.getError()).isEqualTo("oracle down");
        assertThat(failed.getQuickScore()).isNotNull();
        assertThat(result.isDeepScored()).isTrue();
    }

    @Test
    void should_CapCatalogue_AtCandidateLimit() {
        properties.getTriage().setCandidateLimit(1);
        when(matchScoringService.score(eq(cobolJob), any())).thenReturn(matchScoring(cobolJob, 1.0));

        TriageResult result = pipeline.triage(CandidateContext.ofResume(RESUME), List.of(cobolJob, javaJob));

        assertThat(result.getCatalogueSize()).isEqualTo(1);
        assertThat(result.getJobs()).extracting(RankedJob::getJob).containsExactly(cobolJob);
    }

    @Test
    void should_ReturnEmpty_When_CatalogueEmpty() {
        TriageResult result = pipeline.triage(CandidateContext.ofResume(RESUME), List.of());

        assertThat(result.getJobs()).isEmpty();
        assertThat(result.isFallbackUsed()).isTrue();
        verifyNoInteractions(matchScoringService);
    }
}
