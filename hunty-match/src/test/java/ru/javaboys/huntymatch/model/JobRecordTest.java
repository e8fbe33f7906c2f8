package ru.javaboys.huntymatch.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import ru.javaboys.huntymatch.MatchEngineFixture;
import ru.javaboys.huntymatch.ai.ScriptedOracleService;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JobRecordTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void should_ReadNullRequirements_AsEmptyList() throws Exception {
        JobRecord job = objectMapper.readValue("{\"title\":\"T\",\"requirements\":null}", JobRecord.class);

        assertThat(job.getTitle()).isEqualTo("T");
        assertThat(job.getRequirements()).isEmpty();
    }

    @Test
    void should_ReadRequirementsInOrder() throws Exception {
        JobRecord job = objectMapper.readValue(
                "{\"id\":\"j1\",\"title\":\"Chauffeur\",\"salary\":32000,\"requirements\":[\"Permis C\",\"FIMO\"]}",
                JobRecord.class);

        assertThat(job.getRequirements()).containsExactly("Permis C", "FIMO");
        assertThat(job.getSalary()).isEqualTo(32000);
        assertThat(job.cacheKey()).isEqualTo("j1");
    }

    @Test
    void should_ScoreJobReadWithNullRequirements() throws Exception {
        JobRecord job = objectMapper.readValue(
                "{\"title\":\"Dev\",\"company\":\"Acme\",\"description\":\"Java\",\"requirements\":null}",
                JobRecord.class);

        DeterministicScore score = MatchEngineFixture.with(ScriptedOracleService.unavailable()).deterministicScorer
                .score("j", job, CandidateContext.ofResume("Java developer"));

        assertThat(score.getSkillsMatching().getScore()).isEqualTo(15.0);
        assertThat(job.cacheKey()).isEqualTo("Dev@Acme");
    }

    @Test
    void should_SkipNullCollection_InBuilder() {
        JobRecord job = JobRecord.builder().title("T").requirements(null).build();

        assertThat(job.getRequirements()).isEqualTo(List.of());
    }
}
