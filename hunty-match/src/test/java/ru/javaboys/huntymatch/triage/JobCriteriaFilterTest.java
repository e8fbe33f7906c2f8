package ru.javaboys.huntymatch.triage;

import org.junit.jupiter.api.Test;
import ru.javaboys.huntymatch.model.JobRecord;
import ru.javaboys.huntymatch.model.JobSearchCriteria;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JobCriteriaFilterTest {

    private final JobCriteriaFilter filter = new JobCriteriaFilter();

    private final JobRecord lyon = JobRecord.builder().id("1").title("Chauffeur").industry("Transport")
            .location("Lyon").salary(32000).build();
    private final JobRecord paris = JobRecord.builder().id("2").title("Data").industry("IT")
            .location("Paris 9e").salary(55000).build();
    private final JobRecord remote = JobRecord.builder().id("3").title("Dev").industry("IT")
            .location("Remote (France)").build();

    private final List<JobRecord> catalogue = List.of(lyon, paris, remote);

    @Test
    void should_KeepEverything_When_NoCriteria() {
        assertThat(filter.filter(catalogue, JobSearchCriteria.NONE)).containsExactly(lyon, paris, remote);
        assertThat(filter.filter(catalogue, null)).containsExactly(lyon, paris, remote);
    }

    @Test
    void should_MatchIndustryIgnoringCase() {
        JobSearchCriteria it = JobSearchCriteria.builder().industry(" it ").build();

        assertThat(filter.filter(catalogue, it)).containsExactly(paris, remote);
    }

    @Test
    void should_ExcludeUnknownOrLowerSalary() {
        JobSearchCriteria min = JobSearchCriteria.builder().minSalary(40000).build();

        assertThat(filter.filter(catalogue, min)).containsExactly(paris);
    }

    @Test
    void should_KeepRemoteJobs_ForAnyLocation() {
        JobSearchCriteria paris9 = JobSearchCriteria.builder().location("Paris").build();

        assertThat(filter.filter(catalogue, paris9)).containsExactly(paris, remote);
    }

    @Test
    void should_KeepEveryLocation_When_CandidateWantsRemote() {
        JobSearchCriteria anywhere = JobSearchCriteria.builder().location("remote").build();

        assertThat(filter.filter(catalogue, anywhere)).containsExactly(lyon, paris, remote);
    }

    @Test
    void should_SkipNullsAndNullCatalogue() {
        assertThat(filter.filter(Arrays.asList(lyon, null), JobSearchCriteria.NONE)).containsExactly(lyon);
        assertThat(filter.filter(null, JobSearchCriteria.NONE)).isEmpty();
    }
}
