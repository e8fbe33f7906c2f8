package ru.javaboys.huntymatch.model;

import lombok.Builder;
import lombok.Value;

/**
 * Optional hard filters applied to the offer catalogue before triage.
 */
@Value
@Builder
public class JobSearchCriteria {

    public static final JobSearchCriteria NONE = JobSearchCriteria.builder().build();

    String industry;
    String location;
    Integer minSalary;
}
