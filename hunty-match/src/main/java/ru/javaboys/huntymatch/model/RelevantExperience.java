package ru.javaboys.huntymatch.model;

import lombok.Value;

/**
 * Years of experience that count for a given job, with the reason.
 * {@code fromOracle=false} means the value was estimated locally.
 */
@Value
public class RelevantExperience {
    int years;
    String explanation;
    boolean fromOracle;
}
