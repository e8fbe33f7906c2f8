package ru.javaboys.huntymatch.scoring;

/**
 * How repeated mentions of the same employment span are counted.
 */
public enum DuplicateSpanPolicy {
    /**
     * Every distinct (start, end) pair counts once; an open span is skipped when its start was already counted.
     */
    DISTINCT_PAIRS,
    /**
     * Every mention counts: "2015-2024" written twice gives 18 years.
     */
    ALL_MENTIONS
}
