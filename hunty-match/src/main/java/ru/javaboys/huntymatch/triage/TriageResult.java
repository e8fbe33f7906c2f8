package ru.javaboys.huntymatch.triage;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TriageResult {

    @Singular List<RankedJob> jobs;

    int catalogueSize;      // после фильтра по критериям
    int candidatesAboveThreshold;
    boolean fallbackUsed;   // никто не прошёл порог, взяли первые N
    boolean deepScored;
}
