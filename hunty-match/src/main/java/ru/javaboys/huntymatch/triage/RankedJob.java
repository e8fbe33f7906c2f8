package ru.javaboys.huntymatch.triage;

import lombok.Builder;
import lombok.Value;
import ru.javaboys.huntymatch.model.DetailedMatch;
import ru.javaboys.huntymatch.model.JobRecord;

/**
 * One job in the triage output. {@code match} is null when the job was not deep-scored
 * (no resume) or when deep scoring failed; in the latter case {@code error} is set.
 */
@Value
@Builder
public class RankedJob {

    JobRecord job;
    Double quickScore;
    DetailedMatch match;
    String error;

    public boolean isScored() {
        return match != null;
    }

    /**
     * Sort key: the deep match score when present, otherwise the quick score, otherwise 0.
     */
    public double getRankScore() {
        if (match != null) {
            return match.getMatchScore();
        }
        return quickScore == null ? 0.0 : quickScore;
    }
}
