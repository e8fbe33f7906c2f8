package ru.javaboys.huntymatch.triage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.javaboys.huntymatch.config.MatchProperties;
import ru.javaboys.huntymatch.model.CandidateContext;
import ru.javaboys.huntymatch.model.DetailedMatch;
import ru.javaboys.huntymatch.model.JobRecord;
import ru.javaboys.huntymatch.model.JobSearchCriteria;
import ru.javaboys.huntymatch.service.MatchScoringService;
import ru.javaboys.huntymatch.support.MatchWorkerPool;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Ranks a resume against many jobs in two phases: a cheap local quick score over the catalogue,
 * then the full match for the best few only, since model calls are the expensive part.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TriagePipeline {

    private static final Comparator<RankedJob> BY_RANK = Comparator
            .comparing(RankedJob::isScored).reversed()
            .thenComparing(Comparator.comparingDouble(RankedJob::getRankScore).reversed());

    private final JobCriteriaFilter criteriaFilter;
    private final QuickScorer quickScorer;
    private final MatchScoringService matchScoringService;
    private final MatchWorkerPool workerPool;
    private final MatchProperties properties;

    public TriageResult triage(CandidateContext candidate, List<JobRecord> catalogue) {
        return triage(candidate, catalogue, JobSearchCriteria.NONE);
    }

    public TriageResult triage(CandidateContext candidate, List<JobRecord> catalogue, JobSearchCriteria criteria) {
        MatchProperties.Triage cfg = properties.getTriage();
        List<JobRecord> filtered = criteriaFilter.filter(catalogue, criteria);
        if (filtered.size() > cfg.getCandidateLimit()) {
            filtered = new ArrayList<>(filtered.subList(0, cfg.getCandidateLimit()));
        }
        int topN = Math.max(0, cfg.getTopN());

        if (candidate == null || !candidate.hasResume()) {
            log.info("No resume, returning {} jobs without scoring", Math.min(topN, filtered.size()));
            TriageResult.TriageResultBuilder result = TriageResult.builder()
                    .catalogueSize(filtered.size());
            for (JobRecord job : head(filtered, topN)) {
                result.job(RankedJob.builder().job(job).build());
            }
            return result.build();
        }

        List<RankedJob> quick = new ArrayList<>();
        for (JobRecord job : filtered) {
            quick.add(RankedJob.builder().job(job).quickScore(quickScorer.score(candidate.getResumeText(), job)).build());
        }
        List<RankedJob> selected = new ArrayList<>();
        for (RankedJob r : quick) {
            if (r.getQuickScore() >= cfg.getThreshold()) {
                selected.add(r);
            }
        }
        int aboveThreshold = selected.size();
        boolean fallback = false;
        if (selected.isEmpty()) {
            // порог никто не прошёл, берём первые N как есть
            fallback = true;
            selected = head(quick, topN);
            log.info("No job passed quick score {}, deep-scoring first {} jobs", cfg.getThreshold(), selected.size());
        } else {
            selected.sort(Comparator.comparingDouble(RankedJob::getQuickScore).reversed());
            selected = head(selected, topN);
        }

        List<RankedJob> ranked = deepScore(candidate, selected);
        ranked.sort(BY_RANK);
        log.info("Triage done: {} jobs filtered, {} above threshold, {} deep-scored",
                filtered.size(), aboveThreshold, ranked.size());

        return TriageResult.builder()
                .jobs(ranked)
                .catalogueSize(filtered.size())
                .candidatesAboveThreshold(aboveThreshold)
                .fallbackUsed(fallback)
                .deepScored(true)
                .build();
    }

    private List<RankedJob> deepScore(CandidateContext candidate, List<RankedJob> selected) {
        List<Future<DetailedMatch>> futures = new ArrayList<>();
        for (RankedJob r : selected) {
            futures.add(workerPool.submit(() -> matchScoringService.score(r.getJob(), candidate)));
        }
        List<RankedJob> out = new ArrayList<>();
        for (int i = 0; i < selected.size(); i++) {
            RankedJob r = selected.get(i);
            try {
                DetailedMatch match = futures.get(i).get();
                out.add(RankedJob.builder().job(r.getJob()).quickScore(r.getQuickScore()).match(match).build());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.error("Deep scoring of '{}' failed: {}", r.getJob().getTitle(), cause.getMessage(), cause);
                out.add(RankedJob.builder().job(r.getJob()).quickScore(r.getQuickScore())
                        .error(String.valueOf(cause.getMessage())).build());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while deep-scoring jobs", e);
            }
        }
        return out;
    }

    private static <T> List<T> head(List<T> list, int n) {
        return new ArrayList<>(list.subList(0, Math.min(n, list.size())));
    }
}
