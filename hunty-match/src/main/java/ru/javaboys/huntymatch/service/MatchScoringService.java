package ru.javaboys.huntymatch.service;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.javaboys.huntymatch.config.MatchProperties;
import ru.javaboys.huntymatch.model.BonusScore;
import ru.javaboys.huntymatch.model.CandidateContext;
import ru.javaboys.huntymatch.model.DetailedMatch;
import ru.javaboys.huntymatch.model.DeterministicScore;
import ru.javaboys.huntymatch.model.JobRecord;
import ru.javaboys.huntymatch.model.SemanticScore;
import ru.javaboys.huntymatch.scoring.BonusScorer;
import ru.javaboys.huntymatch.scoring.DeterministicScorer;
import ru.javaboys.huntymatch.scoring.ScoreExplainer;
import ru.javaboys.huntymatch.scoring.SemanticScorer;
import ru.javaboys.huntymatch.util.TextUtils;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Full match of one resume against one job:
 * deterministic (40) → semantic (40) → bonus (20) → explanation.
 * Results are memoized by resume hash, job key and candidate preferences.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchScoringService {

    private final DeterministicScorer deterministicScorer;
    private final SemanticScorer semanticScorer;
    private final BonusScorer bonusScorer;
    private final ScoreExplainer scoreExplainer;
    private final Cache<String, DetailedMatch> matchCache;
    private final ScoringMetrics metrics;
    private final MatchProperties properties;

    public DetailedMatch score(JobRecord job, CandidateContext candidate) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(candidate, "candidate");

        boolean cacheEnabled = properties.getCache().isEnabled();
        String key = cacheKey(job, candidate);
        if (cacheEnabled) {
            DetailedMatch cached = matchCache.getIfPresent(key);
            if (cached != null) {
                metrics.recordCacheHit();
                log.debug("Cache hit for '{}'", job.getTitle());
                return cached;
            }
        }

        String conversationId = "match-" + UUID.randomUUID();
        String resume = TextUtils.safe(candidate.getResumeText());
        long started = System.nanoTime();
        try {
            log.info("[{}] Scoring '{}' at {}", conversationId, job.getTitle(), job.getCompany());

            DeterministicScore det = deterministicScorer.score(conversationId, job, candidate);
            log.info("[{}] Deterministic: {}/40", conversationId, round1(det.getTotal()));

            SemanticScore sem = semanticScorer.score(conversationId, job, resume);
            log.info("[{}] Semantic: {}/40", conversationId, round1(sem.getTotal()));

            BonusScore bonus = bonusScorer.score(conversationId, job, resume);
            log.info("[{}] Bonus: {}/20", conversationId, round1(bonus.getTotal()));

            DetailedMatch match = scoreExplainer.explain(conversationId, det, sem, bonus, job);
            long millis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            metrics.recordMatch(millis);
            log.info("[{}] Total {}/100 ({}) in {} ms", conversationId, round1(match.getMatchScore()),
                    match.getTier(), millis);

            if (cacheEnabled) {
                matchCache.put(key, match);
            }
            return match;
        } catch (RuntimeException e) {
            metrics.recordMatchFailure();
            log.error("[{}] Scoring of '{}' failed", conversationId, job.getTitle(), e);
            throw e;
        }
    }

    public ScoringMetrics.Snapshot metrics() {
        return metrics.snapshot();
    }

    public void evictAll() {
        matchCache.invalidateAll();
    }

    static String cacheKey(JobRecord job, CandidateContext candidate) {
        return TextUtils.sha256(candidate.getResumeText())
                + "|" + job.cacheKey()
                + "|" + TextUtils.lower(candidate.getLocation()).trim()
                + "|" + (candidate.getSalaryExpectation() == null ? "" : candidate.getSalaryExpectation());
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
