package ru.javaboys.huntymatch.scoring;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.javaboys.huntymatch.ai.OracleGateway;
import ru.javaboys.huntymatch.model.BonusScore;
import ru.javaboys.huntymatch.model.DetailedMatch;
import ru.javaboys.huntymatch.model.DeterministicScore;
import ru.javaboys.huntymatch.model.JobRecord;
import ru.javaboys.huntymatch.model.MatchTier;
import ru.javaboys.huntymatch.model.ScoreBreakdown;
import ru.javaboys.huntymatch.model.ScoreDetail;
import ru.javaboys.huntymatch.model.ScoreDimension;
import ru.javaboys.huntymatch.model.SemanticScore;
import ru.javaboys.huntymatch.util.TextUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Aggregates the three score groups into a {@link DetailedMatch}: strengths, weaknesses,
 * recommendation and an overall explanation written by the model (or by a template when it is off).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScoreExplainer {

    static final int MAX_STRENGTHS = 5;
    static final int MAX_WEAKNESSES = 4;

    private static final String SYSTEM_PROMPT = """
            Generate a concise overall explanation (2-3 sentences) for a resume-job match.

            Provide a concise summary that:
            1. States the overall match quality (excellent/good/moderate/weak)
            2. Highlights the top 2-3 strengths (highest scores)
            3. Mentions 1-2 areas for improvement (lowest scores)

            Keep it professional, factual, and actionable. Maximum 3 sentences.
            """;

    private final OracleGateway oracleGateway;

    public DetailedMatch explain(String conversationId, DeterministicScore det, SemanticScore sem, BonusScore bonus,
                                 JobRecord job) {
        ScoreBreakdown breakdown = new ScoreBreakdown(det, sem, bonus);
        double total = breakdown.getTotalScore();
        MatchTier tier = MatchTier.of(total);

        return DetailedMatch.builder()
                .jobTitle(job.getTitle())
                .company(job.getCompany())
                .salary(job.getSalary())
                .location(job.getLocation())
                .scoreBreakdown(breakdown)
                .overallExplanation(overallExplanation(conversationId + "-explain", breakdown, job.getTitle()))
                .strengths(strengths(breakdown))
                .weaknesses(weaknesses(breakdown))
                .tier(tier)
                .build();
    }

    String overallExplanation(String conversationId, ScoreBreakdown breakdown, String jobTitle) {
        if (oracleGateway.isAvailable()) {
            try {
                String answer = oracleGateway.ask(conversationId, SYSTEM_PROMPT,
                        "JOB TITLE: " + TextUtils.safe(jobTitle) + "\n\n" + scoreSummary(breakdown));
                if (TextUtils.notBlank(answer)) {
                    return answer.trim();
                }
            } catch (RuntimeException e) {
                log.warn("Overall explanation failed, using template: {}", e.getMessage());
            }
        }
        return fallbackExplanation(breakdown);
    }

    /**
     * "Good candidate with 68/100. Strong skills and location. Could improve culture fit and rare skills."
     */
    static String fallbackExplanation(ScoreBreakdown breakdown) {
        double total = breakdown.getTotalScore();
        List<Map.Entry<ScoreDimension, ScoreDetail>> ranked = new ArrayList<>(breakdown.allDetails().entrySet());
        // сортировка стабильная: при равенстве остаётся порядок измерений
        ranked.sort(Comparator.comparingDouble((Map.Entry<ScoreDimension, ScoreDetail> e) -> e.getValue().getRatio()).reversed());

        String top = ranked.get(0).getKey().getLabel() + " and " + ranked.get(1).getKey().getLabel();
        int n = ranked.size();
        String bottom = ranked.get(n - 2).getKey().getLabel() + " and " + ranked.get(n - 1).getKey().getLabel();
        return String.format(Locale.ROOT, "%s candidate with %.0f/100. Strong %s. Could improve %s.",
                MatchTier.of(total).getLabel(), total, top, bottom);
    }

    static List<String> strengths(ScoreBreakdown b) {
        List<String> out = new ArrayList<>();
        if (score(b, ScoreDimension.SKILLS_MATCHING) >= 12) {
            int matched = listSize(b.get(ScoreDimension.SKILLS_MATCHING).getMetadata().get("matched_skills"));
            out.add("Strong technical skills with " + matched + "+ matched competencies");
        }
        if (score(b, ScoreDimension.EXPERIENCE_YEARS) >= 8) {
            Object years = b.get(ScoreDimension.EXPERIENCE_YEARS).getMetadata().getOrDefault("resume_years", 0);
            out.add("Excellent experience level (" + years + "+ years)");
        }
        if (score(b, ScoreDimension.EDUCATION_MATCH) >= 4) out.add("Strong educational background");
        if (score(b, ScoreDimension.SALARY_FIT) >= 4) out.add("Salary expectations well-aligned");
        if (score(b, ScoreDimension.LOCATION_MATCH) >= 4) out.add("Excellent location fit");
        if (score(b, ScoreDimension.SOFT_SKILLS_MATCH) >= 12) out.add("Outstanding soft skills and communication");
        if (score(b, ScoreDimension.CULTURE_FIT) >= 8) out.add("Excellent cultural alignment");
        if (score(b, ScoreDimension.GROWTH_POTENTIAL) >= 8) out.add("High growth potential and adaptability");
        if (score(b, ScoreDimension.PROJECT_RELEVANCE) >= 4) out.add("Highly relevant project experience");
        if (score(b, ScoreDimension.INDUSTRY_EXPERIENCE) >= 7) out.add("Strong industry-specific experience");
        if (score(b, ScoreDimension.RARE_SKILLS_PREMIUM) >= 4) out.add("Rare and highly valuable technical skills");
        if (score(b, ScoreDimension.CAREER_TRAJECTORY) >= 4) out.add("Coherent and progressive career path");

        if (out.isEmpty()) {
            return List.of("Meets basic requirements");
        }
        return out.size() > MAX_STRENGTHS ? List.copyOf(out.subList(0, MAX_STRENGTHS)) : List.copyOf(out);
    }

    static List<String> weaknesses(ScoreBreakdown b) {
        List<String> out = new ArrayList<>();
        if (score(b, ScoreDimension.SKILLS_MATCHING) < 10) {
            int missing = listSize(b.get(ScoreDimension.SKILLS_MATCHING).getMetadata().get("missing_skills"));
            if (missing > 0) {
                out.add("Missing " + missing + " key technical skills");
            }
        }
        if (score(b, ScoreDimension.EXPERIENCE_YEARS) < 5) {
            Object required = b.get(ScoreDimension.EXPERIENCE_YEARS).getMetadata().getOrDefault("required_years", 0);
            out.add("Experience level below requirement (" + required + " years needed)");
        }
        if (score(b, ScoreDimension.EDUCATION_MATCH) < 3) out.add("Education level could be higher");
        if (score(b, ScoreDimension.SALARY_FIT) < 3) out.add("Salary expectations may not align");
        if (score(b, ScoreDimension.LOCATION_MATCH) < 3) out.add("Location not optimal");
        if (score(b, ScoreDimension.SOFT_SKILLS_MATCH) < 10) out.add("Soft skills need development");
        if (score(b, ScoreDimension.CULTURE_FIT) < 6) out.add("Cultural fit uncertain");
        if (score(b, ScoreDimension.GROWTH_POTENTIAL) < 6) out.add("Growth potential unclear");
        if (score(b, ScoreDimension.PROJECT_RELEVANCE) < 3) out.add("Limited relevant project experience");
        if (score(b, ScoreDimension.INDUSTRY_EXPERIENCE) < 5) out.add("Limited industry-specific experience");
        if (score(b, ScoreDimension.RARE_SKILLS_PREMIUM) < 2) out.add("Few rare or specialized skills");
        if (score(b, ScoreDimension.CAREER_TRAJECTORY) < 3) out.add("Career progression unclear");

        if (out.isEmpty()) {
            return List.of("No significant weaknesses identified");
        }
        return out.size() > MAX_WEAKNESSES ? List.copyOf(out.subList(0, MAX_WEAKNESSES)) : List.copyOf(out);
    }

    static String scoreSummary(ScoreBreakdown b) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "TOTAL SCORE: %.1f/100%n%nBREAKDOWN:%n", b.getTotalScore()));
        appendGroup(sb, "1. Deterministic Score", b.getDeterministic().getTotal(), DeterministicScore.MAX_TOTAL,
                b.getDeterministic().details());
        appendGroup(sb, "2. Semantic Score", b.getSemantic().getTotal(), SemanticScore.MAX_TOTAL,
                b.getSemantic().details());
        appendGroup(sb, "3. Bonus Score", b.getBonus().getTotal(), BonusScore.MAX_TOTAL,
                b.getBonus().details());
        return sb.toString();
    }

    private static void appendGroup(StringBuilder sb, String title, double total, double max,
                                    Map<ScoreDimension, ScoreDetail> details) {
        sb.append(String.format(Locale.ROOT, "%s: %.1f/%.0f%n", title, total, max));
        for (Map.Entry<ScoreDimension, ScoreDetail> e : details.entrySet()) {
            sb.append(String.format(Locale.ROOT, "   - %s: %.1f/%.0f%n",
                    e.getKey().getLabel(), e.getValue().getScore(), e.getValue().getMaxScore()));
        }
    }

    private static double score(ScoreBreakdown b, ScoreDimension dimension) {
        return b.get(dimension).getScore();
    }

    private static int listSize(Object value) {
        return value instanceof Collection ? ((Collection<?>) value).size() : 0;
    }
}
