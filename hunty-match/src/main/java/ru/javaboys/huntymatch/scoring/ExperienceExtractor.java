package ru.javaboys.huntymatch.scoring;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.javaboys.huntymatch.ai.OracleException;
import ru.javaboys.huntymatch.ai.OracleGateway;
import ru.javaboys.huntymatch.ai.ScoreResponseParser;
import ru.javaboys.huntymatch.config.MatchProperties;
import ru.javaboys.huntymatch.model.RelevantExperience;

import java.time.Clock;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Years of experience from free text: date ranges, then "N years of experience" phrases,
 * and the number of years that really count for a given job, asked from the model.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExperienceExtractor {

    static final int MIN_YEAR = 1950;
    static final int MAX_RELEVANT_YEARS = 50;

    // 2015-2024, 2015 à 2024
    private static final List<Pattern> CLOSED_RANGES = List.of(
            Pattern.compile("(\\d{4})\\s*[-–—]\\s*(\\d{4})"),
            Pattern.compile("(\\d{4})\\s+(?:à|a|to)\\s+(\\d{4})", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));

    // Depuis 2015, 2015 à aujourd'hui
    private static final List<Pattern> OPEN_RANGES = List.of(
            Pattern.compile("(?:depuis|since)\\s+(\\d{4})", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
            Pattern.compile("(\\d{4})\\s+(?:à|a|to)\\s+(?:aujourd'?hui|present|now|maintenant)",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));

    private static final List<Pattern> RESUME_YEAR_PHRASES = List.of(
            Pattern.compile("(\\d+)\\+?\\s*(?:years?|ans?)\\s+(?:of\\s+)?(?:experience|expérience)"),
            Pattern.compile("(?:experience|expérience)\\s*:?\\s*(\\d+)\\+?\\s*(?:years?|ans?)"),
            Pattern.compile("(\\d+)\\+?\\s*(?:years?|ans?)\\s+(?:in|dans|en)\\b"));

    private static final List<Pattern> REQUIRED_YEAR_PHRASES = List.of(
            Pattern.compile("(\\d+)\\+?\\s*(?:years?|ans?)\\s+(?:of\\s+)?(?:experience|expérience)"),
            Pattern.compile("minimum\\s+(?:of\\s+)?(\\d+)\\s*(?:years?|ans?)"),
            Pattern.compile("(?:at least|au moins)\\s+(\\d+)\\s*(?:years?|ans?)"));

    private static final String RELEVANT_YEARS_SYSTEM_PROMPT = """
            You analyse a candidate's work history and determine how many years of RELEVANT,
            DIRECTLY APPLICABLE experience they have for a specific job.

            CRITICAL INSTRUCTIONS:
            1. Only count experience that is DIRECTLY relevant and applicable to the target job.
            2. Consider domain/industry alignment, technical skills relevance and functional area match.
            3. Examples:
               - 12 years as truck driver for "Truck Driver" job = 12 relevant years
               - 12 years as truck driver for "Software Developer" job = 0 relevant years (completely different field)
               - 3 years as Data Scientist for "Truck Driver" job = 0 relevant years (no driving experience)
               - 5 years in team management + 3 years as developer for "Engineering Manager" = 5-6 relevant years (partial)
               - 2 years Python dev + 3 years Java dev for "Python Developer" = 5 relevant years (all programming)
            4. Transferable skills count partially:
               - Leadership roles can transfer across industries (50-75% credit)
               - Technical skills in similar domains (75-100% credit)
               - Completely different domains = 0% credit

            Provide the number of relevant years (0 to 50, decimals allowed) and a brief
            explanation (2-3 sentences max).

            Format your response EXACTLY as:
            RELEVANT_YEARS: [number]
            EXPLANATION: [your explanation]
            """;

    private final OracleGateway oracleGateway;
    private final Clock clock;
    private final MatchProperties properties;

    public boolean isOracleAvailable() {
        return oracleGateway.isAvailable();
    }

    public int extractYears(String text) {
        return extractYears(text, currentYear());
    }

    /**
     * Sum of employment spans found in the text. Overlapping spans are not merged.
     */
    public int extractYears(String text, int referenceYear) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        boolean distinct = properties.getExperience().getDuplicateSpanPolicy() == DuplicateSpanPolicy.DISTINCT_PAIRS;
        Set<List<Integer>> counted = new HashSet<>();
        Set<Integer> countedStarts = new HashSet<>();
        int total = 0;

        for (Pattern pattern : CLOSED_RANGES) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                int start = Integer.parseInt(m.group(1));
                int end = Integer.parseInt(m.group(2));
                if (start < MIN_YEAR || start > referenceYear || end < start || end > referenceYear + 1) {
                    continue;
                }
                if (counted.add(List.of(start, end)) || !distinct) {
                    total += end - start;
                    countedStarts.add(start);
                }
            }
        }

        for (Pattern pattern : OPEN_RANGES) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                int start = Integer.parseInt(m.group(1));
                if (start < MIN_YEAR || start > referenceYear) {
                    continue;
                }
                if (countedStarts.add(start) || !distinct) {
                    total += referenceYear - start;
                }
            }
        }
        return total;
    }

    public int estimateTotalYears(String text) {
        return estimateTotalYears(text, currentYear());
    }

    /**
     * {@link #extractYears(String, int)}, and when no span is found the largest
     * "N years of experience" phrase.
     */
    public int estimateTotalYears(String text, int referenceYear) {
        int years = extractYears(text, referenceYear);
        if (years > 0) {
            return years;
        }
        return firstNumberMax(RESUME_YEAR_PHRASES, text);
    }

    /**
     * Years asked in a job description; 0 when it names none.
     */
    public int requiredYears(String jobDescription) {
        return firstNumberMax(REQUIRED_YEAR_PHRASES, jobDescription);
    }

    public RelevantExperience extractRelevantYears(String conversationId, String resumeText,
                                                   String jobTitle, String jobDescription) {
        if (!oracleGateway.isAvailable()) {
            return fallback(resumeText, "semantic evaluation unavailable");
        }
        String user = """
                JOB TITLE: %s

                JOB DESCRIPTION:
                %s

                CANDIDATE RESUME:
                %s
                """.formatted(jobTitle, oracleGateway.trimJob(jobDescription), oracleGateway.trimResume(resumeText));
        try {
            String answer = oracleGateway.ask(conversationId, RELEVANT_YEARS_SYSTEM_PROMPT, user);
            OptionalDouble years = ScoreResponseParser.labeledValue(answer, "RELEVANT_YEARS")
                    .map(ScoreResponseParser::parseNumber)
                    .orElse(OptionalDouble.empty());
            if (years.isEmpty()) {
                log.warn("No RELEVANT_YEARS in answer for {}", conversationId);
                return fallback(resumeText, "could not parse model answer");
            }
            int relevant = (int) Math.max(0, Math.min(MAX_RELEVANT_YEARS, years.getAsDouble()));
            String explanation = ScoreResponseParser.labeledValue(answer, "EXPLANATION")
                    .filter(s -> !s.isBlank())
                    .orElse(relevant + " relevant years for " + jobTitle);
            return new RelevantExperience(relevant, explanation, true);
        } catch (OracleException e) {
            log.warn("Relevant experience evaluation failed: {}", e.getMessage());
            return fallback(resumeText, "error: " + e.getMessage());
        }
    }

    private RelevantExperience fallback(String resumeText, String reason) {
        int total = estimateTotalYears(resumeText);
        return new RelevantExperience(total, "Fallback: " + total + " years total experience (" + reason + ")", false);
    }

    private int currentYear() {
        return LocalDate.now(clock).getYear();
    }

    private static int firstNumberMax(List<Pattern> patterns, String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        int max = 0;
        for (Pattern p : patterns) {
            Matcher m = p.matcher(lower);
            if (m.find()) {
                try {
                    max = Math.max(max, Integer.parseInt(m.group(1)));
                } catch (NumberFormatException e) {
                    log.debug("Ignoring oversized number {}", m.group(1));
                }
            }
        }
        return max;
    }
}
