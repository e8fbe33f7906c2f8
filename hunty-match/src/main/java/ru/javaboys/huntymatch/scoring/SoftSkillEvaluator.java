package ru.javaboys.huntymatch.scoring;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.javaboys.huntymatch.ai.OracleException;
import ru.javaboys.huntymatch.ai.OracleGateway;
import ru.javaboys.huntymatch.ai.ScoreResponseParser;
import ru.javaboys.huntymatch.util.TextUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Decides which soft-skill requirements a resume demonstrates. One model call for the whole list;
 * {@link SkillMatcher} when the model is off, fails or answers without a {@code MATCHED:} line.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SoftSkillEvaluator {

    private static final String SYSTEM_PROMPT = """
            Analyze whether the candidate demonstrates the given soft skills/qualities based on their resume.

            For each soft skill, determine if the resume DEMONSTRATES this quality, either:
            1. Explicitly mentioned (e.g. "Punctual", "Autonomous")
            2. Implicitly demonstrated (e.g. "Managed team of 5" shows Leadership)
            3. Evidenced by achievements (e.g. "Delivered projects on time" shows Punctuality)

            Be reasonable but not overly generous. Look for concrete evidence.

            Examples:
            - "Ponctualite" / "Punctuality": look for "on-time delivery", "respect des delais", "punctual"
            - "Autonomie" / "Autonomy": look for "independent work", "self-managed", "autonome"
            - "Leadership": look for "managed", "led", "coordinated", "team lead"

            Provide your evaluation in this EXACT format, using the skill names as given:
            MATCHED: [skill1, skill2, skill3]

            If no soft skills are demonstrated, respond:
            MATCHED: []
            """;

    private final OracleGateway oracleGateway;
    private final SkillMatcher skillMatcher;

    public SoftSkillMatch evaluate(String conversationId, String resumeText, List<String> softSkills, String jobDescription) {
        if (softSkills == null || softSkills.isEmpty()) {
            return new SoftSkillMatch(Collections.emptyList(), Collections.emptyList(), false);
        }
        if (oracleGateway.isAvailable()) {
            Optional<SoftSkillMatch> semantic = evaluateWithOracle(conversationId, resumeText, softSkills, jobDescription);
            if (semantic.isPresent()) {
                return semantic.get();
            }
        }
        return evaluateLocally(resumeText, softSkills);
    }

    private Optional<SoftSkillMatch> evaluateWithOracle(String conversationId, String resumeText,
                                                        List<String> softSkills, String jobDescription) {
        String user = """
                SOFT SKILLS TO EVALUATE:
                %s

                JOB CONTEXT:
                %s

                CANDIDATE RESUME:
                %s
                """.formatted(String.join(", ", softSkills),
                oracleGateway.trimJob(jobDescription), oracleGateway.trimResume(resumeText));
        try {
            String answer = oracleGateway.ask(conversationId, SYSTEM_PROMPT, user);
            Optional<List<String>> named = ScoreResponseParser.matchedList(answer);
            if (named.isEmpty()) {
                log.warn("No MATCHED line in soft skills answer for {}, using text matching", conversationId);
                return Optional.empty();
            }
            List<String> matched = new ArrayList<>();
            List<String> missing = new ArrayList<>();
            for (String skill : softSkills) {
                if (isNamed(skill, named.get())) {
                    matched.add(skill);
                } else {
                    missing.add(skill);
                }
            }
            return Optional.of(new SoftSkillMatch(matched, missing, true));
        } catch (OracleException e) {
            log.warn("Soft skills evaluation failed, using text matching: {}", e.getMessage());
            return Optional.empty();
        }
    }

    SoftSkillMatch evaluateLocally(String resumeText, List<String> softSkills) {
        List<String> matched = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String skill : softSkills) {
            if (skillMatcher.matches(skill, resumeText)) {
                matched.add(skill);
            } else {
                missing.add(skill);
            }
        }
        return new SoftSkillMatch(matched, missing, false);
    }

    // модель может вернуть имя в другом регистре или без диакритики
    private static boolean isNamed(String skill, List<String> names) {
        String folded = TextUtils.fold(skill).trim();
        for (String name : names) {
            if (TextUtils.fold(name).trim().equals(folded)) {
                return true;
            }
        }
        return false;
    }
}
