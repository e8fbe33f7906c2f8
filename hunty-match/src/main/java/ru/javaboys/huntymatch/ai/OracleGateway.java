package ru.javaboys.huntymatch.ai;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Service;
import ru.javaboys.huntymatch.config.MatchProperties;
import ru.javaboys.huntymatch.model.ScoreDetail;
import ru.javaboys.huntymatch.model.ScoreDimension;
import ru.javaboys.huntymatch.util.TextUtils;

import java.util.Map;

/**
 * Sends scoring prompts to the model and turns answers into bounded {@link ScoreDetail}s.
 * {@link OracleException} is not caught here: each scorer decides how its dimension degrades.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OracleGateway {

    private final OracleService oracleService;
    private final MatchProperties properties;

    public boolean isAvailable() {
        return oracleService.isAvailable();
    }

    public String ask(String conversationId, String systemPrompt, String userPrompt) {
        return oracleService.talk(conversationId, new SystemMessage(systemPrompt), new UserMessage(userPrompt));
    }

    /**
     * One dimension, one round-trip. The answer is expected as {@code SCORE: n/max} + {@code EXPLANATION: text}.
     */
    public ScoreDetail score(String conversationId, ScoreDimension dimension, String systemPrompt, String userPrompt) {
        String answer = ask(conversationId, systemPrompt, userPrompt);
        ParsedScore parsed = ScoreResponseParser.parseScore(answer, dimension.getMaxScore());
        if (parsed.isSalvaged()) {
            log.warn("No SCORE line for {} in {}, salvaged {}", dimension.getKey(), conversationId, parsed.getScore());
            return ScoreDetail.of(dimension, parsed.getScore(), parsed.getExplanation(), Map.of("salvaged", true));
        }
        return ScoreDetail.of(dimension, parsed.getScore(), parsed.getExplanation());
    }

    public String trimResume(String resumeText) {
        return TextUtils.safeTrim(resumeText, properties.getOracle().getMaxResumeChars());
    }

    public String trimJob(String jobText) {
        return TextUtils.safeTrim(jobText, properties.getOracle().getMaxJobChars());
    }
}
