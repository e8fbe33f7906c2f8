package ru.javaboys.huntymatch.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.Prompt;
import ru.javaboys.huntymatch.service.ScoringMetrics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * {@link OracleService} over Spring AI {@link ChatClient}.
 * Concurrent calls are limited by a fair semaphore.
 */
@Slf4j
public class OracleServiceImpl implements OracleService {

    private static final String CONVERSATION_ID_PARAM = "chat_memory_conversation_id";

    private final ChatClient chatClient; // null, если модель не сконфигурирована
    private final boolean enabled;
    private final Semaphore permits;
    private final Duration permitTimeout;
    private final ScoringMetrics metrics;

    public OracleServiceImpl(ChatClient chatClient, boolean enabled, int maxConcurrentCalls,
                             Duration permitTimeout, ScoringMetrics metrics) {
        if (maxConcurrentCalls < 1) {
            throw new IllegalArgumentException("maxConcurrentCalls must be positive: " + maxConcurrentCalls);
        }
        this.chatClient = chatClient;
        this.enabled = enabled;
        this.permits = new Semaphore(maxConcurrentCalls, true);
        this.permitTimeout = permitTimeout;
        this.metrics = metrics;
    }

    @Override
    public boolean isAvailable() {
        return enabled && chatClient != null;
    }

    @Override
    public String talk(String conversationId, SystemMessage systemMessage, UserMessage userMessage) {
        if (!isAvailable()) {
            throw new OracleException(OracleException.ErrorCode.UNAVAILABLE, "oracle is not configured");
        }
        acquirePermit(conversationId);
        long started = System.nanoTime();
        try {
            metrics.recordOracleCall();
            List<Message> promptMessages = new ArrayList<>();
            promptMessages.add(systemMessage);
            promptMessages.add(userMessage);

            String fullResponse = chatClient
                    .prompt(new Prompt(promptMessages))
                    .advisors(advisor -> advisor.param(CONVERSATION_ID_PARAM, conversationId))
                    .call()
                    .content();

            if (fullResponse == null || fullResponse.isBlank()) {
                throw new OracleException(OracleException.ErrorCode.EMPTY_RESPONSE,
                        "empty response for " + conversationId);
            }
            log.debug("Oracle answered {} in {} ms", conversationId,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            return fullResponse;
        } catch (OracleException e) {
            metrics.recordOracleFailure();
            throw e;
        } catch (RuntimeException e) {
            metrics.recordOracleFailure();
            throw new OracleException(OracleException.ErrorCode.CALL_FAILED,
                    "oracle call failed: " + e.getMessage(), e);
        } finally {
            permits.release();
        }
    }

    private void acquirePermit(String conversationId) {
        boolean acquired;
        try {
            acquired = permits.tryAcquire(permitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordOracleFailure();
            throw new OracleException(OracleException.ErrorCode.CALL_FAILED, "interrupted while waiting for oracle", e);
        }
        if (!acquired) {
            metrics.recordOracleFailure();
            log.warn("No free oracle slot for {} within {}", conversationId, permitTimeout);
            throw new OracleException(OracleException.ErrorCode.RATE_LIMITED,
                    "no free oracle slot within " + permitTimeout);
        }
    }
}
