package ru.javaboys.huntymatch.ai;

import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;

public interface OracleService {

    /**
     * false when the model is switched off or not configured; callers should use their local fallback.
     */
    boolean isAvailable();

    /**
     * @throws OracleException when the model is unavailable, fails or returns nothing
     */
    String talk(String conversationId, SystemMessage systemMessage, UserMessage userMessage);
}
