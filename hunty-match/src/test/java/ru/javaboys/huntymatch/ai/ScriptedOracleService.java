package ru.javaboys.huntymatch.ai;

import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * In-memory model for tests: answers are picked by a marker found in the system prompt.
 * Unscripted prompts fail with {@link OracleException}.
 */
public class ScriptedOracleService implements OracleService {

    private final boolean available;
    private final List<Rule> rules = new ArrayList<>();
    private final List<String> conversationIds = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger calls = new AtomicInteger();

    private ScriptedOracleService(boolean available) {
        this.available = available;
    }

    public static ScriptedOracleService available() {
        return new ScriptedOracleService(true);
    }

    public static ScriptedOracleService unavailable() {
        return new ScriptedOracleService(false);
    }

    public ScriptedOracleService on(String systemMarker, String answer) {
        rules.add(new Rule(systemMarker, () -> answer));
        return this;
    }

    public ScriptedOracleService failOn(String systemMarker, String message) {
        rules.add(new Rule(systemMarker, () -> {
            throw new OracleException(OracleException.ErrorCode.CALL_FAILED, message);
        }));
        return this;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public String talk(String conversationId, SystemMessage systemMessage, UserMessage userMessage) {
        if (!available) {
            throw new OracleException(OracleException.ErrorCode.UNAVAILABLE, "oracle is not configured");
        }
        calls.incrementAndGet();
        conversationIds.add(conversationId);
        String system = systemMessage.getText();
        for (Rule rule : rules) {
            if (system.contains(rule.marker)) {
                return rule.answer.get();
            }
        }
        throw new OracleException(OracleException.ErrorCode.CALL_FAILED, "no scripted answer");
    }

    public int getCalls() {
        return calls.get();
    }

    public List<String> getConversationIds() {
        return List.copyOf(conversationIds);
    }

    private static final class Rule {
        private final String marker;
        private final Supplier<String> answer;

        private Rule(String marker, Supplier<String> answer) {
            this.marker = marker;
            this.answer = answer;
        }
    }
}
