package ru.javaboys.huntymatch.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.javaboys.huntymatch.ai.OracleService;
import ru.javaboys.huntymatch.ai.OracleServiceImpl;
import ru.javaboys.huntymatch.service.ScoringMetrics;

import java.time.Clock;

@Configuration
@Slf4j
public class AiConfig {

    @Bean
    public OracleService oracleService(ObjectProvider<ChatClient.Builder> chatClientBuilder,
                                       MatchProperties properties,
                                       ScoringMetrics metrics) {
        MatchProperties.Oracle cfg = properties.getOracle();
        ChatClient chatClient = null;
        if (cfg.isEnabled()) {
            ChatClient.Builder builder = chatClientBuilder.getIfAvailable();
            if (builder != null) {
                chatClient = builder.build();
            } else {
                log.warn("No ChatClient.Builder in context, oracle-backed scores will degrade");
            }
        } else {
            log.info("Oracle disabled by hunty.match.oracle.enabled=false");
        }
        return new OracleServiceImpl(chatClient, cfg.isEnabled(), cfg.getMaxConcurrentCalls(),
                cfg.getPermitTimeout(), metrics);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
