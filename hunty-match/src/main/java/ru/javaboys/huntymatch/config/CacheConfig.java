package ru.javaboys.huntymatch.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.javaboys.huntymatch.model.DetailedMatch;

/**
 * Caffeine cache of finished matches.
 */
@Configuration
public class CacheConfig {

    @Bean
    public Cache<String, DetailedMatch> matchCache(MatchProperties properties) {
        MatchProperties.Cache cfg = properties.getCache();
        return Caffeine.newBuilder()
                .maximumSize(cfg.getMaxSize())
                .expireAfterWrite(cfg.getTtl())
                .recordStats()
                .build();
    }
}
