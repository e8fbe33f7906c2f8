package ru.javaboys.huntymatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import ru.javaboys.huntymatch.scoring.DuplicateSpanPolicy;

import java.time.Duration;

/**
 * Tuning of the matching engine, bound from {@code hunty.match.*}.
 */
@Data
@ConfigurationProperties(prefix = "hunty.match")
public class MatchProperties {

    private Oracle oracle = new Oracle();
    private Pool pool = new Pool();
    private Triage triage = new Triage();
    private Cache cache = new Cache();
    private Experience experience = new Experience();

    @Data
    public static class Oracle {
        /**
         * When false every oracle-backed dimension uses its local fallback.
         */
        private boolean enabled = true;
        /**
         * Upper bound of concurrent calls to the model.
         */
        private int maxConcurrentCalls = 4;
        /**
         * How long a caller waits for a free call slot before giving up.
         */
        private Duration permitTimeout = Duration.ofSeconds(60);
        private int maxResumeChars = 18000;
        private int maxJobChars = 8000;
    }

    @Data
    public static class Pool {
        /**
         * Number of jobs deep-scored in parallel.
         */
        private int parallelism = 3;
    }

    @Data
    public static class Triage {
        private int topN = 3;
        private double threshold = 45.0;
        /**
         * Jobs taken from the filtered catalogue before quick scoring.
         */
        private int candidateLimit = 20;
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private int maxSize = 1000;
        private Duration ttl = Duration.ofMinutes(30);
    }

    @Data
    public static class Experience {
        private DuplicateSpanPolicy duplicateSpanPolicy = DuplicateSpanPolicy.DISTINCT_PAIRS;
    }
}
