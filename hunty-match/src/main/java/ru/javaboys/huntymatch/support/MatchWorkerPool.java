package ru.javaboys.huntymatch.support;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import ru.javaboys.huntymatch.config.MatchProperties;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of daemon threads that deep-score several jobs at once.
 * The number of simultaneous model calls is limited separately by the oracle service.
 */
@Component
@Slf4j
public class MatchWorkerPool {

    private final ExecutorService executor;
    private final int parallelism;

    @Autowired
    public MatchWorkerPool(MatchProperties properties) {
        this(properties.getPool().getParallelism());
    }

    public MatchWorkerPool(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
        this.parallelism = parallelism;
        AtomicInteger threadCounter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread thread = new Thread(r, "match-worker-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        this.executor = Executors.newFixedThreadPool(parallelism, threadFactory);
        log.info("MatchWorkerPool initialized with {} threads", parallelism);
    }

    public <T> Future<T> submit(Callable<T> task) {
        return executor.submit(task);
    }

    public int getParallelism() {
        return parallelism;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down MatchWorkerPool");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("MatchWorkerPool did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for MatchWorkerPool to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
