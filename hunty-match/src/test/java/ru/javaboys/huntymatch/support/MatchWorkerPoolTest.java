package ru.javaboys.huntymatch.support;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchWorkerPoolTest {

    private MatchWorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    @Test
    void should_RunTasksInParallel_OnNamedDaemonThreads() throws Exception {
        pool = new MatchWorkerPool(2);
        CountDownLatch bothStarted = new CountDownLatch(2);
        List<Future<String>> futures = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            futures.add(pool.submit(() -> {
                bothStarted.countDown();
                assertThat(bothStarted.await(5, TimeUnit.SECONDS)).isTrue();
                assertThat(Thread.currentThread().isDaemon()).isTrue();
                return Thread.currentThread().getName();
            }));
        }

        for (Future<String> f : futures) {
            assertThat(f.get(5, TimeUnit.SECONDS)).startsWith("match-worker-");
        }
        assertThat(pool.getParallelism()).isEqualTo(2);
    }

    @Test
    void should_RejectNonPositiveParallelism() {
        assertThatThrownBy(() -> new MatchWorkerPool(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
