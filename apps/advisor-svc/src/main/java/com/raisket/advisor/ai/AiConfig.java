package com.raisket.advisor.ai;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AiConfig {

    public static final String NARRATIVE_EXECUTOR = "narrativeExecutor";

    private static final int NARRATIVE_THREADS = 4;

    @Bean(name = NARRATIVE_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService narrativeExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(NARRATIVE_THREADS, runnable -> {
            Thread thread = new Thread(runnable, "narrative-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
