package com.adpulse.alerts.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pools for campaign evaluation and channel delivery. Both are bounded so a large
 * batch cannot flood the metrics store or the mail relay.
 */
@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService campaignAnalysisExecutor(AlertEngineConfig config) {
        return Executors.newFixedThreadPool(config.getBatch().getMaxConcurrency(), daemonThreads("campaign-analysis"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService alertDispatchExecutor(AlertEngineConfig config) {
        return Executors.newFixedThreadPool(config.getDispatch().getPoolSize(), daemonThreads("alert-dispatch"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
