package com.market.chat.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PipelineConfig {

    /**
     * Pool for bounded store/codec calls and fire-and-forget notifications.
     */
    @Bean(name = "chatPipelineExecutor", destroyMethod = "shutdown")
    public ExecutorService chatPipelineExecutor(@Value("${chat.pipeline.pool-size:16}") int poolSize) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "chat-pipeline-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(poolSize, threadFactory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
