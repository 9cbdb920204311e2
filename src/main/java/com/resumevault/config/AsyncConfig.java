package com.resumevault.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "blobCleanupExecutor")
    public Executor blobCleanupExecutor(@Value("${app.cleanup.concurrency:4}") int concurrency) {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("blob-cleanup-");
        executor.setConcurrencyLimit(concurrency);
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
