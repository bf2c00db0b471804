package com.baykanat.funnel.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/** Bulk hedef analizi için executor ve varsayılan tarih aralığı için UTC saat. */
@Configuration
public class AnalyticsConfig {

    private static final int QUEUE_CAPACITY = 100;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Hedefler paralel hesaplanır; kuyruk dolunca yeni görev reddedilir (AbortPolicy). */
    @Bean(name = "analyticsExecutor", destroyMethod = "shutdownNow")
    public ExecutorService analyticsExecutor(AppProperties appProperties) {
        int poolSize = appProperties.getAnalytics().getBulkPoolSize();
        return new ThreadPoolExecutor(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(QUEUE_CAPACITY),
                new CustomizableThreadFactory("goal-analytics-"),
                new ThreadPoolExecutor.AbortPolicy());
    }
}
