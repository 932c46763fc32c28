package com.delta.jobprep.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class MinerConfig {
    private static final Logger log = LoggerFactory.getLogger(MinerConfig.class);

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(MinerProperties properties) {
        int size = Math.max(4, properties.getFetch().getMaxConnections() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "fetchExecutor", destroyMethod = "shutdown")
    public ExecutorService fetchExecutor(MinerProperties properties) {
        return Executors.newFixedThreadPool(properties.getFetch().getMaxConnections());
    }

    @Bean(name = "enhancementExecutor", destroyMethod = "shutdown")
    public ExecutorService enhancementExecutor(MinerProperties properties) {
        return Executors.newFixedThreadPool(properties.getEnhancement().getPoolSize());
    }

    @Bean
    public RateLimiter fetchRateLimiter(MinerProperties properties) {
        RateLimiter rateLimiter = buildFetchRateLimiter(properties.getFetch());
        log.info(
            "Fetch rate limiter initialized with {} requests/second, max wait {}s",
            properties.getFetch().getRequestsPerSecond(),
            properties.getFetch().getRateLimitWaitSeconds()
        );
        return rateLimiter;
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    public static RateLimiter buildFetchRateLimiter(MinerProperties.Fetch fetch) {
        RateLimiterConfig config = RateLimiterConfig.custom()
            .limitRefreshPeriod(Duration.ofSeconds(1))
            .limitForPeriod(fetch.getRequestsPerSecond())
            .timeoutDuration(Duration.ofSeconds(fetch.getRateLimitWaitSeconds()))
            .build();
        return RateLimiter.of("lightweightFetchRateLimiter", config);
    }
}
