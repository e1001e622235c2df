package com.marketpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.retry.annotation.EnableRetry;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

@SpringBootApplication
@EnableCaching
@EnableRetry
@Slf4j
public class MarketPulseApplication {
    public static void main(String[] args) {
        SpringApplication.run(MarketPulseApplication.class, args);
    }

    @PreDestroy
    public void onExit() {
        log.info("MarketPulse is shutting down; the in-memory dataset is discarded");
    }
}
