package com.chicu.memetrader.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Общие бины движка: часы и источник случайности для джиттера агентов.
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** U(0, 1) */
    @Bean
    public DoubleSupplier jitterSource() {
        return () -> ThreadLocalRandom.current().nextDouble();
    }
}
