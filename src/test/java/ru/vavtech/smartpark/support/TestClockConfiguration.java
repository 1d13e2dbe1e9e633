package ru.vavtech.smartpark.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Подменяет системные часы управляемыми для интеграционных тестов.
 */
@TestConfiguration
public class TestClockConfiguration {

    public static final Instant START = Instant.parse("2024-05-10T08:00:00Z");

    @Bean
    @Primary
    public MutableClock testClock() {
        return new MutableClock(START, ZoneId.of("Africa/Kigali"));
    }
}
