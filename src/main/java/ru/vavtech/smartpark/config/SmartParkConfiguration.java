package ru.vavtech.smartpark.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.web.client.RestTemplate;
import ru.vavtech.smartpark.service.FacilityService;

import java.time.Clock;

/**
 * Конфигурация парковки.
 * Выполняет инициализацию при старте приложения.
 */
@Slf4j
@Configuration
@EnableScheduling
@RequiredArgsConstructor
public class SmartParkConfiguration {

    private final ParkingProperties properties;

    /**
     * Источник текущего времени для всех расчетов длительности и платы
     */
    @Bean
    public Clock parkingClock() {
        return Clock.system(properties.getZoneId());
    }

    @Bean
    public RestTemplate insightsRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(properties.getInsights().getTimeout())
                .setReadTimeout(properties.getInsights().getTimeout())
                .build();
    }

    /**
     * Загрузка сохраненного состояния или первичное заполнение реестра мест
     */
    @Bean
    public CommandLineRunner initializeFacility(FacilityService facilityService) {
        return args -> {
            log.info("Инициализация парковки {}...", properties.getFacility().getName());
            facilityService.initialize();
            log.info("Парковка готова к работе");
        };
    }
}
