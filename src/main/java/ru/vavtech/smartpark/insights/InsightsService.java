package ru.vavtech.smartpark.insights;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import ru.vavtech.smartpark.config.ParkingProperties;
import ru.vavtech.smartpark.model.InsightsSnapshot;
import ru.vavtech.smartpark.service.ReportingService;

/**
 * Текстовая сводка по работе парковки.
 * <p>
 * Если внешний сервис не настроен, недоступен или вернул пустой ответ,
 * возвращается резервный текст. Состояние парковки не меняется.
 */
@Slf4j
@Service
public class InsightsService {

    private final ReportingService reportingService;
    private final ObjectProvider<InsightsClient> insightsClient;
    private final ParkingProperties properties;

    public InsightsService(ReportingService reportingService,
                           ObjectProvider<InsightsClient> insightsClient,
                           ParkingProperties properties) {
        this.reportingService = reportingService;
        this.insightsClient = insightsClient;
        this.properties = properties;
    }

    public String generate() {
        ParkingProperties.Insights settings = properties.getInsights();
        InsightsClient client = insightsClient.getIfAvailable();
        if (client == null) {
            log.debug("Сервис аналитики не настроен");
            return settings.getFallbackMessage();
        }

        InsightsSnapshot snapshot = reportingService.snapshot(settings.getRecentTransactions());
        try {
            String summary = client.summarize(snapshot);
            if (summary == null || summary.isBlank()) {
                log.warn("Сервис аналитики вернул пустой ответ");
                return settings.getFallbackMessage();
            }
            return summary;
        } catch (RuntimeException e) {
            log.warn("Сервис аналитики недоступен: {}", e.getMessage());
            return settings.getFallbackMessage();
        }
    }
}
