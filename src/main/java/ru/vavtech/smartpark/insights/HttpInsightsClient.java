package ru.vavtech.smartpark.insights;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import ru.vavtech.smartpark.config.ParkingProperties;
import ru.vavtech.smartpark.model.InsightsSnapshot;

import java.util.Map;

/**
 * HTTP клиент сервиса аналитики.
 * Отправляет срез данных и текст запроса, ответ используется как готовая сводка.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "smartpark.insights", name = "enabled", havingValue = "true")
public class HttpInsightsClient implements InsightsClient {

    static final String PROMPT = "Analyze the following parking data for %s. "
            + "Provide a brief (max 100 words) summary of performance and one actionable tip for efficiency.";

    private final RestTemplate restTemplate;
    private final String url;

    public HttpInsightsClient(@Qualifier("insightsRestTemplate") RestTemplate restTemplate,
                              ParkingProperties properties) {
        this.restTemplate = restTemplate;
        this.url = properties.getInsights().getUrl();
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("smartpark.insights.url обязателен при smartpark.insights.enabled=true");
        }
    }

    @Override
    public String summarize(InsightsSnapshot snapshot) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = Map.of(
                "prompt", String.format(PROMPT, snapshot.getFacilityName()),
                "stats", snapshot.getStats(),
                "recentTransactions", snapshot.getRecentTransactions()
        );

        log.debug("Запрос аналитики: {} последних визитов", snapshot.getRecentTransactions().size());
        ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
        return response.getBody();
    }
}
