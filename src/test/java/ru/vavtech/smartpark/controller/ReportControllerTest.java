package ru.vavtech.smartpark.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import ru.vavtech.smartpark.insights.InsightsService;
import ru.vavtech.smartpark.model.VisitScope;
import ru.vavtech.smartpark.service.ReportingService;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Тесты REST API отчетов
 */
@WebMvcTest(ReportController.class)
@DisplayName("Тесты REST API отчетов")
class ReportControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReportingService reportingService;

    @MockBean
    private InsightsService insightsService;

    @Test
    @DisplayName("Распределение длительностей по завершенным визитам")
    void durations_ClosedScope() throws Exception {
        when(reportingService.durationDistribution(VisitScope.CLOSED)).thenReturn(Map.of("Short (<1h)", 2L));

        mockMvc.perform(get("/api/reports/durations").param("source", "CLOSED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['Short (<1h)']").value(2));
    }

    @Test
    @DisplayName("Неизвестный источник визитов: 400")
    void durations_UnknownScope() throws Exception {
        mockMvc.perform(get("/api/reports/durations").param("source", "FOO"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));

        verify(reportingService, never()).durationDistribution(any());
    }

    @Test
    @DisplayName("Нечисловой час: 400")
    void hourly_NonNumericHour() throws Exception {
        mockMvc.perform(get("/api/reports/hourly").param("fromHour", "morning"))
                .andExpect(status().isBadRequest());

        verify(reportingService, never()).hourlyLoad(anyInt(), anyInt());
    }

    @Test
    @DisplayName("Некорректная дата периода: 400")
    void revenue_MalformedDate() throws Exception {
        mockMvc.perform(get("/api/reports/revenue").param("from", "10-05-2024"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Слишком длинный период выручки: 400")
    void revenue_TooLongPeriod() throws Exception {
        when(reportingService.revenueByDay(any(), any()))
                .thenThrow(new IllegalArgumentException("Период длиннее 366 дней"));

        mockMvc.perform(get("/api/reports/revenue")
                        .param("from", "0001-01-01")
                        .param("to", "9999-12-31"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Сводка аналитики возвращается в поле summary")
    void insights_Summary() throws Exception {
        when(insightsService.generate()).thenReturn("Загрузка стабильная");

        mockMvc.perform(post("/api/reports/insights"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary").value("Загрузка стабильная"));
    }
}
