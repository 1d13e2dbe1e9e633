package ru.vavtech.smartpark.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.vavtech.smartpark.insights.InsightsService;
import ru.vavtech.smartpark.model.DailyRevenue;
import ru.vavtech.smartpark.model.FacilityStats;
import ru.vavtech.smartpark.model.HourlyLoad;
import ru.vavtech.smartpark.model.VisitScope;
import ru.vavtech.smartpark.service.ReportingService;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * REST контроллер отчетов по парковке.
 */
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {

    private final ReportingService reportingService;
    private final InsightsService insightsService;

    @GetMapping("/stats")
    public ResponseEntity<FacilityStats> getStats() {
        return ResponseEntity.ok(reportingService.getStats());
    }

    @GetMapping("/revenue")
    public ResponseEntity<List<DailyRevenue>> getRevenue(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(reportingService.revenueByDay(from, to));
    }

    @GetMapping("/hourly")
    public ResponseEntity<List<HourlyLoad>> getHourlyLoad(@RequestParam(defaultValue = "0") int fromHour,
                                                          @RequestParam(defaultValue = "23") int toHour) {
        return ResponseEntity.ok(reportingService.hourlyLoad(fromHour, toHour));
    }

    @GetMapping("/durations")
    public ResponseEntity<Map<String, Long>> getDurations(@RequestParam(defaultValue = "ACTIVE") VisitScope source) {
        return ResponseEntity.ok(reportingService.durationDistribution(source));
    }

    /**
     * Текстовая сводка от сервиса аналитики
     */
    @PostMapping("/insights")
    public ResponseEntity<Map<String, String>> generateInsights() {
        return ResponseEntity.ok(Map.of("summary", insightsService.generate()));
    }
}
