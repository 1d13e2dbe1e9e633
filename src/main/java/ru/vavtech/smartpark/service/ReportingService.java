package ru.vavtech.smartpark.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import ru.vavtech.smartpark.config.ParkingProperties;
import ru.vavtech.smartpark.model.DailyRevenue;
import ru.vavtech.smartpark.model.DurationBucket;
import ru.vavtech.smartpark.model.FacilityStats;
import ru.vavtech.smartpark.model.HourlyLoad;
import ru.vavtech.smartpark.model.InsightsSnapshot;
import ru.vavtech.smartpark.model.VisitScope;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Отчеты по парковке. Все показатели вычисляются из реестра мест и журнала при каждом запросе.
 */
@Service
@RequiredArgsConstructor
public class ReportingService {

    static final int DEFAULT_REVENUE_DAYS = 7;

    private final SlotRegistry slotRegistry;
    private final VisitLedger visitLedger;
    private final AllocationService allocationService;
    private final ParkingProperties properties;
    private final Clock clock;

    public FacilityStats getStats() {
        int total = slotRegistry.size();
        int occupied = slotRegistry.countOccupied();
        BigDecimal revenue = visitLedger.revenueTotal();
        int transactions = visitLedger.countAll();

        return FacilityStats.builder()
                .totalRevenue(revenue)
                .totalEntries((long) transactions + occupied)
                .availableSlots(total - occupied)
                .occupiedSlots(occupied)
                .totalSlots(total)
                .utilizationPercent(total == 0 ? 0 : Math.round(occupied * 100f / total))
                .build();
    }

    /**
     * Выручка по дням. Без указания периода берутся последние 7 дней, включая сегодня.
     */
    public List<DailyRevenue> revenueByDay(LocalDate from, LocalDate to) {
        LocalDate end = to != null ? to : LocalDate.now(clock.withZone(properties.getZoneId()));
        LocalDate start = from != null ? from : end.minusDays(DEFAULT_REVENUE_DAYS - 1);
        return visitLedger.revenueByDay(start, end);
    }

    /**
     * Въезды по часам суток в окне [fromHour, toHour]
     */
    public List<HourlyLoad> hourlyLoad(int fromHour, int toHour) {
        if (fromHour < 0 || toHour > 23 || fromHour > toHour) {
            throw new IllegalArgumentException("Некорректное окно часов: " + fromHour + "-" + toHour);
        }
        return visitLedger.entriesByHourOfDay().stream()
                .filter(load -> load.hour() >= fromHour && load.hour() <= toHour)
                .toList();
    }

    public Map<String, Long> durationDistribution(VisitScope scope) {
        return scope == VisitScope.ACTIVE
                ? allocationService.activeDurationHistogram(DurationBucket.DEFAULTS)
                : visitLedger.durationHistogram(DurationBucket.DEFAULTS);
    }

    /**
     * Срез для внешней аналитики: сводка и последние визиты
     */
    public InsightsSnapshot snapshot(int recentTransactions) {
        return InsightsSnapshot.builder()
                .facilityName(properties.getFacility().getName())
                .stats(getStats())
                .recentTransactions(visitLedger.recent(recentTransactions))
                .build();
    }
}
