package ru.vavtech.smartpark.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Срез данных парковки для внешнего сервиса аналитики. Только для чтения.
 */
@Value
@Builder
public class InsightsSnapshot {

    String facilityName;

    FacilityStats stats;

    /**
     * Последние завершенные визиты, от старых к новым
     */
    List<Transaction> recentTransactions;
}
