package ru.vavtech.smartpark.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Сводные показатели парковки.
 * Всегда вычисляются заново из реестра мест и журнала, отдельно не хранятся.
 */
@Value
@Builder
public class FacilityStats {

    BigDecimal totalRevenue;

    /**
     * Завершенные визиты плюс автомобили на парковке
     */
    long totalEntries;

    int availableSlots;

    int occupiedSlots;

    int totalSlots;

    /**
     * Загрузка в процентах, округленная до целого
     */
    int utilizationPercent;
}
