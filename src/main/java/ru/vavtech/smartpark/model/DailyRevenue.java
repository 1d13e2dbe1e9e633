package ru.vavtech.smartpark.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Выручка за календарный день (по дате выезда).
 */
public record DailyRevenue(
        LocalDate date,
        BigDecimal amount
) {
}
