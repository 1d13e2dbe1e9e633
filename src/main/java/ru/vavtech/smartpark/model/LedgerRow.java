package ru.vavtech.smartpark.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Строка выгрузки журнала визитов.
 */
public record LedgerRow(
        String plateNumber,
        String driverName,
        LocalDateTime entryTime,
        LocalDateTime exitTime,
        long durationMinutes,
        BigDecimal totalFee,
        String slotNumber
) {
}
