package ru.vavtech.smartpark.model;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

/**
 * Административная правка записи журнала.
 * Заполненные поля заменяют значения записи, плата и длительность не пересчитываются.
 */
@Value
@Builder
@Jacksonized
public class TransactionPatch {

    String plateNumber;

    String driverName;

    Instant entryTime;

    Instant exitTime;

    @PositiveOrZero(message = "Длительность не может быть отрицательной")
    Long durationMinutes;

    @PositiveOrZero(message = "Плата не может быть отрицательной")
    BigDecimal totalFee;

    String slotNumber;

    /**
     * Применение правки к записи
     */
    public Transaction applyTo(Transaction transaction) {
        Transaction.TransactionBuilder builder = transaction.toBuilder();
        if (plateNumber != null) {
            builder.plateNumber(plateNumber.trim().toUpperCase(Locale.ROOT));
        }
        if (driverName != null) {
            builder.driverName(driverName);
        }
        if (entryTime != null) {
            builder.entryTime(entryTime);
        }
        if (exitTime != null) {
            builder.exitTime(exitTime);
        }
        if (durationMinutes != null) {
            builder.durationMinutes(durationMinutes);
        }
        if (totalFee != null) {
            builder.totalFee(totalFee);
        }
        if (slotNumber != null) {
            builder.slotNumber(slotNumber);
        }
        return builder.build();
    }
}
