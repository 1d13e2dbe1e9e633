package ru.vavtech.smartpark.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Завершенный визит с рассчитанной платой.
 * Неизменяем, хранится в журнале визитов.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Transaction {

    String id;

    String plateNumber;

    String driverName;

    Instant entryTime;

    Instant exitTime;

    /**
     * Длительность стоянки в полных минутах
     */
    long durationMinutes;

    /**
     * Итоговая плата
     */
    BigDecimal totalFee;

    /**
     * Время оплаты, при расчете на выезде совпадает с временем выезда
     */
    Instant paymentDate;

    /**
     * Номер места, с которого выехал автомобиль
     */
    String slotNumber;
}
