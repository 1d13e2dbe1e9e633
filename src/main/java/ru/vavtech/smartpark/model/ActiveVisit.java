package ru.vavtech.smartpark.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Текущий визит с платой и временем стоянки на момент запроса.
 */
@Value
@Builder
public class ActiveVisit {

    String slotId;

    String slotNumber;

    String occupantId;

    String plateNumber;

    String driverName;

    String driverPhone;

    Instant entryTime;

    ElapsedTime elapsed;

    BigDecimal currentFee;
}
