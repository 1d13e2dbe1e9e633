package ru.vavtech.smartpark.model;

import java.math.BigDecimal;

/**
 * Тариф парковки: почасовая ставка и минимальная плата за визит.
 */
public record Tariff(
        BigDecimal hourlyRate,
        BigDecimal minFee
) {

    public Tariff {
        if (hourlyRate == null || hourlyRate.signum() < 0) {
            throw new IllegalArgumentException("Почасовая ставка должна быть неотрицательной");
        }
        if (minFee == null || minFee.signum() < 0) {
            throw new IllegalArgumentException("Минимальная плата должна быть неотрицательной");
        }
    }

    @Override
    public String toString() {
        return hourlyRate + "/ч (мин. " + minFee + ")";
    }
}
