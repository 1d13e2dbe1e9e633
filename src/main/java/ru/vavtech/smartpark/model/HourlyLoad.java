package ru.vavtech.smartpark.model;

/**
 * Количество въездов за час суток (0-23).
 */
public record HourlyLoad(
        int hour,
        long checkIns
) {
}
