package ru.vavtech.smartpark.model;

import java.time.Duration;
import java.util.List;

/**
 * Интервал гистограммы длительностей: нижняя граница включается, верхняя нет.
 * Верхняя граница {@code null} означает интервал без ограничения сверху.
 */
public record DurationBucket(
        String name,
        Duration lowerBound,
        Duration upperBound
) {

    public static final List<DurationBucket> DEFAULTS = List.of(
            new DurationBucket("Short (<1h)", Duration.ZERO, Duration.ofHours(1)),
            new DurationBucket("Mid (1-3h)", Duration.ofHours(1), Duration.ofHours(3)),
            new DurationBucket("Long (>3h)", Duration.ofHours(3), null)
    );

    public DurationBucket {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Название интервала обязательно");
        }
        if (lowerBound == null || lowerBound.isNegative()) {
            throw new IllegalArgumentException("Нижняя граница интервала должна быть неотрицательной");
        }
        if (upperBound != null && upperBound.compareTo(lowerBound) <= 0) {
            throw new IllegalArgumentException("Верхняя граница интервала " + name + " должна быть больше нижней");
        }
    }

    public boolean contains(Duration duration) {
        return duration.compareTo(lowerBound) >= 0
                && (upperBound == null || duration.compareTo(upperBound) < 0);
    }
}
