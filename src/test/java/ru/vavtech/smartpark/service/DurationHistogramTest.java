package ru.vavtech.smartpark.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.vavtech.smartpark.model.DurationBucket;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

/**
 * Unit тесты распределения длительностей
 */
@DisplayName("Тесты распределения длительностей по интервалам")
class DurationHistogramTest {

    @Test
    @DisplayName("Каждая длительность попадает ровно в один интервал")
    void of_CountsEveryDuration() {
        assertThat(DurationHistogram.of(DurationBucket.DEFAULTS,
                List.of(Duration.ZERO, Duration.ofMinutes(59), Duration.ofHours(3), Duration.ofDays(2))))
                .containsExactly(
                        entry("Short (<1h)", 2L),
                        entry("Mid (1-3h)", 0L),
                        entry("Long (>3h)", 2L));
    }

    @Test
    @DisplayName("Отрицательная длительность отклоняется")
    void of_RejectsNegativeDuration() {
        assertThatThrownBy(() -> DurationHistogram.of(DurationBucket.DEFAULTS, List.of(Duration.ofMinutes(-1))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Повторяющиеся названия интервалов отклоняются")
    void of_RejectsDuplicateNames() {
        List<DurationBucket> buckets = List.of(
                new DurationBucket("Any", Duration.ZERO, Duration.ofHours(1)),
                new DurationBucket("Any", Duration.ofHours(1), null));

        assertThatThrownBy(() -> DurationHistogram.of(buckets, List.of(Duration.ofMinutes(30))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
