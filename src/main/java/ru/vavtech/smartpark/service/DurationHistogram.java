package ru.vavtech.smartpark.service;

import ru.vavtech.smartpark.model.DurationBucket;

import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Распределение длительностей по интервалам.
 * <p>
 * Интервалы должны начинаться с нуля, идти подряд без разрывов,
 * а последний не ограничен сверху. Значение на границе попадает
 * в интервал, для которого граница является нижней. Названия интервалов
 * не повторяются, отрицательные длительности отклоняются.
 */
final class DurationHistogram {

    private DurationHistogram() {
    }

    static Map<String, Long> of(List<DurationBucket> buckets, Collection<Duration> durations) {
        validate(buckets);

        Map<String, Long> histogram = new LinkedHashMap<>();
        buckets.forEach(bucket -> histogram.put(bucket.name(), 0L));

        for (Duration duration : durations) {
            DurationBucket bucket = buckets.stream()
                    .filter(candidate -> candidate.contains(duration))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Длительность " + duration + " не попадает ни в один интервал"));
            histogram.merge(bucket.name(), 1L, Long::sum);
        }
        return histogram;
    }

    private static void validate(List<DurationBucket> buckets) {
        if (buckets == null || buckets.isEmpty()) {
            throw new IllegalArgumentException("Нужен хотя бы один интервал");
        }
        Set<String> names = new HashSet<>();
        for (DurationBucket bucket : buckets) {
            if (!names.add(bucket.name())) {
                throw new IllegalArgumentException("Повторяющееся название интервала: " + bucket.name());
            }
        }
        if (!buckets.get(0).lowerBound().isZero()) {
            throw new IllegalArgumentException("Первый интервал должен начинаться с нуля");
        }
        for (int i = 0; i < buckets.size() - 1; i++) {
            Duration upper = buckets.get(i).upperBound();
            if (upper == null || !upper.equals(buckets.get(i + 1).lowerBound())) {
                throw new IllegalArgumentException(
                        "Интервалы " + buckets.get(i).name() + " и " + buckets.get(i + 1).name() + " должны идти подряд");
            }
        }
        if (buckets.get(buckets.size() - 1).upperBound() != null) {
            throw new IllegalArgumentException("Последний интервал не должен ограничиваться сверху");
        }
    }
}
