package ru.vavtech.smartpark.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.vavtech.smartpark.config.ParkingProperties;
import ru.vavtech.smartpark.exception.NegativeDurationException;
import ru.vavtech.smartpark.model.ElapsedTime;
import ru.vavtech.smartpark.model.Tariff;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Расчет платы за стоянку.
 * <p>
 * Правила тарификации:
 * - каждый начатый час оплачивается полностью (округление вверх до целого часа)
 * - итоговая плата не меньше минимальной
 * <p>
 * Один и тот же расчет используется для текущей стоимости на экране
 * и для итоговой платы на выезде, поэтому они всегда совпадают.
 * Методы не имеют побочных эффектов.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeeCalculator {

    private static final Duration ONE_HOUR = Duration.ofHours(1);

    private final ParkingProperties properties;

    /**
     * Плата по текущему тарифу
     */
    public BigDecimal computeFee(Instant entryTime, Instant now) {
        return computeFee(entryTime, now, properties.toTariff());
    }

    public BigDecimal computeFee(Instant entryTime, Instant now, Tariff tariff) {
        return computeFee(entryTime, now, tariff.hourlyRate(), tariff.minFee());
    }

    /**
     * Расчет платы: max(ceil(часы) × ставка, минимальная плата).
     *
     * @param entryTime время въезда
     * @param now момент расчета
     * @param hourlyRate почасовая ставка
     * @param minFee минимальная плата
     * @return плата за стоянку
     * @throws NegativeDurationException если момент расчета раньше въезда
     */
    public BigDecimal computeFee(Instant entryTime, Instant now, BigDecimal hourlyRate, BigDecimal minFee) {
        long hours = billableHours(elapsed(entryTime, now));
        BigDecimal billed = hourlyRate.multiply(BigDecimal.valueOf(hours));
        BigDecimal fee = billed.max(minFee);
        log.debug("Расчет платы: въезд {}, расчет {}, часов к оплате {}, плата {}", entryTime, now, hours, fee);
        return fee;
    }

    /**
     * Количество оплачиваемых часов: любой неполный час считается полным
     */
    public long billableHours(Duration elapsed) {
        long hours = elapsed.toHours();
        return elapsed.minus(ONE_HOUR.multipliedBy(hours)).isZero() ? hours : hours + 1;
    }

    /**
     * Время стоянки для отображения, усеченное до целых часов, минут и секунд
     */
    public ElapsedTime formatDuration(Instant entryTime, Instant now) {
        Duration elapsed = elapsed(entryTime, now);
        return new ElapsedTime(elapsed.toHours(), elapsed.toMinutesPart(), elapsed.toSecondsPart());
    }

    /**
     * Длительность стоянки в полных минутах
     */
    public long durationMinutes(Instant entryTime, Instant exitTime) {
        return elapsed(entryTime, exitTime).toMinutes();
    }

    /**
     * Время от въезда до указанного момента
     *
     * @throws NegativeDurationException если момент раньше въезда
     */
    public Duration elapsed(Instant entryTime, Instant now) {
        Duration elapsed = Duration.between(entryTime, now);
        if (elapsed.isNegative()) {
            throw new NegativeDurationException(entryTime, now);
        }
        return elapsed;
    }
}
