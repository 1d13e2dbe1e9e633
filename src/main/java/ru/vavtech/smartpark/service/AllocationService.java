package ru.vavtech.smartpark.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.vavtech.smartpark.exception.NoCapacityException;
import ru.vavtech.smartpark.exception.SlotNotOccupiedException;
import ru.vavtech.smartpark.model.ActiveVisit;
import ru.vavtech.smartpark.model.CheckInRequest;
import ru.vavtech.smartpark.model.DurationBucket;
import ru.vavtech.smartpark.model.Occupant;
import ru.vavtech.smartpark.model.Slot;
import ru.vavtech.smartpark.model.Transaction;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Сервис въезда и выезда автомобилей.
 * <p>
 * Функциональность:
 * - Въезд: выбор места, фиксация времени въезда, занятие места
 * - Выезд: расчет платы, запись визита в журнал, освобождение места
 * - Принудительное освобождение места без оплаты (административная операция)
 * - Текущая стоимость и время стоянки для отображения
 * <p>
 * Въезд, выезд и принудительное освобождение выполняются под общей
 * блокировкой парковки. Запросы текущей стоимости ничего не меняют.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AllocationService {

    private final SlotRegistry slotRegistry;
    private final VisitLedger visitLedger;
    private final FeeCalculator feeCalculator;
    private final Clock clock;
    private final FacilityLock facilityLock;

    /**
     * Въезд автомобиля.
     * <p>
     * Алгоритм:
     * 1. Выбор запрошенного места, если оно свободно, иначе первого свободного
     * 2. Нормализация госномера (верхний регистр)
     * 3. Фиксация времени въезда
     * 4. Занятие места
     *
     * @param request данные автомобиля и водителя
     * @return созданный визит
     * @throws NoCapacityException если свободных мест нет, состояние при этом не меняется
     */
    public Occupant checkIn(CheckInRequest request) {
        return facilityLock.callLocked(() -> {
            String plateNumber = normalizePlate(request.getPlateNumber());
            if (request.getDriverName() == null || request.getDriverName().isBlank()) {
                throw new IllegalArgumentException("Имя водителя обязательно");
            }
            Slot slot = selectSlot(request.getRequestedSlotId());

            Occupant occupant = Occupant.builder()
                    .id(UUID.randomUUID().toString())
                    .plateNumber(plateNumber)
                    .driverName(request.getDriverName().trim())
                    .driverPhone(request.getDriverPhone())
                    .entryTime(clock.instant())
                    .slotId(slot.id())
                    .build();

            slotRegistry.assign(slot.id(), occupant);

            log.info("Въезд {} на место {} в {}", occupant.getPlateNumber(), slot.number(), occupant.getEntryTime());
            return occupant;
        });
    }

    /**
     * Выезд автомобиля.
     * <p>
     * Запись визита сохраняется в журнал до освобождения места: если освобождение
     * не удалось, оплата уже учтена и освобождение можно повторить.
     *
     * @param slotId занятое место
     * @return запись о завершенном визите
     */
    public Transaction checkOut(String slotId) {
        return facilityLock.callLocked(() -> {
            Slot slot = slotRegistry.findById(slotId);
            if (!slot.isOccupied()) {
                throw new SlotNotOccupiedException(slot);
            }
            Occupant occupant = slot.currentOccupant();

            Instant exitTime = exitTime(occupant.getEntryTime());
            BigDecimal fee = feeCalculator.computeFee(occupant.getEntryTime(), exitTime);

            Transaction transaction = Transaction.builder()
                    .id(UUID.randomUUID().toString())
                    .plateNumber(occupant.getPlateNumber())
                    .driverName(occupant.getDriverName())
                    .entryTime(occupant.getEntryTime())
                    .exitTime(exitTime)
                    .durationMinutes(feeCalculator.durationMinutes(occupant.getEntryTime(), exitTime))
                    .totalFee(fee)
                    .paymentDate(exitTime)
                    .slotNumber(slot.number())
                    .build();

            visitLedger.append(transaction);

            try {
                slotRegistry.release(slotId);
            } catch (RuntimeException e) {
                log.error("Визит {} записан в журнал, но место {} не освобождено", transaction.getId(), slot.number(), e);
                throw e;
            }

            log.info("Выезд {} с места {}: {} мин, плата {}",
                    transaction.getPlateNumber(), slot.number(), transaction.getDurationMinutes(), fee);
            return transaction;
        });
    }

    /**
     * Принудительное освобождение места без создания записи в журнале
     *
     * @return удаленный визит
     */
    public Occupant forceRelease(String slotId) {
        return facilityLock.callLocked(() -> slotRegistry.forcedRelease(slotId));
    }

    /**
     * Автомобили на парковке с текущей платой и временем стоянки.
     *
     * @param query подстрока госномера или имени водителя, без учета регистра; может быть пустой
     */
    public List<ActiveVisit> activeVisits(String query) {
        Instant now = clock.instant();
        String normalizedQuery = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);

        return slotRegistry.getOccupiedSlots().stream()
                .filter(slot -> matches(slot.currentOccupant(), normalizedQuery))
                .map(slot -> toActiveVisit(slot, now))
                .toList();
    }

    /**
     * Текущая стоимость визита на указанном месте
     */
    public ActiveVisit quote(String slotId) {
        Slot slot = slotRegistry.findById(slotId);
        if (!slot.isOccupied()) {
            throw new SlotNotOccupiedException(slot);
        }
        return toActiveVisit(slot, clock.instant());
    }

    /**
     * Распределение автомобилей на парковке по текущей длительности стоянки
     */
    public Map<String, Long> activeDurationHistogram(List<DurationBucket> buckets) {
        Instant now = clock.instant();
        List<Duration> durations = slotRegistry.getOccupiedSlots().stream()
                .map(slot -> feeCalculator.elapsed(slot.currentOccupant().getEntryTime(), now))
                .toList();
        return DurationHistogram.of(buckets, durations);
    }

    /**
     * Момент выезда. Выезд в тот же момент, что и въезд, сдвигается на наименьший
     * шаг времени, чтобы выезд был строго позже въезда; такой визит оплачивается
     * как начатый час. Момент раньше въезда не корректируется.
     */
    private Instant exitTime(Instant entryTime) {
        Instant now = clock.instant();
        return now.equals(entryTime) ? entryTime.plusNanos(1) : now;
    }

    private Slot selectSlot(String requestedSlotId) {
        if (requestedSlotId != null && !requestedSlotId.isBlank()) {
            Slot requested = slotRegistry.findById(requestedSlotId);
            if (requested.isAvailable()) {
                return requested;
            }
            log.info("Запрошенное место {} недоступно, выбирается первое свободное", requested.number());
        }
        return slotRegistry.findFirstAvailable();
    }

    private ActiveVisit toActiveVisit(Slot slot, Instant now) {
        Occupant occupant = slot.currentOccupant();
        return ActiveVisit.builder()
                .slotId(slot.id())
                .slotNumber(slot.number())
                .occupantId(occupant.getId())
                .plateNumber(occupant.getPlateNumber())
                .driverName(occupant.getDriverName())
                .driverPhone(occupant.getDriverPhone())
                .entryTime(occupant.getEntryTime())
                .elapsed(feeCalculator.formatDuration(occupant.getEntryTime(), now))
                .currentFee(feeCalculator.computeFee(occupant.getEntryTime(), now))
                .build();
    }

    private static boolean matches(Occupant occupant, String query) {
        return query.isEmpty()
                || occupant.getPlateNumber().toLowerCase(Locale.ROOT).contains(query)
                || occupant.getDriverName().toLowerCase(Locale.ROOT).contains(query);
    }

    private static String normalizePlate(String plateNumber) {
        if (plateNumber == null || plateNumber.isBlank()) {
            throw new IllegalArgumentException("Госномер обязателен");
        }
        return plateNumber.trim().toUpperCase(Locale.ROOT);
    }
}
