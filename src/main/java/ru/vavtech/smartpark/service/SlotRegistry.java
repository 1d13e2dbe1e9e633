package ru.vavtech.smartpark.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.vavtech.smartpark.exception.NoCapacityException;
import ru.vavtech.smartpark.exception.SlotNotFoundException;
import ru.vavtech.smartpark.model.Occupant;
import ru.vavtech.smartpark.model.Slot;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Реестр парковочных мест.
 * <p>
 * Хранит места в порядке добавления и гарантирует, что на одном месте
 * находится не более одного автомобиля. Статус места меняется только
 * через переходы {@link Slot#occupy} и {@link Slot#vacate}.
 * Thread-safety обеспечивается блокировкой чтения/записи.
 */
@Slf4j
@Service
public class SlotRegistry {

    private final Map<String, Slot> slots = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Счетчик изменений, по нему определяется необходимость сохранения
     */
    private final AtomicLong version = new AtomicLong();

    /**
     * Первичное заполнение реестра: места slot-1..slot-N с номерами A01..AN
     */
    public void provision(int count) {
        lock.writeLock().lock();
        try {
            slots.clear();
            for (int i = 1; i <= count; i++) {
                Slot slot = Slot.available("slot-" + i, String.format("A%02d", i));
                slots.put(slot.id(), slot);
            }
            version.incrementAndGet();
            log.info("Реестр мест заполнен: {} мест", count);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Добавление нового свободного места.
     * Повторяющиеся номера допускаются, но отмечаются в журнале.
     */
    public Slot addSlot(String number) {
        lock.writeLock().lock();
        try {
            boolean duplicate = slots.values().stream().anyMatch(slot -> slot.number().equals(number));
            if (duplicate) {
                log.warn("Место с номером {} уже существует, добавляется дубликат", number);
            }
            Slot slot = Slot.available("slot-" + UUID.randomUUID(), number);
            slots.put(slot.id(), slot);
            version.incrementAndGet();
            log.info("Добавлено место {} ({})", slot.number(), slot.id());
            return slot;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Размещение автомобиля на свободном месте
     */
    public Slot assign(String slotId, Occupant occupant) {
        lock.writeLock().lock();
        try {
            Slot occupied = getExisting(slotId).occupy(occupant);
            slots.put(slotId, occupied);
            version.incrementAndGet();
            return occupied;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Освобождение места при выезде
     *
     * @return автомобиль, занимавший место
     */
    public Occupant release(String slotId) {
        lock.writeLock().lock();
        try {
            Slot slot = getExisting(slotId);
            slots.put(slotId, slot.vacate());
            version.incrementAndGet();
            return slot.currentOccupant();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Принудительное освобождение места без расчета платы.
     * Данные о визите теряются, вызывающая сторона должна подтвердить намерение.
     */
    public Occupant forcedRelease(String slotId) {
        Occupant discarded = release(slotId);
        log.warn("Место {} освобождено принудительно, визит {} ({}) удален без оплаты",
                slotId, discarded.getId(), discarded.getPlateNumber());
        return discarded;
    }

    /**
     * Первое свободное место в порядке добавления
     *
     * @throws NoCapacityException если свободных мест нет
     */
    public Slot findFirstAvailable() {
        lock.readLock().lock();
        try {
            return slots.values().stream()
                    .filter(Slot::isAvailable)
                    .findFirst()
                    .orElseThrow(NoCapacityException::new);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Slot findById(String slotId) {
        lock.readLock().lock();
        try {
            return getExisting(slotId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Slot> getSlots() {
        lock.readLock().lock();
        try {
            return List.copyOf(slots.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Slot> getOccupiedSlots() {
        lock.readLock().lock();
        try {
            return slots.values().stream().filter(Slot::isOccupied).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int countOccupied() {
        return getOccupiedSlots().size();
    }

    /**
     * Количество мест, которые не заняты (включая места на обслуживании)
     */
    public int countAvailable() {
        lock.readLock().lock();
        try {
            return slots.size() - (int) slots.values().stream().filter(Slot::isOccupied).count();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return slots.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Проверка мест перед восстановлением реестра
     *
     * @throws IllegalArgumentException если идентификаторы мест повторяются или автомобиль числится на нескольких местах
     */
    public void checkRestorable(List<Slot> restored) {
        Set<String> slotIds = new HashSet<>();
        Set<String> occupantIds = new HashSet<>();
        for (Slot slot : restored) {
            if (!slotIds.add(slot.id())) {
                throw new IllegalArgumentException("Повторяющийся идентификатор места: " + slot.id());
            }
            if (slot.isOccupied() && !occupantIds.add(slot.currentOccupant().getId())) {
                throw new IllegalArgumentException(
                        "Автомобиль " + slot.currentOccupant().getId() + " числится на нескольких местах");
            }
        }
    }

    /**
     * Восстановление реестра из сохраненного состояния
     */
    public void restore(List<Slot> restored) {
        checkRestorable(restored);

        lock.writeLock().lock();
        try {
            slots.clear();
            restored.forEach(slot -> slots.put(slot.id(), slot));
            version.incrementAndGet();
            log.info("Реестр мест восстановлен: {} мест, занято {}",
                    restored.size(), restored.stream().filter(Slot::isOccupied).count());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public long getVersion() {
        return version.get();
    }

    private Slot getExisting(String slotId) {
        Slot slot = slots.get(slotId);
        if (slot == null) {
            throw new SlotNotFoundException(slotId);
        }
        return slot;
    }
}
