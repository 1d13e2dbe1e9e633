package ru.vavtech.smartpark.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import ru.vavtech.smartpark.exception.SlotNotOccupiedException;
import ru.vavtech.smartpark.exception.SlotUnavailableException;

import java.util.Optional;

/**
 * Парковочное место.
 * <p>
 * Автомобиль присутствует тогда и только тогда, когда место занято:
 * конструктор отклоняет любое другое сочетание, поэтому переходы
 * возвращают новый экземпляр вместо изменения текущего.
 */
public record Slot(
        String id,
        String number,
        SlotStatus status,
        Occupant currentOccupant
) {

    public Slot {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Идентификатор места обязателен");
        }
        if (number == null) {
            throw new IllegalArgumentException("Номер места обязателен");
        }
        if (status == null) {
            throw new IllegalArgumentException("Статус места обязателен");
        }
        if ((status == SlotStatus.OCCUPIED) != (currentOccupant != null)) {
            throw new IllegalArgumentException(
                    "Место " + number + " в статусе " + status + " не согласовано с наличием автомобиля");
        }
        if (currentOccupant != null && !id.equals(currentOccupant.getSlotId())) {
            throw new IllegalArgumentException(
                    "Автомобиль " + currentOccupant.getPlateNumber() + " привязан к другому месту");
        }
    }

    public static Slot available(String id, String number) {
        return new Slot(id, number, SlotStatus.AVAILABLE, null);
    }

    /**
     * Занятие свободного места
     */
    public Slot occupy(Occupant occupant) {
        if (status != SlotStatus.AVAILABLE) {
            throw new SlotUnavailableException(this);
        }
        return new Slot(id, number, SlotStatus.OCCUPIED, occupant);
    }

    /**
     * Освобождение занятого места
     */
    public Slot vacate() {
        if (status != SlotStatus.OCCUPIED) {
            throw new SlotNotOccupiedException(this);
        }
        return new Slot(id, number, SlotStatus.AVAILABLE, null);
    }

    @JsonIgnore
    public boolean isAvailable() {
        return status == SlotStatus.AVAILABLE;
    }

    @JsonIgnore
    public boolean isOccupied() {
        return status == SlotStatus.OCCUPIED;
    }

    public Optional<Occupant> occupant() {
        return Optional.ofNullable(currentOccupant);
    }
}
