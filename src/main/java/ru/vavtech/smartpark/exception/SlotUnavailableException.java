package ru.vavtech.smartpark.exception;

import ru.vavtech.smartpark.model.Slot;

/**
 * Попытка занять место, которое не свободно.
 */
public class SlotUnavailableException extends ParkingException {

    public SlotUnavailableException(Slot slot) {
        super("Место " + slot.number() + " недоступно (статус " + slot.status() + ")");
    }
}
