package ru.vavtech.smartpark.exception;

import ru.vavtech.smartpark.model.Slot;

/**
 * Попытка освободить место, на котором нет автомобиля.
 */
public class SlotNotOccupiedException extends ParkingException {

    public SlotNotOccupiedException(Slot slot) {
        super("Место " + slot.number() + " не занято");
    }
}
