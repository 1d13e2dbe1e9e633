package ru.vavtech.smartpark.exception;

public class SlotNotFoundException extends NotFoundException {

    public SlotNotFoundException(String slotId) {
        super("Место не найдено: " + slotId);
    }
}
