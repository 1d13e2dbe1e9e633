package ru.vavtech.smartpark.exception;

/**
 * Запрошенный объект не найден.
 */
public class NotFoundException extends ParkingException {

    public NotFoundException(String message) {
        super(message);
    }
}
