package ru.vavtech.smartpark.exception;

/**
 * Нет свободных мест для въезда.
 */
public class NoCapacityException extends ParkingException {

    public NoCapacityException() {
        super("Парковка заполнена: свободных мест нет");
    }
}
