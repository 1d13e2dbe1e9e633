package ru.vavtech.smartpark.exception;

/**
 * Базовое исключение бизнес-логики парковки.
 * Все наследники описывают локальные восстановимые ситуации,
 * решение о сообщении пользователю принимает вызывающая сторона.
 */
public abstract class ParkingException extends RuntimeException {

    protected ParkingException(String message) {
        super(message);
    }
}
