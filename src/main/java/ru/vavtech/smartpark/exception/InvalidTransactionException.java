package ru.vavtech.smartpark.exception;

/**
 * Запись журнала нарушает правила: выезд не позже въезда, плата ниже минимальной и т.п.
 */
public class InvalidTransactionException extends ParkingException {

    public InvalidTransactionException(String message) {
        super(message);
    }
}
