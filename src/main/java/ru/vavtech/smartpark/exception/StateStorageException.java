package ru.vavtech.smartpark.exception;

/**
 * Ошибка чтения или записи состояния парковки в хранилище.
 * Повторные попытки остаются на усмотрение вызывающей стороны.
 */
public class StateStorageException extends RuntimeException {

    public StateStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
