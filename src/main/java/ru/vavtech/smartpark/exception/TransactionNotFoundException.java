package ru.vavtech.smartpark.exception;

public class TransactionNotFoundException extends NotFoundException {

    public TransactionNotFoundException(String transactionId) {
        super("Запись журнала не найдена: " + transactionId);
    }
}
