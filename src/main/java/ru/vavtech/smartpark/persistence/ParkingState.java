package ru.vavtech.smartpark.persistence;

import ru.vavtech.smartpark.model.Slot;
import ru.vavtech.smartpark.model.Transaction;

import java.util.List;

/**
 * Полное состояние парковки для сохранения: реестр мест и журнал визитов.
 */
public record ParkingState(
        List<Slot> slots,
        List<Transaction> transactions
) {

    public ParkingState {
        slots = slots == null ? List.of() : List.copyOf(slots);
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
