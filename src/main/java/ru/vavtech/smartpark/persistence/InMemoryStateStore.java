package ru.vavtech.smartpark.persistence;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Хранение состояния в памяти процесса. Используется в тестах и демо-режиме.
 */
@Component
@ConditionalOnProperty(prefix = "smartpark.storage", name = "type", havingValue = "memory")
public class InMemoryStateStore implements ParkingStateStore {

    private final AtomicReference<ParkingState> state = new AtomicReference<>();

    @Override
    public Optional<ParkingState> loadState() {
        return Optional.ofNullable(state.get());
    }

    @Override
    public void saveState(ParkingState newState) {
        state.set(newState);
    }

    @Override
    public void clear() {
        state.set(null);
    }
}
