package ru.vavtech.smartpark.persistence;

import java.util.Optional;

/**
 * Хранилище состояния парковки.
 * Сохранение выполняется целиком: либо записано все состояние, либо ничего.
 */
public interface ParkingStateStore {

    /**
     * @return сохраненное состояние или пустой Optional, если сохранений еще не было
     */
    Optional<ParkingState> loadState();

    void saveState(ParkingState state);

    /**
     * Удаление сохраненного состояния
     */
    void clear();
}
