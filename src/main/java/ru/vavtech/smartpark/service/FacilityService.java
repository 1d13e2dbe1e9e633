package ru.vavtech.smartpark.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.vavtech.smartpark.config.ParkingProperties;
import ru.vavtech.smartpark.persistence.StatePersistenceService;

/**
 * Жизненный цикл парковки: загрузка при старте и полный сброс данных.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FacilityService {

    private final ParkingProperties properties;
    private final SlotRegistry slotRegistry;
    private final VisitLedger visitLedger;
    private final StatePersistenceService persistenceService;
    private final FacilityLock facilityLock;

    /**
     * Восстановление сохраненного состояния, а если его нет, первичное заполнение мест
     */
    public void initialize() {
        if (persistenceService.load()) {
            log.info("Восстановлено сохраненное состояние: {} мест, {} записей журнала",
                    slotRegistry.size(), visitLedger.countAll());
            return;
        }
        log.info("Сохраненное состояние не найдено, создается {} мест", properties.getInitialSlots());
        slotRegistry.provision(properties.getInitialSlots());
        visitLedger.clear();
        persistenceService.save();
    }

    /**
     * Удаление всех данных парковки: журнал очищается, места создаются заново.
     * Автомобили на парковке удаляются без оплаты.
     */
    public void purge() {
        facilityLock.runLocked(() -> {
            log.warn("Полный сброс данных парковки: {} записей журнала, {} занятых мест",
                    visitLedger.countAll(), slotRegistry.countOccupied());
            persistenceService.clearStore();
            visitLedger.clear();
            slotRegistry.provision(properties.getInitialSlots());
            persistenceService.save();
        });
    }

    public ParkingProperties.Facility getFacilityInfo() {
        return properties.getFacility();
    }
}
