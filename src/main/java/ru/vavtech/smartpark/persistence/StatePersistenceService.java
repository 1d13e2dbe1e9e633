package ru.vavtech.smartpark.persistence;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import ru.vavtech.smartpark.service.FacilityLock;
import ru.vavtech.smartpark.service.SlotRegistry;
import ru.vavtech.smartpark.service.VisitLedger;

import java.util.Optional;

/**
 * Сохранение состояния парковки с задержкой.
 * <p>
 * Изменения не записываются после каждой операции: периодическая задача
 * сравнивает счетчики изменений реестра и журнала с последним сохранением
 * и записывает состояние только при расхождении. При остановке приложения
 * выполняется последняя запись.
 * <p>
 * Срез состояния снимается под общей блокировкой парковки, поэтому въезд
 * или выезд не могут попасть между чтением реестра и чтением журнала.
 * Загрузка восстанавливает реестр и журнал только если обе части прошли проверку.
 * <p>
 * Ошибки хранилища пробрасываются вызывающей стороне без повторных попыток.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatePersistenceService {

    private final ParkingStateStore stateStore;
    private final SlotRegistry slotRegistry;
    private final VisitLedger visitLedger;
    private final FacilityLock facilityLock;

    private final Object monitor = new Object();

    private long savedRegistryVersion = -1;
    private long savedLedgerVersion = -1;

    /**
     * Загрузка сохраненного состояния в реестр и журнал
     *
     * @return true если состояние было найдено и восстановлено
     */
    public boolean load() {
        return facilityLock.callLocked(() -> {
            synchronized (monitor) {
                Optional<ParkingState> state = stateStore.loadState();
                if (state.isEmpty()) {
                    return false;
                }
                slotRegistry.checkRestorable(state.get().slots());
                visitLedger.checkRestorable(state.get().transactions());

                slotRegistry.restore(state.get().slots());
                visitLedger.restore(state.get().transactions());
                markSaved();
                return true;
            }
        });
    }

    /**
     * Немедленное сохранение текущего состояния
     */
    public void save() {
        facilityLock.runLocked(() -> {
            synchronized (monitor) {
                long registryVersion = slotRegistry.getVersion();
                long ledgerVersion = visitLedger.getVersion();
                stateStore.saveState(snapshot());
                savedRegistryVersion = registryVersion;
                savedLedgerVersion = ledgerVersion;
                log.debug("Состояние парковки сохранено (реестр v{}, журнал v{})", registryVersion, ledgerVersion);
            }
        });
    }

    public boolean isDirty() {
        synchronized (monitor) {
            return slotRegistry.getVersion() != savedRegistryVersion
                    || visitLedger.getVersion() != savedLedgerVersion;
        }
    }

    /**
     * Сохранение, если с прошлой записи были изменения
     */
    @Scheduled(fixedDelayString = "${smartpark.storage.flush-interval-ms:5000}")
    public void flushIfDirty() {
        if (isDirty()) {
            save();
        }
    }

    @PreDestroy
    public void flushOnShutdown() {
        log.info("Сохранение состояния парковки перед остановкой");
        flushIfDirty();
    }

    /**
     * Удаление сохраненного состояния из хранилища
     */
    public void clearStore() {
        synchronized (monitor) {
            stateStore.clear();
            savedRegistryVersion = -1;
            savedLedgerVersion = -1;
        }
    }

    /**
     * Согласованный срез реестра и журнала
     */
    public ParkingState snapshot() {
        return facilityLock.callLocked(() -> new ParkingState(slotRegistry.getSlots(), visitLedger.findAll()));
    }

    private void markSaved() {
        savedRegistryVersion = slotRegistry.getVersion();
        savedLedgerVersion = visitLedger.getVersion();
    }
}
