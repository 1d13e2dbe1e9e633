package ru.vavtech.smartpark.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Общая блокировка парковки.
 * <p>
 * Под ней выполняются составные операции, затрагивающие и реестр мест, и журнал:
 * въезд, выезд, принудительное освобождение, сброс данных и снятие среза для сохранения.
 * Блокировка реентерабельна, поэтому сохранение можно вызывать из-под уже захваченной блокировки.
 */
@Component
public class FacilityLock {

    private final ReentrantLock lock = new ReentrantLock();

    public <T> T callLocked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }
}
