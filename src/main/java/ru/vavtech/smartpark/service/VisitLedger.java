package ru.vavtech.smartpark.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.vavtech.smartpark.config.ParkingProperties;
import ru.vavtech.smartpark.exception.InvalidTransactionException;
import ru.vavtech.smartpark.exception.TransactionNotFoundException;
import ru.vavtech.smartpark.model.DailyRevenue;
import ru.vavtech.smartpark.model.DurationBucket;
import ru.vavtech.smartpark.model.HourlyLoad;
import ru.vavtech.smartpark.model.Transaction;
import ru.vavtech.smartpark.model.TransactionPatch;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.stream.IntStream;

/**
 * Журнал завершенных визитов.
 * <p>
 * Записи только добавляются. Исключение составляют явные административные
 * операции {@link #edit} и {@link #delete}. Все отчеты по истории
 * (выручка по дням, загрузка по часам, распределение длительностей)
 * строятся из журнала.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VisitLedger {

    /**
     * Наибольший период отчета по дням
     */
    static final int MAX_REPORT_DAYS = 366;

    private final ParkingProperties properties;

    /**
     * Записи в порядке добавления. Ключ: идентификатор записи
     */
    private final Map<String, Transaction> transactions = new LinkedHashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final AtomicLong version = new AtomicLong();

    /**
     * Добавление записи в журнал
     *
     * @throws InvalidTransactionException если выезд не позже въезда или плата ниже минимальной
     */
    public Transaction append(Transaction transaction) {
        validate(transaction);
        lock.writeLock().lock();
        try {
            if (transactions.containsKey(transaction.getId())) {
                throw new InvalidTransactionException("Запись " + transaction.getId() + " уже есть в журнале");
            }
            transactions.put(transaction.getId(), transaction);
            version.incrementAndGet();
            log.debug("В журнал добавлена запись {} на сумму {}", transaction.getId(), transaction.getTotalFee());
            return transaction;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public BigDecimal revenueTotal() {
        return findAll().stream()
                .map(Transaction::getTotalFee)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public int countAll() {
        lock.readLock().lock();
        try {
            return transactions.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Выручка по дням выезда за период включительно.
     * Дни без визитов присутствуют в результате с нулевой суммой.
     */
    public List<DailyRevenue> revenueByDay(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Начало периода " + from + " позже конца " + to);
        }
        if (ChronoUnit.DAYS.between(from, to) >= MAX_REPORT_DAYS) {
            throw new IllegalArgumentException("Период " + from + " - " + to
                    + " длиннее " + MAX_REPORT_DAYS + " дней");
        }
        ZoneId zone = properties.getZoneId();

        Map<LocalDate, BigDecimal> totals = new LinkedHashMap<>();
        from.datesUntil(to.plusDays(1)).forEach(date -> totals.put(date, BigDecimal.ZERO));

        for (Transaction transaction : findAll()) {
            LocalDate exitDate = LocalDate.ofInstant(transaction.getExitTime(), zone);
            totals.computeIfPresent(exitDate, (date, sum) -> sum.add(transaction.getTotalFee()));
        }

        return totals.entrySet().stream()
                .map(entry -> new DailyRevenue(entry.getKey(), entry.getValue()))
                .toList();
    }

    /**
     * Количество въездов по часам суток (0-23)
     */
    public List<HourlyLoad> entriesByHourOfDay() {
        ZoneId zone = properties.getZoneId();
        long[] counts = new long[24];
        findAll().forEach(transaction -> counts[transaction.getEntryTime().atZone(zone).getHour()]++);
        return IntStream.range(0, 24)
                .mapToObj(hour -> new HourlyLoad(hour, counts[hour]))
                .toList();
    }

    /**
     * Распределение завершенных визитов по длительности
     */
    public Map<String, Long> durationHistogram(List<DurationBucket> buckets) {
        List<Duration> durations = findAll().stream()
                .map(transaction -> Duration.ofMinutes(transaction.getDurationMinutes()))
                .toList();
        return DurationHistogram.of(buckets, durations);
    }

    /**
     * Административная правка записи. Плата и длительность не пересчитываются,
     * но результат проверяется теми же правилами, что и при добавлении.
     */
    public Transaction edit(String transactionId, TransactionPatch patch) {
        lock.writeLock().lock();
        try {
            Transaction existing = getExisting(transactionId);
            Transaction edited = patch.applyTo(existing);
            validate(edited);
            transactions.put(transactionId, edited);
            version.incrementAndGet();
            log.warn("Запись журнала {} изменена вручную", transactionId);
            return edited;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Административное удаление записи
     */
    public Transaction delete(String transactionId) {
        lock.writeLock().lock();
        try {
            Transaction removed = getExisting(transactionId);
            transactions.remove(transactionId);
            version.incrementAndGet();
            log.warn("Запись журнала {} ({}, {}) удалена вручную",
                    transactionId, removed.getPlateNumber(), removed.getTotalFee());
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Transaction> findById(String transactionId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(transactions.get(transactionId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Все записи в порядке добавления
     */
    public List<Transaction> findAll() {
        lock.readLock().lock();
        try {
            return List.copyOf(transactions.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Поиск по госномеру или имени водителя с необязательным фильтром по дате выезда
     *
     * @param query подстрока госномера или имени, может быть пустой
     * @param from первый день периода или null
     * @param to последний день периода или null
     */
    public List<Transaction> search(String query, LocalDate from, LocalDate to) {
        Predicate<Transaction> filter = transaction -> true;

        if (query != null && !query.isBlank()) {
            String plateQuery = query.trim().toUpperCase(Locale.ROOT);
            String nameQuery = query.trim().toLowerCase(Locale.ROOT);
            filter = filter.and(transaction -> transaction.getPlateNumber().contains(plateQuery)
                    || transaction.getDriverName().toLowerCase(Locale.ROOT).contains(nameQuery));
        }

        ZoneId zone = properties.getZoneId();
        if (from != null) {
            filter = filter.and(transaction -> !LocalDate.ofInstant(transaction.getExitTime(), zone).isBefore(from));
        }
        if (to != null) {
            filter = filter.and(transaction -> !LocalDate.ofInstant(transaction.getExitTime(), zone).isAfter(to));
        }

        return findAll().stream().filter(filter).toList();
    }

    /**
     * Последние {@code limit} записей, от старых к новым
     */
    public List<Transaction> recent(int limit) {
        List<Transaction> all = findAll();
        return all.subList(Math.max(0, all.size() - limit), all.size());
    }

    /**
     * Проверка записей перед восстановлением журнала.
     * Минимальная плата не проверяется: записи рассчитаны по тарифу, действовавшему на момент выезда.
     *
     * @throws InvalidTransactionException если запись неполная, выезд не позже въезда или идентификаторы повторяются
     */
    public void checkRestorable(List<Transaction> restored) {
        Set<String> ids = new HashSet<>();
        for (Transaction transaction : restored) {
            validateRecord(transaction);
            if (!ids.add(transaction.getId())) {
                throw new InvalidTransactionException("Повторяющийся идентификатор записи: " + transaction.getId());
            }
        }
    }

    /**
     * Восстановление журнала из сохраненного состояния
     */
    public void restore(List<Transaction> restored) {
        checkRestorable(restored);
        lock.writeLock().lock();
        try {
            transactions.clear();
            restored.forEach(transaction -> transactions.put(transaction.getId(), transaction));
            version.incrementAndGet();
            log.info("Журнал визитов восстановлен: {} записей", transactions.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        restore(new ArrayList<>());
    }

    public long getVersion() {
        return version.get();
    }

    private void validate(Transaction transaction) {
        validateRecord(transaction);
        BigDecimal minFee = properties.getTariff().getMinFee();
        if (transaction.getTotalFee().compareTo(minFee) < 0) {
            throw new InvalidTransactionException("Плата " + transaction.getTotalFee()
                    + " меньше минимальной " + minFee);
        }
    }

    private static void validateRecord(Transaction transaction) {
        if (transaction.getId() == null || transaction.getPlateNumber() == null
                || transaction.getDriverName() == null || transaction.getEntryTime() == null
                || transaction.getExitTime() == null || transaction.getTotalFee() == null) {
            throw new InvalidTransactionException("В записи журнала не заполнены обязательные поля");
        }
        if (!transaction.getExitTime().isAfter(transaction.getEntryTime())) {
            throw new InvalidTransactionException("Время выезда " + transaction.getExitTime()
                    + " должно быть позже времени въезда " + transaction.getEntryTime());
        }
        if (transaction.getTotalFee().signum() < 0) {
            throw new InvalidTransactionException("Плата не может быть отрицательной: " + transaction.getTotalFee());
        }
    }

    private Transaction getExisting(String transactionId) {
        Transaction transaction = transactions.get(transactionId);
        if (transaction == null) {
            throw new TransactionNotFoundException(transactionId);
        }
        return transaction;
    }
}
