package ru.vavtech.smartpark.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import ru.vavtech.smartpark.config.ParkingProperties;
import ru.vavtech.smartpark.model.LedgerRow;
import ru.vavtech.smartpark.model.Transaction;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Выгрузка журнала визитов в табличном виде.
 * Строки идут в порядке записей журнала, время приводится к часовому поясу парковки.
 */
@Service
@RequiredArgsConstructor
public class LedgerExportService {

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ParkingProperties properties;
    private final Clock clock;

    public List<LedgerRow> rows(List<Transaction> transactions) {
        ZoneId zone = properties.getZoneId();
        return transactions.stream()
                .map(transaction -> new LedgerRow(
                        transaction.getPlateNumber(),
                        transaction.getDriverName(),
                        LocalDateTime.ofInstant(transaction.getEntryTime(), zone),
                        LocalDateTime.ofInstant(transaction.getExitTime(), zone),
                        transaction.getDurationMinutes(),
                        transaction.getTotalFee(),
                        transaction.getSlotNumber()))
                .toList();
    }

    /**
     * CSV: заголовок и по строке на запись, текстовые ячейки в кавычках
     */
    public String toCsv(List<Transaction> transactions) {
        String header = String.join(",", "Plate Number", "Driver Name", "Entry Time", "Exit Time",
                "Duration (min)", "Total Fee (" + properties.getFacility().getCurrency() + ")", "Slot Number");

        Stream<String> lines = rows(transactions).stream()
                .map(row -> String.join(",",
                        quote(row.plateNumber()),
                        quote(row.driverName()),
                        quote(DATE_TIME.format(row.entryTime())),
                        quote(DATE_TIME.format(row.exitTime())),
                        String.valueOf(row.durationMinutes()),
                        row.totalFee().toPlainString(),
                        quote(row.slotNumber())));

        return Stream.concat(Stream.of(header), lines).collect(Collectors.joining("\n"));
    }

    /**
     * Имя файла выгрузки с текущей датой
     */
    public String fileName() {
        return "SmartPark_Ledger_" + LocalDate.now(clock.withZone(properties.getZoneId())) + ".csv";
    }

    private static String quote(String value) {
        return "\"" + (value == null ? "" : value.replace("\"", "\"\"")) + "\"";
    }
}
