package ru.vavtech.smartpark.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.vavtech.smartpark.model.Transaction;
import ru.vavtech.smartpark.model.TransactionPatch;
import ru.vavtech.smartpark.service.LedgerExportService;
import ru.vavtech.smartpark.service.VisitLedger;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

/**
 * REST контроллер журнала визитов: поиск, административные правки и выгрузка.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
public class LedgerController {

    private final VisitLedger visitLedger;
    private final LedgerExportService exportService;

    @GetMapping("/transactions")
    public ResponseEntity<List<Transaction>> search(
            @RequestParam(required = false) String query,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(visitLedger.search(query, from, to));
    }

    @PatchMapping("/transactions/{transactionId}")
    public ResponseEntity<Transaction> edit(@PathVariable String transactionId,
                                            @RequestBody @Valid TransactionPatch patch) {
        return ResponseEntity.ok(visitLedger.edit(transactionId, patch));
    }

    @DeleteMapping("/transactions/{transactionId}")
    public ResponseEntity<Transaction> delete(@PathVariable String transactionId) {
        return ResponseEntity.ok(visitLedger.delete(transactionId));
    }

    /**
     * Выгрузка журнала в CSV
     */
    @GetMapping("/export")
    public ResponseEntity<String> export() {
        String csv = exportService.toCsv(visitLedger.findAll());
        return ResponseEntity.ok()
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(exportService.fileName()).build().toString())
                .body(csv);
    }
}
