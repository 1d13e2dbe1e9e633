package ru.vavtech.smartpark.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.vavtech.smartpark.config.ParkingProperties;
import ru.vavtech.smartpark.model.ActiveVisit;
import ru.vavtech.smartpark.model.AddSlotRequest;
import ru.vavtech.smartpark.model.CheckInRequest;
import ru.vavtech.smartpark.model.Occupant;
import ru.vavtech.smartpark.model.Slot;
import ru.vavtech.smartpark.model.Transaction;
import ru.vavtech.smartpark.service.AllocationService;
import ru.vavtech.smartpark.service.FacilityService;
import ru.vavtech.smartpark.service.SlotRegistry;

import java.util.List;

/**
 * REST контроллер для работы с местами парковки.
 * Предоставляет API въезда, выезда, учета мест и текущей стоимости стоянки.
 */
@Slf4j
@RestController
@RequestMapping("/api/parking")
@RequiredArgsConstructor
public class ParkingController {

    private final AllocationService allocationService;
    private final SlotRegistry slotRegistry;
    private final FacilityService facilityService;

    @GetMapping("/facility")
    public ResponseEntity<ParkingProperties.Facility> getFacility() {
        return ResponseEntity.ok(facilityService.getFacilityInfo());
    }

    @GetMapping("/slots")
    public ResponseEntity<List<Slot>> getSlots() {
        return ResponseEntity.ok(slotRegistry.getSlots());
    }

    /**
     * Добавление места
     */
    @PostMapping("/slots")
    public ResponseEntity<Slot> addSlot(@RequestBody @Valid AddSlotRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(slotRegistry.addSlot(request.getNumber().trim()));
    }

    /**
     * Въезд автомобиля
     */
    @PostMapping("/check-in")
    public ResponseEntity<Occupant> checkIn(@RequestBody @Valid CheckInRequest request) {
        log.info("Запрос на въезд {} (место {})", request.getPlateNumber(), request.getRequestedSlotId());
        return ResponseEntity.status(HttpStatus.CREATED).body(allocationService.checkIn(request));
    }

    /**
     * Выезд автомобиля с расчетом платы
     */
    @PostMapping("/slots/{slotId}/check-out")
    public ResponseEntity<Transaction> checkOut(@PathVariable String slotId) {
        log.info("Запрос на выезд с места {}", slotId);
        return ResponseEntity.ok(allocationService.checkOut(slotId));
    }

    /**
     * Принудительное освобождение места без оплаты. Требует confirm=true.
     */
    @DeleteMapping("/slots/{slotId}/occupant")
    public ResponseEntity<Occupant> forceRelease(@PathVariable String slotId,
                                                 @RequestParam(defaultValue = "false") boolean confirm) {
        requireConfirmation(confirm, "принудительное освобождение места " + slotId);
        return ResponseEntity.ok(allocationService.forceRelease(slotId));
    }

    /**
     * Автомобили на парковке с текущей стоимостью, с поиском по госномеру или имени
     */
    @GetMapping("/vehicles")
    public ResponseEntity<List<ActiveVisit>> getVehicles(@RequestParam(required = false) String query) {
        return ResponseEntity.ok(allocationService.activeVisits(query));
    }

    @GetMapping("/slots/{slotId}/quote")
    public ResponseEntity<ActiveVisit> quote(@PathVariable String slotId) {
        return ResponseEntity.ok(allocationService.quote(slotId));
    }

    /**
     * Полный сброс данных парковки. Требует confirm=true.
     */
    @DeleteMapping("/state")
    public ResponseEntity<Void> purge(@RequestParam(defaultValue = "false") boolean confirm) {
        requireConfirmation(confirm, "полный сброс данных парковки");
        facilityService.purge();
        return ResponseEntity.noContent().build();
    }

    /**
     * Проверка работоспособности
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static void requireConfirmation(boolean confirm, String action) {
        if (!confirm) {
            throw new IllegalArgumentException("Операция \"" + action + "\" требует подтверждения (confirm=true)");
        }
    }
}
