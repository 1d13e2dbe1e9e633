package ru.vavtech.smartpark.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import ru.vavtech.smartpark.exception.NoCapacityException;
import ru.vavtech.smartpark.model.CheckInRequest;
import ru.vavtech.smartpark.model.FacilityStats;
import ru.vavtech.smartpark.model.Occupant;
import ru.vavtech.smartpark.model.Transaction;
import ru.vavtech.smartpark.persistence.ParkingStateStore;
import ru.vavtech.smartpark.persistence.StatePersistenceService;
import ru.vavtech.smartpark.support.MutableClock;
import ru.vavtech.smartpark.support.TestClockConfiguration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Интеграционные тесты парковки.
 * Тестируют полный цикл: въезд -> текущая стоимость -> выезд -> журнал и отчеты.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfiguration.class)
@DisplayName("Интеграционные тесты въезда и выезда")
class AllocationServiceIntegrationTest {

    @Autowired
    private AllocationService allocationService;

    @Autowired
    private FacilityService facilityService;

    @Autowired
    private ReportingService reportingService;

    @Autowired
    private VisitLedger visitLedger;

    @Autowired
    private StatePersistenceService persistenceService;

    @Autowired
    private ParkingStateStore stateStore;

    @Autowired
    private MutableClock clock;

    @Autowired
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        // Сбрасываем парковку и часы перед каждым тестом
        clock.set(TestClockConfiguration.START);
        facilityService.purge();
    }

    @Test
    @DisplayName("Полный цикл: въезд, выезд, журнал, сводка и сохранение")
    void fullCycle_CheckInAndCheckOut() {
        // Given - автомобиль въезжает
        Occupant occupant = allocationService.checkIn(CheckInRequest.builder()
                .plateNumber("rab 123 c")
                .driverName("Jean Driver")
                .driverPhone("+250788111222")
                .build());
        assertThat(occupant.getPlateNumber()).isEqualTo("RAB 123 C");

        // When - через 2 часа 5 минут автомобиль выезжает
        clock.advance(Duration.ofMinutes(125));
        Transaction transaction = allocationService.checkOut(occupant.getSlotId());

        // Then - 3 часа по 500
        assertThat(transaction.getTotalFee()).isEqualByComparingTo("1500");
        assertThat(transaction.getDurationMinutes()).isEqualTo(125);
        assertThat(visitLedger.findAll()).containsExactly(transaction);

        FacilityStats stats = reportingService.getStats();
        assertThat(stats.getTotalRevenue()).isEqualByComparingTo("1500");
        assertThat(stats.getTotalEntries()).isEqualTo(1);
        assertThat(stats.getOccupiedSlots()).isZero();
        assertThat(stats.getTotalSlots()).isEqualTo(3);

        // Проверяем что изменения попадают в хранилище при очередной проверке
        assertThat(persistenceService.isDirty()).isTrue();
        persistenceService.flushIfDirty();
        assertThat(stateStore.loadState().orElseThrow().transactions()).containsExactly(transaction);
    }

    @Test
    @DisplayName("Одновременные въезды не занимают больше мест, чем есть")
    void concurrentCheckIns_NeverExceedCapacity() throws InterruptedException {
        // Given - 10 автомобилей на 3 места
        ExecutorService executor = Executors.newFixedThreadPool(10);
        List<Callable<Occupant>> tasks = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            String plate = "RAA" + i;
            tasks.add(() -> allocationService.checkIn(CheckInRequest.builder()
                    .plateNumber(plate)
                    .driverName("Driver " + plate)
                    .build()));
        }

        // When
        List<Future<Occupant>> results = executor.invokeAll(tasks);
        executor.shutdown();

        // Then - ровно 3 успешных въезда, остальные отклонены
        int admitted = 0;
        int rejected = 0;
        List<String> slotIds = new ArrayList<>();
        for (Future<Occupant> result : results) {
            try {
                slotIds.add(result.get().getSlotId());
                admitted++;
            } catch (ExecutionException e) {
                assertThat(e.getCause()).isInstanceOf(NoCapacityException.class);
                rejected++;
            }
        }
        assertThat(admitted).isEqualTo(3);
        assertThat(rejected).isEqualTo(7);
        assertThat(slotIds).doesNotHaveDuplicates();
        assertThat(reportingService.getStats().getUtilizationPercent()).isEqualTo(100);
    }

    @Test
    @DisplayName("REST: въезд и выезд через API")
    void restApi_CheckInAndCheckOut() throws Exception {
        // Given - въезд на место slot-2
        mockMvc.perform(post("/api/parking/check-in")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"plateNumber\":\"RAC456D\",\"driverName\":\"Alice\",\"requestedSlotId\":\"slot-2\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.slotId").value("slot-2"))
                .andExpect(jsonPath("$.entryTime").value("2024-05-10T08:00:00Z"));

        // When - через 20 минут запрашиваем стоимость и выезжаем
        clock.advance(Duration.ofMinutes(20));

        mockMvc.perform(get("/api/parking/slots/slot-2/quote"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentFee").value(500));

        mockMvc.perform(post("/api/parking/slots/slot-2/check-out"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalFee").value(500))
                .andExpect(jsonPath("$.slotNumber").value("A02"));

        // Then - повторный выезд отклоняется, журнал выгружается
        mockMvc.perform(post("/api/parking/slots/slot-2/check-out"))
                .andExpect(status().isConflict());

        mockMvc.perform(get("/api/ledger/export"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition",
                        "attachment; filename=\"SmartPark_Ledger_2024-05-10.csv\""))
                .andExpect(content().string(containsString("\"RAC456D\",\"Alice\"")));
    }
}
