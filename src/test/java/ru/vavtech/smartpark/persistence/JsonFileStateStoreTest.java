package ru.vavtech.smartpark.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.vavtech.smartpark.exception.StateStorageException;
import ru.vavtech.smartpark.model.Occupant;
import ru.vavtech.smartpark.model.Slot;
import ru.vavtech.smartpark.model.SlotStatus;
import ru.vavtech.smartpark.model.Transaction;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Тесты хранения состояния в JSON файле
 */
@DisplayName("Тесты хранения состояния в файле")
class JsonFileStateStoreTest {

    private static final Instant ENTRY = Instant.parse("2024-05-10T08:00:00.123Z");

    @TempDir
    Path tempDir;

    private Path stateFile;
    private JsonFileStateStore store;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
        stateFile = tempDir.resolve("state").resolve("smartpark-state.json");
        store = new JsonFileStateStore(objectMapper, stateFile);
    }

    @Test
    @DisplayName("Файла нет: состояние отсутствует")
    void loadState_MissingFile() {
        assertThat(store.loadState()).isEmpty();
    }

    @Test
    @DisplayName("Сохраненное состояние читается без потерь")
    void saveState_ThenLoad() throws IOException {
        // Given
        Occupant occupant = Occupant.builder()
                .id("o-1")
                .plateNumber("RAB123C")
                .driverName("Jean")
                .driverPhone("+250788111222")
                .entryTime(ENTRY)
                .slotId("slot-1")
                .build();
        Transaction transaction = Transaction.builder()
                .id("t-1")
                .plateNumber("RAC456D")
                .driverName("Alice")
                .entryTime(Instant.parse("2024-05-09T10:00:00Z"))
                .exitTime(Instant.parse("2024-05-09T11:30:00Z"))
                .durationMinutes(90)
                .totalFee(new BigDecimal("1000"))
                .paymentDate(Instant.parse("2024-05-09T11:30:00Z"))
                .slotNumber("A02")
                .build();
        ParkingState state = new ParkingState(
                List.of(Slot.available("slot-1", "A01").occupy(occupant), Slot.available("slot-2", "A02")),
                List.of(transaction));

        // When
        store.saveState(state);

        // Then
        assertThat(Files.readString(stateFile))
                .contains("\"OCCUPIED\"")
                .contains("2024-05-10T08:00:00.123Z");
        assertThat(Files.exists(stateFile.resolveSibling("smartpark-state.json.tmp"))).isFalse();

        ParkingState loaded = store.loadState().orElseThrow();
        assertThat(loaded).isEqualTo(state);
        assertThat(loaded.slots().get(0).status()).isEqualTo(SlotStatus.OCCUPIED);
        assertThat(loaded.slots().get(0).currentOccupant().getEntryTime()).isEqualTo(ENTRY);
    }

    @Test
    @DisplayName("Поврежденный файл: ошибка хранилища")
    void loadState_MalformedFile() throws IOException {
        Files.createDirectories(stateFile.getParent());
        Files.writeString(stateFile, "{\"slots\": [");

        assertThatThrownBy(() -> store.loadState()).isInstanceOf(StateStorageException.class);
    }

    @Test
    @DisplayName("Несогласованное место в файле отклоняется при чтении")
    void loadState_InconsistentSlot() throws IOException {
        Files.createDirectories(stateFile.getParent());
        Files.writeString(stateFile,
                "{\"slots\":[{\"id\":\"slot-1\",\"number\":\"A01\",\"status\":\"OCCUPIED\"}],\"transactions\":[]}");

        assertThatThrownBy(() -> store.loadState()).isInstanceOf(StateStorageException.class);
    }

    @Test
    @DisplayName("Очистка удаляет файл")
    void clear_DeletesFile() {
        store.saveState(new ParkingState(List.of(Slot.available("slot-1", "A01")), List.of()));

        store.clear();

        assertThat(Files.exists(stateFile)).isFalse();
        assertThat(store.loadState()).isEmpty();
    }
}
