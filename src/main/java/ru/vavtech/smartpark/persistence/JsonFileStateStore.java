package ru.vavtech.smartpark.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import ru.vavtech.smartpark.config.ParkingProperties;
import ru.vavtech.smartpark.exception.StateStorageException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Хранение состояния в JSON файле.
 * <p>
 * Запись идет во временный файл рядом с основным, затем файл атомарно
 * заменяется, поэтому при сбое на диске остается предыдущее полное состояние.
 * Время сохраняется в формате ISO-8601, статусы мест по имени.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "smartpark.storage", name = "type", havingValue = "file", matchIfMissing = true)
public class JsonFileStateStore implements ParkingStateStore {

    private final ObjectMapper objectMapper;
    private final Path path;

    @Autowired
    public JsonFileStateStore(ObjectMapper objectMapper, ParkingProperties properties) {
        this(objectMapper, properties.getStorage().getPath());
    }

    public JsonFileStateStore(ObjectMapper objectMapper, Path path) {
        this.objectMapper = objectMapper;
        this.path = path;
    }

    @Override
    public Optional<ParkingState> loadState() {
        if (!Files.exists(path)) {
            log.info("Файл состояния {} не найден", path);
            return Optional.empty();
        }
        try {
            ParkingState state = objectMapper.readValue(path.toFile(), ParkingState.class);
            log.info("Состояние загружено из {}: {} мест, {} записей журнала",
                    path, state.slots().size(), state.transactions().size());
            return Optional.of(state);
        } catch (IOException e) {
            throw new StateStorageException("Не удалось прочитать состояние из " + path, e);
        }
    }

    @Override
    public void saveState(ParkingState state) {
        Path absolute = path.toAbsolutePath();
        Path temp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
        try {
            if (absolute.getParent() != null) {
                Files.createDirectories(absolute.getParent());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
            Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Состояние сохранено в {}", absolute);
        } catch (IOException e) {
            throw new StateStorageException("Не удалось сохранить состояние в " + absolute, e);
        }
    }

    @Override
    public void clear() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new StateStorageException("Не удалось удалить файл состояния " + path, e);
        }
    }
}
