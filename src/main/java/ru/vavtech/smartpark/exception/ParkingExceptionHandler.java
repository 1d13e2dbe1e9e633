package ru.vavtech.smartpark.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Глобальный обработчик исключений для REST API парковки.
 * Обеспечивает единообразную обработку ошибок.
 */
@Slf4j
@ControllerAdvice
public class ParkingExceptionHandler {

    /**
     * Обработка общих исключений
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex, WebRequest request) {
        log.error("Необработанная ошибка парковки", ex);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Техническая ошибка",
                "Попробуйте позже или обратитесь к администратору", request);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex, WebRequest request) {
        log.warn("Объект не найден: {}", ex.getMessage());
        return errorResponse(HttpStatus.NOT_FOUND, "Не найдено", ex.getMessage(), request);
    }

    /**
     * Нарушение переходов состояния места: нет мест, место занято или уже свободно
     */
    @ExceptionHandler({NoCapacityException.class, SlotUnavailableException.class, SlotNotOccupiedException.class})
    public ResponseEntity<Map<String, Object>> handleSlotState(ParkingException ex, WebRequest request) {
        log.warn("Операция отклонена: {}", ex.getMessage());
        return errorResponse(HttpStatus.CONFLICT, "Недопустимое состояние места", ex.getMessage(), request);
    }

    @ExceptionHandler({InvalidTransactionException.class, NegativeDurationException.class})
    public ResponseEntity<Map<String, Object>> handleInvalidTransaction(ParkingException ex, WebRequest request) {
        log.warn("Некорректные данные визита: {}", ex.getMessage());
        return errorResponse(HttpStatus.UNPROCESSABLE_ENTITY, "Некорректные данные визита", ex.getMessage(), request);
    }

    /**
     * Обработка ошибок валидации входных данных
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(IllegalArgumentException ex, WebRequest request) {
        log.warn("Ошибка валидации: {}", ex.getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, "Ошибка в данных запроса", String.valueOf(ex.getMessage()), request);
    }

    /**
     * Параметр запроса или пути не приводится к нужному типу (число, дата, перечисление)
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                                  WebRequest request) {
        String message = "Недопустимое значение параметра " + ex.getName() + ": " + ex.getValue();
        log.warn("Ошибка валидации запроса: {}", message);
        return errorResponse(HttpStatus.BAD_REQUEST, "Ошибка в данных запроса", message, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                                    WebRequest request) {
        log.warn("Некорректное тело запроса: {}", ex.getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, "Ошибка в данных запроса",
                "Тело запроса не является корректным JSON нужного формата", request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleBeanValidation(MethodArgumentNotValidException ex, WebRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Ошибка валидации запроса: {}", message);
        return errorResponse(HttpStatus.BAD_REQUEST, "Ошибка в данных запроса", message, request);
    }

    @ExceptionHandler(StateStorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(StateStorageException ex, WebRequest request) {
        log.error("Ошибка хранилища состояния", ex);
        return errorResponse(HttpStatus.SERVICE_UNAVAILABLE, "Хранилище недоступно", ex.getMessage(), request);
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String error,
                                                              String message, WebRequest request) {
        Map<String, Object> errorDetails = Map.of(
                "timestamp", LocalDateTime.now(),
                "status", status.value(),
                "error", error,
                "message", message,
                "path", request.getDescription(false)
        );
        return ResponseEntity.status(status).body(errorDetails);
    }
}
