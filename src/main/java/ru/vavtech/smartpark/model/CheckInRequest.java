package ru.vavtech.smartpark.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Запрос на въезд автомобиля.
 */
@Value
@Builder
@Jacksonized
public class CheckInRequest {

    @NotBlank(message = "Госномер обязателен")
    String plateNumber;

    @NotBlank(message = "Имя водителя обязательно")
    String driverName;

    String driverPhone;

    /**
     * Желаемое место. Если не указано или занято, выбирается первое свободное.
     */
    String requestedSlotId;
}
