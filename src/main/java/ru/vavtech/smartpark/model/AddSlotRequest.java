package ru.vavtech.smartpark.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Запрос на добавление парковочного места.
 */
@Value
@Builder
@Jacksonized
public class AddSlotRequest {

    @NotBlank(message = "Номер места обязателен")
    String number;
}
