package ru.vavtech.smartpark.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Автомобиль, находящийся на парковке (открытый визит).
 * Принадлежит ровно одному месту и превращается в {@link Transaction} при выезде.
 */
@Value
@Builder
@Jacksonized
public class Occupant {

    String id;

    /**
     * Госномер в верхнем регистре
     */
    String plateNumber;

    String driverName;

    String driverPhone;

    /**
     * Время въезда
     */
    Instant entryTime;

    /**
     * Место, которое занимает автомобиль
     */
    String slotId;
}
