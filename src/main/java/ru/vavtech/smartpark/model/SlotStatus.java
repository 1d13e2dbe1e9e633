package ru.vavtech.smartpark.model;

/**
 * Состояние парковочного места.
 */
public enum SlotStatus {

    AVAILABLE("Свободно"),
    OCCUPIED("Занято"),

    /**
     * Место выведено из оборота и не участвует в распределении
     */
    MAINTENANCE("На обслуживании");

    private final String description;

    SlotStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
