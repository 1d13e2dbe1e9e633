package ru.vavtech.smartpark.model;

/**
 * Прошедшее время визита для отображения, усеченное до целых единиц.
 */
public record ElapsedTime(
        long hours,
        int minutes,
        int seconds
) {

    @Override
    public String toString() {
        return hours + "h " + minutes + "m " + seconds + "s";
    }
}
