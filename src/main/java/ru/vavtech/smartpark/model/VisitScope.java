package ru.vavtech.smartpark.model;

/**
 * Какие визиты учитываются в отчете по длительности.
 */
public enum VisitScope {

    /**
     * Автомобили на парковке, длительность на текущий момент
     */
    ACTIVE,

    /**
     * Завершенные визиты из журнала
     */
    CLOSED
}
