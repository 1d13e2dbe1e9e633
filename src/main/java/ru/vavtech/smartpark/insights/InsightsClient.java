package ru.vavtech.smartpark.insights;

import ru.vavtech.smartpark.model.InsightsSnapshot;

/**
 * Внешний сервис, формирующий текстовую сводку по данным парковки.
 */
public interface InsightsClient {

    /**
     * @param snapshot сводные показатели и последние визиты
     * @return текст сводки
     */
    String summarize(InsightsSnapshot snapshot);
}
