package ru.vavtech.smartpark.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import ru.vavtech.smartpark.model.Tariff;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Настройки парковки (префикс {@code smartpark}).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "smartpark")
public class ParkingProperties {

    /**
     * Количество мест при первичном заполнении реестра
     */
    @Min(0)
    private int initialSlots = 24;

    /**
     * Часовой пояс для отчетов по дням и часам
     */
    @NotNull
    private ZoneId zoneId = ZoneId.of("Africa/Kigali");

    @Valid
    private TariffSettings tariff = new TariffSettings();

    @Valid
    private Facility facility = new Facility();

    @Valid
    private Storage storage = new Storage();

    @Valid
    private Insights insights = new Insights();

    public Tariff toTariff() {
        return new Tariff(tariff.getHourlyRate(), tariff.getMinFee());
    }

    @Data
    public static class TariffSettings {

        @NotNull
        @PositiveOrZero
        private BigDecimal hourlyRate = new BigDecimal("500");

        @NotNull
        @PositiveOrZero
        private BigDecimal minFee = new BigDecimal("300");
    }

    @Data
    public static class Facility {

        @NotBlank
        private String name = "SmartPark Rubavu";
        private String district = "Rubavu";
        private String province = "Western Province";
        private String country = "Rwanda";
        private String contact = "+250 788 000 000";
        private String currency = "RWF";
    }

    @Data
    public static class Storage {

        /**
         * file - JSON файл на диске, memory - только в памяти процесса
         */
        @NotBlank
        private String type = "file";

        @NotNull
        private Path path = Path.of("data", "smartpark-state.json");

        /**
         * Пауза между проверками несохраненных изменений
         */
        @Min(100)
        private long flushIntervalMs = 5000;
    }

    @Data
    public static class Insights {

        private boolean enabled = false;

        private String url;

        @Min(1)
        private int recentTransactions = 10;

        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        @NotBlank
        private String fallbackMessage =
                "Не удалось получить аналитику. Проверьте подключение и повторите попытку позже.";
    }
}
