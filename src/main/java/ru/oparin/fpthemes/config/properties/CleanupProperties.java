package ru.oparin.fpthemes.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Настройки очистки файлов на диске.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.cleanup")
public class CleanupProperties {

    /**
     * Минимальный возраст временного файла, после которого он удаляется планировщиком.
     */
    private Duration tempMaxAge = Duration.ofHours(1);

    /**
     * Минимальный возраст файла превью без темы, после которого он удаляется.
     * Превью только что завершенной загрузки еще может не иметь строки в таблице.
     */
    private Duration orphanPreviewMinAge = Duration.ofHours(24);
}
