package ru.oparin.fpthemes.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Настройки рендера превью темы.
 * Результат рендера зависит только от конфигурации темы и этих параметров.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.preview")
public class PreviewProperties {

    /** Ширина холста в пикселях. */
    private Integer width = 1280;

    /** Высота холста в пикселях. */
    private Integer height = 720;

    /** Качество JPEG (0.0–1.0). */
    private Float jpegQuality = 0.85f;

    /** Непрозрачность панели в диапазоне [0, 1]. */
    private Double barOpacity = 0.85;

    /** Во сколько раз увеличивается borderRadius темы при отрисовке панели. */
    private Double cornerRadiusScale = 2.0;

    /** Верхняя граница радиуса размытия фона. */
    private Integer maxBlurRadius = 40;

    /** Таймаут загрузки удаленного фонового изображения. */
    private Duration remoteTimeout = Duration.ofSeconds(10);

    /** Максимальный размер удаленного фонового изображения в байтах. */
    private Integer remoteMaxBytes = 10 * 1024 * 1024;

    /** Фоновое изображение с большим числом пикселей не декодируется. */
    private Long maxBackgroundPixels = 16_000_000L;

    /** Каталог со шрифтами (*.ttf, *.otf), имя файла совпадает с названием семейства. */
    private String fontsDir = "./fonts";
}
