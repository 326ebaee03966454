package ru.oparin.fpthemes.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Настройки приема тем: формат файла, лимиты, квоты и параметры диалога загрузки.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.themes")
public class ThemeProperties {

    /**
     * Обязательное расширение файла темы.
     */
    private String fileExtension = ".fptheme";

    /**
     * Максимальный размер файла темы в мегабайтах.
     */
    private Integer maxFileSizeMb = 5;

    /**
     * Количество слотов под темы, которое получает новый пользователь.
     */
    private Integer defaultSlots = 10;

    /**
     * Максимальная длина названия темы.
     */
    private Integer maxNameLength = 64;

    /**
     * Максимальная длина описания темы.
     */
    private Integer maxDescriptionLength = 512;

    /**
     * Через сколько времени бездействия незавершенный черновик считается брошенным.
     */
    private Duration draftTtl = Duration.ofMinutes(30);

    /**
     * Количество тем на одной странице магазина.
     */
    private Integer pageSize = 5;

    /**
     * Username бота без @, нужен для построения ссылок t.me.
     */
    private String botUsername = "fp_themes_bot";

    /**
     * Telegram ID администраторов.
     */
    private Set<Long> adminIds = new HashSet<>();

    public long getMaxFileSizeBytes() {
        return maxFileSizeMb * 1024L * 1024L;
    }

    public boolean isAdmin(Long userId) {
        return userId != null && adminIds.contains(userId);
    }
}
