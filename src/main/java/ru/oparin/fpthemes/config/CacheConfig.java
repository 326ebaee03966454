package ru.oparin.fpthemes.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.oparin.fpthemes.config.properties.ThemeProperties;
import ru.oparin.fpthemes.model.submission.SubmissionDraft;

import java.awt.Font;

/**
 * Конфигурация кешей приложения.
 */
@Configuration
public class CacheConfig {

    /**
     * Черновики загрузки тем, по одному на пользователя.
     * Черновик, к которому не обращались дольше draftTtl, считается брошенным и удаляется.
     */
    @Bean
    public Cache<Long, SubmissionDraft> submissionDraftCache(ThemeProperties themeProperties) {
        return Caffeine.newBuilder()
                .expireAfterAccess(themeProperties.getDraftTtl())
                .maximumSize(100_000)
                .build();
    }

    /**
     * Шрифты рендера превью по названию семейства. Загружаются один раз за время жизни процесса.
     */
    @Bean
    public Cache<String, Font> previewFontCache() {
        return Caffeine.newBuilder()
                .maximumSize(64)
                .build();
    }
}
