package ru.oparin.fpthemes.service.preview;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.oparin.fpthemes.config.properties.PreviewProperties;

import java.awt.Font;
import java.awt.FontFormatException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Шрифты для превью. Файл семейства ищется в каталоге шрифтов один раз,
 * дальше используется кеш. Если файла нет, используется логический шрифт SansSerif.
 */
@Slf4j
@Component
public class PreviewFontResolver {

    static final String FALLBACK_FAMILY = Font.SANS_SERIF;
    private static final List<String> EXTENSIONS = List.of(".ttf", ".otf");

    private final Cache<String, Font> previewFontCache;
    private final Path fontsDir;

    public PreviewFontResolver(Cache<String, Font> previewFontCache, PreviewProperties previewProperties) {
        this.previewFontCache = previewFontCache;
        this.fontsDir = Paths.get(previewProperties.getFontsDir());
    }

    /**
     * Шрифт семейства нужного размера.
     *
     * @param family название семейства из темы
     * @param size   размер в пунктах
     */
    public Font resolve(String family, float size) {
        String key = family == null || family.isBlank() ? FALLBACK_FAMILY : family.trim();
        return previewFontCache.get(key, this::load).deriveFont(Font.PLAIN, size);
    }

    private Font load(String family) {
        if (!family.contains("/") && !family.contains("\\") && !family.contains("..")) {
            for (String extension : EXTENSIONS) {
                Path file = fontsDir.resolve(family + extension);
                if (Files.isRegularFile(file)) {
                    try {
                        Font font = Font.createFont(Font.TRUETYPE_FONT, file.toFile());
                        log.info("Загружен шрифт {} из {}", family, file);
                        return font;
                    } catch (FontFormatException | IOException e) {
                        log.warn("Не удалось загрузить шрифт {}: {}", file, e.getMessage());
                    }
                }
            }
        }
        log.debug("Шрифт {} не найден, используется {}", family, FALLBACK_FAMILY);
        return new Font(FALLBACK_FAMILY, Font.PLAIN, 12);
    }
}
