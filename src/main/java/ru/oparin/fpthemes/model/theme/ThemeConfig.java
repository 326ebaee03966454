package ru.oparin.fpthemes.model.theme;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Разобранный файл темы FunPay Tools.
 * Обязательные поля всегда заполнены (bgImage может быть пустой строкой),
 * необязательные равны null, если ключ отсутствует или имеет неподходящий тип.
 * Нераспознанные ключи сохраняются в extras без изменений.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThemeConfig {

    public static final String BG_COLOR_1 = "bgColor1";
    public static final String BG_COLOR_2 = "bgColor2";
    public static final String CONTAINER_BG_COLOR = "containerBgColor";
    public static final String TEXT_COLOR = "textColor";
    public static final String LINK_COLOR = "linkColor";
    public static final String FONT = "font";
    public static final String BG_IMAGE = "bgImage";
    public static final String BORDER_RADIUS = "borderRadius";
    public static final String BG_BLUR = "bgBlur";
    public static final String BG_BRIGHTNESS = "bgBrightness";

    /** Основной цвет фона */
    private String bgColor1;

    /** Второй цвет фона (градиент) */
    private String bgColor2;

    /** Цвет контейнеров */
    private String containerBgColor;

    private String textColor;

    private String linkColor;

    /** Семейство шрифта */
    private String font;

    /** Фоновое изображение: URL или data:image/...;base64 */
    private String bgImage;

    /** Радиус скругления контейнеров в пикселях */
    private Double borderRadius;

    /** Радиус размытия фонового изображения в пикселях */
    private Double bgBlur;

    /** Яркость фонового изображения в процентах, 100 - без изменений */
    private Double bgBrightness;

    @Builder.Default
    private Map<String, JsonNode> extras = new LinkedHashMap<>();

    public boolean hasBackgroundImage() {
        return bgImage != null && !bgImage.isBlank();
    }
}
