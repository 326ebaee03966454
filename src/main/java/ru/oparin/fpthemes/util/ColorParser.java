package ru.oparin.fpthemes.util;

import lombok.experimental.UtilityClass;

import java.awt.Color;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Разбор CSS-подобных цветов из файла темы.
 * Поддерживаются #rgb, #rgba, #rrggbb, #rrggbbaa, rgb(r, g, b) и rgba(r, g, b, a).
 */
@UtilityClass
public class ColorParser {

    private static final Pattern HEX_PATTERN = Pattern.compile("#([0-9a-fA-F]{3,4}|[0-9a-fA-F]{6}|[0-9a-fA-F]{8})");
    private static final Pattern RGB_PATTERN = Pattern.compile(
            "rgba?\\(\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*,\\s*(\\d{1,3})\\s*(?:,\\s*([0-9]*\\.?[0-9]+)\\s*)?\\)");

    /**
     * Разобрать цвет.
     *
     * @param value    строка цвета из темы (может быть null)
     * @param fallback цвет по умолчанию
     * @return разобранный цвет или fallback, если строка некорректна
     */
    public static Color parseOrDefault(String value, Color fallback) {
        Color parsed = parse(value);
        return parsed != null ? parsed : fallback;
    }

    /**
     * Разобрать цвет.
     *
     * @return цвет или null, если строка не является поддерживаемым цветом
     */
    public static Color parse(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim().toLowerCase(Locale.ROOT);

        Matcher hex = HEX_PATTERN.matcher(trimmed);
        if (hex.matches()) {
            return parseHex(hex.group(1));
        }

        Matcher rgb = RGB_PATTERN.matcher(trimmed);
        if (rgb.matches()) {
            boolean hasAlpha = rgb.group(4) != null;
            if (hasAlpha != trimmed.startsWith("rgba")) {
                return null;
            }
            int r = Integer.parseInt(rgb.group(1));
            int g = Integer.parseInt(rgb.group(2));
            int b = Integer.parseInt(rgb.group(3));
            if (r > 255 || g > 255 || b > 255) {
                return null;
            }
            double alpha = hasAlpha ? Double.parseDouble(rgb.group(4)) : 1.0;
            if (alpha > 1.0) {
                return null;
            }
            return new Color(r, g, b, (int) Math.round(alpha * 255));
        }
        return null;
    }

    /**
     * Контрастный цвет обводки: черный для светлых цветов, белый для темных.
     */
    public static Color contrastingOutline(Color color) {
        double luminance = 0.299 * color.getRed() + 0.587 * color.getGreen() + 0.114 * color.getBlue();
        return luminance > 128 ? Color.BLACK : Color.WHITE;
    }

    private static Color parseHex(String digits) {
        String expanded = digits;
        if (digits.length() <= 4) {
            StringBuilder sb = new StringBuilder();
            for (char c : digits.toCharArray()) {
                sb.append(c).append(c);
            }
            expanded = sb.toString();
        }
        int r = Integer.parseInt(expanded.substring(0, 2), 16);
        int g = Integer.parseInt(expanded.substring(2, 4), 16);
        int b = Integer.parseInt(expanded.substring(4, 6), 16);
        int a = expanded.length() == 8 ? Integer.parseInt(expanded.substring(6, 8), 16) : 255;
        return new Color(r, g, b, a);
    }
}
