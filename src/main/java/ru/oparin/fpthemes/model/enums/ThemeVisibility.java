package ru.oparin.fpthemes.model.enums;

import java.util.Locale;

/**
 * Видимость темы.
 */
public enum ThemeVisibility {

    /**
     * Тема видна в магазине.
     */
    PUBLIC,

    /**
     * Тема доступна только по ссылке с публичным идентификатором.
     */
    PRIVATE;

    /**
     * Преобразовать ввод пользователя в ThemeVisibility.
     *
     * @param value строковое значение ("public" / "private" в любом регистре)
     * @return ThemeVisibility или null, если значение не распознано
     */
    public static ThemeVisibility fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            return ThemeVisibility.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public ThemeVisibility toggle() {
        return this == PUBLIC ? PRIVATE : PUBLIC;
    }
}
