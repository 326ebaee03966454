package ru.oparin.fpthemes.model.enums;

/**
 * Результат шага диалога загрузки темы.
 * Ошибки ввода оставляют этап без изменений, ошибки финализации завершают диалог.
 */
public enum SubmissionStatus {

    /** Шаг принят, диалог перешел к следующему этапу */
    ACCEPTED,

    /** Тема сохранена */
    COMPLETED,

    QUOTA_EXCEEDED,
    BANNED,
    NO_ACTIVE_DRAFT,
    WRONG_STAGE,

    INVALID_FORMAT,
    TOO_LARGE,
    DUPLICATE_CONTENT,
    INVALID_STRUCTURE,
    DOWNLOAD_FAILED,

    INVALID_NAME,
    INVALID_DESCRIPTION,
    INVALID_VISIBILITY,

    /** Не удалось отрисовать превью */
    RENDER_FAILED,

    /** Такую же тему успели сохранить параллельно */
    STORAGE_CONFLICT,

    /** Хранилище недоступно */
    STORAGE_FAILED
}
