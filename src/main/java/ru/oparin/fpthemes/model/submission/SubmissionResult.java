package ru.oparin.fpthemes.model.submission;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import ru.oparin.fpthemes.model.enums.SubmissionStage;
import ru.oparin.fpthemes.model.enums.SubmissionStatus;
import ru.oparin.fpthemes.model.enums.ThemeVisibility;

/**
 * Типизированный результат шага диалога загрузки.
 * stage - этап диалога после шага (null, если черновика нет).
 */
@Getter
@Builder
@AllArgsConstructor
@ToString(exclude = "previewImage")
public class SubmissionResult {

    private final SubmissionStatus status;

    private final SubmissionStage stage;

    /** Сколько слотов осталось у пользователя (для startUpload и submitFile) */
    private final Integer remainingSlots;

    /** Сколько всего слотов у пользователя */
    private final Integer totalSlots;

    /** Внутренний id сохраненной темы */
    private final Long themeId;

    /** Публичный идентификатор сохраненной темы */
    private final String publicId;

    private final String themeName;

    private final ThemeVisibility visibility;

    /** JPEG превью сохраненной темы */
    private final byte[] previewImage;

    /** Имя файла превью в хранилище */
    private final String previewRef;

    /** Пояснение к ошибке для логов */
    private final String detail;

    public boolean isSuccess() {
        return status == SubmissionStatus.ACCEPTED || status == SubmissionStatus.COMPLETED;
    }

    public static SubmissionResult of(SubmissionStatus status, SubmissionStage stage) {
        return SubmissionResult.builder()
                .status(status)
                .stage(stage)
                .build();
    }

    public static SubmissionResult rejected(SubmissionStatus status, SubmissionStage stage, String detail) {
        return SubmissionResult.builder()
                .status(status)
                .stage(stage)
                .detail(detail)
                .build();
    }
}
