package ru.oparin.fpthemes.model.submission;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.fpthemes.model.enums.SubmissionStage;
import ru.oparin.fpthemes.model.enums.ThemeVisibility;
import ru.oparin.fpthemes.model.theme.ThemeConfig;

import java.time.LocalDateTime;

/**
 * Черновик загрузки темы. Живет только в памяти, по одному на пользователя.
 * Исходные байты файла в черновике не хранятся: только хэш, ссылка на файл и разобранная конфигурация.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionDraft {

    private Long ownerId;

    @Builder.Default
    private SubmissionStage stage = SubmissionStage.AWAITING_FILE;

    private String contentRef;

    private String contentHash;

    private ThemeConfig themeConfig;

    private String name;

    private String description;

    private ThemeVisibility visibility;

    private LocalDateTime startedAt;
}
