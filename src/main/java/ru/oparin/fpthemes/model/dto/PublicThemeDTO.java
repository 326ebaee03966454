package ru.oparin.fpthemes.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Карточка публичной темы в магазине.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublicThemeDTO {

    /** Внутренний идентификатор темы */
    private Long id;

    private String name;

    private String description;

    /** Username автора, null если у автора его нет */
    private String ownerDisplayName;

    /** Имя файла превью */
    private String previewRef;

    private LocalDateTime createdAt;
}
