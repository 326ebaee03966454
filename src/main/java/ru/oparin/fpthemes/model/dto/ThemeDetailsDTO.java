package ru.oparin.fpthemes.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.fpthemes.model.enums.ThemeVisibility;

import java.time.LocalDateTime;

/**
 * Тема, открытая по публичному идентификатору.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThemeDetailsDTO {

    private String publicId;

    private String name;

    private String description;

    private ThemeVisibility visibility;

    private String ownerDisplayName;

    /** Абсолютный URL превью */
    private String previewUrl;

    private LocalDateTime createdAt;
}
