package ru.oparin.fpthemes.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.fpthemes.model.enums.ThemeVisibility;

/**
 * Строка списка "Мои темы".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OwnedThemeDTO {

    private Long id;

    private String name;

    private ThemeVisibility visibility;
}
