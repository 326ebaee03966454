package ru.oparin.fpthemes.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;
import ru.oparin.fpthemes.model.enums.ThemeVisibility;

import java.time.LocalDateTime;

/**
 * Entity для таблицы themes.
 * Тема создается одной вставкой в самом конце диалога загрузки, после успешного рендера превью.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("themes")
public class Theme {

    /** Внутренний последовательный идентификатор */
    @Id
    private Long id;

    /** Случайный идентификатор для ссылок, не выводится из id */
    @Column("public_id")
    private String publicId;

    /** Владелец темы */
    @Column("owner_id")
    private Long ownerId;

    @Column("name")
    private String name;

    @Column("description")
    private String description;

    @Column("visibility")
    private ThemeVisibility visibility;

    /** Ссылка на исходный файл темы (file_id документа в Telegram) */
    @Column("content_ref")
    private String contentRef;

    /** SHA-256 исходного файла, уникален среди всех тем */
    @Column("content_hash")
    private String contentHash;

    /** Имя файла превью в хранилище превью */
    @Column("preview_ref")
    private String previewRef;

    @Column("created_at")
    private LocalDateTime createdAt;

    public boolean isPublic() {
        return visibility == ThemeVisibility.PUBLIC;
    }
}
