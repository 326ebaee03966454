package ru.oparin.fpthemes.model.entity;

import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Сущность пользователя бота.
 * Идентификатор совпадает с Telegram ID и задается извне, поэтому новые записи
 * вставляются через R2dbcEntityTemplate.insert, а не через save.
 */
@Table("users")
@Getter
@Setter
@EqualsAndHashCode
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    /**
     * Telegram ID пользователя (первичный ключ).
     */
    @Id
    private Long id;

    /**
     * Username в Telegram. Может отсутствовать.
     */
    private String displayName;

    /**
     * Сколько тем пользователь может хранить одновременно.
     */
    @Builder.Default
    private Integer themeSlots = 10;

    /**
     * Заблокирован ли пользователь администратором.
     */
    @Column("is_banned")
    @Builder.Default
    private Boolean banned = false;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;
}
