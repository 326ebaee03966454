package ru.oparin.fpthemes.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.fpthemes.model.entity.Theme;
import ru.oparin.fpthemes.model.enums.ThemeVisibility;

/**
 * Repository для работы с темами.
 * Уникальность content_hash и public_id обеспечивается ограничениями таблицы, а не проверками в коде.
 */
@Repository
public interface ThemeRepository extends ReactiveCrudRepository<Theme, Long> {

    /**
     * Подсчитать темы пользователя (для проверки квоты слотов).
     *
     * @param ownerId идентификатор владельца
     * @return количество тем
     */
    Mono<Long> countByOwnerId(Long ownerId);

    /**
     * Проверить, загружался ли уже файл с таким хэшем (любым пользователем).
     *
     * @param contentHash SHA-256 файла
     * @return true если тема с таким хэшем существует
     */
    Mono<Boolean> existsByContentHash(String contentHash);

    /**
     * Все темы пользователя, новые первые.
     *
     * @param ownerId идентификатор владельца
     * @return поток тем
     */
    Flux<Theme> findByOwnerIdOrderByCreatedAtDescIdDesc(Long ownerId);

    /**
     * Найти тему по публичному идентификатору. Видимость не учитывается.
     *
     * @param publicId публичный идентификатор
     * @return тема или пустой результат
     */
    Mono<Theme> findByPublicId(String publicId);

    /**
     * Страница тем с заданной видимостью, новые первые.
     *
     * @param visibility видимость
     * @param pageable   параметры пагинации
     * @return поток тем страницы
     */
    Flux<Theme> findByVisibilityOrderByCreatedAtDescIdDesc(ThemeVisibility visibility, Pageable pageable);

    /**
     * Подсчитать темы с заданной видимостью.
     */
    Mono<Long> countByVisibility(ThemeVisibility visibility);

    /**
     * Существует ли тема, ссылающаяся на данный файл превью.
     */
    Mono<Boolean> existsByPreviewRef(String previewRef);

    /**
     * Удалить тему с проверкой владельца.
     *
     * @return количество удаленных записей (0 или 1)
     */
    @Modifying
    @Query("DELETE FROM themes WHERE id = :id AND owner_id = :ownerId")
    Mono<Integer> deleteOwnedTheme(Long id, Long ownerId);

    /**
     * Удалить тему без проверки владельца.
     *
     * @return количество удаленных записей (0 или 1)
     */
    @Modifying
    @Query("DELETE FROM themes WHERE id = :id")
    Mono<Integer> deleteThemeById(Long id);

    /**
     * Изменить видимость темы с проверкой владельца.
     *
     * @param visibility имя значения {@link ThemeVisibility}
     * @return количество обновленных записей (0 или 1)
     */
    @Modifying
    @Query("UPDATE themes SET visibility = :visibility WHERE id = :id AND owner_id = :ownerId")
    Mono<Integer> updateVisibility(Long id, Long ownerId, String visibility);
}
