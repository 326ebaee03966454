package ru.oparin.fpthemes.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.fpthemes.model.entity.User;

import java.time.LocalDateTime;

/**
 * Репозиторий пользователей бота.
 * Счетчик слотов и флаг блокировки меняются только точечными UPDATE, без чтения-записи сущности.
 */
public interface UserRepository extends ReactiveCrudRepository<User, Long> {

    /**
     * Все незаблокированные пользователи (для рассылки).
     */
    Flux<User> findByBannedFalse();

    /**
     * Атомарно добавить слоты пользователю.
     *
     * @return количество обновленных записей (0 или 1)
     */
    @Modifying
    @Query("UPDATE users SET theme_slots = theme_slots + :count, updated_at = :updatedAt WHERE id = :id")
    Mono<Integer> addThemeSlots(Long id, Integer count, LocalDateTime updatedAt);

    /**
     * Установить флаг блокировки.
     *
     * @return количество обновленных записей (0 или 1)
     */
    @Modifying
    @Query("UPDATE users SET is_banned = :banned, updated_at = :updatedAt WHERE id = :id")
    Mono<Integer> updateBanned(Long id, Boolean banned, LocalDateTime updatedAt);

    /**
     * Обновить username, не трогая слоты и блокировку.
     */
    @Modifying
    @Query("UPDATE users SET display_name = :displayName, updated_at = :updatedAt WHERE id = :id")
    Mono<Integer> updateDisplayName(Long id, String displayName, LocalDateTime updatedAt);
}
