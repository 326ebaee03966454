package ru.oparin.fpthemes.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.fpthemes.config.properties.ThemeProperties;
import ru.oparin.fpthemes.model.entity.User;
import ru.oparin.fpthemes.repository.UserRepository;

import java.time.LocalDateTime;
import java.util.Objects;

import static ru.oparin.fpthemes.config.DatabaseConfig.withRetry;

/**
 * Сервис пользователей бота: регистрация, квота слотов и блокировки.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final R2dbcEntityTemplate r2dbcEntityTemplate;
    private final ThemeProperties themeProperties;

    /**
     * Создать пользователя, если его еще нет. Слоты и блокировка существующего пользователя не меняются,
     * обновляется только username, если он изменился.
     *
     * @param userId      Telegram ID
     * @param displayName username в Telegram (может быть null)
     * @return актуальная запись пользователя
     */
    public Mono<User> upsertUser(Long userId, String displayName) {
        return userRepository.findById(userId)
                .flatMap(existing -> refreshDisplayName(existing, displayName))
                .switchIfEmpty(Mono.defer(() -> insertUser(userId, displayName)));
    }

    private Mono<User> insertUser(Long userId, String displayName) {
        LocalDateTime now = LocalDateTime.now();
        User newUser = User.builder()
                .id(userId)
                .displayName(displayName)
                .themeSlots(themeProperties.getDefaultSlots())
                .banned(false)
                .createdAt(now)
                .updatedAt(now)
                .build();

        return r2dbcEntityTemplate.insert(User.class)
                .using(newUser)
                .doOnNext(saved -> log.info("Зарегистрирован пользователь {} ({}) со слотами: {}",
                        userId, displayName, saved.getThemeSlots()))
                .onErrorResume(DataIntegrityViolationException.class, e -> {
                    log.debug("Пользователь {} уже создан параллельным запросом", userId);
                    return userRepository.findById(userId);
                });
    }

    private Mono<User> refreshDisplayName(User existing, String displayName) {
        if (displayName == null || Objects.equals(displayName, existing.getDisplayName())) {
            return Mono.just(existing);
        }
        return userRepository.updateDisplayName(existing.getId(), displayName, LocalDateTime.now())
                .map(updated -> {
                    existing.setDisplayName(displayName);
                    return existing;
                });
    }

    /**
     * Получить пользователя.
     *
     * @param userId Telegram ID
     * @return пользователь или пустой результат
     */
    public Mono<User> getUser(Long userId) {
        return withRetry(userRepository.findById(userId));
    }

    /**
     * Заблокирован ли пользователь. Для неизвестного пользователя false.
     */
    public Mono<Boolean> isBanned(Long userId) {
        return getUser(userId)
                .map(user -> Boolean.TRUE.equals(user.getBanned()))
                .defaultIfEmpty(false);
    }

    /**
     * Заблокировать или разблокировать пользователя.
     *
     * @return true если пользователь найден
     */
    public Mono<Boolean> setBanStatus(Long userId, boolean banned) {
        log.info("Изменение статуса блокировки пользователя {}: {}", userId, banned);
        return userRepository.updateBanned(userId, banned, LocalDateTime.now())
                .map(count -> count > 0)
                .doOnNext(found -> {
                    if (!found) {
                        log.warn("Пользователь {} не найден при изменении блокировки", userId);
                    }
                });
    }

    /**
     * Добавить слоты пользователю. Верхней границы нет.
     *
     * @param userId Telegram ID
     * @param count  количество добавляемых слотов, больше нуля
     * @return true если пользователь найден и слоты добавлены
     */
    public Mono<Boolean> grantSlots(Long userId, int count) {
        if (count <= 0) {
            return Mono.error(new IllegalArgumentException("Количество слотов должно быть положительным: " + count));
        }
        log.info("Добавление {} слотов пользователю {}", count, userId);
        return userRepository.addThemeSlots(userId, count, LocalDateTime.now())
                .map(updated -> updated > 0)
                .doOnSuccess(granted -> log.info("Слоты пользователю {} добавлены: {}", userId, granted));
    }

    /**
     * Все незаблокированные пользователи.
     */
    public Flux<User> findActiveUsers() {
        return userRepository.findByBannedFalse();
    }
}
