package ru.oparin.fpthemes.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Criteria;
import org.springframework.data.relational.core.query.Query;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.fpthemes.exception.ThemeConflictException;
import ru.oparin.fpthemes.exception.ThemeNotFoundException;
import ru.oparin.fpthemes.model.dto.OwnedThemeDTO;
import ru.oparin.fpthemes.model.dto.PageResponseDTO;
import ru.oparin.fpthemes.model.dto.PublicThemeDTO;
import ru.oparin.fpthemes.model.dto.ThemeDetailsDTO;
import ru.oparin.fpthemes.model.entity.Theme;
import ru.oparin.fpthemes.model.entity.User;
import ru.oparin.fpthemes.model.enums.ThemeVisibility;
import ru.oparin.fpthemes.repository.ThemeRepository;
import ru.oparin.fpthemes.repository.UserRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static ru.oparin.fpthemes.config.DatabaseConfig.withRetry;

/**
 * Сервис хранения тем. Уникальность содержимого и публичных идентификаторов
 * обеспечивается ограничениями таблицы themes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThemeService {

    static final int PUBLIC_ID_ATTEMPTS = 3;

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final ThemeRepository themeRepository;
    private final UserRepository userRepository;
    private final R2dbcEntityTemplate r2dbcEntityTemplate;
    private final ContentIdentityService contentIdentityService;
    private final PreviewStorageService previewStorageService;

    public Mono<Long> countThemesOwnedBy(Long ownerId) {
        return withRetry(themeRepository.countByOwnerId(ownerId));
    }

    /**
     * Проверить, сохранена ли уже тема с таким содержимым (у любого пользователя).
     */
    public Mono<Boolean> hashExists(String contentHash) {
        return withRetry(themeRepository.existsByContentHash(contentHash));
    }

    /**
     * Сохранить тему одной вставкой.
     * Совпадение content_hash с уже сохраненной темой дает {@link ThemeConflictException},
     * совпадение public_id повторяется с новым идентификатором.
     *
     * @return сохраненная тема с присвоенными id и public_id
     */
    public Mono<Theme> createTheme(Long ownerId, String name, String description, ThemeVisibility visibility,
                                   String contentRef, String contentHash, String previewRef) {
        return insertTheme(ownerId, name, description, visibility, contentRef, contentHash, previewRef, 1)
                .doOnSuccess(theme -> log.info("Тема {} сохранена пользователем {}, publicId: {}, видимость: {}",
                        theme.getId(), ownerId, theme.getPublicId(), visibility));
    }

    private Mono<Theme> insertTheme(Long ownerId, String name, String description, ThemeVisibility visibility,
                                    String contentRef, String contentHash, String previewRef, int attempt) {
        Theme theme = Theme.builder()
                .publicId(contentIdentityService.generatePublicId())
                .ownerId(ownerId)
                .name(name)
                .description(description)
                .visibility(visibility)
                .contentRef(contentRef)
                .contentHash(contentHash)
                .previewRef(previewRef)
                .createdAt(LocalDateTime.now())
                .build();

        return themeRepository.save(theme)
                .onErrorResume(DataIntegrityViolationException.class, e -> themeRepository.existsByContentHash(contentHash)
                        .flatMap(duplicate -> {
                            if (duplicate) {
                                log.warn("Тема с хэшем {} уже сохранена параллельной загрузкой", contentHash);
                                return Mono.error(new ThemeConflictException(contentHash, e));
                            }
                            if (attempt >= PUBLIC_ID_ATTEMPTS) {
                                log.error("Не удалось сохранить тему пользователя {} после {} попыток", ownerId, attempt, e);
                                return Mono.error(e);
                            }
                            log.warn("Коллизия публичного идентификатора, попытка {}", attempt);
                            return insertTheme(ownerId, name, description, visibility,
                                    contentRef, contentHash, previewRef, attempt + 1);
                        }));
    }

    /**
     * Темы пользователя, новые первые.
     */
    public Flux<OwnedThemeDTO> listThemesOwnedBy(Long ownerId) {
        return themeRepository.findByOwnerIdOrderByCreatedAtDescIdDesc(ownerId)
                .map(theme -> OwnedThemeDTO.builder()
                        .id(theme.getId())
                        .name(theme.getName())
                        .visibility(theme.getVisibility())
                        .build());
    }

    public Mono<Theme> getThemeById(Long themeId) {
        return withRetry(themeRepository.findById(themeId));
    }

    /**
     * Найти тему по публичному идентификатору, независимо от видимости.
     */
    public Mono<Theme> getThemeByPublicId(String publicId) {
        if (publicId == null || publicId.isBlank()) {
            return Mono.empty();
        }
        return withRetry(themeRepository.findByPublicId(publicId));
    }

    /**
     * Удалить тему владельцем. Превью удаляется вместе с темой.
     *
     * @return true если тема принадлежала пользователю и удалена
     */
    public Mono<Boolean> deleteTheme(Long themeId, Long ownerId) {
        return themeRepository.findById(themeId)
                .filter(theme -> theme.getOwnerId().equals(ownerId))
                .flatMap(theme -> themeRepository.deleteOwnedTheme(themeId, ownerId)
                        .flatMap(deleted -> deleted > 0
                                ? previewStorageService.delete(theme.getPreviewRef()).thenReturn(true)
                                : Mono.just(false)))
                .defaultIfEmpty(false)
                .doOnNext(deleted -> log.info("Удаление темы {} пользователем {}: {}", themeId, ownerId, deleted));
    }

    /**
     * Удалить тему без проверки владельца.
     */
    public Mono<Boolean> adminDeleteTheme(Long themeId) {
        return themeRepository.findById(themeId)
                .flatMap(theme -> themeRepository.deleteThemeById(themeId)
                        .flatMap(deleted -> deleted > 0
                                ? previewStorageService.delete(theme.getPreviewRef()).thenReturn(true)
                                : Mono.just(false)))
                .defaultIfEmpty(false)
                .doOnNext(deleted -> log.info("Администраторское удаление темы {}: {}", themeId, deleted));
    }

    /**
     * Изменить видимость темы владельцем. Повторная установка того же значения считается успешной.
     *
     * @return true если тема принадлежит пользователю
     */
    public Mono<Boolean> setVisibility(Long themeId, Long ownerId, ThemeVisibility visibility) {
        return themeRepository.updateVisibility(themeId, ownerId, visibility.name())
                .map(updated -> updated > 0)
                .doOnNext(updated -> log.info("Видимость темы {} пользователем {} -> {}: {}",
                        themeId, ownerId, visibility, updated));
    }

    /**
     * Публичные темы со смещением, новые первые.
     */
    public Flux<Theme> listPublicThemes(long offset, int limit) {
        Query query = Query.query(Criteria.where("visibility").is(ThemeVisibility.PUBLIC.name()))
                .sort(NEWEST_FIRST)
                .offset(offset)
                .limit(limit);
        return r2dbcEntityTemplate.select(Theme.class)
                .matching(query)
                .all();
    }

    public Mono<Long> countPublicThemes() {
        return withRetry(themeRepository.countByVisibility(ThemeVisibility.PUBLIC));
    }

    /**
     * Страница магазина с именами авторов.
     *
     * @param page номер страницы (с 0)
     * @param size размер страницы
     */
    public Mono<PageResponseDTO<PublicThemeDTO>> browsePublic(int page, int size) {
        if (page < 0 || size <= 0) {
            return Mono.error(new IllegalArgumentException("Некорректные параметры страницы: page=" + page + ", size=" + size));
        }
        Mono<List<Theme>> themesMono = themeRepository
                .findByVisibilityOrderByCreatedAtDescIdDesc(ThemeVisibility.PUBLIC, PageRequest.of(page, size))
                .collectList();

        return Mono.zip(themesMono, countPublicThemes())
                .flatMap(tuple -> {
                    List<Theme> themes = tuple.getT1();
                    long total = tuple.getT2();
                    return loadDisplayNames(themes)
                            .map(names -> PageResponseDTO.of(
                                    themes.stream().map(theme -> toPublicDto(theme, names)).toList(),
                                    page, size, total));
                })
                .doOnSuccess(response -> log.debug("Страница магазина {}: {} тем из {}",
                        page, response.getContent().size(), response.getTotalElements()));
    }

    /**
     * Тема по публичному идентификатору для внешних клиентов.
     *
     * @throws ThemeNotFoundException если идентификатор не выдавался
     */
    public Mono<ThemeDetailsDTO> getThemeDetails(String publicId) {
        return getThemeByPublicId(publicId)
                .switchIfEmpty(Mono.error(new ThemeNotFoundException("Тема не найдена: " + publicId)))
                .flatMap(theme -> userRepository.findById(theme.getOwnerId())
                        .map(User::getDisplayName)
                        .defaultIfEmpty("")
                        .map(ownerName -> ThemeDetailsDTO.builder()
                                .publicId(theme.getPublicId())
                                .name(theme.getName())
                                .description(theme.getDescription())
                                .visibility(theme.getVisibility())
                                .ownerDisplayName(ownerName.isEmpty() ? null : ownerName)
                                .previewUrl(previewStorageService.toUrl(theme.getPreviewRef()))
                                .createdAt(theme.getCreatedAt())
                                .build()));
    }

    private Mono<Map<Long, User>> loadDisplayNames(List<Theme> themes) {
        Set<Long> ownerIds = themes.stream().map(Theme::getOwnerId).collect(Collectors.toSet());
        if (ownerIds.isEmpty()) {
            return Mono.just(Map.of());
        }
        return userRepository.findAllById(ownerIds)
                .collectMap(User::getId, Function.identity());
    }

    private PublicThemeDTO toPublicDto(Theme theme, Map<Long, User> owners) {
        User owner = owners.get(theme.getOwnerId());
        return PublicThemeDTO.builder()
                .id(theme.getId())
                .name(theme.getName())
                .description(theme.getDescription())
                .ownerDisplayName(owner != null ? owner.getDisplayName() : null)
                .previewRef(theme.getPreviewRef())
                .createdAt(theme.getCreatedAt())
                .build();
    }
}
