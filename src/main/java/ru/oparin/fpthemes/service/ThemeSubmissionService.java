package ru.oparin.fpthemes.service;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.fpthemes.config.properties.ThemeProperties;
import ru.oparin.fpthemes.exception.PreviewRenderException;
import ru.oparin.fpthemes.exception.ThemeConflictException;
import ru.oparin.fpthemes.exception.ThemeDownloadException;
import ru.oparin.fpthemes.exception.ThemeValidationException;
import ru.oparin.fpthemes.model.entity.User;
import ru.oparin.fpthemes.model.enums.SubmissionStage;
import ru.oparin.fpthemes.model.enums.SubmissionStatus;
import ru.oparin.fpthemes.model.enums.ThemeVisibility;
import ru.oparin.fpthemes.model.submission.SubmissionDraft;
import ru.oparin.fpthemes.model.submission.SubmissionResult;
import ru.oparin.fpthemes.model.theme.ThemeConfig;
import ru.oparin.fpthemes.service.preview.ThemePreviewRenderer;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

/**
 * Диалог загрузки темы: файл, название, описание, видимость, сохранение.
 * Черновики хранятся в памяти по одному на пользователя. Шаги одного пользователя
 * приходят последовательно, поэтому черновик меняется без блокировок.
 * Ошибки ввода возвращаются как {@link SubmissionResult}, исключения наружу не выходят.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThemeSubmissionService {

    private final Cache<Long, SubmissionDraft> submissionDraftCache;
    private final ThemeProperties themeProperties;
    private final UserService userService;
    private final ThemeService themeService;
    private final ContentIdentityService contentIdentityService;
    private final ThemeSchemaValidator themeSchemaValidator;
    private final ThemePreviewRenderer themePreviewRenderer;
    private final PreviewStorageService previewStorageService;
    private final TemporaryFileService temporaryFileService;

    /**
     * Начать загрузку. Незавершенный черновик пользователя молча заменяется новым.
     *
     * @param ownerId Telegram ID
     * @return ACCEPTED, QUOTA_EXCEEDED (черновик не создается) или BANNED
     */
    public Mono<SubmissionResult> startUpload(Long ownerId) {
        return loadUser(ownerId)
                .flatMap(user -> {
                    if (Boolean.TRUE.equals(user.getBanned())) {
                        return Mono.just(SubmissionResult.of(SubmissionStatus.BANNED, null));
                    }
                    return themeService.countThemesOwnedBy(ownerId)
                            .map(count -> {
                                int slots = user.getThemeSlots();
                                if (count >= slots) {
                                    log.info("Пользователь {} исчерпал слоты: {}/{}", ownerId, count, slots);
                                    return SubmissionResult.builder()
                                            .status(SubmissionStatus.QUOTA_EXCEEDED)
                                            .remainingSlots((int) (slots - count))
                                            .totalSlots(slots)
                                            .build();
                                }
                                submissionDraftCache.put(ownerId, SubmissionDraft.builder()
                                        .ownerId(ownerId)
                                        .stage(SubmissionStage.AWAITING_FILE)
                                        .startedAt(LocalDateTime.now())
                                        .build());
                                log.info("Пользователь {} начал загрузку темы, занято слотов: {}/{}", ownerId, count, slots);
                                return SubmissionResult.builder()
                                        .status(SubmissionStatus.ACCEPTED)
                                        .stage(SubmissionStage.AWAITING_FILE)
                                        .remainingSlots((int) (slots - count))
                                        .totalSlots(slots)
                                        .build();
                            });
                });
    }

    /**
     * Принять файл темы. При любой ошибке черновик остается на этапе ожидания файла.
     *
     * @param ownerId    Telegram ID
     * @param filename   имя файла
     * @param size       заявленный размер файла (может быть null)
     * @param contentRef ссылка на исходный файл (file_id документа)
     * @param byteSource содержимое файла, запрашивается только после проверки имени и размера
     */
    public Mono<SubmissionResult> submitFile(Long ownerId, String filename, Long size, String contentRef,
                                             Mono<byte[]> byteSource) {
        SubmissionDraft draft = submissionDraftCache.getIfPresent(ownerId);
        Optional<SubmissionResult> stageError = checkStage(draft, SubmissionStage.AWAITING_FILE);
        if (stageError.isPresent()) {
            return Mono.just(stageError.get());
        }

        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(themeProperties.getFileExtension())) {
            return Mono.just(SubmissionResult.rejected(SubmissionStatus.INVALID_FORMAT, SubmissionStage.AWAITING_FILE,
                    "Файл " + filename + " не имеет расширения " + themeProperties.getFileExtension()));
        }
        if (size != null && size > themeProperties.getMaxFileSizeBytes()) {
            return Mono.just(tooLarge(size));
        }

        Mono<byte[]> download = byteSource
                .switchIfEmpty(Mono.error(new IllegalStateException("Пустое содержимое файла")))
                .onErrorMap(e -> !(e instanceof DataBufferLimitException),
                        e -> new ThemeDownloadException("Не удалось скачать файл темы: " + e.getMessage(), e));

        // ошибки хранилища (проверка хэша) не перехватываются и уходят вызывающему
        return temporaryFileService.withTemporaryFile("theme_" + ownerId, download,
                        path -> acceptFile(draft, contentRef, path))
                .onErrorResume(DataBufferLimitException.class, e -> {
                    log.info("Файл темы пользователя {} превысил лимит при скачивании", ownerId);
                    return Mono.just(SubmissionResult.rejected(SubmissionStatus.TOO_LARGE, SubmissionStage.AWAITING_FILE,
                            "Размер файла больше " + themeProperties.getMaxFileSizeBytes() + " байт"));
                })
                .onErrorResume(ThemeDownloadException.class, e -> {
                    log.error("Не удалось скачать файл темы пользователя {}", ownerId, e);
                    return Mono.just(SubmissionResult.rejected(SubmissionStatus.DOWNLOAD_FAILED,
                            SubmissionStage.AWAITING_FILE, e.getMessage()));
                });
    }

    private Mono<SubmissionResult> acceptFile(SubmissionDraft draft, String contentRef, Path file) {
        byte[] bytes = temporaryFileService.read(file);
        if (bytes.length > themeProperties.getMaxFileSizeBytes()) {
            return Mono.just(tooLarge(bytes.length));
        }

        String contentHash = contentIdentityService.computeContentHash(bytes);
        return themeService.hashExists(contentHash)
                .flatMap(duplicate -> {
                    if (duplicate) {
                        log.info("Пользователь {} загрузил уже существующую тему, хэш {}", draft.getOwnerId(), contentHash);
                        return Mono.just(SubmissionResult.rejected(SubmissionStatus.DUPLICATE_CONTENT,
                                SubmissionStage.AWAITING_FILE, contentHash));
                    }

                    ThemeConfig config;
                    try {
                        config = themeSchemaValidator.validate(bytes);
                    } catch (ThemeValidationException e) {
                        log.info("Файл темы пользователя {} не прошел проверку: {}", draft.getOwnerId(), e.getMessage());
                        return Mono.just(SubmissionResult.rejected(e.getReason(), SubmissionStage.AWAITING_FILE,
                                e.getMessage()));
                    }

                    draft.setContentRef(contentRef);
                    draft.setContentHash(contentHash);
                    draft.setThemeConfig(config);
                    draft.setStage(SubmissionStage.AWAITING_NAME);
                    log.info("Файл темы пользователя {} принят, хэш {}", draft.getOwnerId(), contentHash);

                    return remainingSlots(draft.getOwnerId())
                            .map(remaining -> SubmissionResult.builder()
                                    .status(SubmissionStatus.ACCEPTED)
                                    .stage(SubmissionStage.AWAITING_NAME)
                                    .remainingSlots(remaining)
                                    .build());
                });
    }

    /**
     * Принять название темы: непустое после обрезки пробелов, сохраняется как есть.
     */
    public Mono<SubmissionResult> submitName(Long ownerId, String text) {
        SubmissionDraft draft = submissionDraftCache.getIfPresent(ownerId);
        Optional<SubmissionResult> stageError = checkStage(draft, SubmissionStage.AWAITING_NAME);
        if (stageError.isPresent()) {
            return Mono.just(stageError.get());
        }
        if (text == null || text.isBlank()) {
            return Mono.just(SubmissionResult.rejected(SubmissionStatus.INVALID_NAME, SubmissionStage.AWAITING_NAME,
                    "Пустое название"));
        }
        if (text.length() > themeProperties.getMaxNameLength()) {
            return Mono.just(SubmissionResult.rejected(SubmissionStatus.INVALID_NAME, SubmissionStage.AWAITING_NAME,
                    "Название длиннее " + themeProperties.getMaxNameLength() + " символов"));
        }
        draft.setName(text);
        draft.setStage(SubmissionStage.AWAITING_DESCRIPTION);
        return Mono.just(SubmissionResult.of(SubmissionStatus.ACCEPTED, SubmissionStage.AWAITING_DESCRIPTION));
    }

    /**
     * Принять описание темы. Пустое описание допустимо.
     */
    public Mono<SubmissionResult> submitDescription(Long ownerId, String text) {
        SubmissionDraft draft = submissionDraftCache.getIfPresent(ownerId);
        Optional<SubmissionResult> stageError = checkStage(draft, SubmissionStage.AWAITING_DESCRIPTION);
        if (stageError.isPresent()) {
            return Mono.just(stageError.get());
        }
        String description = text == null ? "" : text;
        if (description.length() > themeProperties.getMaxDescriptionLength()) {
            return Mono.just(SubmissionResult.rejected(SubmissionStatus.INVALID_DESCRIPTION,
                    SubmissionStage.AWAITING_DESCRIPTION,
                    "Описание длиннее " + themeProperties.getMaxDescriptionLength() + " символов"));
        }
        draft.setDescription(description);
        draft.setStage(SubmissionStage.AWAITING_VISIBILITY);
        return Mono.just(SubmissionResult.of(SubmissionStatus.ACCEPTED, SubmissionStage.AWAITING_VISIBILITY));
    }

    /**
     * Принять выбор видимости ("public" или "private") и сохранить тему.
     *
     * @return COMPLETED с публичным идентификатором и превью либо причина неудачи;
     * после этого шага черновик удаляется в любом случае, кроме неверного ввода
     */
    public Mono<SubmissionResult> submitVisibility(Long ownerId, String choice) {
        SubmissionDraft draft = submissionDraftCache.getIfPresent(ownerId);
        Optional<SubmissionResult> stageError = checkStage(draft, SubmissionStage.AWAITING_VISIBILITY);
        if (stageError.isPresent()) {
            return Mono.just(stageError.get());
        }
        ThemeVisibility visibility = ThemeVisibility.fromString(choice);
        if (visibility == null) {
            return Mono.just(SubmissionResult.rejected(SubmissionStatus.INVALID_VISIBILITY,
                    SubmissionStage.AWAITING_VISIBILITY, "Неизвестная видимость: " + choice));
        }
        draft.setVisibility(visibility);
        draft.setStage(SubmissionStage.FINALIZING);

        return finalizeDraft(draft)
                .doFinally(signal -> submissionDraftCache.asMap().remove(ownerId, draft));
    }

    /**
     * Отменить загрузку.
     *
     * @return true если черновик был
     */
    public boolean cancel(Long ownerId) {
        boolean removed = submissionDraftCache.asMap().remove(ownerId) != null;
        if (removed) {
            log.info("Пользователь {} отменил загрузку темы", ownerId);
        }
        return removed;
    }

    /**
     * Текущий этап диалога пользователя.
     */
    public Optional<SubmissionStage> currentStage(Long ownerId) {
        return Optional.ofNullable(submissionDraftCache.getIfPresent(ownerId))
                .map(SubmissionDraft::getStage);
    }

    private Mono<SubmissionResult> finalizeDraft(SubmissionDraft draft) {
        Long ownerId = draft.getOwnerId();
        return loadUser(ownerId)
                .zipWith(themeService.countThemesOwnedBy(ownerId))
                .flatMap(tuple -> {
                    if (tuple.getT2() >= tuple.getT1().getThemeSlots()) {
                        log.warn("Пользователь {} исчерпал слоты к моменту сохранения темы", ownerId);
                        return Mono.just(failed(SubmissionStatus.QUOTA_EXCEEDED, "Нет свободных слотов"));
                    }
                    return themePreviewRenderer.render(draft.getThemeConfig())
                            .flatMap(preview -> storeTheme(draft, preview))
                            .onErrorResume(PreviewRenderException.class, e -> {
                                log.error("Тема пользователя {} не сохранена: ошибка рендера превью", ownerId, e);
                                return Mono.just(failed(SubmissionStatus.RENDER_FAILED, e.getMessage()));
                            });
                });
    }

    private Mono<SubmissionResult> storeTheme(SubmissionDraft draft, byte[] preview) {
        Long ownerId = draft.getOwnerId();
        return previewStorageService.store(preview)
                .onErrorResume(e -> {
                    log.error("Не удалось сохранить превью темы пользователя {}", ownerId, e);
                    return Mono.empty();
                })
                .flatMap(previewRef -> themeService.createTheme(ownerId, draft.getName(), draft.getDescription(),
                                draft.getVisibility(), draft.getContentRef(), draft.getContentHash(), previewRef)
                        .map(theme -> {
                            draft.setStage(SubmissionStage.COMPLETED);
                            return SubmissionResult.builder()
                                    .status(SubmissionStatus.COMPLETED)
                                    .stage(SubmissionStage.COMPLETED)
                                    .themeId(theme.getId())
                                    .publicId(theme.getPublicId())
                                    .themeName(theme.getName())
                                    .visibility(theme.getVisibility())
                                    .previewImage(preview)
                                    .previewRef(previewRef)
                                    .build();
                        })
                        .onErrorResume(ThemeConflictException.class, e -> previewStorageService.delete(previewRef)
                                .thenReturn(failed(SubmissionStatus.STORAGE_CONFLICT, e.getMessage())))
                        .onErrorResume(e -> !(e instanceof ThemeConflictException), e -> {
                            log.error("Не удалось сохранить тему пользователя {}", ownerId, e);
                            return previewStorageService.delete(previewRef)
                                    .thenReturn(failed(SubmissionStatus.STORAGE_FAILED, e.getMessage()));
                        }))
                .switchIfEmpty(Mono.fromSupplier(() -> failed(SubmissionStatus.STORAGE_FAILED,
                        "Превью не сохранено")));
    }

    private SubmissionResult failed(SubmissionStatus status, String detail) {
        return SubmissionResult.rejected(status, SubmissionStage.FAILED, detail);
    }

    private Optional<SubmissionResult> checkStage(SubmissionDraft draft, SubmissionStage expected) {
        if (draft == null) {
            return Optional.of(SubmissionResult.of(SubmissionStatus.NO_ACTIVE_DRAFT, null));
        }
        if (draft.getStage() != expected) {
            return Optional.of(SubmissionResult.rejected(SubmissionStatus.WRONG_STAGE, draft.getStage(),
                    "Ожидался этап " + expected));
        }
        return Optional.empty();
    }

    private SubmissionResult tooLarge(long size) {
        return SubmissionResult.rejected(SubmissionStatus.TOO_LARGE, SubmissionStage.AWAITING_FILE,
                "Размер файла " + size + " байт больше " + themeProperties.getMaxFileSizeBytes());
    }

    private Mono<Integer> remainingSlots(Long ownerId) {
        return loadUser(ownerId)
                .zipWith(themeService.countThemesOwnedBy(ownerId))
                .map(tuple -> (int) Math.max(0, tuple.getT1().getThemeSlots() - tuple.getT2()));
    }

    private Mono<User> loadUser(Long ownerId) {
        return userService.getUser(ownerId)
                .switchIfEmpty(Mono.defer(() -> userService.upsertUser(ownerId, null)));
    }
}
