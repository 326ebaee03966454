package ru.oparin.fpthemes.service.telegram;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.fpthemes.config.properties.ThemeProperties;
import ru.oparin.fpthemes.model.dto.telegram.TelegramCallbackQuery;
import ru.oparin.fpthemes.model.entity.Theme;
import ru.oparin.fpthemes.model.enums.ThemeVisibility;
import ru.oparin.fpthemes.service.PreviewStorageService;
import ru.oparin.fpthemes.service.ThemeService;

/**
 * Обработчик callback queries от inline-кнопок Telegram бота.
 */
@RequiredArgsConstructor
@Component
@Slf4j
public class TelegramBotCallbackHandler {

    private static final String MANAGE_THEME = "manage_theme_";
    private static final String PRIVACY_THEME = "privacy_theme_";
    private static final String DELETE_THEME = "delete_theme_";
    private static final String CONFIRM_DELETE = "confirm_delete_";
    private static final String STORE = "store_";
    private static final String DOWNLOAD = "download_";
    private static final String SET_PRIVACY = "set_privacy_";

    private final TelegramMessageService telegramMessageService;
    private final TelegramBotMessageBuilder messageBuilder;
    private final TelegramBotSubmissionHandler submissionHandler;
    private final ThemeService themeService;
    private final PreviewStorageService previewStorageService;
    private final ThemeProperties themeProperties;

    /**
     * Обработать callback query от inline-кнопок.
     */
    public Mono<Void> handleCallbackQuery(TelegramCallbackQuery callbackQuery) {
        String data = callbackQuery.getData();
        String callbackId = callbackQuery.getId();
        Long userId = callbackQuery.getFrom().getId();
        log.info("Обработка callback query {} от пользователя {}: {}", callbackId, userId, data);

        if (data == null || callbackQuery.getMessage() == null) {
            return telegramMessageService.answerCallbackQuery(callbackId);
        }
        Long chatId = callbackQuery.getMessage().getChat().getId();
        Long messageId = callbackQuery.getMessage().getMessageId();

        if (data.equals("start")) {
            submissionHandler.cancel(userId);
            return telegramMessageService.answerCallbackQuery(callbackId)
                    .then(replaceMessage(chatId, messageId, messageBuilder.buildWelcomeMessage(),
                            messageBuilder.buildMainMenuKeyboard()));
        }
        if (data.equals("upload_theme")) {
            return submissionHandler.startUpload(chatId, userId, messageId, callbackId);
        }
        if (data.equals("my_themes")) {
            return telegramMessageService.answerCallbackQuery(callbackId)
                    .then(showMyThemes(chatId, userId, messageId));
        }
        if (data.startsWith(SET_PRIVACY)) {
            return submissionHandler.handleVisibilityChoice(chatId, userId, messageId, callbackId,
                    data.substring(SET_PRIVACY.length()));
        }

        Long themeId;
        if (data.startsWith(MANAGE_THEME)) {
            themeId = parseId(data.substring(MANAGE_THEME.length()));
            return themeId == null ? ignore(callbackId) : showManageCard(chatId, userId, messageId, callbackId, themeId);
        }
        if (data.startsWith(PRIVACY_THEME)) {
            return handlePrivacy(chatId, userId, messageId, callbackId, data.substring(PRIVACY_THEME.length()));
        }
        if (data.startsWith(DELETE_THEME)) {
            themeId = parseId(data.substring(DELETE_THEME.length()));
            return themeId == null ? ignore(callbackId) : telegramMessageService.answerCallbackQuery(callbackId)
                    .then(telegramMessageService.editMessageReplyMarkup(chatId, messageId,
                            messageBuilder.buildDeleteConfirmationKeyboard(themeId)));
        }
        if (data.startsWith(CONFIRM_DELETE)) {
            themeId = parseId(data.substring(CONFIRM_DELETE.length()));
            return themeId == null ? ignore(callbackId) : confirmDelete(chatId, userId, messageId, callbackId, themeId);
        }
        if (data.startsWith(STORE)) {
            Long page = parseId(data.substring(STORE.length()));
            return page == null ? ignore(callbackId) : telegramMessageService.answerCallbackQuery(callbackId)
                    .then(showStorePage(chatId, messageId, page.intValue()));
        }
        if (data.startsWith(DOWNLOAD)) {
            themeId = parseId(data.substring(DOWNLOAD.length()));
            return themeId == null ? ignore(callbackId) : download(chatId, userId, callbackId, themeId);
        }

        log.debug("Неизвестный callback: {}", data);
        return ignore(callbackId);
    }

    private Mono<Void> showMyThemes(Long chatId, Long userId, Long messageId) {
        return themeService.listThemesOwnedBy(userId)
                .collectList()
                .flatMap(themes -> themes.isEmpty()
                        ? replaceMessage(chatId, messageId, messageBuilder.buildNoThemesMessage(),
                                messageBuilder.buildMainMenuKeyboard())
                        : replaceMessage(chatId, messageId, messageBuilder.buildMyThemesMessage(),
                                messageBuilder.buildMyThemesKeyboard(themes)));
    }

    private Mono<Void> showManageCard(Long chatId, Long userId, Long messageId, String callbackId, Long themeId) {
        return themeService.getThemeById(themeId)
                .filter(theme -> theme.getOwnerId().equals(userId))
                .flatMap(theme -> telegramMessageService.answerCallbackQuery(callbackId)
                        .then(sendManageCard(chatId, messageId, theme))
                        .thenReturn(true))
                .switchIfEmpty(Mono.defer(() -> telegramMessageService.answerCallbackQuery(callbackId,
                        messageBuilder.buildThemeNotFoundMessage(), true).thenReturn(false)))
                .then();
    }

    private Mono<Void> sendManageCard(Long chatId, Long messageId, Theme theme) {
        return telegramMessageService.sendPhoto(chatId, previewStorageService.toUrl(theme.getPreviewRef()),
                        messageBuilder.buildManageThemeCaption(theme), messageBuilder.buildManageThemeKeyboard(theme))
                .then(telegramMessageService.deleteMessage(chatId, messageId));
    }

    /**
     * privacy_theme_{id}_{1 - сделать публичной, 0 - приватной}.
     */
    private Mono<Void> handlePrivacy(Long chatId, Long userId, Long messageId, String callbackId, String payload) {
        String[] parts = payload.split("_");
        Long themeId = parts.length == 2 ? parseId(parts[0]) : null;
        if (themeId == null || !(parts[1].equals("0") || parts[1].equals("1"))) {
            return ignore(callbackId);
        }
        ThemeVisibility visibility = parts[1].equals("1") ? ThemeVisibility.PUBLIC : ThemeVisibility.PRIVATE;

        return themeService.setVisibility(themeId, userId, visibility)
                .flatMap(updated -> {
                    if (!updated) {
                        return telegramMessageService.answerCallbackQuery(callbackId, "Ошибка!", true);
                    }
                    return telegramMessageService.answerCallbackQuery(callbackId, "Статус приватности изменен!", true)
                            .then(themeService.getThemeById(themeId))
                            .flatMap(theme -> sendManageCard(chatId, messageId, theme));
                });
    }

    private Mono<Void> confirmDelete(Long chatId, Long userId, Long messageId, String callbackId, Long themeId) {
        return themeService.deleteTheme(themeId, userId)
                .flatMap(deleted -> deleted
                        ? telegramMessageService.answerCallbackQuery(callbackId, "Тема удалена.", true)
                                .then(showMyThemes(chatId, userId, messageId))
                        : telegramMessageService.answerCallbackQuery(callbackId, "Ошибка при удалении.", true));
    }

    private Mono<Void> showStorePage(Long chatId, Long messageId, int page) {
        int pageSize = themeProperties.getPageSize();
        return themeService.browsePublic(page, pageSize)
                .flatMap(response -> {
                    if (response.getContent().isEmpty()) {
                        return replaceMessage(chatId, messageId, messageBuilder.buildEmptyStoreMessage(),
                                messageBuilder.buildEmptyStoreKeyboard());
                    }
                    return Flux.fromIterable(response.getContent())
                            .concatMap(theme -> telegramMessageService.sendPhoto(chatId,
                                    previewStorageService.toUrl(theme.getPreviewRef()),
                                    messageBuilder.buildStoreCaption(theme),
                                    messageBuilder.buildDownloadKeyboard(theme.getId())))
                            .then(telegramMessageService.sendMessageWithKeyboard(chatId,
                                    messageBuilder.buildStorePageMessage(page),
                                    messageBuilder.buildStoreNavigationKeyboard(page,
                                            response.getHasPrevious(), response.getHasNext())))
                            .then(telegramMessageService.deleteMessage(chatId, messageId));
                });
    }

    /**
     * Скачать тему: публичную может любой, приватную только владелец (остальным она доступна по ссылке).
     */
    private Mono<Void> download(Long chatId, Long userId, String callbackId, Long themeId) {
        return themeService.getThemeById(themeId)
                .filter(theme -> theme.isPublic() || theme.getOwnerId().equals(userId))
                .flatMap(theme -> telegramMessageService.answerCallbackQuery(callbackId)
                        .then(telegramMessageService.sendDocument(chatId, theme.getContentRef()))
                        .thenReturn(true))
                .switchIfEmpty(Mono.defer(() -> telegramMessageService.answerCallbackQuery(callbackId,
                        "Тема не найдена.", true).thenReturn(false)))
                .then();
    }

    private Mono<Void> replaceMessage(Long chatId, Long messageId, String text, String keyboard) {
        return telegramMessageService.deleteMessage(chatId, messageId)
                .then(telegramMessageService.sendMessageWithKeyboard(chatId, text, keyboard));
    }

    private Mono<Void> ignore(String callbackId) {
        return telegramMessageService.answerCallbackQuery(callbackId);
    }

    private Long parseId(String value) {
        try {
            long id = Long.parseLong(value);
            return id >= 0 ? id : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
