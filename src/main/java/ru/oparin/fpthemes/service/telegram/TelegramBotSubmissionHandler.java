package ru.oparin.fpthemes.service.telegram;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import ru.oparin.fpthemes.model.dto.telegram.TelegramDocument;
import ru.oparin.fpthemes.model.enums.SubmissionStage;
import ru.oparin.fpthemes.model.enums.ThemeVisibility;
import ru.oparin.fpthemes.model.submission.SubmissionResult;
import ru.oparin.fpthemes.service.ThemeSubmissionService;

/**
 * Шаги диалога загрузки темы в Telegram: перевод результатов {@link ThemeSubmissionService} в сообщения.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TelegramBotSubmissionHandler {

    private final ThemeSubmissionService themeSubmissionService;
    private final TelegramMessageService telegramMessageService;
    private final TelegramFileService telegramFileService;
    private final TelegramBotMessageBuilder messageBuilder;

    /**
     * Кнопка "Загрузить тему".
     *
     * @param messageId сообщение с меню, которое заменяется приглашением загрузить файл
     */
    public Mono<Void> startUpload(Long chatId, Long userId, Long messageId, String callbackQueryId) {
        return themeSubmissionService.startUpload(userId)
                .flatMap(result -> switch (result.getStatus()) {
                    case ACCEPTED -> telegramMessageService.answerCallbackQuery(callbackQueryId)
                            .then(telegramMessageService.deleteMessage(chatId, messageId))
                            .then(telegramMessageService.sendMessageWithKeyboard(chatId,
                                    messageBuilder.buildUploadPromptMessage(result.getRemainingSlots()),
                                    messageBuilder.buildCancelKeyboard()));
                    case QUOTA_EXCEEDED -> telegramMessageService.answerCallbackQuery(callbackQueryId,
                            messageBuilder.buildQuotaExceededMessage(
                                    result.getTotalSlots() - result.getRemainingSlots(), result.getTotalSlots()),
                            true);
                    default -> telegramMessageService.answerCallbackQuery(callbackQueryId);
                });
    }

    /**
     * Документ от пользователя. Без активного черновика документ игнорируется.
     */
    public Mono<Void> handleDocument(Long chatId, Long userId, TelegramDocument document) {
        log.info("Получен документ {} от пользователя {}", document.getFileName(), userId);
        return themeSubmissionService.submitFile(userId, document.getFileName(), document.getFileSize(),
                        document.getFileId(), Mono.defer(() -> telegramFileService.downloadFile(document.getFileId())))
                .flatMap(result -> switch (result.getStatus()) {
                    case ACCEPTED -> telegramMessageService.sendMessage(chatId, messageBuilder.buildFileAcceptedMessage());
                    case INVALID_FORMAT -> telegramMessageService.sendMessage(chatId, messageBuilder.buildInvalidFormatMessage());
                    case TOO_LARGE -> telegramMessageService.sendMessage(chatId, messageBuilder.buildTooLargeMessage());
                    case DUPLICATE_CONTENT -> telegramMessageService.sendMessage(chatId, messageBuilder.buildDuplicateMessage());
                    case INVALID_STRUCTURE -> telegramMessageService.sendMessage(chatId, messageBuilder.buildInvalidStructureMessage());
                    case DOWNLOAD_FAILED -> telegramMessageService.sendMessage(chatId, messageBuilder.buildDownloadFailedMessage());
                    default -> {
                        log.debug("Документ от пользователя {} вне диалога загрузки: {}", userId, result.getStatus());
                        yield Mono.empty();
                    }
                });
    }

    /**
     * Текст, пришедший во время диалога загрузки: название, описание или видимость.
     *
     * @return false, если у пользователя нет черновика, ожидающего текст
     */
    public Mono<Boolean> handleText(Long chatId, Long userId, String text) {
        return themeSubmissionService.currentStage(userId)
                .map(stage -> switch (stage) {
                    case AWAITING_NAME -> submitName(chatId, userId, text).thenReturn(true);
                    case AWAITING_DESCRIPTION -> submitDescription(chatId, userId, text).thenReturn(true);
                    case AWAITING_VISIBILITY -> submitVisibility(chatId, userId, text, null).thenReturn(true);
                    default -> Mono.just(false);
                })
                .orElseGet(() -> Mono.just(false));
    }

    /**
     * Выбор видимости кнопкой.
     */
    public Mono<Void> handleVisibilityChoice(Long chatId, Long userId, Long messageId, String callbackQueryId,
                                             String choice) {
        return telegramMessageService.answerCallbackQuery(callbackQueryId)
                .then(submitVisibility(chatId, userId, choice, messageId));
    }

    /**
     * Отмена загрузки.
     */
    public void cancel(Long userId) {
        themeSubmissionService.cancel(userId);
    }

    private Mono<Void> submitName(Long chatId, Long userId, String text) {
        return themeSubmissionService.submitName(userId, text)
                .flatMap(result -> telegramMessageService.sendMessage(chatId, result.isSuccess()
                        ? messageBuilder.buildNameAcceptedMessage()
                        : messageBuilder.buildInvalidNameMessage()));
    }

    private Mono<Void> submitDescription(Long chatId, Long userId, String text) {
        return themeSubmissionService.submitDescription(userId, text)
                .flatMap(result -> result.isSuccess()
                        ? telegramMessageService.sendMessageWithKeyboard(chatId,
                                messageBuilder.buildDescriptionAcceptedMessage(), messageBuilder.buildVisibilityKeyboard())
                        : telegramMessageService.sendMessage(chatId, messageBuilder.buildInvalidDescriptionMessage()));
    }

    private Mono<Void> submitVisibility(Long chatId, Long userId, String choice, Long messageId) {
        if (ThemeVisibility.fromString(choice) == null) {
            return telegramMessageService.sendMessageWithKeyboard(chatId,
                    messageBuilder.buildDescriptionAcceptedMessage(), messageBuilder.buildVisibilityKeyboard());
        }
        Mono<Void> progress = messageId != null
                ? telegramMessageService.editMessageText(chatId, messageId, messageBuilder.buildRenderingMessage(), null)
                : telegramMessageService.sendMessage(chatId, messageBuilder.buildRenderingMessage());

        boolean awaitingVisibility = themeSubmissionService.currentStage(userId)
                .filter(stage -> stage == SubmissionStage.AWAITING_VISIBILITY)
                .isPresent();
        return !awaitingVisibility
                ? Mono.empty()
                : progress.onErrorResume(e -> Mono.empty())
                        .then(themeSubmissionService.submitVisibility(userId, choice))
                        .flatMap(result -> reportCompletion(chatId, result));
    }

    private Mono<Void> reportCompletion(Long chatId, SubmissionResult result) {
        Mono<Void> report = switch (result.getStatus()) {
            case COMPLETED -> telegramMessageService.sendPhotoBytes(chatId, result.getPreviewImage(), null)
                    .onErrorResume(e -> Mono.empty())
                    .then(telegramMessageService.sendMessage(chatId, messageBuilder.buildUploadCompletedMessage(
                            result.getThemeName(), result.getVisibility(), result.getPublicId())));
            case INVALID_VISIBILITY -> telegramMessageService.sendMessageWithKeyboard(chatId,
                    messageBuilder.buildDescriptionAcceptedMessage(), messageBuilder.buildVisibilityKeyboard());
            case QUOTA_EXCEEDED -> telegramMessageService.sendMessage(chatId,
                    messageBuilder.buildNoFreeSlotsMessage());
            case RENDER_FAILED -> telegramMessageService.sendMessage(chatId, messageBuilder.buildRenderFailedMessage());
            case STORAGE_CONFLICT -> telegramMessageService.sendMessage(chatId, messageBuilder.buildStorageConflictMessage());
            case STORAGE_FAILED -> telegramMessageService.sendMessage(chatId, messageBuilder.buildStorageFailedMessage());
            default -> Mono.empty();
        };

        if (result.getStage() == null || !result.getStage().isTerminal()) {
            return report;
        }
        return report.then(telegramMessageService.sendMessageWithKeyboard(chatId,
                messageBuilder.buildBackToMenuMessage(), messageBuilder.buildMainMenuKeyboard()));
    }
}
