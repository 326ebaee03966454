package ru.oparin.fpthemes.service.telegram;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.oparin.fpthemes.config.properties.ThemeProperties;
import ru.oparin.fpthemes.model.dto.telegram.*;
import ru.oparin.fpthemes.model.entity.User;
import ru.oparin.fpthemes.service.PreviewStorageService;
import ru.oparin.fpthemes.service.ThemeService;
import ru.oparin.fpthemes.service.UserService;

import java.time.Duration;
import java.util.function.Function;

/**
 * Основной сервис для работы с Telegram ботом.
 * Разбирает обновления и передает их обработчикам диалога загрузки, кнопок и команд администратора.
 * Сообщения заблокированных пользователей игнорируются.
 */
@RequiredArgsConstructor
@Service
@Slf4j
public class TelegramBotService {

    static final String BUY_SLOTS_PAYLOAD_PREFIX = "buy_slots_";
    private static final Duration BROADCAST_DELAY = Duration.ofMillis(50);

    private final UserService userService;
    private final ThemeService themeService;
    private final PreviewStorageService previewStorageService;
    private final TelegramMessageService telegramMessageService;
    private final TelegramBotMessageBuilder messageBuilder;
    private final TelegramBotCallbackHandler callbackHandler;
    private final TelegramBotSubmissionHandler submissionHandler;
    private final ThemeProperties themeProperties;

    /**
     * Обработать обновление от Telegram.
     */
    public Mono<Void> processUpdate(TelegramUpdate update) {
        if (update.getPreCheckoutQuery() != null) {
            return handlePreCheckout(update.getPreCheckoutQuery());
        }

        if (update.getCallbackQuery() != null) {
            TelegramCallbackQuery callbackQuery = update.getCallbackQuery();
            return registerAndCheckBan(callbackQuery.getFrom())
                    .flatMap(allowed -> allowed
                            ? callbackHandler.handleCallbackQuery(callbackQuery)
                            : telegramMessageService.answerCallbackQuery(callbackQuery.getId()))
                    .onErrorResume(error -> {
                        log.error("Ошибка обработки callback от пользователя {}", callbackQuery.getFrom().getId(), error);
                        return telegramMessageService.answerCallbackQuery(callbackQuery.getId(),
                                messageBuilder.buildErrorMessage(), true);
                    });
        }

        TelegramMessage message = update.getMessage();
        if (message == null || message.getFrom() == null || message.getChat() == null) {
            log.debug("Обновление не содержит сообщения, пропускаем");
            return Mono.empty();
        }

        Long chatId = message.getChat().getId();
        Long telegramId = message.getFrom().getId();

        if (message.getSuccessfulPayment() != null) {
            return handleSuccessfulPayment(chatId, message.getSuccessfulPayment());
        }

        return registerAndCheckBan(message.getFrom())
                .flatMap(allowed -> {
                    if (!allowed) {
                        log.info("Сообщение заблокированного пользователя {} проигнорировано", telegramId);
                        return Mono.<Void>empty();
                    }
                    return processMessage(message, chatId, telegramId);
                })
                .onErrorResume(error -> {
                    log.error("Ошибка обработки сообщения от пользователя {} в чате {}", telegramId, chatId, error);
                    return telegramMessageService.sendMessage(chatId, messageBuilder.buildErrorMessage());
                });
    }

    private Mono<Void> processMessage(TelegramMessage message, Long chatId, Long telegramId) {
        if (message.getDocument() != null) {
            return submissionHandler.handleDocument(chatId, telegramId, message.getDocument());
        }

        String text = message.getText();
        if (text == null) {
            return Mono.empty();
        }

        if (text.startsWith("/start")) {
            return handleStartCommand(chatId, telegramId, text);
        }
        if (text.equals("/cancel")) {
            submissionHandler.cancel(telegramId);
            return sendMainMenu(chatId);
        }
        if (text.startsWith("/") && themeProperties.isAdmin(telegramId)) {
            return handleAdminCommand(chatId, text);
        }

        return submissionHandler.handleText(chatId, telegramId, text)
                .flatMap(handled -> handled ? Mono.<Void>empty() : sendMainMenu(chatId));
    }

    /**
     * Обработать команду /start, в том числе с публичным идентификатором темы из ссылки t.me.
     */
    public Mono<Void> handleStartCommand(Long chatId, Long telegramId, String text) {
        log.info("Обработка команды /start для чата {} и пользователя {}", chatId, telegramId);
        submissionHandler.cancel(telegramId);

        String[] parts = text.trim().split("\\s+", 2);
        if (parts.length < 2) {
            return sendMainMenu(chatId);
        }

        String publicId = parts[1].trim();
        return themeService.getThemeByPublicId(publicId)
                .flatMap(theme -> userService.getUser(theme.getOwnerId())
                        .map(owner -> owner.getDisplayName() != null ? owner.getDisplayName() : "")
                        .defaultIfEmpty("")
                        .flatMap(ownerName -> telegramMessageService.sendPhoto(chatId,
                                        previewStorageService.toUrl(theme.getPreviewRef()),
                                        messageBuilder.buildSharedThemeCaption(theme, ownerName.isEmpty() ? null : ownerName),
                                        null)
                                .then(telegramMessageService.sendDocument(chatId, theme.getContentRef())))
                        .thenReturn(true))
                .switchIfEmpty(Mono.defer(() -> {
                    log.info("Тема по ссылке {} не найдена", publicId);
                    return sendMainMenu(chatId).thenReturn(false);
                }))
                .then();
    }

    /**
     * Команды администратора: /ban, /unban, /deltheme, /broadcast.
     */
    Mono<Void> handleAdminCommand(Long chatId, String text) {
        String[] parts = text.trim().split("\\s+", 2);
        String command = parts[0];
        String argument = parts.length > 1 ? parts[1].trim() : "";
        log.info("Команда администратора в чате {}: {}", chatId, command);

        return switch (command) {
            case "/ban" -> withId(chatId, argument, id -> userService.setBanStatus(id, true)
                    .flatMap(found -> reply(chatId, found, "🔨 Пользователь " + id + " заблокирован.")));
            case "/unban" -> withId(chatId, argument, id -> userService.setBanStatus(id, false)
                    .flatMap(found -> reply(chatId, found, "🕊️ Пользователь " + id + " разблокирован.")));
            case "/deltheme" -> withId(chatId, argument, id -> themeService.adminDeleteTheme(id)
                    .flatMap(deleted -> reply(chatId, deleted, "🗑️ Тема " + id + " удалена.")));
            case "/broadcast" -> argument.isEmpty()
                    ? telegramMessageService.sendMessage(chatId, "Использование: /broadcast текст")
                    : broadcast(chatId, argument);
            default -> sendMainMenu(chatId);
        };
    }

    /**
     * Рассылка всем незаблокированным пользователям. Ошибки доставки отдельным пользователям не прерывают рассылку.
     */
    private Mono<Void> broadcast(Long chatId, String text) {
        return userService.findActiveUsers()
                .map(User::getId)
                .delayElements(BROADCAST_DELAY)
                .concatMap(userId -> telegramMessageService.sendMessage(userId, text)
                        .thenReturn(true)
                        .onErrorResume(error -> Mono.just(false)))
                .filter(Boolean::booleanValue)
                .count()
                .doOnNext(sent -> log.info("Рассылка завершена, доставлено: {}", sent))
                .flatMap(sent -> telegramMessageService.sendMessage(chatId, "📢 Рассылка завершена. Доставлено: " + sent));
    }

    /**
     * Подтвердить оплату слотов. Платежи с неизвестным payload отклоняются.
     */
    private Mono<Void> handlePreCheckout(TelegramPreCheckoutQuery query) {
        boolean known = parseSlotsPayload(query.getInvoicePayload()) != null;
        log.info("Pre-checkout {} от пользователя {}, payload {}: {}",
                query.getId(), query.getFrom() != null ? query.getFrom().getId() : null, query.getInvoicePayload(), known);
        return telegramMessageService.answerPreCheckoutQuery(query.getId(), known,
                known ? null : "Неизвестный товар");
    }

    /**
     * Начислить купленные слоты. Payload: buy_slots_{userId}_{count}.
     */
    private Mono<Void> handleSuccessfulPayment(Long chatId, TelegramSuccessfulPayment payment) {
        long[] parsed = parseSlotsPayload(payment.getInvoicePayload());
        if (parsed == null) {
            log.warn("Оплата с неизвестным payload: {}", payment.getInvoicePayload());
            return Mono.empty();
        }
        Long userId = parsed[0];
        int slots = (int) parsed[1];

        return userService.grantSlots(userId, slots)
                .filter(Boolean::booleanValue)
                .flatMap(granted -> userService.getUser(userId))
                .flatMap(user -> telegramMessageService.sendMessage(userId,
                        messageBuilder.buildPaymentSuccessMessage(slots, user.getThemeSlots())))
                .doOnError(error -> log.error("Ошибка начисления слотов пользователю {} (чат {})", userId, chatId, error));
    }

    static long[] parseSlotsPayload(String payload) {
        if (payload == null || !payload.startsWith(BUY_SLOTS_PAYLOAD_PREFIX)) {
            return null;
        }
        String[] parts = payload.substring(BUY_SLOTS_PAYLOAD_PREFIX.length()).split("_");
        if (parts.length != 2) {
            return null;
        }
        try {
            long userId = Long.parseLong(parts[0]);
            long count = Long.parseLong(parts[1]);
            return count > 0 && count <= Integer.MAX_VALUE ? new long[]{userId, count} : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Mono<Boolean> registerAndCheckBan(TelegramUser telegramUser) {
        return userService.upsertUser(telegramUser.getId(), telegramUser.getUsername())
                .map(user -> !Boolean.TRUE.equals(user.getBanned()));
    }

    private Mono<Void> sendMainMenu(Long chatId) {
        return telegramMessageService.sendMessageWithKeyboard(chatId,
                messageBuilder.buildWelcomeMessage(), messageBuilder.buildMainMenuKeyboard());
    }

    private Mono<Void> withId(Long chatId, String argument, Function<Long, Mono<Void>> action) {
        try {
            return action.apply(Long.parseLong(argument));
        } catch (NumberFormatException e) {
            return telegramMessageService.sendMessage(chatId, "Укажите числовой ID.");
        }
    }

    private Mono<Void> reply(Long chatId, boolean success, String successText) {
        return telegramMessageService.sendMessage(chatId, success ? successText : "Не найдено.");
    }
}
