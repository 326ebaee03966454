package ru.oparin.fpthemes.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.fpthemes.model.dto.telegram.TelegramUpdate;
import ru.oparin.fpthemes.service.telegram.TelegramBotService;

/**
 * Контроллер для обработки webhook от Telegram Bot API.
 */
@RestController
@RequestMapping("/telegram")
@RequiredArgsConstructor
@Slf4j
public class TelegramBotController {

    static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

    private final TelegramBotService telegramBotService;

    @Value("${telegram.bot.webhook-secret:}")
    private String webhookSecret;

    /**
     * Обработка webhook от Telegram.
     * Если задан секрет webhook, запросы без совпадающего заголовка отклоняются.
     *
     * @param update объект обновления от Telegram
     * @return статус обработки
     */
    @PostMapping("/webhook")
    public Mono<ResponseEntity<String>> handleWebhook(
            @RequestHeader(value = SECRET_HEADER, required = false) String secretToken,
            @RequestBody TelegramUpdate update) {
        if (webhookSecret != null && !webhookSecret.isEmpty() && !webhookSecret.equals(secretToken)) {
            log.warn("Webhook с неверным секретом отклонен, update {}", update.getUpdateId());
            return Mono.just(ResponseEntity.status(HttpStatus.UNAUTHORIZED).body("UNAUTHORIZED"));
        }
        log.debug("Получен webhook от Telegram: {}", update);

        return telegramBotService.processUpdate(update)
                .then(Mono.just(ResponseEntity.ok("OK")))
                .onErrorResume(error -> {
                    log.error("Ошибка обработки webhook: {}", error.getMessage(), error);
                    return Mono.just(ResponseEntity.ok("ERROR"));
                });
    }
}
