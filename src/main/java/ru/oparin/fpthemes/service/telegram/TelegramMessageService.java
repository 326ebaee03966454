package ru.oparin.fpthemes.service.telegram;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import ru.oparin.fpthemes.model.dto.telegram.TelegramApiResponse;

import java.time.Duration;

/**
 * Сервис для отправки сообщений и медиа через Telegram Bot API.
 */
@RequiredArgsConstructor
@Service
@Slf4j
public class TelegramMessageService {

    private final WebClient.Builder webClientBuilder;

    @Value("${telegram.bot.token}")
    private String botToken;

    private static final String TELEGRAM_API_URL = "https://api.telegram.org/bot";
    private static final String PARSE_MODE = "Markdown";
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    /**
     * Отправить текстовое сообщение с Markdown разметкой.
     *
     * @param chatId ID чата
     * @param text   текст сообщения
     */
    public Mono<Void> sendMessage(Long chatId, String text) {
        return sendMessageWithKeyboard(chatId, text, null);
    }

    /**
     * Отправить сообщение с inline-клавиатурой.
     *
     * @param chatId          ID чата
     * @param text            текст сообщения
     * @param replyMarkupJson JSON inline-клавиатура или null
     */
    public Mono<Void> sendMessageWithKeyboard(Long chatId, String text, String replyMarkupJson) {
        log.info("Отправка сообщения в чат {}", chatId);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("chat_id", String.valueOf(chatId));
        body.add("text", text);
        body.add("parse_mode", PARSE_MODE);
        if (replyMarkupJson != null) {
            body.add("reply_markup", replyMarkupJson);
        }

        return postForm("/sendMessage", body)
                .doOnError(error -> log.error("Ошибка отправки сообщения в чат {}: {}", chatId, error.getMessage()))
                .then();
    }

    /**
     * Заменить текст и клавиатуру ранее отправленного сообщения.
     */
    public Mono<Void> editMessageText(Long chatId, Long messageId, String text, String replyMarkupJson) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("chat_id", String.valueOf(chatId));
        body.add("message_id", String.valueOf(messageId));
        body.add("text", text);
        body.add("parse_mode", PARSE_MODE);
        if (replyMarkupJson != null) {
            body.add("reply_markup", replyMarkupJson);
        }

        return postForm("/editMessageText", body)
                .doOnError(error -> log.warn("Ошибка редактирования сообщения {} в чате {}: {}",
                        messageId, chatId, error.getMessage()))
                .then();
    }

    /**
     * Заменить только клавиатуру сообщения (работает и для сообщений с фото).
     */
    public Mono<Void> editMessageReplyMarkup(Long chatId, Long messageId, String replyMarkupJson) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("chat_id", String.valueOf(chatId));
        body.add("message_id", String.valueOf(messageId));
        body.add("reply_markup", replyMarkupJson);

        return postForm("/editMessageReplyMarkup", body)
                .doOnError(error -> log.warn("Ошибка изменения клавиатуры сообщения {} в чате {}: {}",
                        messageId, chatId, error.getMessage()))
                .then();
    }

    /**
     * Отправить фото по URL с подписью и клавиатурой.
     *
     * @param chatId          ID чата
     * @param photoUrl        URL фото
     * @param caption         подпись к фото
     * @param replyMarkupJson JSON inline-клавиатура или null
     */
    public Mono<Void> sendPhoto(Long chatId, String photoUrl, String caption, String replyMarkupJson) {
        log.info("Отправка фото в чат {}: {}", chatId, photoUrl);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("chat_id", String.valueOf(chatId));
        body.add("photo", photoUrl);
        if (caption != null && !caption.isBlank()) {
            body.add("caption", caption);
            body.add("parse_mode", PARSE_MODE);
        }
        if (replyMarkupJson != null) {
            body.add("reply_markup", replyMarkupJson);
        }

        return postForm("/sendPhoto", body)
                .doOnError(error -> log.error("Ошибка отправки фото в чат {}: {}", chatId, error.getMessage()))
                .then();
    }

    /**
     * Загрузить и отправить JPEG из памяти.
     *
     * @param chatId  ID чата
     * @param jpeg    байты изображения
     * @param caption подпись или null
     */
    public Mono<Void> sendPhotoBytes(Long chatId, byte[] jpeg, String caption) {
        log.info("Отправка превью в чат {} ({} байт)", chatId, jpeg.length);

        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("chat_id", String.valueOf(chatId));
        builder.part("photo", new ByteArrayResource(jpeg) {
                    @Override
                    public String getFilename() {
                        return "preview.jpg";
                    }
                })
                .contentType(MediaType.IMAGE_JPEG);
        if (caption != null && !caption.isBlank()) {
            builder.part("caption", caption);
            builder.part("parse_mode", PARSE_MODE);
        }

        return telegramClient().post()
                .uri("/sendPhoto")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .retrieve()
                .bodyToMono(TelegramApiResponse.class)
                .timeout(TIMEOUT)
                .doOnError(error -> log.error("Ошибка отправки превью в чат {}: {}", chatId, error.getMessage()))
                .then();
    }

    /**
     * Отправить ранее загруженный в Telegram документ.
     *
     * @param chatId ID чата
     * @param fileId file_id документа
     */
    public Mono<Void> sendDocument(Long chatId, String fileId) {
        log.info("Отправка документа в чат {}", chatId);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("chat_id", String.valueOf(chatId));
        body.add("document", fileId);

        return postForm("/sendDocument", body)
                .doOnError(error -> log.error("Ошибка отправки документа в чат {}: {}", chatId, error.getMessage()))
                .then();
    }

    /**
     * Ответить на callback query без текста.
     */
    public Mono<Void> answerCallbackQuery(String callbackQueryId) {
        return answerCallbackQuery(callbackQueryId, null, false);
    }

    /**
     * Ответить на callback query всплывающим уведомлением.
     *
     * @param callbackQueryId ID callback query
     * @param text            текст уведомления или null
     * @param showAlert       показать как диалог
     */
    public Mono<Void> answerCallbackQuery(String callbackQueryId, String text, boolean showAlert) {
        log.debug("Отправка ответа на callback query: {}", callbackQueryId);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("callback_query_id", callbackQueryId);
        if (text != null) {
            body.add("text", text);
            body.add("show_alert", String.valueOf(showAlert));
        }

        return postForm("/answerCallbackQuery", body)
                .doOnError(error -> log.warn("Ошибка ответа на callback query {}: {}", callbackQueryId, error.getMessage()))
                .onErrorResume(error -> Mono.empty())
                .then();
    }

    /**
     * Подтвердить или отклонить оплату.
     *
     * @param preCheckoutQueryId ID запроса
     * @param ok                 принять оплату
     * @param errorMessage       причина отказа (только при ok = false)
     */
    public Mono<Void> answerPreCheckoutQuery(String preCheckoutQueryId, boolean ok, String errorMessage) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("pre_checkout_query_id", preCheckoutQueryId);
        body.add("ok", String.valueOf(ok));
        if (!ok && errorMessage != null) {
            body.add("error_message", errorMessage);
        }

        return postForm("/answerPreCheckoutQuery", body)
                .doOnError(error -> log.error("Ошибка ответа на pre-checkout {}: {}", preCheckoutQueryId, error.getMessage()))
                .then();
    }

    /**
     * Удалить сообщение. Ошибка (например, сообщение уже удалено) только логируется.
     */
    public Mono<Void> deleteMessage(Long chatId, Long messageId) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("chat_id", String.valueOf(chatId));
        body.add("message_id", String.valueOf(messageId));

        return postForm("/deleteMessage", body)
                .doOnError(error -> log.warn("Не удалось удалить сообщение {} в чате {}: {}",
                        messageId, chatId, error.getMessage()))
                .onErrorResume(error -> Mono.empty())
                .then();
    }

    private Mono<TelegramApiResponse> postForm(String method, MultiValueMap<String, String> body) {
        return telegramClient().post()
                .uri(method)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(body))
                .retrieve()
                .bodyToMono(TelegramApiResponse.class)
                .timeout(TIMEOUT)
                .doOnNext(response -> {
                    if (!Boolean.TRUE.equals(response.getOk())) {
                        log.warn("Telegram API вернул ошибку на {}: {} - {}",
                                method, response.getErrorCode(), response.getDescription());
                    }
                });
    }

    private WebClient telegramClient() {
        return webClientBuilder.clone()
                .baseUrl(TELEGRAM_API_URL + botToken)
                .build();
    }
}
