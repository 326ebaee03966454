package ru.oparin.fpthemes.model.dto.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * DTO для сообщения от Telegram Bot API.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramMessage {

    @JsonProperty("message_id")
    private Long messageId;

    private TelegramUser from;
    private TelegramChat chat;
    private Long date;
    private String text;
    private String caption;
    private TelegramDocument document;

    @JsonProperty("successful_payment")
    private TelegramSuccessfulPayment successfulPayment;
}
