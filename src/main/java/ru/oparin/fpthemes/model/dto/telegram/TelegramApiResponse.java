package ru.oparin.fpthemes.model.dto.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * DTO для ответа от Telegram Bot API.
 * result зависит от метода: сообщение для send*, true для deleteMessage и answerCallbackQuery.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramApiResponse {

    private Boolean ok;
    private JsonNode result;

    @JsonProperty("error_code")
    private Integer errorCode;

    private String description;
}
