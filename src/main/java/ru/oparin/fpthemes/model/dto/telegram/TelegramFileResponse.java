package ru.oparin.fpthemes.model.dto.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * DTO для ответа от Telegram getFile API.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramFileResponse {
    private boolean ok;
    private String description;
    private TelegramFile result;
}
