package ru.oparin.fpthemes.model.dto.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * DTO для чата Telegram.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramChat {

    private Long id;
    private String type;
    private String username;
}
