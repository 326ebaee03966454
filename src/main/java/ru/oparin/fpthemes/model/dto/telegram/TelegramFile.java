package ru.oparin.fpthemes.model.dto.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * DTO для файла Telegram.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramFile {
    @JsonProperty("file_id")
    private String fileId;

    @JsonProperty("file_unique_id")
    private String fileUniqueId;

    @JsonProperty("file_size")
    private Long fileSize;

    @JsonProperty("file_path")
    private String filePath;
}
