package ru.oparin.fpthemes.model.dto.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * DTO для запроса подтверждения оплаты перед списанием.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramPreCheckoutQuery {

    private String id;

    private TelegramUser from;

    private String currency;

    @JsonProperty("total_amount")
    private Integer totalAmount;

    @JsonProperty("invoice_payload")
    private String invoicePayload;
}
