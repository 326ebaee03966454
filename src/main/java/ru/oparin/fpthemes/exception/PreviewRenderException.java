package ru.oparin.fpthemes.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Неустранимая ошибка рендера превью. Без превью тема не сохраняется.
 */
@Getter
public class PreviewRenderException extends RuntimeException {
    private final HttpStatus status;

    public PreviewRenderException(String message, Throwable cause) {
        super(message, cause);
        this.status = HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
