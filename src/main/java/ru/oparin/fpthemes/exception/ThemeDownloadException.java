package ru.oparin.fpthemes.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Не удалось получить содержимое присланного файла темы.
 */
@Getter
public class ThemeDownloadException extends RuntimeException {
    private final HttpStatus status;

    public ThemeDownloadException(String message, Throwable cause) {
        super(message, cause);
        this.status = HttpStatus.BAD_GATEWAY;
    }
}
