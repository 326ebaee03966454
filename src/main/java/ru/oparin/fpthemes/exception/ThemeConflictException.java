package ru.oparin.fpthemes.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Тема с таким же содержимым уже сохранена. Возникает при нарушении
 * уникального ограничения на content_hash в момент вставки.
 */
@Getter
public class ThemeConflictException extends RuntimeException {
    private final HttpStatus status;
    private final String contentHash;

    public ThemeConflictException(String contentHash, Throwable cause) {
        super("Тема с таким содержимым уже существует", cause);
        this.status = HttpStatus.CONFLICT;
        this.contentHash = contentHash;
    }
}
