package ru.oparin.fpthemes.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import ru.oparin.fpthemes.model.enums.SubmissionStatus;

/**
 * Файл темы не прошел проверку структуры.
 */
@Getter
public class ThemeValidationException extends RuntimeException {
    private final HttpStatus status;
    private final SubmissionStatus reason;

    public ThemeValidationException(SubmissionStatus reason, String message) {
        super(message);
        this.status = HttpStatus.BAD_REQUEST;
        this.reason = reason;
    }

    public ThemeValidationException(SubmissionStatus reason, String message, Throwable cause) {
        super(message, cause);
        this.status = HttpStatus.BAD_REQUEST;
        this.reason = reason;
    }
}
