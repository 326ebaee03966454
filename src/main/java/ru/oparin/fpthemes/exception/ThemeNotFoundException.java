package ru.oparin.fpthemes.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class ThemeNotFoundException extends RuntimeException {
    private final HttpStatus status;

    public ThemeNotFoundException(String message) {
        super(message);
        this.status = HttpStatus.NOT_FOUND;
    }
}
