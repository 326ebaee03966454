package ru.oparin.fpthemes.exception;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ответы REST-каталога на ошибки. Тело всегда содержит поля error и status.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ThemeNotFoundException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleThemeNotFound(ThemeNotFoundException ex) {
        log.debug("Тема не найдена: {}", ex.getMessage());
        return respond(ex.getStatus(), ex.getMessage());
    }

    @ExceptionHandler(ThemeConflictException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleThemeConflict(ThemeConflictException ex) {
        log.warn("Конфликт при сохранении темы с хешем {}", ex.getContentHash());
        return respond(ex.getStatus(), ex.getMessage());
    }

    @ExceptionHandler(ThemeValidationException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleThemeValidation(ThemeValidationException ex) {
        Map<String, Object> body = body(ex.getStatus(), "Ошибка валидации темы");
        body.put("reason", ex.getReason().name());
        body.put("details", ex.getMessage());
        return Mono.just(ResponseEntity.status(ex.getStatus()).body(body));
    }

    @ExceptionHandler({IllegalArgumentException.class, ConstraintViolationException.class, ServerWebInputException.class})
    public Mono<ResponseEntity<Map<String, Object>>> handleBadRequest(Exception ex) {
        log.warn("Некорректный запрос: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage() != null ? ex.getMessage() : "Некорректный запрос");
    }

    @ExceptionHandler(PreviewRenderException.class)
    public Mono<ResponseEntity<Map<String, Object>>> handlePreviewRender(PreviewRenderException ex) {
        log.error("Ошибка рендера превью: {}", ex.getMessage(), ex.getCause());
        return respond(ex.getStatus(), ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<Map<String, Object>>> handleAllExceptions(Exception ex) {
        log.error("Неизвестная ошибка: ", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Внутренняя ошибка сервера");
    }

    private static Mono<ResponseEntity<Map<String, Object>>> respond(HttpStatus status, String error) {
        return Mono.just(ResponseEntity.status(status).body(body(status, error)));
    }

    private static Map<String, Object> body(HttpStatus status, String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("status", status.value());
        return body;
    }
}
