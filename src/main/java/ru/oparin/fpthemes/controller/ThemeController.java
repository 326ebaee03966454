package ru.oparin.fpthemes.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import ru.oparin.fpthemes.model.dto.PageResponseDTO;
import ru.oparin.fpthemes.model.dto.PublicThemeDTO;
import ru.oparin.fpthemes.model.dto.ThemeDetailsDTO;
import ru.oparin.fpthemes.service.ThemeService;

/**
 * Публичный каталог тем. Приватные темы в списке не показываются,
 * но доступны по публичному идентификатору.
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/themes")
@RequiredArgsConstructor
@Tag(name = "Themes", description = "Каталог тем FunPay Tools")
public class ThemeController {

    private final ThemeService themeService;

    /**
     * Страница публичных тем, новые первые.
     *
     * @param page номер страницы (начиная с 0)
     * @param size размер страницы
     */
    @GetMapping
    @Operation(summary = "Список публичных тем", description = "Возвращает публичные темы с пагинацией")
    public Mono<ResponseEntity<PageResponseDTO<PublicThemeDTO>>> getPublicThemes(
            @Parameter(description = "Номер страницы (начиная с 0)")
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @Parameter(description = "Размер страницы")
            @RequestParam(defaultValue = "5") @Min(1) @Max(50) int size) {
        return themeService.browsePublic(page, size)
                .map(ResponseEntity::ok)
                .doOnError(error -> log.error("Ошибка при получении списка тем", error));
    }

    /**
     * Тема по публичному идентификатору, независимо от видимости.
     */
    @GetMapping("/{publicId}")
    @Operation(summary = "Тема по ссылке", description = "Возвращает тему по публичному идентификатору")
    public Mono<ResponseEntity<ThemeDetailsDTO>> getTheme(@PathVariable String publicId) {
        return themeService.getThemeDetails(publicId)
                .map(ResponseEntity::ok);
    }
}
