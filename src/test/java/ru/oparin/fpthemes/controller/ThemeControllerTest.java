package ru.oparin.fpthemes.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;
import ru.oparin.fpthemes.exception.GlobalExceptionHandler;
import ru.oparin.fpthemes.exception.ThemeNotFoundException;
import ru.oparin.fpthemes.model.dto.PageResponseDTO;
import ru.oparin.fpthemes.model.dto.PublicThemeDTO;
import ru.oparin.fpthemes.model.dto.ThemeDetailsDTO;
import ru.oparin.fpthemes.model.enums.ThemeVisibility;
import ru.oparin.fpthemes.service.ThemeService;

import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ThemeControllerTest {

    private ThemeService themeService;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        themeService = mock(ThemeService.class);
        webTestClient = WebTestClient.bindToController(new ThemeController(themeService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void listsPublicThemes() {
        PublicThemeDTO theme = PublicThemeDTO.builder().id(1L).name("Neon").ownerDisplayName("alice").build();
        when(themeService.browsePublic(0, 5)).thenReturn(Mono.just(PageResponseDTO.of(List.of(theme), 0, 5, 6)));

        webTestClient.get().uri("/api/themes")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.content[0].name").isEqualTo("Neon")
                .jsonPath("$.content[0].ownerDisplayName").isEqualTo("alice")
                .jsonPath("$.totalElements").isEqualTo(6)
                .jsonPath("$.hasNext").isEqualTo(true)
                .jsonPath("$.hasPrevious").isEqualTo(false);
    }

    @Test
    void returnsThemeByPublicId() {
        when(themeService.getThemeDetails("pub1")).thenReturn(Mono.just(ThemeDetailsDTO.builder()
                .publicId("pub1")
                .name("Secret")
                .visibility(ThemeVisibility.PRIVATE)
                .previewUrl("https://host/files/previews/p.jpg")
                .build()));

        webTestClient.get().uri("/api/themes/pub1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.name").isEqualTo("Secret")
                .jsonPath("$.visibility").isEqualTo("PRIVATE");
    }

    @Test
    void unknownPublicIdIs404() {
        when(themeService.getThemeDetails("missing"))
                .thenReturn(Mono.error(new ThemeNotFoundException("Тема не найдена: missing")));

        webTestClient.get().uri("/api/themes/missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.status").isEqualTo(404);
    }

    @Test
    void invalidPageIs400() {
        when(themeService.browsePublic(-1, 5))
                .thenReturn(Mono.error(new IllegalArgumentException("Некорректные параметры страницы")));

        webTestClient.get().uri("/api/themes?page=-1")
                .exchange()
                .expectStatus().isBadRequest();
    }
}
