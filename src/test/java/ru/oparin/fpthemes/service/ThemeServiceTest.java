package ru.oparin.fpthemes.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.r2dbc.DataR2dbcTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.fpthemes.config.properties.ThemeProperties;
import ru.oparin.fpthemes.exception.ThemeConflictException;
import ru.oparin.fpthemes.exception.ThemeNotFoundException;
import ru.oparin.fpthemes.model.dto.OwnedThemeDTO;
import ru.oparin.fpthemes.model.dto.PublicThemeDTO;
import ru.oparin.fpthemes.model.entity.Theme;
import ru.oparin.fpthemes.model.enums.ThemeVisibility;
import ru.oparin.fpthemes.repository.ThemeRepository;
import ru.oparin.fpthemes.repository.UserRepository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doReturn;

@DataR2dbcTest
@ActiveProfiles("test")
@Import({ThemeService.class, UserService.class, ContentIdentityService.class, PreviewStorageService.class,
        ThemeProperties.class})
class ThemeServiceTest {

    private static final Long ALICE = 1L;
    private static final Long BOB = 2L;

    @Autowired
    private ThemeService themeService;

    @Autowired
    private UserService userService;

    @SpyBean
    private ContentIdentityService contentIdentityService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private ThemeRepository themeRepository;

    @BeforeEach
    void setUp() {
        themeRepository.deleteAll().then(userRepository.deleteAll()).block();
        userService.upsertUser(ALICE, "alice").block();
        userService.upsertUser(BOB, null).block();
    }

    @Test
    void createdThemeGetsIdentifiers() {
        StepVerifier.create(create(ALICE, "Neon", ThemeVisibility.PUBLIC, "hash-1"))
                .assertNext(theme -> {
                    assertThat(theme.getId()).isNotNull();
                    assertThat(theme.getPublicId()).hasSize(22);
                    assertThat(theme.getCreatedAt()).isNotNull();
                })
                .verifyComplete();

        StepVerifier.create(themeService.hashExists("hash-1"))
                .expectNext(true)
                .verifyComplete();
        StepVerifier.create(themeService.countThemesOwnedBy(ALICE))
                .expectNext(1L)
                .verifyComplete();
    }

    @Test
    void sameContentHashConflicts() {
        create(ALICE, "First", ThemeVisibility.PUBLIC, "same-hash").block();

        StepVerifier.create(create(BOB, "Second", ThemeVisibility.PRIVATE, "same-hash"))
                .expectError(ThemeConflictException.class)
                .verify();

        StepVerifier.create(themeService.countThemesOwnedBy(BOB))
                .expectNext(0L)
                .verifyComplete();
    }

    @Test
    void publicIdCollisionIsRetried() {
        doReturn("collidingPublicId00000", "collidingPublicId00000", "freshPublicId000000000")
                .when(contentIdentityService).generatePublicId();

        create(ALICE, "First", ThemeVisibility.PUBLIC, "hash-a").block();

        StepVerifier.create(create(ALICE, "Second", ThemeVisibility.PUBLIC, "hash-b"))
                .assertNext(theme -> assertThat(theme.getPublicId()).isEqualTo("freshPublicId000000000"))
                .verifyComplete();
    }

    @Test
    void ownedThemesAreNewestFirst() {
        create(ALICE, "Old", ThemeVisibility.PUBLIC, "h1").block();
        create(ALICE, "Middle", ThemeVisibility.PRIVATE, "h2").block();
        create(ALICE, "New", ThemeVisibility.PUBLIC, "h3").block();
        create(BOB, "Foreign", ThemeVisibility.PUBLIC, "h4").block();

        StepVerifier.create(themeService.listThemesOwnedBy(ALICE).map(OwnedThemeDTO::getName).collectList())
                .assertNext(names -> assertThat(names).containsExactly("New", "Middle", "Old"))
                .verifyComplete();
    }

    @Test
    void onlyOwnerDeletesTheme() {
        Theme theme = create(ALICE, "Neon", ThemeVisibility.PUBLIC, "h1").block();

        StepVerifier.create(themeService.deleteTheme(theme.getId(), BOB))
                .expectNext(false)
                .verifyComplete();
        StepVerifier.create(themeService.deleteTheme(theme.getId(), ALICE))
                .expectNext(true)
                .verifyComplete();
        StepVerifier.create(themeService.deleteTheme(theme.getId(), ALICE))
                .expectNext(false)
                .verifyComplete();
        StepVerifier.create(themeService.hashExists("h1"))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void adminDeletesAnyTheme() {
        Theme theme = create(ALICE, "Neon", ThemeVisibility.PUBLIC, "h1").block();

        StepVerifier.create(themeService.adminDeleteTheme(theme.getId()))
                .expectNext(true)
                .verifyComplete();
        StepVerifier.create(themeService.adminDeleteTheme(theme.getId()))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void onlyOwnerChangesVisibility() {
        Theme theme = create(ALICE, "Neon", ThemeVisibility.PUBLIC, "h1").block();

        StepVerifier.create(themeService.setVisibility(theme.getId(), BOB, ThemeVisibility.PRIVATE))
                .expectNext(false)
                .verifyComplete();
        StepVerifier.create(themeService.setVisibility(theme.getId(), ALICE, ThemeVisibility.PRIVATE))
                .expectNext(true)
                .verifyComplete();
        StepVerifier.create(themeService.setVisibility(theme.getId(), ALICE, ThemeVisibility.PRIVATE))
                .expectNext(true)
                .verifyComplete();
        StepVerifier.create(themeService.getThemeById(theme.getId()))
                .assertNext(saved -> assertThat(saved.getVisibility()).isEqualTo(ThemeVisibility.PRIVATE))
                .verifyComplete();
    }

    @Test
    void storePagesContainOnlyPublicThemes() {
        for (int i = 0; i < 7; i++) {
            create(i % 2 == 0 ? ALICE : BOB, "Public " + i, ThemeVisibility.PUBLIC, "pub-" + i).block();
        }
        create(ALICE, "Hidden 1", ThemeVisibility.PRIVATE, "priv-1").block();
        create(BOB, "Hidden 2", ThemeVisibility.PRIVATE, "priv-2").block();

        StepVerifier.create(themeService.browsePublic(0, 5))
                .assertNext(page -> {
                    assertThat(page.getContent()).hasSize(5);
                    assertThat(page.getContent()).extracting(PublicThemeDTO::getName)
                            .containsExactly("Public 6", "Public 5", "Public 4", "Public 3", "Public 2");
                    assertThat(page.getContent().get(0).getOwnerDisplayName()).isEqualTo("alice");
                    assertThat(page.getContent().get(1).getOwnerDisplayName()).isNull();
                    assertThat(page.getTotalElements()).isEqualTo(7L);
                    assertThat(page.getTotalPages()).isEqualTo(2);
                    assertThat(page.getHasNext()).isTrue();
                    assertThat(page.getHasPrevious()).isFalse();
                })
                .verifyComplete();

        StepVerifier.create(themeService.browsePublic(1, 5))
                .assertNext(page -> {
                    assertThat(page.getContent()).extracting(PublicThemeDTO::getName)
                            .containsExactly("Public 1", "Public 0");
                    assertThat(page.getHasNext()).isFalse();
                    assertThat(page.getHasPrevious()).isTrue();
                })
                .verifyComplete();

        StepVerifier.create(themeService.listPublicThemes(5, 5).map(Theme::getName).collectList())
                .assertNext(names -> assertThat(names).containsExactly("Public 1", "Public 0"))
                .verifyComplete();
    }

    @Test
    void emptyStore() {
        StepVerifier.create(themeService.browsePublic(0, 5))
                .assertNext(page -> {
                    assertThat(page.getContent()).isEmpty();
                    assertThat(page.getTotalElements()).isZero();
                    assertThat(page.getHasNext()).isFalse();
                })
                .verifyComplete();
    }

    @Test
    void invalidPageIsRejected() {
        StepVerifier.create(themeService.browsePublic(-1, 5))
                .expectError(IllegalArgumentException.class)
                .verify();
        StepVerifier.create(themeService.browsePublic(0, 0))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void privateThemeIsReachableByPublicId() {
        Theme theme = create(ALICE, "Secret", ThemeVisibility.PRIVATE, "h1").block();

        StepVerifier.create(themeService.getThemeByPublicId(theme.getPublicId()))
                .assertNext(found -> assertThat(found.getName()).isEqualTo("Secret"))
                .verifyComplete();
        StepVerifier.create(themeService.getThemeDetails(theme.getPublicId()))
                .assertNext(details -> {
                    assertThat(details.getOwnerDisplayName()).isEqualTo("alice");
                    assertThat(details.getVisibility()).isEqualTo(ThemeVisibility.PRIVATE);
                    assertThat(details.getPreviewUrl()).endsWith("/files/previews/preview.jpg");
                })
                .verifyComplete();
    }

    @Test
    void unknownPublicIdIsNotFound() {
        StepVerifier.create(themeService.getThemeByPublicId("no-such-id"))
                .verifyComplete();
        StepVerifier.create(themeService.getThemeByPublicId(""))
                .verifyComplete();
        StepVerifier.create(themeService.getThemeDetails("no-such-id"))
                .expectError(ThemeNotFoundException.class)
                .verify();
    }

    private Mono<Theme> create(Long ownerId, String name, ThemeVisibility visibility,
                               String hash) {
        return themeService.createTheme(ownerId, name, "description of " + name, visibility,
                "file-" + hash, hash, "preview.jpg");
    }
}
