package ru.oparin.fpthemes.service.telegram;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.fpthemes.config.properties.ThemeProperties;
import ru.oparin.fpthemes.model.dto.PageResponseDTO;
import ru.oparin.fpthemes.model.dto.PublicThemeDTO;
import ru.oparin.fpthemes.model.dto.telegram.TelegramCallbackQuery;
import ru.oparin.fpthemes.model.entity.Theme;
import ru.oparin.fpthemes.model.enums.ThemeVisibility;
import ru.oparin.fpthemes.service.PreviewStorageService;
import ru.oparin.fpthemes.service.ThemeService;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TelegramBotCallbackHandlerTest {

    private static final Long OWNER = 10L;
    private static final Long STRANGER = 20L;
    private static final Long CHAT = 500L;
    private static final Long MESSAGE = 77L;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private TelegramMessageService telegramMessageService;
    @Mock
    private TelegramBotSubmissionHandler submissionHandler;
    @Mock
    private ThemeService themeService;
    @Mock
    private PreviewStorageService previewStorageService;

    private TelegramBotCallbackHandler callbackHandler;

    @BeforeEach
    void setUp() {
        ThemeProperties themeProperties = new ThemeProperties();
        callbackHandler = new TelegramBotCallbackHandler(telegramMessageService,
                new TelegramBotMessageBuilder(themeProperties, objectMapper), submissionHandler, themeService,
                previewStorageService, themeProperties);

        lenient().when(telegramMessageService.answerCallbackQuery(any())).thenReturn(Mono.empty());
        lenient().when(telegramMessageService.answerCallbackQuery(any(), any(), anyBoolean())).thenReturn(Mono.empty());
        lenient().when(telegramMessageService.sendMessageWithKeyboard(any(), any(), any())).thenReturn(Mono.empty());
        lenient().when(telegramMessageService.sendPhoto(any(), any(), any(), any())).thenReturn(Mono.empty());
        lenient().when(telegramMessageService.sendDocument(any(), any())).thenReturn(Mono.empty());
        lenient().when(telegramMessageService.deleteMessage(any(), any())).thenReturn(Mono.empty());
        lenient().when(telegramMessageService.editMessageReplyMarkup(any(), any(), any())).thenReturn(Mono.empty());
    }

    @Test
    void emptyThemeListShowsMessage() {
        when(themeService.listThemesOwnedBy(OWNER)).thenReturn(Flux.empty());

        StepVerifier.create(callbackHandler.handleCallbackQuery(callback(OWNER, "my_themes")))
                .verifyComplete();

        verify(telegramMessageService).deleteMessage(CHAT, MESSAGE);
        verify(telegramMessageService).sendMessageWithKeyboard(eq(CHAT), contains("нет загруженных тем"), anyString());
    }

    @Test
    void strangerCannotOpenManageCard() {
        when(themeService.getThemeById(1L)).thenReturn(Mono.just(theme(ThemeVisibility.PUBLIC)));

        StepVerifier.create(callbackHandler.handleCallbackQuery(callback(STRANGER, "manage_theme_1")))
                .verifyComplete();

        verify(telegramMessageService).answerCallbackQuery(eq("cb"), anyString(), eq(true));
        verify(telegramMessageService, never()).sendPhoto(any(), any(), any(), any());
    }

    @Test
    void ownerTogglesVisibility() {
        when(themeService.setVisibility(1L, OWNER, ThemeVisibility.PRIVATE)).thenReturn(Mono.just(true));
        when(themeService.getThemeById(1L)).thenReturn(Mono.just(theme(ThemeVisibility.PRIVATE)));

        StepVerifier.create(callbackHandler.handleCallbackQuery(callback(OWNER, "privacy_theme_1_0")))
                .verifyComplete();

        verify(telegramMessageService).sendPhoto(eq(CHAT), any(), contains("Приватная"), contains("start=pub1"));
        verify(telegramMessageService).deleteMessage(CHAT, MESSAGE);
    }

    @Test
    void malformedPrivacyCallbackIsIgnored() {
        StepVerifier.create(callbackHandler.handleCallbackQuery(callback(OWNER, "privacy_theme_1_2")))
                .verifyComplete();

        verify(themeService, never()).setVisibility(any(), any(), any());
        verify(telegramMessageService).answerCallbackQuery("cb");
    }

    @Test
    void deleteAsksForConfirmation() {
        StepVerifier.create(callbackHandler.handleCallbackQuery(callback(OWNER, "delete_theme_1")))
                .verifyComplete();

        verify(telegramMessageService).editMessageReplyMarkup(eq(CHAT), eq(MESSAGE), contains("confirm_delete_1"));
        verify(themeService, never()).deleteTheme(any(), any());
    }

    @Test
    void confirmedDeleteRefreshesList() {
        when(themeService.deleteTheme(1L, OWNER)).thenReturn(Mono.just(true));
        when(themeService.listThemesOwnedBy(OWNER)).thenReturn(Flux.empty());

        StepVerifier.create(callbackHandler.handleCallbackQuery(callback(OWNER, "confirm_delete_1")))
                .verifyComplete();

        verify(telegramMessageService).answerCallbackQuery("cb", "Тема удалена.", true);
        verify(themeService).listThemesOwnedBy(OWNER);
    }

    @Test
    void strangerCannotDownloadPrivateTheme() {
        when(themeService.getThemeById(1L)).thenReturn(Mono.just(theme(ThemeVisibility.PRIVATE)));

        StepVerifier.create(callbackHandler.handleCallbackQuery(callback(STRANGER, "download_1")))
                .verifyComplete();

        verify(telegramMessageService, never()).sendDocument(any(), any());
        verify(telegramMessageService).answerCallbackQuery("cb", "Тема не найдена.", true);
    }

    @Test
    void anyoneDownloadsPublicTheme() {
        when(themeService.getThemeById(1L)).thenReturn(Mono.just(theme(ThemeVisibility.PUBLIC)));

        StepVerifier.create(callbackHandler.handleCallbackQuery(callback(STRANGER, "download_1")))
                .verifyComplete();

        verify(telegramMessageService).sendDocument(CHAT, "file-1");
    }

    @Test
    void storePageSendsCardsAndNavigation() {
        List<PublicThemeDTO> content = List.of(
                PublicThemeDTO.builder().id(1L).name("A").previewRef("a.jpg").build(),
                PublicThemeDTO.builder().id(2L).name("B").ownerDisplayName("bob").previewRef("b.jpg").build());
        when(themeService.browsePublic(1, 5)).thenReturn(Mono.just(PageResponseDTO.of(content, 1, 5, 7)));

        StepVerifier.create(callbackHandler.handleCallbackQuery(callback(OWNER, "store_1")))
                .verifyComplete();

        verify(telegramMessageService, times(2)).sendPhoto(eq(CHAT), any(), anyString(), contains("download_"));
        verify(telegramMessageService).sendMessageWithKeyboard(eq(CHAT), eq("Страница 2"), contains("store_0"));
        verify(telegramMessageService).deleteMessage(CHAT, MESSAGE);
    }

    @Test
    void visibilityChoiceGoesToSubmission() {
        when(submissionHandler.handleVisibilityChoice(CHAT, OWNER, MESSAGE, "cb", "public")).thenReturn(Mono.empty());

        StepVerifier.create(callbackHandler.handleCallbackQuery(callback(OWNER, "set_privacy_public")))
                .verifyComplete();

        verify(submissionHandler).handleVisibilityChoice(CHAT, OWNER, MESSAGE, "cb", "public");
    }

    private TelegramCallbackQuery callback(Long userId, String data) {
        try {
            return objectMapper.readValue("""
                    {"id": "cb", "data": "%s", "from": {"id": %d},
                     "message": {"message_id": %d, "chat": {"id": %d}}}
                    """.formatted(data, userId, MESSAGE, CHAT), TelegramCallbackQuery.class);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static Theme theme(ThemeVisibility visibility) {
        return Theme.builder()
                .id(1L)
                .publicId("pub1")
                .ownerId(OWNER)
                .name("Neon")
                .description("desc")
                .visibility(visibility)
                .contentRef("file-1")
                .previewRef("p1.jpg")
                .build();
    }
}
