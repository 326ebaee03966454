package ru.oparin.fpthemes.service.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import ru.oparin.fpthemes.config.properties.ThemeProperties;
import ru.oparin.fpthemes.model.dto.OwnedThemeDTO;
import ru.oparin.fpthemes.model.entity.Theme;
import ru.oparin.fpthemes.model.enums.ThemeVisibility;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TelegramBotMessageBuilderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TelegramBotMessageBuilder messageBuilder = new TelegramBotMessageBuilder(new ThemeProperties(), objectMapper);

    @Test
    void startLinkUsesBotUsername() {
        assertThat(messageBuilder.buildStartLink("AbC_-1"))
                .isEqualTo("https://t.me/fp_themes_bot?start=AbC_-1");
    }

    @Test
    void markdownSpecialCharactersAreEscaped() {
        assertThat(TelegramBotMessageBuilder.escape("my_theme *bold* [x] `code`"))
                .isEqualTo("my\\_theme \\*bold\\* \\[x] \\`code\\`");
        assertThat(TelegramBotMessageBuilder.escape(null)).isEmpty();
    }

    @Test
    void staticKeyboardsAreValidJson() throws Exception {
        for (String keyboard : List.of(messageBuilder.buildMainMenuKeyboard(), messageBuilder.buildCancelKeyboard(),
                messageBuilder.buildVisibilityKeyboard(), messageBuilder.buildEmptyStoreKeyboard())) {
            assertThat(objectMapper.readTree(keyboard).get("inline_keyboard").isArray()).isTrue();
        }
    }

    @Test
    void mainMenuHasNoPurchaseButton() throws Exception {
        assertThat(callbackData(messageBuilder.buildMainMenuKeyboard()))
                .containsExactly("upload_theme", "my_themes", "store_0");
    }

    @Test
    void myThemesListShowsStatusAndBackButton() throws Exception {
        String keyboard = messageBuilder.buildMyThemesKeyboard(List.of(
                OwnedThemeDTO.builder().id(5L).name("Neon").visibility(ThemeVisibility.PUBLIC).build(),
                OwnedThemeDTO.builder().id(6L).name("Dark").visibility(ThemeVisibility.PRIVATE).build()));

        JsonNode rows = objectMapper.readTree(keyboard).get("inline_keyboard");
        assertThat(rows.get(0).get(0).get("text").asText()).isEqualTo("🌍 Neon");
        assertThat(rows.get(1).get(0).get("text").asText()).isEqualTo("🔒 Dark");
        assertThat(callbackData(keyboard)).containsExactly("manage_theme_5", "manage_theme_6", "start");
    }

    @Test
    void privateThemeCardOffersLink() throws Exception {
        Theme theme = Theme.builder().id(9L).publicId("pub9").visibility(ThemeVisibility.PRIVATE).build();

        String keyboard = messageBuilder.buildManageThemeKeyboard(theme);

        assertThat(callbackData(keyboard)).containsExactly("privacy_theme_9_1", "delete_theme_9", "my_themes");
        assertThat(keyboard).contains("https://t.me/fp_themes_bot?start=pub9");
    }

    @Test
    void publicThemeCardHasNoLink() throws Exception {
        Theme theme = Theme.builder().id(9L).publicId("pub9").visibility(ThemeVisibility.PUBLIC).build();

        String keyboard = messageBuilder.buildManageThemeKeyboard(theme);

        assertThat(callbackData(keyboard)).containsExactly("privacy_theme_9_0", "delete_theme_9", "my_themes");
        assertThat(keyboard).doesNotContain("t.me");
    }

    @Test
    void storeNavigationFollowsPageFlags() throws Exception {
        assertThat(callbackData(messageBuilder.buildStoreNavigationKeyboard(0, false, true)))
                .containsExactly("store_1", "start");
        assertThat(callbackData(messageBuilder.buildStoreNavigationKeyboard(2, true, true)))
                .containsExactly("store_1", "store_3", "start");
        assertThat(callbackData(messageBuilder.buildStoreNavigationKeyboard(0, false, false)))
                .containsExactly("start");
    }

    @Test
    void sharedCaptionFallsBackToOwnerId() {
        Theme theme = Theme.builder().id(1L).ownerId(777L).name("Neon_City").description("desc").build();

        assertThat(messageBuilder.buildSharedThemeCaption(theme, null)).contains("User ID: 777").contains("Neon\\_City");
        assertThat(messageBuilder.buildSharedThemeCaption(theme, "alice")).contains("@alice");
    }

    private List<String> callbackData(String keyboardJson) throws Exception {
        List<String> result = new ArrayList<>();
        for (JsonNode row : objectMapper.readTree(keyboardJson).get("inline_keyboard")) {
            for (JsonNode button : row) {
                if (button.has("callback_data")) {
                    result.add(button.get("callback_data").asText());
                }
            }
        }
        return result;
    }
}
