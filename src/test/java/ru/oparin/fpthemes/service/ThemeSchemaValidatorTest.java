package ru.oparin.fpthemes.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import ru.oparin.fpthemes.exception.ThemeValidationException;
import ru.oparin.fpthemes.model.enums.SubmissionStatus;
import ru.oparin.fpthemes.model.theme.ThemeConfig;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThemeSchemaValidatorTest {

    private final ThemeSchemaValidator validator = new ThemeSchemaValidator(new ObjectMapper());

    @Test
    void acceptsMinimalTheme() {
        ThemeConfig config = validate("{\"bgColor1\":\"#1a1a2e\",\"font\":\"Arial\",\"bgImage\":\"\"}");

        assertThat(config.getBgColor1()).isEqualTo("#1a1a2e");
        assertThat(config.getFont()).isEqualTo("Arial");
        assertThat(config.getBgImage()).isEmpty();
        assertThat(config.hasBackgroundImage()).isFalse();
        assertThat(config.getBgColor2()).isNull();
        assertThat(config.getBorderRadius()).isNull();
        assertThat(config.getExtras()).isEmpty();
    }

    @Test
    void readsOptionalFieldsAndKeepsUnknownKeys() {
        ThemeConfig config = validate("""
                {
                  "bgColor1": "#000",
                  "bgColor2": "#fff",
                  "containerBgColor": "rgba(0,0,0,0.3)",
                  "textColor": "#eee",
                  "linkColor": "#0af",
                  "font": "Roboto",
                  "bgImage": "https://example.com/bg.png",
                  "borderRadius": 12,
                  "bgBlur": "4",
                  "bgBrightness": 80.5,
                  "customCss": ".lot { color: red }",
                  "version": 3
                }
                """);

        assertThat(config.getBgColor2()).isEqualTo("#fff");
        assertThat(config.getContainerBgColor()).isEqualTo("rgba(0,0,0,0.3)");
        assertThat(config.getBorderRadius()).isEqualTo(12.0);
        assertThat(config.getBgBlur()).isEqualTo(4.0);
        assertThat(config.getBgBrightness()).isEqualTo(80.5);
        assertThat(config.hasBackgroundImage()).isTrue();
        assertThat(config.getExtras()).containsOnlyKeys("customCss", "version");
        assertThat(config.getExtras().get("version").asInt()).isEqualTo(3);
    }

    @Test
    void wrongTypeOfOptionalKeyIsTreatedAsAbsent() {
        ThemeConfig config = validate("{\"bgColor1\":\"#000\",\"font\":\"Arial\",\"bgImage\":\"\","
                + "\"bgBlur\":\"strong\",\"textColor\":42}");

        assertThat(config.getBgBlur()).isNull();
        assertThat(config.getTextColor()).isNull();
        assertThat(config.getExtras()).containsKeys("bgBlur", "textColor");
    }

    @Test
    void rejectsMissingRequiredKey() {
        assertInvalid("{\"bgColor1\":\"#000\",\"bgImage\":\"\"}");
        assertInvalid("{\"font\":\"Arial\",\"bgImage\":\"\"}");
        assertInvalid("{\"bgColor1\":\"#000\",\"font\":\"Arial\"}");
    }

    @Test
    void acceptsPresentRequiredKeyOfAnyType() {
        ThemeConfig numericColor = validate("{\"bgColor1\":123,\"font\":\"Arial\",\"bgImage\":\"\"}");
        assertThat(numericColor.getBgColor1()).isNull();
        assertThat(numericColor.getExtras()).containsKey("bgColor1");

        ThemeConfig nullImage = validate("{\"bgColor1\":\"#000\",\"font\":\"Arial\",\"bgImage\":null}");
        assertThat(nullImage.getBgImage()).isNull();
        assertThat(nullImage.getExtras()).containsKey("bgImage");

        ThemeConfig arrayFont = validate("{\"bgColor1\":\"#000\",\"font\":[\"Arial\"],\"bgImage\":\"\"}");
        assertThat(arrayFont.getFont()).isNull();
        assertThat(arrayFont.getExtras().get("font").isArray()).isTrue();
    }

    @Test
    void rejectsNonObjectAndBrokenJson() {
        assertInvalid("[1, 2, 3]");
        assertInvalid("\"text\"");
        assertInvalid("{\"bgColor1\": ");
        assertInvalid("");
    }

    @Test
    void rejectsInvalidUtf8() {
        byte[] bytes = {'{', '"', 'a', '"', ':', '"', (byte) 0xC3, (byte) 0x28, '"', '}'};

        assertThatThrownBy(() -> validator.validate(bytes))
                .isInstanceOf(ThemeValidationException.class)
                .extracting("reason")
                .isEqualTo(SubmissionStatus.INVALID_STRUCTURE);
    }

    private ThemeConfig validate(String json) {
        return validator.validate(json.getBytes(StandardCharsets.UTF_8));
    }

    private void assertInvalid(String json) {
        assertThatThrownBy(() -> validate(json))
                .isInstanceOf(ThemeValidationException.class)
                .extracting("reason")
                .isEqualTo(SubmissionStatus.INVALID_STRUCTURE);
    }
}
