package ru.oparin.fpthemes.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.oparin.fpthemes.exception.ThemeValidationException;
import ru.oparin.fpthemes.model.enums.SubmissionStatus;
import ru.oparin.fpthemes.model.theme.ThemeConfig;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Проверка структуры файла темы.
 * Строгая только к наличию обязательных ключей. Значения (цвета, числа, URL и даже типы JSON)
 * здесь не проверяются: значение неподходящего типа уходит в extras, а рендер превью
 * подставляет для поля значение по умолчанию.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThemeSchemaValidator {

    /** Ключи, без которых файл не считается темой */
    public static final List<String> REQUIRED_KEYS = List.of(
            ThemeConfig.BG_COLOR_1, ThemeConfig.FONT, ThemeConfig.BG_IMAGE);

    private static final Set<String> STRING_KEYS = Set.of(
            ThemeConfig.BG_COLOR_1, ThemeConfig.BG_COLOR_2, ThemeConfig.CONTAINER_BG_COLOR,
            ThemeConfig.TEXT_COLOR, ThemeConfig.LINK_COLOR, ThemeConfig.FONT, ThemeConfig.BG_IMAGE);

    private static final Set<String> NUMBER_KEYS = Set.of(
            ThemeConfig.BORDER_RADIUS, ThemeConfig.BG_BLUR, ThemeConfig.BG_BRIGHTNESS);

    private final ObjectMapper objectMapper;

    /**
     * Разобрать и проверить файл темы.
     *
     * @param rawBytes содержимое файла
     * @return типизированная конфигурация темы
     * @throws ThemeValidationException если файл не JSON-объект или нет обязательных ключей
     */
    public ThemeConfig validate(byte[] rawBytes) {
        ObjectNode root = parseRoot(rawBytes);

        List<String> missing = REQUIRED_KEYS.stream()
                .filter(key -> !root.has(key))
                .toList();
        if (!missing.isEmpty()) {
            throw new ThemeValidationException(SubmissionStatus.INVALID_STRUCTURE,
                    "В файле темы отсутствуют обязательные ключи: " + missing);
        }

        Map<String, JsonNode> extras = new LinkedHashMap<>();
        ThemeConfig.ThemeConfigBuilder builder = ThemeConfig.builder();

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!applyKnownField(builder, field.getKey(), field.getValue())) {
                extras.put(field.getKey(), field.getValue());
            }
        }

        ThemeConfig config = builder.extras(extras).build();
        log.debug("Файл темы разобран: font={}, дополнительных ключей: {}", config.getFont(), extras.size());
        return config;
    }

    private ObjectNode parseRoot(byte[] rawBytes) {
        if (rawBytes == null || rawBytes.length == 0) {
            throw new ThemeValidationException(SubmissionStatus.INVALID_STRUCTURE, "Файл темы пуст");
        }
        try {
            String json = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(rawBytes))
                    .toString();
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                throw new ThemeValidationException(SubmissionStatus.INVALID_STRUCTURE,
                        "Файл темы должен содержать JSON-объект");
            }
            return (ObjectNode) node;
        } catch (CharacterCodingException e) {
            throw new ThemeValidationException(SubmissionStatus.INVALID_STRUCTURE, "Файл темы не в кодировке UTF-8", e);
        } catch (JsonProcessingException e) {
            throw new ThemeValidationException(SubmissionStatus.INVALID_STRUCTURE,
                    "Файл темы не является корректным JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ThemeValidationException(SubmissionStatus.INVALID_STRUCTURE, "Не удалось прочитать файл темы", e);
        }
    }

    /**
     * Заполнить известное поле конфигурации.
     *
     * @return false, если ключ неизвестен или значение неподходящего типа (тогда оно уходит в extras)
     */
    private boolean applyKnownField(ThemeConfig.ThemeConfigBuilder builder, String key, JsonNode value) {
        if (STRING_KEYS.contains(key)) {
            if (!value.isTextual()) {
                return false;
            }
            String text = value.asText();
            switch (key) {
                case ThemeConfig.BG_COLOR_1 -> builder.bgColor1(text);
                case ThemeConfig.BG_COLOR_2 -> builder.bgColor2(text);
                case ThemeConfig.CONTAINER_BG_COLOR -> builder.containerBgColor(text);
                case ThemeConfig.TEXT_COLOR -> builder.textColor(text);
                case ThemeConfig.LINK_COLOR -> builder.linkColor(text);
                case ThemeConfig.FONT -> builder.font(text);
                case ThemeConfig.BG_IMAGE -> builder.bgImage(text);
                default -> {
                    return false;
                }
            }
            return true;
        }

        if (NUMBER_KEYS.contains(key)) {
            Double number = toNumber(value);
            if (number == null) {
                return false;
            }
            switch (key) {
                case ThemeConfig.BORDER_RADIUS -> builder.borderRadius(number);
                case ThemeConfig.BG_BLUR -> builder.bgBlur(number);
                case ThemeConfig.BG_BRIGHTNESS -> builder.bgBrightness(number);
                default -> {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    private Double toNumber(JsonNode value) {
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                double parsed = Double.parseDouble(value.asText().trim());
                return Double.isFinite(parsed) ? parsed : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
