package ru.oparin.fpthemes.service.telegram;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import ru.oparin.fpthemes.config.properties.ThemeProperties;
import ru.oparin.fpthemes.model.dto.OwnedThemeDTO;
import ru.oparin.fpthemes.model.dto.PublicThemeDTO;
import ru.oparin.fpthemes.model.entity.Theme;
import ru.oparin.fpthemes.model.enums.ThemeVisibility;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Тексты и inline-клавиатуры Telegram бота.
 */
@Component
@RequiredArgsConstructor
public class TelegramBotMessageBuilder {

    private static final String WELCOME_MESSAGE = """
            👋 Добро пожаловать в FP Themes Bot!

            Здесь вы можете загружать, скачивать и делиться темами для расширения FunPay Tools.""";

    private static final String MAIN_MENU_KEYBOARD = """
            {
                "inline_keyboard": [
                    [{"text": "📥 Загрузить тему", "callback_data": "upload_theme"}],
                    [{"text": "🎨 Мои темы", "callback_data": "my_themes"}],
                    [{"text": "🏪 Магазин тем", "callback_data": "store_0"}]
                ]
            }
            """;

    private static final String CANCEL_KEYBOARD = """
            {
                "inline_keyboard": [
                    [{"text": "❌ Отмена", "callback_data": "start"}]
                ]
            }
            """;

    private static final String VISIBILITY_KEYBOARD = """
            {
                "inline_keyboard": [
                    [
                        {"text": "🌍 Публичная", "callback_data": "set_privacy_public"},
                        {"text": "🔒 Приватная", "callback_data": "set_privacy_private"}
                    ],
                    [{"text": "❌ Отмена", "callback_data": "start"}]
                ]
            }
            """;

    private static final String EMPTY_STORE_KEYBOARD = """
            {
                "inline_keyboard": [
                    [{"text": "🔙 Назад", "callback_data": "start"}]
                ]
            }
            """;

    private final ThemeProperties themeProperties;
    private final ObjectMapper objectMapper;

    public String buildWelcomeMessage() {
        return WELCOME_MESSAGE;
    }

    public String buildMainMenuKeyboard() {
        return MAIN_MENU_KEYBOARD;
    }

    public String buildCancelKeyboard() {
        return CANCEL_KEYBOARD;
    }

    public String buildVisibilityKeyboard() {
        return VISIBILITY_KEYBOARD;
    }

    public String buildEmptyStoreKeyboard() {
        return EMPTY_STORE_KEYBOARD;
    }

    public String buildUploadPromptMessage(int remainingSlots) {
        String extension = escape(themeProperties.getFileExtension());
        return String.format("""
                Отлично! Отправьте мне файл темы в формате `%s`.

                ⚠️ *Требования:*
                - Только формат `%s`
                - Размер до %d МБ
                - Тема не должна быть дубликатом уже загруженной

                У вас осталось слотов: %d""",
                extension, extension, themeProperties.getMaxFileSizeMb(), remainingSlots);
    }

    public String buildQuotaExceededMessage(int used, int total) {
        return String.format("❌ У вас закончились слоты для тем (%d/%d). Удалите старые или купите новые.", used, total);
    }

    public String buildNoFreeSlotsMessage() {
        return "❌ Пока вы заполняли данные темы, свободные слоты закончились. Удалите старые темы или купите новые.";
    }

    public String buildInvalidFormatMessage() {
        return "Неверный формат файла. Пожалуйста, отправьте файл с расширением `"
                + escape(themeProperties.getFileExtension()) + "`.";
    }

    public String buildTooLargeMessage() {
        return String.format("Файл слишком большой. Максимальный размер - %d МБ.", themeProperties.getMaxFileSizeMb());
    }

    public String buildDuplicateMessage() {
        return "Такая тема уже была загружена в бота.";
    }

    public String buildInvalidStructureMessage() {
        return "Не удалось прочитать файл темы. Убедитесь, что это корректный JSON файл.";
    }

    public String buildDownloadFailedMessage() {
        return "Не удалось скачать файл. Попробуйте отправить его еще раз.";
    }

    public String buildFileAcceptedMessage() {
        return "Файл принят! Теперь введите название для вашей темы (например, 'Cyberpunk Neon').";
    }

    public String buildInvalidNameMessage() {
        return String.format("Название не может быть пустым и должно быть не длиннее %d символов.",
                themeProperties.getMaxNameLength());
    }

    public String buildNameAcceptedMessage() {
        return "Отличное название! Теперь введите краткое описание темы.";
    }

    public String buildInvalidDescriptionMessage() {
        return String.format("Описание должно быть не длиннее %d символов.", themeProperties.getMaxDescriptionLength());
    }

    public String buildDescriptionAcceptedMessage() {
        return "Описание добавлено. Сделать тему публичной или приватной?";
    }

    public String buildRenderingMessage() {
        return "⏳ Генерирую превью... Это может занять до 30 секунд.";
    }

    public String buildRenderFailedMessage() {
        return "❌ Произошла ошибка при создании превью. Попробуйте загрузить тему еще раз.";
    }

    public String buildStorageConflictMessage() {
        return "❌ Пока вы заполняли описание, такую же тему загрузил другой пользователь.";
    }

    public String buildStorageFailedMessage() {
        return "❌ Произошла серьезная ошибка при сохранении темы. Пожалуйста, сообщите администратору.";
    }

    public String buildUploadCompletedMessage(String name, ThemeVisibility visibility, String publicId) {
        StringBuilder message = new StringBuilder();
        message.append("✅ Тема *").append(escape(name)).append("* успешно загружена!\n\n");
        message.append("Вы можете управлять ей во вкладке 'Мои темы'.");
        if (visibility == ThemeVisibility.PRIVATE) {
            message.append("\n\n🔗 Ваша приватная ссылка: ").append(escape(buildStartLink(publicId)));
        }
        return message.toString();
    }

    public String buildBackToMenuMessage() {
        return "Возвращаю в главное меню...";
    }

    public String buildNoThemesMessage() {
        return "У вас пока нет загруженных тем.";
    }

    public String buildMyThemesMessage() {
        return "Ваши темы:";
    }

    public String buildThemeNotFoundMessage() {
        return "Тема не найдена или у вас нет прав.";
    }

    /**
     * Подпись карточки темы в разделе "Мои темы".
     */
    public String buildManageThemeCaption(Theme theme) {
        String status = theme.isPublic() ? "Публичная" : "Приватная";
        return String.format("🎨 *%s*\n\n📝 _%s_\n\nСтатус: *%s*",
                escape(theme.getName()), escape(theme.getDescription()), status);
    }

    /**
     * Подпись темы, открытой по ссылке.
     */
    public String buildSharedThemeCaption(Theme theme, String ownerDisplayName) {
        return String.format("🎨 *%s*\n\n📝 _%s_\n\n👤 *Автор:* %s",
                escape(theme.getName()), escape(theme.getDescription()),
                escape(formatAuthor(ownerDisplayName, theme.getOwnerId())));
    }

    /**
     * Подпись темы в магазине.
     */
    public String buildStoreCaption(PublicThemeDTO theme) {
        return String.format("🎨 *%s*\n📝 _%s_\n👤 Автор: %s",
                escape(theme.getName()), escape(theme.getDescription()),
                escape(theme.getOwnerDisplayName() != null ? "@" + theme.getOwnerDisplayName() : "аноним"));
    }

    public String buildEmptyStoreMessage() {
        return "В магазине пока нет публичных тем.";
    }

    public String buildStorePageMessage(int page) {
        return "Страница " + (page + 1);
    }

    public String buildPaymentSuccessMessage(int slotsBought, int totalSlots) {
        return String.format("✅ Оплата прошла успешно! Вам добавлено %d слотов. Теперь у вас %d слотов.",
                slotsBought, totalSlots);
    }

    public String buildErrorMessage() {
        return "❌ Произошла ошибка. Попробуйте позже или вернитесь в меню командой /start.";
    }

    /**
     * Ссылка t.me, открывающая тему в боте по публичному идентификатору.
     */
    public String buildStartLink(String publicId) {
        return "https://t.me/" + themeProperties.getBotUsername() + "?start=" + publicId;
    }

    /**
     * Список тем пользователя: по кнопке на тему и кнопка назад.
     */
    public String buildMyThemesKeyboard(List<OwnedThemeDTO> themes) {
        List<List<Map<String, String>>> rows = new ArrayList<>();
        for (OwnedThemeDTO theme : themes) {
            String status = theme.getVisibility() == ThemeVisibility.PUBLIC ? "🌍" : "🔒";
            rows.add(List.of(callbackButton(status + " " + theme.getName(), "manage_theme_" + theme.getId())));
        }
        rows.add(List.of(callbackButton("🔙 Назад", "start")));
        return toKeyboardJson(rows);
    }

    /**
     * Карточка управления темой: видимость, удаление, приватная ссылка.
     */
    public String buildManageThemeKeyboard(Theme theme) {
        List<List<Map<String, String>>> rows = new ArrayList<>();
        if (theme.isPublic()) {
            rows.add(List.of(callbackButton("🔒 Сделать приватной", "privacy_theme_" + theme.getId() + "_0")));
        } else {
            rows.add(List.of(callbackButton("🌍 Сделать публичной", "privacy_theme_" + theme.getId() + "_1")));
        }
        rows.add(List.of(callbackButton("🗑️ Удалить тему", "delete_theme_" + theme.getId())));
        if (!theme.isPublic()) {
            rows.add(List.of(urlButton("🔗 Получить ссылку", buildStartLink(theme.getPublicId()))));
        }
        rows.add(List.of(callbackButton("🔙 К списку тем", "my_themes")));
        return toKeyboardJson(rows);
    }

    public String buildDeleteConfirmationKeyboard(Long themeId) {
        return toKeyboardJson(List.of(
                List.of(callbackButton("⚠️ ДА, УДАЛИТЬ", "confirm_delete_" + themeId)),
                List.of(callbackButton("🚫 Нет, отмена", "manage_theme_" + themeId))));
    }

    public String buildDownloadKeyboard(Long themeId) {
        return toKeyboardJson(List.of(List.of(callbackButton("📥 Скачать", "download_" + themeId))));
    }

    /**
     * Навигация по магазину.
     */
    public String buildStoreNavigationKeyboard(int page, boolean hasPrevious, boolean hasNext) {
        List<List<Map<String, String>>> rows = new ArrayList<>();
        List<Map<String, String>> navigation = new ArrayList<>();
        if (hasPrevious) {
            navigation.add(callbackButton("◀️ Назад", "store_" + (page - 1)));
        }
        if (hasNext) {
            navigation.add(callbackButton("▶️ Вперед", "store_" + (page + 1)));
        }
        if (!navigation.isEmpty()) {
            rows.add(navigation);
        }
        rows.add(List.of(callbackButton("🔙 В главное меню", "start")));
        return toKeyboardJson(rows);
    }

    /**
     * Экранировать пользовательский текст для Markdown разметки Telegram.
     */
    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\\", "\\\\")
                .replace("_", "\\_")
                .replace("*", "\\*")
                .replace("`", "\\`")
                .replace("[", "\\[");
    }

    private String formatAuthor(String displayName, Long ownerId) {
        return displayName != null ? "@" + displayName : "User ID: " + ownerId;
    }

    private Map<String, String> callbackButton(String text, String callbackData) {
        Map<String, String> button = new LinkedHashMap<>();
        button.put("text", text);
        button.put("callback_data", callbackData);
        return button;
    }

    private Map<String, String> urlButton(String text, String url) {
        Map<String, String> button = new LinkedHashMap<>();
        button.put("text", text);
        button.put("url", url);
        return button;
    }

    private String toKeyboardJson(List<List<Map<String, String>>> rows) {
        try {
            return objectMapper.writeValueAsString(Map.of("inline_keyboard", rows));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Не удалось сериализовать клавиатуру", e);
        }
    }
}
