package ru.oparin.fpthemes.service.preview;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import ru.oparin.fpthemes.config.properties.PreviewProperties;
import ru.oparin.fpthemes.exception.PreviewRenderException;
import ru.oparin.fpthemes.model.theme.ThemeConfig;
import ru.oparin.fpthemes.util.ColorParser;
import ru.oparin.fpthemes.util.ImageEffects;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.*;
import java.awt.geom.RoundRectangle2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Рендер превью темы: фон, фоновое изображение с размытием и яркостью,
 * полупрозрачная панель с образцами текста и полосой цветов темы.
 * Одинаковая тема при одинаковых настройках дает одинаковый JPEG.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ThemePreviewRenderer {

    static final Color DEFAULT_BACKGROUND = Color.BLACK;
    static final Color DEFAULT_CONTAINER = new Color(0, 0, 0, 128);
    static final Color DEFAULT_TEXT = Color.WHITE;
    static final Color DEFAULT_LINK = new Color(0x00, 0x99, 0xFF);
    static final double DEFAULT_BORDER_RADIUS = 8;
    static final double DEFAULT_BRIGHTNESS = 100;

    static final String SAMPLE_TEXT = "FunPay Tools";
    static final String SAMPLE_LINK = "Ссылка на лот";

    private final PreviewProperties previewProperties;
    private final BackgroundImageResolver backgroundImageResolver;
    private final PreviewFontResolver previewFontResolver;

    /**
     * Отрендерить превью темы.
     *
     * @param config разобранная тема
     * @return JPEG превью
     * @throws PreviewRenderException при сбое рендера или кодирования
     */
    public Mono<byte[]> render(ThemeConfig config) {
        return backgroundImageResolver.resolve(config.getBgImage())
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .publishOn(Schedulers.boundedElastic())
                .map(background -> composeGuarded(config, background.orElse(null)))
                .onErrorMap(e -> !(e instanceof PreviewRenderException),
                        e -> new PreviewRenderException("Ошибка рендера превью темы", e))
                .doOnSuccess(bytes -> log.debug("Превью отрендерено: {} байт", bytes.length))
                .doOnError(e -> log.error("Ошибка рендера превью", e));
    }

    private byte[] composeGuarded(ThemeConfig config, BufferedImage background) {
        try {
            return compose(config, background);
        } catch (OutOfMemoryError e) {
            throw new PreviewRenderException("Недостаточно памяти для рендера превью", e);
        }
    }

    /**
     * Собрать превью из темы и уже полученного фонового изображения.
     *
     * @param background декодированное фоновое изображение или null
     */
    byte[] compose(ThemeConfig config, BufferedImage background) {
        int width = previewProperties.getWidth();
        int height = previewProperties.getHeight();

        BufferedImage canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);

            drawBackground(g, config, width, height);
            if (background != null) {
                g.drawImage(prepareBackground(config, background, width, height), 0, 0, null);
            }
            drawControlBar(g, config, width, height);
        } finally {
            g.dispose();
        }
        return encodeJpeg(canvas);
    }

    private void drawBackground(Graphics2D g, ThemeConfig config, int width, int height) {
        Color primary = opaque(color(config.getBgColor1(), DEFAULT_BACKGROUND, ThemeConfig.BG_COLOR_1));
        g.setColor(primary);
        g.fillRect(0, 0, width, height);

        if (config.getBgColor2() != null) {
            Color secondary = opaque(color(config.getBgColor2(), primary, ThemeConfig.BG_COLOR_2));
            g.setPaint(new GradientPaint(0, 0, primary, 0, height, secondary));
            g.fillRect(0, 0, width, height);
        }
    }

    private BufferedImage prepareBackground(ThemeConfig config, BufferedImage source, int width, int height) {
        BufferedImage image = ImageEffects.coverAndCrop(source, width, height);

        int blur = (int) Math.round(valueOrDefault(config.getBgBlur(), 0));
        image = ImageEffects.gaussianBlur(image, Math.min(Math.max(blur, 0), previewProperties.getMaxBlurRadius()));

        double brightness = Math.max(0, valueOrDefault(config.getBgBrightness(), DEFAULT_BRIGHTNESS)) / 100.0;
        return ImageEffects.adjustBrightness(image, brightness);
    }

    private void drawControlBar(Graphics2D g, ThemeConfig config, int width, int height) {
        int margin = Math.round(width * 0.05f);
        int barHeight = Math.round(height * 0.24f);
        int barWidth = width - margin * 2;
        int barY = height - margin - barHeight;

        double cornerRadius = Math.max(0, valueOrDefault(config.getBorderRadius(), DEFAULT_BORDER_RADIUS))
                * previewProperties.getCornerRadiusScale();
        double arc = Math.min(cornerRadius * 2, barHeight);

        Color container = color(config.getContainerBgColor(), DEFAULT_CONTAINER, ThemeConfig.CONTAINER_BG_COLOR);
        double opacity = Math.min(1.0, Math.max(0.0, previewProperties.getBarOpacity()));
        int alpha = (int) Math.round(container.getAlpha() * opacity);
        g.setColor(new Color(container.getRed(), container.getGreen(), container.getBlue(), alpha));
        g.fill(new RoundRectangle2D.Double(margin, barY, barWidth, barHeight, arc, arc));

        int padding = Math.round(barHeight * 0.12f);
        Color textColor = color(config.getTextColor(), DEFAULT_TEXT, ThemeConfig.TEXT_COLOR);
        Color linkColor = color(config.getLinkColor(), DEFAULT_LINK, ThemeConfig.LINK_COLOR);

        Font font = previewFontResolver.resolve(config.getFont(), barHeight * 0.2f);
        g.setFont(font);
        FontMetrics metrics = g.getFontMetrics();
        int textX = margin + padding;
        int textBaseline = barY + padding + metrics.getAscent();
        g.setColor(textColor);
        g.drawString(SAMPLE_TEXT, textX, textBaseline);

        int linkX = textX + metrics.stringWidth(SAMPLE_TEXT) + padding;
        g.setColor(linkColor);
        g.drawString(SAMPLE_LINK, linkX, textBaseline);
        int underlineY = textBaseline + Math.max(1, metrics.getDescent() / 2);
        g.drawLine(linkX, underlineY, linkX + metrics.stringWidth(SAMPLE_LINK), underlineY);

        int stripY = textBaseline + metrics.getDescent() + padding / 2;
        int stripHeight = barY + barHeight - padding - stripY;
        drawSwatches(g, swatchColors(config), textX, stripY, barWidth - padding * 2, stripHeight);
    }

    private void drawSwatches(Graphics2D g, List<Color> colors, int x, int y, int totalWidth, int height) {
        if (height <= 0) {
            return;
        }
        int gap = Math.max(2, totalWidth / 100);
        int swatchWidth = (totalWidth - gap * (colors.size() - 1)) / colors.size();
        g.setStroke(new BasicStroke(1f));
        for (int i = 0; i < colors.size(); i++) {
            Color swatch = opaque(colors.get(i));
            int swatchX = x + i * (swatchWidth + gap);
            g.setColor(swatch);
            g.fillRect(swatchX, y, swatchWidth, height);
            g.setColor(ColorParser.contrastingOutline(swatch));
            g.drawRect(swatchX, y, swatchWidth - 1, height - 1);
        }
    }

    private List<Color> swatchColors(ThemeConfig config) {
        Color primary = ColorParser.parseOrDefault(config.getBgColor1(), DEFAULT_BACKGROUND);
        return List.of(
                primary,
                ColorParser.parseOrDefault(config.getBgColor2(), primary),
                ColorParser.parseOrDefault(config.getContainerBgColor(), DEFAULT_CONTAINER),
                ColorParser.parseOrDefault(config.getTextColor(), DEFAULT_TEXT),
                ColorParser.parseOrDefault(config.getLinkColor(), DEFAULT_LINK));
    }

    private Color color(String value, Color fallback, String key) {
        Color parsed = ColorParser.parse(value);
        if (parsed == null) {
            if (value != null) {
                log.warn("Некорректный цвет {}='{}', используется цвет по умолчанию", key, value);
            }
            return fallback;
        }
        return parsed;
    }

    private static Color opaque(Color color) {
        return color.getAlpha() == 255 ? color : new Color(color.getRed(), color.getGreen(), color.getBlue());
    }

    private static double valueOrDefault(Double value, double fallback) {
        return value != null && !value.isNaN() && !value.isInfinite() ? value : fallback;
    }

    private byte[] encodeJpeg(BufferedImage image) {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        ImageWriter writer = ImageIO.getImageWritersByFormatName("jpg").next();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
            writer.setOutput(ios);

            ImageWriteParam param = writer.getDefaultWriteParam();
            if (param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(previewProperties.getJpegQuality());
            }
            writer.write(null, new IIOImage(image, null, null), param);
        } catch (IOException e) {
            throw new PreviewRenderException("Не удалось закодировать превью в JPEG", e);
        } finally {
            writer.dispose();
        }
        return baos.toByteArray();
    }
}
