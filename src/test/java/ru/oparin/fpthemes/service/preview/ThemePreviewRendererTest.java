package ru.oparin.fpthemes.service.preview;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;
import ru.oparin.fpthemes.config.properties.PreviewProperties;
import ru.oparin.fpthemes.exception.PreviewRenderException;
import ru.oparin.fpthemes.model.theme.ThemeConfig;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Base64;
import java.util.zip.CRC32;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyFloat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ThemePreviewRendererTest {

    private static final int WIDTH = 320;
    private static final int HEIGHT = 180;

    private PreviewProperties previewProperties;
    private ThemePreviewRenderer renderer;

    @BeforeEach
    void setUp() {
        previewProperties = new PreviewProperties();
        previewProperties.setWidth(WIDTH);
        previewProperties.setHeight(HEIGHT);
        previewProperties.setFontsDir("./no-such-fonts-dir");

        renderer = new ThemePreviewRenderer(previewProperties,
                new BackgroundImageResolver(WebClient.builder(), previewProperties),
                new PreviewFontResolver(Caffeine.newBuilder().build(), previewProperties));
    }

    @Test
    void rendersJpegOfConfiguredSize() throws IOException {
        byte[] jpeg = render(theme("#ff0000", ""));

        BufferedImage image = ImageIO.read(new ByteArrayInputStream(jpeg));
        assertThat(image.getWidth()).isEqualTo(WIDTH);
        assertThat(image.getHeight()).isEqualTo(HEIGHT);

        Color corner = new Color(image.getRGB(2, 2));
        assertThat(corner.getRed()).isGreaterThan(200);
        assertThat(corner.getGreen()).isLessThan(50);
        assertThat(corner.getBlue()).isLessThan(50);
    }

    @Test
    void sameThemeGivesSameBytes() {
        ThemeConfig config = theme("#1a1a2e", "");
        config.setBgColor2("#16213e");
        config.setBorderRadius(12.0);

        assertThat(render(config)).isEqualTo(render(config));
    }

    @Test
    void differentColorsGiveDifferentPreviews() {
        assertThat(render(theme("#1a1a2e", ""))).isNotEqualTo(render(theme("#2e1a1a", "")));
    }

    @Test
    void secondColorDrawsVerticalGradient() throws IOException {
        ThemeConfig config = theme("#ff0000", "");
        config.setBgColor2("#0000ff");

        BufferedImage image = ImageIO.read(new ByteArrayInputStream(render(config)));

        Color top = new Color(image.getRGB(2, 2));
        Color bottom = new Color(image.getRGB(2, HEIGHT - 2));
        assertThat(top.getRed()).isGreaterThan(top.getBlue());
        assertThat(bottom.getBlue()).isGreaterThan(bottom.getRed());
    }

    @Test
    void malformedColorsFallBackToDefaults() {
        ThemeConfig broken = theme("definitely-not-a-color", "");
        broken.setTextColor("rgb(300, 0, 0)");
        broken.setLinkColor("#12345");

        assertThat(render(broken)).isEqualTo(render(theme("#000000", "")));
    }

    @Test
    void unusableBackgroundImageIsIgnored() {
        byte[] plain = render(theme("#334455", ""));

        assertThat(render(theme("#334455", "data:image/png;base64,!!!not-base64!!!"))).isEqualTo(plain);
        assertThat(render(theme("#334455", "ftp://example.com/bg.png"))).isEqualTo(plain);
        assertThat(render(theme("#334455", "data:image/png;base64," + Base64.getEncoder()
                .encodeToString("not an image".getBytes())))).isEqualTo(plain);
    }

    @Test
    void inlineBackgroundImageCoversCanvas() throws IOException {
        String dataUri = "data:image/png;base64," + Base64.getEncoder().encodeToString(solidPng(Color.WHITE));

        BufferedImage image = ImageIO.read(new ByteArrayInputStream(render(theme("#000000", dataUri))));

        Color corner = new Color(image.getRGB(2, 2));
        assertThat(corner.getRed()).isGreaterThan(240);
        assertThat(corner.getGreen()).isGreaterThan(240);
        assertThat(corner.getBlue()).isGreaterThan(240);
    }

    @Test
    void backgroundWithHugeDeclaredSizeIsSkipped() throws IOException {
        byte[] plain = render(theme("#334455", ""));
        String dataUri = "data:image/png;base64," + Base64.getEncoder()
                .encodeToString(withDeclaredSize(solidPng(Color.WHITE), 12000, 12000));

        assertThat(render(theme("#334455", dataUri))).isEqualTo(plain);
    }

    @Test
    void backgroundOverPixelLimitIsSkipped() throws IOException {
        previewProperties.setMaxBackgroundPixels(100L);
        byte[] plain = render(theme("#334455", ""));
        String dataUri = "data:image/png;base64," + Base64.getEncoder().encodeToString(solidPng(Color.WHITE));

        assertThat(render(theme("#334455", dataUri))).isEqualTo(plain);
    }

    @Test
    void brightnessDarkensBackgroundImage() throws IOException {
        String dataUri = "data:image/png;base64," + Base64.getEncoder().encodeToString(solidPng(Color.WHITE));
        ThemeConfig config = theme("#000000", dataUri);
        config.setBgBrightness(50.0);
        config.setBgBlur(3.0);

        BufferedImage image = ImageIO.read(new ByteArrayInputStream(render(config)));

        assertThat(new Color(image.getRGB(2, 2)).getRed()).isBetween(110, 145);
    }

    @Test
    void unexpectedFailureBecomesRenderException() {
        PreviewFontResolver brokenFonts = mock(PreviewFontResolver.class);
        when(brokenFonts.resolve(any(), anyFloat())).thenThrow(new IllegalStateException("fonts unavailable"));
        ThemePreviewRenderer failing = new ThemePreviewRenderer(previewProperties,
                new BackgroundImageResolver(WebClient.builder(), previewProperties), brokenFonts);

        StepVerifier.create(failing.render(theme("#000000", "")))
                .expectError(PreviewRenderException.class)
                .verify();
    }

    private byte[] render(ThemeConfig config) {
        byte[] bytes = renderer.render(config).block();
        assertThat(bytes).isNotEmpty();
        return bytes;
    }

    private static ThemeConfig theme(String bgColor1, String bgImage) {
        return ThemeConfig.builder()
                .bgColor1(bgColor1)
                .font("Arial")
                .bgImage(bgImage)
                .build();
    }

    private static byte[] solidPng(Color color) throws IOException {
        BufferedImage image = new BufferedImage(16, 9, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(color);
        g.fillRect(0, 0, 16, 9);
        g.dispose();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }

    /**
     * Подменить ширину и высоту в заголовке IHDR и пересчитать его CRC.
     */
    private static byte[] withDeclaredSize(byte[] png, int width, int height) {
        byte[] patched = png.clone();
        ByteBuffer buffer = ByteBuffer.wrap(patched);
        buffer.putInt(16, width);
        buffer.putInt(20, height);
        CRC32 crc = new CRC32();
        crc.update(patched, 12, 17);
        buffer.putInt(29, (int) crc.getValue());
        return patched;
    }
}
