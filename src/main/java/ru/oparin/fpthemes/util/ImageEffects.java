package ru.oparin.fpthemes.util;

import lombok.experimental.UtilityClass;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Эффекты фонового изображения превью. Все операции детерминированы и работают с TYPE_INT_RGB.
 */
@UtilityClass
public class ImageEffects {

    /**
     * Масштабировать изображение с сохранением пропорций так, чтобы оно покрыло холст,
     * и обрезать по центру до точного размера холста.
     */
    public static BufferedImage coverAndCrop(BufferedImage source, int width, int height) {
        double scale = Math.max((double) width / source.getWidth(), (double) height / source.getHeight());
        int scaledWidth = Math.max(width, (int) Math.ceil(source.getWidth() * scale));
        int scaledHeight = Math.max(height, (int) Math.ceil(source.getHeight() * scale));
        int offsetX = (scaledWidth - width) / 2;
        int offsetY = (scaledHeight - height) / 2;

        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = result.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g.drawImage(source, -offsetX, -offsetY, scaledWidth, scaledHeight, null);
        g.dispose();
        return result;
    }

    /**
     * Размытие по Гауссу двумя проходами (по горизонтали и вертикали), края продолжаются крайним пикселем.
     *
     * @param radius радиус в пикселях, 0 и меньше - без изменений
     */
    public static BufferedImage gaussianBlur(BufferedImage image, int radius) {
        if (radius <= 0) {
            return image;
        }
        float[] kernel = gaussianKernel(radius);
        int width = image.getWidth();
        int height = image.getHeight();
        int[] source = image.getRGB(0, 0, width, height, null, 0, width);
        int[] buffer = new int[source.length];

        blurPass(source, buffer, width, height, kernel, radius, true);
        blurPass(buffer, source, width, height, kernel, radius, false);

        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        result.setRGB(0, 0, width, height, source, 0, width);
        return result;
    }

    /**
     * Умножить яркость каждого канала на коэффициент с ограничением 0..255.
     *
     * @param factor 1.0 - без изменений
     */
    public static BufferedImage adjustBrightness(BufferedImage image, double factor) {
        if (factor == 1.0) {
            return image;
        }
        int width = image.getWidth();
        int height = image.getHeight();
        int[] pixels = image.getRGB(0, 0, width, height, null, 0, width);
        for (int i = 0; i < pixels.length; i++) {
            int p = pixels[i];
            int r = scaleChannel((p >> 16) & 0xFF, factor);
            int g = scaleChannel((p >> 8) & 0xFF, factor);
            int b = scaleChannel(p & 0xFF, factor);
            pixels[i] = (r << 16) | (g << 8) | b;
        }
        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        result.setRGB(0, 0, width, height, pixels, 0, width);
        return result;
    }

    private static int scaleChannel(int value, double factor) {
        return (int) Math.min(255, Math.max(0, Math.round(value * factor)));
    }

    private static float[] gaussianKernel(int radius) {
        double sigma = radius / 2.0;
        float[] kernel = new float[radius * 2 + 1];
        float sum = 0;
        for (int i = -radius; i <= radius; i++) {
            float value = (float) Math.exp(-(i * i) / (2 * sigma * sigma));
            kernel[i + radius] = value;
            sum += value;
        }
        for (int i = 0; i < kernel.length; i++) {
            kernel[i] /= sum;
        }
        return kernel;
    }

    private static void blurPass(int[] in, int[] out, int width, int height, float[] kernel, int radius,
                                 boolean horizontal) {
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                float r = 0;
                float g = 0;
                float b = 0;
                for (int k = -radius; k <= radius; k++) {
                    int sx = horizontal ? clamp(x + k, width) : x;
                    int sy = horizontal ? y : clamp(y + k, height);
                    int p = in[sy * width + sx];
                    float weight = kernel[k + radius];
                    r += ((p >> 16) & 0xFF) * weight;
                    g += ((p >> 8) & 0xFF) * weight;
                    b += (p & 0xFF) * weight;
                }
                out[y * width + x] = (Math.min(255, Math.round(r)) << 16)
                        | (Math.min(255, Math.round(g)) << 8)
                        | Math.min(255, Math.round(b));
            }
        }
    }

    private static int clamp(int value, int size) {
        return value < 0 ? 0 : Math.min(value, size - 1);
    }
}
