package ru.oparin.fpthemes.service.preview;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import ru.oparin.fpthemes.config.properties.PreviewProperties;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.Iterator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Получение фонового изображения темы: встроенное data:image/...;base64 или загрузка по http(s).
 * Любая ошибка (таймаут, превышение размера, нераспознанный формат) дает пустой результат,
 * и превью рисуется без фонового изображения.
 */
@Slf4j
@Component
public class BackgroundImageResolver {

    private static final Pattern DATA_URI_PATTERN = Pattern.compile("data:image/([^;]+);base64,(.+)", Pattern.DOTALL);

    private final WebClient webClient;
    private final PreviewProperties previewProperties;

    public BackgroundImageResolver(WebClient.Builder webClientBuilder, PreviewProperties previewProperties) {
        this.webClient = webClientBuilder.build();
        this.previewProperties = previewProperties;
    }

    /**
     * Получить и декодировать фоновое изображение.
     *
     * @param reference значение bgImage из темы
     * @return изображение или пустой результат
     */
    public Mono<BufferedImage> resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            return Mono.empty();
        }
        String trimmed = reference.trim();

        Mono<byte[]> bytes;
        if (trimmed.startsWith("data:")) {
            bytes = Mono.fromCallable(() -> decodeDataUri(trimmed));
        } else if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            bytes = download(trimmed);
        } else {
            log.warn("Неподдерживаемая ссылка на фоновое изображение, фон будет без изображения");
            return Mono.empty();
        }

        return bytes
                .publishOn(Schedulers.boundedElastic())
                .flatMap(data -> Mono.justOrEmpty(decode(data)))
                .onErrorResume(e -> {
                    log.warn("Фоновое изображение недоступно, превью будет без него: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<byte[]> download(String url) {
        log.debug("Загрузка фонового изображения: {}", url);
        return DataBufferUtils.join(webClient.get()
                                .uri(url)
                                .accept(MediaType.IMAGE_JPEG, MediaType.IMAGE_PNG, MediaType.parseMediaType("image/*"))
                                .retrieve()
                                .bodyToFlux(DataBuffer.class),
                        previewProperties.getRemoteMaxBytes())
                .map(buffer -> {
                    byte[] data = new byte[buffer.readableByteCount()];
                    buffer.read(data);
                    DataBufferUtils.release(buffer);
                    return data;
                })
                .timeout(previewProperties.getRemoteTimeout());
    }

    private byte[] decodeDataUri(String dataUri) {
        Matcher matcher = DATA_URI_PATTERN.matcher(dataUri);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Некорректный data URI фонового изображения");
        }
        return Base64.getMimeDecoder().decode(matcher.group(2));
    }

    /**
     * Декодировать изображение, если его заявленный размер не превышает лимит по пикселям.
     * Размер берется из заголовка до чтения растра.
     */
    private BufferedImage decode(byte[] data) {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            Iterator<ImageReader> readers = input != null ? ImageIO.getImageReaders(input) : null;
            if (readers == null || !readers.hasNext()) {
                log.warn("Формат фонового изображения не распознан ({} байт)", data.length);
                return null;
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if ((long) width * height > previewProperties.getMaxBackgroundPixels()) {
                    log.warn("Фоновое изображение слишком большое ({}x{}), превью будет без него", width, height);
                    return null;
                }
                return reader.read(0);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            log.warn("Не удалось декодировать фоновое изображение: {}", e.getMessage());
            return null;
        } catch (OutOfMemoryError e) {
            log.warn("Недостаточно памяти для декодирования фонового изображения ({} байт)", data.length);
            return null;
        }
    }
}
