package ru.oparin.fpthemes.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Хранилище превью тем на диске. Ссылка на превью (preview_ref) - имя файла в каталоге previews.
 */
@Slf4j
@Service
public class PreviewStorageService {

    static final String PREVIEW_SUBDIR = "previews";
    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9-]+\\.jpg");

    private final Path previewDir;
    private final String serverHost;

    public PreviewStorageService(@Value("${file.upload-dir}") String uploadDir,
                                 @Value("${file.host}") String serverHost) {
        this.previewDir = Paths.get(uploadDir).resolve(PREVIEW_SUBDIR);
        this.serverHost = serverHost;
    }

    /**
     * Сохранить превью и вернуть ссылку на него.
     *
     * @param jpegBytes JPEG превью
     * @return имя сохраненного файла
     */
    public Mono<String> store(byte[] jpegBytes) {
        return Mono.fromCallable(() -> {
                    Files.createDirectories(previewDir);
                    String fileName = UUID.randomUUID() + ".jpg";
                    Files.write(previewDir.resolve(fileName), jpegBytes);
                    log.info("Превью сохранено: {} ({} байт)", fileName, jpegBytes.length);
                    return fileName;
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Удалить превью. Ошибка удаления не прерывает вызывающую цепочку.
     */
    public Mono<Void> delete(String previewRef) {
        if (previewRef == null) {
            return Mono.empty();
        }
        return Mono.fromRunnable(() -> {
                    Path path = resolve(previewRef);
                    if (path == null) {
                        log.warn("Попытка удалить превью с недопустимым именем: {}", previewRef);
                        return;
                    }
                    try {
                        if (Files.deleteIfExists(path)) {
                            log.info("Превью удалено: {}", previewRef);
                        }
                    } catch (IOException e) {
                        log.error("Ошибка при удалении превью {}", previewRef, e);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    /**
     * Путь к файлу превью или null, если имя не похоже на выданное этим хранилищем.
     */
    public Path resolve(String previewRef) {
        if (previewRef == null || !SAFE_NAME.matcher(previewRef).matches()) {
            return null;
        }
        return previewDir.resolve(previewRef);
    }

    /**
     * Абсолютный URL превью для внешних клиентов.
     */
    public String toUrl(String previewRef) {
        if (previewRef == null) {
            return null;
        }
        return "https://" + serverHost + "/files/" + PREVIEW_SUBDIR + "/" + previewRef;
    }

    public Path getPreviewDir() {
        return previewDir;
    }
}
