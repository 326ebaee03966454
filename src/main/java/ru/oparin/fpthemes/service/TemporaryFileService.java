package ru.oparin.fpthemes.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;
import java.util.function.Function;

/**
 * Временные файлы загрузок. Файл существует только на время обработки
 * и удаляется при любом исходе: успех, ошибка валидации, отмена подписки.
 */
@Slf4j
@Service
public class TemporaryFileService {

    static final String TEMP_SUBDIR = "tmp";

    private final Path tempDir;

    public TemporaryFileService(@Value("${file.upload-dir}") String uploadDir) {
        this.tempDir = Paths.get(uploadDir).resolve(TEMP_SUBDIR);
    }

    /**
     * Сохранить байты во временный файл, обработать его и удалить.
     *
     * @param prefix    префикс имени файла (для диагностики)
     * @param content   содержимое файла
     * @param processor обработка файла
     * @return результат обработки
     */
    public <T> Mono<T> withTemporaryFile(String prefix, Mono<byte[]> content, Function<Path, Mono<T>> processor) {
        return Mono.usingWhen(
                content.flatMap(bytes -> Mono.fromCallable(() -> write(prefix, bytes))
                        .subscribeOn(Schedulers.boundedElastic())),
                processor,
                this::delete,
                (path, error) -> delete(path),
                this::delete);
    }

    /**
     * Прочитать временный файл целиком.
     */
    public byte[] read(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Не удалось прочитать временный файл " + path.getFileName(), e);
        }
    }

    public Path getTempDir() {
        return tempDir;
    }

    private Path write(String prefix, byte[] bytes) throws IOException {
        Files.createDirectories(tempDir);
        Path path = tempDir.resolve(prefix + "_" + UUID.randomUUID() + ".part");
        Files.write(path, bytes);
        log.debug("Временный файл создан: {} ({} байт)", path.getFileName(), bytes.length);
        return path;
    }

    private Mono<Void> delete(Path path) {
        return Mono.fromRunnable(() -> {
                    try {
                        if (Files.deleteIfExists(path)) {
                            log.debug("Временный файл удален: {}", path.getFileName());
                        }
                    } catch (IOException e) {
                        log.warn("Не удалось удалить временный файл {}, его удалит планировщик очистки", path, e);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }
}
