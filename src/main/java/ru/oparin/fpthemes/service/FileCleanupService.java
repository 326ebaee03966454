package ru.oparin.fpthemes.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import ru.oparin.fpthemes.repository.ThemeRepository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

/**
 * Сервис для очистки файлов с диска: забытых временных файлов загрузок
 * и файлов превью, на которые не ссылается ни одна тема.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileCleanupService {

    private final TemporaryFileService temporaryFileService;
    private final PreviewStorageService previewStorageService;
    private final ThemeRepository themeRepository;

    /**
     * Удалить временные файлы старше maxAge.
     *
     * @return количество удаленных файлов
     */
    public Mono<Integer> cleanupTemporaryFiles(Duration maxAge) {
        return listOlderThan(temporaryFileService.getTempDir(), maxAge)
                .filter(this::deleteQuietly)
                .count()
                .map(Long::intValue)
                .doOnNext(count -> log.info("Удалено временных файлов: {}", count));
    }

    /**
     * Удалить файлы превью старше minAge, которые не принадлежат ни одной теме.
     *
     * @return количество удаленных файлов
     */
    public Mono<Integer> cleanupOrphanPreviews(Duration minAge) {
        return listOlderThan(previewStorageService.getPreviewDir(), minAge)
                .concatMap(path -> themeRepository.existsByPreviewRef(path.getFileName().toString())
                        .filter(used -> !used)
                        .map(unused -> path))
                .filter(this::deleteQuietly)
                .count()
                .map(Long::intValue)
                .doOnNext(count -> log.info("Удалено превью без темы: {}", count));
    }

    private Flux<Path> listOlderThan(Path dir, Duration age) {
        return Mono.fromCallable(() -> {
                    if (!Files.isDirectory(dir)) {
                        return List.<Path>of();
                    }
                    Instant threshold = Instant.now().minus(age);
                    try (Stream<Path> files = Files.list(dir)) {
                        return files
                                .filter(Files::isRegularFile)
                                .filter(path -> isOlderThan(path, threshold))
                                .toList();
                    }
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(Flux::fromIterable);
    }

    private boolean isOlderThan(Path path, Instant threshold) {
        try {
            return Files.getLastModifiedTime(path).toInstant().isBefore(threshold);
        } catch (IOException e) {
            log.warn("Не удалось получить время изменения файла {}: {}", path, e.getMessage());
            return false;
        }
    }

    private boolean deleteQuietly(Path path) {
        try {
            boolean deleted = Files.deleteIfExists(path);
            if (deleted) {
                log.debug("Удален файл: {}", path.getFileName());
            }
            return deleted;
        } catch (IOException e) {
            log.error("Ошибка при удалении файла {}", path, e);
            return false;
        }
    }
}
