package ru.oparin.fpthemes.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import ru.oparin.fpthemes.repository.ThemeRepository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FileCleanupServiceTest {

    @TempDir
    Path uploadDir;

    private TemporaryFileService temporaryFileService;
    private PreviewStorageService previewStorageService;
    private ThemeRepository themeRepository;
    private FileCleanupService fileCleanupService;

    @BeforeEach
    void setUp() {
        temporaryFileService = new TemporaryFileService(uploadDir.toString());
        previewStorageService = new PreviewStorageService(uploadDir.toString(), "localhost");
        themeRepository = mock(ThemeRepository.class);
        fileCleanupService = new FileCleanupService(temporaryFileService, previewStorageService, themeRepository);
    }

    @Test
    void removesOnlyStaleTemporaryFiles() throws IOException {
        Path stale = createFile(temporaryFileService.getTempDir(), "theme_1_old.part", Duration.ofHours(3));
        Path fresh = createFile(temporaryFileService.getTempDir(), "theme_2_new.part", Duration.ZERO);

        StepVerifier.create(fileCleanupService.cleanupTemporaryFiles(Duration.ofHours(1)))
                .expectNext(1)
                .verifyComplete();

        assertThat(stale).doesNotExist();
        assertThat(fresh).exists();
    }

    @Test
    void missingDirectoryIsNotAnError() {
        StepVerifier.create(fileCleanupService.cleanupTemporaryFiles(Duration.ofHours(1)))
                .expectNext(0)
                .verifyComplete();
    }

    @Test
    void removesPreviewsWithoutTheme() throws IOException {
        Path orphan = createFile(previewStorageService.getPreviewDir(), "orphan.jpg", Duration.ofDays(2));
        Path used = createFile(previewStorageService.getPreviewDir(), "used.jpg", Duration.ofDays(2));
        Path recent = createFile(previewStorageService.getPreviewDir(), "recent.jpg", Duration.ofMinutes(5));
        when(themeRepository.existsByPreviewRef("orphan.jpg")).thenReturn(Mono.just(false));
        when(themeRepository.existsByPreviewRef("used.jpg")).thenReturn(Mono.just(true));

        StepVerifier.create(fileCleanupService.cleanupOrphanPreviews(Duration.ofHours(24)))
                .expectNext(1)
                .verifyComplete();

        assertThat(orphan).doesNotExist();
        assertThat(used).exists();
        assertThat(recent).exists();
        verify(themeRepository, never()).existsByPreviewRef("recent.jpg");
    }

    @Test
    void storedPreviewCanBeResolvedAndDeleted() {
        String ref = previewStorageService.store(new byte[]{1, 2, 3}).block();

        Path path = previewStorageService.resolve(ref);
        assertThat(path).exists();
        assertThat(previewStorageService.resolve("../../etc/passwd")).isNull();

        StepVerifier.create(previewStorageService.delete(ref)).verifyComplete();
        assertThat(path).doesNotExist();
    }

    private static Path createFile(Path dir, String name, Duration age) throws IOException {
        Files.createDirectories(dir);
        Path file = Files.write(dir.resolve(name), new byte[]{42});
        Files.setLastModifiedTime(file, FileTime.from(Instant.now().minus(age)));
        return file;
    }
}
