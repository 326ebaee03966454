package ru.oparin.fpthemes.scheduled;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import ru.oparin.fpthemes.config.properties.CleanupProperties;
import ru.oparin.fpthemes.service.FileCleanupService;

/**
 * Планировщик задач очистки файлов
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CleanupScheduler {

    private final FileCleanupService fileCleanupService;
    private final CleanupProperties cleanupProperties;

    /**
     * Удаление забытых временных файлов загрузок.
     */
    @Scheduled(fixedRateString = "${app.cleanup.temp-interval-ms:3600000}", initialDelay = 60000)
    public void cleanupTemporaryFiles() {
        log.debug("Очистка временных файлов...");
        try {
            fileCleanupService.cleanupTemporaryFiles(cleanupProperties.getTempMaxAge())
                    .doOnError(error -> log.error("Ошибка при очистке временных файлов: {}", error.getMessage()))
                    .subscribe();
        } catch (Exception e) {
            log.error("Ошибка при запуске очистки временных файлов", e);
        }
    }

    /**
     * Удаление превью без темы каждый день в 03:00
     */
    @Scheduled(cron = "0 0 3 * * ?")
    public void cleanupOrphanPreviews() {
        log.info("Очистка превью без темы...");
        try {
            fileCleanupService.cleanupOrphanPreviews(cleanupProperties.getOrphanPreviewMinAge())
                    .doOnError(error -> log.error("Ошибка при очистке превью: {}", error.getMessage()))
                    .subscribe();
        } catch (Exception e) {
            log.error("Ошибка при запуске очистки превью", e);
        }
    }
}
