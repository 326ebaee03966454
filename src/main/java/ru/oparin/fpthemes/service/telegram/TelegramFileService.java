package ru.oparin.fpthemes.service.telegram;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import ru.oparin.fpthemes.config.properties.ThemeProperties;
import ru.oparin.fpthemes.model.dto.telegram.TelegramFile;
import ru.oparin.fpthemes.model.dto.telegram.TelegramFileResponse;

import java.time.Duration;

/**
 * Получение содержимого документов, присланных боту.
 * Сначала getFile возвращает путь к файлу, затем файл скачивается с file-сервера Telegram.
 */
@RequiredArgsConstructor
@Service
@Slf4j
public class TelegramFileService {

    private static final String TELEGRAM_API_URL = "https://api.telegram.org/bot";
    private static final String TELEGRAM_FILE_URL = "https://api.telegram.org/file/bot";
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    /** Запас сверх лимита темы, чтобы слишком большой файл дошел до проверки размера, а не оборвался */
    private static final int DOWNLOAD_SLACK_BYTES = 1024;

    private final WebClient.Builder webClientBuilder;
    private final ThemeProperties themeProperties;

    @Value("${telegram.bot.token}")
    private String botToken;

    /**
     * Скачать документ по file_id.
     *
     * @param fileId file_id документа
     * @return байты файла; ошибка, если Telegram не отдал путь к файлу или файл заметно больше лимита темы
     */
    public Mono<byte[]> downloadFile(String fileId) {
        return resolveFile(fileId)
                .flatMap(file -> fetch(fileId, file.getFilePath()))
                .doOnError(error -> log.error("Ошибка скачивания файла {}: {}", fileId, error.getMessage()));
    }

    private Mono<TelegramFile> resolveFile(String fileId) {
        return webClientBuilder.clone()
                .baseUrl(TELEGRAM_API_URL + botToken)
                .build()
                .get()
                .uri(uriBuilder -> uriBuilder.path("/getFile").queryParam("file_id", fileId).build())
                .retrieve()
                .bodyToMono(TelegramFileResponse.class)
                .timeout(TIMEOUT)
                .flatMap(response -> {
                    TelegramFile file = response.getResult();
                    if (!response.isOk() || file == null || file.getFilePath() == null) {
                        return Mono.error(new IllegalStateException(
                                "Telegram не вернул путь к файлу: " + response.getDescription()));
                    }
                    log.debug("Файл {} доступен по пути {}, размер {}", fileId, file.getFilePath(), file.getFileSize());
                    return Mono.just(file);
                });
    }

    private Mono<byte[]> fetch(String fileId, String filePath) {
        int limit = (int) Math.min(Integer.MAX_VALUE, themeProperties.getMaxFileSizeBytes() + DOWNLOAD_SLACK_BYTES);
        return DataBufferUtils.join(webClientBuilder.clone()
                                .build()
                                .get()
                                .uri(TELEGRAM_FILE_URL + botToken + "/" + filePath)
                                .retrieve()
                                .bodyToFlux(DataBuffer.class),
                        limit)
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .timeout(TIMEOUT)
                .doOnSuccess(bytes -> log.info("Файл {} скачан, размер: {} байт", fileId, bytes != null ? bytes.length : 0));
    }
}
