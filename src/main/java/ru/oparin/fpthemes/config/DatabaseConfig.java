package ru.oparin.fpthemes.config;

import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.R2dbcTransientException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.r2dbc.config.EnableR2dbcAuditing;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Настройка доступа к БД: шаблон для вставок с заданным id (пользователи) и аудит дат.
 */
@Configuration
@EnableR2dbcAuditing
public class DatabaseConfig {

    private static final int READ_RETRIES = 3;
    private static final Duration FIRST_BACKOFF = Duration.ofSeconds(1);
    private static final Duration MAX_BACKOFF = Duration.ofSeconds(5);

    @Bean
    public R2dbcEntityTemplate r2dbcEntityTemplate(ConnectionFactory connectionFactory) {
        return new R2dbcEntityTemplate(connectionFactory);
    }

    /**
     * Повтор чтения при временной недоступности БД.
     * Ошибки запроса и нарушения ограничений не повторяются: повтор дал бы тот же результат.
     */
    public static <T> Mono<T> withRetry(Mono<T> mono) {
        return mono.retryWhen(Retry.backoff(READ_RETRIES, FIRST_BACKOFF)
                .maxBackoff(MAX_BACKOFF)
                .jitter(0.1)
                .filter(DatabaseConfig::isTransient));
    }

    static boolean isTransient(Throwable error) {
        return error instanceof TransientDataAccessException
                || error instanceof R2dbcTransientException
                || error.getCause() instanceof R2dbcTransientException;
    }
}
