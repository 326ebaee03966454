package ru.oparin.fpthemes.service;

import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Идентичность содержимого: хэш файла темы для дедупликации и публичный идентификатор для ссылок.
 * Публичный идентификатор не зависит ни от хэша, ни от внутреннего id темы.
 */
@Service
public class ContentIdentityService {

    /** Длина публичного идентификатора в байтах до кодирования (22 символа Base64URL). */
    private static final int PUBLIC_ID_BYTES = 16;

    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * Вычислить SHA-256 исходных байтов файла.
     *
     * @param bytes содержимое файла
     * @return хэш в нижнем регистре, 64 hex-символа
     */
    public String computeContentHash(byte[] bytes) {
        return DigestUtils.sha256Hex(bytes);
    }

    /**
     * Сгенерировать случайный URL-безопасный идентификатор фиксированной длины.
     *
     * @return идентификатор из 22 символов [A-Za-z0-9_-]
     */
    public String generatePublicId() {
        byte[] bytes = new byte[PUBLIC_ID_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
