package ru.oparin.fpthemes.service;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ContentIdentityServiceTest {

    private final ContentIdentityService contentIdentityService = new ContentIdentityService();

    @Test
    void hashIsLowercaseSha256Hex() {
        String hash = contentIdentityService.computeContentHash("abc".getBytes(StandardCharsets.UTF_8));

        assertThat(hash).isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void hashOfEmptyInput() {
        assertThat(contentIdentityService.computeContentHash(new byte[0]))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    void hashChangesWithSingleByte() {
        String first = contentIdentityService.computeContentHash("{\"font\":\"Arial\"}".getBytes(StandardCharsets.UTF_8));
        String second = contentIdentityService.computeContentHash("{\"font\":\"Arial\" }".getBytes(StandardCharsets.UTF_8));

        assertThat(first).isNotEqualTo(second).hasSize(64);
    }

    @Test
    void publicIdsAreUrlSafeAndUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            String id = contentIdentityService.generatePublicId();
            assertThat(id).hasSize(22).matches("[A-Za-z0-9_-]+");
            ids.add(id);
        }
        assertThat(ids).hasSize(1000);
    }
}
