package com.warden.application.migration;

import com.warden.application.crypto.FakeFieldEncryptor;
import com.warden.application.ports.impl.InMemorySensitiveRowStore;
import com.warden.domain.store.SensitiveTables;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EncryptionCoverageServiceTest {

    @Test
    void countsEncryptedPlaintextAndEmptyPerColumn() {
        FakeFieldEncryptor encryptor = new FakeFieldEncryptor();
        InMemorySensitiveRowStore store = new InMemorySensitiveRowStore();

        store.put(SensitiveTables.MENTION_RESPONSES, 1L, row(encryptor.encrypt("ping"), "pong", null));
        store.put(SensitiveTables.MENTION_RESPONSES, 2L, row("hello", encryptor.encrypt("hi"), ""));
        store.put(SensitiveTables.MENTION_RESPONSES, 3L, row("x", "y", "https://img.example/cat.png"));

        List<ColumnCoverage> coverage = new EncryptionCoverageService(
                encryptor, store, List.of(SensitiveTables.MENTION_RESPONSES), 2).scan();

        assertThat(coverage).containsExactly(
                new ColumnCoverage("mention_responses", "trigger_text", 1, 2, 0),
                new ColumnCoverage("mention_responses", "response", 1, 2, 0),
                new ColumnCoverage("mention_responses", "image_url", 0, 1, 2)
        );
        assertThat(coverage.get(0).fullyEncrypted()).isFalse();
    }

    @Test
    void emptyTablesAreFullyEncrypted() {
        List<ColumnCoverage> coverage = new EncryptionCoverageService(
                new FakeFieldEncryptor(), new InMemorySensitiveRowStore()).scan();

        assertThat(coverage).hasSize(17);
        assertThat(coverage).allMatch(ColumnCoverage::fullyEncrypted);
    }

    @Test
    void rejectsNonPositiveBatchSize() {
        assertThatThrownBy(() -> new EncryptionCoverageService(
                new FakeFieldEncryptor(), new InMemorySensitiveRowStore(), SensitiveTables.all(), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("batchSize");
    }

    private static Map<String, String> row(String trigger, String response, String image) {
        Map<String, String> m = new HashMap<>();
        m.put("trigger_text", trigger);
        m.put("response", response);
        m.put("image_url", image);
        return m;
    }
}
