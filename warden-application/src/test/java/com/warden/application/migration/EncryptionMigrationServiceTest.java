package com.warden.application.migration;

import com.warden.application.crypto.FakeFieldEncryptor;
import com.warden.application.crypto.NullFieldEncryptor;
import com.warden.application.ports.SensitiveRowPort;
import com.warden.application.ports.StoreAccessException;
import com.warden.application.ports.impl.InMemoryMigrationMetadataStore;
import com.warden.application.ports.impl.InMemorySensitiveRowStore;
import com.warden.domain.store.SensitiveRow;
import com.warden.domain.store.SensitiveTable;
import com.warden.domain.store.SensitiveTables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EncryptionMigrationServiceTest {

    private static final SensitiveTable NOTES = SensitiveTables.USER_NOTES;
    private static final SensitiveTable GUILDS = SensitiveTables.GUILD_SETTINGS;
    private static final SensitiveTable TAGS = SensitiveTables.TAGS;

    private FakeFieldEncryptor encryptor;
    private InMemorySensitiveRowStore store;
    private InMemoryMigrationMetadataStore metadata;

    @BeforeEach
    void setUp() {
        encryptor = new FakeFieldEncryptor();
        store = new InMemorySensitiveRowStore();
        metadata = new InMemoryMigrationMetadataStore();
    }

    @Test
    void refusesToRunWithoutEncryption() {
        EncryptionMigrationService service =
                new EncryptionMigrationService(NullFieldEncryptor.INSTANCE, store, metadata);

        assertThatThrownBy(service::migrateToEncrypted)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not enabled");
        assertThat(metadata.isMigrated()).isFalse();
    }

    @Test
    void encryptsPlaintextAndSetsMarker() {
        store.put(NOTES, 1L, Map.of("note", "spams invites"));
        store.put(NOTES, 2L, Map.of("note", "alt account"));
        store.put(GUILDS, "g1", guild("welcome!", null, ""));

        MigrationReport report = service().migrateToEncrypted();

        assertThat(report.alreadyMigrated()).isFalse();
        assertThat(report.valuesEncrypted()).isEqualTo(3);
        assertThat(metadata.isMigrated()).isTrue();

        String note = store.get(NOTES, 1L, "note");
        assertThat(encryptor.isEncrypted(note)).isTrue();
        assertThat(encryptor.decrypt(note)).isEqualTo("spams invites");

        assertThat(encryptor.decrypt(store.get(GUILDS, "g1", "welcome_message"))).isEqualTo("welcome!");
        assertThat(store.get(GUILDS, "g1", "join_dm_title")).isNull();
        assertThat(store.get(GUILDS, "g1", "join_dm_message")).isEmpty();
    }

    @Test
    void secondRunIsNoOp() {
        store.put(NOTES, 1L, Map.of("note", "spams invites"));
        EncryptionMigrationService service = service();

        service.migrateToEncrypted();
        String afterFirst = store.get(NOTES, 1L, "note");
        int calls = encryptor.encryptCalls();

        MigrationReport second = service.migrateToEncrypted();

        assertThat(second.alreadyMigrated()).isTrue();
        assertThat(second.tables()).isEmpty();
        assertThat(store.get(NOTES, 1L, "note")).isEqualTo(afterFirst);
        assertThat(encryptor.encryptCalls()).isEqualTo(calls);
    }

    @Test
    void onlyTouchesValuesThatAreNotCiphertextYet() {
        String already = encryptor.encrypt("old note");
        store.put(NOTES, 1L, Map.of("note", already));
        store.put(NOTES, 2L, Map.of("note", "fresh note"));
        store.put(GUILDS, "g1", guild(encryptor.encrypt("hi"), "title", null));

        MigrationReport report = service().migrateToEncrypted();

        assertThat(store.get(NOTES, 1L, "note")).isEqualTo(already);
        assertThat(encryptor.decrypt(store.get(NOTES, 2L, "note"))).isEqualTo("fresh note");
        assertThat(result(report, "user_notes").rowsUpdated()).isEqualTo(1);
        assertThat(result(report, "guild_settings").valuesEncrypted()).isEqualTo(1);
        assertThat(encryptor.decrypt(store.get(GUILDS, "g1", "join_dm_title"))).isEqualTo("title");
    }

    @Test
    void pagesThroughTablesLargerThanOneBatch() {
        for (long id = 1; id <= 7; id++) {
            store.put(TAGS, id, Map.of("content", "tag body " + id));
        }

        MigrationReport report = new EncryptionMigrationService(encryptor, store, metadata, List.of(TAGS), 3)
                .migrateToEncrypted();

        assertThat(result(report, "tags").rowsScanned()).isEqualTo(7);
        assertThat(result(report, "tags").rowsUpdated()).isEqualTo(7);
        for (long id = 1; id <= 7; id++) {
            assertThat(encryptor.decrypt(store.get(TAGS, id, "content"))).isEqualTo("tag body " + id);
        }
    }

    @Test
    void failingTableAbortsRunAndLeavesMarkerUnset() {
        store.put(NOTES, 1L, Map.of("note", "first table"));
        store.put(TAGS, 1L, Map.of("content", "third table"));
        FailingOnce failing = new FailingOnce(store, GUILDS);

        EncryptionMigrationService service =
                new EncryptionMigrationService(encryptor, failing, metadata, List.of(NOTES, GUILDS, TAGS), 10);

        assertThatThrownBy(service::migrateToEncrypted)
                .isInstanceOf(MigrationException.class)
                .hasMessageContaining("guild_settings")
                .hasCauseInstanceOf(StoreAccessException.class)
                .satisfies(e -> assertThat(((MigrationException) e).table()).isEqualTo("guild_settings"));

        assertThat(metadata.isMigrated()).isFalse();
        assertThat(encryptor.isEncrypted(store.get(NOTES, 1L, "note"))).isTrue();
        assertThat(store.get(TAGS, 1L, "content")).isEqualTo("third table");

        // retry resumes: first table is rescanned harmlessly, the rest gets done
        MigrationReport retry = service.migrateToEncrypted();

        assertThat(metadata.isMigrated()).isTrue();
        assertThat(result(retry, "user_notes").rowsUpdated()).isZero();
        assertThat(encryptor.decrypt(store.get(NOTES, 1L, "note"))).isEqualTo("first table");
        assertThat(encryptor.decrypt(store.get(TAGS, 1L, "content"))).isEqualTo("third table");
    }

    @Test
    void rowRewrittenDuringMigrationIsNotOverwritten() {
        store.put(NOTES, 1L, Map.of("note", "legacy"));
        String liveWrite = encryptor.encrypt("written by a command meanwhile");
        SensitiveRowPort racing = new RacingWriter(store, NOTES, 1L, "note", liveWrite);

        MigrationReport report = new EncryptionMigrationService(encryptor, racing, metadata, List.of(NOTES), 10)
                .migrateToEncrypted();

        assertThat(result(report, "user_notes").rowsChangedConcurrently()).isEqualTo(1);
        assertThat(result(report, "user_notes").rowsUpdated()).isZero();
        assertThat(store.get(NOTES, 1L, "note")).isEqualTo(liveWrite);
        assertThat(metadata.isMigrated()).isTrue();
    }

    @Test
    void concurrentWriteToOneColumnStillEncryptsTheOthers() {
        store.put(GUILDS, "g1", guild("hi", "secret title", null));
        String liveWrite = encryptor.encrypt("hello there");
        SensitiveRowPort racing = new RacingWriter(store, GUILDS, "g1", "welcome_message", liveWrite);

        MigrationReport report = new EncryptionMigrationService(encryptor, racing, metadata, List.of(GUILDS), 10)
                .migrateToEncrypted();

        assertThat(metadata.isMigrated()).isTrue();
        assertThat(store.get(GUILDS, "g1", "welcome_message")).isEqualTo(liveWrite);
        String title = store.get(GUILDS, "g1", "join_dm_title");
        assertThat(encryptor.isEncrypted(title)).isTrue();
        assertThat(encryptor.decrypt(title)).isEqualTo("secret title");
        assertThat(result(report, "guild_settings").rowsChangedConcurrently()).isEqualTo(1);
        assertThat(result(report, "guild_settings").valuesEncrypted()).isEqualTo(1);
    }

    @Test
    void rowThatNeverSettlesFailsTheTable() {
        store.put(NOTES, 1L, Map.of("note", "legacy"));
        SensitiveRowPort neverSettles = new NeverSettles(store);

        assertThatThrownBy(() -> new EncryptionMigrationService(encryptor, neverSettles, metadata, List.of(NOTES), 10)
                .migrateToEncrypted())
                .isInstanceOf(MigrationException.class)
                .hasMessageContaining("kept changing")
                .satisfies(e -> assertThat(((MigrationException) e).table()).isEqualTo("user_notes"));

        assertThat(metadata.isMigrated()).isFalse();
        assertThat(store.get(NOTES, 1L, "note")).isEqualTo("edit " + EncryptionMigrationService.MAX_ROW_ATTEMPTS);
    }

    @Test
    void unexpectedAdapterErrorIsReportedWithTable() {
        SensitiveRowPort broken = new FailingOnce(store, TAGS) {
            @Override
            public List<SensitiveRow> scan(SensitiveTable table, Object afterKey, int limit) {
                throw new IllegalStateException("driver bug");
            }
        };

        assertThatThrownBy(() -> new EncryptionMigrationService(encryptor, broken, metadata, List.of(TAGS), 10)
                .migrateToEncrypted())
                .isInstanceOf(MigrationException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .satisfies(e -> assertThat(((MigrationException) e).table()).isEqualTo("tags"));
        assertThat(metadata.isMigrated()).isFalse();
    }

    private EncryptionMigrationService service() {
        return new EncryptionMigrationService(encryptor, store, metadata);
    }

    private static TableMigrationResult result(MigrationReport report, String table) {
        return report.tables().stream()
                .filter(r -> r.table().equals(table))
                .findFirst()
                .orElseThrow();
    }

    private static Map<String, String> guild(String welcome, String title, String message) {
        Map<String, String> m = new HashMap<>();
        m.put("welcome_message", welcome);
        m.put("join_dm_title", title);
        m.put("join_dm_message", message);
        return m;
    }

    /** Fails the first scan of one table, then behaves. */
    private static class FailingOnce implements SensitiveRowPort {
        private final SensitiveRowPort delegate;
        private final SensitiveTable broken;
        private boolean failed;

        FailingOnce(SensitiveRowPort delegate, SensitiveTable broken) {
            this.delegate = delegate;
            this.broken = broken;
        }

        @Override
        public List<SensitiveRow> scan(SensitiveTable table, Object afterKey, int limit) {
            if (table.equals(broken) && !failed) {
                failed = true;
                throw new StoreAccessException("scan of " + table.name() + " failed", new SQLException("disk I/O error"));
            }
            return delegate.scan(table, afterKey, limit);
        }

        @Override
        public Optional<SensitiveRow> find(SensitiveTable table, Object key) {
            return delegate.find(table, key);
        }

        @Override
        public boolean updateIfUnchanged(SensitiveTable table, Object key,
                                         Map<String, String> expected, Map<String, String> replacement) {
            return delegate.updateIfUnchanged(table, key, expected, replacement);
        }
    }

    /** Simulates an application write to one column landing between the migration's read and its update. */
    private static final class RacingWriter implements SensitiveRowPort {
        private final InMemorySensitiveRowStore delegate;
        private final SensitiveTable table;
        private final Object key;
        private final String column;
        private final String value;

        RacingWriter(InMemorySensitiveRowStore delegate, SensitiveTable table, Object key, String column, String value) {
            this.delegate = delegate;
            this.table = table;
            this.key = key;
            this.column = column;
            this.value = value;
        }

        @Override
        public List<SensitiveRow> scan(SensitiveTable t, Object afterKey, int limit) {
            List<SensitiveRow> page = delegate.scan(t, afterKey, limit);
            if (t.equals(table)) {
                Map<String, String> row = new HashMap<>(delegate.find(table, key).orElseThrow().values());
                row.put(column, value);
                delegate.put(table, key, row);
            }
            return page;
        }

        @Override
        public Optional<SensitiveRow> find(SensitiveTable t, Object k) {
            return delegate.find(t, k);
        }

        @Override
        public boolean updateIfUnchanged(SensitiveTable t, Object k,
                                         Map<String, String> expected, Map<String, String> replacement) {
            return delegate.updateIfUnchanged(t, k, expected, replacement);
        }
    }

    /** Every update loses the race: the stored value is rewritten as plaintext just before it. */
    private static final class NeverSettles implements SensitiveRowPort {
        private final InMemorySensitiveRowStore delegate;
        private int writes;

        NeverSettles(InMemorySensitiveRowStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public List<SensitiveRow> scan(SensitiveTable t, Object afterKey, int limit) {
            return delegate.scan(t, afterKey, limit);
        }

        @Override
        public Optional<SensitiveRow> find(SensitiveTable t, Object k) {
            return delegate.find(t, k);
        }

        @Override
        public boolean updateIfUnchanged(SensitiveTable t, Object k,
                                         Map<String, String> expected, Map<String, String> replacement) {
            delegate.put(t, k, Map.of("note", "edit " + (++writes)));
            return delegate.updateIfUnchanged(t, k, expected, replacement);
        }
    }
}
