package com.warden.infrastructure.db;

import com.warden.application.ports.StoreAccessException;
import com.warden.domain.store.SensitiveRow;
import com.warden.domain.store.SensitiveTables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqliteSensitiveRowStoreTest {

    @TempDir
    Path tmp;

    private Database db;
    private SqliteSensitiveRowStore store;

    @BeforeEach
    void setUp() throws Exception {
        db = Database.open(tmp.resolve("data/warden.db").toString());
        store = new SqliteSensitiveRowStore(db);

        try (Connection c = db.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO warnings(guild_id, user_id, moderator_id, reason) VALUES('g1','u1','m1',?)")) {
            for (int i = 1; i <= 7; i++) {
                ps.setString(1, i == 4 ? null : "reason " + i);
                ps.executeUpdate();
            }
        }
    }

    @Test
    void createsParentDirectoryAndSchema() {
        assertThat(tmp.resolve("data/warden.db")).exists();
        assertThat(store.scan(SensitiveTables.AFK_STATUS, null, 10)).isEmpty();
    }

    @Test
    void scansInKeyOrderWithKeysetPaging() {
        List<SensitiveRow> first = store.scan(SensitiveTables.WARNINGS, null, 3);
        assertThat(first).hasSize(3);
        assertThat(first.get(0).value("reason")).isEqualTo("reason 1");

        List<SensitiveRow> second = store.scan(SensitiveTables.WARNINGS, first.get(2).key(), 3);
        assertThat(second).extracting(r -> r.value("reason"))
                .containsExactly(null, "reason 5", "reason 6");

        List<SensitiveRow> last = store.scan(SensitiveTables.WARNINGS, second.get(2).key(), 3);
        assertThat(last).hasSize(1);
        assertThat(store.scan(SensitiveTables.WARNINGS, last.get(0).key(), 3)).isEmpty();
    }

    @Test
    void scansTextKeys() throws Exception {
        try (Connection c = db.getConnection();
             PreparedStatement ps = c.prepareStatement("INSERT INTO afk_status(user_id, message) VALUES(?,?)")) {
            for (String user : List.of("b", "a", "c")) {
                ps.setString(1, user);
                ps.setString(2, "away " + user);
                ps.executeUpdate();
            }
        }

        List<SensitiveRow> page = store.scan(SensitiveTables.AFK_STATUS, "a", 10);
        assertThat(page).extracting(SensitiveRow::key).containsExactly("b", "c");
    }

    @Test
    void updatesOnlyWhenValueIsUnchanged() throws Exception {
        Object key = store.scan(SensitiveTables.WARNINGS, null, 1).get(0).key();

        boolean stale = store.updateIfUnchanged(SensitiveTables.WARNINGS, key,
                Map.of("reason", "something else"), Map.of("reason", "ENCRYPTED"));
        assertThat(stale).isFalse();
        assertThat(reasonOf(key)).isEqualTo("reason 1");

        boolean fresh = store.updateIfUnchanged(SensitiveTables.WARNINGS, key,
                Map.of("reason", "reason 1"), Map.of("reason", "ENCRYPTED"));
        assertThat(fresh).isTrue();
        assertThat(reasonOf(key)).isEqualTo("ENCRYPTED");
    }

    @Test
    void updatesSeveralColumnsAtOnce() throws Exception {
        try (Connection c = db.getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO guild_settings(guild_id, welcome_message, join_dm_title) VALUES('g1','hi','title')")) {
            ps.executeUpdate();
        }

        boolean ok = store.updateIfUnchanged(SensitiveTables.GUILD_SETTINGS, "g1",
                Map.of("welcome_message", "hi", "join_dm_title", "title"),
                Map.of("welcome_message", "E1", "join_dm_title", "E2"));

        assertThat(ok).isTrue();
        SensitiveRow row = store.scan(SensitiveTables.GUILD_SETTINGS, null, 1).get(0);
        assertThat(row.value("welcome_message")).isEqualTo("E1");
        assertThat(row.value("join_dm_title")).isEqualTo("E2");
        assertThat(row.value("join_dm_message")).isNull();
    }

    @Test
    void findsOneRowByKey() {
        Object key = store.scan(SensitiveTables.WARNINGS, null, 2).get(1).key();

        assertThat(store.find(SensitiveTables.WARNINGS, key))
                .hasValueSatisfying(r -> assertThat(r.value("reason")).isEqualTo("reason 2"));
        assertThat(store.find(SensitiveTables.WARNINGS, 999)).isEmpty();
    }

    @Test
    void rowWithNullTextKeyIsAStoreError() throws Exception {
        try (Connection c = db.getConnection();
             PreparedStatement ps = c.prepareStatement("INSERT INTO afk_status(user_id, message) VALUES(NULL,'brb')")) {
            ps.executeUpdate();
        }

        assertThatThrownBy(() -> store.scan(SensitiveTables.AFK_STATUS, null, 10))
                .isInstanceOf(StoreAccessException.class)
                .hasMessageContaining("afk_status")
                .hasMessageContaining("NULL user_id");
    }

    private String reasonOf(Object id) throws Exception {
        try (Connection c = db.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT reason FROM warnings WHERE id=?")) {
            ps.setObject(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getString(1);
            }
        }
    }
}
