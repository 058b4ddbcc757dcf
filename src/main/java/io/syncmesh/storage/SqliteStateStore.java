package io.syncmesh.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SqliteStateStore implements StateStore {
    private final Database database;
    private final String namespace;
    private final Clock clock;

    public SqliteStateStore(Database database) {
        this(database, Clock.systemUTC());
    }

    public SqliteStateStore(Database database, Clock clock) {
        this.database = database;
        this.namespace = database.namespace();
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        String sql = "SELECT entry_value FROM kv_entries WHERE namespace=? AND entry_key=? AND (expires_at_ms IS NULL OR expires_at_ms>?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, namespace);
            ps.setString(2, key);
            ps.setLong(3, nowMs());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to read key " + key, e);
        }
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        long now = nowMs();
        exec("""
                INSERT INTO kv_entries(namespace,entry_key,entry_value,expires_at_ms,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?)
                ON CONFLICT(namespace,entry_key) DO UPDATE SET
                    entry_value=excluded.entry_value,
                    expires_at_ms=excluded.expires_at_ms,
                    updated_at_ms=excluded.updated_at_ms
                """, ps -> {
            ps.setString(1, namespace);
            ps.setString(2, key);
            ps.setString(3, value);
            bindExpiry(ps, 4, now, ttl);
            ps.setLong(5, now);
            ps.setLong(6, now);
        }, "put " + key);
    }

    @Override
    public boolean putIfAbsent(String key, String value, Duration ttl) {
        long now = nowMs();
        // An expired row is replaced as if it did not exist.
        int changed = exec("""
                INSERT INTO kv_entries(namespace,entry_key,entry_value,expires_at_ms,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?)
                ON CONFLICT(namespace,entry_key) DO UPDATE SET
                    entry_value=excluded.entry_value,
                    expires_at_ms=excluded.expires_at_ms,
                    created_at_ms=excluded.created_at_ms,
                    updated_at_ms=excluded.updated_at_ms
                WHERE kv_entries.expires_at_ms IS NOT NULL AND kv_entries.expires_at_ms<=?
                """, ps -> {
            ps.setString(1, namespace);
            ps.setString(2, key);
            ps.setString(3, value);
            bindExpiry(ps, 4, now, ttl);
            ps.setLong(5, now);
            ps.setLong(6, now);
            ps.setLong(7, now);
        }, "putIfAbsent " + key);
        return changed > 0;
    }

    @Override
    public boolean compareAndSet(String key, String expectedValue, String newValue, Duration ttl) {
        long now = nowMs();
        int changed = exec("""
                UPDATE kv_entries SET entry_value=?,expires_at_ms=?,updated_at_ms=?
                WHERE namespace=? AND entry_key=? AND entry_value=? AND (expires_at_ms IS NULL OR expires_at_ms>?)
                """, ps -> {
            ps.setString(1, newValue);
            bindExpiry(ps, 2, now, ttl);
            ps.setLong(3, now);
            ps.setString(4, namespace);
            ps.setString(5, key);
            ps.setString(6, expectedValue);
            ps.setLong(7, now);
        }, "compareAndSet " + key);
        return changed > 0;
    }

    @Override
    public boolean delete(String key) {
        int changed = exec("DELETE FROM kv_entries WHERE namespace=? AND entry_key=?", ps -> {
            ps.setString(1, namespace);
            ps.setString(2, key);
        }, "delete " + key);
        return changed > 0;
    }

    @Override
    public List<String> list(String prefix) {
        String safePrefix = prefix == null ? "" : prefix;
        String sql = """
                SELECT entry_key FROM kv_entries
                WHERE namespace=? AND substr(entry_key,1,?)=? AND (expires_at_ms IS NULL OR expires_at_ms>?)
                ORDER BY entry_key ASC
                """;
        List<String> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, namespace);
            ps.setInt(2, safePrefix.length());
            ps.setString(3, safePrefix);
            ps.setLong(4, nowMs());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StateStoreException("Failed to list keys with prefix " + safePrefix, e);
        }
    }

    @Override
    public int purgeExpired() {
        long now = nowMs();
        return exec("DELETE FROM kv_entries WHERE namespace=? AND expires_at_ms IS NOT NULL AND expires_at_ms<=?", ps -> {
            ps.setString(1, namespace);
            ps.setLong(2, now);
        }, "purgeExpired");
    }

    private int exec(String sql, Binder binder, String what) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StateStoreException("State store " + what + " failed", e);
        }
    }

    private void bindExpiry(PreparedStatement ps, int index, long now, Duration ttl) throws SQLException {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, now + ttl.toMillis());
        }
    }

    private long nowMs() {
        return clock.millis();
    }

    private interface Binder { void bind(PreparedStatement ps) throws SQLException; }
}
