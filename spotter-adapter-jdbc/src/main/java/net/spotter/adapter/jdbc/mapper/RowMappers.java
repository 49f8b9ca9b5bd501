package net.spotter.adapter.jdbc.mapper;

import net.spotter.adapter.jdbc.JdbcUtil;
import net.spotter.core.model.Account;
import net.spotter.core.model.Confidence;
import net.spotter.core.model.GeoPoint;
import net.spotter.core.model.Sighting;
import net.spotter.core.model.SpawnPoint;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;

public final class RowMappers {
    private RowMappers() {}

    // --- SpawnPoint ---
    public static SpawnPoint toSpawnPoint(ResultSet rs) throws SQLException {
        long durationMs = rs.getLong("DURATION_MS");
        Duration duration = rs.wasNull() ? null : Duration.ofMillis(durationMs);
        return new SpawnPoint(
                rs.getString("SPAWN_ID"),
                new GeoPoint(rs.getDouble("LAT"), rs.getDouble("LON")),
                JdbcUtil.toInstant(rs.getTimestamp("KNOWN_EXPIRATION")),
                duration,
                JdbcUtil.toInstant(rs.getTimestamp("LAST_SEEN")),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_OBSERVED_AT")),
                JdbcUtil.enumOr(Confidence.class, rs.getString("CONFIDENCE"), Confidence.NONE),
                rs.getInt("CONSISTENT_CNT"),
                "Y".equals(rs.getString("STALE")),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }

    // --- Sighting ---
    public static Sighting toSighting(ResultSet rs) throws SQLException {
        return new Sighting(
                rs.getString("SPAWN_ID"),
                new GeoPoint(rs.getDouble("LAT"), rs.getDouble("LON")),
                rs.getTimestamp("OBSERVED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("EXPIRES_AT")),
                JdbcUtil.decodeAttributes(rs.getString("ATTRIBUTES"))
        );
    }

    // --- Account (자격 증명은 저장하지 않는다)
    public static Account toAccount(ResultSet rs) throws SQLException {
        double lat = rs.getDouble("LAST_LAT");
        GeoPoint last = rs.wasNull() ? null : new GeoPoint(lat, rs.getDouble("LAST_LON"));
        return new Account(
                rs.getString("USERNAME"),
                null,
                rs.getString("PROVIDER"),
                JdbcUtil.enumOr(Account.State.class, rs.getString("STATE"), Account.State.HEALTHY),
                JdbcUtil.toInstant(rs.getTimestamp("COOLDOWN_UNTIL")),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_USED")),
                null,
                rs.getInt("CHALLENGES"),
                last
        );
    }
}
