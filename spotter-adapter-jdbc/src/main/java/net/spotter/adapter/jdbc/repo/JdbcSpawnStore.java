package net.spotter.adapter.jdbc.repo;

import net.spotter.adapter.jdbc.JdbcUtil;
import net.spotter.adapter.jdbc.TxContext;
import net.spotter.adapter.jdbc.mapper.RowMappers;
import net.spotter.core.model.Sighting;
import net.spotter.core.model.SpawnPoint;
import net.spotter.core.spi.SpawnStore;
import net.spotter.core.spi.TxRunner;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * TB_SPAWN_POINT / TB_SIGHTING.
 * 각 호출은 tx.required 로 감싸므로 바깥 트랜잭션이 있으면 거기에 참여한다.
 */
public final class JdbcSpawnStore implements SpawnStore {
    private final TxRunner tx;

    public JdbcSpawnStore(TxRunner tx) { this.tx = tx; }

    @Override
    public List<SpawnPoint> loadSpawnPoints() throws Exception {
        return tx.required(() -> {
            try (PreparedStatement ps = TxContext.require().prepareStatement("""
                    SELECT *
                    FROM TB_SPAWN_POINT
                    ORDER BY SPAWN_ID
                """);
                 ResultSet rs = ps.executeQuery()) {
                List<SpawnPoint> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toSpawnPoint(rs));
                return out;
            }
        });
    }

    @Override
    public void saveSpawnPoint(SpawnPoint p) throws Exception {
        // SPAWN_ID 기준 MERGE
        var sql = """
            MERGE INTO TB_SPAWN_POINT d
            USING (SELECT CAST(? AS VARCHAR(32)) SPAWN_ID FROM DUAL) s
               ON (d.SPAWN_ID = s.SPAWN_ID)
            WHEN MATCHED THEN UPDATE SET
                 KNOWN_EXPIRATION = ?,
                 DURATION_MS      = ?,
                 LAST_SEEN        = ?,
                 LAST_OBSERVED_AT = ?,
                 CONFIDENCE       = ?,
                 CONSISTENT_CNT   = ?,
                 STALE            = ?,
                 UPDATED_AT       = ?
            WHEN NOT MATCHED THEN INSERT
                 (SPAWN_ID, LAT, LON, KNOWN_EXPIRATION, DURATION_MS, LAST_SEEN, LAST_OBSERVED_AT,
                  CONFIDENCE, CONSISTENT_CNT, STALE, UPDATED_AT)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        tx.required(() -> {
            try (var ps = TxContext.require().prepareStatement(sql)) {
                int i = 1;
                ps.setString(i++, p.spawnId());
                i = bindTiming(ps, i, p);
                ps.setString(i++, p.spawnId());
                ps.setDouble(i++, p.position().lat());
                ps.setDouble(i++, p.position().lon());
                bindTiming(ps, i, p);
                return ps.executeUpdate();
            }
        });
    }

    private static int bindTiming(PreparedStatement ps, int i, SpawnPoint p) throws SQLException {
        ps.setTimestamp(i++, JdbcUtil.ts(p.knownExpiration()));
        Long ms = JdbcUtil.millis(p.durationEstimate());
        if (ms == null) ps.setNull(i++, Types.BIGINT); else ps.setLong(i++, ms);
        ps.setTimestamp(i++, JdbcUtil.ts(p.lastSeen()));
        ps.setTimestamp(i++, JdbcUtil.ts(p.lastObservedAt()));
        ps.setString(i++, p.confidence().code());
        ps.setInt(i++, p.consistentObservations());
        ps.setString(i++, JdbcUtil.yn(p.stale()));
        ps.setTimestamp(i++, JdbcUtil.ts(p.updatedAt()));
        return i;
    }

    /** 같은 (SPAWN_ID, OBSERVED_AT) 은 한 번만 기록 */
    @Override
    public void saveSighting(Sighting s) throws Exception {
        var sql = """
            MERGE INTO TB_SIGHTING d
            USING (SELECT CAST(? AS VARCHAR(32)) SPAWN_ID, CAST(? AS TIMESTAMP) OBSERVED_AT FROM DUAL) k
               ON (d.SPAWN_ID = k.SPAWN_ID AND d.OBSERVED_AT = k.OBSERVED_AT)
            WHEN NOT MATCHED THEN INSERT
                 (SPAWN_ID, LAT, LON, OBSERVED_AT, EXPIRES_AT, ATTRIBUTES, CREATED_AT)
            VALUES (?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
            """;
        tx.required(() -> {
            try (var ps = TxContext.require().prepareStatement(sql)) {
                int i = 1;
                ps.setString(i++, s.spawnId());
                ps.setTimestamp(i++, JdbcUtil.ts(s.observedAt()));
                ps.setString(i++, s.spawnId());
                ps.setDouble(i++, s.position().lat());
                ps.setDouble(i++, s.position().lon());
                ps.setTimestamp(i++, JdbcUtil.ts(s.observedAt()));
                ps.setTimestamp(i++, JdbcUtil.ts(s.expiresAt()));
                ps.setString(i, JdbcUtil.encodeAttributes(s.attributes()));
                return ps.executeUpdate();
            }
        });
    }

    /** 한 지점의 목격 이력 (오래된 순) */
    public List<Sighting> sightingsOf(String spawnId) throws Exception {
        return tx.required(() -> {
            try (var ps = TxContext.require().prepareStatement("""
                    SELECT *
                    FROM TB_SIGHTING
                    WHERE SPAWN_ID = ?
                    ORDER BY OBSERVED_AT, ID
                """)) {
                ps.setString(1, spawnId);
                try (var rs = ps.executeQuery()) {
                    List<Sighting> out = new ArrayList<>();
                    while (rs.next()) out.add(RowMappers.toSighting(rs));
                    return out;
                }
            }
        });
    }

    /** before 이전 목격 이력 삭제. 삭제 건수 반환 */
    public int pruneSightings(Instant before) throws Exception {
        return tx.required(() -> {
            try (var ps = TxContext.require().prepareStatement("DELETE FROM TB_SIGHTING WHERE OBSERVED_AT < ?")) {
                ps.setTimestamp(1, JdbcUtil.ts(before));
                return ps.executeUpdate();
            }
        });
    }
}
