package net.spotter.core.service;

import net.spotter.core.model.Account;
import net.spotter.core.model.Confidence;
import net.spotter.core.model.GeoPoint;
import net.spotter.core.model.Region;
import net.spotter.core.model.SpawnPoint;

import java.time.Duration;
import java.time.Instant;

public final class Fixtures {
    public static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    // 적도 근처 약 1.1km x 2.2km
    public static final Region REGION = new Region(0.0, 0.0, 0.01, 0.02);

    private Fixtures() {}

    public static EngineSettings settings(int rows, int cols) {
        EngineSettings s = new EngineSettings();
        s.setRegion(REGION);
        s.setGridRows(rows);
        s.setGridCols(cols);
        s.setSpeedLimit(5.0);
        s.setVisitTimeout(Duration.ofSeconds(2));
        s.setRetryBackoff(Duration.ofMillis(20));
        s.setRetryBackoffMax(Duration.ofMillis(100));
        s.setPointJitterDegrees(0);
        return s.validate();
    }

    public static Account account(String username) {
        return Account.ofNew(username, "secret:" + username, "ptc");
    }

    /** 만료 시각을 아는(CONFIRMED) 스폰 지점 */
    public static SpawnPoint confirmed(GeoPoint p, Instant expiration, Duration duration) {
        return new SpawnPoint(p.key(), p, expiration, duration, null, T0.minus(Duration.ofHours(2)),
                Confidence.CONFIRMED, 2, false, T0.minus(Duration.ofHours(2)));
    }
}
