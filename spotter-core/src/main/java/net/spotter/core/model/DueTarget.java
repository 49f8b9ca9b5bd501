package net.spotter.core.model;

import java.time.Instant;

/** 이번 호라이즌 안에 활성 창이 걸친 스폰 */
public record DueTarget(SpawnPoint point, Instant windowStart, Instant deadline) {
    public String spawnId() { return point.spawnId(); }
    public GeoPoint position() { return point.position(); }
}
