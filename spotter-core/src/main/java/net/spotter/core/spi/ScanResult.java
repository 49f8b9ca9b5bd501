package net.spotter.core.spi;

import net.spotter.core.model.GeoPoint;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** scan 1회 결과. 와이어 포맷은 클라이언트 구현에 숨긴다 */
public record ScanResult(Instant scannedAt, List<Encounter> encounters) {
    public ScanResult {
        encounters = encounters == null ? List.of() : List.copyOf(encounters);
    }

    public record Encounter(
            GeoPoint spawnPosition,
            Instant expiresAt,              // 타이머 미확인이면 null
            Map<String, String> attributes
    ) {}
}
