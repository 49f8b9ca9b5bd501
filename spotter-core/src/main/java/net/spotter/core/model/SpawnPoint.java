package net.spotter.core.model;

import java.time.Duration;
import java.time.Instant;

public record SpawnPoint(
        String spawnId,                 // GeoPoint.key()
        GeoPoint position,
        Instant knownExpiration,        // 마지막으로 관측된 만료 시각, null = 모름
        Duration durationEstimate,      // 학습된 활성 구간 길이, null = 기본값 사용
        Instant lastSeen,               // 마지막 목격(엔티티 존재) 시각
        Instant lastObservedAt,         // 목격/부재 포함 마지막 관측 시각 (재적용 방지)
        Confidence confidence,
        int consistentObservations,
        boolean stale,
        Instant updatedAt
) {
    public static SpawnPoint discovered(GeoPoint position, Instant at) {
        return new SpawnPoint(position.key(), position, null, null, null, null,
                Confidence.NONE, 0, false, at);
    }

    public boolean timed() {
        return knownExpiration != null && confidence.atLeast(Confidence.ESTIMATED);
    }

    /** now 이후(포함) 가장 가까운 만료 시각. 주기마다 반복된다. */
    public Instant nextExpiration(Instant now, Duration period) {
        if (knownExpiration == null) return null;
        long periodMs = period.toMillis();
        long diff = now.toEpochMilli() - knownExpiration.toEpochMilli();
        if (diff <= 0) {
            // 과거 방향으로 되감기: now 이후 가장 가까운 발생
            long back = (-diff) / periodMs;
            return knownExpiration.minusMillis(back * periodMs);
        }
        long periods = (diff + periodMs - 1) / periodMs;
        return knownExpiration.plusMillis(periods * periodMs);
    }

    public Duration durationOr(Duration fallback) {
        return durationEstimate == null ? fallback : durationEstimate;
    }

    public SpawnPoint withTiming(Instant expiration, Duration duration, Confidence c, int consistent, Instant at) {
        return new SpawnPoint(spawnId, position, expiration, duration, lastSeen, lastObservedAt, c, consistent, stale, at);
    }

    public SpawnPoint withObservation(Instant seen, Instant observedAt, boolean staleFlag, Instant at) {
        return new SpawnPoint(spawnId, position, knownExpiration, durationEstimate, seen, observedAt,
                confidence, consistentObservations, staleFlag, at);
    }

    public SpawnPoint markedStale(Instant at) {
        return new SpawnPoint(spawnId, position, knownExpiration, durationEstimate, lastSeen, lastObservedAt,
                confidence, consistentObservations, true, at);
    }
}
