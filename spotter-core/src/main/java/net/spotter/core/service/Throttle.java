package net.spotter.core.service;

import net.spotter.core.spi.Clock;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/** 프로세스 전역 일시정지 (해싱 쿼터 소진 시) */
public final class Throttle {
    private final AtomicReference<Instant> until = new AtomicReference<>(Instant.EPOCH);
    private final Clock clock;

    public Throttle(Clock clock) {
        this.clock = clock;
    }

    /** 더 늦은 시각이 이긴다 */
    public Instant engage(Instant t) {
        return until.accumulateAndGet(t, (a, b) -> a.isAfter(b) ? a : b);
    }

    public boolean isEngaged() {
        return until.get().isAfter(clock.now());
    }

    public Instant until() {
        return until.get();
    }

    public Duration remaining() {
        Duration d = Duration.between(clock.now(), until.get());
        return d.isNegative() ? Duration.ZERO : d;
    }
}
