package net.spotter.core.service;

import net.spotter.core.model.Account;
import net.spotter.core.model.GeoPoint;
import net.spotter.core.spi.ScanClient;
import net.spotter.core.spi.ScanException;
import net.spotter.core.spi.ScanResult;
import net.spotter.core.spi.ScanSession;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * 스크립트대로 응답하는 클라이언트.
 * 큐가 비면 빈 결과를 돌려준다.
 */
final class FakeScanClient implements ScanClient {
    interface Step {
        ScanResult run(GeoPoint position) throws ScanException;
    }

    private final ConcurrentLinkedDeque<Step> script = new ConcurrentLinkedDeque<>();
    private final Supplier<Instant> clock;

    final AtomicInteger logins = new AtomicInteger();
    final List<String> scannedBy = new CopyOnWriteArrayList<>();
    final List<GeoPoint> scannedAt = new CopyOnWriteArrayList<>();

    FakeScanClient(Supplier<Instant> clock) {
        this.clock = clock;
    }

    FakeScanClient then(Step step) {
        script.addLast(step);
        return this;
    }

    FakeScanClient thenFail(ScanException.Failure failure) {
        return then(p -> { throw new ScanException(failure, "scripted " + failure); });
    }

    FakeScanClient thenSee(GeoPoint spawn, Instant expiresAt) {
        return then(p -> new ScanResult(clock.get(), List.of(new ScanResult.Encounter(spawn, expiresAt, Map.of("kind", "test")))));
    }

    FakeScanClient thenEmpty() {
        return then(p -> new ScanResult(clock.get(), List.of()));
    }

    @Override
    public ScanSession login(Account account) {
        logins.incrementAndGet();
        String username = account.username();
        return () -> username;
    }

    @Override
    public ScanResult scan(ScanSession session, GeoPoint position) throws ScanException {
        scannedBy.add(session.username());
        scannedAt.add(position);
        Step next = script.pollFirst();
        if (next == null) return new ScanResult(clock.get(), List.of());
        return next.run(position);
    }
}
