package net.spotter.core.service;

import net.spotter.core.model.Confidence;
import net.spotter.core.model.DueTarget;
import net.spotter.core.model.GeoPoint;
import net.spotter.core.model.Observation;
import net.spotter.core.model.Region;
import net.spotter.core.model.SpawnPoint;
import net.spotter.core.spi.Clock;
import net.spotter.core.spi.SpawnStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * 스폰 지점과 만료 추정치의 메모리 내 원본.
 * - 지점 단위 갱신은 ConcurrentHashMap.compute 로 직렬화
 * - due 목록은 values() 스냅샷 위에서 계산 (개별 upsert 를 막지 않음)
 * - 저장소 쓰기는 best-effort (실패 로그만)
 */
public final class SpawnCatalog {
    private static final Logger log = LoggerFactory.getLogger(SpawnCatalog.class);

    private static final Comparator<DueTarget> EARLIEST_DEADLINE_FIRST =
            Comparator.comparing(DueTarget::deadline).thenComparing(DueTarget::spawnId);

    private final ConcurrentHashMap<String, SpawnPoint> points = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, Instant> cellScans = new ConcurrentHashMap<>();

    private final SpawnStore store;
    private final Clock clock;
    private final Duration period;
    private final Duration defaultDuration;
    private final Duration tolerance;
    private final double alpha;
    private final double cellMeters;
    private final double latStep;
    private final double lonStep;

    public SpawnCatalog(SpawnStore store, Clock clock, EngineSettings settings) {
        this.store = store;
        this.clock = clock;
        this.period = settings.getSpawnPeriod();
        this.defaultDuration = settings.getDefaultDuration();
        this.tolerance = settings.getConsistencyTolerance();
        this.alpha = settings.getSmoothingAlpha();
        this.cellMeters = settings.getExplorationCellMeters();
        double[] steps = settings.getRegion().cellSteps(cellMeters);
        this.latStep = steps[0];
        this.lonStep = steps[1];
    }

    /** 기동 시 저장소에서 적재 */
    public int load() throws Exception {
        List<SpawnPoint> loaded = store.loadSpawnPoints();
        for (SpawnPoint p : loaded) {
            points.merge(p.spawnId(), p, (cur, incoming) -> cur);
        }
        log.info("Spawn catalog loaded: {} points ({})", points.size(), counts());
        return loaded.size();
    }

    /** 사전 시드. 이미 있으면 무시 */
    public boolean seed(SpawnPoint point) {
        SpawnPoint prev = points.putIfAbsent(point.spawnId(), point);
        if (prev == null) {
            persist(point);
            return true;
        }
        return false;
    }

    /**
     * 목격/부재 관측으로 지점의 타이밍을 기록하거나 다듬는다.
     * observedAt 이 마지막 관측보다 늦지 않으면 재적용으로 보고 무시한다(멱등).
     * 모르는 지점에 대한 부재 관측은 버린다.
     */
    public Optional<SpawnPoint> upsert(Observation o) {
        AtomicBoolean changed = new AtomicBoolean(false);
        SpawnPoint result = points.compute(o.spawnId(), (id, cur) -> {
            if (cur == null && !o.present()) return null;
            if (cur != null && cur.lastObservedAt() != null && !o.observedAt().isAfter(cur.lastObservedAt())) {
                return cur;
            }
            SpawnPoint base = cur == null ? SpawnPoint.discovered(o.position(), o.observedAt()) : cur;
            changed.set(true);
            return apply(base, o);
        });
        if (changed.get()) persist(result);
        return Optional.ofNullable(result);
    }

    private SpawnPoint apply(SpawnPoint p, Observation o) {
        Instant now = clock.now();
        if (o.present()) {
            SpawnPoint timed = o.expiresAt() == null ? p : learnTimer(p, o, now);
            return timed.withObservation(o.observedAt(), o.observedAt(), false, now);
        }
        SpawnPoint learned = learnMiss(p, o, now);
        return learned.withObservation(learned.lastSeen(), o.observedAt(), learned.stale(), now);
    }

    private SpawnPoint learnTimer(SpawnPoint p, Observation o, Instant now) {
        Instant exp = o.expiresAt();
        Duration remaining = Duration.between(o.observedAt(), exp);
        if (remaining.isNegative()) remaining = Duration.ZERO;
        if (remaining.compareTo(period) > 0) remaining = period;

        // 남은 시간은 활성 구간 길이의 하한
        Duration est = p.durationEstimate();
        Duration raised = est == null || remaining.compareTo(est) > 0 ? remaining : est;

        if (p.knownExpiration() == null) {
            return p.withTiming(exp, raised, Confidence.ESTIMATED, 1, now);
        }
        if (consistent(p.knownExpiration(), exp)) {
            int n = p.consistentObservations() + 1;
            Confidence c = n >= 2 || p.confidence() == Confidence.CONFIRMED ? Confidence.CONFIRMED : Confidence.ESTIMATED;
            return p.withTiming(exp, raised, c, n, now);
        }
        if (p.confidence() == Confidence.CONFIRMED) {
            log.warn("Conflicting timer for confirmed spawn {}: known={} observed={} (kept)",
                    p.spawnId(), p.knownExpiration(), exp);
            return p;
        }
        log.info("Re-timing spawn {}: {} -> {}", p.spawnId(), p.knownExpiration(), exp);
        return p.withTiming(exp, remaining, Confidence.ESTIMATED, 1, now);
    }

    /** 추정 창 안에서 못 봤다면 창 길이의 상한 → 지수 평활로 줄인다 */
    private SpawnPoint learnMiss(SpawnPoint p, Observation o, Instant now) {
        if (!p.timed()) return p;
        Instant exp = p.nextExpiration(o.observedAt(), period);
        Duration dur = p.durationOr(defaultDuration);
        Instant start = exp.minus(dur);
        if (o.observedAt().isBefore(start) || o.observedAt().isAfter(exp)) return p;

        long upper = Duration.between(o.observedAt(), exp).toMillis();
        long cur = dur.toMillis();
        if (upper >= cur) return p;
        long next = Math.round(cur + alpha * (upper - cur));
        return p.withTiming(p.knownExpiration(), Duration.ofMillis(next), p.confidence(), p.consistentObservations(), now);
    }

    private boolean consistent(Instant a, Instant b) {
        long periodMs = period.toMillis();
        long off = Math.floorMod(a.toEpochMilli() - b.toEpochMilli(), periodMs);
        return Math.min(off, periodMs - off) <= tolerance.toMillis();
    }

    /**
     * [now, now+horizon] 에 활성 창이 걸친 지점들. 만료가 빠른 순(EDF).
     * 지연 평가되며, iterator() 마다 새 스냅샷으로 다시 계산한다.
     */
    public Iterable<DueTarget> dueTargets(Duration horizon) {
        return () -> {
            Instant now = clock.now();
            Instant limit = now.plus(horizon);
            return points.values().stream()
                    .filter(p -> !p.stale() && p.timed())
                    .map(p -> toDue(p, now))
                    .filter(Objects::nonNull)
                    .filter(d -> !d.windowStart().isAfter(limit))
                    .sorted(EARLIEST_DEADLINE_FIRST)
                    .iterator();
        };
    }

    private DueTarget toDue(SpawnPoint p, Instant now) {
        Instant exp = p.nextExpiration(now, period);
        if (exp == null) return null;
        Instant start = exp.minus(p.durationOr(defaultDuration));
        // 이번 창에서 이미 목격됨
        if (p.lastSeen() != null && !p.lastSeen().isBefore(start)) return null;
        return new DueTarget(p, start, exp);
    }

    /**
     * 탐색 후보: 타이머 모르는/오래 잠잠한 지점(오래된 순) → 영역 격자 셀(덜 훑은 순).
     */
    public Iterable<GeoPoint> explorationTargets(Region region) {
        return () -> {
            Stream<GeoPoint> mysteries = points.values().stream()
                    .filter(p -> (p.stale() || !p.timed()) && region.contains(p.position()))
                    .sorted(Comparator.comparing(SpawnPoint::lastObservedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                            .thenComparing(SpawnPoint::spawnId))
                    .map(SpawnPoint::position);
            Stream<GeoPoint> cells = Stream.of(region)
                    .flatMap(r -> r.cells(cellMeters).stream())
                    .sorted(Comparator.comparing(c -> cellScans.getOrDefault(cellOf(c), Instant.EPOCH)));
            return Stream.concat(mysteries, cells).iterator();
        };
    }

    public void recordScan(GeoPoint position, Instant at) {
        cellScans.merge(cellOf(position), at, (a, b) -> a.isAfter(b) ? a : b);
    }

    public Optional<Instant> lastScan(GeoPoint position) {
        return Optional.ofNullable(cellScans.get(cellOf(position)));
    }

    private long cellOf(GeoPoint p) {
        long row = (long) Math.floor(p.lat() / latStep);
        long col = (long) Math.floor(p.lon() / lonStep);
        return (row << 32) ^ (col & 0xffffffffL);
    }

    /** 오랫동안 목격되지 않은 지점에 stale 표시. due 목록에서 빠지고 탐색 후보가 된다 */
    public int markStale(Instant threshold) {
        List<SpawnPoint> marked = new ArrayList<>();
        for (String id : points.keySet()) {
            points.computeIfPresent(id, (k, p) -> {
                if (p.stale()) return p;
                Instant last = p.lastSeen() != null ? p.lastSeen() : p.updatedAt();
                if (last == null || !last.isBefore(threshold)) return p;
                SpawnPoint s = p.markedStale(clock.now());
                marked.add(s);
                return s;
            });
        }
        marked.forEach(this::persist);
        if (!marked.isEmpty()) log.info("Marked {} spawn points stale (not seen since {})", marked.size(), threshold);
        return marked.size();
    }

    private void persist(SpawnPoint p) {
        try {
            store.saveSpawnPoint(p);
        } catch (Exception e) {
            log.warn("Failed to persist spawn point {}: {}", p.spawnId(), e.toString());
        }
    }

    public Optional<SpawnPoint> get(String spawnId) {
        return Optional.ofNullable(points.get(spawnId));
    }

    public List<SpawnPoint> snapshot() {
        List<SpawnPoint> out = new ArrayList<>(points.values());
        out.sort(Comparator.comparing(SpawnPoint::spawnId));
        return out;
    }

    public int size() {
        return points.size();
    }

    public Map<Confidence, Long> counts() {
        Map<Confidence, Long> m = new EnumMap<>(Confidence.class);
        for (SpawnPoint p : points.values()) m.merge(p.confidence(), 1L, Long::sum);
        return m;
    }

    public long staleCount() {
        return points.values().stream().filter(SpawnPoint::stale).count();
    }
}
