package net.spotter.core.model;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

public record VisitTask(
        long taskId,
        Kind kind,
        String spawnId,          // EXPLORATION 이면 null
        GeoPoint position,
        int workerId,
        Instant scheduledAt,     // 이 시각 이전에는 방문하지 않음 (창 시작, 이동 시간 반영)
        Instant deadline,        // 스폰 만료 시각 또는 탐색 포기 시각
        int attempt
) {
    private static final AtomicLong SEQ = new AtomicLong();

    public enum Kind { SPAWN, EXPLORATION }

    /** 마감이 이미 지난 태스크는 만들지 않는다 */
    public static VisitTask create(Kind kind, String spawnId, GeoPoint position, int workerId,
                                   Instant scheduledAt, Instant deadline, Instant now) {
        if (deadline.isBefore(now)) {
            throw new IllegalArgumentException("deadline " + deadline + " is before now " + now);
        }
        Instant start = scheduledAt.isBefore(now) ? now : scheduledAt;
        if (start.isAfter(deadline)) start = deadline;
        return new VisitTask(SEQ.incrementAndGet(), kind, spawnId, position, workerId, start, deadline, 1);
    }

    public VisitTask nextAttempt(Instant at) {
        Instant start = at.isAfter(deadline) ? deadline : at;
        return new VisitTask(taskId, kind, spawnId, position, workerId, start, deadline, attempt + 1);
    }

    public boolean expired(Instant now) {
        return now.isAfter(deadline);
    }
}
