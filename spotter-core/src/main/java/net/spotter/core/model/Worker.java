package net.spotter.core.model;

import java.time.Instant;

public record Worker(
        int workerId,
        String account,           // 바인딩된 계정 username, null = 없음
        GeoPoint position,
        double speedLimit,        // m/s
        Status status,
        Instant busyUntil,
        Long taskId,
        int consecutiveTransient,
        int consecutiveProtocol,
        int consecutiveEmpty,
        long visits,
        long seen,
        Instant lastVisitAt,
        Instant startedAt         // 현재 계정으로 일하기 시작한 시각
) {
    public enum Status { IDLE, TRAVELING, VISITING, RECOVERING, RETIRED }

    public static Worker ofNew(int workerId, GeoPoint position, double speedLimit, Instant at) {
        return new Worker(workerId, null, position, speedLimit, Status.RETIRED, null, null,
                0, 0, 0, 0, 0, null, at);
    }

    public boolean busy() {
        return taskId != null;
    }

    public Worker withStatus(Status s, Instant busy, Long task) {
        return new Worker(workerId, account, position, speedLimit, s, busy, task,
                consecutiveTransient, consecutiveProtocol, consecutiveEmpty, visits, seen, lastVisitAt, startedAt);
    }

    public Worker withAccount(String username, Status s, Instant at) {
        return new Worker(workerId, username, position, speedLimit, s, null, null,
                0, 0, 0, visits, seen, lastVisitAt, at);
    }

    public Worker movedTo(GeoPoint p) {
        return new Worker(workerId, account, p, speedLimit, status, busyUntil, taskId,
                consecutiveTransient, consecutiveProtocol, consecutiveEmpty, visits, seen, lastVisitAt, startedAt);
    }

    public Worker withCounters(int transientCnt, int protocolCnt, int emptyCnt, long visitCnt, long seenCnt, Instant lastVisit) {
        return new Worker(workerId, account, position, speedLimit, status, busyUntil, taskId,
                transientCnt, protocolCnt, emptyCnt, visitCnt, seenCnt, lastVisit, startedAt);
    }

    /** 현재 계정 기준 분당 목격 수 */
    public double seenPerMinute(Instant now) {
        if (startedAt == null) return 0;
        double minutes = Math.max(1.0, (now.toEpochMilli() - startedAt.toEpochMilli()) / 60_000.0);
        return seen / minutes;
    }
}
