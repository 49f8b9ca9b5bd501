package net.spotter.core.model;

/** VisitExecutor 결과. Kind 는 닫힌 집합이며 복구 컨트롤러가 전부 처리한다 */
public record VisitOutcome(Kind kind, int seen, String detail) {

    public enum Kind {
        VISITED, TRANSIENT, CHALLENGED, BANNED, RATE_LIMITED, PROTOCOL_ERROR, CANCELLED,
        /** 전역 스로틀 중이라 호출하지 않음. 클라이언트가 보고한 RATE_LIMITED 와 구분 */
        THROTTLED
    }

    public static VisitOutcome visited(int seen) { return new VisitOutcome(Kind.VISITED, seen, null); }
    public static VisitOutcome cancelled(String why) { return new VisitOutcome(Kind.CANCELLED, 0, why); }
    public static VisitOutcome failure(Kind kind, String detail) {
        if (kind == Kind.VISITED) throw new IllegalArgumentException("VISITED is not a failure");
        return new VisitOutcome(kind, 0, detail);
    }

    public boolean success() { return kind == Kind.VISITED; }
}
