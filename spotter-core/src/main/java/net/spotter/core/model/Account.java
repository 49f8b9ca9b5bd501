package net.spotter.core.model;

import java.time.Instant;

public record Account(
        String username,
        String credentialRef,    // 비밀번호/토큰 참조 (평문 보관 X)
        String provider,
        State state,
        Instant cooldownUntil,
        Instant lastUsed,
        Integer boundWorker,     // null = 미할당
        int challenges,
        GeoPoint lastPosition
) {
    public enum State {
        HEALTHY, COOLDOWN, CAPTCHA_PENDING, BANNED;

        public String code() { return name(); }
    }

    public static Account ofNew(String username, String credentialRef, String provider) {
        return new Account(username, credentialRef, provider, State.HEALTHY, null, null, null, 0, null);
    }

    public boolean bound() {
        return boundWorker != null;
    }

    public Account withState(State s, Instant cooldown) {
        return new Account(username, credentialRef, provider, s, cooldown, lastUsed, boundWorker, challenges, lastPosition);
    }

    public Account boundTo(Integer workerId, Instant at) {
        return new Account(username, credentialRef, provider, state, cooldownUntil, at, workerId, challenges, lastPosition);
    }

    public Account challenged() {
        return new Account(username, credentialRef, provider, State.CAPTCHA_PENDING, null, lastUsed, boundWorker, challenges + 1, lastPosition);
    }

    public Account at(GeoPoint p) {
        return new Account(username, credentialRef, provider, state, cooldownUntil, lastUsed, boundWorker, challenges, p);
    }
}
