package net.spotter.core.spi;

import java.time.Instant;

/** 공유 해싱 쿼터 */
public interface HashingQuota {
    int remainingQuota();

    /** 쿼터가 다시 채워지는 시각. 모르면 null */
    default Instant periodResetsAt() { return null; }

    static HashingQuota unlimited() { return () -> Integer.MAX_VALUE; }
}
