package net.spotter.core.model;

/** 만료 시각 추정 신뢰도. 순서가 곧 강도 */
public enum Confidence {
    NONE, ESTIMATED, CONFIRMED;

    public String code() { return name(); }

    public boolean atLeast(Confidence other) {
        return ordinal() >= other.ordinal();
    }
}
