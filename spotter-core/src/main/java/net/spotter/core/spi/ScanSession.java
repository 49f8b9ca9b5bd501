package net.spotter.core.spi;

/** 로그인된 클라이언트 세션 (내용은 클라이언트 구현이 소유) */
public interface ScanSession {
    String username();

    default boolean valid() { return true; }
}
