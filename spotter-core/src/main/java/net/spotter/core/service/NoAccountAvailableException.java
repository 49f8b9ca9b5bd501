package net.spotter.core.service;

/** 발급 가능한 건강한 계정이 없음. 워커는 RETIRED 로 대기 */
public class NoAccountAvailableException extends Exception {
    public NoAccountAvailableException(String message) {
        super(message);
    }
}
