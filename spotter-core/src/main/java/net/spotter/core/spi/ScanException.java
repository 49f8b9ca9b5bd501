package net.spotter.core.spi;

/** 클라이언트 호출 실패. failure 로 이미 분류된 상태로 던진다 */
public class ScanException extends Exception {

    public enum Failure { TRANSIENT, CHALLENGED, BANNED, RATE_LIMITED, PROTOCOL_ERROR }

    private final Failure failure;

    public ScanException(Failure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public ScanException(Failure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }
}
