package net.spotter.core.spi;

/** 응답 형태가 기대와 다를 때 클라이언트 구현이 던진다. PROTOCOL_ERROR 로 분류된다 */
public class ProtocolViolationException extends RuntimeException {
    public ProtocolViolationException(String message) {
        super(message);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
