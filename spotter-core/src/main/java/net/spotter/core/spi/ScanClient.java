package net.spotter.core.spi;

import net.spotter.core.model.Account;
import net.spotter.core.model.GeoPoint;

/**
 * 원격 서비스 클라이언트 경계.
 * 코어는 분류된 결과(ScanResult 또는 ScanException.Failure)에만 의존한다.
 */
public interface ScanClient {
    /** 인증 실패는 ScanException(TRANSIENT/BANNED/CHALLENGED) 로 */
    ScanSession login(Account account) throws ScanException;

    ScanResult scan(ScanSession session, GeoPoint position) throws ScanException;
}
