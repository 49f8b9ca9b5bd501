package net.spotter.core.spi;

import net.spotter.core.model.Account;

/**
 * 챌린지(캡차) 해결 협력자에게 알림.
 * 해결되면 협력자가 AccountManager.resolve(username) 을 호출한다.
 */
@FunctionalInterface
public interface ChallengeSink {
    void challenged(Account account);

    static ChallengeSink none() { return account -> {}; }
}
