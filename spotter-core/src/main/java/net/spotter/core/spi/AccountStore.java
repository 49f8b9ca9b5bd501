package net.spotter.core.spi;

import net.spotter.core.model.Account;

import java.util.List;

/** 계정 상태(밴/캡차/쿨다운) 영속화. 재기동 후에도 밴 계정이 재발급되지 않도록 */
public interface AccountStore {
    List<Account> loadAccounts() throws Exception;

    void saveAccount(Account account) throws Exception;

    static AccountStore none() {
        return new AccountStore() {
            @Override public List<Account> loadAccounts() { return List.of(); }
            @Override public void saveAccount(Account account) {}
        };
    }
}
