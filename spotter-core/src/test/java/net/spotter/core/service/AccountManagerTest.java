package net.spotter.core.service;

import net.spotter.core.model.Account;
import net.spotter.core.model.GeoPoint;
import net.spotter.core.spi.AccountStore;
import net.spotter.core.spi.ChallengeSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static net.spotter.core.service.Fixtures.T0;
import static net.spotter.core.service.Fixtures.account;
import static org.junit.jupiter.api.Assertions.*;

class AccountManagerTest {

    MutableClock clock;
    List<Account> challenged;
    AccountManager accounts;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        challenged = new CopyOnWriteArrayList<>();
        accounts = new AccountManager(AccountStore.none(), challenged::add, clock);
    }

    private static Account usedAt(String username, Instant lastUsed) {
        return new Account(username, "secret", "ptc", Account.State.HEALTHY, null, lastUsed, null, 0, null);
    }

    @Test
    void acquire_picksLeastRecentlyUsed_neverUsedFirst() throws Exception {
        accounts.register(usedAt("a", T0.minus(Duration.ofMinutes(10))));
        accounts.register(usedAt("b", null));
        accounts.register(usedAt("c", T0.minus(Duration.ofHours(1))));

        assertEquals("b", accounts.acquire(0).username());
        assertEquals("c", accounts.acquire(1).username());
        assertEquals("a", accounts.acquire(2).username());
    }

    @Test
    void acquire_bindsAccountToOneWorkerOnly() throws Exception {
        accounts.register(account("a"));
        accounts.register(account("b"));

        Account first = accounts.acquire(0);
        Account second = accounts.acquire(1);
        assertNotEquals(first.username(), second.username());
        assertEquals(0, first.boundWorker());
        assertEquals(1, second.boundWorker());

        assertThrows(NoAccountAvailableException.class, () -> accounts.acquire(2));

        accounts.release(first.username(), new GeoPoint(0.001, 0.001));
        Account again = accounts.acquire(2);
        assertEquals(first.username(), again.username());
        assertEquals(new GeoPoint(0.001, 0.001), again.lastPosition());
    }

    @Test
    void concurrentAcquire_neverHandsOutTheSameAccountTwice() throws Exception {
        for (int i = 0; i < 20; i++) accounts.register(account("acc-" + i));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int w = 0; w < 20; w++) {
                int workerId = w;
                futures.add(pool.submit(() -> accounts.acquire(workerId).username()));
            }
            Set<String> seen = ConcurrentHashMap.newKeySet();
            for (Future<String> f : futures) seen.add(f.get(5, TimeUnit.SECONDS));
            assertEquals(20, seen.size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void bannedAccount_neverReappears() throws Exception {
        accounts.register(account("a"));
        accounts.register(account("b"));

        Account a = accounts.acquire(0);
        accounts.markBanned(a.username());
        Account banned = accounts.get(a.username()).orElseThrow();
        assertEquals(Account.State.BANNED, banned.state());
        assertFalse(banned.bound());

        Set<String> issued = new HashSet<>();
        for (int i = 0; i < 5; i++) {
            try {
                Account x = accounts.acquire(10 + i);
                issued.add(x.username());
                accounts.release(x.username(), null);
            } catch (NoAccountAvailableException e) {
                fail("healthy account should be available");
            }
        }
        assertEquals(Set.of("b"), issued);

        // 쿨다운 요청도 밴을 되돌리지 못한다
        assertThrows(IllegalStateException.class, () -> accounts.markCooldown(a.username(), T0.plusSeconds(1)));
        clock.advance(Duration.ofMinutes(1));
        accounts.expireCooldowns();
        assertEquals(Account.State.BANNED, accounts.get(a.username()).orElseThrow().state());
    }

    @Test
    void challenge_staysOutOfPoolUntilResolved() throws Exception {
        accounts.register(account("a"));
        List<String> resolved = new CopyOnWriteArrayList<>();
        accounts.onResolved(acc -> resolved.add(acc.username()));

        Account a = accounts.acquire(0);
        Account pending = accounts.markChallenged(a.username());

        assertEquals(Account.State.CAPTCHA_PENDING, pending.state());
        assertEquals(1, pending.challenges());
        assertEquals(1, challenged.size(), "challenge sink is notified");
        assertEquals(1, accounts.pendingChallenges());

        accounts.release(a.username(), null);
        assertThrows(NoAccountAvailableException.class, () -> accounts.acquire(1));

        Account healthy = accounts.resolve(a.username());
        assertEquals(Account.State.HEALTHY, healthy.state());
        assertEquals(List.of("a"), resolved);
        assertEquals(0, accounts.pendingChallenges());
        assertEquals("a", accounts.acquire(1).username());
    }

    @Test
    void resolve_onHealthyAccount_isIllegal() {
        accounts.register(account("a"));
        assertThrows(IllegalStateException.class, () -> accounts.resolve("a"));
        assertThrows(IllegalArgumentException.class, () -> accounts.resolve("nobody"));
    }

    @Test
    void illegalTransitions_throwAndLeaveStateUntouched() {
        accounts.register(account("banned"));
        accounts.register(account("pending"));
        accounts.register(account("cool"));
        accounts.markBanned("banned");
        accounts.markChallenged("pending");
        accounts.markCooldown("cool", T0.plus(Duration.ofMinutes(5)));
        challenged.clear();

        assertThrows(IllegalStateException.class, () -> accounts.markCooldown("banned", T0.plusSeconds(60)));
        assertThrows(IllegalStateException.class, () -> accounts.markCooldown("pending", T0.plusSeconds(60)));
        assertThrows(IllegalStateException.class, () -> accounts.markChallenged("banned"));
        assertThrows(IllegalStateException.class, () -> accounts.markChallenged("cool"));
        assertThrows(IllegalStateException.class, () -> accounts.markChallenged("pending"));

        assertEquals(Account.State.BANNED, accounts.get("banned").orElseThrow().state());
        assertEquals(Account.State.CAPTCHA_PENDING, accounts.get("pending").orElseThrow().state());
        assertEquals(Account.State.COOLDOWN, accounts.get("cool").orElseThrow().state());
        assertTrue(challenged.isEmpty(), "no challenge notification for a rejected transition");

        // 쿨다운 연장은 허용
        Instant later = T0.plus(Duration.ofMinutes(30));
        assertEquals(later, accounts.markCooldown("cool", later).cooldownUntil());
    }

    @Test
    void cooldown_returnsToPoolAfterExpiry() throws Exception {
        accounts.register(account("a"));
        accounts.markCooldown("a", T0.plus(Duration.ofMinutes(5)));

        assertThrows(NoAccountAvailableException.class, () -> accounts.acquire(0));
        assertEquals(0, accounts.spareCount());

        clock.advance(Duration.ofMinutes(5));
        Account a = accounts.acquire(0);
        assertEquals(Account.State.HEALTHY, a.state());
        assertNull(a.cooldownUntil());
    }

    @Test
    void expireCooldowns_restoresHealthy() {
        accounts.register(account("a"));
        accounts.register(account("b"));
        accounts.markCooldown("a", T0.plusSeconds(30));
        accounts.markCooldown("b", T0.plus(Duration.ofHours(1)));

        clock.advance(Duration.ofMinutes(1));
        assertEquals(1, accounts.expireCooldowns());
        assertEquals(Account.State.HEALTHY, accounts.get("a").orElseThrow().state());
        assertEquals(Account.State.COOLDOWN, accounts.get("b").orElseThrow().state());
    }

    @Test
    void load_restoresPersistedStateForRegisteredAccounts() throws Exception {
        Account persistedBan = account("a").withState(Account.State.BANNED, null);
        Account stranger = account("zzz");
        AccountStore store = new AccountStore() {
            @Override public List<Account> loadAccounts() { return List.of(persistedBan, stranger); }
            @Override public void saveAccount(Account account) {}
        };
        AccountManager restored = new AccountManager(store, ChallengeSink.none(), clock);
        restored.register(account("a"));
        restored.register(account("b"));

        assertEquals(1, restored.load());
        assertEquals(Account.State.BANNED, restored.get("a").orElseThrow().state());
        assertTrue(restored.get("zzz").isEmpty(), "unregistered accounts are not resurrected");
        assertEquals("b", restored.acquire(0).username());
    }

    @Test
    void failingStoreAndSink_doNotBreakTransitions() throws Exception {
        AccountStore failing = new AccountStore() {
            @Override public List<Account> loadAccounts() throws Exception { throw new Exception("down"); }
            @Override public void saveAccount(Account account) throws Exception { throw new Exception("down"); }
        };
        AccountManager m = new AccountManager(failing, acc -> { throw new IllegalStateException("sink down"); }, clock);
        m.register(account("a"));

        Account a = m.acquire(0);
        assertEquals(Account.State.CAPTCHA_PENDING, m.markChallenged(a.username()).state());
        assertEquals(Account.State.HEALTHY, m.resolve(a.username()).state());
    }
}
