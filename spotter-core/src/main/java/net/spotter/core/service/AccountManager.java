package net.spotter.core.service;

import net.spotter.core.model.Account;
import net.spotter.core.model.GeoPoint;
import net.spotter.core.spi.AccountStore;
import net.spotter.core.spi.ChallengeSink;
import net.spotter.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * 계정 풀. 상태 전이와 워커 바인딩은 풀 락 아래에서만 일어난다.
 * - 한 계정은 동시에 최대 한 워커에만 바인딩
 * - 발급은 LRU (lastUsed 가 가장 오래된 HEALTHY 계정)
 * - BANNED 는 종단 상태
 */
public final class AccountManager {
    private static final Logger log = LoggerFactory.getLogger(AccountManager.class);

    private static final Comparator<Account> LEAST_RECENTLY_USED =
            Comparator.comparing(Account::lastUsed, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparing(Account::username);

    private final Object lock = new Object();
    private final Map<String, Account> accounts = new LinkedHashMap<>();
    private final List<Consumer<Account>> resolvedListeners = new CopyOnWriteArrayList<>();

    private final AccountStore store;
    private final ChallengeSink challengeSink;
    private final Clock clock;

    public AccountManager(AccountStore store, ChallengeSink challengeSink, Clock clock) {
        this.store = store;
        this.challengeSink = challengeSink;
        this.clock = clock;
    }

    public void register(Account account) {
        synchronized (lock) {
            accounts.putIfAbsent(account.username(), account);
        }
    }

    /** 영속된 상태(밴/캡차/쿨다운/lastUsed)를 등록된 계정에 덮어쓴다. 바인딩은 복원하지 않는다 */
    public int load() throws Exception {
        List<Account> persisted = store.loadAccounts();
        int merged = 0;
        synchronized (lock) {
            for (Account p : persisted) {
                Account cur = accounts.get(p.username());
                if (cur == null) continue;
                accounts.put(p.username(), new Account(cur.username(), cur.credentialRef(), cur.provider(),
                        p.state(),
                        p.cooldownUntil(), p.lastUsed(), null, p.challenges(), p.lastPosition()));
                merged++;
            }
        }
        log.info("Accounts: {} registered, {} restored from store", size(), merged);
        return merged;
    }

    /**
     * 워커에 계정 하나를 바인딩한다. 쿨다운이 지난 계정은 이 시점에 HEALTHY 로 돌아온다.
     * @throws NoAccountAvailableException 발급 가능한 계정이 없을 때
     */
    public Account acquire(int workerId) throws NoAccountAvailableException {
        Instant now = clock.now();
        Account picked;
        synchronized (lock) {
            picked = accounts.values().stream()
                    .filter(a -> !a.bound() && available(a, now))
                    .min(LEAST_RECENTLY_USED)
                    .orElse(null);
            if (picked == null) {
                throw new NoAccountAvailableException("no healthy account for worker " + workerId
                        + " (" + countsLocked() + ")");
            }
            picked = picked.withState(Account.State.HEALTHY, null).boundTo(workerId, now);
            accounts.put(picked.username(), picked);
        }
        log.debug("Account {} bound to worker {}", picked.username(), workerId);
        persist(picked);
        return picked;
    }

    private static boolean available(Account a, Instant now) {
        if (a.state() == Account.State.HEALTHY) return true;
        return a.state() == Account.State.COOLDOWN
                && (a.cooldownUntil() == null || !a.cooldownUntil().isAfter(now));
    }

    /** 바인딩 해제. lastUsed 와 마지막 위치를 남긴다 */
    public Account release(String username, GeoPoint position) {
        Account updated = mutate(username, a -> {
            Account r = a.boundTo(null, clock.now());
            return position == null ? r : r.at(position);
        });
        log.debug("Account {} released", username);
        return updated;
    }

    /** 캡차 대기(HEALTHY 에서만). 바인딩은 유지되고 협력자에게 알린다 */
    public Account markChallenged(String username) {
        Account updated = mutate(username, a -> {
            requireState(a, "challenge", Account.State.HEALTHY);
            return a.challenged();
        });
        log.warn("Account {} requires challenge resolution (challenges={})", username, updated.challenges());
        try {
            challengeSink.challenged(updated);
        } catch (RuntimeException e) {
            log.warn("Challenge sink failed for {}: {}", username, e.toString());
        }
        return updated;
    }

    /** 협력자가 캡차를 풀었을 때. CAPTCHA_PENDING 이 아니면 IllegalStateException */
    public Account resolve(String username) {
        Account updated;
        synchronized (lock) {
            Account a = require(username);
            if (a.state() != Account.State.CAPTCHA_PENDING) {
                throw new IllegalStateException("account " + username + " is not awaiting a challenge: " + a.state());
            }
            updated = a.withState(Account.State.HEALTHY, null);
            accounts.put(username, updated);
        }
        log.info("Challenge resolved for account {}", username);
        persist(updated);
        for (Consumer<Account> l : resolvedListeners) {
            try {
                l.accept(updated);
            } catch (RuntimeException e) {
                log.error("Resolve listener failed for {}", username, e);
            }
        }
        return updated;
    }

    /** 밴: 종단 상태. 바인딩도 해제한다 */
    public Account markBanned(String username) {
        Account updated = mutate(username, a -> a.withState(Account.State.BANNED, null).boundTo(null, clock.now()));
        log.error("Account {} banned; removed from rotation", username);
        return updated;
    }

    /** HEALTHY 또는 COOLDOWN(연장) 에서만 */
    public Account markCooldown(String username, Instant until) {
        return mutate(username, a -> {
            requireState(a, "cooldown", Account.State.HEALTHY, Account.State.COOLDOWN);
            return a.withState(Account.State.COOLDOWN, until);
        });
    }

    private static void requireState(Account a, String transition, Account.State... allowed) {
        for (Account.State s : allowed) {
            if (a.state() == s) return;
        }
        throw new IllegalStateException("illegal transition for account " + a.username() + ": "
                + a.state() + " -> " + transition);
    }

    /** 만료된 쿨다운을 HEALTHY 로 되돌린다 */
    public int expireCooldowns() {
        Instant now = clock.now();
        List<Account> changed = new ArrayList<>();
        synchronized (lock) {
            for (Account a : accounts.values()) {
                if (a.state() == Account.State.COOLDOWN
                        && (a.cooldownUntil() == null || !a.cooldownUntil().isAfter(now))) {
                    Account h = a.withState(Account.State.HEALTHY, null);
                    accounts.put(a.username(), h);
                    changed.add(h);
                }
            }
        }
        changed.forEach(this::persist);
        return changed.size();
    }

    private Account mutate(String username, UnaryOperator<Account> fn) {
        Account updated;
        synchronized (lock) {
            updated = fn.apply(require(username));
            accounts.put(username, updated);
        }
        persist(updated);
        return updated;
    }

    private Account require(String username) {
        Account a = accounts.get(username);
        if (a == null) throw new IllegalArgumentException("unknown account: " + username);
        return a;
    }

    private void persist(Account a) {
        try {
            store.saveAccount(a);
        } catch (Exception e) {
            log.warn("Failed to persist account {}: {}", a.username(), e.toString());
        }
    }

    public void onResolved(Consumer<Account> listener) {
        resolvedListeners.add(listener);
    }

    public int pendingChallenges() {
        synchronized (lock) {
            return (int) accounts.values().stream().filter(a -> a.state() == Account.State.CAPTCHA_PENDING).count();
        }
    }

    /** 지금 바로 발급 가능한 미바인딩 계정 수 */
    public int spareCount() {
        Instant now = clock.now();
        synchronized (lock) {
            return (int) accounts.values().stream().filter(a -> !a.bound() && available(a, now)).count();
        }
    }

    public Optional<Account> get(String username) {
        synchronized (lock) {
            return Optional.ofNullable(accounts.get(username));
        }
    }

    public List<Account> snapshot() {
        synchronized (lock) {
            return List.copyOf(accounts.values());
        }
    }

    public int size() {
        synchronized (lock) {
            return accounts.size();
        }
    }

    public Map<Account.State, Long> counts() {
        synchronized (lock) {
            return countsLocked();
        }
    }

    private Map<Account.State, Long> countsLocked() {
        Map<Account.State, Long> m = new EnumMap<>(Account.State.class);
        for (Account a : accounts.values()) m.merge(a.state(), 1L, Long::sum);
        return m;
    }
}
