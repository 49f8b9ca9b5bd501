package net.spotter.bootstrap.autoconfigure;

import net.spotter.adapter.jdbc.repo.JdbcSpawnStore;
import net.spotter.bootstrap.catalog.CatalogRegistrar;
import net.spotter.bootstrap.props.SpotterProperties;
import net.spotter.core.maintenance.FleetMaintenance;
import net.spotter.core.service.AccountManager;
import net.spotter.core.service.EngineSettings;
import net.spotter.core.service.FailureRecoveryController;
import net.spotter.core.service.Orchestrator;
import net.spotter.core.service.RetryPolicy;
import net.spotter.core.service.Scheduler;
import net.spotter.core.service.SpawnCatalog;
import net.spotter.core.service.Throttle;
import net.spotter.core.service.VisitExecutor;
import net.spotter.core.service.WorkerPool;
import net.spotter.core.spi.AccountStore;
import net.spotter.core.spi.ChallengeSink;
import net.spotter.core.spi.Clock;
import net.spotter.core.spi.HashingQuota;
import net.spotter.core.spi.ScanClient;
import net.spotter.core.spi.SpawnStore;
import net.spotter.integration.spring.SpotterSpringConfig;
import net.spotter.integration.spring.sched.SpotterSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

@AutoConfiguration
@EnableConfigurationProperties(SpotterProperties.class)
@Import(SpotterSpringConfig.class) // integration-spring: 저장소/tx/clock 연결
public class SpotterAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(SpotterAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean(ChallengeSink.class)
    public ChallengeSink challengeSink() {
        // 해결 UI 가 없으면 로그만 남긴다. 해결은 AccountManager.resolve 로
        return account -> log.warn("Account {} needs a challenge solved (challenges so far: {})",
                account.username(), account.challenges());
    }

    @Bean
    @ConditionalOnMissingBean(HashingQuota.class)
    public HashingQuota hashingQuota() {
        return HashingQuota.unlimited();
    }

    // --- 엔진 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public EngineSettings engineSettings(SpotterProperties props) {
        EngineSettings s = props.getEngine();
        s.setRegion(props.getRegion().toRegion());
        return s.validate();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(EngineSettings settings) {
        return RetryPolicy.exponential(settings.getRetryBackoff(), settings.getRetryBackoffMax());
    }

    @Bean
    @ConditionalOnMissingBean
    public SpawnCatalog spawnCatalog(SpawnStore store, Clock clock, EngineSettings settings) {
        return new SpawnCatalog(store, clock, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public AccountManager accountManager(AccountStore store, ChallengeSink sink, Clock clock) {
        return new AccountManager(store, sink, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public Throttle throttle(Clock clock) {
        return new Throttle(clock);
    }

    // 아래 셋의 종료는 Orchestrator.shutdown 이 맡는다
    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public WorkerPool workerPool(AccountManager accounts, EngineSettings settings, Clock clock) {
        return new WorkerPool(accounts, settings, clock);
    }

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public VisitExecutor visitExecutor(ScanClient client, SpawnCatalog catalog, SpawnStore store,
                                       AccountManager accounts, Throttle throttle, Clock clock,
                                       EngineSettings settings) {
        return new VisitExecutor(client, catalog, store, accounts, throttle, clock, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public FailureRecoveryController failureRecoveryController(WorkerPool pool, AccountManager accounts,
                                                               Throttle throttle, HashingQuota quota,
                                                               RetryPolicy retry, Clock clock,
                                                               EngineSettings settings) {
        return new FailureRecoveryController(pool, accounts, throttle, quota, retry, clock, settings);
    }

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public Scheduler scheduler(SpawnCatalog catalog, WorkerPool pool, VisitExecutor executor,
                               FailureRecoveryController recovery, AccountManager accounts,
                               Throttle throttle, Clock clock, EngineSettings settings) {
        return new Scheduler(catalog, pool, executor, recovery, accounts, throttle, clock, settings);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public Orchestrator orchestrator(SpawnCatalog catalog, AccountManager accounts, WorkerPool pool,
                                     VisitExecutor executor, FailureRecoveryController recovery,
                                     Scheduler scheduler) {
        return new Orchestrator(catalog, accounts, pool, executor, recovery, scheduler);
    }

    @Bean
    @ConditionalOnMissingBean
    public FleetMaintenance fleetMaintenance(SpawnCatalog catalog, AccountManager accounts, WorkerPool pool,
                                             Scheduler scheduler, Throttle throttle, Clock clock,
                                             EngineSettings settings) {
        return new FleetMaintenance(catalog, accounts, pool, scheduler, throttle, clock, settings);
    }

    // --- 스케줄러 등록 (프로퍼티로 주기 제어) ---

    @Bean
    @ConditionalOnProperty(prefix = "spotter.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SpotterSchedulers spotterSchedulers(Orchestrator orchestrator,
                                               FleetMaintenance maintenance,
                                               JdbcSpawnStore spawnStore,
                                               Clock clock,
                                               SpotterProperties props) {
        // @Scheduled 딜레이는 spotter.scheduler.*-delay-ms 에서 직접 읽힌다
        var s = new SpotterSchedulers(orchestrator, maintenance, spawnStore, clock);
        s.setSightingRetention(props.getScheduler().getSightingRetention());
        return s;
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(AccountManager accounts, SpawnCatalog catalog,
                                             EngineSettings settings, Clock clock) {
        return new CatalogRegistrar(accounts, catalog, settings, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "spotter", name = "autostart", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner spotterRunner(CatalogRegistrar registrar, Orchestrator orchestrator,
                                           SpotterProperties props) {
        log.info("Spotter region {} with {} configured accounts", props.getRegion(), props.getAccounts().size());
        return args -> {
            registrar.register(props);
            orchestrator.start();
        };
    }
}
