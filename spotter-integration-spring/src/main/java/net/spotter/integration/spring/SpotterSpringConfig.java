package net.spotter.integration.spring;

import net.spotter.adapter.jdbc.repo.JdbcAccountStore;
import net.spotter.adapter.jdbc.repo.JdbcSpawnStore;
import net.spotter.core.spi.Clock;
import net.spotter.core.spi.TxRunner;
import net.spotter.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class SpotterSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // 저장소 구현 등록 (adapter-jdbc 재사용)
    @Bean public JdbcSpawnStore spawnStore(TxRunner tx) { return new JdbcSpawnStore(tx); }
    @Bean public JdbcAccountStore accountStore(TxRunner tx) { return new JdbcAccountStore(tx); }

    @Bean public Clock systemClock() { return Clock.system(); }
}
