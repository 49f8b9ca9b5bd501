package net.spotter.app.sim;

import net.spotter.core.service.EngineSettings;
import net.spotter.core.spi.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** 실제 프로토콜 클라이언트 대신 모의 서버를 붙인다 */
@Configuration
@EnableConfigurationProperties(SimulationProperties.class)
@ConditionalOnProperty(prefix = "spotter.simulation", name = "enabled", havingValue = "true")
public class SimulationConfig {

    @Bean
    public SimulatedScanClient simulatedScanClient(EngineSettings settings, Clock clock, SimulationProperties props) {
        return new SimulatedScanClient(settings.getRegion(), settings.getSpawnPeriod(), clock, props);
    }
}
