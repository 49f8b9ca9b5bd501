package net.spotter.app.sim;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties("spotter.simulation")
public class SimulationProperties {
    private boolean enabled = false;
    private long seed = 42;
    private int spawnCount = 40;
    private double scanRadiusMeters = 70;
    private Duration spawnDuration = Duration.ofMinutes(15);
    private Duration latency = Duration.ofMillis(50);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public int getSpawnCount() {
        return spawnCount;
    }

    public void setSpawnCount(int spawnCount) {
        this.spawnCount = spawnCount;
    }

    public double getScanRadiusMeters() {
        return scanRadiusMeters;
    }

    public void setScanRadiusMeters(double scanRadiusMeters) {
        this.scanRadiusMeters = scanRadiusMeters;
    }

    public Duration getSpawnDuration() {
        return spawnDuration;
    }

    public void setSpawnDuration(Duration spawnDuration) {
        this.spawnDuration = spawnDuration;
    }

    public Duration getLatency() {
        return latency;
    }

    public void setLatency(Duration latency) {
        this.latency = latency;
    }
}
