package net.spotter.bootstrap.props;

import net.spotter.core.model.Region;
import net.spotter.core.service.EngineSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("spotter")
public class SpotterProperties {
    private Bounds region = new Bounds();
    private EngineSettings engine = new EngineSettings();   // 엔진 튜닝값 (region 제외)
    private List<AccountDef> accounts = new ArrayList<>();
    private Catalog catalog = new Catalog();
    private Scheduler scheduler = new Scheduler();
    private boolean autostart = true;                        // 기동 시 계정 등록 + 엔진 시작

    public Bounds getRegion() {
        return region;
    }

    public void setRegion(Bounds region) {
        this.region = region;
    }

    public EngineSettings getEngine() {
        return engine;
    }

    public void setEngine(EngineSettings engine) {
        this.engine = engine;
    }

    public List<AccountDef> getAccounts() {
        return accounts;
    }

    public void setAccounts(List<AccountDef> accounts) {
        this.accounts = accounts;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public boolean isAutostart() {
        return autostart;
    }

    public void setAutostart(boolean autostart) {
        this.autostart = autostart;
    }

    /** 탐색 영역. 두 꼭짓점 순서는 상관없다 */
    public static class Bounds {
        private Double startLat;
        private Double startLon;
        private Double endLat;
        private Double endLon;

        public Double getStartLat() {
            return startLat;
        }

        public void setStartLat(Double startLat) {
            this.startLat = startLat;
        }

        public Double getStartLon() {
            return startLon;
        }

        public void setStartLon(Double startLon) {
            this.startLon = startLon;
        }

        public Double getEndLat() {
            return endLat;
        }

        public void setEndLat(Double endLat) {
            this.endLat = endLat;
        }

        public Double getEndLon() {
            return endLon;
        }

        public void setEndLon(Double endLon) {
            this.endLon = endLon;
        }

        public Region toRegion() {
            if (startLat == null || startLon == null || endLat == null || endLon == null) {
                throw new IllegalArgumentException("spotter.region.{start-lat,start-lon,end-lat,end-lon} are required");
            }
            if (startLat.equals(endLat) || startLon.equals(endLon)) {
                throw new IllegalArgumentException("spotter.region must span a non-empty area: " + this);
            }
            return new Region(Math.min(startLat, endLat), Math.min(startLon, endLon),
                    Math.max(startLat, endLat), Math.max(startLon, endLon));
        }

        @Override
        public String toString() {
            return "Bounds{" + startLat + "," + startLon + " / " + endLat + "," + endLon + '}';
        }
    }

    public static class AccountDef {
        private String username;
        private String password;
        private String provider = "ptc";

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        @Override
        public String toString() {
            // 비밀번호는 찍지 않는다
            return "AccountDef{username='" + username + "', provider='" + provider + "'}";
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<SpawnDef> spawnPoints = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<SpawnDef> getSpawnPoints() {
            return spawnPoints;
        }

        public void setSpawnPoints(List<SpawnDef> spawnPoints) {
            this.spawnPoints = spawnPoints;
        }
    }

    /** 미리 알려진 스폰 지점. despawnSecond = 매 시 몇 초에 사라지는지 (모르면 비움) */
    public static class SpawnDef {
        private Double lat;
        private Double lon;
        private Integer despawnSecond;
        private Duration duration;

        public Double getLat() {
            return lat;
        }

        public void setLat(Double lat) {
            this.lat = lat;
        }

        public Double getLon() {
            return lon;
        }

        public void setLon(Double lon) {
            this.lon = lon;
        }

        public Integer getDespawnSecond() {
            return despawnSecond;
        }

        public void setDespawnSecond(Integer despawnSecond) {
            this.despawnSecond = despawnSecond;
        }

        public Duration getDuration() {
            return duration;
        }

        public void setDuration(Duration duration) {
            this.duration = duration;
        }

        @Override
        public String toString() {
            return "SpawnDef{" + lat + "," + lon + ", despawnSecond=" + despawnSecond + ", duration=" + duration + '}';
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long tickDelayMs = 3000;
        private long maintenanceDelayMs = 10000;
        private Duration sightingRetention;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTickDelayMs() {
            return tickDelayMs;
        }

        public void setTickDelayMs(long tickDelayMs) {
            this.tickDelayMs = tickDelayMs;
        }

        public long getMaintenanceDelayMs() {
            return maintenanceDelayMs;
        }

        public void setMaintenanceDelayMs(long maintenanceDelayMs) {
            this.maintenanceDelayMs = maintenanceDelayMs;
        }

        public Duration getSightingRetention() {
            return sightingRetention;
        }

        public void setSightingRetention(Duration sightingRetention) {
            this.sightingRetention = sightingRetention;
        }
    }
}
