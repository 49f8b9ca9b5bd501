package net.spotter.core.service;

import net.spotter.core.model.Region;

import java.time.Duration;

/**
 * 엔진 튜닝 값 모음. 부트스트랩의 SpotterProperties 에서 채워진다.
 * validate() 실패는 기동 중단 사유(설정 오류).
 */
public class EngineSettings {
    // 함대
    private int gridRows = 2;
    private int gridCols = 2;
    private double speedLimit = 8.5;                          // m/s (약 19mph)
    private Region region;

    // 스케줄링
    private Duration scanHorizon = Duration.ofSeconds(60);
    private Duration minDeadlineSlack = Duration.ofSeconds(1); // required_speed 분모 하한
    private double suppressionRadiusMeters = 70;
    private Duration suppressionWindow = Duration.ofSeconds(60);
    private Duration explorationDeadline = Duration.ofSeconds(60);
    private int explorationCandidates = 32;
    private double explorationCellMeters = 140;
    private int maxPendingChallenges = 100;

    // 방문/복구
    private Duration visitTimeout = Duration.ofSeconds(10);
    private int transientRetryCeiling = 3;
    private int protocolRetryCeiling = 2;
    private Duration retryBackoff = Duration.ofSeconds(5);
    private Duration retryBackoffMax = Duration.ofSeconds(60);
    private Duration rateLimitCooldown = Duration.ofSeconds(30);
    private Duration accountCooldown = Duration.ofMinutes(5);
    private Duration challengeSwapAfter;                       // null = resolve 까지 대기
    private int emptyVisitSwapThreshold = 4;                   // 0 = 사용 안 함
    private double pointJitterDegrees = 0.00033;

    // 스폰 모델
    private Duration spawnPeriod = Duration.ofHours(1);
    private Duration defaultDuration = Duration.ofMinutes(15);
    private Duration consistencyTolerance = Duration.ofSeconds(5);
    private double smoothingAlpha = 0.3;
    private Duration staleAfter = Duration.ofHours(24);

    // 유지보수
    private Duration swapInterval = Duration.ofMinutes(10);

    public EngineSettings validate() {
        if (gridRows <= 0 || gridCols <= 0) throw new IllegalArgumentException("fleet grid must be positive: " + gridRows + "x" + gridCols);
        if (!(speedLimit > 0)) throw new IllegalArgumentException("speedLimit must be positive: " + speedLimit);
        if (region == null) throw new IllegalArgumentException("exploration region bounds are required");
        requirePositive("scanHorizon", scanHorizon);
        requirePositive("minDeadlineSlack", minDeadlineSlack);
        requirePositive("visitTimeout", visitTimeout);
        requirePositive("retryBackoff", retryBackoff);
        requirePositive("rateLimitCooldown", rateLimitCooldown);
        requirePositive("explorationDeadline", explorationDeadline);
        requirePositive("spawnPeriod", spawnPeriod);
        requirePositive("defaultDuration", defaultDuration);
        requirePositive("staleAfter", staleAfter);
        if (transientRetryCeiling <= 0 || protocolRetryCeiling <= 0) {
            throw new IllegalArgumentException("retry ceilings must be positive: " + transientRetryCeiling + "/" + protocolRetryCeiling);
        }
        if (smoothingAlpha <= 0 || smoothingAlpha > 1) throw new IllegalArgumentException("smoothingAlpha must be in (0,1]: " + smoothingAlpha);
        if (explorationCellMeters <= 0) throw new IllegalArgumentException("explorationCellMeters must be positive");
        if (explorationCandidates <= 0) throw new IllegalArgumentException("explorationCandidates must be positive");
        return this;
    }

    private static void requirePositive(String name, Duration d) {
        if (d == null || d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be positive: " + d);
    }

    public int fleetSize() {
        return gridRows * gridCols;
    }

    public int getGridRows() { return gridRows; }
    public void setGridRows(int gridRows) { this.gridRows = gridRows; }

    public int getGridCols() { return gridCols; }
    public void setGridCols(int gridCols) { this.gridCols = gridCols; }

    public double getSpeedLimit() { return speedLimit; }
    public void setSpeedLimit(double speedLimit) { this.speedLimit = speedLimit; }

    public Region getRegion() { return region; }
    public void setRegion(Region region) { this.region = region; }

    public Duration getScanHorizon() { return scanHorizon; }
    public void setScanHorizon(Duration scanHorizon) { this.scanHorizon = scanHorizon; }

    public Duration getMinDeadlineSlack() { return minDeadlineSlack; }
    public void setMinDeadlineSlack(Duration minDeadlineSlack) { this.minDeadlineSlack = minDeadlineSlack; }

    public double getSuppressionRadiusMeters() { return suppressionRadiusMeters; }
    public void setSuppressionRadiusMeters(double suppressionRadiusMeters) { this.suppressionRadiusMeters = suppressionRadiusMeters; }

    public Duration getSuppressionWindow() { return suppressionWindow; }
    public void setSuppressionWindow(Duration suppressionWindow) { this.suppressionWindow = suppressionWindow; }

    public Duration getExplorationDeadline() { return explorationDeadline; }
    public void setExplorationDeadline(Duration explorationDeadline) { this.explorationDeadline = explorationDeadline; }

    public int getExplorationCandidates() { return explorationCandidates; }
    public void setExplorationCandidates(int explorationCandidates) { this.explorationCandidates = explorationCandidates; }

    public double getExplorationCellMeters() { return explorationCellMeters; }
    public void setExplorationCellMeters(double explorationCellMeters) { this.explorationCellMeters = explorationCellMeters; }

    public int getMaxPendingChallenges() { return maxPendingChallenges; }
    public void setMaxPendingChallenges(int maxPendingChallenges) { this.maxPendingChallenges = maxPendingChallenges; }

    public Duration getVisitTimeout() { return visitTimeout; }
    public void setVisitTimeout(Duration visitTimeout) { this.visitTimeout = visitTimeout; }

    public int getTransientRetryCeiling() { return transientRetryCeiling; }
    public void setTransientRetryCeiling(int transientRetryCeiling) { this.transientRetryCeiling = transientRetryCeiling; }

    public int getProtocolRetryCeiling() { return protocolRetryCeiling; }
    public void setProtocolRetryCeiling(int protocolRetryCeiling) { this.protocolRetryCeiling = protocolRetryCeiling; }

    public Duration getRetryBackoff() { return retryBackoff; }
    public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }

    public Duration getRetryBackoffMax() { return retryBackoffMax; }
    public void setRetryBackoffMax(Duration retryBackoffMax) { this.retryBackoffMax = retryBackoffMax; }

    public Duration getRateLimitCooldown() { return rateLimitCooldown; }
    public void setRateLimitCooldown(Duration rateLimitCooldown) { this.rateLimitCooldown = rateLimitCooldown; }

    public Duration getAccountCooldown() { return accountCooldown; }
    public void setAccountCooldown(Duration accountCooldown) { this.accountCooldown = accountCooldown; }

    public Duration getChallengeSwapAfter() { return challengeSwapAfter; }
    public void setChallengeSwapAfter(Duration challengeSwapAfter) { this.challengeSwapAfter = challengeSwapAfter; }

    public int getEmptyVisitSwapThreshold() { return emptyVisitSwapThreshold; }
    public void setEmptyVisitSwapThreshold(int emptyVisitSwapThreshold) { this.emptyVisitSwapThreshold = emptyVisitSwapThreshold; }

    public double getPointJitterDegrees() { return pointJitterDegrees; }
    public void setPointJitterDegrees(double pointJitterDegrees) { this.pointJitterDegrees = pointJitterDegrees; }

    public Duration getSpawnPeriod() { return spawnPeriod; }
    public void setSpawnPeriod(Duration spawnPeriod) { this.spawnPeriod = spawnPeriod; }

    public Duration getDefaultDuration() { return defaultDuration; }
    public void setDefaultDuration(Duration defaultDuration) { this.defaultDuration = defaultDuration; }

    public Duration getConsistencyTolerance() { return consistencyTolerance; }
    public void setConsistencyTolerance(Duration consistencyTolerance) { this.consistencyTolerance = consistencyTolerance; }

    public double getSmoothingAlpha() { return smoothingAlpha; }
    public void setSmoothingAlpha(double smoothingAlpha) { this.smoothingAlpha = smoothingAlpha; }

    public Duration getStaleAfter() { return staleAfter; }
    public void setStaleAfter(Duration staleAfter) { this.staleAfter = staleAfter; }

    public Duration getSwapInterval() { return swapInterval; }
    public void setSwapInterval(Duration swapInterval) { this.swapInterval = swapInterval; }
}
