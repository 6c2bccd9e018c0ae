package com.swarmprobe.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "swarmprobe")
public class SwarmProbeProperties {

    private Target target = new Target();
    private Swarm swarm = new Swarm();
    private Detection detection = new Detection();
    private Tracker tracker = new Tracker();
    private State state = new State();

    // -- Target accessors (delegate to nested) --
    public String getBaseUrl() { return target.baseUrl; }
    public String getRoomId() { return target.roomId; }

    // -- Swarm accessors (delegate to nested) --
    public int getMemberCount() { return swarm.memberCount; }
    public long getCycleDelayMs() { return swarm.cycleDelayMs; }
    public long getIssueCheckIntervalMs() { return swarm.issueCheckIntervalMs; }

    public boolean isDryRun() { return tracker.dryRun; }

    public Target getTarget() { return target; }
    public void setTarget(Target target) { this.target = target; }
    public Swarm getSwarm() { return swarm; }
    public void setSwarm(Swarm swarm) { this.swarm = swarm; }
    public Detection getDetection() { return detection; }
    public void setDetection(Detection detection) { this.detection = detection; }
    public Tracker getTracker() { return tracker; }
    public void setTracker(Tracker tracker) { this.tracker = tracker; }
    public State getState() { return state; }
    public void setState(State state) { this.state = state; }

    /**
     * The world server under test.
     */
    public static class Target {
        private String baseUrl = "http://localhost:2567";
        private String apiPrefix = "/aic/v0.1";
        private String roomId = "default";
        private int connectTimeoutSeconds = 5;
        private int requestTimeoutSeconds = 15;
        private int observeRadius = 200;
        private int chatWindowSec = 60;
        private int pollLimit = 50;
        private int mapWidthTiles = 64;
        private int mapHeightTiles = 64;
        private int tileSizePx = 32;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getApiPrefix() { return apiPrefix; }
        public void setApiPrefix(String apiPrefix) { this.apiPrefix = apiPrefix; }
        public String getRoomId() { return roomId; }
        public void setRoomId(String roomId) { this.roomId = roomId; }
        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
        public int getObserveRadius() { return observeRadius; }
        public void setObserveRadius(int observeRadius) { this.observeRadius = observeRadius; }
        public int getChatWindowSec() { return chatWindowSec; }
        public void setChatWindowSec(int chatWindowSec) { this.chatWindowSec = chatWindowSec; }
        public int getPollLimit() { return pollLimit; }
        public void setPollLimit(int pollLimit) { this.pollLimit = pollLimit; }
        public int getMapWidthTiles() { return mapWidthTiles; }
        public void setMapWidthTiles(int mapWidthTiles) { this.mapWidthTiles = mapWidthTiles; }
        public int getMapHeightTiles() { return mapHeightTiles; }
        public void setMapHeightTiles(int mapHeightTiles) { this.mapHeightTiles = mapHeightTiles; }
        public int getTileSizePx() { return tileSizePx; }
        public void setTileSizePx(int tileSizePx) { this.tileSizePx = tileSizePx; }
    }

    /**
     * Swarm composition, member behaviour and escalation.
     */
    public static class Swarm {
        private int memberCount = 10;
        private String stressLevel = "medium";
        private boolean chaosEnabled = false;
        private long cycleDelayMs = 2000;
        private long issueCheckIntervalMs = 10000;
        private Long seed;
        private int historyCapacity = 50;
        private int labelHistoryCapacity = 20;
        private int noveltyWindow = 10;
        private int trackedEntities = 50;
        private int trackedFacilities = 30;
        private int chatCapacity = 50;
        private int observeWindowCycles = 3;
        private int pollWindowCycles = 10;
        private int authFailureCeiling = 3;
        private long reregisterDelayMs = 1000;
        private int reregisterAttempts = 3;
        private long reregisterBackoffMs = 500;
        private double interactRangePx = 90;
        private double navigateRadiusPx = 160;
        private int errorSuppressionThreshold = 5;
        private int escalateAfterCycles = 2;
        private int escalationMemberIncrement = 5;
        private long escalationCycleDelayMs = 500;
        private int shutdownTimeoutSeconds = 10;
        private boolean restartOnNewCommit = false;

        public int getMemberCount() { return memberCount; }
        public void setMemberCount(int memberCount) { this.memberCount = memberCount; }
        public String getStressLevel() { return stressLevel; }
        public void setStressLevel(String stressLevel) { this.stressLevel = stressLevel; }
        public boolean isChaosEnabled() { return chaosEnabled; }
        public void setChaosEnabled(boolean chaosEnabled) { this.chaosEnabled = chaosEnabled; }
        public long getCycleDelayMs() { return cycleDelayMs; }
        public void setCycleDelayMs(long cycleDelayMs) { this.cycleDelayMs = cycleDelayMs; }
        public long getIssueCheckIntervalMs() { return issueCheckIntervalMs; }
        public void setIssueCheckIntervalMs(long issueCheckIntervalMs) { this.issueCheckIntervalMs = issueCheckIntervalMs; }
        public Long getSeed() { return seed; }
        public void setSeed(Long seed) { this.seed = seed; }
        public int getHistoryCapacity() { return historyCapacity; }
        public void setHistoryCapacity(int historyCapacity) { this.historyCapacity = historyCapacity; }
        public int getLabelHistoryCapacity() { return labelHistoryCapacity; }
        public void setLabelHistoryCapacity(int labelHistoryCapacity) { this.labelHistoryCapacity = labelHistoryCapacity; }
        public int getNoveltyWindow() { return noveltyWindow; }
        public void setNoveltyWindow(int noveltyWindow) { this.noveltyWindow = noveltyWindow; }
        public int getTrackedEntities() { return trackedEntities; }
        public void setTrackedEntities(int trackedEntities) { this.trackedEntities = trackedEntities; }
        public int getTrackedFacilities() { return trackedFacilities; }
        public void setTrackedFacilities(int trackedFacilities) { this.trackedFacilities = trackedFacilities; }
        public int getChatCapacity() { return chatCapacity; }
        public void setChatCapacity(int chatCapacity) { this.chatCapacity = chatCapacity; }
        public int getObserveWindowCycles() { return observeWindowCycles; }
        public void setObserveWindowCycles(int observeWindowCycles) { this.observeWindowCycles = observeWindowCycles; }
        public int getPollWindowCycles() { return pollWindowCycles; }
        public void setPollWindowCycles(int pollWindowCycles) { this.pollWindowCycles = pollWindowCycles; }
        public int getAuthFailureCeiling() { return authFailureCeiling; }
        public void setAuthFailureCeiling(int authFailureCeiling) { this.authFailureCeiling = authFailureCeiling; }
        public long getReregisterDelayMs() { return reregisterDelayMs; }
        public void setReregisterDelayMs(long reregisterDelayMs) { this.reregisterDelayMs = reregisterDelayMs; }
        public int getReregisterAttempts() { return reregisterAttempts; }
        public void setReregisterAttempts(int reregisterAttempts) { this.reregisterAttempts = reregisterAttempts; }
        public long getReregisterBackoffMs() { return reregisterBackoffMs; }
        public void setReregisterBackoffMs(long reregisterBackoffMs) { this.reregisterBackoffMs = reregisterBackoffMs; }
        public double getInteractRangePx() { return interactRangePx; }
        public void setInteractRangePx(double interactRangePx) { this.interactRangePx = interactRangePx; }
        public double getNavigateRadiusPx() { return navigateRadiusPx; }
        public void setNavigateRadiusPx(double navigateRadiusPx) { this.navigateRadiusPx = navigateRadiusPx; }
        public int getErrorSuppressionThreshold() { return errorSuppressionThreshold; }
        public void setErrorSuppressionThreshold(int errorSuppressionThreshold) { this.errorSuppressionThreshold = errorSuppressionThreshold; }
        public int getEscalateAfterCycles() { return escalateAfterCycles; }
        public void setEscalateAfterCycles(int escalateAfterCycles) { this.escalateAfterCycles = escalateAfterCycles; }
        public int getEscalationMemberIncrement() { return escalationMemberIncrement; }
        public void setEscalationMemberIncrement(int escalationMemberIncrement) { this.escalationMemberIncrement = escalationMemberIncrement; }
        public long getEscalationCycleDelayMs() { return escalationCycleDelayMs; }
        public void setEscalationCycleDelayMs(long escalationCycleDelayMs) { this.escalationCycleDelayMs = escalationCycleDelayMs; }
        public int getShutdownTimeoutSeconds() { return shutdownTimeoutSeconds; }
        public void setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) { this.shutdownTimeoutSeconds = shutdownTimeoutSeconds; }
        public boolean isRestartOnNewCommit() { return restartOnNewCommit; }
        public void setRestartOnNewCommit(boolean restartOnNewCommit) { this.restartOnNewCommit = restartOnNewCommit; }
    }

    /**
     * Detector thresholds and gating.
     */
    public static class Detection {
        private long cooldownMinutes = 30;

        private double desyncMinJumpPx = 160;
        private double desyncSpeedPxPerMs = 1.2;
        private long desyncMaxDeltaMs = 2000;

        private long chatSkewMs = 5000;
        private double chatJaccardDistance = 0.5;
        private String chatBroadcastChannel = "global";

        private long stuckIdleMs = 30000;
        private double stuckFailureRate = 0.5;
        private int stuckCallWindow = 10;

        private long errorRateWindowMs = 60000;
        private int errorRateMinSamples = 20;
        private double errorRateThreshold = 0.5;

        private int entityBucketPx = 64;
        private long entitySkewMs = 1000;
        private double entityCountRatio = 2.0;

        private long facilitySkewMs = 2000;
        private int observeBucketPx = 16;

        private int interactMinSamples = 5;
        private double interactRejectionRate = 0.6;

        private long pollGapMs = 60000;

        private long coverageWarmupCycles = 10;

        private int complianceMinActions = 10;
        private int complianceMinOpportunity = 3;
        private double complianceMinOverlap = 0.3;

        private int entropyMinActions = 10;
        private int entropyMinDistinct = 3;

        private long idleOpportunityMs = 30000;

        private long starvationMinCycles = 10;

        public long getCooldownMinutes() { return cooldownMinutes; }
        public void setCooldownMinutes(long cooldownMinutes) { this.cooldownMinutes = cooldownMinutes; }
        public double getDesyncMinJumpPx() { return desyncMinJumpPx; }
        public void setDesyncMinJumpPx(double desyncMinJumpPx) { this.desyncMinJumpPx = desyncMinJumpPx; }
        public double getDesyncSpeedPxPerMs() { return desyncSpeedPxPerMs; }
        public void setDesyncSpeedPxPerMs(double desyncSpeedPxPerMs) { this.desyncSpeedPxPerMs = desyncSpeedPxPerMs; }
        public long getDesyncMaxDeltaMs() { return desyncMaxDeltaMs; }
        public void setDesyncMaxDeltaMs(long desyncMaxDeltaMs) { this.desyncMaxDeltaMs = desyncMaxDeltaMs; }
        public long getChatSkewMs() { return chatSkewMs; }
        public void setChatSkewMs(long chatSkewMs) { this.chatSkewMs = chatSkewMs; }
        public double getChatJaccardDistance() { return chatJaccardDistance; }
        public void setChatJaccardDistance(double chatJaccardDistance) { this.chatJaccardDistance = chatJaccardDistance; }
        public String getChatBroadcastChannel() { return chatBroadcastChannel; }
        public void setChatBroadcastChannel(String chatBroadcastChannel) { this.chatBroadcastChannel = chatBroadcastChannel; }
        public long getStuckIdleMs() { return stuckIdleMs; }
        public void setStuckIdleMs(long stuckIdleMs) { this.stuckIdleMs = stuckIdleMs; }
        public double getStuckFailureRate() { return stuckFailureRate; }
        public void setStuckFailureRate(double stuckFailureRate) { this.stuckFailureRate = stuckFailureRate; }
        public int getStuckCallWindow() { return stuckCallWindow; }
        public void setStuckCallWindow(int stuckCallWindow) { this.stuckCallWindow = stuckCallWindow; }
        public long getErrorRateWindowMs() { return errorRateWindowMs; }
        public void setErrorRateWindowMs(long errorRateWindowMs) { this.errorRateWindowMs = errorRateWindowMs; }
        public int getErrorRateMinSamples() { return errorRateMinSamples; }
        public void setErrorRateMinSamples(int errorRateMinSamples) { this.errorRateMinSamples = errorRateMinSamples; }
        public double getErrorRateThreshold() { return errorRateThreshold; }
        public void setErrorRateThreshold(double errorRateThreshold) { this.errorRateThreshold = errorRateThreshold; }
        public int getEntityBucketPx() { return entityBucketPx; }
        public void setEntityBucketPx(int entityBucketPx) { this.entityBucketPx = entityBucketPx; }
        public long getEntitySkewMs() { return entitySkewMs; }
        public void setEntitySkewMs(long entitySkewMs) { this.entitySkewMs = entitySkewMs; }
        public double getEntityCountRatio() { return entityCountRatio; }
        public void setEntityCountRatio(double entityCountRatio) { this.entityCountRatio = entityCountRatio; }
        public long getFacilitySkewMs() { return facilitySkewMs; }
        public void setFacilitySkewMs(long facilitySkewMs) { this.facilitySkewMs = facilitySkewMs; }
        public int getObserveBucketPx() { return observeBucketPx; }
        public void setObserveBucketPx(int observeBucketPx) { this.observeBucketPx = observeBucketPx; }
        public int getInteractMinSamples() { return interactMinSamples; }
        public void setInteractMinSamples(int interactMinSamples) { this.interactMinSamples = interactMinSamples; }
        public double getInteractRejectionRate() { return interactRejectionRate; }
        public void setInteractRejectionRate(double interactRejectionRate) { this.interactRejectionRate = interactRejectionRate; }
        public long getPollGapMs() { return pollGapMs; }
        public void setPollGapMs(long pollGapMs) { this.pollGapMs = pollGapMs; }
        public long getCoverageWarmupCycles() { return coverageWarmupCycles; }
        public void setCoverageWarmupCycles(long coverageWarmupCycles) { this.coverageWarmupCycles = coverageWarmupCycles; }
        public int getComplianceMinActions() { return complianceMinActions; }
        public void setComplianceMinActions(int complianceMinActions) { this.complianceMinActions = complianceMinActions; }
        public int getComplianceMinOpportunity() { return complianceMinOpportunity; }
        public void setComplianceMinOpportunity(int complianceMinOpportunity) { this.complianceMinOpportunity = complianceMinOpportunity; }
        public double getComplianceMinOverlap() { return complianceMinOverlap; }
        public void setComplianceMinOverlap(double complianceMinOverlap) { this.complianceMinOverlap = complianceMinOverlap; }
        public int getEntropyMinActions() { return entropyMinActions; }
        public void setEntropyMinActions(int entropyMinActions) { this.entropyMinActions = entropyMinActions; }
        public int getEntropyMinDistinct() { return entropyMinDistinct; }
        public void setEntropyMinDistinct(int entropyMinDistinct) { this.entropyMinDistinct = entropyMinDistinct; }
        public long getIdleOpportunityMs() { return idleOpportunityMs; }
        public void setIdleOpportunityMs(long idleOpportunityMs) { this.idleOpportunityMs = idleOpportunityMs; }
        public long getStarvationMinCycles() { return starvationMinCycles; }
        public void setStarvationMinCycles(long starvationMinCycles) { this.starvationMinCycles = starvationMinCycles; }
    }

    /**
     * Issue tracker connection. Only the "github" provider exists; dry-run covers running without a tracker.
     */
    public static class Tracker {
        private String provider = "github";
        private String apiUrl = "https://api.github.com";
        private String owner = "";
        private String repo = "";
        private String token = "";
        private String markerLabel = "resident-agent";
        private double similarityThreshold = 0.6;
        private int logTailLines = 20;
        private boolean dryRun = false;

        /**
         * Returns the configured token, falling back to the {@code GITHUB_TOKEN} env var.
         */
        public String resolveToken() {
            if (token != null && !token.isBlank()) {
                return token;
            }
            String env = System.getenv("GITHUB_TOKEN");
            return env != null ? env : "";
        }

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
        public String getOwner() { return owner; }
        public void setOwner(String owner) { this.owner = owner; }
        public String getRepo() { return repo; }
        public void setRepo(String repo) { this.repo = repo; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public String getMarkerLabel() { return markerLabel; }
        public void setMarkerLabel(String markerLabel) { this.markerLabel = markerLabel; }
        public double getSimilarityThreshold() { return similarityThreshold; }
        public void setSimilarityThreshold(double similarityThreshold) { this.similarityThreshold = similarityThreshold; }
        public int getLogTailLines() { return logTailLines; }
        public void setLogTailLines(int logTailLines) { this.logTailLines = logTailLines; }
        public boolean isDryRun() { return dryRun; }
        public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }
    }

    /**
     * Persisted run state location.
     */
    public static class State {
        private String path = "";

        /** Configured path, or {@code ~/.swarmprobe/state.json} when blank. */
        public Path resolvePath() {
            if (path != null && !path.isBlank()) {
                return Path.of(path);
            }
            return Path.of(System.getProperty("user.home"), ".swarmprobe", "state.json");
        }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }
}
