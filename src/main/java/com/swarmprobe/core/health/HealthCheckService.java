package com.swarmprobe.core.health;

import com.swarmprobe.core.client.WorldApi;
import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.reporting.IssueTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final WorldApi worldApi;
    private final IssueTracker issueTracker;
    private final SwarmProbeProperties properties;

    public HealthCheckService(WorldApi worldApi, IssueTracker issueTracker, SwarmProbeProperties properties) {
        this.worldApi = worldApi;
        this.issueTracker = issueTracker;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkTarget());
        results.add(checkTracker());
        return results;
    }

    public HealthStatus checkTarget() {
        var url = properties.getBaseUrl();
        if (worldApi.healthy()) {
            return new HealthStatus("target", HealthStatus.Status.UP,
                    "World server reachable", Map.of("url", url));
        }
        log.warn("Target {} failed its health check", url);
        return new HealthStatus("target", HealthStatus.Status.DOWN,
                "World server unreachable", Map.of("url", url));
    }

    public HealthStatus checkTracker() {
        var tracker = properties.getTracker();
        if (tracker.isDryRun()) {
            return new HealthStatus("tracker", HealthStatus.Status.DEGRADED,
                    "Dry-run mode, tracker not contacted", Map.of("tracker", issueTracker.describe()));
        }
        if (tracker.resolveToken().isBlank()) {
            return new HealthStatus("tracker", HealthStatus.Status.DEGRADED,
                    "No tracker token configured", Map.of("tracker", issueTracker.describe()));
        }
        if (issueTracker.reachable()) {
            return new HealthStatus("tracker", HealthStatus.Status.UP,
                    "Tracker reachable", Map.of("tracker", issueTracker.describe()));
        }
        return new HealthStatus("tracker", HealthStatus.Status.DOWN,
                "Tracker unreachable", Map.of("tracker", issueTracker.describe()));
    }
}
