package com.swarmprobe.core.engine;

import com.swarmprobe.core.reporting.BuildInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Requests a restart once the working directory's HEAD commit differs from the one seen at
 * startup.
 */
public class GitHeadDeploymentWatcher implements DeploymentWatcher {

    private static final Logger log = LoggerFactory.getLogger(GitHeadDeploymentWatcher.class);

    private final Supplier<String> headCommit;
    private final String startupCommit;

    public GitHeadDeploymentWatcher(Supplier<String> headCommit) {
        this.headCommit = headCommit;
        this.startupCommit = headCommit.get();
    }

    @Override
    public boolean restartRequested() {
        if (BuildInfo.UNKNOWN.equals(startupCommit)) {
            return false;
        }
        var current = headCommit.get();
        if (!BuildInfo.UNKNOWN.equals(current) && !current.equals(startupCommit)) {
            log.info("HEAD moved from {} to {}, requesting restart", startupCommit, current);
            return true;
        }
        return false;
    }
}
