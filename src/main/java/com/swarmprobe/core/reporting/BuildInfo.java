package com.swarmprobe.core.reporting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Build identification shown in issue bodies.
 */
public record BuildInfo(String commitSha, String javaVersion, String osName) {

    private static final Logger log = LoggerFactory.getLogger(BuildInfo.class);

    public static final String UNKNOWN = "unknown";

    public static BuildInfo detect() {
        return new BuildInfo(gitCommit(), System.getProperty("java.version", UNKNOWN),
                System.getProperty("os.name", UNKNOWN));
    }

    /** Short HEAD commit of the working directory, or {@code unknown}. */
    public static String gitCommit() {
        try {
            var process = new ProcessBuilder("git", "rev-parse", "HEAD")
                    .redirectErrorStream(true)
                    .start();
            String line;
            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                line = reader.readLine();
            }
            if (!process.waitFor(5, TimeUnit.SECONDS) || process.exitValue() != 0 || line == null) {
                process.destroy();
                return UNKNOWN;
            }
            var sha = line.trim();
            return sha.length() > 8 ? sha.substring(0, 8) : sha;
        } catch (IOException e) {
            log.debug("git rev-parse unavailable: {}", e.getMessage());
            return UNKNOWN;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return UNKNOWN;
        }
    }
}
