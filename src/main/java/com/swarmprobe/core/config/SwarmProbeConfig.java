package com.swarmprobe.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.swarmprobe.core.behavior.RoleCatalog;
import com.swarmprobe.core.client.WorldApi;
import com.swarmprobe.core.client.WorldApiClient;
import com.swarmprobe.core.reporting.BuildInfo;
import com.swarmprobe.core.reporting.GitHubIssueTracker;
import com.swarmprobe.core.reporting.IssueTracker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SwarmProbeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    @Bean
    public RoleCatalog roleCatalog(ObjectMapper objectMapper) {
        return RoleCatalog.load(objectMapper);
    }

    /**
     * The client reads the target section on every call, so command-line overrides applied
     * to the properties before a run take effect.
     */
    @Bean
    public WorldApi worldApi(SwarmProbeProperties properties, ObjectMapper objectMapper) {
        return new WorldApiClient(properties.getTarget(), objectMapper);
    }

    @Bean
    public IssueTracker issueTracker(SwarmProbeProperties properties, ObjectMapper objectMapper) {
        var tracker = properties.getTracker();
        if (!"github".equalsIgnoreCase(tracker.getProvider())) {
            throw new IllegalStateException("Unsupported tracker provider: " + tracker.getProvider());
        }
        return new GitHubIssueTracker(tracker, objectMapper);
    }

    @Bean
    public BuildInfo buildInfo() {
        return BuildInfo.detect();
    }
}
