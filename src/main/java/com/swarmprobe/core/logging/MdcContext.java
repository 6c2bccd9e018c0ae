package com.swarmprobe.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys for swarm logging. Member threads carry {@code memberId} and {@code role};
 * the orchestrator thread carries {@code cycle}.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setMember(String memberId, String role) {
        MDC.put("memberId", memberId);
        MDC.put("role", role);
    }

    public static void setCycle(long cycle) {
        MDC.put("cycle", String.valueOf(cycle));
    }

    public static void clear() {
        MDC.remove("memberId");
        MDC.remove("role");
        MDC.remove("cycle");
    }
}
