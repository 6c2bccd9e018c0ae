package com.swarmprobe.core.model;

import java.time.Instant;

public record ChatObservation(String sender, String text, String channel, Instant timestamp) {

    /** Identity used when comparing two members' views of the same channel. */
    public String fingerprint() {
        return sender + ":" + text;
    }
}
