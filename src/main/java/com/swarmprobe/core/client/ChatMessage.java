package com.swarmprobe.core.client;

public record ChatMessage(String fromEntityId, String fromName, String message, String channel, long tsMs) {
}
