package com.swarmprobe.core.detection;

public final class ImmediateGate implements ViolationGate {

    @Override
    public boolean record(boolean violated) {
        return violated;
    }

    @Override
    public void reset() {
    }
}
