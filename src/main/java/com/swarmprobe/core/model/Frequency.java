package com.swarmprobe.core.model;

public enum Frequency {
    ALWAYS,
    SOMETIMES,
    RARE;

    public String label() {
        return name().toLowerCase();
    }
}
