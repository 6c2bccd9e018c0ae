package com.swarmprobe.core.model;

public enum Severity {
    CRITICAL("Critical"),
    MAJOR("Major"),
    MINOR("Minor");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
