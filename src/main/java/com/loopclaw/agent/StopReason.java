package com.loopclaw.agent;

public enum StopReason {
    COMPLETED("completed"),
    MAX_ITERATIONS("max_iterations"),
    TIMEOUT("timeout"),
    ERROR("error");

    private final String value;

    StopReason(String value) {
        this.value = value;
    }

    public String value() { return value; }
}
