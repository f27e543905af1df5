package com.loopclaw.approval;

import java.util.Locale;

public enum ApprovalMode {
    AUTO("auto"),
    MANUAL("manual"),
    DISABLED("disabled");

    private final String value;

    ApprovalMode(String value) {
        this.value = value;
    }

    public String value() { return value; }

    public static ApprovalMode fromString(String raw) {
        if (raw == null) throw new IllegalArgumentException("approval mode must not be null");
        var normalized = raw.strip().toLowerCase(Locale.ROOT);
        for (var mode : values()) {
            if (mode.value.equals(normalized)) return mode;
        }
        throw new IllegalArgumentException("Unknown approval mode: " + raw);
    }
}
