package com.provote.backend.domain.enums;

public enum PatternType {
    VOTE_BURST("Vote burst"),
    IP_CLUSTER("IP clustering"),
    FINGERPRINT_REUSE("Fingerprint reuse cluster"),
    OPTION_SURGE("Single-option surge");

    private final String label;

    PatternType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
