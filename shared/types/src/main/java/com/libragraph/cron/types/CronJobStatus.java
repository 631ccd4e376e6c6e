package com.libragraph.cron.types;

public enum CronJobStatus {
    ACTIVE("active"),
    PAUSED("paused"),
    COMPLETED("completed");

    private final String label;

    CronJobStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static CronJobStatus fromLabel(String label) {
        for (CronJobStatus s : values()) {
            if (s.label.equals(label)) return s;
        }
        throw new IllegalArgumentException("Unknown CronJobStatus label: " + label);
    }
}
