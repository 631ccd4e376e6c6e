package com.libragraph.cron.types;

/**
 * How the execution engine runs a job's task: in a fresh isolated session,
 * or inside the scope's main session.
 */
public enum ExecutionMode {
    ISOLATED("isolated"),
    MAIN("main");

    private final String label;

    ExecutionMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ExecutionMode fromLabel(String label) {
        for (ExecutionMode m : values()) {
            if (m.label.equals(label)) return m;
        }
        throw new IllegalArgumentException("Unknown ExecutionMode label: " + label);
    }
}
