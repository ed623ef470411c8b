package com.filterbench.engine;

import java.util.Locale;

/**
 * The interchangeable execution strategies. The method tag is embedded in
 * output file names so runs of different strategies do not overwrite each
 * other.
 */
public enum StrategyType {
    SEQUENTIAL("Sequential", "sequential"),
    PROCESS_POOL("ProcessPool", "multiprocess"),
    THREAD_POOL("ThreadPool", "multithread"),
    ACTOR_POOL("ActorPool", "actor");

    private final String label;
    private final String methodTag;

    StrategyType(String label, String methodTag) {
        this.label = label;
        this.methodTag = methodTag;
    }

    public String getLabel() {
        return label;
    }

    public String getMethodTag() {
        return methodTag;
    }

    public boolean isParallel() {
        return this != SEQUENTIAL;
    }

    /**
     * Resolves a strategy from its constant name, label or method tag,
     * ignoring case, spaces and dashes.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static StrategyType fromString(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Strategy name is required");
        }
        String trimmed = name.trim();
        String normalized = trimmed.replace('-', '_').replace(' ', '_').toUpperCase(Locale.ROOT);
        for (StrategyType type : values()) {
            if (type.name().equals(normalized)
                    || type.label.equalsIgnoreCase(trimmed)
                    || type.methodTag.equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown strategy: " + name);
    }
}
