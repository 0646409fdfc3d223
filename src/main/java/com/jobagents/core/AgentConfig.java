package com.jobagents.core;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Per-agent settings: name, where its state lives and how long {@link BaseAgent#run()}
 * sleeps between steps.
 */
public final class AgentConfig {

    private final String name;
    private final Path statePath;
    private final Duration interval;

    public AgentConfig(String name, Path statePath, Duration interval) {
        this.name = Objects.requireNonNull(name, "name");
        this.statePath = Objects.requireNonNull(statePath, "statePath");
        this.interval = Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("Interval must not be negative: " + interval);
        }
    }

    /**
     * Config whose state file is {@code <stateDirectory>/state_<name>.json}.
     */
    public static AgentConfig inDirectory(String name, Path stateDirectory, Duration interval) {
        return new AgentConfig(name, stateDirectory.resolve("state_" + name + ".json"), interval);
    }

    public String getName() {
        return name;
    }

    public Path getStatePath() {
        return statePath;
    }

    public Duration getInterval() {
        return interval;
    }

    @Override
    public String toString() {
        return "AgentConfig{name=" + name + ", statePath=" + statePath + ", interval=" + interval + "}";
    }
}
