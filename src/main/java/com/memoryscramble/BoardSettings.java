package com.memoryscramble;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;

/**
 * Tunable behaviour of a {@link Board}, read from the {@code memory-scramble}
 * section of the configuration.
 *
 * Defaults live in {@code reference.conf}. They can be overridden by an
 * {@code application.conf} on the classpath or by system properties such as
 * {@code -Dmemory-scramble.flip.first-pick-timeout=2s}.
 */
public final class BoardSettings {
    static final String ROOT = "memory-scramble";

    private final Duration firstPickTimeout;
    private final int transformParallelism;

    public BoardSettings(Duration firstPickTimeout, int transformParallelism) {
        if (firstPickTimeout.isNegative()) {
            throw new IllegalArgumentException("First pick timeout must not be negative");
        }
        if (transformParallelism < 0) {
            throw new IllegalArgumentException("Transform parallelism must not be negative");
        }
        this.firstPickTimeout = firstPickTimeout;
        this.transformParallelism = transformParallelism;
    }

    /**
     * Loads settings from the default configuration stack
     * (system properties, application.conf, reference.conf).
     */
    public static BoardSettings load() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Reads settings from a configuration containing a {@code memory-scramble} section.
     * Missing keys fall back to {@code reference.conf}.
     *
     * @throws com.typesafe.config.ConfigException if a value has the wrong type
     */
    public static BoardSettings fromConfig(Config config) {
        Config section = config.withFallback(ConfigFactory.defaultReference()).getConfig(ROOT);
        return new BoardSettings(
                section.getDuration("flip.first-pick-timeout"),
                section.getInt("transform.parallelism"));
    }

    /**
     * @return how long a first pick waits for a card held by someone else; zero means no bound
     */
    public Duration firstPickTimeout() {
        return firstPickTimeout;
    }

    /**
     * @return threads dedicated to map functions; zero means the common fork/join pool
     */
    public int transformParallelism() {
        return transformParallelism;
    }

    @Override
    public String toString() {
        return "BoardSettings{firstPickTimeout=" + firstPickTimeout
                + ", transformParallelism=" + transformParallelism + "}";
    }
}
