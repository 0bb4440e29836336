package com.loadreplay;

import java.time.Duration;

/**
 * Configuration for a replay run - destination, pacing, budget and client limits.
 */
public class ReplayConfig {

    private String host = "localhost";
    private int port = 9200;
    private double speedMultiplier = 1.0;
    private Duration runTime = Duration.ofMinutes(1);
    private int maxOutstanding = 0;
    private int connectTimeoutSeconds = 30;
    private boolean verbose = false;
    private boolean dryRun = false;

    private ReplayConfig() {
    }

    /**
     * Converts fractional minutes as given on the command line to a budget.
     */
    public static Duration minutes(double minutes) {
        return Duration.ofNanos(Math.round(minutes * 60_000_000_000.0));
    }

    // Builder pattern
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final ReplayConfig config = new ReplayConfig();

        public Builder host(String host) {
            config.host = host;
            return this;
        }

        public Builder port(int port) {
            config.port = port;
            return this;
        }

        public Builder speedMultiplier(double speedMultiplier) {
            config.speedMultiplier = speedMultiplier;
            return this;
        }

        public Builder runTime(Duration runTime) {
            config.runTime = runTime;
            return this;
        }

        public Builder runTimeMinutes(double minutes) {
            config.runTime = minutes(minutes);
            return this;
        }

        /**
         * Caps the number of in-flight requests; 0 leaves concurrency unbounded.
         */
        public Builder maxOutstanding(int maxOutstanding) {
            config.maxOutstanding = maxOutstanding;
            return this;
        }

        public Builder connectTimeoutSeconds(int connectTimeoutSeconds) {
            config.connectTimeoutSeconds = connectTimeoutSeconds;
            return this;
        }

        public Builder verbose(boolean verbose) {
            config.verbose = verbose;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            config.dryRun = dryRun;
            return this;
        }

        public ReplayConfig build() {
            if (config.host == null || config.host.isBlank()) {
                throw new IllegalArgumentException("host is required");
            }
            if (config.port < 1 || config.port > 65535) {
                throw new IllegalArgumentException("port must be in 1..65535, got " + config.port);
            }
            if (!(config.speedMultiplier > 0) || Double.isInfinite(config.speedMultiplier)) {
                throw new IllegalArgumentException("speed multiplier must be > 0, got " + config.speedMultiplier);
            }
            if (config.runTime == null || config.runTime.isNegative() || config.runTime.isZero()) {
                throw new IllegalArgumentException("run time must be > 0, got " + config.runTime);
            }
            if (config.maxOutstanding < 0) {
                throw new IllegalArgumentException("max outstanding must be >= 0, got " + config.maxOutstanding);
            }
            if (config.connectTimeoutSeconds < 0) {
                throw new IllegalArgumentException("connect timeout must be >= 0");
            }
            return config;
        }
    }

    // Getters
    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public double getSpeedMultiplier() {
        return speedMultiplier;
    }

    public Duration getRunTime() {
        return runTime;
    }

    public int getMaxOutstanding() {
        return maxOutstanding;
    }

    public int getConnectTimeoutSeconds() {
        return connectTimeoutSeconds;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isDryRun() {
        return dryRun;
    }
}
