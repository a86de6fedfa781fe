package com.ragpipe.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ragpipe.pipeline.defaults.ActivityDefaults;

import java.time.Duration;
import java.util.Objects;

/** Retry policy of one activity; missing values take {@link ActivityDefaults}. */
public final class RetryPolicySpec {

    public static final RetryPolicySpec DEFAULT = new RetryPolicySpec(null, null, null, null);

    private final int initialIntervalSeconds;
    private final int maximumIntervalSeconds;
    private final int maximumAttempts;
    private final double backoffCoefficient;

    @JsonCreator
    public RetryPolicySpec(
            @JsonProperty("initialIntervalSeconds") Integer initialIntervalSeconds,
            @JsonProperty("maximumIntervalSeconds") Integer maximumIntervalSeconds,
            @JsonProperty("maximumAttempts") Integer maximumAttempts,
            @JsonProperty("backoffCoefficient") Double backoffCoefficient) {
        this.initialIntervalSeconds = initialIntervalSeconds != null
                ? initialIntervalSeconds : ActivityDefaults.RETRY_INITIAL_INTERVAL_SECONDS;
        this.maximumIntervalSeconds = maximumIntervalSeconds != null
                ? maximumIntervalSeconds : ActivityDefaults.RETRY_MAXIMUM_INTERVAL_SECONDS;
        this.maximumAttempts = maximumAttempts != null ? maximumAttempts : ActivityDefaults.RETRY_MAXIMUM_ATTEMPTS;
        this.backoffCoefficient = backoffCoefficient != null
                ? backoffCoefficient : ActivityDefaults.RETRY_BACKOFF_COEFFICIENT;
    }

    public int getInitialIntervalSeconds() {
        return initialIntervalSeconds;
    }

    public int getMaximumIntervalSeconds() {
        return maximumIntervalSeconds;
    }

    public int getMaximumAttempts() {
        return maximumAttempts;
    }

    public double getBackoffCoefficient() {
        return backoffCoefficient;
    }

    @JsonIgnore
    public Duration initialInterval() {
        return Duration.ofSeconds(initialIntervalSeconds);
    }

    @JsonIgnore
    public Duration maximumInterval() {
        return Duration.ofSeconds(maximumIntervalSeconds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryPolicySpec that = (RetryPolicySpec) o;
        return initialIntervalSeconds == that.initialIntervalSeconds
                && maximumIntervalSeconds == that.maximumIntervalSeconds
                && maximumAttempts == that.maximumAttempts
                && Double.compare(backoffCoefficient, that.backoffCoefficient) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(initialIntervalSeconds, maximumIntervalSeconds, maximumAttempts, backoffCoefficient);
    }

    @Override
    public String toString() {
        return "RetryPolicySpec{initial=" + initialIntervalSeconds + "s, max=" + maximumIntervalSeconds
                + "s, attempts=" + maximumAttempts + ", backoff=" + backoffCoefficient + "}";
    }
}
