package com.ragpipe.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** One activity entry in a worker metadata document. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ActivityMetadataDocument {

    public static final int DEFAULT_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;

    private final String name;
    private final String description;
    private final int timeoutSeconds;
    private final int retryAttempts;
    private final List<ParameterDocument> parameters;
    private final ReturnsDocument returns;

    @JsonCreator
    public ActivityMetadataDocument(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("timeout_seconds") Integer timeoutSeconds,
            @JsonProperty("retry_attempts") Integer retryAttempts,
            @JsonProperty("parameters") List<ParameterDocument> parameters,
            @JsonProperty("returns") ReturnsDocument returns) {
        this.name = name;
        this.description = description != null ? description : "";
        this.timeoutSeconds = timeoutSeconds != null ? timeoutSeconds : DEFAULT_TIMEOUT_SECONDS;
        this.retryAttempts = retryAttempts != null ? retryAttempts : DEFAULT_RETRY_ATTEMPTS;
        this.parameters = parameters != null ? List.copyOf(parameters) : List.of();
        this.returns = returns;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("timeout_seconds")
    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    @JsonProperty("retry_attempts")
    public int getRetryAttempts() {
        return retryAttempts;
    }

    @JsonProperty("parameters")
    public List<ParameterDocument> getParameters() {
        return parameters;
    }

    @JsonProperty("returns")
    public ReturnsDocument getReturns() {
        return returns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ActivityMetadataDocument that = (ActivityMetadataDocument) o;
        return timeoutSeconds == that.timeoutSeconds
                && retryAttempts == that.retryAttempts
                && Objects.equals(name, that.name)
                && Objects.equals(description, that.description)
                && Objects.equals(parameters, that.parameters)
                && Objects.equals(returns, that.returns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, timeoutSeconds, retryAttempts, parameters, returns);
    }
}
