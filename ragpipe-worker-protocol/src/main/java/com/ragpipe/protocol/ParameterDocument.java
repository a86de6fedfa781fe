package com.ragpipe.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Positional parameter of an activity as advertised in worker metadata. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ParameterDocument {

    private final String name;
    private final String type;
    private final String description;
    private final boolean required;

    @JsonCreator
    public ParameterDocument(
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("description") String description,
            @JsonProperty("required") Boolean required) {
        this.name = name;
        this.type = type;
        this.description = description != null ? description : "";
        this.required = required == null || required;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("type")
    public String getType() {
        return type;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("required")
    public boolean isRequired() {
        return required;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParameterDocument that = (ParameterDocument) o;
        return required == that.required
                && Objects.equals(name, that.name)
                && Objects.equals(type, that.type)
                && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, description, required);
    }
}
