package com.ragpipe.pipeline;

import java.util.List;
import java.util.Objects;

/** A named, ordered, non-empty sequence of steps. */
public final class PipelineDefinition {

    private final String name;
    private final String displayName;
    private final String description;
    private final List<PipelineStep> steps;
    private final PipelineOrigin origin;

    public PipelineDefinition(String name, String displayName, String description,
                              List<PipelineStep> steps, PipelineOrigin origin) {
        this.name = Objects.requireNonNull(name, "name");
        this.displayName = displayName != null && !displayName.isBlank() ? displayName : name;
        this.description = description != null ? description : "";
        this.steps = List.copyOf(Objects.requireNonNull(steps, "steps"));
        this.origin = origin != null ? origin : PipelineOrigin.DECLARED;
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public List<PipelineStep> getSteps() {
        return steps;
    }

    public PipelineOrigin getOrigin() {
        return origin;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PipelineDefinition that = (PipelineDefinition) o;
        return name.equals(that.name)
                && displayName.equals(that.displayName)
                && description.equals(that.description)
                && steps.equals(that.steps)
                && origin == that.origin;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, displayName, description, steps, origin);
    }

    @Override
    public String toString() {
        return "PipelineDefinition{" + name + ", " + origin + ", steps=" + steps + "}";
    }
}
