package com.ragpipe.worker.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/** One executed step: zero-based index, activity, outcome and a short description of the result. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class StepTraceEntry {

    private static final int SUMMARY_TEXT_LIMIT = 100;

    private final int stepIndex;
    private final String activityName;
    private final StepStatus status;
    private final String resultSummary;

    @JsonCreator
    public StepTraceEntry(
            @JsonProperty("stepIndex") int stepIndex,
            @JsonProperty("activityName") String activityName,
            @JsonProperty("status") StepStatus status,
            @JsonProperty("resultSummary") String resultSummary) {
        this.stepIndex = stepIndex;
        this.activityName = activityName;
        this.status = status;
        this.resultSummary = resultSummary;
    }

    public static StepTraceEntry completed(int stepIndex, String activityName, Object result) {
        return new StepTraceEntry(stepIndex, activityName, StepStatus.COMPLETED, summarize(result));
    }

    public static StepTraceEntry failed(int stepIndex, String activityName, String message) {
        return new StepTraceEntry(stepIndex, activityName, StepStatus.FAILED, message);
    }

    /** {@code map{status=success, indexed_count=2}}-style summary; long text is cut. */
    static String summarize(Object result) {
        if (result == null) return "null";
        if (result instanceof Map) {
            Map<?, ?> m = (Map<?, ?>) result;
            Object status = m.get("status");
            return "map(" + m.size() + " keys" + (status != null ? ", status=" + status : "") + ")";
        }
        if (result instanceof Collection) {
            return "list(" + ((Collection<?>) result).size() + " items)";
        }
        String text = result.toString();
        return text.length() > SUMMARY_TEXT_LIMIT ? text.substring(0, SUMMARY_TEXT_LIMIT) + "..." : text;
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public String getActivityName() {
        return activityName;
    }

    public StepStatus getStatus() {
        return status;
    }

    public String getResultSummary() {
        return resultSummary;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepTraceEntry that = (StepTraceEntry) o;
        return stepIndex == that.stepIndex
                && Objects.equals(activityName, that.activityName)
                && status == that.status
                && Objects.equals(resultSummary, that.resultSummary);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepIndex, activityName, status, resultSummary);
    }

    @Override
    public String toString() {
        return "#" + stepIndex + " " + activityName + " " + status + " " + resultSummary;
    }
}
