package com.ragpipe.worker.activity;

import com.ragpipe.activity.ActivityCatalog;
import com.ragpipe.activity.ActivityFunction;
import io.temporal.activity.Activity;
import io.temporal.activity.DynamicActivity;
import io.temporal.common.converter.EncodedValues;
import io.temporal.failure.ApplicationFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Serves every activity type on a task queue that has no typed implementation: the activity type is looked up
 * in the worker's {@link ActivityCatalog} and the positional arguments are passed through as JSON values.
 * An unknown type or unusable arguments fail without retry.
 */
public final class ActivityDispatcher implements DynamicActivity {

    private static final Logger log = LoggerFactory.getLogger(ActivityDispatcher.class);

    public static final String UNKNOWN_ACTIVITY = "UnknownActivity";
    public static final String INVALID_ARGUMENTS = "InvalidArguments";

    private final ActivityCatalog catalog;

    public ActivityDispatcher(ActivityCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    @Override
    public Object execute(EncodedValues args) {
        String activityType = Activity.getExecutionContext().getInfo().getActivityType();
        ActivityFunction function = catalog.get(activityType).orElseThrow(() ->
                ApplicationFailure.newNonRetryableFailure(
                        "Activity " + activityType + " is not hosted by this worker " + catalog.names(),
                        UNKNOWN_ACTIVITY));
        List<Object> values = new ArrayList<>(args.getSize());
        for (int i = 0; i < args.getSize(); i++) {
            values.add(args.get(i, Object.class));
        }
        log.debug("Dispatching {} with {} args", activityType, values.size());
        try {
            return function.invoke(values);
        } catch (IllegalArgumentException e) {
            throw ApplicationFailure.newNonRetryableFailureWithCause(e.getMessage(), INVALID_ARGUMENTS, e);
        } catch (Exception e) {
            throw Activity.wrap(e);
        }
    }
}
