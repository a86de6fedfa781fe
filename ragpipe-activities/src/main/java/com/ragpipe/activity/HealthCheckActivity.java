package com.ragpipe.activity;

import com.ragpipe.protocol.ActivityMetadataDocument;
import com.ragpipe.protocol.ParameterDocument;
import com.ragpipe.protocol.ReturnsDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Liveness probe run as an activity; ignores its arguments. */
public final class HealthCheckActivity implements ActivityFunction {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckActivity.class);

    public static final String NAME = "health_check_activity";
    public static final String HEALTHY = "Activity worker is healthy";

    public static ActivityMetadataDocument metadata() {
        return new ActivityMetadataDocument(NAME, "Reports that the activity worker is up", 30, 1,
                List.of(new ParameterDocument("input", "any", "Ignored", false)),
                new ReturnsDocument("string", "Health message"));
    }

    @Override
    public Object invoke(List<Object> args) {
        log.debug("Health check invoked with {} args", args.size());
        return HEALTHY;
    }
}
