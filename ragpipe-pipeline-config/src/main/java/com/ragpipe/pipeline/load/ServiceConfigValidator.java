package com.ragpipe.pipeline.load;

import com.ragpipe.pipeline.ActivityDescriptor;
import com.ragpipe.pipeline.ConfigurationException;
import com.ragpipe.pipeline.ExecutionKind;
import com.ragpipe.pipeline.PipelineDefinition;
import com.ragpipe.pipeline.PipelineStep;
import com.ragpipe.pipeline.ServiceConfig;
import com.ragpipe.transform.TransformRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Load-time checks on a {@link ServiceConfig}: every pipeline has steps, every step's activity resolves and agrees
 * with its declared type and service, every transform name is known. Unknown transforms are rejected unless the
 * validator is lenient, in which case they are logged and run as passthrough.
 */
public final class ServiceConfigValidator {

    private static final Logger log = LoggerFactory.getLogger(ServiceConfigValidator.class);

    private final TransformRegistry transforms;
    private final boolean lenientTransforms;

    public ServiceConfigValidator(TransformRegistry transforms, boolean lenientTransforms) {
        this.transforms = Objects.requireNonNull(transforms, "transforms");
        this.lenientTransforms = lenientTransforms;
    }

    /**
     * @return the same config, for chaining
     * @throws ConfigurationException on the first problem found
     */
    public ServiceConfig validateOrThrow(ServiceConfig config) {
        for (PipelineDefinition pipeline : config.getPipelines().values()) {
            if (pipeline.getSteps().isEmpty()) {
                throw new ConfigurationException(ConfigurationException.Kind.INVALID_DOCUMENT, pipeline.getName(),
                        "Pipeline '" + pipeline.getName() + "' has no steps (" + config.getSource() + ")");
            }
            int index = 0;
            for (PipelineStep step : pipeline.getSteps()) {
                index++;
                ActivityDescriptor descriptor = config.getActivityDescriptor(step.getActivityName())
                        .orElseThrow(() -> new ConfigurationException(ConfigurationException.Kind.ACTIVITY_NOT_FOUND,
                                step.getActivityName(), "Pipeline '" + pipeline.getName() + "' references activity '"
                                + step.getActivityName() + "' which no service declares"));
                checkDeclaredPlacement(pipeline, index, step, descriptor);
                checkTransform(pipeline, index, step);
            }
        }
        return config;
    }

    private static void checkDeclaredPlacement(PipelineDefinition pipeline, int index, PipelineStep step,
                                               ActivityDescriptor descriptor) {
        if (step.getDeclaredKind() != null && step.getDeclaredKind() != descriptor.getKind()) {
            throw new ConfigurationException(ConfigurationException.Kind.INVALID_STEP, step.getActivityName(),
                    "Pipeline '" + pipeline.getName() + "' step " + index + " declares type "
                            + step.getDeclaredKind().toValue() + " but activity '" + step.getActivityName()
                            + "' is " + descriptor.getKind().toValue());
        }
        if (descriptor.getKind() == ExecutionKind.REMOTE && step.getDeclaredService() != null
                && !step.getDeclaredService().equals(descriptor.getService())) {
            throw new ConfigurationException(ConfigurationException.Kind.INVALID_STEP, step.getActivityName(),
                    "Pipeline '" + pipeline.getName() + "' step " + index + " declares service '"
                            + step.getDeclaredService() + "' but activity '" + step.getActivityName()
                            + "' belongs to '" + descriptor.getService() + "'");
        }
    }

    private void checkTransform(PipelineDefinition pipeline, int index, PipelineStep step) {
        if (transforms.contains(step.getTransformName())) {
            return;
        }
        if (lenientTransforms) {
            log.warn("Pipeline '{}' step {} uses unknown transform '{}'; passthrough will be used",
                    pipeline.getName(), index, step.getTransformName());
            return;
        }
        throw new ConfigurationException(ConfigurationException.Kind.UNKNOWN_TRANSFORM, step.getTransformName(),
                "Pipeline '" + pipeline.getName() + "' step " + index + " uses unknown transform '"
                        + step.getTransformName() + "'; known transforms: " + transforms.names());
    }
}
