package com.ragpipe.worker.workflow;

import com.ragpipe.pipeline.ActivityDescriptor;
import com.ragpipe.pipeline.ConfigurationException;
import com.ragpipe.pipeline.RetryPolicySpec;
import com.ragpipe.worker.activity.PipelineActivities;
import io.temporal.activity.ActivityOptions;
import io.temporal.failure.ApplicationFailure;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TemporalActivityInvokerTest {

    @Test
    void remoteActivity_isRoutedToItsServiceQueueWithItsPolicy() {
        ActivityDescriptor embed = ActivityDescriptor.remote("perform_embedding_and_indexing_activity",
                "embedding_service", "embedding-task-queue", Duration.ofMinutes(30), new RetryPolicySpec(2, 20, 5, 3.0));

        ActivityOptions options = TemporalActivityInvoker.activityOptions(embed);

        assertEquals("embedding-task-queue", options.getTaskQueue());
        assertEquals(Duration.ofMinutes(30), options.getStartToCloseTimeout());
        assertEquals(5, options.getRetryOptions().getMaximumAttempts());
        assertEquals(Duration.ofSeconds(2), options.getRetryOptions().getInitialInterval());
        assertEquals(Duration.ofSeconds(20), options.getRetryOptions().getMaximumInterval());
        assertEquals(3.0, options.getRetryOptions().getBackoffCoefficient());
    }

    @Test
    void localActivity_staysOnTheWorkflowQueue() {
        ActivityOptions options = TemporalActivityInvoker.activityOptions(
                ActivityDescriptor.local("health_check_activity", Duration.ofMinutes(1), null));

        assertNull(options.getTaskQueue());
        assertEquals(Duration.ofMinutes(1), options.getStartToCloseTimeout());
    }

    @Test
    void configurationFailureFromPlanActivity_mapsBackToConfigurationException() {
        ApplicationFailure failure = ApplicationFailure.newNonRetryableFailure(
                "Activity 'rerank' not found in configuration", PipelineActivities.CONFIGURATION_ERROR,
                ConfigurationException.Kind.ACTIVITY_NOT_FOUND.name(), "rerank");

        ConfigurationException e = ActivityPlanResolver.toConfigurationException(failure, "document_retrieval");

        assertEquals(ConfigurationException.Kind.ACTIVITY_NOT_FOUND, e.getKind());
        assertEquals("rerank", e.getSubject());
        assertEquals("Activity 'rerank' not found in configuration", e.getMessage());
    }
}
