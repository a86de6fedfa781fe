package com.ragpipe.discovery;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.temporal.api.enums.v1.TaskQueueType;
import io.temporal.api.taskqueue.v1.TaskQueue;
import io.temporal.api.workflowservice.v1.DescribeTaskQueueRequest;
import io.temporal.api.workflowservice.v1.DescribeTaskQueueResponse;
import io.temporal.serviceclient.WorkflowServiceStubs;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/** {@link TaskQueueInspector} backed by Temporal's DescribeTaskQueue call (activity task queue type). */
public final class TemporalTaskQueueInspector implements TaskQueueInspector {

    private static final long DESCRIBE_DEADLINE_SECONDS = 5;

    private final WorkflowServiceStubs service;
    private final String namespace;

    public TemporalTaskQueueInspector(WorkflowServiceStubs service, String namespace) {
        this.service = Objects.requireNonNull(service, "service");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
    }

    @Override
    public int activityPollerCount(String taskQueue) {
        DescribeTaskQueueRequest request = DescribeTaskQueueRequest.newBuilder()
                .setNamespace(namespace)
                .setTaskQueue(TaskQueue.newBuilder().setName(taskQueue).build())
                .setTaskQueueType(TaskQueueType.TASK_QUEUE_TYPE_ACTIVITY)
                .build();
        try {
            DescribeTaskQueueResponse response = service.blockingStub()
                    .withDeadlineAfter(DESCRIBE_DEADLINE_SECONDS, TimeUnit.SECONDS)
                    .describeTaskQueue(request);
            return response.getPollersCount();
        } catch (StatusRuntimeException e) {
            Status.Code code = e.getStatus().getCode();
            if (code == Status.Code.UNAVAILABLE || code == Status.Code.DEADLINE_EXCEEDED) {
                throw new ControlPlaneUnavailableException(
                        "Temporal control plane unreachable while describing " + taskQueue + ": " + code, e);
            }
            throw e;
        }
    }
}
