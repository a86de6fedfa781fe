package com.ragpipe.discovery;

/** Asks the workflow engine's control plane how many workers poll a task queue. */
public interface TaskQueueInspector {

    /**
     * @return number of live activity pollers on the queue (0 if none)
     * @throws ControlPlaneUnavailableException if the control plane cannot be reached
     * @throws RuntimeException for a failure specific to this queue
     */
    int activityPollerCount(String taskQueue);
}
