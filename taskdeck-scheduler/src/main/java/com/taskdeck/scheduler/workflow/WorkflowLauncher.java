package com.taskdeck.scheduler.workflow;

import com.taskdeck.scheduler.model.ScheduledJob;

/**
 * Hands a due job to a workflow runner without waiting for it to finish.
 */
@FunctionalInterface
public interface WorkflowLauncher {

    /**
     * @throws RuntimeException when the job could not be handed off
     */
    void launch(ScheduledJob job);
}
