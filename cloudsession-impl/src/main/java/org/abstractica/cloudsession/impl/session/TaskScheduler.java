package org.abstractica.cloudsession.impl.session;

/**
 * Runs delayed tasks for a session, such as reconnect attempts.
 */
public interface TaskScheduler
{
    /**
     * Schedules a task.
     *
     * @param task    the task
     * @param delayMs delay in milliseconds
     * @return a handle that cancels the task if it has not run yet
     */
    Runnable schedule(Runnable task, long delayMs);

    /**
     * Cancels pending tasks and releases resources.
     */
    void shutdown();
}
