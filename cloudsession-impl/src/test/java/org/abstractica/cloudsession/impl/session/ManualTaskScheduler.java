package org.abstractica.cloudsession.impl.session;

import java.util.ArrayList;
import java.util.List;

/**
 * Scheduler for tests: tasks run only when the test says so.
 */
class ManualTaskScheduler implements TaskScheduler
{
    private final List<ScheduledTask> tasks = new ArrayList<>();
    private boolean shutdown;

    private static final class ScheduledTask
    {
        private final Runnable task;
        private final long delayMs;
        private boolean cancelled;

        ScheduledTask(Runnable task, long delayMs)
        {
            this.task = task;
            this.delayMs = delayMs;
        }
    }

    @Override
    public synchronized Runnable schedule(Runnable task, long delayMs)
    {
        if (shutdown)
        {
            throw new IllegalStateException("Scheduler is shut down");
        }
        ScheduledTask scheduled = new ScheduledTask(task, delayMs);
        tasks.add(scheduled);
        return () -> scheduled.cancelled = true;
    }

    @Override
    public synchronized void shutdown()
    {
        shutdown = true;
    }

    /**
     * Runs the oldest pending task.
     *
     * @throws IllegalStateException if nothing is pending
     */
    void runNext()
    {
        ScheduledTask next;
        synchronized (this)
        {
            next = tasks.stream()
                    .filter(t -> !t.cancelled)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No pending task"));
            tasks.remove(next);
        }
        next.task.run();
    }

    synchronized int pendingCount()
    {
        return (int) tasks.stream().filter(t -> !t.cancelled).count();
    }

    synchronized List<Long> delays()
    {
        List<Long> delays = new ArrayList<>();
        for (ScheduledTask task : tasks)
        {
            delays.add(task.delayMs);
        }
        return delays;
    }

    synchronized boolean isShutdown()
    {
        return shutdown;
    }
}
