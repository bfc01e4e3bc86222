package org.abstractica.cloudsession.impl.session;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Task scheduler backed by a single daemon thread.
 */
public class ExecutorTaskScheduler implements TaskScheduler
{
    private final ScheduledExecutorService executor;

    /**
     * Creates a scheduler whose thread carries the given name.
     *
     * @param threadName name of the scheduler thread
     */
    public ExecutorTaskScheduler(String threadName)
    {
        Objects.requireNonNull(threadName, "threadName");
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable ->
        {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public Runnable schedule(Runnable task, long delayMs)
    {
        ScheduledFuture<?> future = executor.schedule(task, delayMs, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void shutdown()
    {
        executor.shutdownNow();
    }
}
