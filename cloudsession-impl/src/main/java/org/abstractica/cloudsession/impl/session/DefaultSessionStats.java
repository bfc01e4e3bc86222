package org.abstractica.cloudsession.impl.session;

import org.abstractica.cloudsession.SessionStats;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of SessionStats.
 */
public class DefaultSessionStats implements SessionStats
{
    private final AtomicLong packetsSent = new AtomicLong(0);
    private final AtomicLong packetsQueued = new AtomicLong(0);
    private final AtomicLong framesReceived = new AtomicLong(0);
    private final AtomicLong malformedSegments = new AtomicLong(0);
    private final AtomicLong connectionAttempts = new AtomicLong(0);
    private final AtomicLong successfulOpens = new AtomicLong(0);

    @Override
    public long getPacketsSent()
    {
        return packetsSent.get();
    }

    @Override
    public long getPacketsQueued()
    {
        return packetsQueued.get();
    }

    @Override
    public long getFramesReceived()
    {
        return framesReceived.get();
    }

    @Override
    public long getMalformedSegments()
    {
        return malformedSegments.get();
    }

    @Override
    public long getConnectionAttempts()
    {
        return connectionAttempts.get();
    }

    @Override
    public long getSuccessfulOpens()
    {
        return successfulOpens.get();
    }

    // ========== Update Methods ==========

    public void recordPacketSent()
    {
        packetsSent.incrementAndGet();
    }

    public void recordPacketQueued()
    {
        packetsQueued.incrementAndGet();
    }

    public void recordFrame(int malformed)
    {
        framesReceived.incrementAndGet();
        malformedSegments.addAndGet(malformed);
    }

    public void recordConnectionAttempt()
    {
        connectionAttempts.incrementAndGet();
    }

    public void recordOpen()
    {
        successfulOpens.incrementAndGet();
    }
}
