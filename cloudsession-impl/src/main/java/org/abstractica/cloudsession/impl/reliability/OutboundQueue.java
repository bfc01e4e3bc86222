package org.abstractica.cloudsession.impl.reliability;

import org.abstractica.cloudsession.impl.protocol.Packet;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Holds packets produced while no connection is open.
 *
 * <p>Packets are kept in the order they were queued and handed back in
 * that order when the next connection opens. The queue is unbounded;
 * nothing written while offline is dropped.</p>
 *
 * <p>Not thread-safe. The owning session confines access to its lock.</p>
 */
public class OutboundQueue
{
    private final Deque<Packet> pending;

    /**
     * Creates an empty queue.
     */
    public OutboundQueue()
    {
        this.pending = new ArrayDeque<>();
    }

    /**
     * Appends a packet.
     *
     * @param packet the packet
     */
    public void enqueue(Packet packet)
    {
        pending.addLast(Objects.requireNonNull(packet, "packet"));
    }

    /**
     * Removes and returns every queued packet.
     *
     * @return the packets in FIFO order; the queue is empty afterwards
     */
    public List<Packet> drain()
    {
        List<Packet> drained = new ArrayList<>(pending);
        pending.clear();
        return drained;
    }

    /**
     * Returns the number of queued packets.
     *
     * @return queued packet count
     */
    public int size()
    {
        return pending.size();
    }

    /**
     * Returns whether the queue is empty.
     *
     * @return true if no packets are queued
     */
    public boolean isEmpty()
    {
        return pending.isEmpty();
    }
}
