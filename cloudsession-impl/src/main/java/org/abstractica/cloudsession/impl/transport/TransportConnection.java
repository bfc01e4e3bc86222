package org.abstractica.cloudsession.impl.transport;

/**
 * One connection opened by a {@link Transport}.
 */
public interface TransportConnection extends AutoCloseable
{
    /**
     * Sends one text frame.
     *
     * <p>Sends are asynchronous and delivered in call order. This method is
     * thread-safe and never blocks on the network.</p>
     *
     * @param text the frame text
     * @throws IllegalStateException if the connection is not open
     */
    void send(String text);

    /**
     * Returns whether the connection is open for sending.
     *
     * @return true if open
     */
    boolean isOpen();

    /**
     * Closes the connection normally. Safe to call in any state.
     */
    @Override
    void close();
}
