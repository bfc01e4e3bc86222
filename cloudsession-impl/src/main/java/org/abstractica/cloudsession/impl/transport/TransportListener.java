package org.abstractica.cloudsession.impl.transport;

/**
 * Receives the lifecycle callbacks of one {@link TransportConnection}.
 *
 * <p>Callbacks may arrive on a transport I/O thread and must not block.
 * {@link #onClose} is reported at most once and nothing follows it.</p>
 */
public interface TransportListener
{
    /**
     * The connection is open and ready for sending.
     *
     * @param connection the opened connection
     */
    void onOpen(TransportConnection connection);

    /**
     * A complete text frame arrived.
     *
     * @param frame the frame text
     */
    void onMessage(String frame);

    /**
     * The connection closed, normally or not.
     *
     * @param code   close status code
     * @param reason close reason, possibly empty
     */
    void onClose(int code, String reason);

    /**
     * The connection failed. A call to {@link #onClose} follows.
     *
     * @param error the failure
     */
    void onError(Throwable error);
}
