package org.abstractica.cloudsession.impl.session;

import org.abstractica.cloudsession.impl.store.VariableStore;

/**
 * Callback interface from connection manager to session.
 *
 * <p>Invoked while the session lock is held, in the order the underlying
 * state changes happened.</p>
 */
public interface SessionCallback
{
    /**
     * A connection opened; the handshake and queued packets have been sent.
     */
    void onOpen();

    /**
     * The connection closed.
     *
     * @param code   close status code
     * @param reason close reason
     */
    void onClose(int code, String reason);

    /**
     * The transport reported an error.
     *
     * @param cause the failure
     */
    void onError(Throwable cause);

    /**
     * The server set a variable.
     *
     * @param name   full variable name
     * @param value  new value
     * @param result whether the variable was created or updated
     */
    void onVariable(String name, String value, VariableStore.ApplyResult result);

    /**
     * The first frame of variable state has been applied.
     */
    void onSetup();
}
