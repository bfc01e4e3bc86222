package org.abstractica.cloudsession;

/**
 * Handle for a registered event listener.
 */
@FunctionalInterface
public interface Subscription
{
    /**
     * Unregisters the listener. Calling this more than once has no effect.
     */
    void cancel();
}
