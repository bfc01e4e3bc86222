package org.abstractica.cloudsession;

import java.util.OptionalLong;

/**
 * Decides how long a session waits before reconnecting after a close.
 */
@FunctionalInterface
public interface ReconnectPolicy
{
    /**
     * Returns the delay before the next connection attempt.
     *
     * <p>The attempt count is 1 right after a successful open and grows by
     * one with every reconnect that has not yet reached the open state.
     * It is 0 if the session has never connected.</p>
     *
     * @param attempts the session's current attempt count
     * @return delay in milliseconds, or empty to stop reconnecting
     */
    OptionalLong nextDelayMs(int attempts);

    /**
     * Returns a policy that never reconnects.
     *
     * @return the policy
     */
    static ReconnectPolicy never()
    {
        return attempts -> OptionalLong.empty();
    }

    /**
     * Returns a policy that always waits the same delay.
     *
     * @param delayMs delay in milliseconds
     * @return the policy
     */
    static ReconnectPolicy fixedDelay(long delayMs)
    {
        if (delayMs < 0)
        {
            throw new IllegalArgumentException("delayMs must not be negative: " + delayMs);
        }
        return attempts -> OptionalLong.of(delayMs);
    }
}
