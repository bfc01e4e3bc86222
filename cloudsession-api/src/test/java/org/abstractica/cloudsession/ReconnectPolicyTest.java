package org.abstractica.cloudsession;

import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the {@link ReconnectPolicy} factory methods.
 */
class ReconnectPolicyTest
{
    @Test
    void never_givesUpImmediately()
    {
        assertTrue(ReconnectPolicy.never().nextDelayMs(0).isEmpty());
        assertTrue(ReconnectPolicy.never().nextDelayMs(7).isEmpty());
    }

    @Test
    void fixedDelay_ignoresAttempts()
    {
        ReconnectPolicy policy = ReconnectPolicy.fixedDelay(2500);

        assertEquals(OptionalLong.of(2500), policy.nextDelayMs(1));
        assertEquals(OptionalLong.of(2500), policy.nextDelayMs(40));
    }

    @Test
    void fixedDelay_rejectsNegative()
    {
        assertThrows(IllegalArgumentException.class, () -> ReconnectPolicy.fixedDelay(-1));
    }
}
