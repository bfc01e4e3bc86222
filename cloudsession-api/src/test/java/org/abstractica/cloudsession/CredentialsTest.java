package org.abstractica.cloudsession;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Credentials}.
 */
class CredentialsTest
{
    @Test
    void toString_masksSessionId()
    {
        Credentials credentials = new Credentials("alice", "very-secret-token");

        assertFalse(credentials.toString().contains("very-secret-token"));
        assertTrue(credentials.toString().contains("alice"));
    }

    @Test
    void emptySessionIdAllowed()
    {
        assertEquals("", new Credentials("alice", "").sessionId());
    }

    @Test
    void blankUsernameRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> new Credentials(" ", "x"));
        assertThrows(NullPointerException.class, () -> new Credentials(null, "x"));
        assertThrows(NullPointerException.class, () -> new Credentials("alice", null));
    }
}
