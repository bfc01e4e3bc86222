package org.abstractica.cloudsession;

import java.util.Objects;

/**
 * Account credentials obtained from a prior login.
 *
 * <p>The session id is only ever placed in connection headers; it is
 * masked in {@link #toString()}.</p>
 *
 * @param username  the account name announced in handshake and set packets
 * @param sessionId the opaque session token
 */
public record Credentials(String username, String sessionId)
{
    public Credentials
    {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(sessionId, "sessionId");
        if (username.isBlank())
        {
            throw new IllegalArgumentException("username must not be blank");
        }
    }

    @Override
    public String toString()
    {
        return "Credentials[username=" + username + ", sessionId=***]";
    }
}
