package org.abstractica.cloudsession.impl.protocol;

import org.abstractica.cloudsession.RoomId;

/**
 * Announces the account and room a connection belongs to. Sent first on
 * every new connection.
 *
 * <pre>
 * {"method":"handshake","user":"alice","project_id":123}
 * </pre>
 *
 * @param user   the account name
 * @param roomId the project room
 */
public record Handshake(
        String user,
        RoomId roomId
) implements Packet
{
    @Override
    public PacketMethod method()
    {
        return PacketMethod.HANDSHAKE;
    }
}
