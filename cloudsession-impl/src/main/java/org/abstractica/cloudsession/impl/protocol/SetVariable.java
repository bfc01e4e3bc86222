package org.abstractica.cloudsession.impl.protocol;

import org.abstractica.cloudsession.RoomId;

import java.util.Objects;

/**
 * Sets a cloud variable. Sent by clients to publish a write and by the
 * server to relay writes from other clients.
 *
 * <pre>
 * {"method":"set","user":"alice","project_id":123,"name":"☁ score","value":"42"}
 * </pre>
 *
 * @param user   the account name, may be null on inbound packets
 * @param roomId the project room, may be null on inbound packets
 * @param name   full variable name
 * @param value  variable value
 */
public record SetVariable(
        String user,
        RoomId roomId,
        String name,
        String value
) implements Packet
{
    public SetVariable
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    /**
     * Creates an inbound-style set packet with no user or room.
     *
     * @param name  full variable name
     * @param value variable value
     * @return the packet
     */
    public static SetVariable of(String name, String value)
    {
        return new SetVariable(null, null, name, value);
    }

    @Override
    public PacketMethod method()
    {
        return PacketMethod.SET;
    }
}
