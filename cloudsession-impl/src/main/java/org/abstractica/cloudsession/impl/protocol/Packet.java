package org.abstractica.cloudsession.impl.protocol;

import org.abstractica.cloudsession.RoomId;

/**
 * A wire protocol packet.
 *
 * <p>Wire format: one JSON object per line,</p>
 * <pre>
 * {"method": "...", "user": "...", "project_id": ..., "name": "...", "value": "..."}\n
 * </pre>
 * <p>Absent fields are omitted. Packets from the server usually carry
 * only {@code method}, {@code name} and {@code value}, so {@link #user()}
 * and {@link #roomId()} may be null on decoded packets.</p>
 */
public sealed interface Packet permits Handshake, SetVariable
{
    /**
     * Returns the packet method.
     *
     * @return the method
     */
    PacketMethod method();

    /**
     * Returns the account name, or null if absent.
     *
     * @return the user
     */
    String user();

    /**
     * Returns the project room, or null if absent.
     *
     * @return the room id
     */
    RoomId roomId();
}
