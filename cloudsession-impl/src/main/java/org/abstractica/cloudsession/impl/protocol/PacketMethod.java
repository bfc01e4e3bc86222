package org.abstractica.cloudsession.impl.protocol;

/**
 * Packet methods as named in the wire protocol.
 */
public enum PacketMethod
{
    HANDSHAKE("handshake"),
    SET("set");

    private final String wireName;

    PacketMethod(String wireName)
    {
        this.wireName = wireName;
    }

    /**
     * Returns the value of the {@code method} field for this packet method.
     *
     * @return the wire name
     */
    public String getWireName()
    {
        return wireName;
    }

    /**
     * Looks up a packet method by its wire name.
     *
     * @param wireName the {@code method} field value
     * @return the packet method
     * @throws PacketDecodingException if the name is unknown
     */
    public static PacketMethod fromWireName(String wireName)
    {
        for (PacketMethod method : values())
        {
            if (method.wireName.equals(wireName))
            {
                return method;
            }
        }
        throw new PacketDecodingException("Unknown packet method: " + wireName);
    }
}
