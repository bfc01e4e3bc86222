package org.abstractica.cloudsession.impl.protocol;

/**
 * Thrown when an inbound segment is not a valid packet.
 */
public class PacketDecodingException extends RuntimeException
{
    public PacketDecodingException(String message)
    {
        super(message);
    }

    public PacketDecodingException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
