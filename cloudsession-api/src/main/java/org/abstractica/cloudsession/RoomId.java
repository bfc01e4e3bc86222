package org.abstractica.cloudsession;

import java.util.Objects;

/**
 * Identifies the project whose cloud variables a session shares.
 *
 * <p>Project ids are usually numeric but may be arbitrary strings. The
 * form used to create the id is kept, so a numeric id goes on the wire as
 * a JSON number and a textual id as a JSON string. A numeric id must fit
 * in a {@code long}.</p>
 *
 * @param value   the id as text
 * @param numeric whether the id was created from a number
 */
public record RoomId(String value, boolean numeric)
{
    public RoomId
    {
        Objects.requireNonNull(value, "value");
        if (value.isEmpty())
        {
            throw new IllegalArgumentException("Room id must not be empty");
        }
        if (numeric)
        {
            try
            {
                Long.parseLong(value);
            }
            catch (NumberFormatException e)
            {
                throw new IllegalArgumentException("Numeric room id is not a number: " + value, e);
            }
        }
    }

    /**
     * Creates a numeric room id.
     *
     * @param projectId the project number
     * @return the room id
     */
    public static RoomId of(long projectId)
    {
        return new RoomId(Long.toString(projectId), true);
    }

    /**
     * Creates a textual room id.
     *
     * @param projectId the project id
     * @return the room id
     */
    public static RoomId of(String projectId)
    {
        return new RoomId(projectId, false);
    }

    /**
     * Returns the id as a number.
     *
     * @return the numeric id
     * @throws IllegalStateException if the id is textual
     */
    public long asLong()
    {
        if (!numeric)
        {
            throw new IllegalStateException("Room id is not numeric: " + value);
        }
        return Long.parseLong(value);
    }

    @Override
    public String toString()
    {
        return value;
    }
}
