package org.abstractica.cloudsession.impl.session;

import org.abstractica.cloudsession.CloudSession;

import java.util.regex.Pattern;

/**
 * Name and value rules for cloud variables.
 */
public final class CloudValues
{
    private static final Pattern DECIMAL = Pattern.compile(
            "[+-]?(?:Infinity|(?:[0-9]+\\.?[0-9]*|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?)");

    private static final Pattern NON_DECIMAL = Pattern.compile(
            "0[xX][0-9a-fA-F]+|0[oO][0-7]+|0[bB][01]+");

    private CloudValues() {}

    /**
     * Returns whether a value is accepted as a number by the cloud servers.
     *
     * <p>Follows the browser's string-to-number conversion: surrounding
     * whitespace is ignored, an empty string counts as zero, and decimal,
     * exponent, {@code Infinity}, hex, octal and binary forms are numbers.</p>
     *
     * @param value the value
     * @return true if numeric
     */
    public static boolean isNumeric(String value)
    {
        String trimmed = trimWhitespace(value);
        if (trimmed.isEmpty())
        {
            return true;
        }
        return DECIMAL.matcher(trimmed).matches() || NON_DECIMAL.matcher(trimmed).matches();
    }

    /**
     * Adds the cloud prefix to a name that lacks it.
     *
     * @param name the name
     * @return the prefixed name
     */
    public static String withPrefix(String name)
    {
        return name.startsWith(CloudSession.CLOUD_PREFIX) ? name : CloudSession.CLOUD_PREFIX + name;
    }

    private static String trimWhitespace(String value)
    {
        int start = 0;
        int end = value.length();
        while (start < end && isWhitespace(value.charAt(start)))
        {
            start++;
        }
        while (end > start && isWhitespace(value.charAt(end - 1)))
        {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isWhitespace(char c)
    {
        switch (c)
        {
            case '\t':
            case '\n':
            case '\u000B':
            case '\f':
            case '\r':
            case ' ':
            case '\u00A0':
            case '\u2028':
            case '\u2029':
            case '\uFEFF':
                return true;
            default:
                return Character.getType(c) == Character.SPACE_SEPARATOR;
        }
    }
}
