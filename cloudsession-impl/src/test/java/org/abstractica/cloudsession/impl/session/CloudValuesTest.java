package org.abstractica.cloudsession.impl.session;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CloudValues}.
 */
class CloudValuesTest
{
    @Test
    void isNumeric_acceptsNumberForms()
    {
        assertTrue(CloudValues.isNumeric("0"));
        assertTrue(CloudValues.isNumeric("42"));
        assertTrue(CloudValues.isNumeric("-17"));
        assertTrue(CloudValues.isNumeric("+3.5"));
        assertTrue(CloudValues.isNumeric(".5"));
        assertTrue(CloudValues.isNumeric("5."));
        assertTrue(CloudValues.isNumeric("1e10"));
        assertTrue(CloudValues.isNumeric("2.5E-3"));
        assertTrue(CloudValues.isNumeric("Infinity"));
        assertTrue(CloudValues.isNumeric("-Infinity"));
        assertTrue(CloudValues.isNumeric("0x1F"));
        assertTrue(CloudValues.isNumeric("0o17"));
        assertTrue(CloudValues.isNumeric("0b101"));
        assertTrue(CloudValues.isNumeric("0001"));
    }

    @Test
    void isNumeric_ignoresSurroundingWhitespace()
    {
        assertTrue(CloudValues.isNumeric("  12 "));
        assertTrue(CloudValues.isNumeric("\t7\n"));
        assertTrue(CloudValues.isNumeric(" 9"));
    }

    @Test
    void isNumeric_emptyCountsAsZero()
    {
        assertTrue(CloudValues.isNumeric(""));
        assertTrue(CloudValues.isNumeric("   "));
    }

    @Test
    void isNumeric_rejectsText()
    {
        assertFalse(CloudValues.isNumeric("abc"));
        assertFalse(CloudValues.isNumeric("12abc"));
        assertFalse(CloudValues.isNumeric("1 2"));
        assertFalse(CloudValues.isNumeric("NaN"));
        assertFalse(CloudValues.isNumeric("infinity"));
        assertFalse(CloudValues.isNumeric("-0x10"));
        assertFalse(CloudValues.isNumeric("0x"));
        assertFalse(CloudValues.isNumeric("."));
        assertFalse(CloudValues.isNumeric("e5"));
        assertFalse(CloudValues.isNumeric("1e"));
        assertFalse(CloudValues.isNumeric("0b2"));
    }

    @Test
    void withPrefix_addsOnlyWhenMissing()
    {
        assertEquals("☁ score", CloudValues.withPrefix("score"));
        assertEquals("☁ score", CloudValues.withPrefix("☁ score"));
        assertEquals("☁ ☁score", CloudValues.withPrefix("☁score"));
    }
}
