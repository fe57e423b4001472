package me.christianrobert.py2lua.core.tools;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class NamingConverterTest {

    @Test
    void snakeToCamel_twoSegments() {
        assertEquals("getNames", NamingConverter.snakeToCamel("get_names"));
        assertEquals("isPresent", NamingConverter.snakeToCamel("is_present"));
    }

    @Test
    void snakeToCamel_manySegments() {
        assertEquals("getBundledInputState", NamingConverter.snakeToCamel("get_bundled_input_state"));
    }

    @Test
    void snakeToCamel_noSeparatorIsUnchanged() {
        assertEquals("foo", NamingConverter.snakeToCamel("foo"));
        assertEquals("wrap", NamingConverter.snakeToCamel("wrap"));
    }

    @Test
    void snakeToCamel_idempotentWithoutSeparator() {
        String once = NamingConverter.snakeToCamel("get_names");
        assertEquals(once, NamingConverter.snakeToCamel(once));
    }

    @Test
    void snakeToCamel_restOfSegmentKeptAsWritten() {
        assertEquals("getRPMValue", NamingConverter.snakeToCamel("get_RPM_value"));
    }

    @Test
    void snakeToCamel_emptySegmentsContributeNothing() {
        assertEquals("getNames", NamingConverter.snakeToCamel("get__names"));
        assertEquals("Private", NamingConverter.snakeToCamel("_private"));
        assertEquals("trailing", NamingConverter.snakeToCamel("trailing_"));
    }

    @Test
    void snakeToCamel_emptyAndNull() {
        assertEquals("", NamingConverter.snakeToCamel(""));
        assertNull(NamingConverter.snakeToCamel(null));
    }
}
