package com.schemalens.core.catalog;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class RawRowTest {

    @Test
    void labelsAreCaseInsensitive() {
        RawRow row = RawRow.of("TABLE_NAME", "orders");
        assertEquals("orders", row.string("table_name"));
        assertTrue(row.has("Table_Name"));
    }

    @Test
    void flagsAcceptCatalogSpellings() {
        RawRow row = RawRow.of("a", "YES", "b", "N", "c", 1, "d", "t", "e", Boolean.FALSE);
        assertTrue(row.bool("a"));
        assertFalse(row.bool("b"));
        assertTrue(row.bool("c"));
        assertTrue(row.bool("d"));
        assertFalse(row.bool("e"));
        assertNull(row.bool("missing"));
        assertFalse(row.flag("missing"));
    }

    @Test
    void numbersStayExact() {
        RawRow row = RawRow.of("max", new BigDecimal("9999999999999999999999999999"), "scale", "2");
        assertEquals(new BigInteger("9999999999999999999999999999"), row.bigInteger("max"));
        assertEquals(2, row.integer("scale"));
        assertEquals("9999999999999999999999999999", row.string("max"));
    }

    @Test
    void outOfRangeNumbersAreRejectedNotWrapped() {
        RawRow row = RawRow.of("ordinal", 4_294_967_297L, "row_count", new BigInteger("18446744073709551617"),
                "scale", "2.5");
        IllegalArgumentException narrow = assertThrows(IllegalArgumentException.class, () -> row.integer("ordinal"));
        assertTrue(narrow.getMessage().contains("ordinal"));
        assertEquals(4_294_967_297L, row.longValue("ordinal"));
        assertThrows(IllegalArgumentException.class, () -> row.longValue("row_count"));
        assertThrows(IllegalArgumentException.class, () -> row.integer("scale"));
    }

    @Test
    void textTrimsBlankToNull() {
        RawRow row = RawRow.of("comment", "   ", "name", " x ");
        assertNull(row.text("comment"));
        assertEquals("x", row.text("name"));
    }

    @Test
    void rowKindIsUpperCased() {
        assertEquals("PARAMETER", RawRow.of("row_kind", "parameter").kind());
        assertEquals("", RawRow.of("x", 1).kind());
    }
}
