package domain.grid;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellValuesTest {

    enum Color { None, Red, Green }

    @Test
    void coerce_numbers() {
        assertEquals(12, CellValues.coerce("12", int.class));
        assertEquals(12, CellValues.coerce(12.0, Integer.class));
        assertEquals(3, CellValues.coerce(2.6, int.class));
        assertEquals(2, CellValues.coerce(2.5, int.class));
        assertEquals(7L, CellValues.coerce(" 7 ", long.class));
        assertEquals(1.5d, CellValues.coerce("1.5", double.class));
        assertEquals(1, CellValues.coerce(Boolean.TRUE, int.class));
    }

    @Test
    void coerce_unconvertibleYieldsNullAndDefault() {
        assertNull(CellValues.coerce("abc", int.class));
        assertNull(CellValues.coerce(null, String.class));
        assertNull(CellValues.coerce(1e12, int.class));

        assertEquals(0, CellValues.coerceOrDefault("abc", int.class));
        assertEquals(0d, CellValues.coerceOrDefault(null, double.class));
        assertEquals(false, CellValues.coerceOrDefault("maybe", boolean.class));
        assertNull(CellValues.coerceOrDefault(null, String.class));
    }

    @Test
    void coerce_strings() {
        assertEquals("3", CellValues.coerce(3.0, String.class));
        assertEquals("3.25", CellValues.coerce(3.25, String.class));
        assertEquals("true", CellValues.coerce(Boolean.TRUE, String.class));
        assertEquals(" x ", CellValues.coerce(" x ", String.class));
    }

    @Test
    void coerce_booleans() {
        assertEquals(true, CellValues.coerce("TRUE", boolean.class));
        assertEquals(false, CellValues.coerce(0.0, Boolean.class));
        assertNull(CellValues.coerce("yes", Boolean.class));
    }

    @Test
    void parseEnum_exactMemberNameAfterTrim() {
        assertEquals(Color.Red, CellValues.parseEnum(" Red ", Color.class));
        assertNull(CellValues.parseEnum("red", Color.class));
        assertNull(CellValues.parseEnum("", Color.class));
        assertEquals(Color.None, CellValues.zeroMember(Color.class));
    }

    @Test
    void toRaw_normalizesWrites() {
        assertEquals(5.0, CellValues.toRaw(5));
        assertEquals(2.5, CellValues.toRaw(2.5f));
        assertEquals(Boolean.TRUE, CellValues.toRaw(true));
        assertEquals("Green", CellValues.toRaw(Color.Green));
        assertEquals("txt", CellValues.toRaw(new StringBuilder("txt")));
        assertNull(CellValues.toRaw(null));
    }
}
