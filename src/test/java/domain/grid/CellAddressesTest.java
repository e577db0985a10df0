package domain.grid;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellAddressesTest {

    @Test
    void sheetOf_stripsQuotesAndUnescapes() {
        assertEquals("My Sheet", CellAddresses.sheetOf("'My Sheet'!$A$1:$C$4"));
        assertEquals("It's", CellAddresses.sheetOf("'It''s'!A1"));
        assertEquals("Data", CellAddresses.sheetOf("=Data!$B$2"));
        assertNull(CellAddresses.sheetOf("$A$1:$B$2"));
    }

    @Test
    void areaOf_parsesSingleContiguousArea() {
        assertEquals(new CellArea(2, 2, 5, 4), CellAddresses.areaOf("Sheet1!$B$2:$D$5"));
        assertEquals(new CellArea(3, 1, 3, 1), CellAddresses.areaOf("'A b'!A3"));
        assertEquals(new CellArea(1, 27, 10, 28), CellAddresses.areaOf("X!AB10:AA1"));

        assertNull(CellAddresses.areaOf("Sheet1!A1:B2,C3:D4"));
        assertNull(CellAddresses.areaOf("Sheet1!#REF!"));
        assertNull(CellAddresses.areaOf("Sheet1!A0"));
    }

    @Test
    void columnLetters_roundTrip() {
        assertEquals("A", CellAddresses.columnLetters(1));
        assertEquals("Z", CellAddresses.columnLetters(26));
        assertEquals("AA", CellAddresses.columnLetters(27));
        assertEquals("XFD", CellAddresses.columnLetters(16384));
        assertEquals(28, CellAddresses.columnIndex("ab"));
        assertThrows(IllegalArgumentException.class, () -> CellAddresses.columnLetters(0));
    }

    @Test
    void qualify_quotesSheetNamesWhenNeeded() {
        assertEquals("'My Sheet'!$A$1:$C$4", CellAddresses.qualify("My Sheet", CellArea.of(1, 1, 4, 3)));
        assertEquals("Data!$B$2", CellAddresses.qualify("Data", CellArea.of(2, 2, 1, 1)));
        assertEquals("'O''Brien'!$A$1", CellAddresses.qualify("O'Brien", CellArea.of(1, 1, 1, 1)));
    }

    @Test
    void namedRegion_parseAndAddress() {
        NamedRegion r = NamedRegion.parse("Grid", "'My Sheet'!$A$1:$C$4");

        assertNotNull(r);
        assertEquals("My Sheet", r.getSheet());
        assertEquals(4, r.getArea().rows());
        assertEquals(3, r.getArea().columns());
        assertEquals("'My Sheet'!$A$1:$C$4", r.getAddress());
        assertNull(NamedRegion.parse("Bad", "A1:B2"));
    }
}
