package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.models.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.spreadsheet.calc.functions.FormulaFixture.error;
import static com.spreadsheet.calc.functions.FormulaFixture.number;
import static com.spreadsheet.calc.functions.FormulaFixture.text;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the lookup and reference functions over a small table.
 */
class LookupFunctionsTest {

    private FormulaFixture sheet;

    @BeforeEach
    void setUp() {
        sheet = new FormulaFixture(
                "A1", "1", "B1", "one",
                "A2", "2", "B2", "two",
                "A3", "3", "B3", "three",
                "D1", "apple", "E1", "pear", "F1", "plum",
                "D2", "10", "E2", "20", "F2", "30");
    }

    @Test
    void testVlookup() {
        assertEquals(text("two"), sheet.eval("=VLOOKUP(2,A1:B3,2,FALSE)"));
        assertEquals(text("two"), sheet.eval("=VLOOKUP(2.5,A1:B3,2)"));
        assertEquals(error(ErrorCode.NA), sheet.eval("=VLOOKUP(9,A1:B3,2,FALSE)"));
        assertEquals(error(ErrorCode.NA), sheet.eval("=VLOOKUP(0,A1:B3,2,TRUE)"));
        assertEquals(error(ErrorCode.REF), sheet.eval("=VLOOKUP(2,A1:B3,3,FALSE)"));
        assertEquals(error(ErrorCode.VALUE), sheet.eval("=VLOOKUP(2,A1:B3,0,FALSE)"));
    }

    @Test
    void testHlookup() {
        assertEquals(number("20"), sheet.eval("=HLOOKUP(\"PEAR\",D1:F2,2,FALSE)"));
        assertEquals(number("30"), sheet.eval("=HLOOKUP(\"p*m\",D1:F2,2,FALSE)"));
    }

    @Test
    void testIndexAndMatch() {
        assertEquals(text("three"), sheet.eval("=INDEX(A1:B3,3,2)"));
        assertEquals(number("3"), sheet.eval("=MATCH(3,A1:A3,0)"));
        assertEquals(number("2"), sheet.eval("=MATCH(2.7,A1:A3)"));
        assertEquals(error(ErrorCode.NA), sheet.eval("=MATCH(7,A1:A3,0)"));
        assertEquals(text("two"), sheet.eval("=INDEX(B1:B3,MATCH(2,A1:A3,0))"));
    }

    @Test
    void testXlookup() {
        assertEquals(text("three"), sheet.eval("=XLOOKUP(3,A1:A3,B1:B3)"));
        assertEquals(text("none"), sheet.eval("=XLOOKUP(7,A1:A3,B1:B3,\"none\")"));
        assertEquals(error(ErrorCode.NA), sheet.eval("=XLOOKUP(7,A1:A3,B1:B3)"));
        assertEquals(text("two"), sheet.eval("=XLOOKUP(2.5,A1:A3,B1:B3,,-1)"));
        assertEquals(text("three"), sheet.eval("=XLOOKUP(2.5,A1:A3,B1:B3,,1)"));
        assertEquals(text("two"), sheet.eval("=XLOOKUP(\"t*\",B1:B3,B1:B3,,2)"));
        assertEquals(text("three"), sheet.eval("=XLOOKUP(\"t*\",B1:B3,B1:B3,,2,-1)"));
    }

    @Test
    void testChooseRowsColumns() {
        assertEquals(text("b"), sheet.eval("=CHOOSE(2,\"a\",\"b\")"));
        assertEquals(error(ErrorCode.VALUE), sheet.eval("=CHOOSE(3,\"a\",\"b\")"));
        assertEquals(number("3"), sheet.eval("=ROWS(A1:B3)"));
        assertEquals(number("2"), sheet.eval("=COLUMNS(A1:B3)"));
        assertEquals(number("7"), sheet.eval("=ROW(C7)"));
        assertEquals(number("1000"), sheet.eval("=ROW()"));
    }
}
