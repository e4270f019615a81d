package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.models.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.spreadsheet.calc.functions.FormulaFixture.error;
import static com.spreadsheet.calc.functions.FormulaFixture.number;
import static com.spreadsheet.calc.functions.FormulaFixture.text;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the text functions.
 */
class TextFunctionsTest {

    private FormulaFixture sheet;

    @BeforeEach
    void setUp() {
        sheet = new FormulaFixture("A1", "a", "A3", "c", "B1", "1.5");
    }

    @Test
    void testJoining() {
        assertEquals(text("a1TRUE"), sheet.eval("=CONCATENATE(\"a\",1,TRUE)"));
        assertEquals(text("ac"), sheet.eval("=CONCAT(A1:A3)"));
        assertEquals(text("a-c"), sheet.eval("=TEXTJOIN(\"-\",TRUE,A1:A3)"));
        assertEquals(text("a--c"), sheet.eval("=TEXTJOIN(\"-\",FALSE,A1:A3)"));
        assertEquals(text("x1.5"), sheet.eval("=\"x\"&B1"));
    }

    @Test
    void testSubstrings() {
        assertEquals(text("he"), sheet.eval("=LEFT(\"hello\",2)"));
        assertEquals(text("o"), sheet.eval("=RIGHT(\"hello\")"));
        assertEquals(text("ell"), sheet.eval("=MID(\"hello\",2,3)"));
        assertEquals(text(""), sheet.eval("=MID(\"hello\",9,3)"));
        assertEquals(error(ErrorCode.VALUE), sheet.eval("=LEFT(\"hello\",-1)"));
        assertEquals(number("5"), sheet.eval("=LEN(\"hello\")"));
    }

    @Test
    void testCaseAndSpacing() {
        assertEquals(text("a b"), sheet.eval("=TRIM(\"  a   b \")"));
        assertEquals(text("HELLO"), sheet.eval("=UPPER(\"hello\")"));
        assertEquals(text("hello"), sheet.eval("=LOWER(\"HeLLo\")"));
        assertEquals(text("Hello World"), sheet.eval("=PROPER(\"hello WORLD\")"));
        assertEquals(text("ababab"), sheet.eval("=REPT(\"ab\",3)"));
    }

    @Test
    void testReplacing() {
        assertEquals(text("a+b+c"), sheet.eval("=SUBSTITUTE(\"a-b-c\",\"-\",\"+\")"));
        assertEquals(text("a-b+c"), sheet.eval("=SUBSTITUTE(\"a-b-c\",\"-\",\"+\",2)"));
        assertEquals(text("aXYd"), sheet.eval("=REPLACE(\"abcd\",2,2,\"XY\")"));
    }

    /**
     * FIND is case-sensitive; SEARCH is not and takes wildcards.
     */
    @Test
    void testSearching() {
        assertEquals(number("3"), sheet.eval("=FIND(\"l\",\"hello\")"));
        assertEquals(error(ErrorCode.VALUE), sheet.eval("=FIND(\"L\",\"hello\")"));
        assertEquals(number("3"), sheet.eval("=SEARCH(\"L*o\",\"hello\")"));
        assertEquals(number("4"), sheet.eval("=SEARCH(\"l\",\"hello\",4)"));
        assertEquals(sheet.eval("=FALSE"), sheet.eval("=EXACT(\"a\",\"A\")"));
    }

    @Test
    void testConversions() {
        assertEquals(number("12.5"), sheet.eval("=VALUE(\"12.5\")"));
        assertEquals(error(ErrorCode.VALUE), sheet.eval("=VALUE(\"abc\")"));
        assertEquals(text("1,234.50"), sheet.eval("=TEXT(1234.5,\"#,##0.00\")"));
        assertEquals(text("13%"), sheet.eval("=TEXT(0.125,\"0%\")"));
    }
}
