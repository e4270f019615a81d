package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.models.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.spreadsheet.calc.functions.FormulaFixture.error;
import static com.spreadsheet.calc.functions.FormulaFixture.number;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the statistical functions.
 */
class StatisticalFunctionsTest {

    private FormulaFixture sheet;

    @BeforeEach
    void setUp() {
        sheet = new FormulaFixture(
                "A1", "1",
                "A2", "2",
                "A3", "3",
                "A4", "4",
                "A5", "x",
                "B1", "east",
                "B2", "west",
                "B3", "east",
                "B4", "west");
    }

    @Test
    void testAverageMaxMin() {
        assertEquals(number("2.5"), sheet.eval("=AVERAGE(A1:A5)"));
        assertEquals(number("4"), sheet.eval("=MAX(A1:A5)"));
        assertEquals(number("1"), sheet.eval("=MIN(A1:A5)"));
        assertEquals(number("0"), sheet.eval("=MAX(C1:C3)"));
        assertEquals(error(ErrorCode.DIV_ZERO), sheet.eval("=AVERAGE(C1:C3)"));
    }

    /**
     * COUNT counts numbers, COUNTA anything non-blank, COUNTBLANK the rest.
     */
    @Test
    void testCounts() {
        assertEquals(number("4"), sheet.eval("=COUNT(A1:A5)"));
        assertEquals(number("5"), sheet.eval("=COUNTA(A1:A5)"));
        assertEquals(number("2"), sheet.eval("=COUNT(1,\"2\",\"x\")"));
        assertEquals(number("3"), sheet.eval("=COUNTBLANK(A1:A8)"));
    }

    @Test
    void testConditionalCounts() {
        assertEquals(number("2"), sheet.eval("=COUNTIF(A1:A5,\">2\")"));
        assertEquals(number("2"), sheet.eval("=COUNTIF(B1:B4,\"EAST\")"));
        assertEquals(number("2"), sheet.eval("=COUNTIF(B1:B4,\"w*\")"));
        assertEquals(number("1"), sheet.eval("=COUNTIFS(A1:A4,\">1\",B1:B4,\"east\")"));
        assertEquals(number("2"), sheet.eval("=AVERAGEIF(B1:B4,\"east\",A1:A4)"));
        assertEquals(number("3"), sheet.eval("=AVERAGEIFS(A1:A4,B1:B4,\"west\")"));
        assertEquals(number("4"), sheet.eval("=MAXIFS(A1:A4,B1:B4,\"west\")"));
        assertEquals(number("1"), sheet.eval("=MINIFS(A1:A4,B1:B4,\"east\")"));
        assertEquals(error(ErrorCode.VALUE), sheet.eval("=COUNTIFS(A1:A4,\">1\",B1:B3,\"east\")"));
    }

    @Test
    void testOrderStatistics() {
        assertEquals(number("2.5"), sheet.eval("=MEDIAN(A1:A5)"));
        assertEquals(number("3"), sheet.eval("=MEDIAN(1,3,5)"));
        assertEquals(error(ErrorCode.NUM), sheet.eval("=MEDIAN(C1:C2)"));
        assertEquals(number("4"), sheet.eval("=LARGE(A1:A4,1)"));
        assertEquals(number("2"), sheet.eval("=SMALL(A1:A4,2)"));
        assertEquals(error(ErrorCode.NUM), sheet.eval("=SMALL(A1:A4,5)"));
    }

    /**
     * Sample variance and deviation.
     */
    @Test
    void testVariance() {
        assertEquals(number("1.666667"), sheet.eval("=ROUND(VAR(A1:A4),6)"));
        assertEquals(number("1.290994"), sheet.eval("=ROUND(STDEV(A1:A4),6)"));
        assertEquals(error(ErrorCode.DIV_ZERO), sheet.eval("=VAR(5)"));
    }
}
