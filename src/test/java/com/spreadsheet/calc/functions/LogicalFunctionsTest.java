package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.spreadsheet.calc.functions.FormulaFixture.error;
import static com.spreadsheet.calc.functions.FormulaFixture.number;
import static com.spreadsheet.calc.functions.FormulaFixture.text;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the logical and information functions.
 */
class LogicalFunctionsTest {

    private FormulaFixture sheet;

    @BeforeEach
    void setUp() {
        sheet = new FormulaFixture("A1", "5", "A2", "text", "A3", "=1/0", "A4", "#N/A");
    }

    /**
     * IF only evaluates the branch it takes.
     */
    @Test
    void testIf() {
        assertEquals(number("1"), sheet.eval("=IF(TRUE,1,1/0)"));
        assertEquals(CellValue.FALSE, sheet.eval("=IF(A1>10,1)"));
        assertEquals(text("big"), sheet.eval("=IF(A1>=5,\"big\",\"small\")"));
        assertEquals(error(ErrorCode.DIV_ZERO), sheet.eval("=IF(A3,1,2)"));
    }

    @Test
    void testIfsAndSwitch() {
        assertEquals(text("mid"), sheet.eval("=IFS(A1>10,\"high\",A1>3,\"mid\")"));
        assertEquals(error(ErrorCode.NA), sheet.eval("=IFS(A1>10,\"high\")"));
        assertEquals(text("b"), sheet.eval("=SWITCH(2,1,\"a\",2,\"b\")"));
        assertEquals(text("other"), sheet.eval("=SWITCH(9,1,\"a\",2,\"b\",\"other\")"));
        assertEquals(error(ErrorCode.NA), sheet.eval("=SWITCH(9,1,\"a\")"));
    }

    @Test
    void testErrorTraps() {
        assertEquals(number("0"), sheet.eval("=IFERROR(A3,0)"));
        assertEquals(number("5"), sheet.eval("=IFERROR(A1,0)"));
        assertEquals(text("missing"), sheet.eval("=IFNA(A4,\"missing\")"));
        assertEquals(error(ErrorCode.DIV_ZERO), sheet.eval("=IFNA(A3,\"missing\")"));
    }

    /**
     * AND/OR/XOR ignore text in ranges but fail when nothing logical is left.
     */
    @Test
    void testConnectives() {
        assertEquals(CellValue.TRUE, sheet.eval("=AND(TRUE,1,A1:A2)"));
        assertEquals(CellValue.FALSE, sheet.eval("=AND(TRUE,0)"));
        assertEquals(CellValue.TRUE, sheet.eval("=OR(FALSE,A1)"));
        assertEquals(CellValue.FALSE, sheet.eval("=XOR(TRUE,TRUE)"));
        assertEquals(CellValue.TRUE, sheet.eval("=XOR(TRUE,FALSE,FALSE)"));
        assertEquals(error(ErrorCode.VALUE), sheet.eval("=OR(A2)"));
        assertEquals(CellValue.TRUE, sheet.eval("=NOT(0)"));
        assertEquals(CellValue.TRUE, sheet.eval("=TRUE()"));
    }

    @Test
    void testInformation() {
        assertEquals(CellValue.TRUE, sheet.eval("=ISBLANK(Z9)"));
        assertEquals(CellValue.FALSE, sheet.eval("=ISNUMBER(\"1\")"));
        assertEquals(CellValue.TRUE, sheet.eval("=ISTEXT(A2)"));
        assertEquals(CellValue.TRUE, sheet.eval("=ISNA(A4)"));
        assertEquals(CellValue.FALSE, sheet.eval("=ISNA(A3)"));
        assertEquals(CellValue.TRUE, sheet.eval("=ISERROR(A3)"));
        assertEquals(number("1"), sheet.eval("=N(TRUE)"));
        assertEquals(text(""), sheet.eval("=T(A1)"));
        assertEquals(number("16"), sheet.eval("=TYPE(A3)"));
        assertEquals(number("4"), sheet.eval("=TYPE(FALSE)"));
        assertEquals(error(ErrorCode.NA), sheet.eval("=NA()"));
    }
}
