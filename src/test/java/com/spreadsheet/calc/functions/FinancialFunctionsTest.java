package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.models.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.spreadsheet.calc.functions.FormulaFixture.error;
import static com.spreadsheet.calc.functions.FormulaFixture.number;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the time-value-of-money functions.
 */
class FinancialFunctionsTest {

    private FormulaFixture sheet;

    @BeforeEach
    void setUp() {
        sheet = new FormulaFixture(
                "A1", "-100",
                "A2", "110",
                "B1", "-1000",
                "B2", "300",
                "B3", "400",
                "B4", "500");
    }

    @Test
    void testPayment() {
        assertEquals(number("-57.62"), sheet.eval("=ROUND(PMT(0.1,2,100),2)"));
        assertEquals(number("-50"), sheet.eval("=PMT(0,2,100)"));
        assertEquals(number("-52.38"), sheet.eval("=ROUND(PMT(0.1,2,100,0,1),2)"));
        assertEquals(number("-536.82"), sheet.eval("=ROUND(PMT(0.05/12,360,100000),2)"));
    }

    @Test
    void testPresentAndFutureValue() {
        assertEquals(number("205"), sheet.eval("=ROUND(FV(0.05,2,-100),6)"));
        assertEquals(number("-100"), sheet.eval("=ROUND(PV(0.1,2,0,121),6)"));
        assertEquals(number("-200"), sheet.eval("=PV(0,2,100)"));
    }

    @Test
    void testPeriodsAndRate() {
        assertEquals(number("2"), sheet.eval("=ROUND(NPER(0.1,0,-100,121),6)"));
        assertEquals(number("4"), sheet.eval("=NPER(0,-25,100)"));
        assertEquals(number("0.1"), sheet.eval("=ROUND(RATE(2,0,-100,121),6)"));
    }

    @Test
    void testCashFlows() {
        assertEquals(number("100"), sheet.eval("=ROUND(NPV(0.1,110),6)"));
        assertEquals(number("0.1"), sheet.eval("=ROUND(IRR(A1:A2),6)"));
        assertEquals(number("0.088963"), sheet.eval("=ROUND(IRR(B1:B4),6)"));
        assertEquals(error(ErrorCode.NUM), sheet.eval("=IRR(B2:B4)"));
    }
}
