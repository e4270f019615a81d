package com.spreadsheet.calc.validation;

import com.spreadsheet.calc.models.CalculationSettings;
import com.spreadsheet.calc.models.CellEdit;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.WorkbookImport;
import com.spreadsheet.calc.services.FormulaEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for replaying a workbook against golden values.
 */
class FormulaValidatorTest {

    private FormulaValidator validator;
    private WorkbookImport loan;

    @BeforeEach
    void setUp() {
        Map<FormulaCategory, BigDecimal> tolerances = new EnumMap<>(FormulaCategory.class);
        tolerances.put(FormulaCategory.FINANCIAL, new BigDecimal("0.01"));
        validator = new FormulaValidator(new FormulaEngine(), CalculationSettings.defaults(),
                new BigDecimal("0.000001"), tolerances);

        loan = new WorkbookImport(Collections.singletonList("Loan"), Arrays.asList(
                new CellEdit("Loan", "B1", "100000"),
                new CellEdit("Loan", "B2", "0.05"),
                new CellEdit("Loan", "B3", "360"),
                new CellEdit("Loan", "B4", "=PMT(B2/12,B3,B1)"),
                new CellEdit("Loan", "B5", "=-B4*B3-B1"),
                new CellEdit("Loan", "B6", "=IF(B4>-1000,\"Approved\",\"Rejected\")"),
                new CellEdit("Loan", "B7", "=AND(B1>0,B2<1)"),
                new CellEdit("Loan", "B8", "=B1/0"),
                new CellEdit("Loan", "B9", "=1/3")));
    }

    private List<GoldenCase> fixture() throws Exception {
        try (InputStream input = getClass().getResourceAsStream("/golden/loan-cases.json")) {
            return new GoldenCaseReader().read(input);
        }
    }

    /**
     * Every case in the fixture matches, including the financial one within
     * the category tolerance.
     */
    @Test
    void testFixturePasses() throws Exception {
        ValidationReport report = validator.validate(loan, fixture());
        assertEquals(7, report.getTotal());
        assertEquals(7, report.getPassed(), () -> report.getFailed().toString());
        assertEquals(1.0, report.getPassRate());
        assertEquals(1, report.getCategoryBreakdown().get(FormulaCategory.FINANCIAL).getPassed());
        assertEquals(2, report.getCategoryBreakdown().get(FormulaCategory.LOGICAL).getPassed());
        assertEquals(1, report.getCategoryBreakdown().get(FormulaCategory.LITERAL).getPassed());
    }

    /**
     * Mismatches are reported with the formula and the category derived from it.
     */
    @Test
    void testFailuresAreReported() {
        List<GoldenCase> cases = Arrays.asList(
                new GoldenCase("Loan", "B4", new BigDecimal("-530")),
                new GoldenCase("Loan", "B6", "approved"),
                new GoldenCase("Loan", "B8", "#N/A"),
                new GoldenCase("Nowhere", "A1", BigDecimal.ONE));

        ValidationReport report = validator.validate(loan, cases);

        assertEquals(4, report.getTotal());
        assertEquals(0, report.getPassed());
        ValidationFailure payment = report.getFailed().get(0);
        assertEquals("Loan!B4", payment.getCell());
        assertEquals("=PMT(B2/12,B3,B1)", payment.getFormula());
        assertEquals(FormulaCategory.FINANCIAL, payment.getCategory());
        assertEquals(FormulaCategory.LOGICAL, report.getFailed().get(1).getCategory());
        assertEquals(CellValue.error(ErrorCode.DIV_ZERO), report.getFailed().get(2).getActual());
        assertEquals(CellValue.error(ErrorCode.REF), report.getFailed().get(3).getActual());
    }

    /**
     * A case tolerance overrides the category and global ones.
     */
    @Test
    void testCaseTolerance() {
        GoldenCase loose = new GoldenCase("Loan", "B9", new BigDecimal("0.3"));
        loose.setTolerance(new BigDecimal("0.05"));
        GoldenCase strict = new GoldenCase("Loan", "B9", new BigDecimal("0.3"));

        ValidationReport report = validator.validate(loan, Arrays.asList(loose, strict));
        assertEquals(1, report.getPassed());
        assertEquals(FormulaCategory.ARITHMETIC, report.getFailed().get(0).getCategory());
    }

    @Test
    void testCompare() {
        BigDecimal tolerance = new BigDecimal("0.001");
        assertNull(FormulaValidator.compare(CellValue.number(new BigDecimal("1.0005")),
                CellValue.number(BigDecimal.ONE), tolerance));
        assertNotNull(FormulaValidator.compare(CellValue.number(new BigDecimal("1.01")),
                CellValue.number(BigDecimal.ONE), tolerance));
        assertNotNull(FormulaValidator.compare(CellValue.text("1"), CellValue.number(BigDecimal.ONE), tolerance));
        assertNull(FormulaValidator.compare(CellValue.TRUE, CellValue.TRUE, tolerance));
    }

    @Test
    void testToCellValue() {
        assertEquals(CellValue.error(ErrorCode.NA), FormulaValidator.toCellValue("#N/A"));
        assertEquals(CellValue.number(new BigDecimal("3")), FormulaValidator.toCellValue(3));
        assertEquals(CellValue.text("x"), FormulaValidator.toCellValue("x"));
        assertEquals(CellValue.BLANK, FormulaValidator.toCellValue(null));
    }
}
