package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.exceptions.FormulaTooComplexException;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for tokenizing and parsing formula text.
 */
class FormulaParserTest {

    private FormulaParser parser;

    @BeforeEach
    void setUp() {
        parser = new FormulaParser(16, 100);
    }

    private FormulaNode root(String formula) {
        ParsedFormula parsed = parser.parse(formula);
        assertFalse(parsed.hasError(), parsed.getError());
        return parsed.getRoot();
    }

    /**
     * Multiplication binds tighter than addition.
     */
    @Test
    void testArithmeticPrecedence() {
        BinaryOpNode add = (BinaryOpNode) root("=1+2*3");
        assertEquals(BinaryOperator.ADD, add.getOperator());
        assertEquals(BinaryOperator.MULTIPLY, ((BinaryOpNode) add.getRight()).getOperator());
    }

    /**
     * Unary minus binds tighter than '^', and '&' sits below '+'.
     */
    @Test
    void testUnaryAndConcatenation() {
        BinaryOpNode power = (BinaryOpNode) root("=-2^2");
        assertEquals(BinaryOperator.POWER, power.getOperator());
        assertEquals(UnaryOperator.NEGATE, ((UnaryOpNode) power.getLeft()).getOperator());

        BinaryOpNode concat = (BinaryOpNode) root("=1+2&\"x\"");
        assertEquals(BinaryOperator.CONCAT, concat.getOperator());
        assertEquals(BinaryOperator.ADD, ((BinaryOpNode) concat.getLeft()).getOperator());
    }

    /**
     * Comparisons have the lowest precedence.
     */
    @Test
    void testComparison() {
        BinaryOpNode compare = (BinaryOpNode) root("=A1+1>=B2*2");
        assertEquals(BinaryOperator.GE, compare.getOperator());
    }

    /**
     * Postfix percent divides its operand by 100.
     */
    @Test
    void testPercent() {
        UnaryOpNode percent = (UnaryOpNode) root("=50%");
        assertEquals(UnaryOperator.PERCENT, percent.getOperator());
        assertEquals(CellValue.number(new BigDecimal("50")), ((LiteralNode) percent.getOperand()).getValue());
    }

    /**
     * Function names are case-insensitive; empty argument slots are blank literals.
     */
    @Test
    void testFunctionCall() {
        FunctionCallNode call = (FunctionCallNode) root("=if(A1,,2)");
        assertEquals("IF", call.getName());
        assertEquals(3, call.getArguments().size());
        assertEquals(CellValue.BLANK, ((LiteralNode) call.getArguments().get(1)).getValue());
        assertEquals("IF", parser.parse("=if(A1,,2)").outermostFunction());
        assertNull(parser.parse("=1+1").outermostFunction());
    }

    /**
     * References are collected with their kind, sheet and bounds.
     */
    @Test
    void testReferences() {
        List<Reference> references = parser.parse("=SUM($A$1:B2, 'My Sheet'!C3, Rates, D:D)").getReferences();
        assertEquals(4, references.size());

        Reference range = references.get(0);
        assertEquals(Reference.Kind.RANGE, range.getKind());
        assertNull(range.getSheetName());
        assertEquals(1, range.getLastRow());
        assertEquals(1, range.getLastColumn());

        Reference cell = references.get(1);
        assertEquals(Reference.Kind.CELL, cell.getKind());
        assertEquals("My Sheet", cell.getSheetName());
        assertEquals(2, cell.getFirstRow());
        assertEquals(2, cell.getFirstColumn());

        assertEquals(Reference.Kind.NAME, references.get(2).getKind());
        assertEquals("Rates", references.get(2).getName());

        Reference column = references.get(3);
        assertEquals(CellAddress.MAX_ROWS - 1, column.getLastRow());
        assertEquals(3, column.getFirstColumn());
    }

    /**
     * Cells and ranges past the last row or column parse to a #REF! literal
     * and contribute no references.
     */
    @Test
    void testReferencesOutsideSheetBounds() {
        CellValue ref = CellValue.error(ErrorCode.REF);
        for (String formula : new String[] {"=A1048577", "=XFE1", "=Sheet1!XFE1", "=A1:A1048577", "=XFE:XFE"}) {
            ParsedFormula parsed = parser.parse(formula);
            assertFalse(parsed.hasError(), formula);
            assertEquals(ref, ((LiteralNode) parsed.getRoot()).getValue(), formula);
            assertTrue(parsed.getReferences().isEmpty(), formula);
        }

        FunctionCallNode sum = (FunctionCallNode) root("=SUM(A1:A1048577)");
        assertEquals(ref, ((LiteralNode) sum.getArguments().get(0)).getValue());
        assertEquals(CellAddress.MAX_ROWS - 1, ((CellRefNode) root("=A1048576")).getRow());
    }

    /**
     * Absolute markers are kept on cell nodes.
     */
    @Test
    void testAbsoluteReference() {
        CellRefNode cell = (CellRefNode) root("=$B7");
        assertTrue(cell.isColumnAbsolute());
        assertFalse(cell.isRowAbsolute());
        assertEquals(6, cell.getRow());
        assertEquals(1, cell.getColumn());
    }

    /**
     * A space between two references is the intersection operator.
     */
    @Test
    void testIntersection() {
        BinaryOpNode intersect = (BinaryOpNode) root("=A1:C3 B2:B9");
        assertEquals(BinaryOperator.INTERSECT, intersect.getOperator());
        assertTrue(intersect.isReference());
    }

    /**
     * Literals of every kind.
     */
    @Test
    void testLiterals() {
        assertEquals(CellValue.TRUE, ((LiteralNode) root("=TRUE")).getValue());
        assertEquals(CellValue.text("a\"b"), ((LiteralNode) root("=\"a\"\"b\"")).getValue());
        assertEquals(CellValue.number(new BigDecimal("1500")), ((LiteralNode) root("=1.5E3")).getValue());
        assertTrue(((LiteralNode) root("=#N/A")).getValue().isError());
    }

    /**
     * Malformed text produces a formula carrying the error, not an exception.
     */
    @Test
    void testMalformedFormula() {
        assertTrue(parser.parse("=1+").hasError());
        assertTrue(parser.parse("=(1").hasError());
        assertTrue(parser.parse("=SUM(1 2)").hasError());
        assertTrue(parser.parse("=").hasError());
        assertTrue(parser.parse("=\"open").hasError());
    }

    /**
     * Nesting beyond the limit throws.
     */
    @Test
    void testNestingLimit() {
        StringBuilder formula = new StringBuilder("=");
        for (int i = 0; i < 20; i++) {
            formula.append("ABS(");
        }
        formula.append('1');
        for (int i = 0; i < 20; i++) {
            formula.append(')');
        }
        assertThrows(FormulaTooComplexException.class, () -> parser.parse(formula.toString()));
    }

    /**
     * Identical text is parsed once.
     */
    @Test
    void testCache() {
        ParsedFormula first = parser.parse("=A1*2");
        assertSame(first, parser.parse("=A1*2"));
        assertEquals(1, parser.cachedFormulaCount());
    }
}
