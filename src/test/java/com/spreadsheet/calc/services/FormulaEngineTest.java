package com.spreadsheet.calc.services;

import com.spreadsheet.calc.exceptions.RecalculationFailedException;
import com.spreadsheet.calc.functions.FunctionRegistry;
import com.spreadsheet.calc.models.*;
import com.spreadsheet.calc.parser.FormulaParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end recalculation tests against an in-memory workbook
 * (no HTTP, no Spring context).
 */
class FormulaEngineTest {

    private FormulaEngine engine;
    private ExecutorService workers;

    @BeforeEach
    void setUp() {
        engine = new FormulaEngine();
    }

    @AfterEach
    void tearDown() {
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    private Workbook open(CalculationSettings settings, CellEdit... cells) {
        return engine.open(new WorkbookImport(Collections.singletonList("Sheet1"), Arrays.asList(cells)), settings);
    }

    private Workbook open(CellEdit... cells) {
        return open(CalculationSettings.defaults(), cells);
    }

    private static CellEdit cell(String a1, String input) {
        return new CellEdit("Sheet1", a1, input);
    }

    private static CellValue valueOf(Workbook workbook, String a1) {
        SheetManager sheets = workbook.getSheets();
        return sheets.getValue(sheets.address("Sheet1", a1));
    }

    private static CellValue number(String value) {
        return CellValue.number(new BigDecimal(value));
    }

    /**
     * Decimal arithmetic: 0.1 + 0.2 is exactly 0.3.
     */
    @Test
    void testDecimalAddition() {
        Workbook workbook = open(cell("A1", "=0.1+0.2"), cell("A2", "=A1=0.3"));
        assertEquals(number("0.3"), valueOf(workbook, "A1"));
        assertEquals(CellValue.TRUE, valueOf(workbook, "A2"));
    }

    /**
     * Editing A1 reports A1 and its dependent A3, nothing else.
     */
    @Test
    void testChangeSetHoldsOnlyChangedCells() {
        Workbook workbook = open(
                cell("A1", "10"),
                cell("A2", "20"),
                cell("A3", "=A1+A2"),
                cell("B1", "=A2*2"));
        assertEquals(number("30"), valueOf(workbook, "A3"));

        CalculationResult result = engine.calculate(workbook, Collections.singletonList(cell("A1", "15")));

        Map<String, CellValue> changes = result.asMap();
        assertEquals(Arrays.asList("Sheet1!A1", "Sheet1!A3"), new ArrayList<>(changes.keySet()));
        assertEquals(number("15"), changes.get("Sheet1!A1"));
        assertEquals(number("35"), changes.get("Sheet1!A3"));
        assertTrue(result.isComplete());
    }

    /**
     * A cell that recalculates to the same value is left out of the change-set.
     */
    @Test
    void testUnchangedDependentNotReported() {
        Workbook workbook = open(cell("A1", "3"), cell("B1", "=IF(A1>0,1,0)"));
        CalculationResult result = engine.calculate(workbook, Collections.singletonList(cell("A1", "7")));
        assertEquals(Collections.singletonList("Sheet1!A1"), new ArrayList<>(result.asMap().keySet()));
    }

    /**
     * Writing into a blank cell inside a referenced range updates the SUM.
     */
    @Test
    void testRangeEditUpdatesSum() {
        Workbook workbook = open(cell("A1", "1"), cell("A2", "2"), cell("B1", "=SUM(A1:A3)"));
        assertEquals(number("3"), valueOf(workbook, "B1"));

        CalculationResult result = engine.calculate(workbook, Collections.singletonList(cell("A3", "1")));
        assertEquals(number("4"), result.asMap().get("Sheet1!B1"));
        assertEquals(number("4"), valueOf(workbook, "B1"));
    }

    /**
     * Clearing a cell inside a referenced range updates the SUM through the
     * same range node, without touching the graph.
     */
    @Test
    void testRangeClearUpdatesSum() {
        Workbook workbook = open(cell("A1", "1"), cell("A2", "2"), cell("A3", "3"), cell("B1", "=SUM(A1:A3)"));
        assertEquals(number("6"), valueOf(workbook, "B1"));
        int rangeNodes = workbook.getDependencies().rangeNodeCount();
        int edges = workbook.getDependencies().edgeCount();

        CalculationResult result = engine.calculate(workbook, Collections.singletonList(cell("A2", "")));

        Map<String, CellValue> changes = result.asMap();
        assertEquals(Arrays.asList("Sheet1!A2", "Sheet1!B1"), new ArrayList<>(changes.keySet()));
        assertEquals(CellValue.BLANK, changes.get("Sheet1!A2"));
        assertEquals(number("4"), changes.get("Sheet1!B1"));
        assertEquals(number("4"), valueOf(workbook, "B1"));
        assertEquals(rangeNodes, workbook.getDependencies().rangeNodeCount());
        assertEquals(edges, workbook.getDependencies().edgeCount());
    }

    /**
     * References past the last row or column evaluate to #REF!.
     */
    @Test
    void testReferencesOutsideSheetBounds() {
        Workbook workbook = open(
                cell("A1", "5"),
                cell("B1", "=A1048577"),
                cell("B2", "=XFE1"),
                cell("B3", "=SUM(A1:A1048577)"),
                cell("B4", "=IFERROR(Sheet1!XFE1,A1)"),
                cell("B5", "=A1048576"));
        CellValue ref = CellValue.error(ErrorCode.REF);
        assertEquals(ref, valueOf(workbook, "B1"));
        assertEquals(ref, valueOf(workbook, "B2"));
        assertEquals(ref, valueOf(workbook, "B3"));
        assertEquals(number("5"), valueOf(workbook, "B4"));
        assertEquals(number("0"), valueOf(workbook, "B5"));
    }

    /**
     * Errors flow into dependents and IFERROR catches them.
     */
    @Test
    void testErrorPropagation() {
        Workbook workbook = open(
                cell("A1", "=1/0"),
                cell("B1", "=A1+1"),
                cell("C1", "=IFERROR(A1,-1)"),
                cell("D1", "=ISERROR(B1)"));
        assertEquals(CellValue.error(ErrorCode.DIV_ZERO), valueOf(workbook, "A1"));
        assertEquals(CellValue.error(ErrorCode.DIV_ZERO), valueOf(workbook, "B1"));
        assertEquals(number("-1"), valueOf(workbook, "C1"));
        assertEquals(CellValue.TRUE, valueOf(workbook, "D1"));
    }

    /**
     * Malformed formulas, unknown functions and unknown names each have their error.
     */
    @Test
    void testFormulaErrorKinds() {
        Workbook workbook = open(
                cell("A1", "=1+"),
                cell("A2", "=NOSUCHFUNCTION(1)"),
                cell("A3", "=UNDEFINED_NAME*2"),
                cell("A4", "=SUM(1,2"));
        assertEquals(CellValue.error(ErrorCode.ERROR), valueOf(workbook, "A1"));
        assertEquals(CellValue.error(ErrorCode.NAME), valueOf(workbook, "A2"));
        assertEquals(CellValue.error(ErrorCode.NAME), valueOf(workbook, "A3"));
        assertEquals(CellValue.error(ErrorCode.ERROR), valueOf(workbook, "A4"));
    }

    /**
     * A two-cell cycle is marked circular; unrelated cells still calculate
     * and dependents of the cycle see the error.
     */
    @Test
    void testCycleIsolation() {
        Workbook workbook = open(
                cell("A1", "=B1"),
                cell("B1", "=A1"),
                cell("C1", "=5*2"),
                cell("D1", "=A1+1"));
        assertEquals(CellValue.error(ErrorCode.CIRCULAR), valueOf(workbook, "A1"));
        assertEquals(CellValue.error(ErrorCode.CIRCULAR), valueOf(workbook, "B1"));
        assertEquals(number("10"), valueOf(workbook, "C1"));
        assertEquals(CellValue.error(ErrorCode.CIRCULAR), valueOf(workbook, "D1"));

        List<Set<CellAddress>> cycles = workbook.getDependencies().detectCycles();
        assertEquals(1, cycles.size());
        assertEquals(2, cycles.get(0).size());
    }

    /**
     * Breaking a cycle restores normal values.
     */
    @Test
    void testBreakingCycle() {
        Workbook workbook = open(cell("A1", "=B1"), cell("B1", "=A1"));
        engine.calculate(workbook, Collections.singletonList(cell("B1", "4")));
        assertEquals(number("4"), valueOf(workbook, "A1"));
        assertTrue(workbook.getDependencies().detectCycles().isEmpty());
    }

    /**
     * A self-referencing cell is a cycle too.
     */
    @Test
    void testSelfReference() {
        Workbook workbook = open(cell("A1", "=A1+1"));
        assertEquals(CellValue.error(ErrorCode.CIRCULAR), valueOf(workbook, "A1"));
    }

    /**
     * With iteration enabled a contracting cycle converges to its fixed point.
     */
    @Test
    void testIterativeConvergence() {
        CalculationSettings settings = CalculationSettings.defaults()
                .withIterative(true, 100, new BigDecimal("0.000001"));
        Workbook workbook = open(settings, cell("A1", "=B1/2+1"), cell("B1", "=A1/2"));

        BigDecimal a1 = ((CellValue.NumberValue) valueOf(workbook, "A1")).getValue();
        BigDecimal b1 = ((CellValue.NumberValue) valueOf(workbook, "B1")).getValue();
        assertTrue(a1.subtract(new BigDecimal("1.333333")).abs().compareTo(new BigDecimal("0.0001")) < 0, a1.toString());
        assertTrue(b1.subtract(new BigDecimal("0.666667")).abs().compareTo(new BigDecimal("0.0001")) < 0, b1.toString());
    }

    /**
     * A diverging cycle stops at the iteration limit with #NONCONVERGENT!.
     */
    @Test
    void testIterativeNonConvergence() {
        CalculationSettings settings = CalculationSettings.defaults()
                .withIterative(true, 20, new BigDecimal("0.001"));
        Workbook workbook = open(settings, cell("A1", "=B1+1"), cell("B1", "=A1"));
        assertEquals(CellValue.error(ErrorCode.NON_CONVERGENT), valueOf(workbook, "A1"));
        assertEquals(CellValue.error(ErrorCode.NON_CONVERGENT), valueOf(workbook, "B1"));
    }

    /**
     * Incremental passes end in the same state as a full recalculation.
     */
    @Test
    void testIncrementalMatchesFullRecalculation() {
        Workbook workbook = open(
                cell("A1", "1"),
                cell("A2", "=A1*2"),
                cell("A3", "=SUM(A1:A2)"),
                cell("B1", "=A3&\" total\""),
                cell("B2", "=COUNTIF(A1:A3,\">1\")"));
        engine.calculate(workbook, Arrays.asList(cell("A1", "5"), cell("C1", "=A2+B2")));
        engine.calculate(workbook, Collections.singletonList(cell("A2", "=A1*3")));
        engine.calculate(workbook, Collections.singletonList(cell("A1", "")));
        List<CellChange> incremental = FormulaEngine.snapshot(workbook);

        engine.recalculateAll(workbook);
        assertEquals(incremental, FormulaEngine.snapshot(workbook));
        assertEquals(number("0"), valueOf(workbook, "A3"));
        assertEquals(CellValue.text("0 total"), valueOf(workbook, "B1"));
    }

    /**
     * Parallel evaluation gives the same values as sequential evaluation.
     */
    @Test
    void testParallelEvaluationIsDeterministic() {
        List<CellEdit> cells = new ArrayList<>();
        for (int row = 1; row <= 200; row++) {
            cells.add(cell("A" + row, String.valueOf(row)));
            cells.add(cell("B" + row, "=A" + row + "*1.5"));
            cells.add(cell("C" + row, "=B" + row + "+SUM(A1:A" + row + ")"));
        }
        cells.add(cell("D1", "=SUM(C1:C200)"));
        WorkbookImport source = new WorkbookImport(Collections.singletonList("Sheet1"), cells);

        workers = Executors.newFixedThreadPool(4);
        FormulaEngine parallel = new FormulaEngine(new FormulaParser(), FunctionRegistry.standard(), workers, 4, 8);
        Workbook sequentialBook = engine.open(source, CalculationSettings.defaults());
        Workbook parallelBook = parallel.open(source, CalculationSettings.defaults());

        assertEquals(FormulaEngine.snapshot(sequentialBook), FormulaEngine.snapshot(parallelBook));
        assertEquals(FormulaEngine.snapshot(parallelBook), FormulaEngine.snapshot(parallel.open(source, CalculationSettings.defaults())));
    }

    /**
     * A cancelled pass leaves its cells dirty; the next pass picks them up.
     */
    @Test
    void testCancellation() {
        Workbook workbook = open(cell("A1", "1"), cell("B1", "=A1*2"));
        CancellationToken token = new CancellationToken();
        token.cancel();

        CalculationResult result = engine.calculate(workbook, Collections.singletonList(cell("A1", "5")), token);
        assertFalse(result.isComplete());
        assertEquals(number("2"), valueOf(workbook, "B1"));
        assertFalse(workbook.getDirtyCells().isEmpty());

        CalculationResult next = engine.calculate(workbook, Collections.emptyList());
        assertTrue(next.isComplete());
        assertEquals(number("10"), valueOf(workbook, "B1"));
        assertTrue(workbook.getDirtyCells().isEmpty());
    }

    /**
     * The shared never-cancelled token refuses to be cancelled.
     */
    @Test
    void testSharedTokenCannotBeCancelled() {
        assertThrows(UnsupportedOperationException.class, CancellationToken.NONE::cancel);
    }

    /**
     * Reading a range bigger than the workbook limit fails the pass.
     */
    @Test
    void testRangeTooLarge() {
        CalculationSettings settings = CalculationSettings.defaults().withMaxRangeCells(10);
        List<CellEdit> cells = new ArrayList<>();
        for (int row = 1; row <= 20; row++) {
            cells.add(cell("A" + row, String.valueOf(row)));
        }
        Workbook workbook = open(settings, cells.toArray(new CellEdit[0]));

        assertThrows(RecalculationFailedException.class, () ->
                engine.calculate(workbook, Collections.singletonList(cell("B1", "=SUM(A:A)"))));

        engine.calculate(workbook, Collections.singletonList(cell("B1", "=SUM(A1:A5)")));
        assertEquals(number("15"), valueOf(workbook, "B1"));
    }

    /**
     * Clearing the bottom cell of a column shrinks the extent that
     * whole-column ranges read and check against the limit.
     */
    @Test
    void testUsedExtentShrinksAfterClear() {
        CalculationSettings settings = CalculationSettings.defaults().withMaxRangeCells(10);
        Workbook workbook = open(settings,
                cell("A1", "1"), cell("A2", "2"), cell("A3", "3"), cell("A4", "4"), cell("A5", "5"),
                cell("A20", "20"));
        assertThrows(RecalculationFailedException.class, () ->
                engine.calculate(workbook, Collections.singletonList(cell("B1", "=SUM(A:A)"))));

        engine.calculate(workbook, Arrays.asList(cell("B1", ""), cell("A20", "")));
        engine.calculate(workbook, Collections.singletonList(cell("B1", "=SUM(A:A)")));
        assertEquals(number("15"), valueOf(workbook, "B1"));
    }

    /**
     * Excessive nesting is rejected before anything is written.
     */
    @Test
    void testFormulaTooComplex() {
        Workbook workbook = open(cell("A1", "1"));
        StringBuilder formula = new StringBuilder("=");
        for (int i = 0; i < 300; i++) {
            formula.append('(');
        }
        formula.append('1');
        for (int i = 0; i < 300; i++) {
            formula.append(')');
        }

        assertThrows(RecalculationFailedException.class, () ->
                engine.calculate(workbook, Arrays.asList(cell("A1", "2"), cell("B1", formula.toString()))));
        assertEquals(number("1"), valueOf(workbook, "A1"));
    }

    /**
     * Named ranges resolve, follow redefinition and turn into #REF! once deleted.
     */
    @Test
    void testNamedRanges() {
        WorkbookImport source = new WorkbookImport(Collections.singletonList("Sheet1"), Arrays.asList(
                cell("A1", "1"), cell("A2", "2"), cell("A3", "3"), cell("B1", "=SUM(Values)")));
        source.getNames().put("Values", "Sheet1!A1:A2");
        Workbook workbook = engine.open(source, CalculationSettings.defaults());
        assertEquals(number("3"), valueOf(workbook, "B1"));

        engine.defineName(workbook, "Values", "A1:A3");
        assertEquals(number("6"), valueOf(workbook, "B1"));

        engine.calculate(workbook, Collections.singletonList(cell("A3", "10")));
        assertEquals(number("13"), valueOf(workbook, "B1"));

        engine.deleteName(workbook, "Values");
        assertEquals(CellValue.error(ErrorCode.REF), valueOf(workbook, "B1"));
    }

    /**
     * References across sheets, including quoted sheet names.
     */
    @Test
    void testCrossSheetReferences() {
        WorkbookImport source = new WorkbookImport(Arrays.asList("Inputs", "My Sheet"), Arrays.asList(
                new CellEdit("Inputs", "A1", "4"),
                new CellEdit("My Sheet", "A1", "=Inputs!A1*2"),
                new CellEdit("Inputs", "B1", "='My Sheet'!A1+1"),
                new CellEdit("Inputs", "C1", "=Missing!A1")));
        Workbook workbook = engine.open(source, CalculationSettings.defaults());
        SheetManager sheets = workbook.getSheets();

        assertEquals(number("8"), sheets.getValue(sheets.address("My Sheet", "A1")));
        assertEquals(number("9"), sheets.getValue(sheets.address("Inputs", "B1")));
        assertEquals(CellValue.error(ErrorCode.REF), sheets.getValue(sheets.address("Inputs", "C1")));

        CalculationResult result = engine.calculate(workbook,
                Collections.singletonList(new CellEdit("Inputs", "A1", "5")));
        assertEquals(number("11"), result.asMap().get("Inputs!B1"));
        assertEquals(number("10"), result.asMap().get("'My Sheet'!A1"));
    }

    /**
     * Literal inputs keep their types; a formula reading a blank shows 0.
     */
    @Test
    void testLiteralTypes() {
        Workbook workbook = open(
                cell("A1", "true"),
                cell("A2", "'123"),
                cell("A3", "12.5%"),
                cell("A4", "#N/A"),
                cell("B1", "=Z99"),
                cell("B2", "=TYPE(A2)"));
        assertEquals(CellValue.TRUE, valueOf(workbook, "A1"));
        assertEquals(CellValue.text("123"), valueOf(workbook, "A2"));
        assertEquals(number("0.125"), valueOf(workbook, "A3"));
        assertEquals(CellValue.error(ErrorCode.NA), valueOf(workbook, "A4"));
        assertEquals(number("0"), valueOf(workbook, "B1"));
        assertEquals(number("2"), valueOf(workbook, "B2"));
    }
}
