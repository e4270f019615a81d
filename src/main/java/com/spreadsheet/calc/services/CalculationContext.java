package com.spreadsheet.calc.services;

import com.spreadsheet.calc.functions.FunctionRegistry;
import com.spreadsheet.calc.models.CalculationSettings;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.Workbook;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * State threaded through one evaluation: the workbook being calculated,
 * the function table, the cancellation token and the stack of cells being
 * evaluated. A worker thread gets its own {@link #fork()} so stacks are
 * never shared.
 */
public class CalculationContext {

    private final Workbook workbook;
    private final FunctionRegistry functions;
    private final CancellationToken cancellation;
    private final Deque<CellAddress> stack = new ArrayDeque<>();

    public CalculationContext(Workbook workbook, FunctionRegistry functions, CancellationToken cancellation) {
        this.workbook = workbook;
        this.functions = functions;
        this.cancellation = cancellation;
    }

    public CalculationContext fork() {
        return new CalculationContext(workbook, functions, cancellation);
    }

    public Workbook getWorkbook() {
        return workbook;
    }

    public SheetManager getSheets() {
        return workbook.getSheets();
    }

    public CalculationSettings getSettings() {
        return workbook.getSettings();
    }

    public FunctionRegistry getFunctions() {
        return functions;
    }

    public CancellationToken getCancellation() {
        return cancellation;
    }

    /**
     * The cell whose formula is being evaluated, or null outside a formula.
     */
    public CellAddress currentCell() {
        return stack.peek();
    }

    void enter(CellAddress cell) {
        stack.push(cell);
    }

    void exit() {
        stack.pop();
    }
}
