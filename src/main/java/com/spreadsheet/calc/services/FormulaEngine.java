package com.spreadsheet.calc.services;

import com.spreadsheet.calc.exceptions.FormulaTooComplexException;
import com.spreadsheet.calc.exceptions.RangeTooLargeException;
import com.spreadsheet.calc.exceptions.RecalculationFailedException;
import com.spreadsheet.calc.functions.FunctionRegistry;
import com.spreadsheet.calc.graph.DependencyResolver;
import com.spreadsheet.calc.graph.EvaluationBlock;
import com.spreadsheet.calc.graph.EvaluationPlan;
import com.spreadsheet.calc.graph.ResolvedReferences;
import com.spreadsheet.calc.models.*;
import com.spreadsheet.calc.parser.FormulaParser;
import com.spreadsheet.calc.parser.ParsedFormula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.*;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Drives recalculation passes over a {@link Workbook}.
 * - Parses every edit before touching the workbook, so a fatal parse leaves
 *   it unchanged
 * - Applies the edits, updates dependency edges and plans the dirty closure
 * - Evaluates level by level and commits each level as a whole
 * - Handles cycles: #CIRCULAR! by default, Gauss-Seidel sweeps in
 *   iterative mode
 * - Reports only cells whose committed value changed, sorted by address
 *
 * The workbook's write lock is held for the whole pass. Levels above the
 * parallel threshold are computed on the worker pool; commits always
 * happen on the calling thread.
 */
public class FormulaEngine {

    private static final Logger log = LoggerFactory.getLogger(FormulaEngine.class);

    private final FormulaParser parser;
    private final FunctionRegistry functions;
    private final FormulaExecutor executor = new FormulaExecutor();
    private final ExecutorService workers;
    private final int parallelism;
    private final int parallelThreshold;

    public FormulaEngine(FormulaParser parser, FunctionRegistry functions, ExecutorService workers,
                         int parallelism, int parallelThreshold) {
        this.parser = parser;
        this.functions = functions;
        this.workers = parallelism > 1 ? workers : null;
        this.parallelism = Math.max(1, parallelism);
        this.parallelThreshold = parallelThreshold;
    }

    /**
     * A sequential engine with the built-in functions.
     */
    public FormulaEngine() {
        this(new FormulaParser(), FunctionRegistry.standard(), null, 1, Integer.MAX_VALUE);
    }

    public FormulaParser getParser() {
        return parser;
    }

    public FunctionRegistry getFunctions() {
        return functions;
    }

    /**
     * Creates a workbook from an import, applying the import's setting
     * overrides to {@code defaults}, and calculates it.
     */
    public Workbook open(WorkbookImport source, CalculationSettings defaults) {
        Workbook workbook = new Workbook(source.applyTo(defaults));
        load(workbook, source);
        return workbook;
    }

    /**
     * Bulk import into an empty workbook followed by a full recalculation.
     * Returns every non-blank value.
     */
    public CalculationResult load(Workbook workbook, WorkbookImport source) {
        workbook.getLock().writeLock().lock();
        try {
            SheetManager sheets = workbook.getSheets();
            for (String name : source.getSheets()) {
                sheets.addSheet(name);
            }
            String defaultSheet = source.getSheets().isEmpty() ? null : source.getSheets().get(0);
            for (Map.Entry<String, String> name : source.getNames().entrySet()) {
                sheets.defineName(name.getKey(), sheets.parseRange(name.getValue(), defaultSheet));
            }
            List<PreparedEdit> edits = prepare(workbook, source.getCells());
            workbook.setSource(source);
            apply(workbook, edits, new HashMap<>());
            CalculationResult pass = runPass(workbook, formulaCells(workbook), new HashMap<>(), CancellationToken.NONE);
            log.info("Loaded workbook {}: {} sheets, {} cells, {} formulas evaluated",
                    workbook.getId(), sheets.getSheets().size(), sheets.cellCount(), pass.getEvaluatedCells());
            return new CalculationResult(snapshot(workbook), pass.isComplete(), pass.getEvaluatedCells());
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    public CalculationResult calculate(Workbook workbook, List<CellEdit> edits) {
        return calculate(workbook, edits, CancellationToken.NONE);
    }

    /**
     * Applies a batch of edits and recalculates everything that depends on
     * them. Cells left dirty by an earlier cancelled or failed pass are
     * recalculated too.
     *
     * @throws RecalculationFailedException if a formula is nested too deeply
     *                                      or a range is too large to read
     */
    public CalculationResult calculate(Workbook workbook, List<CellEdit> edits, CancellationToken cancellation) {
        workbook.getLock().writeLock().lock();
        try {
            long started = System.nanoTime();
            List<PreparedEdit> prepared = prepare(workbook, edits);
            Map<CellAddress, CellValue> previous = new HashMap<>();
            Set<CellAddress> seeds = apply(workbook, prepared, previous);
            seeds.addAll(workbook.getDirtyCells());
            CalculationResult result = runPass(workbook, seeds, previous, cancellation);
            log.info("Calculated workbook {}: {} edits, {} cells evaluated, {} changed in {} ms",
                    workbook.getId(), edits.size(), result.getEvaluatedCells(), result.getChanges().size(),
                    (System.nanoTime() - started) / 1_000_000);
            return result;
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    /**
     * Recalculates every formula from scratch.
     */
    public CalculationResult recalculateAll(Workbook workbook) {
        workbook.getLock().writeLock().lock();
        try {
            return runPass(workbook, formulaCells(workbook), new HashMap<>(), CancellationToken.NONE);
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    /**
     * Defines or redefines a named range and recalculates the formulas using it.
     */
    public CalculationResult defineName(Workbook workbook, String name, String range) {
        workbook.getLock().writeLock().lock();
        try {
            SheetManager sheets = workbook.getSheets();
            String defaultSheet = sheets.getSheets().isEmpty() ? null : sheets.getSheets().get(0).getName();
            sheets.defineName(name, sheets.parseRange(range, defaultSheet));
            return renamed(workbook, name);
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    /**
     * Deletes a named range; formulas using it turn into #REF!.
     */
    public CalculationResult deleteName(Workbook workbook, String name) {
        workbook.getLock().writeLock().lock();
        try {
            workbook.getSheets().deleteName(name);
            return renamed(workbook, name);
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    private CalculationResult renamed(Workbook workbook, String name) {
        SheetManager sheets = workbook.getSheets();
        DependencyResolver dependencies = workbook.getDependencies();
        Set<CellAddress> users = dependencies.cellsUsingName(name);
        for (CellAddress user : users) {
            Cell cell = sheets.getCell(user);
            if (cell != null && cell.isFormula()) {
                dependencies.registerOrUpdate(user, sheets.resolveReferences(user, cell.getFormula().getReferences()));
            }
        }
        Set<CellAddress> seeds = new TreeSet<>(users);
        seeds.addAll(workbook.getDirtyCells());
        return runPass(workbook, seeds, new HashMap<>(), CancellationToken.NONE);
    }

    /**
     * Resolves addresses and parses formulas without mutating anything.
     */
    private List<PreparedEdit> prepare(Workbook workbook, List<CellEdit> edits) {
        SheetManager sheets = workbook.getSheets();
        List<PreparedEdit> prepared = new ArrayList<>(edits.size());
        for (CellEdit edit : edits) {
            CellAddress address = sheets.address(edit.getSheet(), edit.getCell());
            String input = edit.getInput();
            if (input != null && input.startsWith("=")) {
                try {
                    prepared.add(new PreparedEdit(address, input, parser.parse(input), null));
                } catch (FormulaTooComplexException e) {
                    log.warn("Rejected edit of {}: {}", sheets.describe(address), e.getMessage());
                    throw new RecalculationFailedException(
                            "Formula in " + sheets.describe(address) + " is too complex: " + e.getMessage(), e);
                }
            } else {
                prepared.add(new PreparedEdit(address, input, null, SheetManager.parseLiteral(input)));
            }
        }
        return prepared;
    }

    /**
     * Writes the edits into the workbook and returns the edited addresses.
     * The value each cell had before its first edit goes into {@code previous}.
     */
    private Set<CellAddress> apply(Workbook workbook, List<PreparedEdit> edits, Map<CellAddress, CellValue> previous) {
        SheetManager sheets = workbook.getSheets();
        DependencyResolver dependencies = workbook.getDependencies();
        long version = workbook.nextVersion();
        Set<CellAddress> edited = new TreeSet<>();
        for (PreparedEdit edit : edits) {
            CellAddress address = edit.address;
            previous.putIfAbsent(address, sheets.getValue(address));
            if (edit.formula != null) {
                sheets.setFormula(address, edit.input, edit.formula);
                dependencies.registerOrUpdate(address, sheets.resolveReferences(address, edit.formula.getReferences()));
            } else if (edit.literal.isBlank()) {
                sheets.clear(address);
                dependencies.remove(address);
                workbook.markClean(address);
            } else {
                sheets.setLiteral(address, edit.input, edit.literal, version);
                dependencies.registerOrUpdate(address, ResolvedReferences.NONE);
                workbook.markClean(address);
            }
            edited.add(address);
        }
        return edited;
    }

    /**
     * Plans and evaluates the closure of {@code seeds}, then diffs committed
     * values against {@code previous} (extended with the planned cells'
     * values from before the pass).
     */
    private CalculationResult runPass(Workbook workbook, Collection<CellAddress> seeds,
                                      Map<CellAddress, CellValue> previous, CancellationToken cancellation) {
        SheetManager sheets = workbook.getSheets();
        EvaluationPlan plan = workbook.getDependencies().computeOrder(seeds);
        List<CellAddress> order = plan.order();
        for (CellAddress address : order) {
            previous.putIfAbsent(address, sheets.getValue(address));
        }
        workbook.markDirty(order);
        long version = workbook.nextVersion();
        CalculationContext context = new CalculationContext(workbook, functions, cancellation);

        int evaluated = 0;
        boolean complete = true;
        try {
            for (List<CellAddress> level : plan.getLevels()) {
                if (cancellation.isCancelled()) {
                    complete = false;
                    break;
                }
                evaluated += evaluateLevel(workbook, level, context, version);
            }
            for (EvaluationBlock block : plan.getBlocks()) {
                if (!complete || cancellation.isCancelled()) {
                    complete = false;
                    break;
                }
                if (block.isCyclic()) {
                    int swept = evaluateCycle(workbook, block, context, version);
                    if (swept < 0) {
                        complete = false;
                        break;
                    }
                    evaluated += swept;
                } else {
                    evaluated += evaluateLevel(workbook, block.getMembers(), context, version);
                }
            }
        } catch (RangeTooLargeException | FormulaTooComplexException e) {
            log.warn("Calculation of workbook {} failed after {} cells: {}", workbook.getId(), evaluated, e.getMessage());
            throw new RecalculationFailedException(e.getMessage(), e);
        }
        if (!complete) {
            log.warn("Calculation of workbook {} cancelled; {} cells left dirty",
                    workbook.getId(), workbook.getDirtyCells().size());
        }

        List<CellChange> changes = new ArrayList<>();
        for (Map.Entry<CellAddress, CellValue> entry : new TreeMap<>(previous).entrySet()) {
            CellAddress address = entry.getKey();
            Cell cell = sheets.getCell(address);
            if (cell != null && cell.isDirty()) {
                continue;
            }
            CellValue current = cell == null ? CellValue.BLANK : cell.getValue();
            if (!current.equals(entry.getValue())) {
                changes.add(new CellChange(sheets.describe(address), current));
            }
        }
        return new CalculationResult(changes, complete, evaluated);
    }

    /**
     * Evaluates one acyclic level and commits it. Cells in a level never
     * read each other, so they can be computed in any order or in parallel.
     */
    private int evaluateLevel(Workbook workbook, List<CellAddress> level, CalculationContext context, long version) {
        List<Cell> cells = new ArrayList<>(level.size());
        for (CellAddress address : level) {
            Cell cell = workbook.getSheets().getCell(address);
            if (cell != null && cell.isFormula()) {
                cells.add(cell);
            } else {
                workbook.markClean(address);
            }
        }
        CellValue[] results = workers != null && cells.size() > parallelThreshold
                ? computeParallel(cells, context)
                : computeSequential(cells, context);
        for (int i = 0; i < cells.size(); i++) {
            cells.get(i).commit(results[i], version);
            workbook.markClean(cells.get(i).getAddress());
        }
        log.debug("Committed level of {} cells", cells.size());
        return cells.size();
    }

    private CellValue[] computeSequential(List<Cell> cells, CalculationContext context) {
        CellValue[] results = new CellValue[cells.size()];
        for (int i = 0; i < cells.size(); i++) {
            results[i] = executor.compute(cells.get(i), context);
        }
        return results;
    }

    private CellValue[] computeParallel(List<Cell> cells, CalculationContext context) {
        CellValue[] results = new CellValue[cells.size()];
        int chunk = (cells.size() + parallelism - 1) / parallelism;
        List<Callable<Void>> tasks = new ArrayList<>();
        for (int start = 0; start < cells.size(); start += chunk) {
            final int from = start;
            final int to = Math.min(cells.size(), start + chunk);
            final CalculationContext forked = context.fork();
            tasks.add(() -> {
                for (int i = from; i < to; i++) {
                    results[i] = executor.compute(cells.get(i), forked);
                }
                return null;
            });
        }
        try {
            for (Future<Void> future : workers.invokeAll(tasks)) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecalculationFailedException("Interrupted while evaluating a level", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new RecalculationFailedException("Worker failed: " + cause, cause);
        }
        log.debug("Computed {} cells on {} workers", cells.size(), tasks.size());
        return results;
    }

    /**
     * Evaluates a strongly-connected component. Returns the number of
     * evaluations, or -1 when cancelled between sweeps.
     */
    private int evaluateCycle(Workbook workbook, EvaluationBlock block, CalculationContext context, long version) {
        SheetManager sheets = workbook.getSheets();
        List<Cell> members = new ArrayList<>();
        for (CellAddress address : block.getMembers()) {
            members.add(sheets.getCell(address));
        }
        CalculationSettings settings = workbook.getSettings();
        if (!settings.isIterative()) {
            log.warn("Circular reference in workbook {}: {}", workbook.getId(), describe(sheets, block));
            commitAll(workbook, members, CellValue.error(ErrorCode.CIRCULAR), version);
            return members.size();
        }

        int evaluations = 0;
        for (int sweep = 1; sweep <= settings.getMaxIterations(); sweep++) {
            if (context.getCancellation().isCancelled()) {
                return -1;
            }
            boolean settled = true;
            for (Cell cell : members) {
                CellValue before = cell.getValue();
                CellValue after = executor.compute(cell, context);
                // Gauss-Seidel: later members read this sweep's values
                cell.commit(after, version);
                cell.setDirty(true);
                evaluations++;
                settled &= converged(before, after, settings.getEpsilon());
            }
            if (settled) {
                for (Cell cell : members) {
                    cell.setDirty(false);
                    workbook.markClean(cell.getAddress());
                }
                log.debug("Cycle {} converged after {} sweeps", describe(sheets, block), sweep);
                return evaluations;
            }
        }
        log.warn("Cycle in workbook {} did not converge in {} sweeps: {}",
                workbook.getId(), settings.getMaxIterations(), describe(sheets, block));
        commitAll(workbook, members, CellValue.error(ErrorCode.NON_CONVERGENT), version);
        return evaluations;
    }

    private static boolean converged(CellValue before, CellValue after, BigDecimal epsilon) {
        if (before.getType() == ValueType.NUMBER && after.getType() == ValueType.NUMBER) {
            BigDecimal delta = ((CellValue.NumberValue) after).getValue()
                    .subtract(((CellValue.NumberValue) before).getValue()).abs();
            return delta.compareTo(epsilon) < 0;
        }
        return before.equals(after);
    }

    private static void commitAll(Workbook workbook, List<Cell> cells, CellValue value, long version) {
        for (Cell cell : cells) {
            cell.commit(value, version);
            workbook.markClean(cell.getAddress());
        }
    }

    private static String describe(SheetManager sheets, EvaluationBlock block) {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (CellAddress address : block.getMembers()) {
            joiner.add(sheets.describe(address));
        }
        return joiner.toString();
    }

    private static Set<CellAddress> formulaCells(Workbook workbook) {
        Set<CellAddress> cells = new TreeSet<>();
        for (Sheet sheet : workbook.getSheets().getSheets()) {
            for (Cell cell : sheet.getCells()) {
                if (cell.isFormula()) {
                    cells.add(cell.getAddress());
                }
            }
        }
        return cells;
    }

    /**
     * Every non-blank committed value, sorted by address.
     */
    public static List<CellChange> snapshot(Workbook workbook) {
        SheetManager sheets = workbook.getSheets();
        Map<CellAddress, CellValue> values = new TreeMap<>();
        for (Sheet sheet : sheets.getSheets()) {
            for (Cell cell : sheet.getCells()) {
                if (!cell.getValue().isBlank()) {
                    values.put(cell.getAddress(), cell.getValue());
                }
            }
        }
        List<CellChange> snapshot = new ArrayList<>(values.size());
        for (Map.Entry<CellAddress, CellValue> entry : values.entrySet()) {
            snapshot.add(new CellChange(sheets.describe(entry.getKey()), entry.getValue()));
        }
        return snapshot;
    }

    private static final class PreparedEdit {
        final CellAddress address;
        final String input;
        final ParsedFormula formula;
        final CellValue literal;

        PreparedEdit(CellAddress address, String input, ParsedFormula formula, CellValue literal) {
            this.address = address;
            this.input = input;
            this.formula = formula;
            this.literal = literal;
        }
    }
}
