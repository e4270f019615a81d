package com.spreadsheet.calc.services;

import com.spreadsheet.calc.config.CalculationProperties;
import com.spreadsheet.calc.exceptions.WorkbookNotFoundException;
import com.spreadsheet.calc.models.*;
import com.spreadsheet.calc.validation.FormulaValidator;
import com.spreadsheet.calc.validation.GoldenCaseReader;
import com.spreadsheet.calc.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open workbook sessions and the operations the REST layer offers on them:
 * opening an import, applying edits, reading values and cycles, checking
 * golden cases and closing.
 *
 * Each workbook carries its own read/write lock: edits take the write lock
 * (inside the engine), reads take the read lock, and different workbooks
 * never wait on each other.
 */
@Service
public class WorkbookService {

    private static final Logger log = LoggerFactory.getLogger(WorkbookService.class);

    // All workbooks live here in memory; nothing is persisted
    private final Map<Long, Workbook> workbooks = new ConcurrentHashMap<>();

    @Autowired
    private FormulaEngine engine;

    @Autowired
    private FormulaValidator validator;

    @Autowired
    private GoldenCaseReader goldenCaseReader;

    @Autowired
    private CalculationProperties properties;

    /**
     * Opens a workbook from an import and returns its ID with the initial values.
     */
    public WorkbookResponse createWorkbook(WorkbookImport source) {
        Workbook workbook = new Workbook(source.applyTo(properties.toSettings()));
        CalculationResult result = engine.load(workbook, source);
        workbooks.put(workbook.getId(), workbook);
        log.info("Opened workbook {} with {} values", workbook.getId(), result.getChanges().size());
        return new WorkbookResponse(workbook.getId(), result.asMap());
    }

    /**
     * Retrieves a workbook by ID. Throws if not found.
     */
    public Workbook getWorkbook(long workbookId) {
        Workbook workbook = workbooks.get(workbookId);
        if (workbook == null) {
            throw new WorkbookNotFoundException("Workbook not found: " + workbookId);
        }
        return workbook;
    }

    /**
     * Applies edits and returns the cells whose values changed.
     */
    public CalculationResult applyEdits(long workbookId, List<CellEdit> edits) {
        return engine.calculate(getWorkbook(workbookId), edits);
    }

    public CalculationResult defineName(long workbookId, String name, String range) {
        return engine.defineName(getWorkbook(workbookId), name, range);
    }

    public CalculationResult deleteName(long workbookId, String name) {
        return engine.deleteName(getWorkbook(workbookId), name);
    }

    /**
     * Every non-blank value, keyed "Sheet!A1" in address order.
     */
    public Map<String, CellValue> getValues(long workbookId) {
        Workbook workbook = getWorkbook(workbookId);
        workbook.getLock().readLock().lock();
        try {
            Map<String, CellValue> values = new LinkedHashMap<>();
            for (CellChange value : FormulaEngine.snapshot(workbook)) {
                values.put(value.getCell(), value.getValue());
            }
            return values;
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    /**
     * Current circular references, each as a sorted list of "Sheet!A1" cells.
     */
    public List<List<String>> getCycles(long workbookId) {
        Workbook workbook = getWorkbook(workbookId);
        workbook.getLock().readLock().lock();
        try {
            List<List<String>> cycles = new ArrayList<>();
            for (Set<CellAddress> cycle : workbook.getDependencies().detectCycles()) {
                List<String> cells = new ArrayList<>();
                for (CellAddress address : cycle) {
                    cells.add(workbook.getSheets().describe(address));
                }
                cycles.add(cells);
            }
            return cycles;
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    /**
     * Replays the workbook's original import and checks the given golden
     * cases (JSON) against it.
     */
    public ValidationReport validate(long workbookId, String goldenCasesJson) {
        Workbook workbook = getWorkbook(workbookId);
        return validator.validate(workbook.getSource(), goldenCaseReader.read(goldenCasesJson));
    }

    public void deleteWorkbook(long workbookId) {
        if (workbooks.remove(workbookId) == null) {
            throw new WorkbookNotFoundException("Workbook not found: " + workbookId);
        }
        log.info("Closed workbook {}", workbookId);
    }
}
