package com.spreadsheet.calc.models;

import com.spreadsheet.calc.graph.DependencyResolver;
import com.spreadsheet.calc.services.SheetManager;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an entire workbook:
 * - Has a unique ID
 * - Its sheets, cells and named ranges (through the {@link SheetManager})
 * - The dependency graph between cells
 * - The calculation settings it was opened with
 * - The set of dirty cells still waiting for a pass to commit them
 * - A read/write lock so a single writer drives each pass
 *
 * Workbooks share no mutable state, so independent instances can be
 * calculated in parallel.
 */
public class Workbook {

    // Generates unique IDs for newly created workbooks
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final CalculationSettings settings;
    private final SheetManager sheets = new SheetManager();
    private final DependencyResolver dependencies = new DependencyResolver();
    private final Set<CellAddress> dirty = new TreeSet<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private long version;
    private WorkbookImport source;

    public Workbook(CalculationSettings settings) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.settings = settings;
    }

    public long getId() {
        return id;
    }

    public CalculationSettings getSettings() {
        return settings;
    }

    public SheetManager getSheets() {
        return sheets;
    }

    public DependencyResolver getDependencies() {
        return dependencies;
    }

    /**
     * Starts a new pass and returns its version stamp.
     */
    public long nextVersion() {
        return ++version;
    }

    public long getVersion() {
        return version;
    }

    public void markDirty(Collection<CellAddress> cells) {
        for (CellAddress address : cells) {
            Cell cell = sheets.getCell(address);
            if (cell != null && cell.isFormula()) {
                cell.setDirty(true);
                dirty.add(address);
            }
        }
    }

    public void markClean(CellAddress address) {
        dirty.remove(address);
    }

    public Set<CellAddress> getDirtyCells() {
        return Collections.unmodifiableSet(dirty);
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }

    /**
     * The import this workbook was opened from, kept so golden cases can be
     * replayed against the same inputs.
     */
    public WorkbookImport getSource() {
        return source;
    }

    public void setSource(WorkbookImport source) {
        this.source = source;
    }
}
