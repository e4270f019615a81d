package com.spreadsheet.calc.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a golden-case run: totals, the failures in case order, and
 * pass/fail counts per formula category.
 */
public class ValidationReport {
    private int total;
    private int passed;
    private final List<ValidationFailure> failed = new ArrayList<>();
    private final Map<FormulaCategory, CategoryStats> categoryBreakdown = new EnumMap<>(FormulaCategory.class);

    void recordPass(FormulaCategory category) {
        total++;
        passed++;
        categoryBreakdown.computeIfAbsent(category, c -> new CategoryStats()).passed++;
    }

    void recordFailure(ValidationFailure failure) {
        total++;
        failed.add(failure);
        categoryBreakdown.computeIfAbsent(failure.getCategory(), c -> new CategoryStats()).failed++;
    }

    public int getTotal() {
        return total;
    }

    public int getPassed() {
        return passed;
    }

    public List<ValidationFailure> getFailed() {
        return Collections.unmodifiableList(failed);
    }

    public Map<FormulaCategory, CategoryStats> getCategoryBreakdown() {
        return Collections.unmodifiableMap(categoryBreakdown);
    }

    /**
     * Share of passing cases, 1.0 for an empty run.
     */
    public double getPassRate() {
        return total == 0 ? 1.0 : (double) passed / total;
    }

    public static class CategoryStats {
        private int passed;
        private int failed;

        public int getPassed() {
            return passed;
        }

        public int getFailed() {
            return failed;
        }

        public int getTotal() {
            return passed + failed;
        }
    }
}
