package com.spreadsheet.calc.services;

import com.spreadsheet.calc.exceptions.InvalidCellReferenceException;
import com.spreadsheet.calc.exceptions.SheetNotFoundException;
import com.spreadsheet.calc.graph.ResolvedReferences;
import com.spreadsheet.calc.models.*;
import com.spreadsheet.calc.parser.ParsedFormula;
import com.spreadsheet.calc.parser.Reference;

import java.math.BigDecimal;
import java.util.*;

/**
 * Owns a workbook's cell storage: the sheets (looked up by index or by
 * case-insensitive name), their sparse cells and the named ranges.
 * Missing sheets and names never throw during evaluation; the caller turns
 * a null lookup into #REF! or #NAME? at the referencing cell.
 */
public class SheetManager {

    private final List<Sheet> sheets = new ArrayList<>();
    private final Map<String, Sheet> sheetsByName = new HashMap<>();
    private final Map<String, RangeAddress> names = new TreeMap<>();
    private final Set<String> deletedNames = new HashSet<>();

    /**
     * Adds a sheet at the next index.
     */
    public Sheet addSheet(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Sheet name must not be empty");
        }
        String key = name.toUpperCase();
        if (sheetsByName.containsKey(key)) {
            throw new IllegalArgumentException("Duplicate sheet name: " + name);
        }
        Sheet sheet = new Sheet(sheets.size(), name);
        sheets.add(sheet);
        sheetsByName.put(key, sheet);
        return sheet;
    }

    public List<Sheet> getSheets() {
        return Collections.unmodifiableList(sheets);
    }

    /**
     * Retrieves a sheet by name, or null if there is none.
     */
    public Sheet getSheet(String name) {
        return name == null ? null : sheetsByName.get(name.toUpperCase());
    }

    public Sheet getSheet(int index) {
        return index >= 0 && index < sheets.size() ? sheets.get(index) : null;
    }

    /**
     * Retrieves a sheet by name. Throws if not found.
     */
    public Sheet requireSheet(String name) {
        Sheet sheet = getSheet(name);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + name);
        }
        return sheet;
    }

    /**
     * Resolves "B7" on a named sheet to an address. Throws for an unknown
     * sheet or malformed reference.
     */
    public CellAddress address(String sheetName, String a1) {
        Sheet sheet = requireSheet(sheetName);
        CellAddress address = CellAddress.parse(sheet.getIndex(), a1);
        if (address == null) {
            throw new InvalidCellReferenceException("Invalid cell reference: " + a1);
        }
        return address;
    }

    /**
     * Parses "Sheet!A1:B2", "'My Sheet'!C3" or "A1" (on the default sheet).
     */
    public RangeAddress parseRange(String text, String defaultSheet) {
        String body = text.trim();
        if (body.startsWith("=")) {
            body = body.substring(1);
        }
        String sheetName = defaultSheet;
        int bang = body.lastIndexOf('!');
        if (bang >= 0) {
            sheetName = body.substring(0, bang);
            if (sheetName.startsWith("'") && sheetName.endsWith("'") && sheetName.length() >= 2) {
                sheetName = sheetName.substring(1, sheetName.length() - 1).replace("''", "'");
            }
            body = body.substring(bang + 1);
        }
        Sheet sheet = requireSheet(sheetName);
        String[] parts = body.split(":");
        CellAddress first = CellAddress.parse(sheet.getIndex(), parts[0]);
        CellAddress last = parts.length == 2 ? CellAddress.parse(sheet.getIndex(), parts[1]) : first;
        if (first == null || last == null || parts.length > 2) {
            throw new InvalidCellReferenceException("Invalid range: " + text);
        }
        return new RangeAddress(sheet.getIndex(), first.getRow(), first.getColumn(), last.getRow(), last.getColumn());
    }

    public Cell getCell(CellAddress address) {
        Sheet sheet = getSheet(address.getSheetIndex());
        return sheet == null ? null : sheet.getCell(address.getRow(), address.getColumn());
    }

    /**
     * The committed value at an address; blank when nothing is stored there.
     */
    public CellValue getValue(CellAddress address) {
        Sheet sheet = getSheet(address.getSheetIndex());
        if (sheet == null) {
            return CellValue.error(ErrorCode.REF);
        }
        Cell cell = sheet.getCell(address.getRow(), address.getColumn());
        return cell == null ? CellValue.BLANK : cell.getValue();
    }

    public Cell setFormula(CellAddress address, String rawInput, ParsedFormula formula) {
        Cell cell = requireSheetAt(address).getOrCreateCell(address.getRow(), address.getColumn());
        cell.setFormula(rawInput, formula);
        return cell;
    }

    public Cell setLiteral(CellAddress address, String rawInput, CellValue value, long version) {
        Cell cell = requireSheetAt(address).getOrCreateCell(address.getRow(), address.getColumn());
        cell.setLiteral(rawInput, value, version);
        return cell;
    }

    /**
     * Removes the cell; returns the removed cell or null.
     */
    public Cell clear(CellAddress address) {
        return requireSheetAt(address).removeCell(address.getRow(), address.getColumn());
    }

    /**
     * A lazy view over a rectangle of committed values.
     */
    public RangeValues resolveRange(RangeAddress range) {
        Sheet sheet = getSheet(range.getSheetIndex());
        if (sheet == null) {
            return RangeValues.of(CellValue.error(ErrorCode.REF));
        }
        return new SheetRange(sheet, range);
    }

    public void defineName(String name, RangeAddress range) {
        String key = name.toUpperCase();
        names.put(key, range);
        deletedNames.remove(key);
    }

    /**
     * Deletes a name; formulas still using it evaluate to #REF!.
     */
    public boolean deleteName(String name) {
        String key = name.toUpperCase();
        if (names.remove(key) != null) {
            deletedNames.add(key);
            return true;
        }
        return false;
    }

    public RangeAddress resolveNamedRange(String name) {
        return names.get(name.toUpperCase());
    }

    public boolean isDeletedName(String name) {
        return deletedNames.contains(name.toUpperCase());
    }

    public Map<String, RangeAddress> getNames() {
        return Collections.unmodifiableMap(names);
    }

    /**
     * Looks up the sheets and names a formula mentions. References to a
     * missing sheet or name produce no edge; they evaluate to an error.
     */
    public ResolvedReferences resolveReferences(CellAddress owner, List<Reference> references) {
        Set<CellAddress> cells = new LinkedHashSet<>();
        Set<RangeAddress> ranges = new LinkedHashSet<>();
        Set<String> usedNames = new LinkedHashSet<>();
        for (Reference reference : references) {
            if (reference.getKind() == Reference.Kind.NAME) {
                usedNames.add(reference.getName().toUpperCase());
                RangeAddress target = resolveNamedRange(reference.getName());
                if (target != null) {
                    ranges.add(target);
                }
                continue;
            }
            int sheetIndex = owner.getSheetIndex();
            if (reference.getSheetName() != null) {
                Sheet sheet = getSheet(reference.getSheetName());
                if (sheet == null) {
                    continue;
                }
                sheetIndex = sheet.getIndex();
            }
            if (reference.getKind() == Reference.Kind.CELL) {
                cells.add(new CellAddress(sheetIndex, reference.getFirstRow(), reference.getFirstColumn()));
            } else {
                ranges.add(new RangeAddress(sheetIndex, reference.getFirstRow(), reference.getFirstColumn(),
                        reference.getLastRow(), reference.getLastColumn()));
            }
        }
        return new ResolvedReferences(cells, ranges, usedNames);
    }

    /**
     * "Sheet1!B7", quoting sheet names that contain anything but letters,
     * digits and underscores.
     */
    public String describe(CellAddress address) {
        Sheet sheet = getSheet(address.getSheetIndex());
        String name = sheet == null ? "#REF" : sheet.getName();
        if (!name.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            name = "'" + name.replace("'", "''") + "'";
        }
        return name + "!" + address.toA1();
    }

    public int cellCount() {
        int count = 0;
        for (Sheet sheet : sheets) {
            count += sheet.size();
        }
        return count;
    }

    /**
     * Interprets non-formula input: a leading apostrophe forces text;
     * TRUE/FALSE, error texts, numbers and percentages ("12.5%") are typed;
     * anything else is text. Empty input is blank.
     */
    public static CellValue parseLiteral(String input) {
        if (input == null || input.isEmpty()) {
            return CellValue.BLANK;
        }
        if (input.startsWith("'")) {
            return CellValue.text(input.substring(1));
        }
        String trimmed = input.trim();
        if (trimmed.equalsIgnoreCase("TRUE")) {
            return CellValue.TRUE;
        }
        if (trimmed.equalsIgnoreCase("FALSE")) {
            return CellValue.FALSE;
        }
        ErrorCode error = ErrorCode.fromDisplay(trimmed);
        if (error != null) {
            return CellValue.error(error);
        }
        BigDecimal number = parseNumber(trimmed);
        if (number != null) {
            return CellValue.number(number);
        }
        return CellValue.text(input);
    }

    /**
     * Parses numeric text, including a trailing percent sign. Returns null
     * when the text is not a number.
     */
    public static BigDecimal parseNumber(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        boolean percent = trimmed.endsWith("%");
        if (percent) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        char first = trimmed.isEmpty() ? ' ' : trimmed.charAt(0);
        if (!(Character.isDigit(first) || first == '.' || first == '-' || first == '+')) {
            return null;
        }
        try {
            BigDecimal value = new BigDecimal(trimmed);
            return percent ? value.movePointLeft(2) : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Sheet requireSheetAt(CellAddress address) {
        Sheet sheet = getSheet(address.getSheetIndex());
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: index " + address.getSheetIndex());
        }
        return sheet;
    }

    /**
     * A range over one sheet's sparse storage.
     */
    private static final class SheetRange implements RangeValues {
        private final Sheet sheet;
        private final RangeAddress range;

        SheetRange(Sheet sheet, RangeAddress range) {
            this.sheet = sheet;
            this.range = range;
        }

        @Override
        public int rows() {
            return range.rowCount();
        }

        @Override
        public int columns() {
            return range.columnCount();
        }

        @Override
        public int usedRows() {
            return Math.max(0, Math.min(range.getLastRow(), sheet.getMaxRow()) - range.getFirstRow() + 1);
        }

        @Override
        public int usedColumns() {
            return Math.max(0, Math.min(range.getLastColumn(), sheet.getMaxColumn()) - range.getFirstColumn() + 1);
        }

        @Override
        public CellValue get(int row, int column) {
            if (row < 0 || column < 0 || row >= rows() || column >= columns()) {
                return CellValue.error(ErrorCode.REF);
            }
            Cell cell = sheet.getCell(range.getFirstRow() + row, range.getFirstColumn() + column);
            return cell == null ? CellValue.BLANK : cell.getValue();
        }

        @Override
        public RangeAddress getAddress() {
            return range;
        }
    }
}
