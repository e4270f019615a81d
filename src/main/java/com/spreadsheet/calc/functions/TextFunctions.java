package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.FormulaErrorException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.ValueType;
import com.spreadsheet.calc.services.SheetManager;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.regex.Matcher;

import static com.spreadsheet.calc.functions.FunctionCategory.TEXT;
import static com.spreadsheet.calc.functions.FunctionDefinition.VARIADIC;

/**
 * String functions. Positions are 1-based and counted in UTF-16 units.
 */
final class TextFunctions {

    private static final int MAX_TEXT_LENGTH = 32_767;

    private TextFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register(FunctionDefinition.scalar("CONCATENATE", TEXT, 1, VARIADIC, args -> {
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                text.append(args.text(i));
            }
            return checked(text);
        }));
        registry.register(FunctionDefinition.strict("CONCAT", TEXT, 1, VARIADIC, args -> {
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                for (CellValue value : args.range(i)) {
                    text.append(ValueCoercion.toText(value));
                }
            }
            return checked(text);
        }, ArgumentKind.RANGE));
        registry.register(FunctionDefinition.strict("TEXTJOIN", TEXT, 3, VARIADIC, TextFunctions::textJoin,
                ArgumentKind.SCALAR, ArgumentKind.SCALAR, ArgumentKind.RANGE));
        registry.register(FunctionDefinition.scalar("LEFT", TEXT, 1, 2, args -> {
            String text = args.text(0);
            return CellValue.text(text.substring(0, Math.min(text.length(), count(args, 1))));
        }));
        registry.register(FunctionDefinition.scalar("RIGHT", TEXT, 1, 2, args -> {
            String text = args.text(0);
            return CellValue.text(text.substring(text.length() - Math.min(text.length(), count(args, 1))));
        }));
        registry.register(FunctionDefinition.scalar("MID", TEXT, 3, 3, args -> {
            String text = args.text(0);
            int start = args.integer(1);
            int length = args.integer(2);
            if (start < 1 || length < 0) {
                throw new FormulaErrorException(ErrorCode.VALUE);
            }
            if (start > text.length()) {
                return CellValue.text("");
            }
            int from = start - 1;
            return CellValue.text(text.substring(from, (int) Math.min(text.length(), (long) from + length)));
        }));
        registry.register(FunctionDefinition.scalar("LEN", TEXT, 1, 1,
                args -> CellValue.number(args.text(0).length())));
        registry.register(FunctionDefinition.scalar("TRIM", TEXT, 1, 1,
                args -> CellValue.text(args.text(0).trim().replaceAll(" {2,}", " "))));
        registry.register(FunctionDefinition.scalar("UPPER", TEXT, 1, 1,
                args -> CellValue.text(args.text(0).toUpperCase(Locale.ROOT))));
        registry.register(FunctionDefinition.scalar("LOWER", TEXT, 1, 1,
                args -> CellValue.text(args.text(0).toLowerCase(Locale.ROOT))));
        registry.register(FunctionDefinition.scalar("PROPER", TEXT, 1, 1,
                args -> CellValue.text(proper(args.text(0)))));
        registry.register(FunctionDefinition.scalar("SUBSTITUTE", TEXT, 3, 4, TextFunctions::substitute));
        registry.register(FunctionDefinition.scalar("REPLACE", TEXT, 4, 4, args -> {
            String text = args.text(0);
            int start = args.integer(1);
            int length = args.integer(2);
            if (start < 1 || length < 0) {
                throw new FormulaErrorException(ErrorCode.VALUE);
            }
            int from = Math.min(start - 1, text.length());
            int to = (int) Math.min(text.length(), (long) from + length);
            return checked(new StringBuilder(text).replace(from, to, args.text(3)));
        }));
        registry.register(FunctionDefinition.scalar("FIND", TEXT, 2, 3, args -> find(args, false)));
        registry.register(FunctionDefinition.scalar("SEARCH", TEXT, 2, 3, args -> find(args, true)));
        registry.register(FunctionDefinition.scalar("EXACT", TEXT, 2, 2,
                args -> CellValue.bool(args.text(0).equals(args.text(1)))));
        registry.register(FunctionDefinition.scalar("VALUE", TEXT, 1, 1, args -> {
            CellValue value = args.value(0);
            if (value.getType() != ValueType.TEXT) {
                return CellValue.number(args.number(0));
            }
            BigDecimal number = SheetManager.parseNumber(((CellValue.TextValue) value).getValue());
            if (number == null) {
                throw new FormulaErrorException(ErrorCode.VALUE);
            }
            return CellValue.number(number);
        }));
        registry.register(FunctionDefinition.scalar("REPT", TEXT, 2, 2, args -> {
            String text = args.text(0);
            int times = args.integer(1);
            if (times < 0 || (long) text.length() * times > MAX_TEXT_LENGTH) {
                throw new FormulaErrorException(ErrorCode.VALUE);
            }
            StringBuilder repeated = new StringBuilder();
            for (int i = 0; i < times; i++) {
                repeated.append(text);
            }
            return CellValue.text(repeated.toString());
        }));
        registry.register(FunctionDefinition.scalar("TEXT", TEXT, 2, 2, TextFunctions::format));
    }

    private static CellValue textJoin(Arguments args) {
        String delimiter = args.text(0);
        boolean ignoreEmpty = args.bool(1);
        StringBuilder text = new StringBuilder();
        boolean first = true;
        for (int i = 2; i < args.size(); i++) {
            for (CellValue value : args.range(i)) {
                String part = ValueCoercion.toText(value);
                if (ignoreEmpty && part.isEmpty()) {
                    continue;
                }
                if (!first) {
                    text.append(delimiter);
                }
                text.append(part);
                first = false;
            }
        }
        return checked(text);
    }

    private static int count(Arguments args, int index) {
        int count = args.integer(index, 1);
        if (count < 0) {
            throw new FormulaErrorException(ErrorCode.VALUE);
        }
        return count;
    }

    private static String proper(String text) {
        StringBuilder result = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetter(c)) {
                result.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                result.append(c);
                startOfWord = true;
            }
        }
        return result.toString();
    }

    private static CellValue substitute(Arguments args) {
        String text = args.text(0);
        String search = args.text(1);
        String replacement = args.text(2);
        if (search.isEmpty()) {
            return CellValue.text(text);
        }
        if (args.isMissing(3)) {
            return checked(new StringBuilder(text.replace(search, replacement)));
        }
        int instance = args.integer(3);
        if (instance < 1) {
            throw new FormulaErrorException(ErrorCode.VALUE);
        }
        int at = -1;
        for (int i = 0; i < instance; i++) {
            at = text.indexOf(search, at + 1);
            if (at < 0) {
                return CellValue.text(text);
            }
        }
        return checked(new StringBuilder(text).replace(at, at + search.length(), replacement));
    }

    private static CellValue find(Arguments args, boolean search) {
        String needle = args.text(0);
        String haystack = args.text(1);
        int start = args.integer(2, 1);
        if (start < 1 || start > haystack.length() + 1) {
            throw new FormulaErrorException(ErrorCode.VALUE);
        }
        int found;
        if (search) {
            Matcher matcher = Criteria.wildcardPattern(needle).matcher(haystack);
            found = matcher.find(start - 1) ? matcher.start() : -1;
            if (needle.isEmpty()) {
                found = start - 1;
            }
        } else {
            found = haystack.indexOf(needle, start - 1);
        }
        if (found < 0) {
            throw new FormulaErrorException(ErrorCode.VALUE);
        }
        return CellValue.number(found + 1L);
    }

    /**
     * TEXT(value, format) for numeric formats such as "0.00", "#,##0" and
     * "0%". Date and conditional formats are not supported and give #VALUE!.
     */
    private static CellValue format(Arguments args) {
        BigDecimal number = args.number(0);
        String pattern = args.text(1);
        try {
            DecimalFormat format = new DecimalFormat(pattern, DecimalFormatSymbols.getInstance(Locale.US));
            format.setRoundingMode(RoundingMode.HALF_UP);
            return CellValue.text(format.format(number));
        } catch (IllegalArgumentException e) {
            throw new FormulaErrorException(ErrorCode.VALUE, "Unsupported format: " + pattern);
        }
    }

    private static CellValue checked(CharSequence text) {
        if (text.length() > MAX_TEXT_LENGTH) {
            throw new FormulaErrorException(ErrorCode.VALUE);
        }
        return CellValue.text(text.toString());
    }
}
