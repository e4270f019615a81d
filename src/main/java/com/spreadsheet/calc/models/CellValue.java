package com.spreadsheet.calc.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A computed cell value. The set of variants is closed: blank, number,
 * text, boolean and error. Callers switch on {@link #getType()} and cast
 * to the nested variant.
 *
 * Numbers are always {@link BigDecimal}; two numbers are equal when they
 * compare equal, so 0.30 and 0.3 are the same value.
 */
public abstract class CellValue {

    public static final Blank BLANK = new Blank();
    public static final BoolValue TRUE = new BoolValue(true);
    public static final BoolValue FALSE = new BoolValue(false);
    public static final NumberValue ZERO = new NumberValue(BigDecimal.ZERO);

    private CellValue() {
    }

    public abstract ValueType getType();

    /**
     * The value as Jackson writes it: number, string, boolean,
     * error text such as "#DIV/0!", or null for a blank.
     */
    @JsonValue
    public abstract Object toJson();

    public boolean isError() {
        return getType() == ValueType.ERROR;
    }

    public boolean isBlank() {
        return getType() == ValueType.BLANK;
    }

    public static NumberValue number(BigDecimal value) {
        return new NumberValue(value);
    }

    public static NumberValue number(long value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    public static TextValue text(String value) {
        return new TextValue(value);
    }

    public static BoolValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static ErrorValue error(ErrorCode code) {
        return ErrorValue.of(code);
    }

    public static final class Blank extends CellValue {
        private Blank() {
        }

        @Override
        public ValueType getType() {
            return ValueType.BLANK;
        }

        @Override
        public Object toJson() {
            return null;
        }

        @Override
        public String toString() {
            return "<blank>";
        }
    }

    public static final class NumberValue extends CellValue {
        private final BigDecimal value;

        private NumberValue(BigDecimal value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        public BigDecimal getValue() {
            return value;
        }

        @Override
        public ValueType getType() {
            return ValueType.NUMBER;
        }

        @Override
        public Object toJson() {
            return value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof NumberValue)) return false;
            return value.compareTo(((NumberValue) o).value) == 0;
        }

        @Override
        public int hashCode() {
            return value.signum() == 0 ? 0 : value.stripTrailingZeros().hashCode();
        }

        @Override
        public String toString() {
            return value.signum() == 0 ? "0" : value.stripTrailingZeros().toPlainString();
        }
    }

    public static final class TextValue extends CellValue {
        private final String value;

        private TextValue(String value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        public String getValue() {
            return value;
        }

        @Override
        public ValueType getType() {
            return ValueType.TEXT;
        }

        @Override
        public Object toJson() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof TextValue)) return false;
            return value.equals(((TextValue) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "\"" + value + "\"";
        }
    }

    public static final class BoolValue extends CellValue {
        private final boolean value;

        private BoolValue(boolean value) {
            this.value = value;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public ValueType getType() {
            return ValueType.BOOLEAN;
        }

        @Override
        public Object toJson() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BoolValue && ((BoolValue) o).value == value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return value ? "TRUE" : "FALSE";
        }
    }

    public static final class ErrorValue extends CellValue {
        private static final ErrorValue[] CACHE = new ErrorValue[ErrorCode.values().length];

        static {
            for (ErrorCode code : ErrorCode.values()) {
                CACHE[code.ordinal()] = new ErrorValue(code);
            }
        }

        private final ErrorCode code;

        private ErrorValue(ErrorCode code) {
            this.code = code;
        }

        static ErrorValue of(ErrorCode code) {
            return CACHE[code.ordinal()];
        }

        public ErrorCode getCode() {
            return code;
        }

        @Override
        public ValueType getType() {
            return ValueType.ERROR;
        }

        @Override
        public Object toJson() {
            return code.getDisplay();
        }

        @Override
        public String toString() {
            return code.getDisplay();
        }
    }
}
