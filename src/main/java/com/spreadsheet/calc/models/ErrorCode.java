package com.spreadsheet.calc.models;

import java.util.HashMap;
import java.util.Map;

/**
 * Spreadsheet error values, plus the two kinds the engine raises itself
 * for structural cycles and non-convergent iteration.
 */
public enum ErrorCode {
    DIV_ZERO("#DIV/0!"),
    NA("#N/A"),
    NAME("#NAME?"),
    NULL("#NULL!"),
    NUM("#NUM!"),
    REF("#REF!"),
    VALUE("#VALUE!"),
    ERROR("#ERROR!"),
    CIRCULAR("#CIRCULAR!"),
    NON_CONVERGENT("#NONCONVERGENT!");

    private static final Map<String, ErrorCode> BY_DISPLAY = new HashMap<>();

    static {
        for (ErrorCode code : values()) {
            BY_DISPLAY.put(code.display, code);
        }
    }

    private final String display;

    ErrorCode(String display) {
        this.display = display;
    }

    public String getDisplay() {
        return display;
    }

    /**
     * Looks up an error by the text a spreadsheet shows for it, e.g. "#N/A".
     * Returns null for anything else.
     */
    public static ErrorCode fromDisplay(String text) {
        if (text == null) {
            return null;
        }
        return BY_DISPLAY.get(text.trim().toUpperCase());
    }

    @Override
    public String toString() {
        return display;
    }
}
