package com.spreadsheet.calc.exceptions;

/**
 * JSON body of every failed request:
 * {
 *   "status": 404,
 *   "code": "WORKBOOK_NOT_FOUND",
 *   "message": "Workbook not found: 7"
 * }
 */
public class ErrorResponse {
    private final int status;
    private final String code;
    private final String message;

    public ErrorResponse(int status, String code, String message) {
        this.status = status;
        this.code = code;
        this.message = message;
    }

    public int getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
