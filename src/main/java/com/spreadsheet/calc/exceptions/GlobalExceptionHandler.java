package com.spreadsheet.calc.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.io.UncheckedIOException;

/**
 * Catches custom exceptions from anywhere in the controllers or services,
 * returning user-friendly error JSON with an HTTP 4xx code instead of 500.
 * Formula errors never get here: they are cell values.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(WorkbookNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleWorkbookNotFound(WorkbookNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "WORKBOOK_NOT_FOUND", ex);
    }

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "SHEET_NOT_FOUND", ex);
    }

    @ExceptionHandler(InvalidCellReferenceException.class)
    public ResponseEntity<ErrorResponse> handleInvalidReference(InvalidCellReferenceException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_CELL_REFERENCE", ex);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex);
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableCases(UncheckedIOException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_GOLDEN_CASES", ex);
    }

    @ExceptionHandler(RecalculationFailedException.class)
    public ResponseEntity<ErrorResponse> handleRecalculationFailed(RecalculationFailedException ex) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "RECALCULATION_FAILED", ex);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        // Catch-all for other runtime exceptions you haven't explicitly handled
        log.error("Unhandled error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "SERVER_ERROR", ex);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, RuntimeException ex) {
        return new ResponseEntity<>(new ErrorResponse(status.value(), code, ex.getMessage()), status);
    }
}
