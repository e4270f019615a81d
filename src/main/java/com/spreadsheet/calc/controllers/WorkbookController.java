package com.spreadsheet.calc.controllers;

import com.spreadsheet.calc.models.CalculationResult;
import com.spreadsheet.calc.models.CellEdit;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.WorkbookImport;
import com.spreadsheet.calc.models.WorkbookResponse;
import com.spreadsheet.calc.services.WorkbookService;
import com.spreadsheet.calc.validation.ValidationReport;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for workbook sessions.
 * "/workbook" is the base path.
 */
@RestController
@RequestMapping("/workbook")
public class WorkbookController {

    @Autowired
    private WorkbookService workbookService;

    /**
     * POST /workbook
     * Body: a workbook import ({ "sheets", "cells", "names", settings }).
     * Opens the workbook, calculates it and returns its id and values.
     */
    @PostMapping
    public ResponseEntity<WorkbookResponse> createWorkbook(@RequestBody WorkbookImport source) {
        return ResponseEntity.ok(workbookService.createWorkbook(source));
    }

    /**
     * PUT /workbook/{workbookId}/cells
     * Body: [{ "sheet": "Sheet1", "cell": "A1", "input": "=B1*2" }, ...].
     * Returns the change-set: only cells whose value changed, in address order.
     * A formula that fails to calculate is still 200 OK; its error is the
     * cell's value.
     */
    @PutMapping("/{workbookId}/cells")
    public ResponseEntity<CalculationResult> applyEdits(@PathVariable long workbookId,
                                                        @RequestBody List<CellEdit> edits) {
        return ResponseEntity.ok(workbookService.applyEdits(workbookId, edits));
    }

    /**
     * GET /workbook/{workbookId}
     * Returns every non-blank value: { "Sheet1!A1": 10, "Sheet1!B1": "#DIV/0!", ... }.
     */
    @GetMapping("/{workbookId}")
    public ResponseEntity<Map<String, CellValue>> getValues(@PathVariable long workbookId) {
        return ResponseEntity.ok(workbookService.getValues(workbookId));
    }

    /**
     * GET /workbook/{workbookId}/cycles
     * Returns the circular references, e.g. [["Sheet1!A1", "Sheet1!B1"]].
     */
    @GetMapping("/{workbookId}/cycles")
    public ResponseEntity<List<List<String>>> getCycles(@PathVariable long workbookId) {
        return ResponseEntity.ok(workbookService.getCycles(workbookId));
    }

    /**
     * PUT /workbook/{workbookId}/names/{name}
     * Body: the range, e.g. "Sheet1!A1:A10". Recalculates the formulas using the name.
     */
    @PutMapping("/{workbookId}/names/{name}")
    public ResponseEntity<CalculationResult> defineName(@PathVariable long workbookId, @PathVariable String name,
                                                        @RequestBody String range) {
        return ResponseEntity.ok(workbookService.defineName(workbookId, name, range));
    }

    @DeleteMapping("/{workbookId}/names/{name}")
    public ResponseEntity<CalculationResult> deleteName(@PathVariable long workbookId, @PathVariable String name) {
        return ResponseEntity.ok(workbookService.deleteName(workbookId, name));
    }

    /**
     * POST /workbook/{workbookId}/validate
     * Body: golden cases [{ "sheet", "cell", "expectedValue", "tolerance", "category" }].
     * Replays the workbook's original import and reports mismatches.
     */
    @PostMapping("/{workbookId}/validate")
    public ResponseEntity<ValidationReport> validate(@PathVariable long workbookId, @RequestBody String goldenCases) {
        return ResponseEntity.ok(workbookService.validate(workbookId, goldenCases));
    }

    /**
     * DELETE /workbook/{workbookId}
     * Closes the session. 204 on success, 404 if it does not exist.
     */
    @DeleteMapping("/{workbookId}")
    public ResponseEntity<Void> deleteWorkbook(@PathVariable long workbookId) {
        workbookService.deleteWorkbook(workbookId);
        return ResponseEntity.noContent().build();
    }
}
