package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;

import java.util.Collections;
import java.util.List;

/**
 * The result of parsing one formula: its syntax tree, the references it
 * reads, and a parse-error description when the text was malformed.
 * A malformed formula still has a tree (a single #ERROR! literal) so it can
 * be stored and evaluated like any other.
 */
public final class ParsedFormula {
    private final String text;
    private final FormulaNode root;
    private final List<Reference> references;
    private final String error;

    ParsedFormula(String text, FormulaNode root, List<Reference> references, String error) {
        this.text = text;
        this.root = root;
        this.references = Collections.unmodifiableList(references);
        this.error = error;
    }

    static ParsedFormula failed(String text, String error) {
        return new ParsedFormula(text, new LiteralNode(CellValue.error(ErrorCode.ERROR)), Collections.emptyList(), error);
    }

    public String getText() {
        return text;
    }

    public FormulaNode getRoot() {
        return root;
    }

    public List<Reference> getReferences() {
        return references;
    }

    public boolean hasError() {
        return error != null;
    }

    public String getError() {
        return error;
    }

    /**
     * Name of the function at the top of the tree, or null when the formula
     * is not a function call.
     */
    public String outermostFunction() {
        return root instanceof FunctionCallNode ? ((FunctionCallNode) root).getName() : null;
    }

    @Override
    public String toString() {
        return hasError() ? text + " [" + error + "]" : text;
    }
}
