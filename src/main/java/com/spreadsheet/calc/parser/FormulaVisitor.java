package com.spreadsheet.calc.parser;

public interface FormulaVisitor<R> {

    R visitLiteral(LiteralNode node);

    R visitCellRef(CellRefNode node);

    R visitRangeRef(RangeRefNode node);

    R visitSheetQualifiedRef(SheetQualifiedRefNode node);

    R visitNameRef(NameRefNode node);

    R visitFunctionCall(FunctionCallNode node);

    R visitBinaryOp(BinaryOpNode node);

    R visitUnaryOp(UnaryOpNode node);
}
