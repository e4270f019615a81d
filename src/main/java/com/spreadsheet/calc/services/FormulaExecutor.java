package com.spreadsheet.calc.services;

import com.spreadsheet.calc.exceptions.FormulaErrorException;
import com.spreadsheet.calc.exceptions.RangeTooLargeException;
import com.spreadsheet.calc.functions.Argument;
import com.spreadsheet.calc.functions.ArgumentKind;
import com.spreadsheet.calc.functions.Arguments;
import com.spreadsheet.calc.functions.DecimalMath;
import com.spreadsheet.calc.functions.EvaluationStrategy;
import com.spreadsheet.calc.functions.FunctionDefinition;
import com.spreadsheet.calc.functions.ValueCoercion;
import com.spreadsheet.calc.models.*;
import com.spreadsheet.calc.parser.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates one formula cell against the committed values of its
 * precedents.
 * - {@link #compute} is side-effect free and safe to call from worker
 *   threads as long as no precedent is being written
 * - {@link #evaluate} computes and commits the value
 *
 * Errors are values: a function throwing {@link FormulaErrorException} or an
 * {@link ArithmeticException} yields an error value at the cell. Anything
 * else (a range over the size limit, for one) escapes to the engine and
 * fails the pass.
 */
public class FormulaExecutor {

    /**
     * Evaluates the cell and commits the result with the given version.
     */
    public CellValue evaluate(Cell cell, CalculationContext context, long version) {
        CellValue value = compute(cell, context);
        cell.commit(value, version);
        return value;
    }

    public CellValue compute(Cell cell, CalculationContext context) {
        ParsedFormula formula = cell.getFormula();
        if (formula == null) {
            return cell.getValue();
        }
        if (formula.hasError()) {
            return CellValue.error(ErrorCode.ERROR);
        }
        context.enter(cell.getAddress());
        try {
            CellValue value = formula.getRoot().accept(new Evaluator(context));
            // A formula that reads an empty cell shows 0
            return value.isBlank() ? CellValue.ZERO : value;
        } catch (FormulaErrorException e) {
            return CellValue.error(e.getCode());
        } catch (ArithmeticException e) {
            return CellValue.error(ErrorCode.NUM);
        } finally {
            context.exit();
        }
    }

    /**
     * Evaluates a free-standing expression, with references resolved on the
     * first sheet unless the context is inside a cell.
     */
    public CellValue evaluate(FormulaNode node, CalculationContext context) {
        try {
            return node.accept(new Evaluator(context));
        } catch (FormulaErrorException e) {
            return CellValue.error(e.getCode());
        } catch (ArithmeticException e) {
            return CellValue.error(ErrorCode.NUM);
        }
    }

    /**
     * The AST walk. References used as values go through implicit
     * intersection; references used as function arguments stay ranges.
     */
    private static final class Evaluator implements FormulaVisitor<CellValue> {
        private final CalculationContext context;
        private final SheetManager sheets;

        Evaluator(CalculationContext context) {
            this.context = context;
            this.sheets = context.getSheets();
        }

        @Override
        public CellValue visitLiteral(LiteralNode node) {
            return node.getValue();
        }

        @Override
        public CellValue visitCellRef(CellRefNode node) {
            return scalarOf(node);
        }

        @Override
        public CellValue visitRangeRef(RangeRefNode node) {
            return scalarOf(node);
        }

        @Override
        public CellValue visitSheetQualifiedRef(SheetQualifiedRefNode node) {
            return scalarOf(node);
        }

        @Override
        public CellValue visitNameRef(NameRefNode node) {
            return scalarOf(node);
        }

        @Override
        public CellValue visitFunctionCall(FunctionCallNode node) {
            FunctionDefinition definition = context.getFunctions().lookup(node.getName());
            if (definition == null) {
                return CellValue.error(ErrorCode.NAME);
            }
            List<FormulaNode> nodes = node.getArguments();
            if (!definition.acceptsArgumentCount(nodes.size())) {
                return CellValue.error(ErrorCode.VALUE);
            }
            List<Argument> arguments = new ArrayList<>(nodes.size());
            for (FormulaNode argumentNode : nodes) {
                arguments.add(new NodeArgument(argumentNode, this));
            }
            if (definition.getStrategy() == EvaluationStrategy.STRICT) {
                for (int i = 0; i < arguments.size(); i++) {
                    if (definition.kindAt(i) == ArgumentKind.SCALAR) {
                        CellValue value = arguments.get(i).value();
                        if (value.isError()) {
                            return value;
                        }
                    }
                }
            }
            try {
                return definition.getImplementation().apply(new Arguments(arguments, context));
            } catch (FormulaErrorException e) {
                return CellValue.error(e.getCode());
            }
        }

        @Override
        public CellValue visitBinaryOp(BinaryOpNode node) {
            BinaryOperator operator = node.getOperator();
            if (operator == BinaryOperator.INTERSECT) {
                return scalarOf(node);
            }
            CellValue left = node.getLeft().accept(this);
            if (left.isError()) {
                return left;
            }
            CellValue right = node.getRight().accept(this);
            if (right.isError()) {
                return right;
            }
            if (operator == BinaryOperator.CONCAT) {
                return CellValue.text(ValueCoercion.toText(left) + ValueCoercion.toText(right));
            }
            if (operator.isComparison()) {
                return CellValue.bool(compare(operator, ValueCoercion.compare(left, right)));
            }
            BigDecimal a = ValueCoercion.toNumber(left);
            BigDecimal b = ValueCoercion.toNumber(right);
            CalculationSettings settings = context.getSettings();
            switch (operator) {
                case ADD:
                    return CellValue.number(settings.round(a.add(b)));
                case SUBTRACT:
                    return CellValue.number(settings.round(a.subtract(b)));
                case MULTIPLY:
                    return CellValue.number(settings.round(a.multiply(b)));
                case DIVIDE:
                    return CellValue.number(DecimalMath.divide(a, b, settings));
                case POWER:
                    return CellValue.number(DecimalMath.power(a, b, settings));
                default:
                    throw new IllegalStateException("Unexpected operator " + operator);
            }
        }

        @Override
        public CellValue visitUnaryOp(UnaryOpNode node) {
            CellValue operand = node.getOperand().accept(this);
            if (operand.isError()) {
                return operand;
            }
            switch (node.getOperator()) {
                case NEGATE:
                    return CellValue.number(ValueCoercion.toNumber(operand).negate());
                case PERCENT:
                    return CellValue.number(context.getSettings().round(ValueCoercion.toNumber(operand).movePointLeft(2)));
                default:
                    return operand;
            }
        }

        private static boolean compare(BinaryOperator operator, int comparison) {
            switch (operator) {
                case EQ:
                    return comparison == 0;
                case NE:
                    return comparison != 0;
                case LT:
                    return comparison < 0;
                case LE:
                    return comparison <= 0;
                case GT:
                    return comparison > 0;
                default:
                    return comparison >= 0;
            }
        }

        /**
         * The value of a reference used where one value is expected. A
         * single cell is read directly; a one-column or one-row range yields
         * the cell on the current row or column, anything else is #VALUE!.
         */
        CellValue scalarOf(FormulaNode node) {
            RangeAddress range = resolve(node, defaultSheet());
            if (range.isSingleCell()) {
                return sheets.getValue(range.topLeft());
            }
            CellAddress current = context.currentCell();
            if (current != null && current.getSheetIndex() == range.getSheetIndex()) {
                if (range.columnCount() == 1 && current.getRow() >= range.getFirstRow()
                        && current.getRow() <= range.getLastRow()) {
                    return sheets.getValue(new CellAddress(range.getSheetIndex(), current.getRow(), range.getFirstColumn()));
                }
                if (range.rowCount() == 1 && current.getColumn() >= range.getFirstColumn()
                        && current.getColumn() <= range.getLastColumn()) {
                    return sheets.getValue(new CellAddress(range.getSheetIndex(), range.getFirstRow(), current.getColumn()));
                }
            }
            throw new FormulaErrorException(ErrorCode.VALUE);
        }

        RangeValues rangeOf(FormulaNode node) {
            RangeValues range = sheets.resolveRange(resolve(node, defaultSheet()));
            long limit = context.getSettings().getMaxRangeCells();
            if (range.usedArea() > limit) {
                throw new RangeTooLargeException("Range " + range.getAddress() + " spans "
                        + range.usedArea() + " cells, over the limit of " + limit);
            }
            return range;
        }

        private int defaultSheet() {
            CellAddress current = context.currentCell();
            return current == null ? 0 : current.getSheetIndex();
        }

        /**
         * Turns a reference node into the area it denotes. Unknown sheets
         * and deleted names are #REF!, names never defined are #NAME? and
         * disjoint intersections are #NULL!.
         */
        private RangeAddress resolve(FormulaNode node, int sheetIndex) {
            if (node instanceof CellRefNode) {
                CellRefNode cell = (CellRefNode) node;
                return new RangeAddress(sheetIndex, cell.getRow(), cell.getColumn(), cell.getRow(), cell.getColumn());
            }
            if (node instanceof RangeRefNode) {
                RangeRefNode range = (RangeRefNode) node;
                return new RangeAddress(sheetIndex, range.getFirstRow(), range.getFirstColumn(),
                        range.getLastRow(), range.getLastColumn());
            }
            if (node instanceof SheetQualifiedRefNode) {
                SheetQualifiedRefNode qualified = (SheetQualifiedRefNode) node;
                Sheet sheet = sheets.getSheet(qualified.getSheetName());
                if (sheet == null) {
                    throw new FormulaErrorException(ErrorCode.REF);
                }
                return resolve(qualified.getTarget(), sheet.getIndex());
            }
            if (node instanceof NameRefNode) {
                String name = ((NameRefNode) node).getName();
                RangeAddress target = sheets.resolveNamedRange(name);
                if (target == null) {
                    throw new FormulaErrorException(sheets.isDeletedName(name) ? ErrorCode.REF : ErrorCode.NAME);
                }
                return target;
            }
            if (node instanceof BinaryOpNode && ((BinaryOpNode) node).getOperator() == BinaryOperator.INTERSECT) {
                BinaryOpNode intersection = (BinaryOpNode) node;
                RangeAddress left = resolve(intersection.getLeft(), sheetIndex);
                RangeAddress right = resolve(intersection.getRight(), sheetIndex);
                RangeAddress overlap = left.intersect(right);
                if (overlap == null) {
                    throw new FormulaErrorException(ErrorCode.NULL);
                }
                return overlap;
            }
            throw new FormulaErrorException(ErrorCode.VALUE);
        }
    }

    /**
     * A function argument backed by its AST node, evaluated on first use.
     */
    private static final class NodeArgument implements Argument {
        private final FormulaNode node;
        private final Evaluator evaluator;
        private CellValue value;
        private RangeValues range;

        NodeArgument(FormulaNode node, Evaluator evaluator) {
            this.node = node;
            this.evaluator = evaluator;
        }

        @Override
        public CellValue value() {
            if (value == null) {
                try {
                    value = node.accept(evaluator);
                } catch (FormulaErrorException e) {
                    value = CellValue.error(e.getCode());
                } catch (ArithmeticException e) {
                    value = CellValue.error(ErrorCode.NUM);
                }
            }
            return value;
        }

        @Override
        public RangeValues range() {
            if (range == null) {
                if (node.isReference()) {
                    try {
                        range = evaluator.rangeOf(node);
                    } catch (FormulaErrorException e) {
                        range = RangeValues.of(CellValue.error(e.getCode()));
                    }
                } else {
                    range = RangeValues.of(value());
                }
            }
            return range;
        }

        @Override
        public boolean isReference() {
            return node.isReference();
        }

        @Override
        public boolean isMissing() {
            return node instanceof LiteralNode && ((LiteralNode) node).getValue().isBlank();
        }
    }
}
