package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.exceptions.FormulaTooComplexException;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns formula text into a {@link ParsedFormula}.
 *
 * Precedence, tightest first: reference operators (range ':' and
 * intersection by space), unary minus/plus, postfix '%', '^', '*' and '/',
 * '+' and '-', '&', comparisons. All binary operators are left-associative.
 *
 * Parsing is pure. Results are cached by exact text, so cells sharing a
 * formula share one tree. Malformed text yields a formula carrying a parse
 * error rather than an exception; only excessive nesting throws.
 */
public class FormulaParser {

    private static final Logger log = LoggerFactory.getLogger(FormulaParser.class);

    public static final int DEFAULT_MAX_DEPTH = 128;
    public static final int DEFAULT_CACHE_SIZE = 20_000;

    private final int maxDepth;
    private final Map<String, ParsedFormula> cache;

    public FormulaParser() {
        this(DEFAULT_MAX_DEPTH, DEFAULT_CACHE_SIZE);
    }

    public FormulaParser(int maxDepth, int cacheSize) {
        this.maxDepth = maxDepth;
        this.cache = new LinkedHashMap<String, ParsedFormula>(256, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ParsedFormula> eldest) {
                return size() > cacheSize;
            }
        };
    }

    /**
     * Parses formula text, with or without the leading '='.
     *
     * @throws FormulaTooComplexException if nesting exceeds the configured depth
     */
    public ParsedFormula parse(String text) {
        Objects.requireNonNull(text, "text");
        synchronized (cache) {
            ParsedFormula cached = cache.get(text);
            if (cached != null) {
                return cached;
            }
        }
        ParsedFormula parsed = doParse(text);
        synchronized (cache) {
            cache.put(text, parsed);
        }
        return parsed;
    }

    public int cachedFormulaCount() {
        synchronized (cache) {
            return cache.size();
        }
    }

    private ParsedFormula doParse(String text) {
        String body = text.startsWith("=") ? text.substring(1) : text;
        if (body.trim().isEmpty()) {
            return ParsedFormula.failed(text, "Empty formula");
        }
        try {
            List<Token> tokens = new FormulaLexer(body).tokenize();
            Parser parser = new Parser(tokens);
            FormulaNode root = parser.parseFormula();
            return new ParsedFormula(text, root, new ArrayList<>(parser.references), null);
        } catch (FormulaSyntaxException e) {
            log.debug("Keeping malformed formula {}: {}", text, e.getMessage());
            return ParsedFormula.failed(text, e.getMessage());
        }
    }

    private final class Parser {
        private final List<Token> tokens;
        private final Set<Reference> references = new LinkedHashSet<>();
        private int index;
        private int depth;

        Parser(List<Token> tokens) {
            this.tokens = tokens;
        }

        FormulaNode parseFormula() {
            FormulaNode node = expression();
            Token end = peek();
            if (end.type != TokenType.END) {
                throw new FormulaSyntaxException("Unexpected '" + end.text + "'", end.position);
            }
            return node;
        }

        private Token peek() {
            return tokens.get(index);
        }

        private Token next() {
            Token token = tokens.get(index);
            if (token.type != TokenType.END) {
                index++;
            }
            return token;
        }

        private boolean peekOperator(String... symbols) {
            Token token = peek();
            if (token.type != TokenType.OPERATOR) {
                return false;
            }
            for (String symbol : symbols) {
                if (token.text.equals(symbol)) {
                    return true;
                }
            }
            return false;
        }

        private void enter() {
            if (++depth > maxDepth) {
                throw new FormulaTooComplexException("Formula nesting exceeds " + maxDepth + " levels");
            }
        }

        private FormulaNode expression() {
            enter();
            try {
                return comparison();
            } finally {
                depth--;
            }
        }

        private FormulaNode comparison() {
            FormulaNode left = concatenation();
            while (peekOperator("=", "<>", "<", "<=", ">", ">=")) {
                BinaryOperator op = BinaryOperator.fromSymbol(next().text);
                left = new BinaryOpNode(op, left, concatenation());
            }
            return left;
        }

        private FormulaNode concatenation() {
            FormulaNode left = additive();
            while (peekOperator("&")) {
                next();
                left = new BinaryOpNode(BinaryOperator.CONCAT, left, additive());
            }
            return left;
        }

        private FormulaNode additive() {
            FormulaNode left = multiplicative();
            while (peekOperator("+", "-")) {
                BinaryOperator op = next().text.equals("+") ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
                left = new BinaryOpNode(op, left, multiplicative());
            }
            return left;
        }

        private FormulaNode multiplicative() {
            FormulaNode left = power();
            while (peekOperator("*", "/")) {
                BinaryOperator op = next().text.equals("*") ? BinaryOperator.MULTIPLY : BinaryOperator.DIVIDE;
                left = new BinaryOpNode(op, left, power());
            }
            return left;
        }

        private FormulaNode power() {
            FormulaNode left = unary();
            while (peekOperator("^")) {
                next();
                left = new BinaryOpNode(BinaryOperator.POWER, left, unary());
            }
            return left;
        }

        private FormulaNode unary() {
            if (peekOperator("-", "+")) {
                UnaryOperator op = next().text.equals("-") ? UnaryOperator.NEGATE : UnaryOperator.PLUS;
                enter();
                try {
                    return new UnaryOpNode(op, unary());
                } finally {
                    depth--;
                }
            }
            return percent();
        }

        private FormulaNode percent() {
            FormulaNode node = intersection();
            while (peekOperator("%")) {
                next();
                node = new UnaryOpNode(UnaryOperator.PERCENT, node);
            }
            return node;
        }

        private FormulaNode intersection() {
            FormulaNode node = primary();
            while (node.isReference() && peek().startsReference() && peek().spaceBefore) {
                Token at = peek();
                FormulaNode right = primary();
                if (!right.isReference()) {
                    throw new FormulaSyntaxException("Intersection needs two references", at.position);
                }
                node = new BinaryOpNode(BinaryOperator.INTERSECT, node, right);
            }
            return node;
        }

        private FormulaNode primary() {
            Token token = next();
            switch (token.type) {
                case NUMBER:
                    return new LiteralNode(CellValue.number(new BigDecimal(token.text)));
                case STRING:
                    return new LiteralNode(CellValue.text(token.text));
                case BOOLEAN:
                    return new LiteralNode(CellValue.bool(token.text.equals("TRUE")));
                case ERROR:
                    return new LiteralNode(CellValue.error(ErrorCode.valueOf(token.text)));
                case CELL:
                    return cellOrRange(null, token);
                case COLUMN_RANGE:
                    return columnRange(null, token);
                case ROW_RANGE:
                    return rowRange(null, token);
                case SHEET:
                    return sheetQualified(token);
                case FUNCTION:
                    return functionCall(token);
                case NAME:
                    references.add(Reference.name(token.text));
                    return new NameRefNode(token.text.toUpperCase());
                case LPAREN: {
                    FormulaNode inner = expression();
                    Token close = next();
                    if (close.type != TokenType.RPAREN) {
                        throw new FormulaSyntaxException("Expected ')'", close.position);
                    }
                    return inner;
                }
                case END:
                    throw new FormulaSyntaxException("Unexpected end of formula", token.position);
                default:
                    throw new FormulaSyntaxException("Unexpected '" + token.text + "'", token.position);
            }
        }

        private FormulaNode sheetQualified(Token sheet) {
            Token target = next();
            FormulaNode node;
            switch (target.type) {
                case CELL:
                    node = cellOrRange(sheet.text, target);
                    break;
                case COLUMN_RANGE:
                    node = columnRange(sheet.text, target);
                    break;
                case ROW_RANGE:
                    node = rowRange(sheet.text, target);
                    break;
                case ERROR:
                    return new LiteralNode(CellValue.error(ErrorCode.valueOf(target.text)));
                default:
                    throw new FormulaSyntaxException("Expected a reference after '" + sheet.text + "!'", target.position);
            }
            if (node instanceof LiteralNode) {
                return node;
            }
            return new SheetQualifiedRefNode(sheet.text, node);
        }

        private FormulaNode cellOrRange(String sheetName, Token first) {
            CellRefNode start = cellNode(first);
            if (peek().type == TokenType.COLON) {
                next();
                Token second = next();
                if (second.type != TokenType.CELL) {
                    throw new FormulaSyntaxException("Expected a cell after ':'", second.position);
                }
                CellRefNode end = cellNode(second);
                if (start == null || end == null) {
                    return outOfBounds();
                }
                RangeRefNode range = new RangeRefNode(start.getRow(), start.getColumn(), end.getRow(), end.getColumn());
                references.add(Reference.range(sheetName, range.getFirstRow(), range.getFirstColumn(),
                        range.getLastRow(), range.getLastColumn()));
                return range;
            }
            if (start == null) {
                return outOfBounds();
            }
            references.add(Reference.cell(sheetName, start.getRow(), start.getColumn()));
            return start;
        }

        /**
         * A reference past the last row or column of a sheet evaluates to #REF!.
         */
        private FormulaNode outOfBounds() {
            return new LiteralNode(CellValue.error(ErrorCode.REF));
        }

        private CellRefNode cellNode(Token token) {
            String text = token.text;
            CellAddress address = CellAddress.parse(0, text);
            if (address == null) {
                return null;
            }
            boolean columnAbsolute = text.startsWith("$");
            boolean rowAbsolute = text.indexOf('$', 1) > 0;
            return new CellRefNode(address.getRow(), address.getColumn(), rowAbsolute, columnAbsolute);
        }

        private FormulaNode columnRange(String sheetName, Token token) {
            String[] parts = token.text.replace("$", "").split(":");
            int first = CellAddress.columnIndex(parts[0]);
            int last = CellAddress.columnIndex(parts[1]);
            if (first >= CellAddress.MAX_COLUMNS || last >= CellAddress.MAX_COLUMNS) {
                return outOfBounds();
            }
            RangeRefNode range = new RangeRefNode(0, first, CellAddress.MAX_ROWS - 1, last);
            references.add(Reference.range(sheetName, range.getFirstRow(), range.getFirstColumn(),
                    range.getLastRow(), range.getLastColumn()));
            return range;
        }

        private FormulaNode rowRange(String sheetName, Token token) {
            String[] parts = token.text.replace("$", "").split(":");
            long first = Long.parseLong(parts[0]);
            long last = Long.parseLong(parts[1]);
            if (first < 1 || last < 1) {
                throw new FormulaSyntaxException("Row numbers start at 1", token.position);
            }
            if (first > CellAddress.MAX_ROWS || last > CellAddress.MAX_ROWS) {
                return outOfBounds();
            }
            RangeRefNode range = new RangeRefNode((int) first - 1, 0, (int) last - 1, CellAddress.MAX_COLUMNS - 1);
            references.add(Reference.range(sheetName, range.getFirstRow(), range.getFirstColumn(),
                    range.getLastRow(), range.getLastColumn()));
            return range;
        }

        private FormulaNode functionCall(Token name) {
            Token open = next();
            if (open.type != TokenType.LPAREN) {
                throw new FormulaSyntaxException("Expected '(' after " + name.text, open.position);
            }
            enter();
            try {
                List<FormulaNode> arguments = new ArrayList<>();
                if (peek().type == TokenType.RPAREN) {
                    next();
                    return new FunctionCallNode(name.text, arguments);
                }
                while (true) {
                    TokenType upcoming = peek().type;
                    if (upcoming == TokenType.SEPARATOR || upcoming == TokenType.RPAREN) {
                        arguments.add(new LiteralNode(CellValue.BLANK));
                    } else {
                        arguments.add(expression());
                    }
                    Token after = next();
                    if (after.type == TokenType.RPAREN) {
                        return new FunctionCallNode(name.text, arguments);
                    }
                    if (after.type != TokenType.SEPARATOR) {
                        throw new FormulaSyntaxException("Expected ',' or ')' in " + name.text, after.position);
                    }
                }
            } finally {
                depth--;
            }
        }
    }
}
