package com.asiainfo.semantic.core.measure;

import com.asiainfo.semantic.core.exception.MeasureDefinitionException;
import com.asiainfo.semantic.core.filter.ColumnPredicate;
import com.asiainfo.semantic.core.filter.Predicates;
import com.asiainfo.semantic.core.graph.RelationshipGraph;
import com.asiainfo.semantic.core.model.ColumnDef;
import com.asiainfo.semantic.core.model.ColumnRef;
import com.asiainfo.semantic.core.model.ColumnType;
import com.asiainfo.semantic.core.model.Relationship;
import com.asiainfo.semantic.core.model.Values;
import com.asiainfo.semantic.core.schema.SchemaRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 度量表达式解析器（递归下降）
 *
 * <pre>
 * expr      := term (('+' | '-') term)*
 * term      := unary (('*' | '/') unary)*
 * unary     := '-' unary | primary
 * primary   := NUMBER | '[' measure ']' | '(' expr ')' | FUNC '(' args ')'
 * column    := Table '[' Column ']' | 'Quoted Table' '[' Column ']'
 * filterArg := column op literal | column IN { literal, ... } | column BETWEEN literal AND literal
 *            | ISBLANK(column) | USERELATIONSHIP(Fact[col], Dim[col])
 * </pre>
 *
 * 函数: COUNT, COUNTROWS, DISTINCTCOUNT, SUM, AVERAGE, MIN, MAX, PERCENTILE, DIVIDE, FILTERED, LASTNDAYS。
 * '/' 等价于 DIVIDE（安全除法）。列引用在解析时即按模型校验，字面量按列类型转换。
 */
public final class MeasureExpressionParser {

    /** 十进制数字，至多一个小数点 */
    private static final Pattern NUMBER_LITERAL = Pattern.compile("\\d+(\\.\\d*)?|\\.\\d+");

    private final String measureName;
    private final String text;
    private final SchemaRegistry schema;
    private final RelationshipGraph graph;
    private final List<Token> tokens;
    private int pos;

    private MeasureExpressionParser(String measureName, String text, SchemaRegistry schema, RelationshipGraph graph) {
        this.measureName = measureName;
        this.text = text;
        this.schema = schema;
        this.graph = graph;
        this.tokens = tokenize();
    }

    public static MeasureExpr parse(String measureName, String expression, SchemaRegistry schema, RelationshipGraph graph) {
        if (expression == null || expression.isBlank()) {
            throw new MeasureDefinitionException(measureName, "expression is empty");
        }
        MeasureExpressionParser parser = new MeasureExpressionParser(measureName, expression, schema, graph);
        MeasureExpr expr = parser.expression();
        if (parser.peek().type != TokenType.EOF) {
            throw parser.error("unexpected '" + parser.peek().text + "'");
        }
        return expr;
    }

    // ==================== 表达式 ====================

    private MeasureExpr expression() {
        MeasureExpr left = term();
        while (peek().type == TokenType.PLUS || peek().type == TokenType.MINUS) {
            ArithmeticExpr.Operator op = next().type == TokenType.PLUS
                    ? ArithmeticExpr.Operator.ADD
                    : ArithmeticExpr.Operator.SUBTRACT;
            left = new ArithmeticExpr(op, left, term());
        }
        return left;
    }

    private MeasureExpr term() {
        MeasureExpr left = unary();
        while (peek().type == TokenType.STAR || peek().type == TokenType.SLASH) {
            if (next().type == TokenType.STAR) {
                left = new ArithmeticExpr(ArithmeticExpr.Operator.MULTIPLY, left, unary());
            } else {
                left = new DivideExpr(left, unary());
            }
        }
        return left;
    }

    private MeasureExpr unary() {
        if (peek().type == TokenType.MINUS) {
            next();
            return new ArithmeticExpr(ArithmeticExpr.Operator.SUBTRACT, new ConstantExpr(0), unary());
        }
        return primary();
    }

    private MeasureExpr primary() {
        Token t = next();
        switch (t.type) {
            case NUMBER:
                return new ConstantExpr(Double.parseDouble(t.text));
            case BRACKET:
                return new MeasureRefExpr(t.text);
            case LPAREN: {
                MeasureExpr inner = expression();
                expect(TokenType.RPAREN);
                return inner;
            }
            case IDENT:
                if (peek().type == TokenType.LPAREN) {
                    next();
                    return function(t.text.toUpperCase(Locale.ROOT));
                }
                if (peek().type == TokenType.BRACKET) {
                    throw error("bare column reference " + t.text + "[" + peek().text + "] must be aggregated");
                }
                throw error("unknown identifier '" + t.text + "'");
            case QUOTED:
                throw error("bare column reference on table '" + t.text + "' must be aggregated");
            default:
                throw error("unexpected '" + t.text + "'", t);
        }
    }

    private MeasureExpr function(String name) {
        MeasureExpr result;
        switch (name) {
            case "COUNT":
            case "DISTINCTCOUNT":
            case "SUM":
            case "AVERAGE":
            case "MIN":
            case "MAX": {
                AggFunc func = AggFunc.valueOf(name);
                ColumnRef col = column();
                ColumnDef def = schema.requireColumn(col);
                requireFact(col.table(), name);
                if (func.requiresNumeric() && def.type() != ColumnType.NUMERIC) {
                    throw error(name + " requires a numeric column, " + col + " is " + def.type());
                }
                result = new AggregateExpr(func, col.table(), col.column());
                break;
            }
            case "COUNTROWS": {
                String table = tableName();
                requireFact(table, name);
                result = new AggregateExpr(AggFunc.COUNTROWS, table, null);
                break;
            }
            case "PERCENTILE": {
                ColumnRef col = column();
                ColumnDef def = schema.requireColumn(col);
                requireFact(col.table(), name);
                if (def.type() != ColumnType.NUMERIC) {
                    throw error("PERCENTILE requires a numeric column, " + col + " is " + def.type());
                }
                expect(TokenType.COMMA);
                double fraction = number();
                if (fraction < 0d || fraction > 1d) {
                    throw error("percentile fraction must be within [0, 1]: " + fraction);
                }
                result = new PercentileExpr(col.table(), col.column(), fraction);
                break;
            }
            case "DIVIDE": {
                MeasureExpr numerator = expression();
                expect(TokenType.COMMA);
                MeasureExpr denominator = expression();
                result = new DivideExpr(numerator, denominator);
                break;
            }
            case "FILTERED":
            case "CALCULATE":
                result = filtered();
                break;
            case "LASTNDAYS": {
                MeasureExpr base = expression();
                expect(TokenType.COMMA);
                ColumnRef dateCol = column();
                if (schema.requireColumn(dateCol).type() != ColumnType.DATE) {
                    throw error("LASTNDAYS requires a date column, " + dateCol + " is not");
                }
                expect(TokenType.COMMA);
                double days = number();
                if (days < 0 || days != Math.rint(days)) {
                    throw error("LASTNDAYS window must be a non-negative integer: " + days);
                }
                result = new LastNDaysExpr(base, dateCol, (int) days);
                break;
            }
            default:
                throw error("unknown function " + name);
        }
        expect(TokenType.RPAREN);
        return result;
    }

    private MeasureExpr filtered() {
        MeasureExpr base = expression();
        List<ColumnFilter> filters = new ArrayList<>();
        List<String> relationships = new ArrayList<>();
        while (peek().type == TokenType.COMMA) {
            next();
            Token t = peek();
            if (t.type == TokenType.IDENT && peekAt(1).type == TokenType.LPAREN) {
                String fn = t.text.toUpperCase(Locale.ROOT);
                if ("USERELATIONSHIP".equals(fn)) {
                    next();
                    next();
                    relationships.add(useRelationship());
                    expect(TokenType.RPAREN);
                    continue;
                }
                if ("ISBLANK".equals(fn)) {
                    next();
                    next();
                    ColumnRef col = column();
                    schema.requireColumn(col);
                    expect(TokenType.RPAREN);
                    filters.add(new ColumnFilter(col, Predicates.isNull()));
                    continue;
                }
            }
            filters.add(filterArg());
        }
        if (filters.isEmpty() && relationships.isEmpty()) {
            throw error("FILTERED needs at least one filter argument");
        }
        return new FilteredExpr(base, filters, relationships);
    }

    private ColumnFilter filterArg() {
        ColumnRef col = column();
        ColumnType type = schema.requireColumn(col).type();
        Token op = next();
        ColumnPredicate predicate;
        switch (op.type) {
            case EQ:
                predicate = Predicates.eq(literal(type));
                break;
            case LT:
                predicate = Predicates.lessThan(literal(type));
                break;
            case LE:
                predicate = Predicates.atMost(literal(type));
                break;
            case GT:
                predicate = Predicates.greaterThan(literal(type));
                break;
            case GE:
                predicate = Predicates.atLeast(literal(type));
                break;
            case IDENT:
                String keyword = op.text.toUpperCase(Locale.ROOT);
                if ("IN".equals(keyword)) {
                    expect(TokenType.LBRACE);
                    List<Object> values = new ArrayList<>();
                    if (peek().type != TokenType.RBRACE) {
                        values.add(literal(type));
                        while (peek().type == TokenType.COMMA) {
                            next();
                            values.add(literal(type));
                        }
                    }
                    expect(TokenType.RBRACE);
                    predicate = Predicates.in(values);
                    break;
                }
                if ("BETWEEN".equals(keyword)) {
                    Object lower = literal(type);
                    Token and = next();
                    if (and.type != TokenType.IDENT || !"AND".equalsIgnoreCase(and.text)) {
                        throw error("expected AND in BETWEEN", and);
                    }
                    predicate = Predicates.between(lower, literal(type));
                    break;
                }
                throw error("unknown filter operator '" + op.text + "'", op);
            default:
                throw error("expected a comparison after " + col, op);
        }
        return new ColumnFilter(col, predicate);
    }

    /**
     * USERELATIONSHIP(Fact[col], Dim[col])，参数顺序不限
     */
    private String useRelationship() {
        ColumnRef a = column();
        expect(TokenType.COMMA);
        ColumnRef b = column();
        ColumnRef factSide = schema.isFact(a.table()) ? a : b;
        ColumnRef dimSide = factSide == a ? b : a;
        for (Relationship rel : graph.candidates(factSide.table(), dimSide.table())) {
            if (rel.factColumn().equals(factSide.column()) && rel.dimensionColumn().equals(dimSide.column())) {
                return rel.id();
            }
        }
        throw error("no relationship between " + a + " and " + b);
    }

    private void requireFact(String table, String function) {
        if (!schema.isFact(table)) {
            throw error(function + " must aggregate a fact table, " + table + " is not one");
        }
    }

    // ==================== 终结符 ====================

    private ColumnRef column() {
        String table = tableName();
        Token col = next();
        if (col.type != TokenType.BRACKET) {
            throw error("expected [column] after " + table, col);
        }
        ColumnRef ref = ColumnRef.of(table, col.text);
        if (schema.findColumn(ref).isEmpty()) {
            throw error("unknown column " + ref);
        }
        return ref;
    }

    private String tableName() {
        Token t = next();
        if (t.type != TokenType.IDENT && t.type != TokenType.QUOTED) {
            throw error("expected a table name", t);
        }
        if (schema.table(t.text).isEmpty()) {
            throw error("unknown table " + t.text);
        }
        return t.text;
    }

    private Object literal(ColumnType type) {
        Token t = next();
        Object raw;
        switch (t.type) {
            case NUMBER:
                raw = Values.normalize(Double.parseDouble(t.text));
                break;
            case MINUS: {
                Token n = next();
                if (n.type != TokenType.NUMBER) throw error("expected a number after '-'", n);
                raw = Values.normalize(-Double.parseDouble(n.text));
                break;
            }
            case STRING:
                raw = t.text;
                break;
            default:
                throw error("expected a literal", t);
        }
        try {
            return type.coerce(raw);
        } catch (IllegalArgumentException e) {
            throw new MeasureDefinitionException(measureName, e.getMessage(), e);
        }
    }

    private double number() {
        Token t = next();
        boolean negative = false;
        if (t.type == TokenType.MINUS) {
            negative = true;
            t = next();
        }
        if (t.type != TokenType.NUMBER) {
            throw error("expected a number", t);
        }
        double v = Double.parseDouble(t.text);
        return negative ? -v : v;
    }

    // ==================== 词法 ====================

    private enum TokenType {
        IDENT, QUOTED, BRACKET, NUMBER, STRING,
        LPAREN, RPAREN, LBRACE, RBRACE, COMMA,
        PLUS, MINUS, STAR, SLASH,
        EQ, LT, LE, GT, GE,
        EOF
    }

    private record Token(TokenType type, String text, int position) {}

    private List<Token> tokenize() {
        List<Token> result = new ArrayList<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            int start = i;
            switch (c) {
                case '(' -> { result.add(new Token(TokenType.LPAREN, "(", start)); i++; }
                case ')' -> { result.add(new Token(TokenType.RPAREN, ")", start)); i++; }
                case '{' -> { result.add(new Token(TokenType.LBRACE, "{", start)); i++; }
                case '}' -> { result.add(new Token(TokenType.RBRACE, "}", start)); i++; }
                case ',' -> { result.add(new Token(TokenType.COMMA, ",", start)); i++; }
                case '+' -> { result.add(new Token(TokenType.PLUS, "+", start)); i++; }
                case '-' -> { result.add(new Token(TokenType.MINUS, "-", start)); i++; }
                case '*' -> { result.add(new Token(TokenType.STAR, "*", start)); i++; }
                case '/' -> { result.add(new Token(TokenType.SLASH, "/", start)); i++; }
                case '=' -> { result.add(new Token(TokenType.EQ, "=", start)); i += text.startsWith("==", i) ? 2 : 1; }
                case '<' -> {
                    boolean le = i + 1 < n && text.charAt(i + 1) == '=';
                    result.add(new Token(le ? TokenType.LE : TokenType.LT, le ? "<=" : "<", start));
                    i += le ? 2 : 1;
                }
                case '>' -> {
                    boolean ge = i + 1 < n && text.charAt(i + 1) == '=';
                    result.add(new Token(ge ? TokenType.GE : TokenType.GT, ge ? ">=" : ">", start));
                    i += ge ? 2 : 1;
                }
                case '[' -> {
                    int end = text.indexOf(']', i + 1);
                    if (end < 0) throw error("unterminated '['", start);
                    result.add(new Token(TokenType.BRACKET, text.substring(i + 1, end), start));
                    i = end + 1;
                }
                case '\'' -> {
                    int end = text.indexOf('\'', i + 1);
                    if (end < 0) throw error("unterminated quoted table name", start);
                    result.add(new Token(TokenType.QUOTED, text.substring(i + 1, end), start));
                    i = end + 1;
                }
                case '"' -> {
                    int end = text.indexOf('"', i + 1);
                    if (end < 0) throw error("unterminated string literal", start);
                    result.add(new Token(TokenType.STRING, text.substring(i + 1, end), start));
                    i = end + 1;
                }
                default -> {
                    if (Character.isDigit(c) || c == '.') {
                        while (i < n && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) i++;
                        String number = text.substring(start, i);
                        if (!NUMBER_LITERAL.matcher(number).matches()) {
                            throw error("malformed number '" + number + "'", start);
                        }
                        result.add(new Token(TokenType.NUMBER, number, start));
                    } else if (Character.isLetter(c) || c == '_') {
                        while (i < n && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) i++;
                        result.add(new Token(TokenType.IDENT, text.substring(start, i), start));
                    } else {
                        throw error("unexpected character '" + c + "'", start);
                    }
                }
            }
        }
        result.add(new Token(TokenType.EOF, "<end>", n));
        return result;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.type != TokenType.EOF) pos++;
        return t;
    }

    private void expect(TokenType type) {
        Token t = next();
        if (t.type != type) {
            throw error("expected " + type + " but found '" + t.text + "'", t);
        }
    }

    private MeasureDefinitionException error(String message) {
        return error(message, tokens.get(Math.max(0, pos - 1)));
    }

    private MeasureDefinitionException error(String message, Token at) {
        return error(message, at.position);
    }

    private MeasureDefinitionException error(String message, int position) {
        return new MeasureDefinitionException(measureName, message + " (at position " + position + ")");
    }
}
