package org.contextql.dsl.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

import static org.contextql.dsl.expr.Token.*;

/**
 * Recursive descent parser for metric expressions and filter/rule conditions.
 *
 * The accepted language is the scalar expression subset of SQL: boolean and
 * arithmetic operators, comparisons, IN / BETWEEN / LIKE / IS NULL, CASE,
 * CAST, function calls (including aggregates), and {@code {name}} parameter
 * placeholders. Subqueries are rejected.
 */
public final class ExpressionParser {

    /** Identifiers that introduce a typed literal when followed by a string. */
    private static final Set<String> TYPED_LITERALS = Set.of("DATE", "TIME", "TIMESTAMP", "INTERVAL");

    private final Lexer lexer;

    public ExpressionParser(String text) {
        this.lexer = new Lexer(text);
    }

    /**
     * Parses a complete expression.
     *
     * @throws ExpressionParseException if the text is blank, malformed, or has
     *                                  trailing input
     */
    public static Expression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ExpressionParseException("Expression is empty", 0);
        }
        ExpressionParser parser = new ExpressionParser(text);
        Expression expression = parser.parseExpression();
        if (!parser.check(EOF)) {
            throw parser.error("Unexpected trailing input");
        }
        return expression;
    }

    // ==================== Token Helpers ====================

    private Token current() {
        return lexer.token();
    }

    private String stringVal() {
        return lexer.stringVal();
    }

    private boolean check(Token t) {
        return current() == t;
    }

    private void advance() {
        lexer.nextToken();
    }

    private boolean consumeIf(Token t) {
        if (check(t)) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(Token t) {
        if (!check(t)) {
            throw error("Expected " + t + ", got " + current());
        }
        advance();
    }

    private String expectIdentifier() {
        if (check(IDENTIFIER) || check(QUOTED_IDENTIFIER)) {
            String val = stringVal();
            advance();
            return val;
        }
        throw error("Expected identifier");
    }

    private ExpressionParseException error(String message) {
        return new ExpressionParseException(message + " at " + lexer.info(), lexer.tokenPos());
    }

    private <T> List<T> parseList(Supplier<T> parser) {
        List<T> items = new ArrayList<>();
        do {
            items.add(parser.get());
        } while (consumeIf(COMMA));
        return items;
    }

    private boolean peekIs(Token t) {
        Lexer.SavePoint mark = lexer.mark();
        advance();
        boolean result = check(t);
        lexer.reset(mark);
        return result;
    }

    // ==================== Expressions ====================

    public Expression parseExpression() {
        return parseOrExpr();
    }

    private Expression parseOrExpr() {
        Expression left = parseAndExpr();
        while (consumeIf(OR)) {
            Expression right = parseAndExpr();
            left = new Expression.BinaryOp(left, Expression.BinaryOperator.OR, right);
        }
        return left;
    }

    private Expression parseAndExpr() {
        Expression left = parseNotExpr();
        while (consumeIf(AND)) {
            Expression right = parseNotExpr();
            left = new Expression.BinaryOp(left, Expression.BinaryOperator.AND, right);
        }
        return left;
    }

    private Expression parseNotExpr() {
        if (consumeIf(NOT)) {
            return new Expression.UnaryOp(Expression.UnaryOperator.NOT, parseNotExpr());
        }
        return parseComparisonExpr();
    }

    private Expression parseComparisonExpr() {
        Expression left = parseAddExpr();

        // IS NULL / IS NOT NULL
        if (consumeIf(IS)) {
            boolean negated = consumeIf(NOT);
            expect(NULL);
            return new Expression.IsNullExpr(left, negated);
        }

        // BETWEEN
        if (check(BETWEEN) || (check(NOT) && peekIs(BETWEEN))) {
            boolean negated = consumeIf(NOT);
            expect(BETWEEN);
            Expression low = parseAddExpr();
            expect(AND);
            Expression high = parseAddExpr();
            return new Expression.BetweenExpr(left, low, high, negated);
        }

        // IN
        if (check(IN) || (check(NOT) && peekIs(IN))) {
            boolean negated = consumeIf(NOT);
            expect(IN);
            expect(LPAREN);
            if (check(SELECT)) {
                throw error("Subqueries are not supported");
            }
            List<Expression> values = parseList(this::parseExpression);
            expect(RPAREN);
            return new Expression.InExpr(left, values, negated);
        }

        // LIKE / ILIKE, optionally negated
        if (check(LIKE) || check(ILIKE) || (check(NOT) && (peekIs(LIKE) || peekIs(ILIKE)))) {
            boolean negated = consumeIf(NOT);
            Expression.BinaryOperator op = check(LIKE) ? Expression.BinaryOperator.LIKE
                    : Expression.BinaryOperator.ILIKE;
            advance();
            Expression like = new Expression.BinaryOp(left, op, parseAddExpr());
            return negated ? new Expression.UnaryOp(Expression.UnaryOperator.NOT, like) : like;
        }

        if (current().isComparisonOp()) {
            Expression.BinaryOperator op = switch (current()) {
                case EQ -> Expression.BinaryOperator.EQ;
                case NE -> Expression.BinaryOperator.NE;
                case LT -> Expression.BinaryOperator.LT;
                case LE -> Expression.BinaryOperator.LE;
                case GT -> Expression.BinaryOperator.GT;
                case GE -> Expression.BinaryOperator.GE;
                default -> throw error("Unexpected comparison operator");
            };
            advance();
            return new Expression.BinaryOp(left, op, parseAddExpr());
        }

        return left;
    }

    private Expression parseAddExpr() {
        Expression left = parseMulExpr();
        while (check(PLUS) || check(MINUS) || check(CONCAT)) {
            Expression.BinaryOperator op = switch (current()) {
                case PLUS -> Expression.BinaryOperator.PLUS;
                case MINUS -> Expression.BinaryOperator.MINUS;
                case CONCAT -> Expression.BinaryOperator.CONCAT;
                default -> throw error("Unexpected");
            };
            advance();
            left = new Expression.BinaryOp(left, op, parseMulExpr());
        }
        return left;
    }

    private Expression parseMulExpr() {
        Expression left = parseUnaryExpr();
        while (check(STAR) || check(SLASH) || check(PERCENT)) {
            Expression.BinaryOperator op = switch (current()) {
                case STAR -> Expression.BinaryOperator.MULTIPLY;
                case SLASH -> Expression.BinaryOperator.DIVIDE;
                case PERCENT -> Expression.BinaryOperator.MODULO;
                default -> throw error("Unexpected");
            };
            advance();
            left = new Expression.BinaryOp(left, op, parseUnaryExpr());
        }
        return left;
    }

    private Expression parseUnaryExpr() {
        if (consumeIf(MINUS)) {
            return new Expression.UnaryOp(Expression.UnaryOperator.MINUS, parseUnaryExpr());
        }
        if (consumeIf(PLUS)) {
            return new Expression.UnaryOp(Expression.UnaryOperator.PLUS, parseUnaryExpr());
        }
        return parsePostfixCast(parsePrimaryExpr());
    }

    private Expression parsePostfixCast(Expression expr) {
        Expression result = expr;
        while (consumeIf(DOUBLE_COLON)) {
            result = new Expression.CastExpr(result, parseTypeName());
        }
        return result;
    }

    /**
     * Type name with optional modifiers: {@code INTEGER}, {@code DECIMAL(10, 2)}.
     */
    private String parseTypeName() {
        String name = expectIdentifier();
        if (!consumeIf(LPAREN)) {
            return name;
        }
        List<String> modifiers = parseList(() -> {
            if (!check(INTEGER)) {
                throw error("Expected type modifier");
            }
            String modifier = stringVal();
            advance();
            return modifier;
        });
        expect(RPAREN);
        return name + "(" + String.join(", ", modifiers) + ")";
    }

    private Expression parsePrimaryExpr() {
        if (check(CASE)) {
            return parseCaseExpr();
        }

        if (consumeIf(CAST)) {
            expect(LPAREN);
            Expression expr = parseExpression();
            expect(AS);
            String type = parseTypeName();
            expect(RPAREN);
            return new Expression.CastExpr(expr, type);
        }

        if (consumeIf(LPAREN)) {
            if (check(SELECT)) {
                throw error("Subqueries are not supported");
            }
            Expression expr = parseExpression();
            expect(RPAREN);
            return expr;
        }

        if (check(PARAMETER)) {
            String name = stringVal();
            advance();
            return new Expression.Parameter(name);
        }

        // Literals
        if (check(STRING)) {
            String val = stringVal();
            advance();
            return Expression.stringLiteral(val);
        }
        if (check(INTEGER)) {
            String text = stringVal();
            advance();
            try {
                return Expression.intLiteral(Long.parseLong(text));
            } catch (NumberFormatException e) {
                return Expression.decimalLiteral(Double.parseDouble(text));
            }
        }
        if (check(DECIMAL)) {
            double val = Double.parseDouble(stringVal());
            advance();
            return Expression.decimalLiteral(val);
        }
        if (consumeIf(TRUE))
            return Expression.boolLiteral(true);
        if (consumeIf(FALSE))
            return Expression.boolLiteral(false);
        if (consumeIf(NULL))
            return Expression.nullLiteral();

        if (current().isStatementKeyword()) {
            throw error("Statement keyword " + current() + " is not allowed in an expression");
        }

        return parseIdentifierExpr();
    }

    private Expression parseIdentifierExpr() {
        boolean quoted = check(QUOTED_IDENTIFIER);
        String name = expectIdentifier();

        if (consumeIf(LPAREN)) {
            // EXTRACT(YEAR FROM expr): the field is a keyword, not a column
            if (name.equalsIgnoreCase("EXTRACT") && check(IDENTIFIER) && peekIs(FROM)) {
                String field = stringVal().toUpperCase(Locale.ROOT);
                advance();
                expect(FROM);
                Expression source = parseExpression();
                expect(RPAREN);
                return new Expression.FunctionCall(name, List.of(Expression.stringLiteral(field), source), false);
            }

            // COUNT(*)
            if (name.equalsIgnoreCase("COUNT") && consumeIf(STAR)) {
                expect(RPAREN);
                return new Expression.FunctionCall(name, List.of(Expression.column("*")), false);
            }

            boolean distinct = consumeIf(DISTINCT);
            List<Expression> args = check(RPAREN) ? List.of() : parseList(this::parseExpression);
            expect(RPAREN);
            return new Expression.FunctionCall(name, args, distinct);
        }

        // Qualified column: dataset.column
        if (consumeIf(DOT)) {
            String column = expectIdentifier();
            return Expression.column(name, column);
        }

        // Typed literal: DATE '2024-01-01', INTERVAL '30 days'
        if (!quoted && check(STRING) && TYPED_LITERALS.contains(name.toUpperCase(Locale.ROOT))) {
            String val = stringVal();
            advance();
            return new Expression.CastExpr(Expression.stringLiteral(val), name.toUpperCase(Locale.ROOT));
        }

        return Expression.column(name);
    }

    private Expression.CaseExpr parseCaseExpr() {
        expect(CASE);
        List<Expression.WhenClause> whenClauses = new ArrayList<>();

        while (consumeIf(WHEN)) {
            Expression condition = parseExpression();
            expect(THEN);
            Expression result = parseExpression();
            whenClauses.add(new Expression.WhenClause(condition, result));
        }
        if (whenClauses.isEmpty()) {
            throw error("CASE requires at least one WHEN clause");
        }

        Expression elseExpr = null;
        if (consumeIf(ELSE)) {
            elseExpr = parseExpression();
        }

        expect(END);
        return new Expression.CaseExpr(whenClauses, elseExpr);
    }
}
