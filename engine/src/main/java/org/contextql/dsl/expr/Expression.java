package org.contextql.dsl.expr;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * AST of a metric expression or a filter/rule condition.
 *
 * The engine inlines expression text verbatim into compiled queries; the AST
 * exists so the validator can check syntax and collect the column references
 * and parameter placeholders an expression uses.
 */
public sealed interface Expression
        permits Expression.ColumnRef, Expression.Literal, Expression.Parameter,
        Expression.BinaryOp, Expression.UnaryOp, Expression.FunctionCall,
        Expression.CaseExpr, Expression.InExpr, Expression.BetweenExpr,
        Expression.IsNullExpr, Expression.CastExpr {

    /**
     * @return Direct sub-expressions, in source order
     */
    List<Expression> children();

    /**
     * Visits this node and all its descendants depth-first, in source order.
     */
    default void walk(Consumer<Expression> visitor) {
        visitor.accept(this);
        for (Expression child : children()) {
            child.walk(visitor);
        }
    }

    /**
     * @return All column references, in source order
     */
    default List<ColumnRef> columnReferences() {
        List<ColumnRef> refs = new ArrayList<>();
        walk(e -> {
            if (e instanceof ColumnRef ref) {
                refs.add(ref);
            }
        });
        return refs;
    }

    /**
     * @return Names of all {@code {name}} placeholders, in order of first use
     */
    default Set<String> parameterNames() {
        Set<String> names = new LinkedHashSet<>();
        walk(e -> {
            if (e instanceof Parameter p) {
                names.add(p.name());
            }
        });
        return names;
    }

    // ==================== Factory Methods ====================

    static ColumnRef column(String name) {
        return new ColumnRef(null, name);
    }

    static ColumnRef column(String qualifier, String name) {
        return new ColumnRef(qualifier, name);
    }

    static Literal stringLiteral(String value) {
        return new Literal(LiteralType.STRING, value);
    }

    static Literal intLiteral(long value) {
        return new Literal(LiteralType.INTEGER, value);
    }

    static Literal decimalLiteral(double value) {
        return new Literal(LiteralType.DECIMAL, value);
    }

    static Literal boolLiteral(boolean value) {
        return new Literal(LiteralType.BOOLEAN, value);
    }

    static Literal nullLiteral() {
        return new Literal(LiteralType.NULL, null);
    }

    // ==================== AST Node Types ====================

    /**
     * Column reference: dataset.column or just column. {@code COUNT(*)} is
     * represented with the column name {@code *}.
     */
    record ColumnRef(String qualifier, String columnName) implements Expression {
        public boolean isQualified() {
            return qualifier != null;
        }

        public boolean isStar() {
            return "*".equals(columnName);
        }

        @Override
        public List<Expression> children() {
            return List.of();
        }
    }

    /**
     * Literal value: 'string', 123, 45.67, TRUE, NULL
     */
    record Literal(LiteralType type, Object value) implements Expression {
        @Override
        public List<Expression> children() {
            return List.of();
        }
    }

    enum LiteralType {
        STRING, INTEGER, DECIMAL, BOOLEAN, NULL
    }

    /**
     * Filter parameter placeholder: {name}
     */
    record Parameter(String name) implements Expression {
        @Override
        public List<Expression> children() {
            return List.of();
        }
    }

    record BinaryOp(Expression left, BinaryOperator operator, Expression right) implements Expression {
        @Override
        public List<Expression> children() {
            return List.of(left, right);
        }
    }

    enum BinaryOperator {
        // Comparison
        EQ, NE, LT, LE, GT, GE,
        // Logical
        AND, OR,
        // Arithmetic
        PLUS, MINUS, MULTIPLY, DIVIDE, MODULO,
        // String
        CONCAT, LIKE, ILIKE
    }

    record UnaryOp(UnaryOperator operator, Expression operand) implements Expression {
        @Override
        public List<Expression> children() {
            return List.of(operand);
        }
    }

    enum UnaryOperator {
        NOT, MINUS, PLUS
    }

    /**
     * Function call: SUM(x), COUNT(DISTINCT y), COALESCE(a, b)
     */
    record FunctionCall(String functionName, List<Expression> arguments, boolean distinct) implements Expression {
        public FunctionCall {
            arguments = List.copyOf(arguments);
        }

        @Override
        public List<Expression> children() {
            return arguments;
        }
    }

    /**
     * CASE WHEN cond THEN result ... ELSE default END
     */
    record CaseExpr(List<WhenClause> whenClauses, Expression elseExpr) implements Expression {
        public CaseExpr {
            whenClauses = List.copyOf(whenClauses);
        }

        @Override
        public List<Expression> children() {
            List<Expression> children = new ArrayList<>();
            for (WhenClause clause : whenClauses) {
                children.add(clause.condition());
                children.add(clause.result());
            }
            if (elseExpr != null) {
                children.add(elseExpr);
            }
            return children;
        }
    }

    record WhenClause(Expression condition, Expression result) {
    }

    record InExpr(Expression operand, List<Expression> values, boolean negated) implements Expression {
        public InExpr {
            values = List.copyOf(values);
        }

        @Override
        public List<Expression> children() {
            List<Expression> children = new ArrayList<>();
            children.add(operand);
            children.addAll(values);
            return children;
        }
    }

    record BetweenExpr(Expression operand, Expression low, Expression high, boolean negated) implements Expression {
        @Override
        public List<Expression> children() {
            return List.of(operand, low, high);
        }
    }

    record IsNullExpr(Expression operand, boolean negated) implements Expression {
        @Override
        public List<Expression> children() {
            return List.of(operand);
        }
    }

    /**
     * CAST(expr AS type), expr::type, or a typed literal such as DATE '2024-01-01'
     */
    record CastExpr(Expression expression, String targetType) implements Expression {
        @Override
        public List<Expression> children() {
            return List.of(expression);
        }
    }
}
