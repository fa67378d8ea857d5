package com.fhylang.compiler.ast.expr;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;

/**
 * Binary expression.
 */
public class BinaryExpression extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpression(SourceLocation location, BinaryOp operator, Expression left, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpression(this, context);
    }

    /**
     * Binary operators, with their binding strength (higher binds tighter).
     */
    public enum BinaryOp {
        // arithmetic
        POWER("**", 11),
        MULTIPLY("*", 10),
        DIVIDE("/", 10),
        MODULO("%", 10),
        ADD("+", 9),
        SUBTRACT("-", 9),

        // bitwise shifts
        LEFT_SHIFT("<<", 8),
        RIGHT_SHIFT(">>", 8),

        // comparison
        LESS_THAN("<", 7),
        LESS_THAN_OR_EQUAL("<=", 7),
        GREATER_THAN(">", 7),
        GREATER_THAN_OR_EQUAL(">=", 7),
        EQUAL("==", 6),
        NOT_EQUAL("!=", 6),

        // bitwise
        BITWISE_AND("&", 5),
        BITWISE_XOR("^", 4),
        BITWISE_OR("|", 3),

        // logical
        LOGICAL_AND("&&", 2),
        LOGICAL_OR("||", 1);

        private final String source;
        private final int precedence;

        BinaryOp(String source, int precedence) {
            this.source = source;
            this.precedence = precedence;
        }

        /** Operator as written in FhY source */
        public String toSourceString() {
            return source;
        }

        public int getPrecedence() {
            return precedence;
        }

        /** {@code **} groups to the right; every other operator groups to the left. */
        public boolean isRightAssociative() {
            return this == POWER;
        }

        /** Looks up an operator by its source spelling, or {@code null}. */
        public static BinaryOp fromSource(String text) {
            for (BinaryOp op : values()) {
                if (op.source.equals(text)) {
                    return op;
                }
            }
            return null;
        }
    }
}
