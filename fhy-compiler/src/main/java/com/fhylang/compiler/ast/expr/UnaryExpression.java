package com.fhylang.compiler.ast.expr;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;

/**
 * Prefix unary expression.
 */
public class UnaryExpression extends Expression {
    private final UnaryOp operator;
    private final Expression operand;

    public UnaryExpression(SourceLocation location, UnaryOp operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnaryExpression(this, context);
    }

    /**
     * Unary operators
     */
    public enum UnaryOp {
        NEGATIVE("-"),
        POSITIVE("+"),
        LOGICAL_NOT("!"),
        BITWISE_NOT("~");

        private final String source;

        UnaryOp(String source) {
            this.source = source;
        }

        /** Operator as written in FhY source */
        public String toSourceString() {
            return source;
        }

        /** Looks up an operator by its source spelling, or {@code null}. */
        public static UnaryOp fromSource(String text) {
            for (UnaryOp op : values()) {
                if (op.source.equals(text)) {
                    return op;
                }
            }
            return null;
        }
    }
}
