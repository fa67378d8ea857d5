package com.fhylang.compiler.ast.stmt;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;
import com.fhylang.compiler.ast.expr.Expression;

/**
 * Return statement. The value is mandatory.
 */
public class ReturnStatement extends Statement {
    private final Expression expression;

    public ReturnStatement(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitReturnStatement(this, context);
    }
}
