package com.fhylang.compiler.ast.stmt;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;
import com.fhylang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * If statement. An {@code else if} chain keeps the nested selection as the only
 * statement of the false body.
 */
public class SelectionStatement extends Statement {
    private final Expression condition;
    private final List<Statement> trueBody;
    private final List<Statement> falseBody;  // empty when there is no else

    public SelectionStatement(SourceLocation location, Expression condition,
                              List<Statement> trueBody, List<Statement> falseBody) {
        super(location);
        this.condition = condition;
        this.trueBody = immutable(trueBody);
        this.falseBody = immutable(falseBody);
    }

    public Expression getCondition() {
        return condition;
    }

    /**
     * Statements run when the condition holds.
     */
    public List<Statement> getTrueBody() {
        return trueBody;
    }

    /**
     * Statements of the {@code else} branch; empty when absent.
     */
    public List<Statement> getFalseBody() {
        return falseBody;
    }

    public boolean hasElse() {
        return !falseBody.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSelectionStatement(this, context);
    }
}
