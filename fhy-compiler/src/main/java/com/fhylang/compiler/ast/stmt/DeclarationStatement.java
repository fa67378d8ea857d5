package com.fhylang.compiler.ast.stmt;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.Identifier;
import com.fhylang.compiler.ast.SourceLocation;
import com.fhylang.compiler.ast.expr.Expression;
import com.fhylang.compiler.ast.type.QualifiedType;

/**
 * Variable declaration: {@code temp int32[m] x = e;}
 */
public class DeclarationStatement extends Statement {
    private final Identifier variableName;
    private final QualifiedType variableType;
    private final Expression expression;  // optional

    public DeclarationStatement(SourceLocation location, Identifier variableName,
                                QualifiedType variableType, Expression expression) {
        super(location);
        this.variableName = variableName;
        this.variableType = variableType;
        this.expression = expression;
    }

    public Identifier getVariableName() {
        return variableName;
    }

    public QualifiedType getVariableType() {
        return variableType;
    }

    /**
     * Initializer, or {@code null} for a bare declaration.
     */
    public Expression getExpression() {
        return expression;
    }

    public boolean hasExpression() {
        return expression != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDeclarationStatement(this, context);
    }
}
