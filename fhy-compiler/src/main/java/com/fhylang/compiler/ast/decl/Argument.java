package com.fhylang.compiler.ast.decl;

import com.fhylang.compiler.ast.AstNode;
import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.Identifier;
import com.fhylang.compiler.ast.SourceLocation;
import com.fhylang.compiler.ast.type.QualifiedType;

/**
 * Procedure or operation argument: {@code input int32[m, n] A}
 */
public class Argument extends AstNode {
    private final Identifier name;
    private final QualifiedType qualifiedType;

    public Argument(SourceLocation location, Identifier name, QualifiedType qualifiedType) {
        super(location);
        this.name = name;
        this.qualifiedType = qualifiedType;
    }

    public Identifier getName() {
        return name;
    }

    /**
     * Qualifier and type, e.g. {@code input int32[m, n]}.
     */
    public QualifiedType getQualifiedType() {
        return qualifiedType;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArgument(this, context);
    }
}
