package com.fhylang.compiler.ast.type;

import com.fhylang.compiler.ast.AstNode;
import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;

/**
 * A type with its usage qualifier: {@code input int32[m, n]}
 */
public class QualifiedType extends AstNode {
    private final TypeQualifier typeQualifier;
    private final Type baseType;

    public QualifiedType(SourceLocation location, TypeQualifier typeQualifier, Type baseType) {
        super(location);
        this.typeQualifier = typeQualifier;
        this.baseType = baseType;
    }

    public TypeQualifier getTypeQualifier() {
        return typeQualifier;
    }

    public Type getBaseType() {
        return baseType;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitQualifiedType(this, context);
    }
}
