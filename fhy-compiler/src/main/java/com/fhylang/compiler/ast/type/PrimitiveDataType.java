package com.fhylang.compiler.ast.type;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;

/**
 * Core data type occurrence such as {@code float32}.
 */
public class PrimitiveDataType extends DataType {
    private final CoreDataType coreDataType;

    public PrimitiveDataType(SourceLocation location, CoreDataType coreDataType) {
        super(location);
        this.coreDataType = coreDataType;
    }

    public CoreDataType getCoreDataType() {
        return coreDataType;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPrimitiveDataType(this, context);
    }
}
