package com.fhylang.compiler.ast.type;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.Identifier;
import com.fhylang.compiler.ast.SourceLocation;

/**
 * Occurrence of a template parameter. Every occurrence of one declared parameter holds
 * the same {@link Identifier}.
 */
public class TemplateDataType extends DataType {
    private final Identifier dataType;

    public TemplateDataType(SourceLocation location, Identifier dataType) {
        super(location);
        this.dataType = dataType;
    }

    public Identifier getDataType() {
        return dataType;
    }

    /** Whether both occurrences refer to the same declared parameter. */
    public boolean isSameParameter(TemplateDataType other) {
        return other != null && dataType.equals(other.dataType);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTemplateDataType(this, context);
    }
}
