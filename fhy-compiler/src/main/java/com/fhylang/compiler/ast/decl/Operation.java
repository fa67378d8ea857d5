package com.fhylang.compiler.ast.decl;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.Identifier;
import com.fhylang.compiler.ast.SourceLocation;
import com.fhylang.compiler.ast.stmt.Statement;
import com.fhylang.compiler.ast.type.QualifiedType;
import com.fhylang.compiler.ast.type.TemplateDataType;

import java.util.List;

/**
 * Operation declaration ({@code op}); the return type is mandatory.
 */
public class Operation extends FunctionDecl {
    private final QualifiedType returnType;

    public Operation(SourceLocation location, Identifier name, List<TemplateDataType> templates,
                     List<Identifier> indices, List<Argument> args, QualifiedType returnType,
                     List<Statement> body) {
        super(location, name, templates, indices, args, body);
        this.returnType = returnType;
    }

    public QualifiedType getReturnType() {
        return returnType;
    }

    @Override
    public String getKeyword() {
        return "op";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitOperation(this, context);
    }
}
