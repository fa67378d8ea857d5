package com.fhylang.compiler.ast.decl;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.Identifier;
import com.fhylang.compiler.ast.SourceLocation;
import com.fhylang.compiler.ast.stmt.Statement;
import com.fhylang.compiler.ast.type.TemplateDataType;

import java.util.List;

/**
 * Procedure declaration ({@code proc}); has no return type.
 */
public class Procedure extends FunctionDecl {

    public Procedure(SourceLocation location, Identifier name, List<TemplateDataType> templates,
                     List<Identifier> indices, List<Argument> args, List<Statement> body) {
        super(location, name, templates, indices, args, body);
    }

    @Override
    public String getKeyword() {
        return "proc";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProcedure(this, context);
    }
}
