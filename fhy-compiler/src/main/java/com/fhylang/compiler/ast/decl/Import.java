package com.fhylang.compiler.ast.decl;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.Identifier;
import com.fhylang.compiler.ast.SourceLocation;
import com.fhylang.compiler.ast.stmt.Statement;

/**
 * Import statement.
 *
 * <p>Supported forms:</p>
 * <ul>
 *   <li>{@code import foo.bar;}</li>
 *   <li>{@code import foo.bar as baz;}</li>
 *   <li>{@code from foo import bar;} (name is {@code foo.bar})</li>
 * </ul>
 */
public class Import extends Statement {
    private final Identifier name;   // hint holds the dotted path
    private final Identifier alias;  // optional

    public Import(SourceLocation location, Identifier name, Identifier alias) {
        super(location);
        this.name = name;
        this.alias = alias;
    }

    /**
     * Imported path, e.g. {@code foo.bar}.
     */
    public Identifier getName() {
        return name;
    }

    /**
     * Name after {@code as}, or {@code null}.
     */
    public Identifier getAlias() {
        return alias;
    }

    public boolean hasAlias() {
        return alias != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImport(this, context);
    }
}
