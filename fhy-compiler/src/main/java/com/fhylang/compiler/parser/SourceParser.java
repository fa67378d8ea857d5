package com.fhylang.compiler.parser;

import com.fhylang.compiler.ast.decl.Module;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point from FhY source text to an AST {@link Module}.
 *
 * <p>Lexing and parsing are done by the generated ANTLR recognizers with their console
 * error reporting replaced by {@link SyntaxErrorListener}; the resulting tree is handed to
 * {@link ParseTreeConverter}.</p>
 */
public class SourceParser {

    private static final Logger LOG = Logger.getLogger(SourceParser.class.getName());

    private final String source;
    private final String fileName;

    public SourceParser(String source, String fileName) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        this.source = source;
        this.fileName = fileName != null ? fileName : "<source>";
    }

    public SourceParser(String source) {
        this(source, null);
    }

    /**
     * Parses the whole source.
     *
     * @throws FhYSyntaxError on the first lexical, grammatical or structural error
     * @throws LiteralError   when a numeric literal cannot be decoded
     */
    public Module parse() {
        SyntaxErrorListener errorListener = new SyntaxErrorListener(fileName);

        FhYLexer lexer = new FhYLexer(CharStreams.fromString(source, fileName));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        FhYParser parser = new FhYParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);

        try {
            Module module = new ParseTreeConverter(fileName).convert(parser.module());
            LOG.fine("Parsed " + fileName + ": " + module.getStatements().size() + " top-level statements");
            return module;
        } catch (FhYError e) {
            LOG.log(Level.FINE, "Failed to parse " + fileName, e);
            throw e;
        }
    }

    public static Module parse(String source) {
        return new SourceParser(source).parse();
    }

    public static Module parse(String source, String fileName) {
        return new SourceParser(source, fileName).parse();
    }
}
