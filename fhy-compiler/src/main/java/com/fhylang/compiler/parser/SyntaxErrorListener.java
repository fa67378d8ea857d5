package com.fhylang.compiler.parser;

import com.fhylang.compiler.ast.SourceLocation;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * Fails fast on the first lexer or parser error, replacing ANTLR's console reporting.
 */
final class SyntaxErrorListener extends BaseErrorListener {

    private final String fileName;

    SyntaxErrorListener(String fileName) {
        this.fileName = fileName;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg,
                            RecognitionException e) {
        int length = 1;
        if (offendingSymbol instanceof Token) {
            Token token = (Token) offendingSymbol;
            if (token.getType() != Token.EOF && token.getText() != null) {
                length = Math.max(1, token.getText().length());
            }
        }
        SourceLocation location = new SourceLocation(fileName, line, charPositionInLine + 1,
                line, charPositionInLine + 1 + length);
        throw new FhYSyntaxError("Syntax error: " + msg, location, e);
    }
}
