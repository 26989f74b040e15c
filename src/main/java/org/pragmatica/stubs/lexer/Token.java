package org.pragmatica.stubs.lexer;

import org.pragmatica.stubs.tree.SourceLocation;
import org.pragmatica.stubs.tree.SourceSpan;

/**
 * A single token pulled from a {@link Lexer}.
 *
 * @param kind  token kind
 * @param value token text; for LEXERROR the diagnostic message
 * @param span  where the token sits in the source
 */
public record Token(TokenKind kind, String value, SourceSpan span) {

    public Token {
        if (kind == null || span == null) {
            throw new IllegalArgumentException("Token kind and span are required");
        }
        value = value == null ? "" : value;
    }

    public static Token of(TokenKind kind, String value, SourceSpan span) {
        return new Token(kind, value, span);
    }

    public static Token end(SourceLocation location) {
        return new Token(TokenKind.END, "", SourceSpan.at(location));
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    /**
     * Human readable form used in error messages.
     */
    public String describe() {
        return switch (kind) {
            case NAME -> "name '" + value + "'";
            case NUMBER -> "number " + value;
            case END, INDENT, DEDENT, TRIPLEQUOTED, TYPECOMMENT, LEXERROR -> kind.display();
            default -> value.isEmpty() ? kind.display() : "'" + value + "'";
        };
    }
}
