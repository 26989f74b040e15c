package org.pragmatica.stubs.lexer;

import java.util.List;

/**
 * Token source consumed by the stub grammar.
 *
 * <p>Implementations own block-structure detection (INDENT/DEDENT from leading
 * whitespace) and report internal faults as a {@link TokenKind#LEXERROR} token
 * whose value is the diagnostic message. After the input is exhausted every
 * call returns an {@link TokenKind#END} token.
 */
@FunctionalInterface
public interface Lexer {

    /**
     * Pull the next token. May block while reading the underlying input.
     */
    Token next();

    /**
     * Lexer replaying an already tokenized list.
     */
    static Lexer of(List<Token> tokens) {
        return new TokenListLexer(tokens);
    }
}
