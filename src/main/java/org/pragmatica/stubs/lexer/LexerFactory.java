package org.pragmatica.stubs.lexer;

/**
 * Creates a fresh {@link Lexer} for one stub source. Each parse gets its own lexer.
 */
@FunctionalInterface
public interface LexerFactory {
    Lexer create(String source);
}
