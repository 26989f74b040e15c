package org.pragmatica.stubs.lexer;

import org.pragmatica.stubs.tree.SourceLocation;

import java.util.List;

/**
 * Replays a pre-tokenized list. Synthesizes END after the last token when the
 * list does not end with one.
 */
final class TokenListLexer implements Lexer {
    private final List<Token> tokens;
    private final Token end;
    private int pos;

    TokenListLexer(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
        this.end = this.tokens.isEmpty()
                   ? Token.end(SourceLocation.START)
                   : Token.end(this.tokens.get(this.tokens.size() - 1).span().end());
        this.pos = 0;
    }

    @Override
    public Token next() {
        if (pos < tokens.size()) {
            return tokens.get(pos++);
        }
        return end;
    }
}
