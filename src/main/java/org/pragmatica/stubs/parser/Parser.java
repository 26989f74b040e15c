package org.pragmatica.stubs.parser;

import org.pragmatica.stubs.lexer.Lexer;
import org.pragmatica.stubs.lexer.Token;
import org.pragmatica.stubs.tree.Unit;

import java.util.List;

/**
 * Parser interface - parses one stub file per call under a fixed configuration.
 */
public interface Parser {

    /**
     * Parse the tokens pulled from {@code lexer} into a unit.
     */
    ParseResult<Unit> parse(Lexer lexer);

    /**
     * Parse an already tokenized stub.
     */
    default ParseResult<Unit> parse(List<Token> tokens) {
        return parse(Lexer.of(tokens));
    }

    ParserConfig config();

    static Parser create(ParserConfig config) {
        return new ConfiguredParser(config);
    }
}

record ConfiguredParser(ParserConfig config) implements Parser {
    ConfiguredParser {
        if (config == null) {
            throw new IllegalArgumentException("Parser config is required");
        }
    }

    @Override
    public ParseResult<Unit> parse(Lexer lexer) {
        return StubGrammarParser.parse(lexer, config);
    }
}
