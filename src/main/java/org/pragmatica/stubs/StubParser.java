package org.pragmatica.stubs;

import org.pragmatica.stubs.lexer.Lexer;
import org.pragmatica.stubs.parser.ParseResult;
import org.pragmatica.stubs.parser.Parser;
import org.pragmatica.stubs.parser.ParserConfig;
import org.pragmatica.stubs.tree.Unit;
import org.pragmatica.stubs.tree.VersionTuple;

/**
 * Entry point for parsing stub files.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = StubParser.builder()
 *                        .targetVersion(3, 8)
 *                        .platform("darwin")
 *                        .build();
 *
 * var unit = parser.parse(lexer).unwrap();
 * }</pre>
 */
public final class StubParser {
    private StubParser() {}

    /**
     * Parse with the default target version and platform.
     */
    public static ParseResult<Unit> parse(Lexer lexer) {
        return parse(lexer, ParserConfig.DEFAULT);
    }

    public static ParseResult<Unit> parse(Lexer lexer, ParserConfig config) {
        return create(config).parse(lexer);
    }

    public static Parser create(ParserConfig config) {
        return Parser.create(config);
    }

    /**
     * Create a builder for the parser configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private VersionTuple targetVersion = ParserConfig.DEFAULT.targetVersion();
        private String platform = ParserConfig.DEFAULT.platform();

        private Builder() {}

        public Builder targetVersion(int... parts) {
            this.targetVersion = VersionTuple.of(parts);
            return this;
        }

        /**
         * Dotted form, e.g. {@code "3.8"}.
         */
        public Builder targetVersion(String version) {
            this.targetVersion = VersionTuple.parse(version);
            return this;
        }

        public Builder platform(String platform) {
            this.platform = platform;
            return this;
        }

        public Parser build() {
            return create(new ParserConfig(targetVersion, platform));
        }
    }
}
