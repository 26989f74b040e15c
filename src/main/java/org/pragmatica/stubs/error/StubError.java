package org.pragmatica.stubs.error;

import org.pragmatica.stubs.tree.SourceSpan;

/**
 * The single error a failed stub parse produces. Grammar and construction
 * failures share this channel, so callers cannot tell them apart beyond the
 * message.
 */
public sealed interface StubError {
    SourceSpan span();

    String message();

    /**
     * Fault reported by the lexer. The lexer's diagnostic is kept verbatim.
     */
    record LexicalError(SourceSpan span, String diagnostic) implements StubError {
        @Override
        public String message() {
            return diagnostic;
        }
    }

    /**
     * Token that cannot extend the current parse.
     */
    record UnexpectedToken(SourceSpan span, String found, String expected) implements StubError {
        @Override
        public String message() {
            return "Unexpected " + found + " at " + span.start() + ", expected " + expected;
        }
    }

    /**
     * Grammatical input rejected while building a node.
     */
    record ConstructionError(SourceSpan span, String reason) implements StubError {
        @Override
        public String message() {
            return reason + " at " + span.start();
        }
    }

    /**
     * Stub source that could not be read at all.
     */
    record InputError(SourceSpan span, String source, String reason) implements StubError {
        @Override
        public String message() {
            return "Cannot read " + source + ": " + reason;
        }
    }
}
