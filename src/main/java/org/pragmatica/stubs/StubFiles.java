package org.pragmatica.stubs;

import org.pragmatica.stubs.error.StubError;
import org.pragmatica.stubs.lexer.LexerFactory;
import org.pragmatica.stubs.parser.ParseResult;
import org.pragmatica.stubs.parser.Parser;
import org.pragmatica.stubs.parser.ParserConfig;
import org.pragmatica.stubs.tree.SourceSpan;
import org.pragmatica.stubs.tree.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Parses stub files from disk, several at a time.
 *
 * <p>Every file gets its own lexer and parsing context, so files never see each
 * other's class names or type variables. A file that cannot be read yields an
 * {@link StubError.InputError} for that file only.
 */
public final class StubFiles implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StubFiles.class);

    private final LexerFactory lexerFactory;
    private final Parser parser;
    private final ExecutorService executor;

    private StubFiles(LexerFactory lexerFactory, Parser parser, ExecutorService executor) {
        this.lexerFactory = lexerFactory;
        this.parser = parser;
        this.executor = executor;
    }

    public static StubFiles create(LexerFactory lexerFactory, ParserConfig config) {
        return create(lexerFactory, config, Runtime.getRuntime().availableProcessors());
    }

    public static StubFiles create(LexerFactory lexerFactory, ParserConfig config, int threads) {
        if (lexerFactory == null) {
            throw new IllegalArgumentException("Lexer factory is required");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("At least one worker thread is required, got " + threads);
        }
        return new StubFiles(lexerFactory, StubParser.create(config), Executors.newFixedThreadPool(threads));
    }

    public ParserConfig config() {
        return parser.config();
    }

    /**
     * Parse all files. Results come back in the order of {@code paths}.
     */
    public List<FileResult> parseAll(List<Path> paths) {
        var futures = new ArrayList<Future<FileResult>>(paths.size());
        for (var path : paths) {
            futures.add(executor.submit(() -> parseFile(path)));
        }

        var results = new ArrayList<FileResult>(futures.size());
        for (var future : futures) {
            results.add(await(future));
        }

        var failed = results.stream().filter(FileResult::isFailure).count();
        log.debug("Parsed {} stub files, {} failed", results.size(), failed);
        return results;
    }

    /**
     * Read and parse a single file on the calling thread.
     */
    public FileResult parseFile(Path path) {
        String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            var reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.warn("Cannot read stub file {}: {}", path, reason);
            return new FileResult(path, ParseResult.failure(new StubError.InputError(SourceSpan.EMPTY,
                                                                                      path.toString(),
                                                                                      reason)));
        }

        log.debug("Parsing stub file {}", path);
        var result = parser.parse(lexerFactory.create(source))
                           .onFailure(error -> log.warn("Failed to parse {}: {}", path, error.message()));
        return new FileResult(path, result);
    }

    @Override
    public void close() {
        executor.shutdown();
    }

    private static FileResult await(Future<FileResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while parsing stub files", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Stub parse task failed", e.getCause());
        }
    }

    /**
     * Outcome for one file.
     */
    public record FileResult(Path path, ParseResult<Unit> result) {
        public boolean isSuccess() {
            return result.isSuccess();
        }

        public boolean isFailure() {
            return result.isFailure();
        }
    }
}
