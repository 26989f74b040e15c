package org.pragmatica.stubs;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pragmatica.stubs.error.StubError;
import org.pragmatica.stubs.lexer.StubTokenizer;
import org.pragmatica.stubs.parser.ParserConfig;
import org.pragmatica.stubs.tree.TypeExpr;
import org.pragmatica.stubs.tree.VersionTuple;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class StubFilesTest {

    @TempDir
    Path dir;

    private Path write(String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content);
    }

    @Test
    void parseAll_mixedInputs_returnsResultsInInputOrder() throws IOException {
        var good = write("good.pyi", "class A: ...\ndef f() -> A: ...\n");
        var broken = write("broken.pyi", "def f(: ...\n");
        var missing = dir.resolve("missing.pyi");

        try (var files = StubFiles.create(StubTokenizer::lexer, ParserConfig.DEFAULT, 2)) {
            var results = files.parseAll(List.of(good, broken, missing));

            assertThat(results).extracting(StubFiles.FileResult::path).containsExactly(good, broken, missing);
            assertTrue(results.get(0).isSuccess());
            assertEquals(2, results.get(0).result().unwrap().size());
            assertInstanceOf(StubError.UnexpectedToken.class, results.get(1).result().fold(e -> e, u -> null));
            var inputError = assertInstanceOf(StubError.InputError.class, results.get(2).result().fold(e -> e, u -> null));
            assertEquals(missing.toString(), inputError.source());
        }
    }

    @Test
    void parseAll_manyFiles_keepsOrderAndIsolatesClassNames() throws IOException {
        var paths = new ArrayList<Path>();
        for (int i = 0; i < 20; i++) {
            var content = i % 2 == 0
                          ? "class C" + i + ": ...\n"
                          : "def f() -> C" + (i - 1) + ": ...\n";
            paths.add(write("stub" + i + ".pyi", content));
        }

        try (var files = StubFiles.create(StubTokenizer::lexer, ParserConfig.DEFAULT, 4)) {
            var results = files.parseAll(paths);

            assertEquals(20, results.size());
            for (int i = 0; i < results.size(); i++) {
                assertEquals(paths.get(i), results.get(i).path());
                var unit = results.get(i).result().unwrap();
                if (i % 2 == 1) {
                    assertInstanceOf(TypeExpr.NamedType.class, unit.functions().get(0).returnType());
                } else {
                    assertEquals("C" + i, unit.classes().get(0).name());
                }
            }
        }
    }

    @Test
    void parseFile_usesConfiguredTargetVersion() throws IOException {
        var path = write("versioned.pyi", """
            if sys.version_info >= (3, 10):
                x: int
            else:
                x: str
            """);

        try (var files = StubFiles.create(StubTokenizer::lexer, ParserConfig.forVersion(VersionTuple.of(3, 11)))) {
            var unit = files.parseFile(path).result().unwrap();

            assertEquals("int", unit.constants().get(0).type().toString());
            assertEquals(ParserConfig.forVersion(VersionTuple.of(3, 11)), files.config());
        }
    }

    @Test
    void create_withoutThreads_throws() {
        assertThrows(IllegalArgumentException.class,
                     () -> StubFiles.create(StubTokenizer::lexer, ParserConfig.DEFAULT, 0));
    }
}
