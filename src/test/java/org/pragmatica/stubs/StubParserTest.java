package org.pragmatica.stubs;

import org.junit.jupiter.api.Test;
import org.pragmatica.stubs.lexer.StubTokenizer;
import org.pragmatica.stubs.parser.ParserConfig;
import org.pragmatica.stubs.tree.Declaration.FuncDef;
import org.pragmatica.stubs.tree.VersionTuple;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class StubParserTest {

    private static final String GUARDED = """
        import sys

        if sys.version_info >= (3, 8):
            def f() -> int: ...
        elif sys.platform == "darwin":
            def g() -> int: ...
        else:
            def h() -> int: ...
        """;

    @Test
    void parse_withDefaults_usesDefaultConfig() {
        var unit = StubParser.parse(StubTokenizer.lexer(GUARDED)).unwrap();

        assertThat(unit.functions()).extracting(FuncDef::name).containsExactly("h");
        assertEquals(2, unit.size());
    }

    @Test
    void builder_targetVersion_selectsBranch() {
        var parser = StubParser.builder()
                               .targetVersion(3, 9)
                               .build();

        var unit = parser.parse(StubTokenizer.tokenize(GUARDED)).unwrap();

        assertThat(unit.functions()).extracting(FuncDef::name).containsExactly("f");
        assertEquals(VersionTuple.of(3, 9), parser.config().targetVersion());
        assertEquals(ParserConfig.DEFAULT.platform(), parser.config().platform());
    }

    @Test
    void builder_dottedVersionAndPlatform_selectsBranch() {
        var parser = StubParser.builder()
                               .targetVersion("3.7")
                               .platform("darwin")
                               .build();

        var unit = parser.parse(StubTokenizer.lexer(GUARDED)).unwrap();

        assertThat(unit.functions()).extracting(FuncDef::name).containsExactly("g");
    }

    @Test
    void builder_blankPlatform_throws() {
        var builder = StubParser.builder().platform(" ");

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void parse_sameParserTwice_usesFreshContext() {
        var parser = StubParser.create(ParserConfig.DEFAULT);

        var first = parser.parse(StubTokenizer.lexer("class A: ...\n")).unwrap();
        var second = parser.parse(StubTokenizer.lexer("def f() -> A: ...\n")).unwrap();

        assertEquals(1, first.size());
        assertEquals("A", second.functions().get(0).returnType().toString());
        assertThat(second.functions().get(0).returnType().getClass().getSimpleName()).isEqualTo("NamedType");
    }
}
