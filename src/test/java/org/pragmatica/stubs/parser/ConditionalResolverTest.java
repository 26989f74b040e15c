package org.pragmatica.stubs.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.stubs.tree.ConditionalBlock;
import org.pragmatica.stubs.tree.ConditionalBlock.Branch;
import org.pragmatica.stubs.tree.ConditionalBlock.Condition;
import org.pragmatica.stubs.tree.ConditionalBlock.Operand;
import org.pragmatica.stubs.tree.ConditionalBlock.Operator;
import org.pragmatica.stubs.tree.Declaration;
import org.pragmatica.stubs.tree.SourceSpan;
import org.pragmatica.stubs.tree.TypeExpr;
import org.pragmatica.stubs.tree.VersionTuple;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ConditionalResolverTest {

    private static final SourceSpan SPAN = SourceSpan.of(1, 1, 1, 5);

    private static Condition version(Operator operator, int... parts) {
        return new Condition(SPAN, "sys.version_info", operator, new Operand.Version(VersionTuple.of(parts)));
    }

    private static Condition platform(Operator operator, String name) {
        return new Condition(SPAN, "sys.platform", operator, new Operand.Name(name));
    }

    private static List<Declaration> constant(String name) {
        return List.of(new Declaration.Constant(SPAN, name, new TypeExpr.NamedType(SPAN, "int")));
    }

    private static List<String> names(List<Declaration> declarations) {
        return declarations.stream().flatMap(declaration -> declaration.boundNames().stream()).toList();
    }

    private static final ConditionalBlock CHAIN = new ConditionalBlock(SPAN, List.of(
        Branch.of(version(Operator.LT, 3), constant("legacy")),
        Branch.of(version(Operator.GE, 3, 7), constant("modern")),
        Branch.otherwise(constant("current"))
    ));

    @Test
    void resolve_picksFirstMatchingBranch() {
        assertThat(names(ConditionalResolver.resolve(CHAIN, VersionTuple.of(2, 7)))).containsExactly("legacy");
        assertThat(names(ConditionalResolver.resolve(CHAIN, VersionTuple.of(3, 9)))).containsExactly("modern");
    }

    @Test
    void resolve_noConditionMatches_fallsBackToElse() {
        assertThat(names(ConditionalResolver.resolve(CHAIN, VersionTuple.of(3, 6)))).containsExactly("current");
    }

    @Test
    void resolve_noElseAndNoMatch_returnsEmpty() {
        var block = new ConditionalBlock(SPAN, List.of(Branch.of(version(Operator.EQ, 4), constant("x"))));

        assertTrue(ConditionalResolver.resolve(block, VersionTuple.of(3, 8)).isEmpty());
    }

    @Test
    void matches_shortTuple_isZeroPadded() {
        var resolver = ConditionalResolver.create(ParserConfig.forVersion(VersionTuple.of(3, 0)));

        assertTrue(resolver.matches(version(Operator.EQ, 3)));
        assertTrue(resolver.matches(version(Operator.LE, 3, 0, 0)));
        assertFalse(resolver.matches(version(Operator.GT, 3)));
    }

    @Test
    void matches_eachOperator_followsComparison() {
        var resolver = ConditionalResolver.create(ParserConfig.forVersion(VersionTuple.of(3, 8)));

        assertTrue(resolver.matches(version(Operator.GT, 3, 7)));
        assertTrue(resolver.matches(version(Operator.GE, 3, 8)));
        assertTrue(resolver.matches(version(Operator.LT, 3, 10)));
        assertTrue(resolver.matches(version(Operator.NE, 3, 9)));
        assertFalse(resolver.matches(version(Operator.LE, 3, 7)));
        assertFalse(resolver.matches(version(Operator.EQ, 3, 9)));
    }

    @Test
    void matches_platformName_comparesConfiguredPlatform() {
        var resolver = ConditionalResolver.create(ParserConfig.DEFAULT.withPlatform("darwin"));

        assertTrue(resolver.matches(platform(Operator.EQ, "darwin")));
        assertTrue(resolver.matches(platform(Operator.NE, "linux")));
        assertFalse(resolver.matches(platform(Operator.EQ, "win32")));
    }

    @Test
    void matches_orderedPlatformComparison_throws() {
        var resolver = ConditionalResolver.create(ParserConfig.DEFAULT);

        assertThrows(IllegalArgumentException.class, () -> resolver.matches(platform(Operator.GE, "linux")));
    }

    @Test
    void create_copiesConfiguration() {
        var resolver = ConditionalResolver.create(new ParserConfig(VersionTuple.of(2, 7), "win32"));

        assertEquals(VersionTuple.of(2, 7), resolver.targetVersion());
        assertEquals("win32", resolver.platform());
    }

    @Test
    void create_withUpdatedTargetVersion_keepsPlatform() {
        var config = ParserConfig.DEFAULT.withPlatform("darwin").withTargetVersion(VersionTuple.parse("3.10"));
        var resolver = ConditionalResolver.create(config);

        assertTrue(resolver.matches(version(Operator.GT, 3, 9)));
        assertTrue(resolver.matches(platform(Operator.EQ, "darwin")));
    }
}
