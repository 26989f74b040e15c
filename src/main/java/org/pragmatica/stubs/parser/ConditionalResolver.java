package org.pragmatica.stubs.parser;

import org.pragmatica.stubs.tree.ConditionalBlock;
import org.pragmatica.stubs.tree.ConditionalBlock.Condition;
import org.pragmatica.stubs.tree.ConditionalBlock.Operand;
import org.pragmatica.stubs.tree.Declaration;
import org.pragmatica.stubs.tree.VersionTuple;

import java.util.List;

/**
 * Static conditional compilation: picks the branch of a guarded block that
 * matches the target version and platform.
 *
 * <p>Branches are tried left to right. The first true condition wins, then the
 * else branch. When nothing matches the block contributes no declarations.
 */
public final class ConditionalResolver {
    private final VersionTuple targetVersion;
    private final String platform;

    private ConditionalResolver(VersionTuple targetVersion, String platform) {
        this.targetVersion = targetVersion;
        this.platform = platform;
    }

    public static ConditionalResolver create(ParserConfig config) {
        return new ConditionalResolver(config.targetVersion(), config.platform());
    }

    /**
     * Resolve against a target version, using the default platform.
     */
    public static List<Declaration> resolve(ConditionalBlock block, VersionTuple targetVersion) {
        return create(ParserConfig.forVersion(targetVersion)).resolve(block);
    }

    public List<Declaration> resolve(ConditionalBlock block) {
        for (var branch : block.branches()) {
            if (branch.condition().map(this::matches).orElse(true)) {
                return branch.body();
            }
        }
        return List.of();
    }

    /**
     * Evaluate one condition. Version operands compare the target version;
     * name operands compare the platform and only support equality.
     */
    public boolean matches(Condition condition) {
        var operator = condition.operator();
        if (condition.right() instanceof Operand.Version version) {
            return operator.test(targetVersion.compareTo(version.version()));
        }
        var name = ((Operand.Name) condition.right()).name();
        if (!operator.isEquality()) {
            throw new IllegalArgumentException(
                "Operator '" + operator.symbol() + "' cannot compare with name '" + name + "'");
        }
        return operator.test(platform.equals(name) ? 0 : 1);
    }

    public VersionTuple targetVersion() {
        return targetVersion;
    }

    public String platform() {
        return platform;
    }
}
