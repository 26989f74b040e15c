package org.pragmatica.stubs.tree;

import java.util.List;
import java.util.Optional;

import static org.pragmatica.stubs.tree.Names.requireDottedName;
import static org.pragmatica.stubs.tree.Names.requireName;
import static org.pragmatica.stubs.tree.Names.requireNode;

/**
 * {@code if/elif/else} chain guarding declarations. Only the last branch may be
 * unconditional.
 */
public record ConditionalBlock(SourceSpan span, List<Branch> branches) {

    public ConditionalBlock {
        if (branches == null || branches.isEmpty()) {
            throw new IllegalArgumentException("Conditional without branches");
        }
        branches = List.copyOf(branches);
        for (int i = 0; i < branches.size() - 1; i++) {
            if (branches.get(i).isElse()) {
                throw new IllegalArgumentException("'else' must be the last branch");
            }
        }
    }

    public record Branch(Optional<Condition> condition, List<Declaration> body) {
        public Branch {
            condition = condition == null ? Optional.empty() : condition;
            body = List.copyOf(body);
        }

        public static Branch of(Condition condition, List<Declaration> body) {
            return new Branch(Optional.of(condition), body);
        }

        public static Branch otherwise(List<Declaration> body) {
            return new Branch(Optional.empty(), body);
        }

        public boolean isElse() {
            return condition.isEmpty();
        }
    }

    /**
     * {@code left op right}, where right is a version tuple or a symbolic name.
     */
    public record Condition(SourceSpan span, String left, Operator operator, Operand right) {
        public Condition {
            requireDottedName(left, "condition operand");
            requireNode(operator, "comparison operator");
            requireNode(right, "condition operand");
        }

        @Override
        public String toString() {
            return left + " " + operator.symbol() + " " + right;
        }
    }

    public sealed interface Operand {
        record Version(VersionTuple version) implements Operand {
            public Version {
                requireNode(version, "version tuple");
            }

            @Override
            public String toString() {
                return version.toString();
            }
        }

        record Name(String name) implements Operand {
            public Name {
                requireName(name, "symbolic operand");
            }

            @Override
            public String toString() {
                return name;
            }
        }
    }

    public enum Operator {
        LT("<"),
        GT(">"),
        LE("<="),
        GE(">="),
        EQ("=="),
        NE("!=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isEquality() {
            return this == EQ || this == NE;
        }

        /**
         * Apply to the sign of a {@code compareTo} result.
         */
        public boolean test(int comparison) {
            return switch (this) {
                case LT -> comparison < 0;
                case GT -> comparison > 0;
                case LE -> comparison <= 0;
                case GE -> comparison >= 0;
                case EQ -> comparison == 0;
                case NE -> comparison != 0;
            };
        }
    }
}
