package org.pragmatica.stubs.tree;

import java.util.HashSet;
import java.util.List;

import static org.pragmatica.stubs.tree.Names.requireDottedName;
import static org.pragmatica.stubs.tree.Names.requireName;
import static org.pragmatica.stubs.tree.Names.requireNode;

/**
 * Type expressions allowed in stubs.
 */
public sealed interface TypeExpr {

    SourceSpan span();

    /**
     * Reference by (possibly dotted) name: {@code int}, {@code os.PathLike}.
     */
    record NamedType(SourceSpan span, String name) implements TypeExpr {
        public NamedType {
            requireDottedName(name, "type name");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Reference to a class declared earlier in the same stub (or the enclosing class itself).
     */
    record ClassType(SourceSpan span, String name) implements TypeExpr {
        public ClassType {
            requireName(name, "class name");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Reference to a type variable declared with {@code TypeVar}.
     */
    record TypeParameter(SourceSpan span, String name) implements TypeExpr {
        public TypeParameter {
            requireName(name, "type parameter name");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Parameterized type: {@code List[int]}, {@code Dict[str, Any]}.
     */
    record GenericType(SourceSpan span, TypeExpr base, List<TypeExpr> parameters) implements TypeExpr {
        public GenericType {
            requireNode(base, "generic base type");
            parameters = List.copyOf(parameters);
        }

        @Override
        public String toString() {
            var sb = new StringBuilder(base.toString()).append('[');
            for (int i = 0; i < parameters.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(parameters.get(i));
            }
            return sb.append(']').toString();
        }
    }

    /**
     * Binary union {@code left or right}. Chains nest to the left and are never flattened.
     */
    record UnionType(SourceSpan span, TypeExpr left, TypeExpr right) implements TypeExpr {
        public UnionType {
            requireNode(left, "union left operand");
            requireNode(right, "union right operand");
        }

        @Override
        public String toString() {
            return "(" + left + " or " + right + ")";
        }
    }

    /**
     * Unconstrained type, written {@code ?}.
     */
    record AnythingType(SourceSpan span) implements TypeExpr {
        @Override
        public String toString() {
            return "?";
        }
    }

    /**
     * Uninhabited type, written {@code nothing}.
     */
    record NothingType(SourceSpan span) implements TypeExpr {
        @Override
        public String toString() {
            return "nothing";
        }
    }

    /**
     * {@code ...} in type position, e.g. {@code Tuple[int, ...]}.
     */
    record EllipsisType(SourceSpan span) implements TypeExpr {
        @Override
        public String toString() {
            return "...";
        }
    }

    /**
     * Inline {@code NamedTuple('Name', [('field', type), ...])}.
     */
    record NamedTupleType(SourceSpan span, String name, List<Field> fields) implements TypeExpr {
        public NamedTupleType {
            requireName(name, "named tuple name");
            fields = List.copyOf(fields);
        }

        public boolean hasDuplicateFields() {
            var seen = new HashSet<String>();
            return !fields.stream().allMatch(field -> seen.add(field.name()));
        }

        @Override
        public String toString() {
            return "NamedTuple(" + name + ", " + fields + ")";
        }

        public record Field(SourceSpan span, String name, TypeExpr type) {
            public Field {
                requireName(name, "named tuple field");
                requireNode(type, "named tuple field type");
            }

            @Override
            public String toString() {
                return "(" + name + ", " + type + ")";
            }
        }
    }
}
