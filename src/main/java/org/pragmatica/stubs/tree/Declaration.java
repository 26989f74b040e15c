package org.pragmatica.stubs.tree;

import java.util.List;
import java.util.Optional;

import static org.pragmatica.stubs.tree.Names.requireDottedName;
import static org.pragmatica.stubs.tree.Names.requireName;
import static org.pragmatica.stubs.tree.Names.requireNode;

/**
 * Declarations that can appear in a {@link Unit} or a class body.
 */
public sealed interface Declaration {

    SourceSpan span();

    /**
     * Names this declaration makes visible in its scope.
     */
    List<String> boundNames();

    /**
     * {@code class Name(parents): body}
     *
     * @param keywords keyword parents such as {@code metaclass=Meta}
     * @param body     constants and functions, conditionals already resolved
     */
    record ClassDef(SourceSpan span,
                    String name,
                    List<TypeExpr> parents,
                    List<Keyword> keywords,
                    List<Declaration> body) implements Declaration {
        public ClassDef {
            requireName(name, "class name");
            parents = List.copyOf(parents);
            keywords = List.copyOf(keywords);
            body = List.copyOf(body);
        }

        public List<FuncDef> methods() {
            return body.stream()
                       .filter(FuncDef.class::isInstance)
                       .map(FuncDef.class::cast)
                       .toList();
        }

        public List<Constant> constants() {
            return body.stream()
                       .filter(Constant.class::isInstance)
                       .map(Constant.class::cast)
                       .toList();
        }

        @Override
        public List<String> boundNames() {
            return List.of(name);
        }

        public record Keyword(SourceSpan span, String name, TypeExpr value) {
            public Keyword {
                requireName(name, "class keyword");
                requireNode(value, "class keyword value");
            }
        }
    }

    /**
     * One function signature. Overloads are separate, adjacent FuncDefs.
     *
     * @param hasOptional a trailing {@code ...} parameter accepts further arguments
     * @param mutators    {@code name := type} statements from the body
     */
    record FuncDef(SourceSpan span,
                   String name,
                   List<String> decorators,
                   List<Param> params,
                   boolean hasOptional,
                   TypeExpr returnType,
                   List<TypeExpr> raises,
                   Body body,
                   List<Mutator> mutators) implements Declaration {
        public FuncDef {
            requireName(name, "function name");
            requireNode(returnType, "return type of " + name);
            requireNode(body, "body of " + name);
            decorators = List.copyOf(decorators);
            params = List.copyOf(params);
            raises = List.copyOf(raises);
            mutators = List.copyOf(mutators);
        }

        public boolean isDecoratedWith(String decorator) {
            return decorators.contains(decorator);
        }

        @Override
        public List<String> boundNames() {
            return List.of(name);
        }

        public enum Body {
            ELLIPSIS,
            PASS,
            EXTERNAL_CODE,
            STATEMENTS
        }

        public record Mutator(SourceSpan span, String name, TypeExpr type) {
            public Mutator {
                requireName(name, "mutated name");
                requireNode(type, "mutated type");
            }
        }
    }

    /**
     * {@code name: type}. Repeated constants are all kept in source order.
     */
    record Constant(SourceSpan span, String name, TypeExpr type) implements Declaration {
        public Constant {
            requireName(name, "constant name");
            requireNode(type, "type of " + name);
        }

        @Override
        public List<String> boundNames() {
            return List.of(name);
        }
    }

    /**
     * {@code Name = type}
     */
    record Alias(SourceSpan span, String name, TypeExpr type) implements Declaration {
        public Alias {
            requireName(name, "alias name");
            requireNode(type, "aliased type");
        }

        @Override
        public List<String> boundNames() {
            return List.of(name);
        }
    }

    /**
     * {@code import a.b as c, d} or {@code from m import x, y as z}.
     */
    record Import(SourceSpan span, Optional<String> fromModule, List<Item> items) implements Declaration {
        public Import {
            fromModule = fromModule == null ? Optional.empty() : fromModule;
            fromModule.ifPresent(module -> requireDottedName(module, "module name"));
            if (items == null || items.isEmpty()) {
                throw new IllegalArgumentException("Import without items");
            }
            items = List.copyOf(items);
        }

        public boolean isFromImport() {
            return fromModule.isPresent();
        }

        @Override
        public List<String> boundNames() {
            return items.stream()
                        .map(Item::boundName)
                        .toList();
        }

        public record Item(SourceSpan span, String name, Optional<String> alias) {
            public static final String WILDCARD = "*";

            public Item {
                requireDottedName(name, "imported name");
                alias = alias == null ? Optional.empty() : alias;
            }

            public String boundName() {
                return alias.orElse(name);
            }
        }
    }

    /**
     * {@code T = TypeVar('T', constraint, ..., bound=type)}
     */
    record TypeVarDef(SourceSpan span,
                      String name,
                      List<TypeExpr> constraints,
                      Optional<TypeExpr> bound) implements Declaration {
        public TypeVarDef {
            requireName(name, "type variable name");
            constraints = List.copyOf(constraints);
            bound = bound == null ? Optional.empty() : bound;
        }

        @Override
        public List<String> boundNames() {
            return List.of(name);
        }
    }
}
