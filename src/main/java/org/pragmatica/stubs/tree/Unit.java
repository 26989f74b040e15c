package org.pragmatica.stubs.tree;

import java.util.List;

/**
 * Parsed stub file: top-level declarations in source order.
 */
public record Unit(SourceSpan span, List<Declaration> declarations) {

    public Unit {
        declarations = List.copyOf(declarations);
    }

    /**
     * All declarations binding the given name, in source order.
     */
    public List<Declaration> lookup(String name) {
        return declarations.stream()
                           .filter(declaration -> declaration.boundNames().contains(name))
                           .toList();
    }

    public List<Declaration.ClassDef> classes() {
        return ofType(Declaration.ClassDef.class);
    }

    public List<Declaration.FuncDef> functions() {
        return ofType(Declaration.FuncDef.class);
    }

    public List<Declaration.Constant> constants() {
        return ofType(Declaration.Constant.class);
    }

    public List<Declaration.Import> imports() {
        return ofType(Declaration.Import.class);
    }

    public <T extends Declaration> List<T> ofType(Class<T> type) {
        return declarations.stream()
                           .filter(type::isInstance)
                           .map(type::cast)
                           .toList();
    }

    public int size() {
        return declarations.size();
    }
}
