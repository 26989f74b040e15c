package org.pragmatica.stubs.parser;

import org.pragmatica.stubs.tree.Declaration.FuncDef.Body;
import org.pragmatica.stubs.tree.Declaration.FuncDef.Mutator;
import org.pragmatica.stubs.tree.TypeExpr;

import java.util.List;

/**
 * What followed a function signature: the body marker plus any statements.
 */
record FunctionBody(Body kind, List<Mutator> mutators, List<TypeExpr> raises) {

    static final FunctionBody ELLIPSIS = marker(Body.ELLIPSIS);
    static final FunctionBody PASS = marker(Body.PASS);

    FunctionBody {
        mutators = List.copyOf(mutators);
        raises = List.copyOf(raises);
    }

    static FunctionBody marker(Body kind) {
        return new FunctionBody(kind, List.of(), List.of());
    }

    static FunctionBody statements(List<Mutator> mutators, List<TypeExpr> raises) {
        return new FunctionBody(Body.STATEMENTS, mutators, raises);
    }
}
