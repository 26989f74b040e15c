package org.pragmatica.stubs.parser;

import org.pragmatica.stubs.error.StubError;
import org.pragmatica.stubs.tree.ConditionalBlock;
import org.pragmatica.stubs.tree.ConditionalBlock.Condition;
import org.pragmatica.stubs.tree.ConditionalBlock.Operand;
import org.pragmatica.stubs.tree.Declaration;
import org.pragmatica.stubs.tree.Declaration.Alias;
import org.pragmatica.stubs.tree.Declaration.ClassDef;
import org.pragmatica.stubs.tree.Declaration.Constant;
import org.pragmatica.stubs.tree.Declaration.FuncDef;
import org.pragmatica.stubs.tree.Declaration.Import;
import org.pragmatica.stubs.tree.Declaration.TypeVarDef;
import org.pragmatica.stubs.tree.Param;
import org.pragmatica.stubs.tree.Param.StarKind;
import org.pragmatica.stubs.tree.SourceSpan;
import org.pragmatica.stubs.tree.TypeExpr;
import org.pragmatica.stubs.tree.Unit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Mutable per-parse state plus the node construction operations the grammar
 * invokes when a production completes.
 *
 * <p>Holds the forward class-name table, the declared type variables and the
 * stack of open conditional branches. A context serves exactly one parse;
 * every rejected construction comes back as a {@link StubError.ConstructionError}
 * located at the production being built.
 */
public final class ParsingContext {

    private final ParserConfig config;
    private final ConditionalResolver resolver;
    private final Set<String> classNames;
    private final Set<String> typeVariables;
    private final Deque<Frame> conditionals;
    private boolean finished;

    private ParsingContext(ParserConfig config) {
        this.config = config;
        this.resolver = ConditionalResolver.create(config);
        this.classNames = new HashSet<>();
        this.typeVariables = new HashSet<>();
        this.conditionals = new ArrayDeque<>();
        this.finished = false;
    }

    public static ParsingContext create(ParserConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Parser config is required");
        }
        return new ParsingContext(config);
    }

    public ParserConfig config() {
        return config;
    }

    // === Name Registration ===

    /**
     * Make a class name resolvable before its body is parsed. Skipped inside an
     * inactive conditional branch so a losing branch leaves nothing behind.
     */
    public ParseResult<String> registerClassName(String name, SourceSpan span) {
        if (typeVariables.contains(name)) {
            return fail(span, "Class '" + name + "' conflicts with a TypeVar of the same name");
        }
        if (isActive()) {
            classNames.add(name);
        }
        return ParseResult.success(name);
    }

    public boolean isClassName(String name) {
        return classNames.contains(name);
    }

    public boolean isTypeVariable(String name) {
        return typeVariables.contains(name);
    }

    // === Declarations ===

    public ParseResult<Declaration> newClass(SourceSpan span,
                                             String name,
                                             List<TypeExpr> parents,
                                             List<ClassDef.Keyword> keywords,
                                             List<Declaration> body) {
        var seen = new HashSet<String>();
        for (var keyword : keywords) {
            if (!seen.add(keyword.name())) {
                return fail(span, "Duplicate keyword '" + keyword.name() + "' in parents of class '" + name + "'");
            }
        }
        return construct(span, () -> new ClassDef(span, name, parents, keywords, body));
    }

    public ParseResult<Param> newParam(SourceSpan span,
                                       String name,
                                       Optional<TypeExpr> type,
                                       Optional<String> defaultValue,
                                       StarKind kind) {
        return construct(span, () -> new Param(span, name, type, defaultValue, kind));
    }

    public ParseResult<Declaration> newFunction(SourceSpan span,
                                                List<String> decorators,
                                                String name,
                                                List<Param> params,
                                                Optional<TypeExpr> returnType,
                                                List<TypeExpr> raises,
                                                FunctionBody body) {
        var problem = checkParams(name, params);
        if (problem.isPresent()) {
            return fail(span, problem.get());
        }
        var hasOptional = !params.isEmpty() && params.get(params.size() - 1).isEllipsis();
        var effectiveParams = hasOptional ? params.subList(0, params.size() - 1) : params;
        var allRaises = NodeLists.extend(new ArrayList<>(raises), body.raises());
        var result = returnType.orElseGet(() -> new TypeExpr.AnythingType(span.endPoint()));
        return construct(span, () -> new FuncDef(span,
                                                 name,
                                                 decorators,
                                                 effectiveParams,
                                                 hasOptional,
                                                 result,
                                                 allRaises,
                                                 body.kind(),
                                                 body.mutators()));
    }

    /**
     * {@code def name PYTHONCODE}: implementation supplied elsewhere, signature unknown.
     */
    public ParseResult<Declaration> newExternalFunction(SourceSpan span, List<String> decorators, String name) {
        return construct(span, () -> new FuncDef(span,
                                                 name,
                                                 decorators,
                                                 List.of(),
                                                 true,
                                                 new TypeExpr.AnythingType(span.endPoint()),
                                                 List.of(),
                                                 FuncDef.Body.EXTERNAL_CODE,
                                                 List.of()));
    }

    public ParseResult<Declaration> newConstant(SourceSpan span, String name, TypeExpr type) {
        return construct(span, () -> new Constant(span, name, type));
    }

    /**
     * {@code name = 42} or {@code name = 1.5}: typed by the literal.
     */
    public ParseResult<Declaration> newNumberConstant(SourceSpan span, String name, String number, SourceSpan numberSpan) {
        var typeName = isFloatLiteral(number) ? "float" : "int";
        return construct(span, () -> new Constant(span, name, new TypeExpr.NamedType(numberSpan, typeName)));
    }

    /**
     * {@code Name = type}: an alias, except {@code True}/{@code False} which declare a bool constant.
     */
    public ParseResult<Declaration> newAliasOrConstant(SourceSpan span, String name, TypeExpr value) {
        if (value instanceof TypeExpr.NamedType named
            && ("True".equals(named.name()) || "False".equals(named.name()))) {
            return construct(span, () -> new Constant(span, name, new TypeExpr.NamedType(value.span(), "bool")));
        }
        return construct(span, () -> new Alias(span, name, value));
    }

    public ParseResult<Declaration> newImport(SourceSpan span, Optional<String> fromModule, List<Import.Item> items) {
        for (var item : items) {
            if (Import.Item.WILDCARD.equals(item.name()) && fromModule.isEmpty()) {
                return fail(span, "Wildcard import needs a 'from' module");
            }
        }
        return construct(span, () -> new Import(span, fromModule, items));
    }

    /**
     * {@code T = TypeVar('T', ...)}. The first argument must repeat the declared name.
     */
    public ParseResult<Declaration> newTypeVar(SourceSpan span,
                                               String name,
                                               String declaredName,
                                               List<TypeExpr> constraints,
                                               Optional<TypeExpr> bound) {
        if (!name.equals(declaredName)) {
            return fail(span, "TypeVar name needs to be '" + name + "' (not '" + declaredName + "')");
        }
        if (constraints.size() == 1) {
            return fail(span, "TypeVar '" + name + "' needs at least two constraints");
        }
        if (!constraints.isEmpty() && bound.isPresent()) {
            return fail(span, "TypeVar '" + name + "' cannot have both constraints and a bound");
        }
        if (classNames.contains(name)) {
            return fail(span, "TypeVar '" + name + "' conflicts with a class of the same name");
        }
        return this.<Declaration>construct(span, () -> new TypeVarDef(span, name, constraints, bound))
            .onSuccess(typeVar -> {
                if (isActive()) {
                    typeVariables.add(name);
                }
            });
    }

    // === Types ===

    /**
     * Resolve a dotted name. Plain names that were registered as classes or
     * declared as type variables resolve to those.
     */
    public ParseResult<TypeExpr> newType(SourceSpan span, String name) {
        if (classNames.contains(name)) {
            return construct(span, () -> new TypeExpr.ClassType(span, name));
        }
        if (typeVariables.contains(name)) {
            return construct(span, () -> new TypeExpr.TypeParameter(span, name));
        }
        return construct(span, () -> new TypeExpr.NamedType(span, name));
    }

    public ParseResult<TypeExpr> newGenericType(SourceSpan span, TypeExpr base, List<TypeExpr> parameters) {
        if (base instanceof TypeExpr.TypeParameter) {
            return fail(span, "Type parameter '" + base + "' cannot be parameterized");
        }
        return construct(span, () -> new TypeExpr.GenericType(span, base, parameters));
    }

    /**
     * {@code [t1, t2]}: shorthand for a generic {@code tuple}.
     */
    public ParseResult<TypeExpr> newTupleType(SourceSpan span, List<TypeExpr> elements) {
        return construct(span, () -> new TypeExpr.GenericType(span, new TypeExpr.NamedType(span, "tuple"), elements));
    }

    public ParseResult<TypeExpr> newUnionType(SourceSpan span, TypeExpr left, TypeExpr right) {
        return construct(span, () -> new TypeExpr.UnionType(span, left, right));
    }

    public ParseResult<TypeExpr.NamedTupleType.Field> newNamedTupleField(SourceSpan span, String name, TypeExpr type) {
        return construct(span, () -> new TypeExpr.NamedTupleType.Field(span, name, type));
    }

    public ParseResult<TypeExpr> newNamedTuple(SourceSpan span, String name, List<TypeExpr.NamedTupleType.Field> fields) {
        var tuple = new TypeExpr.NamedTupleType(span, name, fields);
        if (tuple.hasDuplicateFields()) {
            return fail(span, "Duplicate field name in NamedTuple '" + name + "'");
        }
        return ParseResult.success(tuple);
    }

    // === Conditionals ===

    public ParseResult<Condition> ifBegin(Condition condition, SourceSpan span) {
        return checkCondition(condition, span).onSuccess(valid -> {
            var enclosing = isActive();
            conditionals.push(new Frame(enclosing, enclosing && resolver.matches(valid)));
        });
    }

    public ParseResult<Condition> ifElif(Condition condition, SourceSpan span) {
        return checkCondition(condition, span).onSuccess(valid -> {
            var frame = currentFrame();
            frame.active = !frame.taken && frame.enclosingActive && resolver.matches(valid);
            frame.taken |= frame.active;
        });
    }

    public void ifElse() {
        var frame = currentFrame();
        frame.active = !frame.taken && frame.enclosingActive;
        frame.taken = true;
    }

    /**
     * Close a guarded block and return the declarations of the winning branch.
     */
    public ParseResult<List<Declaration>> ifEnd(ConditionalBlock block) {
        currentFrame();
        conditionals.pop();
        return ParseResult.success(resolver.resolve(block));
    }

    public boolean isActive() {
        for (var frame : conditionals) {
            if (!frame.active) {
                return false;
            }
        }
        return true;
    }

    // === Completion ===

    /**
     * Hand the finished unit to the caller. The context cannot be reused afterwards.
     */
    public ParseResult<Unit> newUnit(SourceSpan span, List<Declaration> declarations) {
        if (finished) {
            throw new IllegalStateException("Parsing context already produced a unit");
        }
        if (!conditionals.isEmpty()) {
            throw new IllegalStateException("Unclosed conditional block");
        }
        finished = true;
        return construct(span, () -> new Unit(span, declarations));
    }

    // === Internals ===

    private ParseResult<Condition> checkCondition(Condition condition, SourceSpan span) {
        if (condition.right() instanceof Operand.Name name && !condition.operator().isEquality()) {
            return fail(span, "Unsupported comparison '" + condition.operator().symbol()
                              + "' with name '" + name.name() + "', only '==' and '!=' are allowed");
        }
        return ParseResult.success(condition);
    }

    private Optional<String> checkParams(String function, List<Param> params) {
        var names = new HashSet<String>();
        var stars = 0;
        for (int i = 0; i < params.size(); i++) {
            var param = params.get(i);
            var last = i == params.size() - 1;
            if (param.isEllipsis()) {
                if (!last) {
                    return Optional.of("'...' must be the last parameter of '" + function + "'");
                }
                continue;
            }
            if (!param.isSeparator() && !names.add(param.name())) {
                return Optional.of("Duplicate parameter '" + param.name() + "' in '" + function + "'");
            }
            switch (param.kind()) {
                case STAR -> {
                    if (++stars > 1) {
                        return Optional.of("Conflicting '*' parameters in '" + function + "'");
                    }
                    if (param.isSeparator() && (last || params.get(i + 1).kind() != StarKind.NONE
                                                || params.get(i + 1).isEllipsis())) {
                        return Optional.of("Named parameters must follow bare '*' in '" + function + "'");
                    }
                }
                case DOUBLE_STAR -> {
                    if (!last) {
                        return Optional.of("'**" + param.name() + "' must be the last parameter of '" + function + "'");
                    }
                }
                case NONE -> {
                }
            }
        }
        return Optional.empty();
    }

    private Frame currentFrame() {
        var frame = conditionals.peek();
        if (frame == null) {
            throw new IllegalStateException("No open conditional block");
        }
        return frame;
    }

    private static boolean isFloatLiteral(String number) {
        return number.indexOf('.') >= 0 || number.indexOf('e') >= 0 || number.indexOf('E') >= 0;
    }

    private <T> ParseResult<T> construct(SourceSpan span, Supplier<T> constructor) {
        try {
            return ParseResult.success(constructor.get());
        } catch (IllegalArgumentException e) {
            return fail(span, e.getMessage());
        }
    }

    private static <T> ParseResult<T> fail(SourceSpan span, String reason) {
        return ParseResult.failure(new StubError.ConstructionError(span, reason));
    }

    /**
     * One open if/elif/else chain.
     */
    private static final class Frame {
        private final boolean enclosingActive;
        private boolean taken;
        private boolean active;

        private Frame(boolean enclosingActive, boolean active) {
            this.enclosingActive = enclosingActive;
            this.active = active;
            this.taken = active;
        }
    }
}
