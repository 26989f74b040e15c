package org.pragmatica.stubs.parser;

import org.pragmatica.stubs.error.StubError;
import org.pragmatica.stubs.lexer.Lexer;
import org.pragmatica.stubs.lexer.Token;
import org.pragmatica.stubs.lexer.TokenKind;
import org.pragmatica.stubs.tree.ConditionalBlock;
import org.pragmatica.stubs.tree.ConditionalBlock.Branch;
import org.pragmatica.stubs.tree.ConditionalBlock.Condition;
import org.pragmatica.stubs.tree.ConditionalBlock.Operand;
import org.pragmatica.stubs.tree.ConditionalBlock.Operator;
import org.pragmatica.stubs.tree.Declaration;
import org.pragmatica.stubs.tree.Declaration.ClassDef;
import org.pragmatica.stubs.tree.Declaration.FuncDef;
import org.pragmatica.stubs.tree.Declaration.Import;
import org.pragmatica.stubs.tree.Param;
import org.pragmatica.stubs.tree.SourceLocation;
import org.pragmatica.stubs.tree.SourceSpan;
import org.pragmatica.stubs.tree.TypeExpr;
import org.pragmatica.stubs.tree.Unit;
import org.pragmatica.stubs.tree.VersionTuple;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.pragmatica.stubs.lexer.TokenKind.*;

/**
 * Parser for stub files. Pulls tokens from a {@link Lexer} with one token of
 * lookahead and builds nodes through a {@link ParsingContext}.
 *
 * <p>The first failure aborts the parse: no recovery, no partial unit.
 */
public final class StubGrammarParser {

    private final Lexer lexer;
    private final ParsingContext context;
    private Token current;
    private Token previous;

    private StubGrammarParser(Lexer lexer, ParsingContext context) {
        this.lexer = lexer;
        this.context = context;
        this.current = lexer.next();
        this.previous = null;
    }

    /**
     * Parse one stub file with a fresh context.
     */
    public static ParseResult<Unit> parse(Lexer lexer, ParserConfig config) {
        return parse(lexer, ParsingContext.create(config));
    }

    public static ParseResult<Unit> parse(Lexer lexer, ParsingContext context) {
        return new StubGrammarParser(lexer, context).parseUnit();
    }

    // start := TRIPLEQUOTED? alldefs END
    private ParseResult<Unit> parseUnit() {
        var start = current.span().start();
        if (current.is(TRIPLEQUOTED)) {
            advance();
        }
        var defs = parseModuleDefs();
        if (defs.isFailure()) {
            return defs.fold(ParseResult::failure, value -> null);
        }
        if (!current.is(END)) {
            return unexpected("declaration or end of input");
        }
        var span = SourceSpan.of(start, current.span().end());
        return context.newUnit(span, defs.unwrap());
    }

    // === Declaration Lists ===

    private ParseResult<List<Declaration>> parseModuleDefs() {
        var defs = NodeLists.<Declaration>empty();

        while (true) {
            ParseResult<Declaration> result;
            switch (current.kind()) {
                case NAME -> result = parseNameDefinition(true);
                case AT, DEF -> result = parseFunction();
                case IMPORT, FROM -> result = parseImport();
                case CLASS -> result = parseClass();
                case IF -> {
                    var resolved = parseConditional(this::parseModuleDefs);
                    if (resolved.isFailure()) {
                        return resolved;
                    }
                    NodeLists.extend(defs, resolved.unwrap());
                    continue;
                }
                default -> {
                    return ParseResult.success(defs);
                }
            }
            if (result.isFailure()) {
                return result.fold(ParseResult::failure, value -> null);
            }
            NodeLists.append(defs, result.unwrap());
        }
    }

    private ParseResult<List<Declaration>> parseClassDefs() {
        var defs = NodeLists.<Declaration>empty();

        while (true) {
            ParseResult<Declaration> result;
            switch (current.kind()) {
                case NAME -> result = parseNameDefinition(false);
                case AT, DEF -> result = parseFunction();
                case IF -> {
                    var resolved = parseConditional(this::parseClassDefs);
                    if (resolved.isFailure()) {
                        return resolved;
                    }
                    NodeLists.extend(defs, resolved.unwrap());
                    continue;
                }
                default -> {
                    return ParseResult.success(defs);
                }
            }
            if (result.isFailure()) {
                return result.fold(ParseResult::failure, value -> null);
            }
            NodeLists.append(defs, result.unwrap());
        }
    }

    // === Conditionals ===

    /**
     * if/elif/else chain whose branch bodies are parsed by {@code body}. Returns
     * the declarations of the winning branch only.
     */
    private ParseResult<List<Declaration>> parseConditional(Supplier<ParseResult<List<Declaration>>> body) {
        var start = current.span().start();
        var branches = NodeLists.<Branch>empty();

        advance(); // if
        var condition = parseCondition();
        if (condition.isFailure()) {
            return condition.fold(ParseResult::failure, value -> null);
        }
        var begun = context.ifBegin(condition.unwrap(), spanFrom(start));
        if (begun.isFailure()) {
            return begun.fold(ParseResult::failure, value -> null);
        }
        var firstBody = parseBlock(body);
        if (firstBody.isFailure()) {
            return firstBody;
        }
        NodeLists.append(branches, Branch.of(condition.unwrap(), firstBody.unwrap()));

        while (current.is(ELIF)) {
            var elifStart = current.span().start();
            advance();
            var elifCondition = parseCondition();
            if (elifCondition.isFailure()) {
                return elifCondition.fold(ParseResult::failure, value -> null);
            }
            var continued = context.ifElif(elifCondition.unwrap(), spanFrom(elifStart));
            if (continued.isFailure()) {
                return continued.fold(ParseResult::failure, value -> null);
            }
            var elifBody = parseBlock(body);
            if (elifBody.isFailure()) {
                return elifBody;
            }
            NodeLists.append(branches, Branch.of(elifCondition.unwrap(), elifBody.unwrap()));
        }

        if (current.is(ELSE)) {
            advance();
            context.ifElse();
            var elseBody = parseBlock(body);
            if (elseBody.isFailure()) {
                return elseBody;
            }
            NodeLists.append(branches, Branch.otherwise(elseBody.unwrap()));
        }

        return context.ifEnd(new ConditionalBlock(spanFrom(start), branches));
    }

    // ':' INDENT body DEDENT
    private ParseResult<List<Declaration>> parseBlock(Supplier<ParseResult<List<Declaration>>> body) {
        var colon = expect(COLON);
        if (colon.isFailure()) {
            return colon.fold(ParseResult::failure, value -> null);
        }
        var indent = expect(INDENT, "indented block");
        if (indent.isFailure()) {
            return indent.fold(ParseResult::failure, value -> null);
        }
        var defs = body.get();
        if (defs.isFailure()) {
            return defs;
        }
        var dedent = expect(DEDENT, "declaration or end of block");
        if (dedent.isFailure()) {
            return dedent.fold(ParseResult::failure, value -> null);
        }
        return defs;
    }

    // condition := dotted_name op (NAME | version_tuple)
    private ParseResult<Condition> parseCondition() {
        var start = current.span().start();
        var left = parseDottedName();
        if (left.isFailure()) {
            return left.fold(ParseResult::failure, value -> null);
        }
        var operator = parseComparison();
        if (operator.isFailure()) {
            return operator.fold(ParseResult::failure, value -> null);
        }
        ParseResult<Operand> right;
        if (current.is(NAME)) {
            right = ParseResult.success(new Operand.Name(advance().value()));
        } else if (current.is(LPAREN)) {
            right = parseVersionTuple().map(Operand.Version::new);
        } else {
            return unexpected("name or version tuple");
        }
        return right.map(operand -> new Condition(spanFrom(start), left.unwrap(), operator.unwrap(), operand));
    }

    private ParseResult<Operator> parseComparison() {
        Operator operator;
        switch (current.kind()) {
            case LT -> operator = Operator.LT;
            case GT -> operator = Operator.GT;
            case LE -> operator = Operator.LE;
            case GE -> operator = Operator.GE;
            case EQ -> operator = Operator.EQ;
            case NE -> operator = Operator.NE;
            default -> {
                return unexpected("comparison operator");
            }
        }
        advance();
        return ParseResult.success(operator);
    }

    // '(' NUMBER ',' ')' | '(' NUMBER ',' NUMBER ')' | '(' NUMBER ',' NUMBER ',' NUMBER ')'
    private ParseResult<VersionTuple> parseVersionTuple() {
        var parts = NodeLists.<Integer>empty();

        advance(); // (
        var first = versionComponent();
        if (first.isFailure()) {
            return first.fold(ParseResult::failure, value -> null);
        }
        NodeLists.append(parts, first.unwrap());
        var comma = expect(COMMA);
        if (comma.isFailure()) {
            return comma.fold(ParseResult::failure, value -> null);
        }
        if (!current.is(RPAREN)) {
            var second = versionComponent();
            if (second.isFailure()) {
                return second.fold(ParseResult::failure, value -> null);
            }
            NodeLists.append(parts, second.unwrap());
            if (current.is(COMMA)) {
                advance();
                var third = versionComponent();
                if (third.isFailure()) {
                    return third.fold(ParseResult::failure, value -> null);
                }
                NodeLists.append(parts, third.unwrap());
            }
        }
        var close = expect(RPAREN);
        if (close.isFailure()) {
            return close.fold(ParseResult::failure, value -> null);
        }
        return ParseResult.success(new VersionTuple(parts));
    }

    private ParseResult<Integer> versionComponent() {
        var number = expect(NUMBER);
        if (number.isFailure()) {
            return number.fold(ParseResult::failure, value -> null);
        }
        var token = number.unwrap();
        try {
            var component = Integer.parseInt(token.value());
            if (component < 0) {
                return ParseResult.failure(new StubError.ConstructionError(
                    token.span(),
                    "Negative version component '" + token.value() + "'"
                ));
            }
            return ParseResult.success(component);
        } catch (NumberFormatException e) {
            return ParseResult.failure(new StubError.ConstructionError(
                token.span(),
                "Invalid version component '" + token.value() + "'"
            ));
        }
    }

    // === Constants, Aliases, Type Variables ===

    /**
     * Declarations starting with NAME. Aliases and TypeVars are only legal at module level.
     */
    private ParseResult<Declaration> parseNameDefinition(boolean moduleLevel) {
        var start = current.span().start();
        var name = advance().value();

        // NAME ':' type ('=' ELLIPSIS)?
        if (current.is(COLON)) {
            advance();
            var type = parseType();
            if (type.isFailure()) {
                return type.fold(ParseResult::failure, value -> null);
            }
            if (current.is(ASSIGN)) {
                advance();
                var ellipsis = expect(ELLIPSIS);
                if (ellipsis.isFailure()) {
                    return ellipsis.fold(ParseResult::failure, value -> null);
                }
            }
            return context.newConstant(spanFrom(start), name, type.unwrap());
        }

        if (!current.is(ASSIGN)) {
            return unexpected("':' or '='");
        }
        advance();

        switch (current.kind()) {
            case NUMBER -> {
                var number = advance();
                return context.newNumberConstant(spanFrom(start), name, number.value(), number.span());
            }
            case ELLIPSIS -> {
                var ellipsis = advance();
                if (!current.is(TYPECOMMENT)) {
                    return context.newConstant(spanFrom(start), name, new TypeExpr.AnythingType(ellipsis.span()));
                }
                advance();
                var type = parseType();
                if (type.isFailure()) {
                    return type.fold(ParseResult::failure, value -> null);
                }
                return context.newConstant(spanFrom(start), name, type.unwrap());
            }
            case TYPEVAR -> {
                if (moduleLevel) {
                    return parseTypeVar(start, name);
                }
            }
            default -> {
            }
        }

        if (!moduleLevel) {
            return unexpected("number or '...'");
        }
        var value = parseType();
        if (value.isFailure()) {
            return value.fold(ParseResult::failure, v -> null);
        }
        return context.newAliasOrConstant(spanFrom(start), name, value.unwrap());
    }

    // NAME '=' TYPEVAR '(' NAME (',' type)* (',' NAME '=' type)? ')'
    private ParseResult<Declaration> parseTypeVar(SourceLocation start, String name) {
        var constraints = NodeLists.<TypeExpr>empty();
        Optional<TypeExpr> bound = Optional.empty();

        advance(); // TypeVar
        var open = expect(LPAREN);
        if (open.isFailure()) {
            return open.fold(ParseResult::failure, value -> null);
        }
        var declared = expect(NAME, "type variable name");
        if (declared.isFailure()) {
            return declared.fold(ParseResult::failure, value -> null);
        }

        while (current.is(COMMA)) {
            advance();
            if (!current.is(NAME)) {
                var constraint = parseType();
                if (constraint.isFailure()) {
                    return constraint.fold(ParseResult::failure, value -> null);
                }
                NodeLists.append(constraints, constraint.unwrap());
                continue;
            }
            var first = advance();
            if (!current.is(ASSIGN)) {
                var constraint = parseTypeAfterName(first);
                if (constraint.isFailure()) {
                    return constraint.fold(ParseResult::failure, value -> null);
                }
                NodeLists.append(constraints, constraint.unwrap());
                continue;
            }
            advance();
            var keywordValue = parseType();
            if (keywordValue.isFailure()) {
                return keywordValue.fold(ParseResult::failure, value -> null);
            }
            if (!"bound".equals(first.value())) {
                return ParseResult.failure(new StubError.ConstructionError(
                    first.span(),
                    "Unsupported TypeVar keyword '" + first.value() + "'"
                ));
            }
            bound = Optional.of(keywordValue.unwrap());
        }

        var close = expect(RPAREN);
        if (close.isFailure()) {
            return close.fold(ParseResult::failure, value -> null);
        }
        return context.newTypeVar(spanFrom(start), name, declared.unwrap().value(), constraints, bound);
    }

    // === Imports ===

    // IMPORT import_item (',' import_item)* | FROM dotted_name IMPORT from_list
    private ParseResult<Declaration> parseImport() {
        var start = current.span().start();
        var items = NodeLists.<Import.Item>empty();

        if (advance().is(IMPORT)) {
            do {
                var item = parseImportItem();
                if (item.isFailure()) {
                    return item.fold(ParseResult::failure, value -> null);
                }
                NodeLists.append(items, item.unwrap());
            } while (match(COMMA));
            return context.newImport(spanFrom(start), Optional.empty(), items);
        }

        var module = parseDottedName();
        if (module.isFailure()) {
            return module.fold(ParseResult::failure, value -> null);
        }
        var keyword = expect(IMPORT);
        if (keyword.isFailure()) {
            return keyword.fold(ParseResult::failure, value -> null);
        }
        var parenthesized = current.is(LPAREN);
        if (parenthesized) {
            advance();
        }
        do {
            if (parenthesized && current.is(RPAREN) && !items.isEmpty()) {
                break;
            }
            var item = parseFromItem();
            if (item.isFailure()) {
                return item.fold(ParseResult::failure, value -> null);
            }
            NodeLists.append(items, item.unwrap());
        } while (match(COMMA));
        if (parenthesized) {
            var close = expect(RPAREN);
            if (close.isFailure()) {
                return close.fold(ParseResult::failure, value -> null);
            }
        }
        return context.newImport(spanFrom(start), Optional.of(module.unwrap()), items);
    }

    private ParseResult<Import.Item> parseImportItem() {
        var start = current.span().start();
        var name = parseDottedName();
        if (name.isFailure()) {
            return name.fold(ParseResult::failure, value -> null);
        }
        return parseAlias().map(alias -> new Import.Item(spanFrom(start), name.unwrap(), alias));
    }

    // (NAME | NAMEDTUPLE | TYPEVAR) (AS NAME)? | '*'
    private ParseResult<Import.Item> parseFromItem() {
        var start = current.span().start();
        String name;
        switch (current.kind()) {
            case NAME -> name = current.value();
            case NAMEDTUPLE -> name = "NamedTuple";
            case TYPEVAR -> name = "TypeVar";
            case STAR -> {
                advance();
                return ParseResult.success(new Import.Item(spanFrom(start), Import.Item.WILDCARD, Optional.empty()));
            }
            default -> {
                return unexpected("imported name");
            }
        }
        advance();
        return parseAlias().map(alias -> new Import.Item(spanFrom(start), name, alias));
    }

    private ParseResult<Optional<String>> parseAlias() {
        if (!current.is(AS)) {
            return ParseResult.success(Optional.empty());
        }
        advance();
        return expect(NAME).map(token -> Optional.of(token.value()));
    }

    // === Functions ===

    // ('@' dotted_name)* DEF NAME (PYTHONCODE | '(' params? ')' return? raises? body?)
    private ParseResult<Declaration> parseFunction() {
        var decorators = NodeLists.<String>empty();
        while (current.is(AT)) {
            advance();
            var decorator = parseDottedName();
            if (decorator.isFailure()) {
                return decorator.fold(ParseResult::failure, value -> null);
            }
            NodeLists.append(decorators, decorator.unwrap());
        }

        // The span starts at 'def': decorators are not part of the reported location.
        var start = current.span().start();
        var def = expect(DEF);
        if (def.isFailure()) {
            return def.fold(ParseResult::failure, value -> null);
        }
        var name = expect(NAME, "function name");
        if (name.isFailure()) {
            return name.fold(ParseResult::failure, value -> null);
        }
        if (current.is(PYTHONCODE)) {
            advance();
            return context.newExternalFunction(spanFrom(start), decorators, name.unwrap().value());
        }

        var open = expect(LPAREN, "'(' or 'PYTHONCODE'");
        if (open.isFailure()) {
            return open.fold(ParseResult::failure, value -> null);
        }
        var params = parseParams();
        if (params.isFailure()) {
            return params.fold(ParseResult::failure, value -> null);
        }
        var close = expect(RPAREN, "',' or ')'");
        if (close.isFailure()) {
            return close.fold(ParseResult::failure, value -> null);
        }

        Optional<TypeExpr> returnType = Optional.empty();
        if (current.is(ARROW)) {
            advance();
            var type = parseType();
            if (type.isFailure()) {
                return type.fold(ParseResult::failure, value -> null);
            }
            returnType = Optional.of(type.unwrap());
        }

        var raises = NodeLists.<TypeExpr>empty();
        if (current.is(RAISES)) {
            do {
                advance();
                var exception = parseType();
                if (exception.isFailure()) {
                    return exception.fold(ParseResult::failure, value -> null);
                }
                NodeLists.append(raises, exception.unwrap());
            } while (current.is(COMMA));
        }

        var body = parseFunctionBody();
        if (body.isFailure()) {
            return body.fold(ParseResult::failure, value -> null);
        }
        return context.newFunction(spanFrom(start),
                                   decorators,
                                   name.unwrap().value(),
                                   params.unwrap(),
                                   returnType,
                                   raises,
                                   body.unwrap());
    }

    private ParseResult<List<Param>> parseParams() {
        var params = NodeLists.<Param>empty();
        if (current.is(RPAREN)) {
            return ParseResult.success(params);
        }
        do {
            var param = parseParam();
            if (param.isFailure()) {
                return param.fold(ParseResult::failure, value -> null);
            }
            NodeLists.append(params, param.unwrap());
        } while (match(COMMA));
        return ParseResult.success(params);
    }

    // NAME (':' type)? ('=' default)? | '*' | '*' NAME (':' type)? | '*' '*' NAME (':' type)? | ELLIPSIS
    private ParseResult<Param> parseParam() {
        var start = current.span().start();

        if (current.is(ELLIPSIS)) {
            advance();
            return ParseResult.success(Param.ellipsis(spanFrom(start)));
        }

        if (current.is(NAME)) {
            var name = advance().value();
            var type = parseParamType();
            if (type.isFailure()) {
                return type.fold(ParseResult::failure, value -> null);
            }
            var defaultValue = parseParamDefault();
            if (defaultValue.isFailure()) {
                return defaultValue.fold(ParseResult::failure, value -> null);
            }
            return context.newParam(spanFrom(start), name, type.unwrap(), defaultValue.unwrap(), Param.StarKind.NONE);
        }

        if (!current.is(STAR)) {
            return unexpected("parameter or ')'");
        }
        advance();

        var kind = Param.StarKind.STAR;
        if (current.is(STAR)) {
            advance();
            kind = Param.StarKind.DOUBLE_STAR;
        } else if (!current.is(NAME)) {
            return ParseResult.success(Param.separator(spanFrom(start)));
        }
        var name = expect(NAME, "parameter name");
        if (name.isFailure()) {
            return name.fold(ParseResult::failure, value -> null);
        }
        var type = parseParamType();
        if (type.isFailure()) {
            return type.fold(ParseResult::failure, value -> null);
        }
        return context.newParam(spanFrom(start), name.unwrap().value(), type.unwrap(), Optional.empty(), kind);
    }

    private ParseResult<Optional<TypeExpr>> parseParamType() {
        if (!current.is(COLON)) {
            return ParseResult.success(Optional.empty());
        }
        advance();
        return parseType().map(Optional::of);
    }

    // '=' (NAME | NUMBER | ELLIPSIS)
    private ParseResult<Optional<String>> parseParamDefault() {
        if (!current.is(ASSIGN)) {
            return ParseResult.success(Optional.empty());
        }
        advance();
        switch (current.kind()) {
            case NAME, NUMBER -> {
                return ParseResult.success(Optional.of(advance().value()));
            }
            case ELLIPSIS -> {
                advance();
                return ParseResult.success(Optional.of(Param.ELLIPSIS));
            }
            default -> {
                return unexpected("default value");
            }
        }
    }

    /**
     * Optional body after a signature: {@code : ...}, {@code : pass}, or an indented
     * block with a docstring, a placeholder or mutation/raise statements.
     */
    private ParseResult<FunctionBody> parseFunctionBody() {
        if (!current.is(COLON)) {
            return ParseResult.success(FunctionBody.ELLIPSIS);
        }
        advance();

        if (current.is(PASS) || current.is(ELLIPSIS)) {
            return ParseResult.success(advance().is(PASS) ? FunctionBody.PASS : FunctionBody.ELLIPSIS);
        }
        var indent = expect(INDENT, "'pass', '...' or indented body");
        if (indent.isFailure()) {
            return indent.fold(ParseResult::failure, value -> null);
        }

        FunctionBody body;
        if (current.is(TRIPLEQUOTED)) {
            advance();
            body = FunctionBody.ELLIPSIS;
        } else if (current.is(PASS) || current.is(ELLIPSIS)) {
            body = advance().is(PASS) ? FunctionBody.PASS : FunctionBody.ELLIPSIS;
        } else {
            var statements = parseBodyStatements();
            if (statements.isFailure()) {
                return statements;
            }
            body = statements.unwrap();
        }

        var dedent = expect(DEDENT, "body statement or end of block");
        if (dedent.isFailure()) {
            return dedent.fold(ParseResult::failure, value -> null);
        }
        return ParseResult.success(body);
    }

    // (NAME ':=' type | RAISE NAME ('(' ')')?)+
    private ParseResult<FunctionBody> parseBodyStatements() {
        var mutators = NodeLists.<FuncDef.Mutator>empty();
        var raises = NodeLists.<TypeExpr>empty();

        if (!current.is(NAME) && !current.is(RAISE)) {
            return unexpected("'pass', '...' or body statement");
        }
        while (current.is(NAME) || current.is(RAISE)) {
            var start = current.span().start();
            if (advance().is(NAME)) {
                var name = previous.value();
                var assign = expect(COLONEQUALS);
                if (assign.isFailure()) {
                    return assign.fold(ParseResult::failure, value -> null);
                }
                var type = parseType();
                if (type.isFailure()) {
                    return type.fold(ParseResult::failure, value -> null);
                }
                NodeLists.append(mutators, new FuncDef.Mutator(spanFrom(start), name, type.unwrap()));
                continue;
            }
            var exception = expect(NAME, "exception name");
            if (exception.isFailure()) {
                return exception.fold(ParseResult::failure, value -> null);
            }
            if (current.is(LPAREN)) {
                advance();
                var close = expect(RPAREN);
                if (close.isFailure()) {
                    return close.fold(ParseResult::failure, value -> null);
                }
            }
            var token = exception.unwrap();
            var type = context.newType(token.span(), token.value());
            if (type.isFailure()) {
                return type.fold(ParseResult::failure, value -> null);
            }
            NodeLists.append(raises, type.unwrap());
        }
        return ParseResult.success(FunctionBody.statements(mutators, raises));
    }

    // === Classes ===

    // CLASS NAME parents? ':' class_body
    private ParseResult<Declaration> parseClass() {
        var start = current.span().start();
        var parents = NodeLists.<TypeExpr>empty();
        var keywords = NodeLists.<ClassDef.Keyword>empty();

        advance(); // class
        var nameToken = expect(NAME, "class name");
        if (nameToken.isFailure()) {
            return nameToken.fold(ParseResult::failure, value -> null);
        }
        // Registered before anything else so the parents and the body can refer to the class.
        var name = context.registerClassName(nameToken.unwrap().value(), nameToken.unwrap().span());
        if (name.isFailure()) {
            return name.fold(ParseResult::failure, value -> null);
        }

        if (current.is(LPAREN)) {
            advance();
            while (!current.is(RPAREN)) {
                var parent = parseParent(parents, keywords);
                if (parent.isFailure()) {
                    return parent.fold(ParseResult::failure, value -> null);
                }
                if (!current.is(COMMA)) {
                    break;
                }
                advance();
                if (current.is(RPAREN)) {
                    return unexpected("parent class");
                }
            }
            var close = expect(RPAREN, "',' or ')'");
            if (close.isFailure()) {
                return close.fold(ParseResult::failure, value -> null);
            }
        }

        var colon = expect(COLON);
        if (colon.isFailure()) {
            return colon.fold(ParseResult::failure, value -> null);
        }
        var body = parseClassBody();
        if (body.isFailure()) {
            return body.fold(ParseResult::failure, value -> null);
        }
        return context.newClass(spanFrom(start), name.unwrap(), parents, keywords, body.unwrap());
    }

    // type | NAME '=' type
    private ParseResult<TypeExpr> parseParent(List<TypeExpr> parents, List<ClassDef.Keyword> keywords) {
        if (!current.is(NAME)) {
            return parseType().onSuccess(parent -> NodeLists.append(parents, parent));
        }
        var first = advance();
        if (!current.is(ASSIGN)) {
            return parseTypeAfterName(first).onSuccess(parent -> NodeLists.append(parents, parent));
        }
        advance();
        return parseType().onSuccess(value -> NodeLists.append(keywords,
                                                               new ClassDef.Keyword(spanFrom(first.span().start()),
                                                                                    first.value(),
                                                                                    value)));
    }

    // pass_or_ellipsis | INDENT TRIPLEQUOTED? (pass_or_ellipsis | class_defs) DEDENT
    private ParseResult<List<Declaration>> parseClassBody() {
        if (current.is(PASS) || current.is(ELLIPSIS)) {
            advance();
            return ParseResult.success(List.of());
        }
        var indent = expect(INDENT, "'pass', '...' or indented class body");
        if (indent.isFailure()) {
            return indent.fold(ParseResult::failure, value -> null);
        }
        if (current.is(TRIPLEQUOTED)) {
            advance();
        }

        ParseResult<List<Declaration>> body;
        if (current.is(PASS) || current.is(ELLIPSIS)) {
            advance();
            body = ParseResult.success(List.of());
        } else {
            body = parseClassDefs();
            if (body.isFailure()) {
                return body;
            }
        }

        var dedent = expect(DEDENT, "class member or end of class body");
        if (dedent.isFailure()) {
            return dedent.fold(ParseResult::failure, value -> null);
        }
        return body;
    }

    // === Types ===

    // primary (OR primary)*
    private ParseResult<TypeExpr> parseType() {
        return parseUnionTail(parsePrimaryType());
    }

    /**
     * Type whose leading NAME was already consumed to decide between alternatives.
     */
    private ParseResult<TypeExpr> parseTypeAfterName(Token first) {
        return parseUnionTail(parseNamedType(first));
    }

    private ParseResult<TypeExpr> parseUnionTail(ParseResult<TypeExpr> first) {
        if (first.isFailure()) {
            return first;
        }
        var left = first.unwrap();
        while (current.is(OR)) {
            advance();
            var right = parsePrimaryType();
            if (right.isFailure()) {
                return right;
            }
            var union = context.newUnionType(left.span().merge(right.unwrap().span()), left, right.unwrap());
            if (union.isFailure()) {
                return union;
            }
            left = union.unwrap();
        }
        return ParseResult.success(left);
    }

    private ParseResult<TypeExpr> parsePrimaryType() {
        var token = current;
        var start = token.span().start();

        switch (token.kind()) {
            case NAME -> {
                return parseNamedType(advance());
            }
            case QUESTION -> {
                advance();
                return ParseResult.success(new TypeExpr.AnythingType(token.span()));
            }
            case NOTHING -> {
                advance();
                return ParseResult.success(new TypeExpr.NothingType(token.span()));
            }
            case ELLIPSIS -> {
                advance();
                return ParseResult.success(new TypeExpr.EllipsisType(token.span()));
            }
            case NAMEDTUPLE -> {
                return parseNamedTuple();
            }
            case LPAREN -> {
                advance();
                var inner = parseType();
                if (inner.isFailure()) {
                    return inner;
                }
                var close = expect(RPAREN);
                if (close.isFailure()) {
                    return close.fold(ParseResult::failure, value -> null);
                }
                return inner;
            }
            case LBRACKET -> {
                advance();
                var elements = NodeLists.<TypeExpr>empty();
                if (!current.is(RBRACKET)) {
                    var list = parseTypeList(elements);
                    if (list.isFailure()) {
                        return list.fold(ParseResult::failure, value -> null);
                    }
                }
                var close = expect(RBRACKET, "',' or ']'");
                if (close.isFailure()) {
                    return close.fold(ParseResult::failure, value -> null);
                }
                return context.newTupleType(spanFrom(start), elements);
            }
            default -> {
                return unexpected("type");
            }
        }
    }

    // dotted_name ('[' type (',' type)* ']')?
    private ParseResult<TypeExpr> parseNamedType(Token first) {
        var start = first.span().start();
        var name = continueDottedName(first.value());
        if (name.isFailure()) {
            return name.fold(ParseResult::failure, value -> null);
        }
        var base = context.newType(spanFrom(start), name.unwrap());
        if (base.isFailure() || !current.is(LBRACKET)) {
            return base;
        }
        advance();
        var parameters = NodeLists.<TypeExpr>empty();
        var list = parseTypeList(parameters);
        if (list.isFailure()) {
            return list.fold(ParseResult::failure, value -> null);
        }
        var close = expect(RBRACKET, "',' or ']'");
        if (close.isFailure()) {
            return close.fold(ParseResult::failure, value -> null);
        }
        return context.newGenericType(spanFrom(start), base.unwrap(), parameters);
    }

    private ParseResult<List<TypeExpr>> parseTypeList(List<TypeExpr> types) {
        do {
            var type = parseType();
            if (type.isFailure()) {
                return type.fold(ParseResult::failure, value -> null);
            }
            NodeLists.append(types, type.unwrap());
        } while (match(COMMA));
        return ParseResult.success(types);
    }

    // NAMEDTUPLE '(' NAME ',' '[' (field (',' field)* ','?)? ']' ')'
    private ParseResult<TypeExpr> parseNamedTuple() {
        var start = current.span().start();
        var fields = NodeLists.<TypeExpr.NamedTupleType.Field>empty();

        advance(); // NamedTuple
        var open = expect(LPAREN);
        if (open.isFailure()) {
            return open.fold(ParseResult::failure, value -> null);
        }
        var name = expect(NAME, "named tuple name");
        if (name.isFailure()) {
            return name.fold(ParseResult::failure, value -> null);
        }
        var comma = expect(COMMA);
        if (comma.isFailure()) {
            return comma.fold(ParseResult::failure, value -> null);
        }
        var openFields = expect(LBRACKET);
        if (openFields.isFailure()) {
            return openFields.fold(ParseResult::failure, value -> null);
        }
        while (!current.is(RBRACKET)) {
            var field = parseNamedTupleField();
            if (field.isFailure()) {
                return field.fold(ParseResult::failure, value -> null);
            }
            NodeLists.append(fields, field.unwrap());
            if (!current.is(COMMA)) {
                break;
            }
            advance();
        }
        var closeFields = expect(RBRACKET, "',' or ']'");
        if (closeFields.isFailure()) {
            return closeFields.fold(ParseResult::failure, value -> null);
        }
        var close = expect(RPAREN);
        if (close.isFailure()) {
            return close.fold(ParseResult::failure, value -> null);
        }
        return context.newNamedTuple(spanFrom(start), name.unwrap().value(), fields);
    }

    // '(' NAME ',' type ','? ')'
    private ParseResult<TypeExpr.NamedTupleType.Field> parseNamedTupleField() {
        var start = current.span().start();
        var open = expect(LPAREN, "named tuple field");
        if (open.isFailure()) {
            return open.fold(ParseResult::failure, value -> null);
        }
        var name = expect(NAME, "field name");
        if (name.isFailure()) {
            return name.fold(ParseResult::failure, value -> null);
        }
        var comma = expect(COMMA);
        if (comma.isFailure()) {
            return comma.fold(ParseResult::failure, value -> null);
        }
        var type = parseType();
        if (type.isFailure()) {
            return type.fold(ParseResult::failure, value -> null);
        }
        if (current.is(COMMA)) {
            advance();
        }
        var close = expect(RPAREN);
        if (close.isFailure()) {
            return close.fold(ParseResult::failure, value -> null);
        }
        return context.newNamedTupleField(spanFrom(start), name.unwrap().value(), type.unwrap());
    }

    // === Names ===

    // NAME ('.' NAME)*
    private ParseResult<String> parseDottedName() {
        var first = expect(NAME);
        if (first.isFailure()) {
            return first.fold(ParseResult::failure, value -> null);
        }
        return continueDottedName(first.unwrap().value());
    }

    private ParseResult<String> continueDottedName(String head) {
        var name = new StringBuilder(head);
        while (current.is(DOT)) {
            advance();
            var segment = expect(NAME);
            if (segment.isFailure()) {
                return segment.fold(ParseResult::failure, value -> null);
            }
            name.append('.').append(segment.unwrap().value());
        }
        return ParseResult.success(name.toString());
    }

    // === Token Access ===

    private Token advance() {
        previous = current;
        if (!current.is(END)) {
            current = lexer.next();
        }
        return previous;
    }

    private boolean match(TokenKind kind) {
        if (!current.is(kind)) {
            return false;
        }
        advance();
        return true;
    }

    private ParseResult<Token> expect(TokenKind kind) {
        return expect(kind, kind.display());
    }

    private ParseResult<Token> expect(TokenKind kind, String expected) {
        if (current.is(kind)) {
            return ParseResult.success(advance());
        }
        return unexpected(expected);
    }

    /**
     * Failure at the lookahead token. A LEXERROR token is reported with the
     * lexer's own message.
     */
    private <T> ParseResult<T> unexpected(String expected) {
        if (current.is(LEXERROR)) {
            return ParseResult.failure(new StubError.LexicalError(current.span(), current.value()));
        }
        return ParseResult.failure(new StubError.UnexpectedToken(current.span(), current.describe(), expected));
    }

    /**
     * Span from {@code start} to the end of the last consumed token; empty at
     * {@code start} when nothing was consumed yet.
     */
    private SourceSpan spanFrom(SourceLocation start) {
        if (previous == null || previous.span().end().isBefore(start)) {
            return SourceSpan.at(start);
        }
        return SourceSpan.of(start, previous.span().end());
    }
}
