package org.pragmatica.stubs.lexer;

/**
 * Kinds of tokens a stub lexer produces.
 */
public enum TokenKind {
    END("end of input"),
    NAME("name"),
    NUMBER("number"),
    LEXERROR("lexical error"),

    // Keywords
    CLASS("'class'"),
    DEF("'def'"),
    ELSE("'else'"),
    ELIF("'elif'"),
    IF("'if'"),
    OR("'or'"),
    PASS("'pass'"),
    IMPORT("'import'"),
    FROM("'from'"),
    AS("'as'"),
    RAISE("'raise'"),
    PYTHONCODE("'PYTHONCODE'"),
    NOTHING("'nothing'"),
    RAISES("'raises'"),
    NAMEDTUPLE("'NamedTuple'"),
    TYPEVAR("'TypeVar'"),

    // Multi-character operators
    ARROW("'->'"),
    COLONEQUALS("':='"),
    ELLIPSIS("'...'"),
    EQ("'=='"),
    NE("'!='"),
    LE("'<='"),
    GE("'>='"),

    // Block structure and opaque text
    INDENT("indent"),
    DEDENT("dedent"),
    TRIPLEQUOTED("docstring"),
    TYPECOMMENT("type comment"),

    // Punctuation
    COLON("':'"),
    LPAREN("'('"),
    RPAREN("')'"),
    COMMA("','"),
    ASSIGN("'='"),
    LT("'<'"),
    GT("'>'"),
    STAR("'*'"),
    AT("'@'"),
    LBRACKET("'['"),
    RBRACKET("']'"),
    QUESTION("'?'"),
    DOT("'.'");

    private final String display;

    TokenKind(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }
}
