package org.pragmatica.stubs.tree;

import java.util.Optional;

import static org.pragmatica.stubs.tree.Names.requireName;

/**
 * Function parameter. A lone {@code *} separator is kept as a param named {@code *}
 * with kind {@link StarKind#STAR} and no type.
 *
 * @param defaultValue default marker text: a name, a number or {@code ...}
 */
public record Param(SourceSpan span,
                    String name,
                    Optional<TypeExpr> type,
                    Optional<String> defaultValue,
                    StarKind kind) {

    public static final String SEPARATOR = "*";
    public static final String ELLIPSIS = "...";

    public enum StarKind {
        NONE,
        STAR,
        DOUBLE_STAR
    }

    public Param {
        requireName(name, "parameter name");
        if (kind == null) {
            throw new IllegalArgumentException("Missing star kind for parameter " + name);
        }
        type = type == null ? Optional.empty() : type;
        defaultValue = defaultValue == null ? Optional.empty() : defaultValue;
    }

    public static Param separator(SourceSpan span) {
        return new Param(span, SEPARATOR, Optional.empty(), Optional.empty(), StarKind.STAR);
    }

    /**
     * Placeholder for a trailing {@code ...} in a parameter list. Never survives
     * into a finished function; it becomes {@code FuncDef.hasOptional()}.
     */
    public static Param ellipsis(SourceSpan span) {
        return new Param(span, ELLIPSIS, Optional.empty(), Optional.empty(), StarKind.NONE);
    }

    public boolean isEllipsis() {
        return kind == StarKind.NONE && ELLIPSIS.equals(name);
    }

    public boolean isSeparator() {
        return kind == StarKind.STAR && SEPARATOR.equals(name);
    }

    public boolean hasDefault() {
        return defaultValue.isPresent();
    }

    @Override
    public String toString() {
        var prefix = switch (kind) {
            case NONE -> "";
            case STAR -> isSeparator() ? "" : "*";
            case DOUBLE_STAR -> "**";
        };
        return prefix + name
               + type.map(t -> ": " + t).orElse("")
               + defaultValue.map(d -> " = " + d).orElse("");
    }
}
