package org.pragmatica.stubs.tree;

/**
 * Structural checks shared by node constructors.
 */
final class Names {
    private Names() {}

    static String requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Empty " + what);
        }
        return name;
    }

    static String requireDottedName(String name, String what) {
        requireName(name, what);
        for (var segment : name.split("\\.", -1)) {
            if (segment.isBlank()) {
                throw new IllegalArgumentException("Malformed dotted " + what + " '" + name + "'");
            }
        }
        return name;
    }

    static <T> T requireNode(T node, String what) {
        if (node == null) {
            throw new IllegalArgumentException("Missing " + what);
        }
        return node;
    }
}
