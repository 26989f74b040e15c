package org.pragmatica.stubs.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered accumulation helpers for list-shaped productions.
 * Lists returned here are mutable until handed to a node constructor.
 */
final class NodeLists {
    private NodeLists() {}

    static <T> List<T> empty() {
        return new ArrayList<>();
    }

    static <T> List<T> append(List<T> list, T item) {
        list.add(item);
        return list;
    }

    static <T> List<T> extend(List<T> destination, List<? extends T> source) {
        destination.addAll(source);
        return destination;
    }
}
