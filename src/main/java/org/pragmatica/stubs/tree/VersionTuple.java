package org.pragmatica.stubs.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered sequence of non-negative integers, e.g. {@code (3, 8)}.
 * Comparison pads the shorter tuple with zeros on the right.
 */
public record VersionTuple(List<Integer> parts) implements Comparable<VersionTuple> {

    public VersionTuple {
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("Version tuple needs at least one component");
        }
        for (var part : parts) {
            if (part == null || part < 0) {
                throw new IllegalArgumentException("Invalid version component " + part);
            }
        }
        parts = List.copyOf(parts);
    }

    public static VersionTuple of(int... parts) {
        var list = new ArrayList<Integer>(parts.length);
        for (var part : parts) {
            list.add(part);
        }
        return new VersionTuple(list);
    }

    /**
     * Parse a dotted version such as {@code 3.8} or {@code 2.7.18}.
     */
    public static VersionTuple parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Empty version");
        }
        var list = new ArrayList<Integer>();
        for (var segment : text.trim().split("\\.", -1)) {
            try {
                list.add(Integer.parseInt(segment));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid version '" + text + "'", e);
            }
        }
        return new VersionTuple(list);
    }

    public int size() {
        return parts.size();
    }

    @Override
    public int compareTo(VersionTuple other) {
        var length = Math.max(parts.size(), other.parts.size());
        for (int i = 0; i < length; i++) {
            int mine = i < parts.size() ? parts.get(i) : 0;
            int theirs = i < other.parts.size() ? other.parts.get(i) : 0;
            if (mine != theirs) {
                return Integer.compare(mine, theirs);
            }
        }
        return 0;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("(");
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(parts.get(i));
        }
        if (parts.size() == 1) {
            sb.append(',');
        }
        return sb.append(')').toString();
    }
}
