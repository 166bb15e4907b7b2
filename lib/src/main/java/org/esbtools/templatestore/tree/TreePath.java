/*
 *  Copyright 2016 esbtools Contributors and/or its affiliates.
 *
 *  This file is part of esbtools.
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.esbtools.templatestore.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable location of a node within a document tree. Segments are either object keys
 * ({@link String}) or array indexes ({@link Integer}).
 *
 * <p>The string form joins segments with dots, so the third aspect of a document is
 * {@code aspects.2}.
 */
public final class TreePath {
    private static final TreePath ROOT = new TreePath(Collections.emptyList());

    private final List<Object> segments;

    private TreePath(List<Object> segments) {
        this.segments = segments;
    }

    public static TreePath root() {
        return ROOT;
    }

    public static TreePath of(Object... segments) {
        TreePath path = ROOT;
        for (Object segment : segments) {
            if (segment instanceof String) {
                path = path.key((String) segment);
            } else if (segment instanceof Integer) {
                path = path.index((Integer) segment);
            } else {
                throw new IllegalArgumentException("Path segments must be String keys or " +
                        "Integer indexes but got: " + segment);
            }
        }
        return path;
    }

    public TreePath key(String key) {
        return append(Objects.requireNonNull(key, "key"));
    }

    public TreePath index(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Negative index: " + index);
        }
        return append(index);
    }

    public List<Object> segments() {
        return segments;
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public TreePath parent() {
        if (isRoot()) {
            throw new IllegalStateException("Root path has no parent");
        }
        return new TreePath(segments.subList(0, segments.size() - 1));
    }

    public Object lastSegment() {
        if (isRoot()) {
            throw new IllegalStateException("Root path has no segments");
        }
        return segments.get(segments.size() - 1);
    }

    private TreePath append(Object segment) {
        List<Object> appended = new ArrayList<>(segments.size() + 1);
        appended.addAll(segments);
        appended.add(segment);
        return new TreePath(Collections.unmodifiableList(appended));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TreePath treePath = (TreePath) o;
        return Objects.equals(segments, treePath.segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segments);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (Object segment : segments) {
            if (builder.length() > 0) {
                builder.append('.');
            }
            builder.append(segment);
        }
        return builder.toString();
    }
}
