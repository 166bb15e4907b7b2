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

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.Lists;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered list of per-path changes which turn one tree into another.
 *
 * <p>Objects are compared key by key and arrays index by index. When arrays differ in length,
 * trailing additions are listed in ascending index order and trailing removals in descending
 * index order, so the changes can be replayed one after the other. Object keys follow the same
 * rule by their position in the object: removed keys last to first, added keys first to last.
 * If the keys both objects share are in a different order, the object is reported as changed
 * as a whole.
 */
public final class StructuredDiff {
    private static final StructuredDiff EMPTY = new StructuredDiff(Collections.emptyList());

    private final List<Change> changes;

    public static StructuredDiff empty() {
        return EMPTY;
    }

    public static StructuredDiff between(JsonNode from, JsonNode to) {
        List<Change> changes = new ArrayList<>();
        collect(TreePath.root(), from, to, changes);
        return changes.isEmpty() ? EMPTY : new StructuredDiff(Collections.unmodifiableList(changes));
    }

    private StructuredDiff(List<Change> changes) {
        this.changes = changes;
    }

    public List<Change> changes() {
        return changes;
    }

    public List<Change> changesOfType(Change.Type type) {
        return changes.stream()
                .filter(change -> change.type() == type)
                .collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public int size() {
        return changes.size();
    }

    private static void collect(TreePath path, JsonNode from, JsonNode to, List<Change> changes) {
        if (Trees.isAbsent(from) && Trees.isAbsent(to)) {
            if (from != null && to != null && from.getNodeType() != to.getNodeType()) {
                changes.add(Change.changed(path, from, to));
            }
            return;
        }

        if (from != null && to != null && from.isObject() && to.isObject()) {
            collectObject(path, from, to, changes);
        } else if (from != null && to != null && from.isArray() && to.isArray()) {
            collectArray(path, from, to, changes);
        } else if (!Trees.sameValue(from, to)) {
            changes.add(Change.changed(path, from, to));
        }
    }

    private static void collectObject(TreePath path, JsonNode from, JsonNode to,
            List<Change> changes) {
        List<String> fromKeys = Lists.newArrayList(from.fieldNames());
        List<String> toKeys = Lists.newArrayList(to.fieldNames());

        List<String> sharedInFromOrder = fromKeys.stream().filter(to::has)
                .collect(Collectors.toList());
        List<String> sharedInToOrder = toKeys.stream().filter(from::has)
                .collect(Collectors.toList());

        // Key order is part of the content. A reorder replaces the whole object.
        if (!sharedInFromOrder.equals(sharedInToOrder)) {
            changes.add(Change.changed(path, from, to));
            return;
        }

        for (String key : sharedInFromOrder) {
            collect(path.key(key), from.get(key), to.get(key), changes);
        }

        for (int i = fromKeys.size() - 1; i >= 0; i--) {
            String key = fromKeys.get(i);
            if (!to.has(key)) {
                changes.add(Change.removed(path.key(key), from.get(key)));
            }
        }

        for (String key : toKeys) {
            if (!from.has(key)) {
                changes.add(Change.added(path.key(key), to.get(key)));
            }
        }
    }

    private static void collectArray(TreePath path, JsonNode from, JsonNode to,
            List<Change> changes) {
        int common = Math.min(from.size(), to.size());

        for (int i = 0; i < common; i++) {
            collect(path.index(i), from.get(i), to.get(i), changes);
        }

        for (int i = common; i < to.size(); i++) {
            changes.add(Change.added(path.index(i), to.get(i)));
        }

        for (int i = from.size() - 1; i >= common; i--) {
            changes.add(Change.removed(path.index(i), from.get(i)));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StructuredDiff that = (StructuredDiff) o;
        return Objects.equals(changes, that.changes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(changes);
    }

    @Override
    public String toString() {
        return "StructuredDiff{" +
                "changes=" + changes +
                '}';
    }
}
