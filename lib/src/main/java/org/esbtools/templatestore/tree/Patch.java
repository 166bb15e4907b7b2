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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.Iterators;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A reversible structural diff. {@code Patch.between(a, b).apply(a)} yields {@code b}, and
 * {@code Patch.between(a, b).inverse().apply(b)} yields {@code a}. Both keep the key order of
 * the objects they rebuild.
 *
 * <p>Reverse deltas in a document's history are patches from a newer version's content to the
 * previous version's content.
 */
public final class Patch {
    private static final Patch EMPTY = new Patch(Collections.emptyList());

    private final List<PatchOperation> operations;

    public static Patch empty() {
        return EMPTY;
    }

    public static Patch between(@Nullable JsonNode from, @Nullable JsonNode to) {
        List<PatchOperation> operations = new ArrayList<>();

        for (Change change : StructuredDiff.between(from, to).changes()) {
            operations.add(PatchOperation.fromChange(change, keyIndexOf(change, from, to)));
        }

        return of(operations);
    }

    /**
     * Position of an added key in the new object, or of a removed key in the old one.
     */
    @Nullable
    private static Integer keyIndexOf(Change change, @Nullable JsonNode from,
            @Nullable JsonNode to) {
        TreePath path = change.path();
        if (path.isRoot() || !(path.lastSegment() instanceof String)) {
            return null;
        }

        JsonNode object;
        switch (change.type()) {
            case ITEM_ADDED:
                object = Trees.at(to, path.parent());
                break;
            case ITEM_REMOVED:
                object = Trees.at(from, path.parent());
                break;
            default:
                return null;
        }

        int index = Iterators.indexOf(object.fieldNames(), path.lastSegment()::equals);
        return index < 0 ? null : index;
    }

    public static Patch of(List<PatchOperation> operations) {
        if (operations.isEmpty()) {
            return EMPTY;
        }
        return new Patch(Collections.unmodifiableList(new ArrayList<>(operations)));
    }

    private Patch(List<PatchOperation> operations) {
        this.operations = operations;
    }

    public List<PatchOperation> operations() {
        return operations;
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    /**
     * Applies the operations in order to a copy of {@code tree}.
     *
     * @throws IllegalStateException if an operation does not fit the shape of the tree, which
     * means the patch was computed from a different tree.
     */
    public JsonNode apply(@Nullable JsonNode tree) {
        JsonNode result = tree == null ? Trees.NODES.nullNode() : tree.deepCopy();

        for (PatchOperation operation : operations) {
            result = applyOne(result, operation);
        }

        return result;
    }

    public Patch inverse() {
        List<PatchOperation> inverted = new ArrayList<>(operations.size());

        for (int i = operations.size() - 1; i >= 0; i--) {
            inverted.add(operations.get(i).inverse());
        }

        return of(inverted);
    }

    private static JsonNode applyOne(JsonNode tree, PatchOperation operation) {
        TreePath path = operation.path();

        if (path.isRoot()) {
            JsonNode replacement = operation.newValue();
            return replacement == null ? Trees.NODES.nullNode() : replacement.deepCopy();
        }

        JsonNode parent = Trees.at(tree, path.parent());
        Object last = path.lastSegment();

        if (last instanceof Integer && parent.isArray()) {
            applyToArray((ArrayNode) parent, (Integer) last, operation);
        } else if (last instanceof String && parent.isObject()) {
            applyToObject((ObjectNode) parent, (String) last, operation);
        } else {
            throw new IllegalStateException("Patch does not fit tree. Cannot apply " + operation +
                    " because the parent at '" + path.parent() + "' is " + parent.getNodeType());
        }

        return tree;
    }

    private static void applyToArray(ArrayNode array, int index, PatchOperation operation) {
        switch (operation.type()) {
            case ADD:
                if (index > array.size()) {
                    throw new IllegalStateException("Patch does not fit tree. Cannot add at " +
                            operation.path() + ", array has only " + array.size() + " items");
                }
                array.insert(index, valueOf(operation.newValue()));
                break;
            case REMOVE:
                requireIndex(array, index, operation);
                array.remove(index);
                break;
            case REPLACE:
                requireIndex(array, index, operation);
                array.set(index, valueOf(operation.newValue()));
                break;
            default:
                throw new IllegalStateException("Unknown operation type: " + operation.type());
        }
    }

    private static void applyToObject(ObjectNode object, String key, PatchOperation operation) {
        switch (operation.type()) {
            case ADD:
                Integer keyIndex = operation.keyIndex();
                if (keyIndex != null && !object.has(key)) {
                    insertAt(object, key, valueOf(operation.newValue()), keyIndex);
                    break;
                }
                object.set(key, valueOf(operation.newValue()));
                break;
            case REPLACE:
                object.set(key, valueOf(operation.newValue()));
                break;
            case REMOVE:
                object.remove(key);
                break;
            default:
                throw new IllegalStateException("Unknown operation type: " + operation.type());
        }
    }

    private static void insertAt(ObjectNode object, String key, JsonNode value, int keyIndex) {
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        object.fields().forEachRemaining(field -> fields.put(field.getKey(), field.getValue()));
        int at = Math.min(keyIndex, fields.size());

        object.removeAll();
        int i = 0;
        for (Map.Entry<String, JsonNode> field : fields.entrySet()) {
            if (i++ == at) {
                object.set(key, value);
            }
            object.set(field.getKey(), field.getValue());
        }
        if (at == fields.size()) {
            object.set(key, value);
        }
    }

    private static void requireIndex(ArrayNode array, int index, PatchOperation operation) {
        if (index >= array.size()) {
            throw new IllegalStateException("Patch does not fit tree. No item at " +
                    operation.path() + ", array has only " + array.size() + " items");
        }
    }

    private static JsonNode valueOf(@Nullable JsonNode value) {
        return value == null ? Trees.NODES.nullNode() : value.deepCopy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Patch patch = (Patch) o;
        return Objects.equals(operations, patch.operations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operations);
    }

    @Override
    public String toString() {
        return "Patch{" +
                "operations=" + operations +
                '}';
    }
}
