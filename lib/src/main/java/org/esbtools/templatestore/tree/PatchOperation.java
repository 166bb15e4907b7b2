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

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A single step of a {@link Patch}. Every operation keeps both the value it replaces and the
 * value it installs, so it can be inverted without looking at the tree it was computed from.
 */
public final class PatchOperation {
    public enum Type {
        ADD,
        REMOVE,
        REPLACE
    }

    private final Type type;
    private final TreePath path;
    @Nullable
    private final JsonNode oldValue;
    @Nullable
    private final JsonNode newValue;
    @Nullable
    private final Integer keyIndex;

    public static PatchOperation add(TreePath path, JsonNode value) {
        return new PatchOperation(Type.ADD, path, null, value, null);
    }

    /**
     * Adds an object key at {@code keyIndex} among the keys of its object.
     */
    public static PatchOperation add(TreePath path, JsonNode value, @Nullable Integer keyIndex) {
        return new PatchOperation(Type.ADD, path, null, value, keyIndex);
    }

    public static PatchOperation remove(TreePath path, JsonNode oldValue) {
        return new PatchOperation(Type.REMOVE, path, oldValue, null, null);
    }

    /**
     * Removes an object key which sat at {@code keyIndex}, so the inverse puts it back there.
     */
    public static PatchOperation remove(TreePath path, JsonNode oldValue,
            @Nullable Integer keyIndex) {
        return new PatchOperation(Type.REMOVE, path, oldValue, null, keyIndex);
    }

    public static PatchOperation replace(TreePath path, @Nullable JsonNode oldValue,
            @Nullable JsonNode newValue) {
        return new PatchOperation(Type.REPLACE, path, oldValue, newValue, null);
    }

    public static PatchOperation of(Type type, TreePath path, @Nullable JsonNode oldValue,
            @Nullable JsonNode newValue) {
        return new PatchOperation(type, path, oldValue, newValue, null);
    }

    public static PatchOperation of(Type type, TreePath path, @Nullable JsonNode oldValue,
            @Nullable JsonNode newValue, @Nullable Integer keyIndex) {
        return new PatchOperation(type, path, oldValue, newValue, keyIndex);
    }

    static PatchOperation fromChange(Change change, @Nullable Integer keyIndex) {
        switch (change.type()) {
            case ITEM_ADDED:
                return add(change.path(), change.newValue(), keyIndex);
            case ITEM_REMOVED:
                return remove(change.path(), change.oldValue(), keyIndex);
            case VALUE_CHANGED:
                return replace(change.path(), change.oldValue(), change.newValue());
            default:
                throw new IllegalArgumentException("Unknown change type: " + change.type());
        }
    }

    private PatchOperation(Type type, TreePath path, @Nullable JsonNode oldValue,
            @Nullable JsonNode newValue, @Nullable Integer keyIndex) {
        this.type = Objects.requireNonNull(type, "type");
        this.path = Objects.requireNonNull(path, "path");
        this.oldValue = Trees.copy(oldValue);
        this.newValue = Trees.copy(newValue);
        this.keyIndex = keyIndex;

        if (type != Type.REPLACE && path.isRoot()) {
            throw new IllegalArgumentException(type + " is not supported at the root of a tree");
        }
        if (keyIndex != null && (type == Type.REPLACE || keyIndex < 0 ||
                !(path.lastSegment() instanceof String))) {
            throw new IllegalArgumentException("Key index " + keyIndex + " does not apply to " +
                    type + " at '" + path + "'");
        }
    }

    public Type type() {
        return type;
    }

    public TreePath path() {
        return path;
    }

    @Nullable
    public JsonNode oldValue() {
        return oldValue;
    }

    @Nullable
    public JsonNode newValue() {
        return newValue;
    }

    /**
     * Position of an added or removed object key among the keys of its object, if recorded.
     */
    @Nullable
    public Integer keyIndex() {
        return keyIndex;
    }

    public PatchOperation inverse() {
        switch (type) {
            case ADD:
                return remove(path, newValue, keyIndex);
            case REMOVE:
                return add(path, oldValue, keyIndex);
            case REPLACE:
                return replace(path, newValue, oldValue);
            default:
                throw new IllegalStateException("Unknown operation type: " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PatchOperation that = (PatchOperation) o;
        return type == that.type &&
                Objects.equals(path, that.path) &&
                Objects.equals(oldValue, that.oldValue) &&
                Objects.equals(newValue, that.newValue) &&
                Objects.equals(keyIndex, that.keyIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, path, oldValue, newValue, keyIndex);
    }

    @Override
    public String toString() {
        return "PatchOperation{" +
                "type=" + type +
                ", path=" + path +
                ", oldValue=" + oldValue +
                ", newValue=" + newValue +
                ", keyIndex=" + keyIndex +
                '}';
    }
}
