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
 * One entry of a {@link StructuredDiff}.
 */
public final class Change {
    public enum Type {
        ITEM_ADDED,
        ITEM_REMOVED,
        VALUE_CHANGED
    }

    private final Type type;
    private final TreePath path;
    @Nullable
    private final JsonNode oldValue;
    @Nullable
    private final JsonNode newValue;

    public static Change added(TreePath path, JsonNode newValue) {
        return new Change(Type.ITEM_ADDED, path, null, newValue);
    }

    public static Change removed(TreePath path, JsonNode oldValue) {
        return new Change(Type.ITEM_REMOVED, path, oldValue, null);
    }

    public static Change changed(TreePath path, JsonNode oldValue, JsonNode newValue) {
        return new Change(Type.VALUE_CHANGED, path, oldValue, newValue);
    }

    private Change(Type type, TreePath path, @Nullable JsonNode oldValue,
            @Nullable JsonNode newValue) {
        this.type = Objects.requireNonNull(type, "type");
        this.path = Objects.requireNonNull(path, "path");
        this.oldValue = oldValue;
        this.newValue = newValue;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Change change = (Change) o;
        return type == change.type &&
                Objects.equals(path, change.path) &&
                Objects.equals(oldValue, change.oldValue) &&
                Objects.equals(newValue, change.newValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, path, oldValue, newValue);
    }

    @Override
    public String toString() {
        return "Change{" +
                "type=" + type +
                ", path=" + path +
                ", oldValue=" + oldValue +
                ", newValue=" + newValue +
                '}';
    }
}
