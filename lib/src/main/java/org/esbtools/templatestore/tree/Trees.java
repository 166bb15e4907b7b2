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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Static helpers over Jackson trees. None of these mutate their arguments.
 */
public abstract class Trees {
    public static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /**
     * A node is absent if it is Java {@code null}, a JSON {@code null}, or a missing node.
     */
    public static boolean isAbsent(@Nullable JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    @Nullable
    public static JsonNode copy(@Nullable JsonNode node) {
        return node == null ? null : node.deepCopy();
    }

    public static ObjectNode copyObject(@Nullable JsonNode node) {
        if (isAbsent(node)) {
            return NODES.objectNode();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Expected an object node but got " +
                    node.getNodeType() + ": " + node);
        }
        return (ObjectNode) node.deepCopy();
    }

    /**
     * Copies {@code node}, dropping null valued keys at every depth and the given top level keys.
     * This is the view used to decide whether two trees carry the same content.
     */
    public static JsonNode project(@Nullable JsonNode node, Set<String> ignoreTopLevelFields) {
        JsonNode withoutNulls = withoutNulls(node);

        if (withoutNulls.isObject() && !ignoreTopLevelFields.isEmpty()) {
            ((ObjectNode) withoutNulls).remove(ignoreTopLevelFields);
        }

        return withoutNulls;
    }

    public static JsonNode withoutNulls(@Nullable JsonNode node) {
        if (isAbsent(node)) {
            return NODES.nullNode();
        }

        switch (node.getNodeType()) {
            case OBJECT:
                ObjectNode object = NODES.objectNode();
                Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    if (!isAbsent(field.getValue())) {
                        object.set(field.getKey(), withoutNulls(field.getValue()));
                    }
                }
                return object;
            case ARRAY:
                ArrayNode array = NODES.arrayNode();
                for (JsonNode element : node) {
                    array.add(withoutNulls(element));
                }
                return array;
            default:
                return node.deepCopy();
        }
    }

    /**
     * Returns the node at {@code path}, or a missing node if any segment does not exist.
     */
    public static JsonNode at(@Nullable JsonNode root, TreePath path) {
        JsonNode current = root == null ? NODES.missingNode() : root;

        for (Object segment : path.segments()) {
            if (segment instanceof Integer) {
                current = current.path((Integer) segment);
            } else {
                current = current.path((String) segment);
            }
        }

        return current;
    }

    /**
     * Structural equality, except integral numbers compare by value regardless of their width.
     */
    public static boolean sameValue(@Nullable JsonNode left, @Nullable JsonNode right) {
        if (isAbsent(left) || isAbsent(right)) {
            return isAbsent(left) && isAbsent(right);
        }

        if (left.isIntegralNumber() && right.isIntegralNumber()) {
            return left.bigIntegerValue().equals(right.bigIntegerValue());
        }

        return left.equals(right);
    }
}
