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

package org.esbtools.templatestore.merge;

import org.esbtools.templatestore.MergeException;
import org.esbtools.templatestore.tree.TreePath;
import org.esbtools.templatestore.tree.Trees;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Deep merges a language overlay tree into a structural tree.
 *
 * <p>Objects merge key by key and arrays item by item. Where only one side has a value, that
 * value is used. Where both sides hold plain values, the overlay wins. Strict merges demand
 * that both trees have the same shape: arrays of different length, or an object facing an
 * array, fail with a {@link MergeException}. Inputs are never changed.
 */
public class MergeEngine {
    public JsonNode merge(@Nullable JsonNode base, @Nullable JsonNode overlay, boolean strict) {
        return merge(TreePath.root(), base, overlay, strict);
    }

    /**
     * Merges the {@code aspects} arrays of both trees one index at a time, recording the
     * outcome of each instead of failing. An aspect present on only one side is reported as a
     * structural mismatch.
     */
    public List<AspectMergeResult> mergeAspectsOneByOne(@Nullable JsonNode base,
            @Nullable JsonNode overlay, boolean strict) {
        JsonNode baseAspects = aspectsOf(base);
        JsonNode overlayAspects = aspectsOf(overlay);
        int count = Math.max(baseAspects.size(), overlayAspects.size());
        TreePath aspectsPath = TreePath.of("aspects");

        List<AspectMergeResult> results = new ArrayList<>(count);

        for (int i = 0; i < count; i++) {
            JsonNode baseAspect = baseAspects.get(i);
            JsonNode overlayAspect = overlayAspects.get(i);
            TreePath path = aspectsPath.index(i);
            MergeException error = null;

            if (baseAspect == null || overlayAspect == null) {
                error = new MergeException(MergeException.Reason.STRUCTURAL_MISMATCH, path,
                        (baseAspect == null ? "base" : "language overlay") + " has no aspect " +
                                "at index " + i);
            } else {
                try {
                    merge(path, baseAspect, overlayAspect, strict);
                } catch (MergeException e) {
                    error = e;
                }
            }

            results.add(new AspectMergeResult(i, textOf(baseAspect, "name"),
                    textOf(overlayAspect, "label"), error));
        }

        return results;
    }

    private JsonNode merge(TreePath path, @Nullable JsonNode base, @Nullable JsonNode overlay,
            boolean strict) {
        if (Trees.isAbsent(overlay)) {
            return base == null ? Trees.NODES.nullNode() : base.deepCopy();
        }
        if (Trees.isAbsent(base)) {
            return overlay.deepCopy();
        }

        if (base.isObject() && overlay.isObject()) {
            return mergeObjects(path, (ObjectNode) base, overlay, strict);
        }
        if (base.isArray() && overlay.isArray()) {
            return mergeArrays(path, base, overlay, strict);
        }

        if (strict && base.isContainerNode() && overlay.isContainerNode()) {
            throw new MergeException(MergeException.Reason.TYPE_CONFLICT, path,
                    "base is " + base.getNodeType() + " but language overlay is " +
                            overlay.getNodeType());
        }

        return overlay.deepCopy();
    }

    private ObjectNode mergeObjects(TreePath path, ObjectNode base, JsonNode overlay,
            boolean strict) {
        ObjectNode merged = base.deepCopy();

        Iterator<Map.Entry<String, JsonNode>> fields = overlay.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            merged.set(key, merge(path.key(key), base.get(key), field.getValue(), strict));
        }

        return merged;
    }

    private ArrayNode mergeArrays(TreePath path, JsonNode base, JsonNode overlay,
            boolean strict) {
        if (strict && base.size() != overlay.size()) {
            throw new MergeException(MergeException.Reason.STRUCTURAL_MISMATCH,
                    path.index(Math.min(base.size(), overlay.size())),
                    "base has " + base.size() + " items but language overlay has " +
                            overlay.size());
        }

        ArrayNode merged = Trees.NODES.arrayNode();
        int size = Math.max(base.size(), overlay.size());

        for (int i = 0; i < size; i++) {
            merged.add(merge(path.index(i), base.get(i), overlay.get(i), strict));
        }

        return merged;
    }

    private static JsonNode aspectsOf(@Nullable JsonNode tree) {
        JsonNode aspects = tree == null ? null : tree.get("aspects");
        return aspects != null && aspects.isArray() ? aspects : Trees.NODES.arrayNode();
    }

    @Nullable
    private static String textOf(@Nullable JsonNode node, String field) {
        if (node == null || !node.path(field).isTextual()) {
            return null;
        }
        return node.get(field).textValue();
    }
}
