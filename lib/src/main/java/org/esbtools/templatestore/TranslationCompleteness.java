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

package org.esbtools.templatestore;

import org.esbtools.templatestore.tree.TreePath;
import org.esbtools.templatestore.tree.Trees;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Compares the text of a language overlay with the text of the domain's default language. A
 * translation is complete when every text of the default language has a non-empty counterpart
 * at the same path.
 */
public class TranslationCompleteness {
    public List<TreePath> missingTexts(JsonNode defaultLanguage, JsonNode translation) {
        List<TreePath> missing = new ArrayList<>();
        collect(TreePath.root(), defaultLanguage, translation, missing);
        return missing;
    }

    public PublicationStatus statusOf(JsonNode defaultLanguage, JsonNode translation) {
        return missingTexts(defaultLanguage, translation).isEmpty()
                ? PublicationStatus.PUBLISHED
                : PublicationStatus.DRAFT;
    }

    private static void collect(TreePath path, JsonNode expected, JsonNode actual,
            List<TreePath> missing) {
        if (expected.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = expected.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                collect(path.key(field.getKey()), field.getValue(),
                        actual.path(field.getKey()), missing);
            }
        } else if (expected.isArray()) {
            for (int i = 0; i < expected.size(); i++) {
                collect(path.index(i), expected.get(i), actual.path(i), missing);
            }
        } else if (expected.isTextual() && !expected.textValue().isEmpty()) {
            if (Trees.isAbsent(actual) || (actual.isTextual() && actual.textValue().isEmpty())) {
                missing.add(path);
            }
        }
    }
}
