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

package org.esbtools.templatestore.aspect;

import org.esbtools.templatestore.AspectParseException;
import org.esbtools.templatestore.tree.TreePath;
import org.esbtools.templatestore.tree.Trees;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the {@code aspects} array of a structural document into {@link AspectNode}s.
 *
 * <p>The aspect {@code type} must always be known. Other attributes are checked according to
 * the {@link ParseMode} passed with each call.
 */
public class AspectParser {
    public static final Set<String> KNOWN_ATTRIBUTES = Collections.unmodifiableSet(new HashSet<>(
            Arrays.asList("name", "type", "attr", "items", "list_items", "components", "view",
                    "comment")));

    private static final Logger logger = LoggerFactory.getLogger(AspectParser.class);

    public List<AspectNode> parse(@Nullable JsonNode aspects, ParseMode mode) {
        TreePath path = TreePath.of("aspects");

        if (Trees.isAbsent(aspects)) {
            return Collections.emptyList();
        }
        if (!aspects.isArray()) {
            throw new AspectParseException(path, "aspects must be an array but was " +
                    aspects.getNodeType());
        }

        List<AspectNode> parsed = new ArrayList<>(aspects.size());
        for (int i = 0; i < aspects.size(); i++) {
            parsed.add(parseAspect(aspects.get(i), path.index(i), mode));
        }
        return parsed;
    }

    public AspectNode parseAspect(JsonNode aspect, TreePath path, ParseMode mode) {
        if (!aspect.isObject()) {
            throw new AspectParseException(path, "an aspect must be an object but was " +
                    aspect.getNodeType());
        }

        if (mode == ParseMode.STRICT) {
            Iterator<String> attributes = aspect.fieldNames();
            while (attributes.hasNext()) {
                String attribute = attributes.next();
                if (!KNOWN_ATTRIBUTES.contains(attribute)) {
                    throw new AspectParseException(path.key(attribute),
                            "unknown aspect attribute '" + attribute + "'");
                }
            }
        }

        String name = requiredText(aspect, "name", path);
        String type = requiredText(aspect, "type", path);
        JsonNode attr = Trees.isAbsent(aspect.get("attr")) ? null : aspect.get("attr");

        switch (type) {
            case "str":
            case "int":
            case "float":
                return new ScalarAspect(name,
                        ScalarAspect.ScalarKind.valueOf(type.toUpperCase(Locale.ROOT)), attr);
            case "select":
            case "multiselect":
            case "tree":
            case "treemultiselect":
                return parseSelect(aspect, name,
                        SelectAspect.SelectKind.valueOf(type.toUpperCase(Locale.ROOT)), attr,
                        path, mode);
            case "list":
                JsonNode listItems = aspect.get("list_items");
                if (Trees.isAbsent(listItems)) {
                    throw new AspectParseException(path, "aspect '" + name +
                            "' of type 'list' is missing 'list_items'");
                }
                return new ListAspect(name,
                        parseAspect(listItems, path.key("list_items"), mode), attr);
            case "composite":
                return parseComposite(aspect, name, attr, path, mode);
            default:
                throw new AspectParseException(path.key("type"),
                        "'" + type + "' is not a valid aspect type");
        }
    }

    private SelectAspect parseSelect(JsonNode aspect, String name, SelectAspect.SelectKind kind,
            @Nullable JsonNode attr, TreePath path, ParseMode mode) {
        JsonNode items = aspect.get("items");
        TreePath itemsPath = path.key("items");

        if (Trees.isAbsent(items)) {
            if (mode == ParseMode.STRICT) {
                throw new AspectParseException(path, "aspect '" + name + "' of type '" +
                        kind.name().toLowerCase(Locale.ROOT) + "' is missing 'items'");
            }
            return SelectAspect.inline(name, kind, Collections.emptyList(), attr);
        }

        if (items.isTextual()) {
            return SelectAspect.fromCode(name, kind, items.textValue(), attr);
        }

        if (items.isObject() && items.has("root")) {
            return SelectAspect.inline(name, kind,
                    Collections.singletonList(parseItem(items.get("root"), itemsPath.key("root"))),
                    attr);
        }

        return SelectAspect.inline(name, kind, parseItems(items, itemsPath), attr);
    }

    private List<SelectItem> parseItems(JsonNode items, TreePath path) {
        if (!items.isArray()) {
            throw new AspectParseException(path, "items must be a code slug, a tree or an " +
                    "array but was " + items.getNodeType());
        }

        List<SelectItem> parsed = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            parsed.add(parseItem(items.get(i), path.index(i)));
        }
        return parsed;
    }

    private SelectItem parseItem(JsonNode item, TreePath path) {
        if (item.isTextual()) {
            return new SelectItem(item.textValue());
        }

        String value = requiredText(item, "value", path);
        JsonNode children = item.get("children");

        if (Trees.isAbsent(children)) {
            return new SelectItem(value);
        }

        return new SelectItem(value, parseItems(children, path.key("children")));
    }

    private CompositeAspect parseComposite(JsonNode aspect, String name, @Nullable JsonNode attr,
            TreePath path, ParseMode mode) {
        JsonNode components = aspect.get("components");

        if (!Trees.isAbsent(components) && !components.isArray()) {
            throw new AspectParseException(path.key("components"),
                    "components must be an array but was " + components.getNodeType());
        }

        if (Trees.isAbsent(components) || components.size() == 0) {
            logger.warn("Aspect '{}' of type 'composite' at '{}' is missing 'components'",
                    name, path);
            return new CompositeAspect(name, Collections.emptyMap(), attr);
        }

        Map<String, AspectNode> parsed = new LinkedHashMap<>();
        for (int i = 0; i < components.size(); i++) {
            TreePath componentPath = path.key("components").index(i);
            AspectNode component = parseAspect(components.get(i), componentPath, mode);

            if (parsed.containsKey(component.name())) {
                throw new AspectParseException(componentPath, "duplicate component '" +
                        component.name() + "' in composite '" + name + "'");
            }
            parsed.put(component.name(), component);
        }

        return new CompositeAspect(name, parsed, attr);
    }

    private static String requiredText(JsonNode node, String field, TreePath path) {
        JsonNode value = node.get(field);

        if (value == null || !value.isTextual() || value.textValue().isEmpty()) {
            throw new AspectParseException(path.key(field), "'" + field +
                    "' is required and must be a non-empty string");
        }

        return value.textValue();
    }
}
