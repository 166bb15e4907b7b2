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

package org.esbtools.templatestore.filesystem;

import org.esbtools.templatestore.BaseDocument;
import org.esbtools.templatestore.DocumentKind;
import org.esbtools.templatestore.LanguageOverlay;
import org.esbtools.templatestore.PublicationStatus;
import org.esbtools.templatestore.Reference;
import org.esbtools.templatestore.VersionedDocument;
import org.esbtools.templatestore.tree.Patch;
import org.esbtools.templatestore.tree.PatchOperation;
import org.esbtools.templatestore.tree.TreePath;
import org.esbtools.templatestore.tree.Trees;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads and writes documents, including their reverse deltas, as JSON.
 *
 * <p>Patch operations are written as {@code {"op": "add", "path": ["aspects", 2], "old": ...,
 * "new": ...}}, leaving out absent values.
 */
public class JsonDocumentCodec {
    private final ObjectMapper objectMapper;

    public JsonDocumentCodec() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonDocumentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] toBytes(VersionedDocument document) throws JsonProcessingException {
        return objectMapper.writeValueAsBytes(encode(document));
    }

    public VersionedDocument fromBytes(byte[] json) throws IOException {
        return decode(objectMapper.readTree(json));
    }

    public ObjectNode encode(VersionedDocument document) {
        ObjectNode json = Trees.NODES.objectNode();

        json.put("uuid", document.getUuid());
        json.put("slug", document.getSlug());
        json.put("domain", document.getDomain());
        json.put("kind", document.getKind().wireName());
        json.put("version", document.getVersion());
        json.set("content", document.getContent());

        ArrayNode reverseDeltas = json.putArray("reverse_deltas");
        for (Patch delta : document.getReverseDeltas()) {
            reverseDeltas.add(encodePatch(delta));
        }

        ArrayNode references = json.putArray("references");
        for (Reference reference : document.getReferences()) {
            references.addObject()
                    .put("dest_slug", reference.destSlug())
                    .put("ref_type", reference.type().wireName());
        }

        if (document instanceof LanguageOverlay) {
            LanguageOverlay overlay = (LanguageOverlay) document;
            json.put("language", overlay.getLanguage());
            json.put("template_version", overlay.getTemplateVersion());
            json.put("status", overlay.getStatus().name().toLowerCase(Locale.ROOT));
        } else {
            ((BaseDocument) document).getTemplateReference()
                    .ifPresent(template -> json.put("template", template));
        }

        return json;
    }

    public VersionedDocument decode(JsonNode json) {
        String slug = requiredText(json, "slug");
        String domain = requiredText(json, "domain");
        DocumentKind kind = DocumentKind.fromWireName(requiredText(json, "kind"));

        VersionedDocument document;

        if (json.hasNonNull("language")) {
            LanguageOverlay overlay = new LanguageOverlay(slug, domain, kind,
                    json.get("language").asText(), json.path("template_version").asInt(1));
            if (json.hasNonNull("status")) {
                overlay.setStatus(PublicationStatus.valueOf(
                        json.get("status").asText().toUpperCase(Locale.ROOT)));
            }
            document = overlay;
        } else {
            BaseDocument base = new BaseDocument(slug, domain, kind);
            if (json.hasNonNull("template")) {
                base.setTemplateReference(json.get("template").asText());
            }
            document = base;
        }

        document.setUuid(requiredText(json, "uuid"));
        document.setContent(Trees.copyObject(json.get("content")));

        List<Patch> reverseDeltas = new ArrayList<>();
        for (JsonNode delta : json.path("reverse_deltas")) {
            reverseDeltas.add(decodePatch(delta));
        }
        document.restoreHistory(json.path("version").asInt(1), reverseDeltas);

        List<Reference> references = new ArrayList<>();
        for (JsonNode reference : json.path("references")) {
            references.add(new Reference(requiredText(reference, "dest_slug"),
                    Reference.Type.fromWireName(requiredText(reference, "ref_type"))));
        }
        document.setReferences(references);

        return document;
    }

    public ArrayNode encodePatch(Patch patch) {
        ArrayNode operations = Trees.NODES.arrayNode();

        for (PatchOperation operation : patch.operations()) {
            ObjectNode json = operations.addObject();
            json.put("op", operation.type().name().toLowerCase(Locale.ROOT));

            ArrayNode path = json.putArray("path");
            for (Object segment : operation.path().segments()) {
                if (segment instanceof Integer) {
                    path.add((Integer) segment);
                } else {
                    path.add((String) segment);
                }
            }

            if (operation.oldValue() != null) {
                json.set("old", operation.oldValue());
            }
            if (operation.newValue() != null) {
                json.set("new", operation.newValue());
            }
            if (operation.keyIndex() != null) {
                json.put("at", operation.keyIndex());
            }
        }

        return operations;
    }

    public Patch decodePatch(JsonNode json) {
        List<PatchOperation> operations = new ArrayList<>();

        for (JsonNode operation : json) {
            List<Object> segments = new ArrayList<>();
            for (JsonNode segment : operation.path("path")) {
                segments.add(segment.isInt() ? (Object) segment.intValue() : segment.asText());
            }

            operations.add(PatchOperation.of(
                    PatchOperation.Type.valueOf(
                            requiredText(operation, "op").toUpperCase(Locale.ROOT)),
                    TreePath.of(segments.toArray()),
                    operation.get("old"),
                    operation.get("new"),
                    operation.hasNonNull("at") ? operation.get("at").intValue() : null));
        }

        return Patch.of(operations);
    }

    private static String requiredText(JsonNode json, String field) {
        JsonNode value = json.get(field);

        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException("Expected text field '" + field + "' in " + json);
        }

        return value.textValue();
    }
}
