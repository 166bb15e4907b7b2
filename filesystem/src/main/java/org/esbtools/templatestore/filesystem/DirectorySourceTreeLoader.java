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

import org.esbtools.templatestore.DocumentKind;
import org.esbtools.templatestore.Reference;
import org.esbtools.templatestore.importing.SourceRecord;
import org.esbtools.templatestore.importing.SourceTreeLoader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads the source tree of one domain:
 *
 * <pre>
 * &lt;root&gt;/&lt;domain&gt;/schema/*.json
 * &lt;root&gt;/&lt;domain&gt;/template/*.json
 * &lt;root&gt;/&lt;domain&gt;/code/*.json
 * &lt;root&gt;/&lt;domain&gt;/lang/&lt;language&gt;/template/&lt;slug&gt;.json
 * &lt;root&gt;/&lt;domain&gt;/lang/&lt;language&gt;/code/&lt;slug&gt;.json
 * </pre>
 *
 * <p>Files are read in name order. The keys {@code slug}, {@code type}, {@code domain},
 * {@code language}, {@code template} and {@code entry_refs} describe the document and are not
 * part of its content.
 */
public class DirectorySourceTreeLoader implements SourceTreeLoader {
    public static final List<String> METADATA_KEYS = Collections.unmodifiableList(Arrays.asList(
            "slug", "type", "domain", "language", "template", "entry_refs"));

    private static final Map<String, DocumentKind> BASE_DIRECTORIES =
            ImmutableMap.of(
                    "schema", DocumentKind.SCHEMA,
                    "template", DocumentKind.BASE_TEMPLATE,
                    "code", DocumentKind.BASE_CODE);

    private final Path root;
    private final String domain;
    private final ObjectMapper objectMapper;

    private static final Logger logger = LoggerFactory.getLogger(DirectorySourceTreeLoader.class);

    public DirectorySourceTreeLoader(Path root, String domain) {
        this(root, domain, new ObjectMapper());
    }

    public DirectorySourceTreeLoader(Path root, String domain, ObjectMapper objectMapper) {
        this.root = Objects.requireNonNull(root, "root");
        this.domain = Objects.requireNonNull(domain, "domain");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public List<SourceRecord> load() throws IOException {
        Path domainDir = root.resolve(domain);
        List<SourceRecord> records = new ArrayList<>();

        for (Map.Entry<String, DocumentKind> baseDirectory : BASE_DIRECTORIES.entrySet()) {
            for (Path file : jsonFilesIn(domainDir.resolve(baseDirectory.getKey()))) {
                records.add(readRecord(file, baseDirectory.getKey(), baseDirectory.getValue(),
                        domainDir));
            }
        }

        logger.info("Loaded {} record(s) of domain {} from {}", records.size(), domain, domainDir);
        return records;
    }

    private SourceRecord readRecord(Path file, String directory, DocumentKind kind,
            Path domainDir) throws IOException {
        ObjectNode content = readObject(file);
        String slug = content.hasNonNull("slug")
                ? content.get("slug").asText()
                : slugOf(file);

        List<Reference> refs = referencesIn(content.get("entry_refs"));
        String templateSlug = templateSlugIn(content.get("template"));
        content.remove(METADATA_KEYS);

        Map<String, ObjectNode> overlays = new LinkedHashMap<>();
        for (Path languageDir : directoriesIn(domainDir.resolve("lang"))) {
            Path overlayFile = languageDir.resolve(directory).resolve(slug + ".json");

            if (Files.isRegularFile(overlayFile)) {
                ObjectNode text = readObject(overlayFile);
                text.remove(METADATA_KEYS);
                overlays.put(languageDir.getFileName().toString(), text);
            }
        }

        return new SourceRecord(slug, domain, kind, content, refs, templateSlug, overlays);
    }

    private ObjectNode readObject(Path file) throws IOException {
        JsonNode json = objectMapper.readTree(file.toFile());

        if (json == null || !json.isObject()) {
            throw new IOException("Expected a JSON object in " + file);
        }

        return (ObjectNode) json;
    }

    private static List<Reference> referencesIn(JsonNode entryRefs) {
        List<Reference> refs = new ArrayList<>();

        if (entryRefs == null) {
            return refs;
        }

        for (JsonNode ref : entryRefs) {
            if (ref.isTextual()) {
                refs.add(Reference.code(ref.textValue()));
            } else {
                refs.add(new Reference(ref.path("dest_slug").asText(),
                        Reference.Type.fromWireName(ref.path("ref_type").asText("code"))));
            }
        }

        return refs;
    }

    private static String templateSlugIn(JsonNode template) {
        if (template == null || template.isNull()) {
            return null;
        }
        return template.isObject() ? template.path("slug").asText(null) : template.asText();
    }

    private static List<Path> jsonFilesIn(Path dir) throws IOException {
        List<Path> files = new ArrayList<>();

        if (!Files.isDirectory(dir)) {
            return files;
        }

        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir, "*.json")) {
            entries.forEach(files::add);
        }

        Collections.sort(files);
        return files;
    }

    private static List<Path> directoriesIn(Path dir) throws IOException {
        List<Path> directories = new ArrayList<>();

        if (!Files.isDirectory(dir)) {
            return directories;
        }

        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir, Files::isDirectory)) {
            entries.forEach(directories::add);
        }

        Collections.sort(directories);
        return directories;
    }

    private static String slugOf(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - ".json".length());
    }
}
