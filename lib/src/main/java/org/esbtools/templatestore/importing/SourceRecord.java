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

package org.esbtools.templatestore.importing;

import org.esbtools.templatestore.DocumentKind;
import org.esbtools.templatestore.DocumentModel;
import org.esbtools.templatestore.Reference;
import org.esbtools.templatestore.tree.Trees;

import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One structural document of a source tree, with the text of every language it is translated
 * to.
 */
public final class SourceRecord {
    private final String slug;
    private final String domain;
    private final DocumentKind kind;
    private final ObjectNode content;
    private final List<Reference> refs;
    @Nullable
    private final String templateSlug;
    private final Map<String, ObjectNode> overlays;

    public SourceRecord(String slug, String domain, DocumentKind kind, ObjectNode content,
            List<Reference> refs, @Nullable String templateSlug,
            Map<String, ObjectNode> overlays) {
        this.slug = Objects.requireNonNull(slug, "slug");
        this.domain = Objects.requireNonNull(domain, "domain");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.content = Trees.copyObject(Objects.requireNonNull(content, "content"));
        this.refs = Collections.unmodifiableList(new ArrayList<>(refs));
        this.templateSlug = templateSlug;

        Map<String, ObjectNode> overlaysCopy = new LinkedHashMap<>();
        overlays.forEach((language, text) -> overlaysCopy.put(language, Trees.copyObject(text)));
        this.overlays = Collections.unmodifiableMap(overlaysCopy);

        if (!kind.isStructural()) {
            throw new IllegalArgumentException("Source records hold structural documents, " +
                    "but " + slug + " is a " + kind.wireName());
        }
    }

    public String slug() {
        return slug;
    }

    public String domain() {
        return domain;
    }

    public DocumentKind kind() {
        return kind;
    }

    public ObjectNode content() {
        return content.deepCopy();
    }

    public List<Reference> refs() {
        return refs;
    }

    public Optional<String> templateSlug() {
        return Optional.ofNullable(templateSlug);
    }

    /**
     * Language to text content, in the order the languages were read.
     */
    public Map<String, ObjectNode> overlays() {
        return overlays;
    }

    public DocumentModel toBaseModel() {
        return DocumentModel.structural(slug, domain, kind, content)
                .withTemplateReference(templateSlug)
                .withReferences(refs);
    }

    public DocumentModel toOverlayModel(String language) {
        ObjectNode text = overlays.get(language);

        if (text == null) {
            throw new IllegalArgumentException(slug + " has no text in language " + language);
        }

        return DocumentModel.languageOverlay(slug, domain, language, text)
                .withReferences(refs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceRecord that = (SourceRecord) o;
        return Objects.equals(slug, that.slug) &&
                Objects.equals(domain, that.domain) &&
                kind == that.kind &&
                Objects.equals(content, that.content) &&
                Objects.equals(refs, that.refs) &&
                Objects.equals(templateSlug, that.templateSlug) &&
                Objects.equals(overlays, that.overlays);
    }

    @Override
    public int hashCode() {
        return Objects.hash(slug, domain, kind, content, refs, templateSlug, overlays);
    }

    @Override
    public String toString() {
        return "SourceRecord{" +
                "slug='" + slug + '\'' +
                ", domain='" + domain + '\'' +
                ", kind=" + kind.wireName() +
                ", templateSlug='" + templateSlug + '\'' +
                ", languages=" + overlays.keySet() +
                '}';
    }
}
