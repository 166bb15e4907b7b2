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

import org.esbtools.templatestore.tree.Trees;

import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An incoming write, either the structure of a document or the text of one of its languages.
 * Immutable.
 */
public final class DocumentModel {
    private final String slug;
    private final String domain;
    @Nullable
    private final DocumentKind kind;
    @Nullable
    private final String language;
    private final ObjectNode content;
    @Nullable
    private final String templateReference;
    private final List<Reference> references;

    public static DocumentModel structural(String slug, String domain, DocumentKind kind,
            ObjectNode content) {
        if (!kind.isStructural()) {
            throw new IllegalArgumentException("Expected a structural kind but got " +
                    kind.wireName());
        }
        return new DocumentModel(slug, domain, kind, null, content, null,
                Collections.emptyList());
    }

    /**
     * The concrete kind of a language overlay follows from its base document, so it is not
     * given here.
     */
    public static DocumentModel languageOverlay(String slug, String domain, String language,
            ObjectNode content) {
        return new DocumentModel(slug, domain, null, Objects.requireNonNull(language, "language"),
                content, null, Collections.emptyList());
    }

    private DocumentModel(String slug, String domain, @Nullable DocumentKind kind,
            @Nullable String language, ObjectNode content, @Nullable String templateReference,
            List<Reference> references) {
        this.slug = Objects.requireNonNull(slug, "slug");
        this.domain = Objects.requireNonNull(domain, "domain");
        this.kind = kind;
        this.language = language;
        this.content = Trees.copyObject(Objects.requireNonNull(content, "content"));
        this.templateReference = templateReference;
        this.references = Collections.unmodifiableList(new ArrayList<>(references));
    }

    public DocumentModel withTemplateReference(@Nullable String templateReference) {
        return new DocumentModel(slug, domain, kind, language, content, templateReference,
                references);
    }

    public DocumentModel withReferences(List<Reference> references) {
        return new DocumentModel(slug, domain, kind, language, content, templateReference,
                references);
    }

    public String slug() {
        return slug;
    }

    public String domain() {
        return domain;
    }

    /**
     * Empty for language overlays.
     */
    public Optional<DocumentKind> kind() {
        return Optional.ofNullable(kind);
    }

    public Optional<String> language() {
        return Optional.ofNullable(language);
    }

    public boolean isLanguageOverlay() {
        return language != null;
    }

    public ObjectNode content() {
        return content.deepCopy();
    }

    public Optional<String> templateReference() {
        return Optional.ofNullable(templateReference);
    }

    public List<Reference> references() {
        return references;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DocumentModel that = (DocumentModel) o;
        return Objects.equals(slug, that.slug) &&
                Objects.equals(domain, that.domain) &&
                kind == that.kind &&
                Objects.equals(language, that.language) &&
                Objects.equals(content, that.content) &&
                Objects.equals(templateReference, that.templateReference) &&
                Objects.equals(references, that.references);
    }

    @Override
    public int hashCode() {
        return Objects.hash(slug, domain, kind, language, content, templateReference, references);
    }

    @Override
    public String toString() {
        return "DocumentModel{" +
                "slug='" + slug + '\'' +
                ", domain='" + domain + '\'' +
                ", kind=" + kind +
                ", language='" + language + '\'' +
                ", templateReference='" + templateReference + '\'' +
                ", references=" + references +
                '}';
    }
}
