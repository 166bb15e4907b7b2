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

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

/**
 * Identifies a document either by uuid, by slug and language (a language overlay), or by slug
 * alone (the structural document).
 */
public final class DocumentRef {
    @Nullable
    private final String slug;
    @Nullable
    private final String language;
    @Nullable
    private final String uuid;

    public static DocumentRef byUuid(String uuid) {
        return new DocumentRef(null, null, Objects.requireNonNull(uuid, "uuid"));
    }

    public static DocumentRef bySlug(String slug) {
        return new DocumentRef(Objects.requireNonNull(slug, "slug"), null, null);
    }

    public static DocumentRef bySlugAndLanguage(String slug, String language) {
        return new DocumentRef(Objects.requireNonNull(slug, "slug"),
                Objects.requireNonNull(language, "language"), null);
    }

    private DocumentRef(@Nullable String slug, @Nullable String language, @Nullable String uuid) {
        this.slug = slug;
        this.language = language;
        this.uuid = uuid;
    }

    public Optional<String> slug() {
        return Optional.ofNullable(slug);
    }

    public Optional<String> language() {
        return Optional.ofNullable(language);
    }

    public Optional<String> uuid() {
        return Optional.ofNullable(uuid);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DocumentRef that = (DocumentRef) o;
        return Objects.equals(slug, that.slug) &&
                Objects.equals(language, that.language) &&
                Objects.equals(uuid, that.uuid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(slug, language, uuid);
    }

    @Override
    public String toString() {
        if (uuid != null) {
            return "{uuid=" + uuid + "}";
        }
        return language == null
                ? "{slug=" + slug + "}"
                : "{slug=" + slug + ", language=" + language + "}";
    }
}
