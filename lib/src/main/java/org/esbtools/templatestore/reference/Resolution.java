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

package org.esbtools.templatestore.reference;

import org.esbtools.templatestore.VersionedDocument;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

public final class Resolution {
    private final VersionedDocument document;
    @Nullable
    private final String requestedLanguage;
    @Nullable
    private final String servedLanguage;

    public Resolution(VersionedDocument document, @Nullable String requestedLanguage,
            @Nullable String servedLanguage) {
        this.document = Objects.requireNonNull(document, "document");
        this.requestedLanguage = requestedLanguage;
        this.servedLanguage = servedLanguage;
    }

    public VersionedDocument document() {
        return document;
    }

    public Optional<String> requestedLanguage() {
        return Optional.ofNullable(requestedLanguage);
    }

    public Optional<String> servedLanguage() {
        return Optional.ofNullable(servedLanguage);
    }

    /**
     * True if the document is served in a different language than the one asked for.
     */
    public boolean isFallback() {
        return !Objects.equals(requestedLanguage, servedLanguage);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Resolution that = (Resolution) o;
        return Objects.equals(document.getUuid(), that.document.getUuid()) &&
                Objects.equals(requestedLanguage, that.requestedLanguage) &&
                Objects.equals(servedLanguage, that.servedLanguage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(document.getUuid(), requestedLanguage, servedLanguage);
    }

    @Override
    public String toString() {
        return "Resolution{" +
                "document=" + document +
                ", requestedLanguage='" + requestedLanguage + '\'' +
                ", servedLanguage='" + servedLanguage + '\'' +
                '}';
    }
}
