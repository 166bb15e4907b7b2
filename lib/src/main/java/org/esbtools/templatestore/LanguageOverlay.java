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

import java.util.Objects;

/**
 * The text of one language for a structural document. Its tree parallels the structural tree.
 *
 * <p>An overlay is the concrete form of its base document and is versioned on its own;
 * {@link #getTemplateVersion()} pins the base version it was last merged against.
 */
public class LanguageOverlay extends VersionedDocument {
    private final String language;
    private int templateVersion;
    private PublicationStatus status = PublicationStatus.PUBLISHED;

    public LanguageOverlay(String slug, String domain, DocumentKind kind, String language,
            int templateVersion) {
        super(slug, domain, kind);
        this.language = Objects.requireNonNull(language, "language");
        this.templateVersion = templateVersion;

        if (kind.isStructural()) {
            throw new IllegalArgumentException("Language overlays must have a concrete kind, " +
                    "but got " + kind.wireName());
        }
    }

    private LanguageOverlay(LanguageOverlay toCopy) {
        super(toCopy);
        this.language = toCopy.language;
        this.templateVersion = toCopy.templateVersion;
        this.status = toCopy.status;
    }

    @Override
    public LanguageOverlay copy() {
        return new LanguageOverlay(this);
    }

    public String getLanguage() {
        return language;
    }

    public int getTemplateVersion() {
        return templateVersion;
    }

    public void setTemplateVersion(int templateVersion) {
        this.templateVersion = templateVersion;
    }

    public PublicationStatus getStatus() {
        return status;
    }

    public void setStatus(PublicationStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    @Override
    public String toString() {
        return "LanguageOverlay{" +
                "slug='" + getSlug() + '\'' +
                ", language='" + language + '\'' +
                ", kind=" + getKind().wireName() +
                ", version=" + getVersion() +
                ", templateVersion=" + templateVersion +
                ", status=" + status +
                '}';
    }
}
