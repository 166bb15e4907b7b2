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

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Read model combining a structural document with one of its language overlays. Never persisted.
 */
public final class MergedDocument {
    private final BaseDocument base;
    private final LanguageOverlay overlay;
    private final ObjectNode content;
    private final String requestedLanguage;

    public MergedDocument(BaseDocument base, LanguageOverlay overlay, ObjectNode content,
            String requestedLanguage) {
        this.base = Objects.requireNonNull(base, "base");
        this.overlay = Objects.requireNonNull(overlay, "overlay");
        this.content = Objects.requireNonNull(content, "content").deepCopy();
        this.requestedLanguage = Objects.requireNonNull(requestedLanguage, "requestedLanguage");
    }

    public String slug() {
        return base.getSlug();
    }

    public DocumentKind kind() {
        return overlay.getKind();
    }

    /**
     * The structural version at merge time.
     */
    public int version() {
        return base.getVersion();
    }

    public ObjectNode content() {
        return content.deepCopy();
    }

    /**
     * True when the structure changed since the overlay was last merged against it.
     */
    public boolean isOutdated() {
        return overlay.getTemplateVersion() < base.getVersion();
    }

    public String requestedLanguage() {
        return requestedLanguage;
    }

    public String servedLanguage() {
        return overlay.getLanguage();
    }

    public boolean isFallbackLanguage() {
        return !requestedLanguage.equals(servedLanguage());
    }

    public BaseDocument base() {
        return base;
    }

    public LanguageOverlay overlay() {
        return overlay;
    }

    @Override
    public String toString() {
        return "MergedDocument{" +
                "slug='" + slug() + '\'' +
                ", version=" + version() +
                ", requestedLanguage='" + requestedLanguage + '\'' +
                ", servedLanguage='" + servedLanguage() + '\'' +
                ", outdated=" + isOutdated() +
                '}';
    }
}
