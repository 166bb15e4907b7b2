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

import org.esbtools.templatestore.BaseDocument;
import org.esbtools.templatestore.DocumentRef;
import org.esbtools.templatestore.DocumentStore;
import org.esbtools.templatestore.DomainLanguages;
import org.esbtools.templatestore.LanguageOverlay;
import org.esbtools.templatestore.NotFoundException;
import org.esbtools.templatestore.Reference;
import org.esbtools.templatestore.VersionedDocument;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Looks documents up by uuid, by slug, or by slug and language. A language which a document is
 * not available in falls back to the default language of the document's domain.
 */
public class ReferenceResolver {
    private final DocumentStore store;
    private final DomainLanguages domainLanguages;

    private static final Logger logger = LoggerFactory.getLogger(ReferenceResolver.class);

    public ReferenceResolver(DocumentStore store, DomainLanguages domainLanguages) {
        this.store = Objects.requireNonNull(store, "store");
        this.domainLanguages = Objects.requireNonNull(domainLanguages, "domainLanguages");
    }

    /**
     * @throws NotFoundException listing every reference which was tried.
     */
    public Resolution resolve(DocumentRef ref) {
        if (ref.uuid().isPresent()) {
            VersionedDocument document = store.findByUuid(ref.uuid().get())
                    .orElseThrow(() -> new NotFoundException(ref));
            String language = document instanceof LanguageOverlay
                    ? ((LanguageOverlay) document).getLanguage()
                    : null;
            return new Resolution(document, language, language);
        }

        String slug = ref.slug().orElseThrow(() ->
                new IllegalArgumentException("A reference needs a uuid or a slug: " + ref));

        if (!ref.language().isPresent()) {
            BaseDocument base = store.findBase(slug).orElseThrow(() -> new NotFoundException(ref));
            return new Resolution(base, null, null);
        }

        String language = ref.language().get();
        Optional<LanguageOverlay> overlay = store.findOverlay(slug, language);

        if (overlay.isPresent()) {
            return new Resolution(overlay.get(), language, language);
        }

        Optional<String> defaultLanguage = store.findBase(slug)
                .flatMap(base -> domainLanguages.defaultLanguageOf(base.getDomain()))
                .filter(candidate -> !candidate.equals(language));

        if (!defaultLanguage.isPresent()) {
            throw new NotFoundException(ref);
        }

        DocumentRef fallbackRef = DocumentRef.bySlugAndLanguage(slug, defaultLanguage.get());
        LanguageOverlay fallback = store.findOverlay(slug, defaultLanguage.get())
                .orElseThrow(() -> new NotFoundException(ref, fallbackRef));

        logger.warn("{} is not available in '{}', serving '{}' instead", slug, language,
                defaultLanguage.get());
        return new Resolution(fallback, language, defaultLanguage.get());
    }

    /**
     * Resolves every reference of {@code document}. Language overlays look up their references
     * in their own language, structural documents look up base documents.
     *
     * @throws NotFoundException for the first reference which cannot be resolved.
     */
    public List<Resolution> resolveReferences(VersionedDocument document) {
        String language = document instanceof LanguageOverlay
                ? ((LanguageOverlay) document).getLanguage()
                : null;

        List<Resolution> resolutions = new ArrayList<>(document.getReferences().size());

        for (Reference reference : document.getReferences()) {
            DocumentRef ref = language == null
                    ? DocumentRef.bySlug(reference.destSlug())
                    : DocumentRef.bySlugAndLanguage(reference.destSlug(), language);
            resolutions.add(resolve(ref));
        }

        return resolutions;
    }
}
