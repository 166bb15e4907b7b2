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

import org.esbtools.templatestore.aspect.AspectParser;
import org.esbtools.templatestore.aspect.ParseMode;
import org.esbtools.templatestore.merge.AspectMergeResult;
import org.esbtools.templatestore.merge.MergeEngine;
import org.esbtools.templatestore.reference.ReferenceResolver;
import org.esbtools.templatestore.reference.Resolution;
import org.esbtools.templatestore.tree.ChangeDetector;
import org.esbtools.templatestore.tree.Trees;
import org.esbtools.templatestore.version.DependentsPolicy;
import org.esbtools.templatestore.version.VersionStore;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Entry point for reading and writing documents.
 *
 * <p>Every write runs validate or merge, compare, version and save as one unit under a single
 * lock, and ends in exactly one {@link DocumentStore#save(VersionedDocument)}. A write which
 * fails before that leaves the store untouched.
 */
@ThreadSafe
public class DocumentService {
    private final DocumentStore store;
    private final DomainLanguages domainLanguages;
    private final TemplateStoreConfig config;
    private final AspectParser aspectParser;
    private final MergeEngine mergeEngine;
    private final ChangeDetector changeDetector;
    private final VersionStore versionStore;
    private final ReferenceResolver referenceResolver;
    private final TranslationCompleteness translationCompleteness;

    private final List<DocumentCommitListener> commitListeners = new CopyOnWriteArrayList<>();
    private final Object writeLock = new Object();

    private static final Logger logger = LoggerFactory.getLogger(DocumentService.class);

    public DocumentService(DocumentStore store, DomainLanguages domainLanguages,
            InstancePins instancePins, TemplateStoreConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.domainLanguages = Objects.requireNonNull(domainLanguages, "domainLanguages");
        this.config = Objects.requireNonNull(config, "config");
        this.aspectParser = new AspectParser();
        this.mergeEngine = new MergeEngine();
        this.changeDetector = new ChangeDetector();
        this.versionStore = new VersionStore(changeDetector,
                new DependentsPolicy(new StoreDependents(store, instancePins)), config);
        this.referenceResolver = new ReferenceResolver(store, domainLanguages);
        this.translationCompleteness = new TranslationCompleteness();
    }

    public DocumentService(DocumentStore store, DomainLanguages domainLanguages) {
        this(store, domainLanguages, InstancePins.NONE, new MutableTemplateStoreConfig());
    }

    /**
     * Content of a base document, or of one language overlay when a language is given, at a
     * past or the current version.
     *
     * @throws NotFoundException if there is no such document.
     * @throws VersionException if there is no such version.
     */
    public JsonNode getVersion(String slug, @Nullable String language, int version) {
        VersionedDocument document = language == null
                ? store.findBase(slug).orElseThrow(() ->
                        new NotFoundException(DocumentRef.bySlug(slug)))
                : store.findOverlay(slug, language).orElseThrow(() ->
                        new NotFoundException(DocumentRef.bySlugAndLanguage(slug, language)));

        return versionStore.getVersion(document, version);
    }

    public UpsertResult updateOrInsert(DocumentModel model) {
        return updateOrInsert(model, config.getDefaultParseMode());
    }

    /**
     * Inserts a new document at version 1 or updates an existing one.
     *
     * <p>Structural documents have their aspects validated with {@code parseMode}. Language
     * overlays are strictly merged against the latest version of their base document, and are
     * pinned to that version.
     *
     * @throws AspectParseException if aspects are invalid.
     * @throws MergeException if a language overlay does not fit its base document.
     * @throws NotFoundException if the base document or a referenced document is missing.
     * @throws StoreCommitException if the document could not be saved.
     */
    public UpsertResult updateOrInsert(DocumentModel model, ParseMode parseMode) {
        synchronized (writeLock) {
            VersionedDocument document;
            UpsertResult.Outcome outcome;

            if (model.isLanguageOverlay()) {
                BaseDocument base = store.findBase(model.slug()).orElseThrow(() ->
                        new NotFoundException(DocumentRef.bySlug(model.slug())));
                requireMergeable(base, model);

                Optional<LanguageOverlay> existing =
                        store.findOverlay(model.slug(), model.language().get());
                LanguageOverlay overlay;

                if (existing.isPresent()) {
                    overlay = existing.get().copy();
                    outcome = update(overlay, model);
                } else {
                    overlay = new LanguageOverlay(model.slug(), model.domain(),
                            base.getKind().concreteKind(), model.language().get(),
                            base.getVersion());
                    insert(overlay, model);
                    outcome = UpsertResult.Outcome.INSERTED;
                }

                if (overlay.getTemplateVersion() != base.getVersion()) {
                    overlay.setTemplateVersion(base.getVersion());
                    outcome = markUpdated(outcome);
                }

                PublicationStatus status = publicationStatusOf(overlay);
                if (status != overlay.getStatus()) {
                    overlay.setStatus(status);
                    outcome = markUpdated(outcome);
                }

                document = overlay;
            } else {
                aspectParser.parse(model.content().get("aspects"), parseMode);

                Optional<BaseDocument> existing = store.findBase(model.slug());
                BaseDocument base;

                if (existing.isPresent()) {
                    base = existing.get().copy();
                    requireSameIdentity(base, model);
                    outcome = update(base, model);
                } else {
                    base = new BaseDocument(model.slug(), model.domain(), model.kind().get());
                    insert(base, model);
                    outcome = UpsertResult.Outcome.INSERTED;
                }

                if (!base.getTemplateReference().equals(model.templateReference())) {
                    base.setTemplateReference(model.templateReference().orElse(null));
                    outcome = markUpdated(outcome);
                }

                document = base;
            }

            if (outcome == UpsertResult.Outcome.UNCHANGED) {
                logger.debug("No changes to {}, nothing to commit", document);
                return new UpsertResult(document, document.getVersion(), outcome);
            }

            List<Resolution> resolutions = referenceResolver.resolveReferences(document);
            if (logger.isDebugEnabled() && !resolutions.isEmpty()) {
                logger.debug("Resolved references of {}: {}", document, resolutions);
            }

            save(document);
            logger.info("Committed {} ({})", document, outcome);

            UpsertResult result = new UpsertResult(document, document.getVersion(), outcome);
            notifyCommitted(result);
            return result;
        }
    }

    /**
     * The base document merged with one of its language overlays, falling back to the domain's
     * default language if the document is not available in {@code language}.
     *
     * @throws NotFoundException if neither the language nor the default language is available.
     */
    public MergedDocument mergedDocument(String slug, String language) {
        BaseDocument base = store.findBase(slug).orElseThrow(() ->
                new NotFoundException(DocumentRef.bySlug(slug)));
        Resolution resolution =
                referenceResolver.resolve(DocumentRef.bySlugAndLanguage(slug, language));
        LanguageOverlay overlay = (LanguageOverlay) resolution.document();

        JsonNode merged = mergeEngine.merge(base.getContent(), overlay.getContent(), false);
        MergedDocument mergedDocument =
                new MergedDocument(base, overlay, Trees.copyObject(merged), language);

        if (mergedDocument.isOutdated()) {
            logger.debug("{} in '{}' was merged against version {} but the base document is at " +
                    "version {}", slug, overlay.getLanguage(), overlay.getTemplateVersion(),
                    base.getVersion());
        }

        return mergedDocument;
    }

    /**
     * Folds the current version of a base document into the previous one.
     *
     * @return False if the document has a single version, or a language overlay still pins an
     * older version.
     * @throws NotFoundException if there is no such document.
     */
    public boolean smashVersion(String slug) {
        synchronized (writeLock) {
            BaseDocument base = store.findBase(slug).orElseThrow(() ->
                    new NotFoundException(DocumentRef.bySlug(slug))).copy();
            return smash(base);
        }
    }

    /**
     * Folds the current version of a language overlay into the previous one.
     *
     * @see #smashVersion(String)
     */
    public boolean smashVersion(String slug, String language) {
        synchronized (writeLock) {
            LanguageOverlay overlay = store.findOverlay(slug, language).orElseThrow(() ->
                    new NotFoundException(DocumentRef.bySlugAndLanguage(slug, language))).copy();
            return smash(overlay);
        }
    }

    public void onDocumentCommitted(DocumentCommitListener listener) {
        commitListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public DocumentStore store() {
        return store;
    }

    private boolean smash(VersionedDocument document) {
        if (!versionStore.smashVersion(document)) {
            return false;
        }

        save(document);
        versionStore.repinAfterSmash(document);
        logger.info("Smashed {} down to version {}", document.getSlug(), document.getVersion());
        return true;
    }

    private void insert(VersionedDocument document, DocumentModel model) {
        document.setContent(model.content());
        document.setReferences(model.references());
    }

    private UpsertResult.Outcome update(VersionedDocument document, DocumentModel model) {
        boolean contentChanged = !changeDetector.compare(document, model.content(),
                config.getChangeIgnoreFields()).isEqual();

        if (contentChanged) {
            versionStore.updateVersion(document, model.content());
        }

        boolean referencesChanged = !document.getReferences().equals(model.references());
        if (referencesChanged) {
            document.setReferences(model.references());
        }

        return contentChanged || referencesChanged
                ? UpsertResult.Outcome.UPDATED
                : UpsertResult.Outcome.UNCHANGED;
    }

    private static UpsertResult.Outcome markUpdated(UpsertResult.Outcome outcome) {
        return outcome == UpsertResult.Outcome.UNCHANGED ? UpsertResult.Outcome.UPDATED : outcome;
    }

    private void requireMergeable(BaseDocument base, DocumentModel model) {
        ObjectNode baseContent = base.getContent();
        ObjectNode overlayContent = model.content();

        try {
            mergeEngine.merge(baseContent, overlayContent, true);
        } catch (MergeException e) {
            logger.error("Cannot merge language data of {} in '{}' with latest base version {}",
                    model.slug(), model.language().orElse(null), base.getVersion(), e);

            for (AspectMergeResult result :
                    mergeEngine.mergeAspectsOneByOne(baseContent, overlayContent, true)) {
                if (!result.isMerged()) {
                    logger.error("Aspect {} (name: {}, label: {}) failed to merge: {}",
                            result.index(), result.baseName().orElse("-"),
                            result.overlayLabel().orElse("-"),
                            result.error().get().getMessage());
                }
            }

            throw e;
        }
    }

    private void requireSameIdentity(BaseDocument existing, DocumentModel model) {
        if (!existing.getDomain().equals(model.domain())) {
            throw new TemplateStoreException("Document " + model.slug() + " already exists in " +
                    "domain " + existing.getDomain() + ", not in " + model.domain());
        }
        if (existing.getKind() != model.kind().get()) {
            throw new TemplateStoreException("Document " + model.slug() + " is a " +
                    existing.getKind().wireName() + " and cannot become a " +
                    model.kind().get().wireName());
        }
    }

    private PublicationStatus publicationStatusOf(LanguageOverlay overlay) {
        Optional<String> defaultLanguage = domainLanguages.defaultLanguageOf(overlay.getDomain());

        if (!defaultLanguage.isPresent() || defaultLanguage.get().equals(overlay.getLanguage())) {
            return PublicationStatus.PUBLISHED;
        }

        return store.findOverlay(overlay.getSlug(), defaultLanguage.get())
                .map(reference -> translationCompleteness.statusOf(reference.getContent(),
                        overlay.getContent()))
                .orElse(PublicationStatus.PUBLISHED);
    }

    private void save(VersionedDocument document) {
        try {
            store.save(document);
        } catch (Exception e) {
            throw new StoreCommitException("Failed to save " + document, e);
        }
    }

    private void notifyCommitted(UpsertResult result) {
        for (DocumentCommitListener listener : commitListeners) {
            try {
                listener.onDocumentCommitted(result);
            } catch (RuntimeException e) {
                logger.error("Commit listener {} failed for {}. The document stays committed.",
                        listener, result, e);
            }
        }
    }
}
