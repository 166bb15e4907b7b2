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

import org.esbtools.templatestore.AspectParseException;
import org.esbtools.templatestore.BaseDocument;
import org.esbtools.templatestore.CircularDependencyException;
import org.esbtools.templatestore.DocumentService;
import org.esbtools.templatestore.Reference;
import org.esbtools.templatestore.TemplateStoreConfig;
import org.esbtools.templatestore.TemplateStoreException;
import org.esbtools.templatestore.UpsertResult;
import org.esbtools.templatestore.aspect.AspectParser;
import org.esbtools.templatestore.aspect.ParseMode;
import org.esbtools.templatestore.aspect.ReferencedCodes;
import org.esbtools.templatestore.dependency.DependencyNode;
import org.esbtools.templatestore.dependency.DependencyOrder;
import org.esbtools.templatestore.dependency.DependencyResolver;
import org.esbtools.templatestore.dependency.ResolutionMode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Imports a batch of source records so that every document is written after the documents it
 * depends on. Documents are written one at a time; a failing document does not stop the rest.
 */
public class BatchImporter {
    private final DocumentService documentService;
    private final TemplateStoreConfig config;
    private final AspectParser aspectParser = new AspectParser();
    private final DependencyResolver dependencyResolver = new DependencyResolver();

    private static final Logger logger = LoggerFactory.getLogger(BatchImporter.class);

    public BatchImporter(DocumentService documentService, TemplateStoreConfig config) {
        this.documentService = Objects.requireNonNull(documentService, "documentService");
        this.config = Objects.requireNonNull(config, "config");
    }

    public ImportReport importBatch(Collection<SourceRecord> records) {
        return importBatch(records, config.getDefaultResolutionMode(),
                config.getDefaultParseMode());
    }

    /**
     * @throws CircularDependencyException in {@link ResolutionMode#STRICT} mode, if records
     * depend on each other in a cycle. Nothing is imported in that case.
     */
    public ImportReport importBatch(Collection<SourceRecord> records, ResolutionMode resolutionMode,
            ParseMode parseMode) {
        Map<String, SourceRecord> recordsBySlug = new LinkedHashMap<>();
        List<SourceRecord> skipped = new ArrayList<>();
        List<FailedImport> failed = new ArrayList<>();
        List<DependencyNode> nodes = new ArrayList<>();

        for (SourceRecord record : records) {
            Optional<BaseDocument> existing = documentService.store().findBase(record.slug());

            if (existing.isPresent() && !existing.get().getDomain().equals(record.domain())) {
                logger.warn("Skipping {}: slug already exists in domain {}", record,
                        existing.get().getDomain());
                skipped.add(record);
                continue;
            }

            recordsBySlug.put(record.slug(), record);
        }

        for (SourceRecord record : recordsBySlug.values()) {
            try {
                nodes.add(new DependencyNode(record.slug(), dependenciesOf(record, parseMode)));
            } catch (AspectParseException e) {
                logger.error("Not importing {}: invalid aspects", record, e);
                failed.add(new FailedImport(record, null, e));
            }
        }

        DependencyOrder order = dependencyResolver.resolveOrder(nodes, resolutionMode);
        List<UpsertResult> imported = new ArrayList<>();

        for (String slug : order.ordered()) {
            SourceRecord record = recordsBySlug.get(slug);

            try {
                imported.add(documentService.updateOrInsert(record.toBaseModel(), parseMode));
            } catch (TemplateStoreException e) {
                logger.error("Failed to import {}", record, e);
                failed.add(new FailedImport(record, null, e));
                continue;
            }

            for (String language : record.overlays().keySet()) {
                try {
                    imported.add(documentService.updateOrInsert(
                            record.toOverlayModel(language), parseMode));
                } catch (TemplateStoreException e) {
                    logger.error("Failed to import {} in language '{}'", record, language, e);
                    failed.add(new FailedImport(record, language, e));
                }
            }
        }

        ImportReport report = new ImportReport(imported, failed, skipped, order.unresolved());
        logger.info("Imported batch of {} record(s): {}", records.size(), report);
        return report;
    }

    private Set<String> dependenciesOf(SourceRecord record, ParseMode parseMode) {
        Set<String> dependencies = new LinkedHashSet<>();

        for (Reference ref : record.refs()) {
            dependencies.add(ref.destSlug());
        }
        record.templateSlug().ifPresent(dependencies::add);
        dependencies.addAll(ReferencedCodes.in(
                aspectParser.parse(record.content().get("aspects"), parseMode)));

        return dependencies;
    }
}
