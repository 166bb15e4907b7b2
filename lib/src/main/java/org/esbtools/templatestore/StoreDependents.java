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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds dependents through the {@link DocumentStore}: the language overlays of a base document
 * are its dependents, pinned by their template version. Language overlays are depended on by
 * instances, found through {@link InstancePins}.
 */
public class StoreDependents implements DependentsQuery {
    private final DocumentStore store;
    private final InstancePins instancePins;

    private static final Logger logger = LoggerFactory.getLogger(StoreDependents.class);

    public StoreDependents(DocumentStore store, InstancePins instancePins) {
        this.store = Objects.requireNonNull(store, "store");
        this.instancePins = Objects.requireNonNull(instancePins, "instancePins");
    }

    @Override
    public List<Dependent> dependentsOf(VersionedDocument document) {
        if (document instanceof LanguageOverlay) {
            LanguageOverlay overlay = (LanguageOverlay) document;
            return instancePins.pinsOf(overlay.getSlug(), overlay.getLanguage());
        }

        List<Dependent> dependents = new ArrayList<>();
        for (LanguageOverlay overlay : store.overlaysOf(document.getSlug())) {
            dependents.add(new Dependent(overlay.getSlug() + "/" + overlay.getLanguage(),
                    overlay.getTemplateVersion()));
        }
        return dependents;
    }

    @Override
    public void repin(VersionedDocument document, int fromVersion, int toVersion) {
        if (document instanceof LanguageOverlay) {
            LanguageOverlay overlay = (LanguageOverlay) document;
            instancePins.repin(overlay.getSlug(), overlay.getLanguage(), fromVersion, toVersion);
            return;
        }

        for (LanguageOverlay overlay : store.overlaysOf(document.getSlug())) {
            if (overlay.getTemplateVersion() != fromVersion) {
                continue;
            }

            overlay.setTemplateVersion(toVersion);

            try {
                store.save(overlay);
            } catch (Exception e) {
                throw new StoreCommitException("Failed to repin " + overlay + " from template " +
                        "version " + fromVersion + " to " + toVersion, e);
            }

            logger.debug("Repinned {} from template version {} to {}", overlay, fromVersion,
                    toVersion);
        }
    }
}
