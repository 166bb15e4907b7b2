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

package org.esbtools.templatestore.version;

import org.esbtools.templatestore.TemplateStoreConfig;
import org.esbtools.templatestore.VersionException;
import org.esbtools.templatestore.VersionedDocument;
import org.esbtools.templatestore.tree.ChangeDetector;
import org.esbtools.templatestore.tree.Patch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Keeps the version history of a document as a log of reverse deltas next to its live content.
 *
 * <p>Methods change the document they are given, so callers pass a copy and persist it once
 * it is complete.
 */
public class VersionStore {
    private final ChangeDetector changeDetector;
    private final DependentsPolicy dependentsPolicy;
    private final TemplateStoreConfig config;

    private static final Logger logger = LoggerFactory.getLogger(VersionStore.class);

    public VersionStore(ChangeDetector changeDetector, DependentsPolicy dependentsPolicy,
            TemplateStoreConfig config) {
        this.changeDetector = Objects.requireNonNull(changeDetector, "changeDetector");
        this.dependentsPolicy = Objects.requireNonNull(dependentsPolicy, "dependentsPolicy");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Reconstructs the content of {@code document} at {@code targetVersion} by walking back from
     * the live content through the reverse deltas.
     *
     * @throws VersionException if the version is below 1 or above the current version.
     */
    public JsonNode getVersion(VersionedDocument document, int targetVersion) {
        int version = document.getVersion();

        if (targetVersion < 1 || targetVersion > version) {
            throw VersionException.invalidVersion(document.getSlug(), targetVersion, version);
        }

        List<Patch> reverseDeltas = document.getReverseDeltas();
        JsonNode content = document.getContent();

        for (int i = version - 2; i >= targetVersion - 1; i--) {
            content = reverseDeltas.get(i).apply(content);
        }

        return content;
    }

    /**
     * Makes {@code newContent} the live content of {@code document}.
     *
     * <p>If the content is unchanged nothing happens. If something depends on the current
     * version, a new version is created. Otherwise the current version is overwritten in place,
     * and the newest reverse delta is recomputed so the previous version stays reachable.
     *
     * @return The version of the document after the update.
     */
    public int updateVersion(VersionedDocument document, ObjectNode newContent) {
        ObjectNode currentContent = document.getContent();

        if (changeDetector.compare(document, newContent, config.getChangeIgnoreFields())
                .isEqual()) {
            logger.debug("No changes to {}, keeping version {}", document,
                    document.getVersion());
            return document.getVersion();
        }

        if (dependentsPolicy.hasDependents(document)) {
            document.appendVersion(Patch.between(newContent, currentContent));
            logger.debug("Bumped {} to version {}", document.getSlug(), document.getVersion());
        } else if (document.getVersion() > 1) {
            JsonNode previousContent = getVersion(document, document.getVersion() - 1);
            document.replaceLastReverseDelta(Patch.between(newContent, previousContent));
            logger.debug("Overwrote version {} of {} which has no dependents",
                    document.getVersion(), document.getSlug());
        } else {
            logger.debug("Overwrote the only version of {}", document.getSlug());
        }

        document.setContent(newContent);
        return document.getVersion();
    }

    /**
     * Folds the current version into the previous one, keeping the live content. Only allowed
     * while every dependent pins the current version. Dependents keep their pins until
     * {@link #repinAfterSmash(VersionedDocument)}.
     *
     * @return False if the version could not be smashed.
     */
    public boolean smashVersion(VersionedDocument document) {
        int version = document.getVersion();

        if (version <= 1) {
            logger.warn("Refusing to smash {}: it has only one version", document);
            return false;
        }

        if (!dependentsPolicy.allDependentsPin(document, version)) {
            logger.warn("Refusing to smash {}: some dependents do not pin version {}",
                    document, version);
            return false;
        }

        if (version > 2) {
            JsonNode olderContent = getVersion(document, version - 2);
            document.dropLastVersion();
            document.replaceLastReverseDelta(Patch.between(document.getContent(), olderContent));
        } else {
            document.dropLastVersion();
        }

        logger.debug("Smashed version {} of {} into version {}", version, document.getSlug(),
                version - 1);
        return true;
    }

    /**
     * Moves the dependents of a smashed document from the version that was folded away to the
     * document's current version. Call once the smashed document is saved.
     */
    public void repinAfterSmash(VersionedDocument document) {
        int version = document.getVersion();
        dependentsPolicy.repin(document, version + 1, version);
    }
}
