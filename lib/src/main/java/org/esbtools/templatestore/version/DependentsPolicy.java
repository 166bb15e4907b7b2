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

import org.esbtools.templatestore.Dependent;
import org.esbtools.templatestore.DependentsQuery;
import org.esbtools.templatestore.VersionedDocument;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether the current version of a document must be kept when its content changes.
 *
 * <p>Structural documents always keep their versions, since language overlays are merged
 * against them. Concrete documents keep a version only while an instance pins it.
 */
public class DependentsPolicy {
    private final DependentsQuery dependentsQuery;

    public DependentsPolicy(DependentsQuery dependentsQuery) {
        this.dependentsQuery = Objects.requireNonNull(dependentsQuery, "dependentsQuery");
    }

    public boolean hasDependents(VersionedDocument document) {
        if (document.getKind().isStructural()) {
            return true;
        }

        for (Dependent dependent : dependentsQuery.dependentsOf(document)) {
            if (dependent.pinnedVersion() == document.getVersion()) {
                return true;
            }
        }

        return false;
    }

    /**
     * True if every dependent pins {@code version}, including when there are no dependents.
     */
    public boolean allDependentsPin(VersionedDocument document, int version) {
        List<Dependent> dependents = dependentsQuery.dependentsOf(document);

        for (Dependent dependent : dependents) {
            if (dependent.pinnedVersion() != version) {
                return false;
            }
        }

        return true;
    }

    public void repin(VersionedDocument document, int fromVersion, int toVersion) {
        dependentsQuery.repin(document, fromVersion, toVersion);
    }
}
