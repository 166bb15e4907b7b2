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

import java.util.List;
import java.util.Optional;

/**
 * Persistence collaborator. Slugs are unique across domains; language overlays are keyed by slug
 * and language.
 *
 * <p>Implementations must hand out documents which callers may change freely, for example
 * copies, so that nothing changes in the store until {@link #save(VersionedDocument)}.
 */
public interface DocumentStore {
    Optional<BaseDocument> findBase(String slug);

    Optional<LanguageOverlay> findOverlay(String slug, String language);

    /**
     * Looks up base documents and language overlays alike.
     */
    Optional<VersionedDocument> findByUuid(String uuid);

    /**
     * All language overlays of a base document, in no particular order.
     */
    List<LanguageOverlay> overlaysOf(String slug);

    /**
     * Inserts or replaces a document, including its version history, as one atomic unit.
     */
    void save(VersionedDocument document) throws Exception;
}
