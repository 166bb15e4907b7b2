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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A batch contains documents which (transitively) depend on each other, so no safe order
 * exists for them.
 */
public class CircularDependencyException extends TemplateStoreException {
    private final Map<String, Set<String>> remaining;

    /**
     * @param remaining The unresolved documents, each mapped to the in-batch documents it still
     *                  waits for.
     */
    public CircularDependencyException(Map<String, Set<String>> remaining) {
        super("Circular dependencies: " + remaining);

        Map<String, Set<String>> copy = new LinkedHashMap<>();
        remaining.forEach((slug, dependencies) ->
                copy.put(slug, Collections.unmodifiableSet(new LinkedHashSet<>(dependencies))));
        this.remaining = Collections.unmodifiableMap(copy);
    }

    public Map<String, Set<String>> remaining() {
        return remaining;
    }
}
