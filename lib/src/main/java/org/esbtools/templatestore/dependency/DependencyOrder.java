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

package org.esbtools.templatestore.dependency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class DependencyOrder {
    private final List<String> ordered;
    private final Map<String, Set<String>> unresolved;

    public DependencyOrder(List<String> ordered, Map<String, Set<String>> unresolved) {
        this.ordered = Collections.unmodifiableList(new ArrayList<>(ordered));

        Map<String, Set<String>> copy = new LinkedHashMap<>();
        unresolved.forEach((slug, dependsOn) ->
                copy.put(slug, Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn))));
        this.unresolved = Collections.unmodifiableMap(copy);
    }

    /**
     * Slugs such that every slug comes after the slugs it depends on.
     */
    public List<String> ordered() {
        return ordered;
    }

    /**
     * Slugs caught in or behind a circular dependency, with their unresolved dependencies.
     * Always empty for strict resolutions.
     */
    public Map<String, Set<String>> unresolved() {
        return unresolved;
    }

    public boolean isComplete() {
        return unresolved.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DependencyOrder that = (DependencyOrder) o;
        return Objects.equals(ordered, that.ordered) &&
                Objects.equals(unresolved, that.unresolved);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ordered, unresolved);
    }

    @Override
    public String toString() {
        return "DependencyOrder{" +
                "ordered=" + ordered +
                ", unresolved=" + unresolved +
                '}';
    }
}
