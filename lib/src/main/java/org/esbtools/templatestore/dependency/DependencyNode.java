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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

public final class DependencyNode {
    private final String slug;
    private final Set<String> dependsOn;

    public DependencyNode(String slug, Collection<String> dependsOn) {
        this.slug = Objects.requireNonNull(slug, "slug");
        this.dependsOn = Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn));
    }

    public String slug() {
        return slug;
    }

    public Set<String> dependsOn() {
        return dependsOn;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DependencyNode that = (DependencyNode) o;
        return Objects.equals(slug, that.slug) &&
                Objects.equals(dependsOn, that.dependsOn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(slug, dependsOn);
    }

    @Override
    public String toString() {
        return slug + " -> " + dependsOn;
    }
}
