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

package org.esbtools.templatestore.aspect;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

/**
 * One field of a template or code schema. The set of variants is closed: an aspect is a
 * {@link ScalarAspect}, a {@link SelectAspect}, a {@link ListAspect} or a
 * {@link CompositeAspect}. Dispatch on the variant with an {@link AspectVisitor}.
 */
public abstract class AspectNode {
    private final String name;
    @Nullable
    private final JsonNode attr;

    AspectNode(String name, @Nullable JsonNode attr) {
        this.name = Objects.requireNonNull(name, "name");
        this.attr = attr == null ? null : attr.deepCopy();
    }

    public String name() {
        return name;
    }

    /**
     * Free form presentation attributes, passed through as they are.
     */
    public Optional<JsonNode> attr() {
        return Optional.ofNullable(attr).map(JsonNode::deepCopy);
    }

    /**
     * The value of {@code type} this aspect is written with.
     */
    public abstract String wireType();

    public abstract <R> R accept(AspectVisitor<R> visitor);

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AspectNode that = (AspectNode) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(attr, that.attr);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, attr);
    }
}
