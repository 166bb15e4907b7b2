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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A group of named components, kept in declaration order.
 */
public final class CompositeAspect extends AspectNode {
    private final Map<String, AspectNode> components;

    public CompositeAspect(String name, Map<String, AspectNode> components) {
        this(name, components, null);
    }

    public CompositeAspect(String name, Map<String, AspectNode> components,
            @Nullable JsonNode attr) {
        super(name, attr);
        this.components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
    }

    public Map<String, AspectNode> components() {
        return components;
    }

    @Override
    public String wireType() {
        return "composite";
    }

    @Override
    public <R> R accept(AspectVisitor<R> visitor) {
        return visitor.visitComposite(this);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && components.equals(((CompositeAspect) o).components);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), components);
    }

    @Override
    public String toString() {
        return "CompositeAspect{" +
                "name='" + name() + '\'' +
                ", components=" + components.values() +
                '}';
    }
}
