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

/**
 * A repeated value, every item following {@link #itemSchema()}.
 */
public final class ListAspect extends AspectNode {
    private final AspectNode itemSchema;

    public ListAspect(String name, AspectNode itemSchema) {
        this(name, itemSchema, null);
    }

    public ListAspect(String name, AspectNode itemSchema, @Nullable JsonNode attr) {
        super(name, attr);
        this.itemSchema = Objects.requireNonNull(itemSchema, "itemSchema");
    }

    public AspectNode itemSchema() {
        return itemSchema;
    }

    @Override
    public String wireType() {
        return "list";
    }

    @Override
    public <R> R accept(AspectVisitor<R> visitor) {
        return visitor.visitList(this);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && itemSchema.equals(((ListAspect) o).itemSchema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), itemSchema);
    }

    @Override
    public String toString() {
        return "ListAspect{" +
                "name='" + name() + '\'' +
                ", itemSchema=" + itemSchema +
                '}';
    }
}
