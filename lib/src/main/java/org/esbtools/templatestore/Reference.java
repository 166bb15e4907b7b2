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

import java.util.Locale;
import java.util.Objects;

/**
 * An outgoing edge from one document to another, used for rendering and for ordering imports.
 */
public final class Reference {
    public enum Type {
        CODE,
        TAG;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Type fromWireName(String wireName) {
            return valueOf(wireName.toUpperCase(Locale.ROOT));
        }
    }

    private final String destSlug;
    private final Type type;

    public Reference(String destSlug, Type type) {
        this.destSlug = Objects.requireNonNull(destSlug, "destSlug");
        this.type = Objects.requireNonNull(type, "type");
    }

    public static Reference code(String destSlug) {
        return new Reference(destSlug, Type.CODE);
    }

    public static Reference tag(String destSlug) {
        return new Reference(destSlug, Type.TAG);
    }

    public String destSlug() {
        return destSlug;
    }

    public Type type() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Reference reference = (Reference) o;
        return Objects.equals(destSlug, reference.destSlug) &&
                type == reference.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(destSlug, type);
    }

    @Override
    public String toString() {
        return "Reference{" +
                "destSlug='" + destSlug + '\'' +
                ", type=" + type +
                '}';
    }
}
