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
import java.util.Locale;
import java.util.Objects;

public final class ScalarAspect extends AspectNode {
    public enum ScalarKind {
        STR,
        INT,
        FLOAT
    }

    private final ScalarKind kind;

    public ScalarAspect(String name, ScalarKind kind) {
        this(name, kind, null);
    }

    public ScalarAspect(String name, ScalarKind kind, @Nullable JsonNode attr) {
        super(name, attr);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ScalarKind kind() {
        return kind;
    }

    @Override
    public String wireType() {
        return kind.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public <R> R accept(AspectVisitor<R> visitor) {
        return visitor.visitScalar(this);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && kind == ((ScalarAspect) o).kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), kind);
    }

    @Override
    public String toString() {
        return "ScalarAspect{" +
                "name='" + name() + '\'' +
                ", kind=" + kind +
                '}';
    }
}
