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

import java.util.Objects;

/**
 * Something which is pinned to one version of a document: a language overlay pinning its base
 * document, or an instance pinning a language overlay.
 */
public final class Dependent {
    private final String id;
    private final int pinnedVersion;

    public Dependent(String id, int pinnedVersion) {
        this.id = Objects.requireNonNull(id, "id");
        this.pinnedVersion = pinnedVersion;
    }

    public String id() {
        return id;
    }

    public int pinnedVersion() {
        return pinnedVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Dependent dependent = (Dependent) o;
        return pinnedVersion == dependent.pinnedVersion &&
                Objects.equals(id, dependent.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, pinnedVersion);
    }

    @Override
    public String toString() {
        return "Dependent{" +
                "id='" + id + '\'' +
                ", pinnedVersion=" + pinnedVersion +
                '}';
    }
}
