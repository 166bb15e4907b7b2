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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One selectable value of an inline select aspect. Tree selects nest further items as children.
 */
public final class SelectItem {
    private final String value;
    private final List<SelectItem> children;

    public SelectItem(String value) {
        this(value, Collections.emptyList());
    }

    public SelectItem(String value, List<SelectItem> children) {
        this.value = Objects.requireNonNull(value, "value");
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public String value() {
        return value;
    }

    public List<SelectItem> children() {
        return children;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SelectItem that = (SelectItem) o;
        return Objects.equals(value, that.value) &&
                Objects.equals(children, that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, children);
    }

    @Override
    public String toString() {
        return children.isEmpty() ? value : value + children;
    }
}
