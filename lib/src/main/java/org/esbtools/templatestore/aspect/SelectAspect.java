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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Selection among values which are either listed inline or taken from a code document.
 */
public final class SelectAspect extends AspectNode {
    public enum SelectKind {
        SELECT,
        MULTISELECT,
        TREE,
        TREEMULTISELECT
    }

    private final SelectKind kind;
    private final List<SelectItem> inlineItems;
    @Nullable
    private final String codeSlug;

    public static SelectAspect inline(String name, SelectKind kind, List<SelectItem> items,
            @Nullable JsonNode attr) {
        return new SelectAspect(name, kind, items, null, attr);
    }

    public static SelectAspect fromCode(String name, SelectKind kind, String codeSlug,
            @Nullable JsonNode attr) {
        return new SelectAspect(name, kind, Collections.emptyList(),
                Objects.requireNonNull(codeSlug, "codeSlug"), attr);
    }

    private SelectAspect(String name, SelectKind kind, List<SelectItem> inlineItems,
            @Nullable String codeSlug, @Nullable JsonNode attr) {
        super(name, attr);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.inlineItems = Collections.unmodifiableList(new ArrayList<>(inlineItems));
        this.codeSlug = codeSlug;
    }

    public SelectKind kind() {
        return kind;
    }

    /**
     * Empty when the items come from a code document.
     */
    public List<SelectItem> inlineItems() {
        return inlineItems;
    }

    /**
     * The slug of the code document providing the items, if they are not inline.
     */
    public Optional<String> codeSlug() {
        return Optional.ofNullable(codeSlug);
    }

    @Override
    public String wireType() {
        return kind.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public <R> R accept(AspectVisitor<R> visitor) {
        return visitor.visitSelect(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        SelectAspect that = (SelectAspect) o;
        return kind == that.kind &&
                Objects.equals(inlineItems, that.inlineItems) &&
                Objects.equals(codeSlug, that.codeSlug);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), kind, inlineItems, codeSlug);
    }

    @Override
    public String toString() {
        return "SelectAspect{" +
                "name='" + name() + '\'' +
                ", kind=" + kind +
                (codeSlug == null ? ", items=" + inlineItems : ", code='" + codeSlug + '\'') +
                '}';
    }
}
