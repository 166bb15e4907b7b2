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

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the slugs of every code document a set of aspects takes its items from, at any
 * depth.
 */
public class ReferencedCodes implements AspectVisitor<Set<String>> {
    public static Set<String> in(Collection<? extends AspectNode> aspects) {
        ReferencedCodes visitor = new ReferencedCodes();
        Set<String> codes = new LinkedHashSet<>();

        for (AspectNode aspect : aspects) {
            codes.addAll(aspect.accept(visitor));
        }

        return codes;
    }

    @Override
    public Set<String> visitScalar(ScalarAspect aspect) {
        return new LinkedHashSet<>();
    }

    @Override
    public Set<String> visitSelect(SelectAspect aspect) {
        Set<String> codes = new LinkedHashSet<>();
        aspect.codeSlug().ifPresent(codes::add);
        return codes;
    }

    @Override
    public Set<String> visitList(ListAspect aspect) {
        return aspect.itemSchema().accept(this);
    }

    @Override
    public Set<String> visitComposite(CompositeAspect aspect) {
        return in(aspect.components().values());
    }
}
