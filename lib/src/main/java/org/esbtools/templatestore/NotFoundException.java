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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * No document matched a reference, even after any fallbacks were tried.
 */
public class NotFoundException extends TemplateStoreException {
    private final List<DocumentRef> tried;

    public NotFoundException(DocumentRef... tried) {
        this(Arrays.asList(tried));
    }

    public NotFoundException(List<DocumentRef> tried) {
        super("Document not found. Tried: " + tried);
        this.tried = Collections.unmodifiableList(tried);
    }

    public List<DocumentRef> tried() {
        return tried;
    }
}
