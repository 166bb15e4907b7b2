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

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * The language neutral structure of a schema, base template or base code document.
 */
public class BaseDocument extends VersionedDocument {
    @Nullable
    private String templateReference;

    public BaseDocument(String slug, String domain, DocumentKind kind) {
        super(slug, domain, kind);

        if (!kind.isStructural()) {
            throw new IllegalArgumentException("Base documents must have a structural kind, " +
                    "but got " + kind.wireName());
        }
    }

    private BaseDocument(BaseDocument toCopy) {
        super(toCopy);
        this.templateReference = toCopy.templateReference;
    }

    @Override
    public BaseDocument copy() {
        return new BaseDocument(this);
    }

    /**
     * For base codes, the slug of the schema they follow.
     */
    public Optional<String> getTemplateReference() {
        return Optional.ofNullable(templateReference);
    }

    public void setTemplateReference(@Nullable String templateReference) {
        this.templateReference = templateReference;
    }
}
