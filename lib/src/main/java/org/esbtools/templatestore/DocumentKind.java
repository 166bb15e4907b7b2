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

/**
 * Structural kinds are language neutral. Concrete kinds are a structural document merged with
 * one language.
 */
public enum DocumentKind {
    SCHEMA(true),
    BASE_TEMPLATE(true),
    BASE_CODE(true),
    TEMPLATE(false),
    CODE(false);

    private final boolean structural;

    DocumentKind(boolean structural) {
        this.structural = structural;
    }

    public boolean isStructural() {
        return structural;
    }

    /**
     * The kind a language overlay of this structural kind takes.
     *
     * @throws TemplateStoreException if there is no such kind, as for {@link #SCHEMA} or for
     * kinds which are already concrete.
     */
    public DocumentKind concreteKind() {
        switch (this) {
            case BASE_TEMPLATE:
                return TEMPLATE;
            case BASE_CODE:
                return CODE;
            default:
                throw new TemplateStoreException("Documents of kind " + wireName() +
                        " have no language specific form");
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DocumentKind fromWireName(String wireName) {
        for (DocumentKind kind : values()) {
            if (kind.wireName().equals(wireName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown document kind: " + wireName);
    }
}
