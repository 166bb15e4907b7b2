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

/**
 * A version outside of a document's history was requested. Always a caller usage error.
 */
public class VersionException extends TemplateStoreException {
    public enum Reason {
        INVALID_VERSION
    }

    private final Reason reason;
    private final int requested;
    private final int min;
    private final int max;

    public static VersionException invalidVersion(String slug, int requested, int max) {
        return new VersionException(Reason.INVALID_VERSION, slug, requested, 1, max);
    }

    private VersionException(Reason reason, String slug, int requested, int min, int max) {
        super("Invalid version number for " + slug + ". Given: " + requested + ", min: " + min +
                ", max: " + max);
        this.reason = reason;
        this.requested = requested;
        this.min = min;
        this.max = max;
    }

    public Reason reason() {
        return reason;
    }

    public int requested() {
        return requested;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }
}
