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

import org.esbtools.templatestore.tree.TreePath;

import java.util.Objects;

/**
 * A language overlay could not be merged onto its base structure.
 */
public class MergeException extends TemplateStoreException {
    public enum Reason {
        /** Lists at the same path have a different number of items. */
        STRUCTURAL_MISMATCH,
        /** One side has a container where the other has a different kind of node. */
        TYPE_CONFLICT
    }

    private final Reason reason;
    private final TreePath path;

    public MergeException(Reason reason, TreePath path, String detail) {
        super(reason + " at '" + path + "': " + detail);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.path = Objects.requireNonNull(path, "path");
    }

    public Reason reason() {
        return reason;
    }

    public TreePath path() {
        return path;
    }
}
