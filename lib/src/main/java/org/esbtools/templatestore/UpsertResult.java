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

public final class UpsertResult {
    public enum Outcome {
        INSERTED,
        UPDATED,
        /**
         * Nothing differed from the persisted document, so nothing was committed.
         */
        UNCHANGED
    }

    private final VersionedDocument document;
    private final int version;
    private final Outcome outcome;

    public UpsertResult(VersionedDocument document, int version, Outcome outcome) {
        this.document = Objects.requireNonNull(document, "document");
        this.version = version;
        this.outcome = Objects.requireNonNull(outcome, "outcome");
    }

    public VersionedDocument document() {
        return document;
    }

    public int version() {
        return version;
    }

    public Outcome outcome() {
        return outcome;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UpsertResult that = (UpsertResult) o;
        return version == that.version &&
                Objects.equals(document.getUuid(), that.document.getUuid()) &&
                outcome == that.outcome;
    }

    @Override
    public int hashCode() {
        return Objects.hash(document.getUuid(), version, outcome);
    }

    @Override
    public String toString() {
        return "UpsertResult{" +
                "document=" + document +
                ", version=" + version +
                ", outcome=" + outcome +
                '}';
    }
}
