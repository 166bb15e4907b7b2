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

package org.esbtools.templatestore.importing;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

public final class FailedImport {
    private final SourceRecord record;
    @Nullable
    private final String language;
    private final Exception cause;

    public FailedImport(SourceRecord record, @Nullable String language, Exception cause) {
        this.record = Objects.requireNonNull(record, "record");
        this.language = language;
        this.cause = Objects.requireNonNull(cause, "cause");
    }

    public SourceRecord record() {
        return record;
    }

    /**
     * The language whose text failed to import, or empty if the structural document failed.
     */
    public Optional<String> language() {
        return Optional.ofNullable(language);
    }

    public Exception cause() {
        return cause;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FailedImport that = (FailedImport) o;
        return Objects.equals(record, that.record) &&
                Objects.equals(language, that.language) &&
                Objects.equals(cause, that.cause);
    }

    @Override
    public int hashCode() {
        return Objects.hash(record, language, cause);
    }

    @Override
    public String toString() {
        return "FailedImport{" +
                "slug='" + record.slug() + '\'' +
                ", language='" + language + '\'' +
                ", cause=" + cause +
                '}';
    }
}
