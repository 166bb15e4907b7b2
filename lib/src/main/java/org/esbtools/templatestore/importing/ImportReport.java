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

import org.esbtools.templatestore.UpsertResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class ImportReport {
    private final List<UpsertResult> imported;
    private final List<FailedImport> failed;
    private final List<SourceRecord> skipped;
    private final Map<String, Set<String>> unresolved;

    public ImportReport(List<UpsertResult> imported, List<FailedImport> failed,
            List<SourceRecord> skipped, Map<String, Set<String>> unresolved) {
        this.imported = Collections.unmodifiableList(new ArrayList<>(imported));
        this.failed = Collections.unmodifiableList(new ArrayList<>(failed));
        this.skipped = Collections.unmodifiableList(new ArrayList<>(skipped));
        this.unresolved = Collections.unmodifiableMap(new LinkedHashMap<>(unresolved));
    }

    /**
     * Results of every write in the order they were made, including unchanged documents.
     */
    public List<UpsertResult> imported() {
        return imported;
    }

    public List<FailedImport> failed() {
        return failed;
    }

    /**
     * Records whose slug already belongs to another domain.
     */
    public List<SourceRecord> skipped() {
        return skipped;
    }

    /**
     * Slugs left out of a lenient import because of circular dependencies.
     */
    public Map<String, Set<String>> unresolved() {
        return unresolved;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ImportReport that = (ImportReport) o;
        return Objects.equals(imported, that.imported) &&
                Objects.equals(failed, that.failed) &&
                Objects.equals(skipped, that.skipped) &&
                Objects.equals(unresolved, that.unresolved);
    }

    @Override
    public int hashCode() {
        return Objects.hash(imported, failed, skipped, unresolved);
    }

    @Override
    public String toString() {
        return "ImportReport{" +
                "imported=" + imported.size() +
                ", failed=" + failed +
                ", skipped=" + skipped.size() +
                ", unresolved=" + unresolved.keySet() +
                '}';
    }
}
