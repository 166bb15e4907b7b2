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

package org.esbtools.templatestore.merge;

import org.esbtools.templatestore.MergeException;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of merging one aspect on its own, used to point out which aspect of a language
 * overlay does not fit its base document.
 */
public final class AspectMergeResult {
    private final int index;
    @Nullable
    private final String baseName;
    @Nullable
    private final String overlayLabel;
    @Nullable
    private final MergeException error;

    public AspectMergeResult(int index, @Nullable String baseName, @Nullable String overlayLabel,
            @Nullable MergeException error) {
        this.index = index;
        this.baseName = baseName;
        this.overlayLabel = overlayLabel;
        this.error = error;
    }

    public int index() {
        return index;
    }

    /**
     * The {@code name} of the base aspect, if there is a base aspect at this index.
     */
    public Optional<String> baseName() {
        return Optional.ofNullable(baseName);
    }

    /**
     * The {@code label} of the overlay aspect, if there is an overlay aspect at this index.
     */
    public Optional<String> overlayLabel() {
        return Optional.ofNullable(overlayLabel);
    }

    public Optional<MergeException> error() {
        return Optional.ofNullable(error);
    }

    public boolean isMerged() {
        return error == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AspectMergeResult that = (AspectMergeResult) o;
        return index == that.index &&
                Objects.equals(baseName, that.baseName) &&
                Objects.equals(overlayLabel, that.overlayLabel) &&
                Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, baseName, overlayLabel, error);
    }

    @Override
    public String toString() {
        return "AspectMergeResult{" +
                "index=" + index +
                ", baseName='" + baseName + '\'' +
                ", overlayLabel='" + overlayLabel + '\'' +
                ", error=" + (error == null ? "none" : error.getMessage()) +
                '}';
    }
}
