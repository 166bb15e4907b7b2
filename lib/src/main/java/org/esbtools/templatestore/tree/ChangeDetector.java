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

package org.esbtools.templatestore.tree;

import org.esbtools.templatestore.VersionedDocument;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether an incoming tree differs from what is persisted. Writes whose content is
 * unchanged are no-ops, which makes every write idempotent.
 */
public class ChangeDetector {
    private static final Logger logger = LoggerFactory.getLogger(ChangeDetector.class);

    /**
     * @param ignoreFields Top level keys which never count as content, such as identity and
     *                     version bookkeeping. Null valued keys are ignored at every depth.
     */
    public Comparison compare(@Nullable JsonNode persisted, @Nullable JsonNode incoming,
            Set<String> ignoreFields) {
        JsonNode persistedView = Trees.project(persisted, ignoreFields);
        JsonNode incomingView = Trees.project(incoming, ignoreFields);

        StructuredDiff diff = StructuredDiff.between(persistedView, incomingView);

        if (logger.isDebugEnabled() && !diff.isEmpty()) {
            logger.debug("Detected {} change(s): {}", diff.size(), diff.changes());
        }

        return new Comparison(diff);
    }

    public Comparison compare(@Nullable JsonNode persisted, @Nullable JsonNode incoming) {
        return compare(persisted, incoming, Collections.emptySet());
    }

    /**
     * Compares against the live content of a persisted document.
     */
    public Comparison compare(VersionedDocument persisted, @Nullable JsonNode incoming,
            Set<String> ignoreFields) {
        return compare(persisted.getContent(), incoming, ignoreFields);
    }

    public static final class Comparison {
        private final StructuredDiff diff;

        Comparison(StructuredDiff diff) {
            this.diff = Objects.requireNonNull(diff, "diff");
        }

        public boolean isEqual() {
            return diff.isEmpty();
        }

        public StructuredDiff diff() {
            return diff;
        }

        @Override
        public String toString() {
            return "Comparison{" +
                    "isEqual=" + isEqual() +
                    ", diff=" + diff +
                    '}';
        }
    }
}
