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

package org.esbtools.templatestore.dependency;

import org.esbtools.templatestore.CircularDependencyException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders a batch of documents so that each comes after the documents it depends on.
 *
 * <p>Only dependencies on other members of the batch count; anything else is expected to exist
 * already. Every round emits all nodes without remaining dependencies in input order, so the
 * result is deterministic for the same input.
 */
public class DependencyResolver {
    private static final Logger logger = LoggerFactory.getLogger(DependencyResolver.class);

    /**
     * @throws CircularDependencyException in {@link ResolutionMode#STRICT} mode, if the nodes
     * cannot all be ordered.
     */
    public DependencyOrder resolveOrder(Collection<DependencyNode> nodes, ResolutionMode mode) {
        Map<String, Set<String>> remaining = new LinkedHashMap<>();

        for (DependencyNode node : nodes) {
            // A repeated slug replaces the earlier node but keeps its position.
            remaining.put(node.slug(), new LinkedHashSet<>(node.dependsOn()));
        }

        for (Set<String> dependsOn : remaining.values()) {
            dependsOn.retainAll(remaining.keySet());
        }

        List<String> ordered = new ArrayList<>(remaining.size());

        while (!remaining.isEmpty()) {
            List<String> ready = new ArrayList<>();

            Iterator<Map.Entry<String, Set<String>>> entries = remaining.entrySet().iterator();
            while (entries.hasNext()) {
                Map.Entry<String, Set<String>> entry = entries.next();
                if (entry.getValue().isEmpty()) {
                    ready.add(entry.getKey());
                    entries.remove();
                }
            }

            if (ready.isEmpty()) {
                if (mode == ResolutionMode.STRICT) {
                    throw new CircularDependencyException(remaining);
                }

                logger.warn("Circular dependencies left {} document(s) unresolved: {}",
                        remaining.size(), remaining);
                return new DependencyOrder(ordered, remaining);
            }

            for (Set<String> dependsOn : remaining.values()) {
                dependsOn.removeAll(ready);
            }

            ordered.addAll(ready);
        }

        logger.debug("Resolved order: {}", ordered);
        return new DependencyOrder(ordered, remaining);
    }
}
