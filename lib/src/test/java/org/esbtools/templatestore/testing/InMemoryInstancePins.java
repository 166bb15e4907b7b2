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

package org.esbtools.templatestore.testing;

import org.esbtools.templatestore.Dependent;
import org.esbtools.templatestore.InstancePins;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryInstancePins implements InstancePins {
    private final Map<String, List<Dependent>> pins = new ConcurrentHashMap<>();

    public void pin(String slug, String language, String instanceId, int version) {
        pins.computeIfAbsent(key(slug, language),
                k -> Collections.synchronizedList(new ArrayList<>()))
                .add(new Dependent(instanceId, version));
    }

    @Override
    public List<Dependent> pinsOf(String slug, String language) {
        return new ArrayList<>(pins.getOrDefault(key(slug, language), Collections.emptyList()));
    }

    @Override
    public void repin(String slug, String language, int fromVersion, int toVersion) {
        List<Dependent> current = pins.get(key(slug, language));

        if (current == null) {
            return;
        }

        synchronized (current) {
            for (int i = 0; i < current.size(); i++) {
                Dependent dependent = current.get(i);
                if (dependent.pinnedVersion() == fromVersion) {
                    current.set(i, new Dependent(dependent.id(), toVersion));
                }
            }
        }
    }

    private static String key(String slug, String language) {
        return slug + "/" + language;
    }
}
