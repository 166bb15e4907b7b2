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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@ThreadSafe
public class MutableDomainLanguages implements DomainLanguages {
    private final Map<String, String> defaultLanguages = new ConcurrentHashMap<>();

    private static final Logger log = LoggerFactory.getLogger(MutableDomainLanguages.class);

    /**
     * Starts without default languages, so no fallback language is ever served.
     */
    public MutableDomainLanguages() {
    }

    /**
     * Uses provided as initial values.
     */
    public MutableDomainLanguages(Map<String, String> initialDefaultLanguages) {
        defaultLanguages.putAll(
                Objects.requireNonNull(initialDefaultLanguages, "initialDefaultLanguages"));
    }

    @Override
    public Optional<String> defaultLanguageOf(String domain) {
        return Optional.ofNullable(defaultLanguages.get(domain));
    }

    public MutableDomainLanguages setDefaultLanguage(String domain, String language) {
        String old = defaultLanguages.put(Objects.requireNonNull(domain, "domain"),
                Objects.requireNonNull(language, "language"));

        if (!language.equals(old)) {
            log.info("Default language of domain {} updated. Old value was {}. New value is {}.",
                    domain, old, language);
        }

        return this;
    }
}
