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

import org.esbtools.templatestore.aspect.ParseMode;
import org.esbtools.templatestore.dependency.ResolutionMode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

@ThreadSafe
public class MutableTemplateStoreConfig implements TemplateStoreConfig {
    public static final Set<String> DEFAULT_CHANGE_IGNORE_FIELDS = Collections.unmodifiableSet(
            new LinkedHashSet<>(Arrays.asList("uuid", "version", "template_version", "actors")));

    private volatile Set<String> changeIgnoreFields;
    private volatile ParseMode defaultParseMode;
    private volatile ResolutionMode defaultResolutionMode;

    private static final Logger log = LoggerFactory.getLogger(MutableTemplateStoreConfig.class);

    /**
     * Ignores identity and version bookkeeping when detecting changes, and parses and resolves
     * strictly.
     */
    public MutableTemplateStoreConfig() {
        this(DEFAULT_CHANGE_IGNORE_FIELDS, ParseMode.STRICT, ResolutionMode.STRICT);
    }

    /**
     * Uses provided as initial values.
     */
    public MutableTemplateStoreConfig(Collection<String> initialChangeIgnoreFields,
            ParseMode defaultParseMode, ResolutionMode defaultResolutionMode) {
        this.changeIgnoreFields = Collections.unmodifiableSet(new LinkedHashSet<>(
                Objects.requireNonNull(initialChangeIgnoreFields, "initialChangeIgnoreFields")));
        this.defaultParseMode = Objects.requireNonNull(defaultParseMode, "defaultParseMode");
        this.defaultResolutionMode =
                Objects.requireNonNull(defaultResolutionMode, "defaultResolutionMode");
    }

    @Override
    public Set<String> getChangeIgnoreFields() {
        return changeIgnoreFields;
    }

    public MutableTemplateStoreConfig setChangeIgnoreFields(Collection<String> fields) {
        Set<String> old = changeIgnoreFields;
        changeIgnoreFields = Collections.unmodifiableSet(new LinkedHashSet<>(fields));

        if (!old.equals(changeIgnoreFields)) {
            log.info("Change ignore fields updated. Old value was {}. New value is {}.",
                    old, changeIgnoreFields);
        }

        return this;
    }

    @Override
    public ParseMode getDefaultParseMode() {
        return defaultParseMode;
    }

    public MutableTemplateStoreConfig setDefaultParseMode(ParseMode parseMode) {
        ParseMode old = defaultParseMode;
        defaultParseMode = Objects.requireNonNull(parseMode, "parseMode");

        if (old != defaultParseMode) {
            log.info("Default parse mode updated. Old value was {}. New value is {}.",
                    old, defaultParseMode);
        }

        return this;
    }

    @Override
    public ResolutionMode getDefaultResolutionMode() {
        return defaultResolutionMode;
    }

    public MutableTemplateStoreConfig setDefaultResolutionMode(ResolutionMode resolutionMode) {
        ResolutionMode old = defaultResolutionMode;
        defaultResolutionMode = Objects.requireNonNull(resolutionMode, "resolutionMode");

        if (old != defaultResolutionMode) {
            log.info("Default resolution mode updated. Old value was {}. New value is {}.",
                    old, defaultResolutionMode);
        }

        return this;
    }
}
