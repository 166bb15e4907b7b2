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

import java.util.Set;

public interface TemplateStoreConfig {
    /**
     * Top level content keys which never count as a change, such as identity and version
     * bookkeeping.
     */
    Set<String> getChangeIgnoreFields();

    /**
     * How aspects are validated when a write does not ask for a mode explicitly.
     */
    ParseMode getDefaultParseMode();

    /**
     * How batch imports deal with circular dependencies when not asked for a mode explicitly.
     */
    ResolutionMode getDefaultResolutionMode();
}
