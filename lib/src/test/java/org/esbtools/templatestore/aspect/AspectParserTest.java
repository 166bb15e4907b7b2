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

package org.esbtools.templatestore.aspect;

import static com.google.common.truth.Truth.assertThat;
import static org.esbtools.templatestore.testing.JsonTrees.json;
import static org.junit.Assert.fail;

import org.esbtools.templatestore.AspectParseException;
import org.esbtools.templatestore.testing.TestLogger;

import com.google.common.collect.ImmutableMap;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.util.Arrays;
import java.util.List;

@RunWith(JUnit4.class)
public class AspectParserTest {
    @Rule
    public TestLogger testLogger = new TestLogger();

    @Rule
    public ExpectedException expectedException = ExpectedException.none();

    AspectParser parser = new AspectParser();

    @Test
    public void shouldParseEveryVariant() {
        List<AspectNode> aspects = parser.parse(json("[" +
                "{'name': 'count', 'type': 'int'}, " +
                "{'name': 'color', 'type': 'select', 'items': 'colors'}, " +
                "{'name': 'size', 'type': 'multiselect', 'items': ['s', {'value': 'm'}]}, " +
                "{'name': 'tags', 'type': 'list', 'list_items': {'name': 'tag', 'type': 'str'}}, " +
                "{'name': 'place', 'type': 'composite', 'components': [" +
                "  {'name': 'lat', 'type': 'float'}, {'name': 'lon', 'type': 'float'}]}" +
                "]"), ParseMode.STRICT);

        assertThat(aspects).containsExactly(
                new ScalarAspect("count", ScalarAspect.ScalarKind.INT),
                SelectAspect.fromCode("color", SelectAspect.SelectKind.SELECT, "colors", null),
                SelectAspect.inline("size", SelectAspect.SelectKind.MULTISELECT,
                        Arrays.asList(new SelectItem("s"), new SelectItem("m")), null),
                new ListAspect("tags", new ScalarAspect("tag", ScalarAspect.ScalarKind.STR)),
                new CompositeAspect("place", ImmutableMap.of(
                        "lat", new ScalarAspect("lat", ScalarAspect.ScalarKind.FLOAT),
                        "lon", new ScalarAspect("lon", ScalarAspect.ScalarKind.FLOAT))))
                .inOrder();
    }

    @Test
    public void shouldParseTreeItemsWithChildren() {
        AspectNode aspect = parser.parse(json("[{'name': 'habitat', 'type': 'tree', " +
                "'items': {'levels': ['l1', 'l2'], 'root': {'value': 'root', 'children': " +
                "['forest', {'value': 'water', 'children': ['lake']}]}}}]"),
                ParseMode.STRICT).get(0);

        assertThat(((SelectAspect) aspect).inlineItems()).containsExactly(
                new SelectItem("root", Arrays.asList(
                        new SelectItem("forest"),
                        new SelectItem("water", Arrays.asList(new SelectItem("lake"))))));
    }

    @Test
    public void shouldRejectUnknownTypesInEveryMode() {
        for (ParseMode mode : ParseMode.values()) {
            try {
                parser.parse(json("[{'name': 'a', 'type': 'str'}, {'name': 'b', 'type': 'blob'}]"),
                        mode);
                fail("Expected unknown type to be rejected in " + mode + " mode");
            } catch (AspectParseException e) {
                assertThat(e.path().toString()).isEqualTo("aspects.1.type");
            }
        }
    }

    @Test
    public void shouldRejectUnknownAttributesWhenStrict() {
        expectedException.expect(AspectParseException.class);
        expectedException.expectMessage("aspects.0.options");

        parser.parse(json("[{'name': 'a', 'type': 'str', 'options': []}]"), ParseMode.STRICT);
    }

    @Test
    public void shouldIgnoreUnknownAttributesWhenLenient() {
        List<AspectNode> aspects = parser.parse(
                json("[{'name': 'a', 'type': 'str', 'options': [], 'view': {}, 'comment': 'c'}]"),
                ParseMode.LENIENT);

        assertThat(aspects).containsExactly(new ScalarAspect("a", ScalarAspect.ScalarKind.STR));
    }

    @Test
    public void shouldRejectListsWithoutListItems() {
        expectedException.expect(AspectParseException.class);
        expectedException.expectMessage("missing 'list_items'");

        parser.parse(json("[{'name': 'tags', 'type': 'list'}]"), ParseMode.LENIENT);
    }

    @Test
    public void shouldTreatCompositesWithoutComponentsAsEmpty() {
        AspectNode aspect = parser.parse(json("[{'name': 'empty', 'type': 'composite'}]"),
                ParseMode.STRICT).get(0);

        assertThat(((CompositeAspect) aspect).components()).isEmpty();
    }

    @Test
    public void shouldRejectComponentsWhichAreNotAList() {
        expectedException.expect(AspectParseException.class);
        expectedException.expectMessage("aspects.0.components");

        parser.parse(json("[{'name': 'c', 'type': 'composite', 'components': 'x'}]"),
                ParseMode.LENIENT);
    }

    @Test
    public void shouldRequireANameOnNestedAspects() {
        expectedException.expect(AspectParseException.class);
        expectedException.expectMessage("aspects.0.components.1.name");

        parser.parse(json("[{'name': 'c', 'type': 'composite', 'components': [" +
                "{'name': 'a', 'type': 'str'}, {'type': 'str'}]}]"), ParseMode.STRICT);
    }

    @Test
    public void shouldTreatMissingAspectsAsNone() {
        assertThat(parser.parse(null, ParseMode.STRICT)).isEmpty();
    }
}
