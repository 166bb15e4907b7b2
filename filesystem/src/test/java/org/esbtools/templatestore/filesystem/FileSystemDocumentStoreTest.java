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

package org.esbtools.templatestore.filesystem;

import static com.google.common.truth.Truth.assertThat;
import static org.esbtools.templatestore.testing.JsonTrees.object;

import org.esbtools.templatestore.BaseDocument;
import org.esbtools.templatestore.DocumentKind;
import org.esbtools.templatestore.DocumentModel;
import org.esbtools.templatestore.DocumentService;
import org.esbtools.templatestore.LanguageOverlay;
import org.esbtools.templatestore.MutableDomainLanguages;
import org.esbtools.templatestore.testing.TestLogger;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

@RunWith(JUnit4.class)
public class FileSystemDocumentStoreTest {
    @Rule
    public TestLogger testLogger = new TestLogger();

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    Path root;
    FileSystemDocumentStore store;

    static final ObjectNode COLORS_V1 = object("{'values': ['red']}");
    static final ObjectNode COLORS_V2 = object("{'values': ['red', 'green']}");

    @Before
    public void createStore() throws Exception {
        root = temporaryFolder.newFolder("store").toPath();
        store = new FileSystemDocumentStore(root);
    }

    @Test
    public void shouldWriteBaseDocumentsAndOverlaysToSeparateFiles() throws Exception {
        BaseDocument base = new BaseDocument("colors", "demo", DocumentKind.BASE_CODE);
        base.setContent(COLORS_V1);
        LanguageOverlay overlay = new LanguageOverlay("colors", "demo", DocumentKind.CODE, "en", 1);
        overlay.setContent(object("{'values': ['Red']}"));

        store.save(base);
        store.save(overlay);

        assertThat(Files.isRegularFile(root.resolve("base").resolve("colors.json"))).isTrue();
        assertThat(Files.isRegularFile(root.resolve("lang").resolve("en").resolve("colors.json")))
                .isTrue();
        assertThat(store.findBase("colors").get().getContent()).isEqualTo(COLORS_V1);
        assertThat(store.findOverlay("colors", "en").get().getLanguage()).isEqualTo("en");
        assertThat(store.findByUuid(overlay.getUuid()).get().getSlug()).isEqualTo("colors");
        assertThat(store.overlaysOf("colors")).hasSize(1);
    }

    @Test
    public void shouldReportMissingDocumentsAsAbsent() {
        assertThat(store.findBase("nothing").isPresent()).isFalse();
        assertThat(store.findOverlay("nothing", "en").isPresent()).isFalse();
        assertThat(store.findByUuid("nothing").isPresent()).isFalse();
        assertThat(store.overlaysOf("nothing")).isEmpty();
    }

    @Test
    public void shouldReplaceFilesWithoutLeavingTemporaryFilesBehind() throws Exception {
        BaseDocument base = new BaseDocument("colors", "demo", DocumentKind.BASE_CODE);
        base.setContent(COLORS_V1);
        store.save(base);

        base.setContent(COLORS_V2);
        store.save(base);

        assertThat(store.findBase("colors").get().getContent()).isEqualTo(COLORS_V2);
        try (Stream<Path> files = Files.list(root.resolve("base"))) {
            assertThat(files.count()).isEqualTo(1L);
        }
    }

    @Test
    public void shouldKeepVersionHistoryAcrossServiceInstances() {
        new DocumentService(store, new MutableDomainLanguages())
                .updateOrInsert(colors(COLORS_V1));
        new DocumentService(store, new MutableDomainLanguages())
                .updateOrInsert(colors(COLORS_V2));

        DocumentService reopened = new DocumentService(new FileSystemDocumentStore(root),
                new MutableDomainLanguages());

        assertThat(reopened.getVersion("colors", null, 1)).isEqualTo(COLORS_V1);
        assertThat(reopened.getVersion("colors", null, 2)).isEqualTo(COLORS_V2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldRejectSlugsWhichAreNotFileNames() {
        store.findBase("../outside");
    }

    private static DocumentModel colors(ObjectNode content) {
        return DocumentModel.structural("colors", "demo", DocumentKind.BASE_CODE, content);
    }
}
