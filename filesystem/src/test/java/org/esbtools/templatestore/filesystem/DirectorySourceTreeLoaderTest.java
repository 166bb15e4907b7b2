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

import org.esbtools.templatestore.DocumentKind;
import org.esbtools.templatestore.DocumentService;
import org.esbtools.templatestore.InstancePins;
import org.esbtools.templatestore.MutableDomainLanguages;
import org.esbtools.templatestore.MutableTemplateStoreConfig;
import org.esbtools.templatestore.Reference;
import org.esbtools.templatestore.importing.BatchImporter;
import org.esbtools.templatestore.importing.ImportReport;
import org.esbtools.templatestore.importing.SourceRecord;
import org.esbtools.templatestore.testing.InMemoryDocumentStore;
import org.esbtools.templatestore.testing.TestLogger;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@RunWith(JUnit4.class)
public class DirectorySourceTreeLoaderTest {
    @Rule
    public TestLogger testLogger = new TestLogger();

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    Path root;

    @Before
    public void writeSourceTree() throws Exception {
        root = temporaryFolder.newFolder("source").toPath();

        write("demo/code/colors.json", "{\"slug\": \"colors\", \"type\": \"base_code\", " +
                "\"values\": [\"red\", \"green\"]}");
        write("demo/code/sizes.json", "{\"values\": [\"s\", \"m\"]}");
        write("demo/schema/observation.json", "{\"aspects\": []}");
        write("demo/template/bird_obs.json", "{\"slug\": \"bird_obs\", " +
                "\"template\": {\"slug\": \"observation\"}, " +
                "\"entry_refs\": [\"colors\", {\"dest_slug\": \"birds\", \"ref_type\": \"tag\"}], " +
                "\"aspects\": [{\"name\": \"color\", \"type\": \"select\", \"items\": \"colors\"}]}");
        write("demo/lang/en/code/colors.json", "{\"language\": \"en\", " +
                "\"values\": [\"Red\", \"Green\"]}");
        write("demo/lang/de/code/colors.json", "{\"values\": [\"Rot\", \"Grün\"]}");
        write("demo/lang/en/template/bird_obs.json", "{\"aspects\": [{\"label\": \"Color\"}]}");
        write("other/code/elsewhere.json", "{\"values\": []}");
    }

    @Test
    public void shouldReadEveryDocumentOfTheDomain() throws Exception {
        List<SourceRecord> records = new DirectorySourceTreeLoader(root, "demo").load();

        List<String> slugs = new ArrayList<>();
        for (SourceRecord record : records) {
            slugs.add(record.slug());
        }

        assertThat(slugs).containsExactly("observation", "bird_obs", "colors", "sizes").inOrder();
    }

    @Test
    public void shouldSeparateMetadataFromContent() throws Exception {
        SourceRecord birdObs = recordOf("bird_obs");

        assertThat(birdObs.kind()).isEqualTo(DocumentKind.BASE_TEMPLATE);
        assertThat(birdObs.domain()).isEqualTo("demo");
        assertThat(birdObs.templateSlug().get()).isEqualTo("observation");
        assertThat(birdObs.refs()).containsExactly(Reference.code("colors"),
                Reference.tag("birds")).inOrder();
        assertThat(birdObs.content()).isEqualTo(object(
                "{'aspects': [{'name': 'color', 'type': 'select', 'items': 'colors'}]}"));
    }

    @Test
    public void shouldReadTheTextOfEveryLanguage() throws Exception {
        SourceRecord colors = recordOf("colors");

        assertThat(colors.overlays().keySet()).containsExactly("de", "en").inOrder();
        assertThat(colors.overlays().get("en")).isEqualTo(object("{'values': ['Red', 'Green']}"));
        assertThat(recordOf("sizes").overlays()).isEmpty();
    }

    @Test
    public void shouldImportTheSourceTreeInDependencyOrder() throws Exception {
        InMemoryDocumentStore store = new InMemoryDocumentStore();
        MutableTemplateStoreConfig config = new MutableTemplateStoreConfig();
        DocumentService service = new DocumentService(store,
                new MutableDomainLanguages().setDefaultLanguage("demo", "en"),
                InstancePins.NONE, config);
        write("demo/code/birds.json", "{\"values\": [\"robin\"]}");
        write("demo/lang/en/code/birds.json", "{\"values\": [\"Robin\"]}");

        ImportReport report = new BatchImporter(service, config)
                .importBatch(new DirectorySourceTreeLoader(root, "demo").load());

        assertThat(report.failed()).isEmpty();
        assertThat(store.findBase("bird_obs").get().getTemplateReference().get())
                .isEqualTo("observation");
        assertThat(store.findOverlay("colors", "de").isPresent()).isTrue();
        assertThat(store.findOverlay("bird_obs", "en").isPresent()).isTrue();
        assertThat(store.findBase("elsewhere").isPresent()).isFalse();
    }

    private SourceRecord recordOf(String slug) throws IOException {
        for (SourceRecord record : new DirectorySourceTreeLoader(root, "demo").load()) {
            if (record.slug().equals(slug)) {
                return record;
            }
        }
        throw new AssertionError("No record " + slug);
    }

    private void write(String relativePath, String json) throws IOException {
        Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.write(file, json.getBytes(StandardCharsets.UTF_8));
    }
}
