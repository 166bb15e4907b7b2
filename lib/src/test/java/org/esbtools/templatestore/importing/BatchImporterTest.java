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

package org.esbtools.templatestore.importing;

import static com.google.common.truth.Truth.assertThat;
import static org.esbtools.templatestore.testing.JsonTrees.object;
import static org.junit.Assert.fail;

import org.esbtools.templatestore.AspectParseException;
import org.esbtools.templatestore.CircularDependencyException;
import org.esbtools.templatestore.DocumentKind;
import org.esbtools.templatestore.DocumentModel;
import org.esbtools.templatestore.DocumentService;
import org.esbtools.templatestore.LanguageOverlay;
import org.esbtools.templatestore.MergeException;
import org.esbtools.templatestore.MutableDomainLanguages;
import org.esbtools.templatestore.MutableTemplateStoreConfig;
import org.esbtools.templatestore.Reference;
import org.esbtools.templatestore.UpsertResult;
import org.esbtools.templatestore.VersionedDocument;
import org.esbtools.templatestore.aspect.ParseMode;
import org.esbtools.templatestore.dependency.ResolutionMode;
import org.esbtools.templatestore.testing.InMemoryDocumentStore;
import org.esbtools.templatestore.testing.InMemoryInstancePins;
import org.esbtools.templatestore.testing.TestLogger;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@RunWith(JUnit4.class)
public class BatchImporterTest {
    @Rule
    public TestLogger testLogger = new TestLogger();

    InMemoryDocumentStore store = new InMemoryDocumentStore();
    MutableTemplateStoreConfig config = new MutableTemplateStoreConfig();
    DocumentService service = new DocumentService(store,
            new MutableDomainLanguages().setDefaultLanguage("demo", "en"),
            new InMemoryInstancePins(), config);

    BatchImporter importer = new BatchImporter(service, config);

    @Test
    public void shouldImportDocumentsAfterTheDocumentsTheyDependOn() {
        ImportReport report = importer.importBatch(Arrays.asList(birdObs(), colors()));

        assertThat(slugsAndLanguagesOf(report.imported()))
                .containsExactly("colors", "colors/en", "bird_obs", "bird_obs/en")
                .inOrder();
        assertThat(report.failed()).isEmpty();
        assertThat(report.skipped()).isEmpty();
        assertThat(store.findOverlay("bird_obs", "en").get().getTemplateVersion()).isEqualTo(1);
    }

    @Test
    public void shouldReportUnchangedDocumentsOnReimport() {
        importer.importBatch(Arrays.asList(birdObs(), colors()));
        int savesBefore = store.getSaveCount();

        ImportReport report = importer.importBatch(Arrays.asList(birdObs(), colors()));

        assertThat(report.imported()).hasSize(4);
        for (UpsertResult result : report.imported()) {
            assertThat(result.outcome()).isEqualTo(UpsertResult.Outcome.UNCHANGED);
        }
        assertThat(store.getSaveCount()).isEqualTo(savesBefore);
    }

    @Test
    public void shouldSkipSlugsWhichBelongToAnotherDomain() {
        service.updateOrInsert(DocumentModel.structural("colors", "other", DocumentKind.BASE_CODE,
                object("{'values': ['blue']}")));

        ImportReport report = importer.importBatch(Arrays.asList(colors()));

        assertThat(report.skipped()).containsExactly(colors());
        assertThat(report.imported()).isEmpty();
        assertThat(store.findBase("colors").get().getDomain()).isEqualTo("other");
    }

    @Test
    public void shouldContinueImportingWhenADocumentFails() {
        SourceRecord broken = record("broken", DocumentKind.BASE_TEMPLATE,
                object("{'aspects': [{'name': 'x', 'type': 'blob'}]}"),
                Collections.emptyList(), Collections.emptyMap());
        SourceRecord untranslatable = record("untranslatable", DocumentKind.BASE_TEMPLATE,
                object("{'aspects': [{'name': 'count', 'type': 'int'}]}"),
                Collections.emptyList(),
                ImmutableMap.of(
                        "en", object("{'aspects': [{'label': 'Count'}]}"),
                        "de", object("{'aspects': [{'label': 'Anzahl'}, {'label': 'Farbe'}]}")));

        ImportReport report = importer.importBatch(Arrays.asList(broken, untranslatable, colors()));

        assertThat(slugsAndLanguagesOf(report.imported()))
                .containsExactly("untranslatable", "untranslatable/en", "colors", "colors/en")
                .inOrder();
        assertThat(report.failed()).hasSize(2);

        FailedImport parseFailure = report.failed().get(0);
        assertThat(parseFailure.record()).isEqualTo(broken);
        assertThat(parseFailure.cause()).isInstanceOf(AspectParseException.class);

        FailedImport mergeFailure = report.failed().get(1);
        assertThat(mergeFailure.record()).isEqualTo(untranslatable);
        assertThat(mergeFailure.language().get()).isEqualTo("de");
        assertThat(mergeFailure.cause()).isInstanceOf(MergeException.class);
    }

    @Test
    public void shouldImportNothingWhenStrictImportsHaveCircularDependencies() {
        List<SourceRecord> records = Arrays.asList(
                dependingOn("a", "b"), dependingOn("b", "a"), colors());

        try {
            importer.importBatch(records, ResolutionMode.STRICT, ParseMode.STRICT);
            fail("Expected circular dependencies to fail the import");
        } catch (CircularDependencyException e) {
            assertThat(store.getSaveCount()).isEqualTo(0);
        }
    }

    @Test
    public void shouldLeaveCircularDependenciesOutOfLenientImports() {
        List<SourceRecord> records = Arrays.asList(
                dependingOn("a", "b"), dependingOn("b", "a"), colors());

        ImportReport report = importer.importBatch(records, ResolutionMode.LENIENT,
                ParseMode.STRICT);

        assertThat(report.unresolved().keySet()).containsExactly("a", "b").inOrder();
        assertThat(slugsAndLanguagesOf(report.imported())).containsExactly("colors", "colors/en");
        assertThat(store.findBase("a").isPresent()).isFalse();
    }

    private static SourceRecord colors() {
        return record("colors", DocumentKind.BASE_CODE, object("{'values': ['red', 'green']}"),
                Collections.emptyList(),
                ImmutableMap.of("en", object("{'values': ['Red', 'Green']}")));
    }

    private static SourceRecord birdObs() {
        return record("bird_obs", DocumentKind.BASE_TEMPLATE,
                object("{'aspects': [{'name': 'color', 'type': 'select', 'items': 'colors'}]}"),
                Arrays.asList(Reference.code("colors")),
                ImmutableMap.of("en", object("{'aspects': [{'label': 'Color'}]}")));
    }

    private static SourceRecord dependingOn(String slug, String dependency) {
        return record(slug, DocumentKind.BASE_CODE, object("{'values': []}"),
                Arrays.asList(Reference.code(dependency)), Collections.emptyMap());
    }

    private static SourceRecord record(String slug, DocumentKind kind, ObjectNode content,
            List<Reference> refs, Map<String, ObjectNode> overlays) {
        return new SourceRecord(slug, "demo", kind, content, refs, null, overlays);
    }

    private static List<String> slugsAndLanguagesOf(List<UpsertResult> results) {
        List<String> slugs = new ArrayList<>();
        for (UpsertResult result : results) {
            VersionedDocument document = result.document();
            slugs.add(document instanceof LanguageOverlay
                    ? document.getSlug() + "/" + ((LanguageOverlay) document).getLanguage()
                    : document.getSlug());
        }
        return slugs;
    }
}
