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

import static com.google.common.truth.Truth.assertThat;
import static org.esbtools.templatestore.testing.JsonTrees.object;
import static org.junit.Assert.fail;

import org.esbtools.templatestore.aspect.ParseMode;
import org.esbtools.templatestore.testing.InMemoryDocumentStore;
import org.esbtools.templatestore.testing.InMemoryInstancePins;
import org.esbtools.templatestore.testing.TestLogger;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@RunWith(JUnit4.class)
public class DocumentServiceTest {
    @Rule
    public TestLogger testLogger = new TestLogger();

    @Rule
    public ExpectedException expectedException = ExpectedException.none();

    InMemoryDocumentStore store = new InMemoryDocumentStore();
    InMemoryInstancePins instancePins = new InMemoryInstancePins();
    MutableDomainLanguages domainLanguages = new MutableDomainLanguages()
            .setDefaultLanguage("demo", "en");
    MutableTemplateStoreConfig config = new MutableTemplateStoreConfig();

    DocumentService service = new DocumentService(store, domainLanguages, instancePins, config);

    static final ObjectNode BIRD_OBS_V1 =
            object("{'aspects': [{'name': 'count', 'type': 'int'}]}");
    static final ObjectNode BIRD_OBS_V2 = object("{'aspects': [{'name': 'count', 'type': 'int'}, " +
            "{'name': 'color', 'type': 'select', 'items': 'colors'}]}");
    static final ObjectNode BIRD_OBS_EN = object("{'title': 'Bird observation', " +
            "'aspects': [{'label': 'Count'}, {'label': 'Color'}]}");

    @Test
    public void shouldInsertNewDocumentsAtVersionOne() {
        UpsertResult result = service.updateOrInsert(birdObs(BIRD_OBS_V1));

        assertThat(result.outcome()).isEqualTo(UpsertResult.Outcome.INSERTED);
        assertThat(result.version()).isEqualTo(1);
        assertThat(store.findBase("bird_obs").get().getContent()).isEqualTo(BIRD_OBS_V1);
    }

    @Test
    public void shouldNotCommitUnchangedDocuments() {
        service.updateOrInsert(birdObs(BIRD_OBS_V1));
        int savesBefore = store.getSaveCount();

        UpsertResult result = service.updateOrInsert(birdObs(BIRD_OBS_V1.deepCopy()));

        assertThat(result.outcome()).isEqualTo(UpsertResult.Outcome.UNCHANGED);
        assertThat(result.version()).isEqualTo(1);
        assertThat(store.getSaveCount()).isEqualTo(savesBefore);
    }

    @Test
    public void shouldCreateVersionsOfStructuralDocuments() {
        saveColors();
        service.updateOrInsert(birdObs(BIRD_OBS_V1));

        UpsertResult result = service.updateOrInsert(birdObs(BIRD_OBS_V2));

        assertThat(result.outcome()).isEqualTo(UpsertResult.Outcome.UPDATED);
        assertThat(result.version()).isEqualTo(2);
        assertThat(service.getVersion("bird_obs", null, 1)).isEqualTo(BIRD_OBS_V1);
        assertThat(service.getVersion("bird_obs", null, 2)).isEqualTo(BIRD_OBS_V2);
    }

    @Test
    public void shouldRejectInvalidAspectsWithoutCommitting() {
        try {
            service.updateOrInsert(birdObs(object("{'aspects': [{'name': 'x', 'type': 'blob'}]}")));
            fail("Expected invalid aspects to be rejected");
        } catch (AspectParseException e) {
            assertThat(store.findBase("bird_obs").isPresent()).isFalse();
        }
    }

    @Test
    public void shouldUseTheParseModeOfEachCall() {
        ObjectNode withExtraAttribute =
                object("{'aspects': [{'name': 'count', 'type': 'int', 'colour_hint': 'red'}]}");

        try {
            service.updateOrInsert(birdObs(withExtraAttribute), ParseMode.STRICT);
            fail("Expected strict parsing to reject unknown attributes");
        } catch (AspectParseException expected) {
            // continue with a lenient write
        }

        assertThat(service.updateOrInsert(birdObs(withExtraAttribute), ParseMode.LENIENT)
                .outcome()).isEqualTo(UpsertResult.Outcome.INSERTED);
        assertThat(config.getDefaultParseMode()).isEqualTo(ParseMode.STRICT);
    }

    @Test
    public void shouldPinLanguageOverlaysToTheLatestBaseVersion() {
        saveColors();
        service.updateOrInsert(birdObs(BIRD_OBS_V1));
        service.updateOrInsert(birdObs(BIRD_OBS_V2));

        UpsertResult result = service.updateOrInsert(birdObsIn("en", BIRD_OBS_EN));

        LanguageOverlay overlay = (LanguageOverlay) result.document();
        assertThat(result.outcome()).isEqualTo(UpsertResult.Outcome.INSERTED);
        assertThat(overlay.getKind()).isEqualTo(DocumentKind.TEMPLATE);
        assertThat(overlay.getTemplateVersion()).isEqualTo(2);
        assertThat(store.findOverlay("bird_obs", "en").get().getTemplateVersion()).isEqualTo(2);
    }

    @Test
    public void shouldRejectLanguageOverlaysWhichDoNotFitTheBase() {
        service.updateOrInsert(birdObs(BIRD_OBS_V1));

        try {
            service.updateOrInsert(birdObsIn("en", BIRD_OBS_EN));
            fail("Expected the overlay not to fit");
        } catch (MergeException e) {
            assertThat(e.reason()).isEqualTo(MergeException.Reason.STRUCTURAL_MISMATCH);
            assertThat(e.path().toString()).isEqualTo("aspects.1");
        }

        assertThat(store.findOverlay("bird_obs", "en").isPresent()).isFalse();
    }

    @Test
    public void shouldRequireTheBaseDocumentOfLanguageOverlays() {
        expectedException.expect(NotFoundException.class);

        service.updateOrInsert(birdObsIn("en", BIRD_OBS_EN));
    }

    @Test
    public void shouldMarkIncompleteTranslationsAsDrafts() {
        saveColors();
        service.updateOrInsert(birdObs(BIRD_OBS_V2));
        service.updateOrInsert(birdObsIn("en", BIRD_OBS_EN));

        UpsertResult german = service.updateOrInsert(birdObsIn("de", object(
                "{'title': 'Vogelbeobachtung', 'aspects': [{'label': 'Anzahl'}, {'label': ''}]}")));
        UpsertResult french = service.updateOrInsert(birdObsIn("fr", object(
                "{'title': 'Observation', 'aspects': [{'label': 'Nombre'}, {'label': 'Couleur'}]}")));

        assertThat(((LanguageOverlay) german.document()).getStatus())
                .isEqualTo(PublicationStatus.DRAFT);
        assertThat(((LanguageOverlay) french.document()).getStatus())
                .isEqualTo(PublicationStatus.PUBLISHED);
    }

    @Test
    public void shouldFailOnUnresolvableReferencesWithoutCommitting() {
        DocumentModel model = birdObs(BIRD_OBS_V1)
                .withReferences(Arrays.asList(Reference.code("missing")));

        try {
            service.updateOrInsert(model);
            fail("Expected the reference not to resolve");
        } catch (NotFoundException e) {
            assertThat(e.tried()).containsExactly(DocumentRef.bySlug("missing"));
        }

        assertThat(store.findBase("bird_obs").isPresent()).isFalse();
    }

    @Test
    public void shouldWrapStoreFailures() {
        store.failSaves();

        expectedException.expect(StoreCommitException.class);

        service.updateOrInsert(birdObs(BIRD_OBS_V1));
    }

    @Test
    public void shouldNotifyCommitListenersOfCommittedDocumentsOnly() {
        List<UpsertResult> committed = new ArrayList<>();
        service.onDocumentCommitted(committed::add);

        service.updateOrInsert(birdObs(BIRD_OBS_V1));
        service.updateOrInsert(birdObs(BIRD_OBS_V1));

        assertThat(committed).hasSize(1);
        assertThat(committed.get(0).outcome()).isEqualTo(UpsertResult.Outcome.INSERTED);
    }

    @Test
    public void shouldKeepDocumentsCommittedWhenAListenerFails() {
        service.onDocumentCommitted(result -> {
            throw new IllegalStateException("Simulated listener failure");
        });

        service.updateOrInsert(birdObs(BIRD_OBS_V1));

        assertThat(store.findBase("bird_obs").isPresent()).isTrue();
    }

    @Test
    public void shouldMergeDocumentsFallingBackToTheDefaultLanguage() {
        saveColors();
        service.updateOrInsert(birdObs(BIRD_OBS_V2));
        service.updateOrInsert(birdObsIn("en", BIRD_OBS_EN));

        MergedDocument merged = service.mergedDocument("bird_obs", "fr");

        assertThat(merged.servedLanguage()).isEqualTo("en");
        assertThat(merged.isFallbackLanguage()).isTrue();
        assertThat(merged.isOutdated()).isFalse();
        assertThat(merged.content().get("aspects").get(1)).isEqualTo(
                object("{'name': 'color', 'type': 'select', 'items': 'colors', 'label': 'Color'}"));
    }

    @Test
    public void shouldFlagMergedDocumentsWhoseBaseMovedOn() {
        saveColors();
        service.updateOrInsert(birdObs(BIRD_OBS_V1));
        service.updateOrInsert(birdObs(BIRD_OBS_V2));
        service.updateOrInsert(birdObsIn("en", BIRD_OBS_EN));

        ObjectNode v3 = BIRD_OBS_V2.deepCopy();
        v3.put("description", "changed");
        service.updateOrInsert(birdObs(v3));

        MergedDocument merged = service.mergedDocument("bird_obs", "en");

        assertThat(merged.version()).isEqualTo(3);
        assertThat(merged.overlay().getTemplateVersion()).isEqualTo(2);
        assertThat(merged.isOutdated()).isTrue();
    }

    @Test
    public void shouldReturnTheHistoryOfALanguageOverlay() {
        service.updateOrInsert(birdObs(BIRD_OBS_V1));
        service.updateOrInsert(birdObsIn("en", object("{'aspects': [{'label': 'Count'}]}")));
        instancePins.pin("bird_obs", "en", "observation-1", 1);

        service.updateOrInsert(birdObsIn("en", object("{'aspects': [{'label': 'Number'}]}")));

        assertThat(service.getVersion("bird_obs", "en", 1))
                .isEqualTo(object("{'aspects': [{'label': 'Count'}]}"));
        assertThat(service.getVersion("bird_obs", "en", 2))
                .isEqualTo(object("{'aspects': [{'label': 'Number'}]}"));
    }

    @Test
    public void shouldSmashVersionsAndRepinOverlays() {
        saveColors();
        service.updateOrInsert(birdObs(BIRD_OBS_V1));
        service.updateOrInsert(birdObs(BIRD_OBS_V2));
        service.updateOrInsert(birdObsIn("en", BIRD_OBS_EN));

        assertThat(service.smashVersion("bird_obs")).isTrue();

        assertThat(store.findBase("bird_obs").get().getVersion()).isEqualTo(1);
        assertThat(store.findBase("bird_obs").get().getContent()).isEqualTo(BIRD_OBS_V2);
        assertThat(store.findOverlay("bird_obs", "en").get().getTemplateVersion()).isEqualTo(1);
        assertThat(service.smashVersion("bird_obs")).isFalse();
    }

    @Test
    public void shouldKeepOverlaysPinnedWhenASmashCannotBeSaved() {
        saveColors();
        service.updateOrInsert(birdObs(BIRD_OBS_V1));
        service.updateOrInsert(birdObs(BIRD_OBS_V2));
        service.updateOrInsert(birdObsIn("en", BIRD_OBS_EN));
        store.failBaseSaves();

        try {
            service.smashVersion("bird_obs");
            fail("Expected the smashed document not to be saved");
        } catch (StoreCommitException expected) {
            // nothing was committed
        }

        assertThat(store.findBase("bird_obs").get().getVersion()).isEqualTo(2);
        assertThat(store.findOverlay("bird_obs", "en").get().getTemplateVersion()).isEqualTo(2);
        assertThat(service.mergedDocument("bird_obs", "en").isOutdated()).isFalse();
    }

    @Test
    public void shouldNotMoveDocumentsBetweenDomains() {
        service.updateOrInsert(birdObs(BIRD_OBS_V1));

        expectedException.expect(TemplateStoreException.class);
        expectedException.expectMessage("already exists in domain demo");

        service.updateOrInsert(DocumentModel.structural("bird_obs", "other",
                DocumentKind.BASE_TEMPLATE, BIRD_OBS_V1));
    }

    private void saveColors() {
        service.updateOrInsert(DocumentModel.structural("colors", "demo", DocumentKind.BASE_CODE,
                object("{'values': ['red', 'green']}")));
    }

    private static DocumentModel birdObs(ObjectNode content) {
        return DocumentModel.structural("bird_obs", "demo", DocumentKind.BASE_TEMPLATE, content);
    }

    private static DocumentModel birdObsIn(String language, ObjectNode content) {
        return DocumentModel.languageOverlay("bird_obs", "demo", language, content);
    }
}
