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

import static org.esbtools.templatestore.testing.JsonTrees.object;

import org.esbtools.templatestore.DocumentKind;
import org.esbtools.templatestore.DocumentService;
import org.esbtools.templatestore.MutableDomainLanguages;
import org.esbtools.templatestore.MutableTemplateStoreConfig;
import org.esbtools.templatestore.UpsertResult;
import org.esbtools.templatestore.testing.InMemoryDocumentStore;
import org.esbtools.templatestore.testing.InMemoryInstancePins;

import com.google.common.collect.ImmutableMap;
import com.google.common.truth.Truth;
import com.jayway.awaitility.Awaitility;
import org.apache.camel.EndpointInject;
import org.apache.camel.builder.RouteBuilder;
import org.apache.camel.component.mock.MockEndpoint;
import org.apache.camel.test.junit4.CamelTestSupport;
import org.hamcrest.Matchers;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

public class PollingSourceTreeImportRouteTest extends CamelTestSupport {
    InMemoryDocumentStore store = new InMemoryDocumentStore();
    MutableTemplateStoreConfig config = new MutableTemplateStoreConfig();
    DocumentService documentService = new DocumentService(store,
            new MutableDomainLanguages().setDefaultLanguage("demo", "en"),
            new InMemoryInstancePins(), config);

    List<SourceRecord> sourceTree = new CopyOnWriteArrayList<>();

    @EndpointInject("mock:imported")
    MockEndpoint importedEndpoint;

    @EndpointInject("mock:failures")
    MockEndpoint failureEndpoint;

    @Override
    protected RouteBuilder createRouteBuilder() throws Exception {
        return new PollingSourceTreeImportRoute(() -> new ArrayList<>(sourceTree),
                new BatchImporter(documentService, config), Duration.ofMillis(500),
                "mock:imported", "mock:failures");
    }

    @Test
    public void shouldImportRecordsAddedToTheSourceTreeInPeriodicIntervals() throws Exception {
        importedEndpoint.expectedMessageCount(4);

        sourceTree.add(codeList("colors"));
        Thread.sleep(2000);
        sourceTree.add(codeList("sizes"));

        importedEndpoint.assertIsSatisfied();
    }

    @Test
    public void shouldNotSendUnchangedDocumentsAgain() throws Exception {
        importedEndpoint.expectedMessageCount(2);
        importedEndpoint.setAssertPeriod(3000);

        sourceTree.add(codeList("colors"));

        importedEndpoint.assertIsSatisfied();
        Truth.assertThat(importedEndpoint.getReceivedExchanges().get(0).getIn()
                .getBody(UpsertResult.class).outcome()).isEqualTo(UpsertResult.Outcome.INSERTED);
    }

    @Test
    public void shouldSendFailedImportsToTheFailureEndpointButImportRest() throws Exception {
        importedEndpoint.expectedMessageCount(2);
        failureEndpoint.expectedMinimumMessageCount(1);

        sourceTree.add(new SourceRecord("broken", "demo", DocumentKind.BASE_TEMPLATE,
                object("{'aspects': [{'name': 'x', 'type': 'blob'}]}"), Collections.emptyList(),
                null, Collections.emptyMap()));
        sourceTree.add(codeList("colors"));

        importedEndpoint.assertIsSatisfied();
        failureEndpoint.assertIsSatisfied();

        FailedImport failure = failureEndpoint.getReceivedExchanges().get(0).getIn()
                .getBody(FailedImport.class);
        Truth.assertThat(failure.record().slug()).isEqualTo("broken");
    }

    @Test
    public void shouldCommitImportedDocumentsToTheStore() throws Exception {
        sourceTree.add(codeList("colors"));

        Awaitility.await().atMost(5, TimeUnit.SECONDS)
                .until(() -> store.overlaysOf("colors"), Matchers.hasSize(1));
    }

    private static SourceRecord codeList(String slug) {
        return new SourceRecord(slug, "demo", DocumentKind.BASE_CODE,
                object("{'values': ['a', 'b']}"), Collections.emptyList(), null,
                ImmutableMap.of("en", object("{'values': ['A', 'B']}")));
    }
}
