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

import org.esbtools.templatestore.UpsertResult;

import com.google.common.collect.Iterables;
import org.apache.camel.builder.RouteBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodically loads a source tree and imports it. Each committed write is sent to
 * {@code importedEndpoint} as an {@link UpsertResult}, each failure to {@code failureEndpoint}
 * as a {@link FailedImport}. Unchanged documents are not sent anywhere.
 */
public class PollingSourceTreeImportRoute extends RouteBuilder {
    private final SourceTreeLoader sourceTreeLoader;
    private final BatchImporter batchImporter;
    private final Duration pollingInterval;
    private final String importedEndpoint;
    private final String failureEndpoint;

    private static final AtomicInteger idCounter = new AtomicInteger(1);
    private final int id = idCounter.getAndIncrement();

    private static final Logger logger =
            LoggerFactory.getLogger(PollingSourceTreeImportRoute.class);

    public PollingSourceTreeImportRoute(SourceTreeLoader sourceTreeLoader,
            BatchImporter batchImporter, Duration pollingInterval, String importedEndpoint,
            String failureEndpoint) {
        this.sourceTreeLoader = sourceTreeLoader;
        this.batchImporter = batchImporter;
        this.pollingInterval = pollingInterval;
        this.importedEndpoint = importedEndpoint;
        this.failureEndpoint = failureEndpoint;
    }

    @Override
    public void configure() throws Exception {
        from("timer:pollSourceTree" + id + "?period=" + pollingInterval.toMillis())
        .routeId("sourceTreeImport-" + id)
        .process(exchange -> {
            List<SourceRecord> records = sourceTreeLoader.load();
            ImportReport report = batchImporter.importBatch(records);

            logger.debug("Import on route {} finished: {}", exchange.getFromRouteId(), report);

            Iterable<UpsertResult> committed = Iterables.filter(report.imported(),
                    result -> result.outcome() != UpsertResult.Outcome.UNCHANGED);

            exchange.getIn().setBody(Iterables.concat(committed, report.failed()));
        })
        .split(body())
        .streaming()
        .choice()
            .when(e -> e.getIn().getBody() instanceof FailedImport).to(failureEndpoint)
            .otherwise().to(importedEndpoint);
    }
}
