/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.antarctic.atsdocs.shared;

import org.antarctic.atsdocs.phase1.listing.MetadataCrawler;
import org.antarctic.atsdocs.phase2.fetch.DocumentFetcher;
import org.antarctic.atsdocs.phase2.fetch.FetchReport;
import org.antarctic.atsdocs.phase3.reconcile.ReconciledRecord;
import org.antarctic.atsdocs.phase3.reconcile.Reconciler;
import org.antarctic.atsdocs.phase4.measures.MeasureCrawler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Collects the ATS document corpus.
 * <p>
 * The work is split into four phases:
 * 1. Metadata phase: Crawls the paginated listing, or loads earlier snapshots
 * 2. Documents phase: Fetches the language variants of every paper that are not on disk yet
 * 3. Reconcile phase: Attributes the fetched files to their metadata record
 * 4. Measures phase: Crawls the measure pages, independent of phases 1-3
 * <p>
 * All output directories must exist when the pipeline is created.
 */
public class CorpusPipeline {

    private static final Logger logger = LoggerFactory.getLogger(CorpusPipeline.class);

    private final Configuration config;
    private final RequestThrottle throttle;
    private final ArtifactIndex documentIndex;
    private final MetadataCrawler metadataCrawler;
    private final DocumentFetcher documentFetcher;
    private final Reconciler reconciler;
    private final MeasureCrawler measureCrawler;

    /**
     * @throws java.nio.file.NoSuchFileException if an output directory does not exist
     */
    public CorpusPipeline(Configuration config) throws IOException {
        this.config = config;
        OutputFiles.requireDirectory(config.getDocumentsPath());
        OutputFiles.requireDirectory(config.getMeasuresPath());
        OutputFiles.requireDirectory(config.getReportsPath());

        // One throttle for all crawlers, since they talk to the same hosts
        this.throttle = new RequestThrottle(config.getRequestIntervalMs());
        this.documentIndex = ArtifactIndex.scan(config.getDocumentsPath());
        this.metadataCrawler = new MetadataCrawler(config, throttle);
        this.documentFetcher = new DocumentFetcher(config, documentIndex, throttle, DocumentFetcher.newRandom(config));
        this.reconciler = new Reconciler();
        this.measureCrawler = new MeasureCrawler(config, throttle);
    }

    /**
     * Phase 1: Returns the metadata corpus, crawling the listing only when no usable snapshot exists.
     */
    public List<CanonicalRecord> collectMetadata() throws IOException {
        banner("Phase 1: Collecting paper metadata...");
        List<CanonicalRecord> corpus = metadataCrawler.collect(config.getDocumentsPath());
        logger.info("Metadata corpus holds {} papers", corpus.size());
        return corpus;
    }

    /**
     * Phase 2: Fetches the documents of the corpus and writes the fetch report.
     */
    public FetchReport fetchDocuments(List<CanonicalRecord> corpus) throws IOException {
        banner("Phase 2: Fetching documents of " + corpus.size() + " papers...");
        FetchReport report = documentFetcher.fetchBatch(corpus);
        report.writeCsv(config.getReportsPath(), config.isWriteLatestCopy());
        return report;
    }

    /**
     * Phase 3: Reconciles the documents on disk with the corpus and writes the reconciliation reports.
     */
    public List<ReconciledRecord> reconcile(List<CanonicalRecord> corpus) throws IOException {
        banner("Phase 3: Reconciling documents with metadata...");
        documentIndex.refresh();
        List<ReconciledRecord> results = reconciler.reconcileDirectory(
            documentIndex, config.getDocumentExtensions(), corpus);
        reconciler.writeReports(results, config.getReportsPath(), config.isWriteLatestCopy());
        return results;
    }

    /**
     * Phase 4: Crawls the configured range of measure ids.
     */
    public List<Path> crawlMeasures() throws IOException {
        banner("Phase 4: Crawling measures " + config.getFirstMeasureId() + " to " + config.getLastMeasureId() + "...");
        return measureCrawler.crawlRange(config.getFirstMeasureId(), config.getLastMeasureId(), config.getMeasuresPath());
    }

    /**
     * Runs all four phases in order.
     */
    public void runAll() throws IOException {
        List<CanonicalRecord> corpus = collectMetadata();
        FetchReport report = fetchDocuments(corpus);
        if (report.isAborted()) {
            logger.warn("Document fetch was aborted, reconciling what is on disk");
        }
        reconcile(corpus);
        crawlMeasures();
        banner("All phases completed");
    }

    private static void banner(String message) {
        logger.info("=".repeat(60));
        logger.info(message);
        logger.info("=".repeat(60));
    }

    /**
     * Closes all HTTP clients.
     */
    public void close() {
        logger.info("Stopping corpus pipeline...");
        metadataCrawler.close();
        documentFetcher.close();
        measureCrawler.close();
    }
}
