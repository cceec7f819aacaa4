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
package org.antarctic.atsdocs.phase2.fetch;

import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.core5.http.HttpEntity;
import org.antarctic.atsdocs.shared.ArtifactIndex;
import org.antarctic.atsdocs.shared.CanonicalRecord;
import org.antarctic.atsdocs.shared.Configuration;
import org.antarctic.atsdocs.shared.DocumentVariant;
import org.antarctic.atsdocs.shared.HttpClientFactory;
import org.antarctic.atsdocs.shared.OutputFiles;
import org.antarctic.atsdocs.shared.RequestThrottle;
import org.antarctic.atsdocs.shared.UrlResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Phase 2: Fetches the language variants of working papers into a flat output directory.
 * <p>
 * Variants whose file already exists are skipped before any request is made, so a resumed run
 * never does more network work than a fresh one. A timeout skips the variant; any other transport
 * error fails the record, and the batch driver carries on with the next record.
 */
public class DocumentFetcher {

    private static final Logger logger = LoggerFactory.getLogger(DocumentFetcher.class);

    private final Configuration config;
    private final ArtifactIndex index;
    private final UrlResolver urlResolver;
    private final RequestThrottle throttle;
    private final Random random;
    private final CloseableHttpClient httpClient;

    public DocumentFetcher(Configuration config, ArtifactIndex index) {
        this(config, index, new RequestThrottle(config.getRequestIntervalMs()), newRandom(config));
    }

    /**
     * @param random source of the batch order; pass a seeded instance for a reproducible order
     */
    public DocumentFetcher(Configuration config, ArtifactIndex index, RequestThrottle throttle, Random random) {
        this.config = config;
        this.index = index;
        this.urlResolver = new UrlResolver(config.getDocumentBaseUrl());
        this.throttle = throttle;
        this.random = random;
        this.httpClient = HttpClientFactory.create(
                config.getDocumentConnectTimeoutMs(), config.getDocumentReadTimeoutMs(),
                config.getUserAgent(), Math.max(1, config.getFetchConcurrency()));
    }

    /**
     * Returns a {@link Random} seeded from {@code shuffleSeed}, or an unseeded one when none is configured.
     */
    public static Random newRandom(Configuration config) {
        return config.getShuffleSeed() != null ? new Random(config.getShuffleSeed()) : new Random();
    }

    /**
     * Fetches the batch in shuffled order, isolating each record's failure.
     * Records are spread over {@code fetchConcurrency} workers; one worker reproduces the
     * strictly sequential behaviour.
     */
    public FetchReport fetchBatch(List<CanonicalRecord> records) {
        List<CanonicalRecord> ordered = shuffle(records);
        int workers = Math.max(1, config.getFetchConcurrency());
        int abortThreshold = config.getAbortAfterConsecutiveFailures();
        logger.info("Fetching documents for {} papers into {} with {} worker(s)",
            ordered.size(), index.getDirectory(), workers);

        FetchReport report = new FetchReport();
        AtomicBoolean aborted = new AtomicBoolean(false);
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        List<Future<RecordOutcome>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < ordered.size(); i++) {
                CanonicalRecord record = ordered.get(i);
                int position = i + 1;
                futures.add(pool.submit(() -> {
                    if (aborted.get()) {
                        RecordOutcome skipped = RecordOutcome.aborted(record);
                        report.add(skipped);
                        return skipped;
                    }
                    RecordOutcome outcome = fetchRecord(record, position, ordered.size());
                    int failureStreak = report.add(outcome);
                    if (abortThreshold > 0 && failureStreak >= abortThreshold && aborted.compareAndSet(false, true)) {
                        logger.error("{} consecutive records failed, aborting the remaining batch", failureStreak);
                        report.markAborted();
                    }
                    return outcome;
                }));
            }
            pool.shutdown();
            for (Future<RecordOutcome> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Fetch batch interrupted, {} of {} records processed",
                report.getOutcomes().size(), ordered.size());
            report.markAborted();
        } catch (ExecutionException e) {
            logger.error("Unexpected error in fetch worker: {}", e.getCause().getMessage(), e.getCause());
        } finally {
            pool.shutdownNow();
        }

        report.logSummary();
        return report;
    }

    /**
     * Returns a uniformly shuffled copy of the records.
     */
    public List<CanonicalRecord> shuffle(List<CanonicalRecord> records) {
        List<CanonicalRecord> ordered = new ArrayList<>(records);
        synchronized (random) {
            Collections.shuffle(ordered, random);
        }
        return ordered;
    }

    private RecordOutcome fetchRecord(CanonicalRecord record, int position, int total) {
        MDC.put("paperId", String.valueOf(record.getPaperId()));
        try {
            logger.info("Fetching primary documents of paper {} ({}/{})", record.getPaperId(), position, total);
            return RecordOutcome.completed(record, fetchAll(record));
        } catch (IOException | RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                logger.warn("Interrupted while fetching paper {}", record.getPaperId());
            } else {
                logger.error("Failed to fetch documents of paper {}: {}", record.getPaperId(), e.getMessage());
            }
            return RecordOutcome.failed(record, e);
        } finally {
            MDC.remove("paperId");
        }
    }

    /**
     * Fetches the four language variants of one record.
     *
     * @return one result per variant, in language order
     * @throws IOException on a transport error other than a timeout
     */
    public List<FetchResult> fetchAll(CanonicalRecord record) throws IOException {
        List<FetchResult> results = new ArrayList<>();
        for (DocumentVariant variant : urlResolver.resolve(record)) {
            String filename = outputFilename(variant.getUrl());
            if (config.isSkipExisting() && index.contains(filename)) {
                logger.debug("Already present, skipping: {}", filename);
                results.add(FetchResult.skippedExisting(variant));
                continue;
            }
            results.add(fetchVariant(variant, filename));
        }
        return results;
    }

    private FetchResult fetchVariant(DocumentVariant variant, String filename) throws IOException {
        String url = variant.getUrl();
        acquire(url);
        HttpGet request = new HttpGet(url);
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int status = response.getCode();
            HttpEntity entity = response.getEntity();
            if (status < 200 || status >= 300 || entity == null) {
                logger.info("Not available ({}): {}", status, url);
                return FetchResult.notFound(variant, status);
            }

            Path target = index.resolve(filename);
            long bytes;
            try (InputStream content = entity.getContent()) {
                bytes = OutputFiles.writeNonEmptyAtomically(target, content);
            }
            if (bytes == 0) {
                logger.info("Empty response ({}), not saved: {}", status, url);
                return FetchResult.notFound(variant, status);
            }
            index.record(filename);
            logger.info("Saved {} ({} bytes)", filename, bytes);
            return FetchResult.fetched(variant, status, bytes);
        } catch (SocketTimeoutException e) {
            // Also covers ConnectTimeoutException, a subclass
            logger.warn("Timed out fetching {}: {}", url, e.getMessage());
            return FetchResult.timedOut(variant);
        }
    }

    /**
     * Returns the output filename for a document URL: its final path segment.
     */
    static String outputFilename(String url) {
        String path = url;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private void acquire(String url) throws InterruptedIOException {
        try {
            throttle.acquire(url);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting to request " + url);
        }
    }

    public ArtifactIndex getIndex() {
        return index;
    }

    /**
     * Closes the HTTP client.
     */
    public void close() {
        try {
            httpClient.close();
        } catch (IOException e) {
            logger.error("Error closing HTTP client: {}", e.getMessage());
        }
    }
}
