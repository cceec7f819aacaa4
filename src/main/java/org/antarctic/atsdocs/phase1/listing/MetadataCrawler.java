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
package org.antarctic.atsdocs.phase1.listing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.core5.http.HttpEntity;
import org.antarctic.atsdocs.shared.CanonicalRecord;
import org.antarctic.atsdocs.shared.Configuration;
import org.antarctic.atsdocs.shared.HttpClientFactory;
import org.antarctic.atsdocs.shared.OutputFiles;
import org.antarctic.atsdocs.shared.RequestThrottle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Phase 1: Collects working paper metadata from the paginated listing endpoint.
 * <p>
 * The crawl follows the pager until it stops advancing, deduplicates records by their canonical
 * serialization and persists a timestamped snapshot. A non-empty snapshot from an earlier run
 * short-circuits the crawl. A failed request aborts the whole crawl without writing a snapshot,
 * since a partial listing cannot be told apart from a complete one later.
 */
public class MetadataCrawler {

    private static final Logger logger = LoggerFactory.getLogger(MetadataCrawler.class);

    // Sorted properties and map keys give every record one stable textual form
    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private final Configuration config;
    private final CloseableHttpClient httpClient;
    private final RequestThrottle throttle;
    private final MetadataSnapshotStore snapshotStore;
    private final ObjectMapper objectMapper;

    public MetadataCrawler(Configuration config) {
        this(config, new RequestThrottle(config.getRequestIntervalMs()));
    }

    public MetadataCrawler(Configuration config, RequestThrottle throttle) {
        this.config = config;
        this.throttle = throttle;
        this.snapshotStore = new MetadataSnapshotStore();
        this.objectMapper = new ObjectMapper();
        this.httpClient = HttpClientFactory.create(
                config.getConnectTimeoutMs(), config.getReadTimeoutMs(), config.getUserAgent(), 1);
    }

    /**
     * Returns the metadata corpus for the directory: loaded from existing snapshots when there are
     * any (and they are not stale), otherwise crawled from page 1 and saved as a new snapshot.
     * <p>
     * With a snapshot age limit, snapshots are successive versions of the listing and only the
     * newest one is read. Without it, all snapshots are combined.
     */
    public List<CanonicalRecord> collect(Path directory) throws IOException {
        OutputFiles.requireDirectory(directory);

        List<CanonicalRecord> existing = deduplicate(config.getSnapshotMaxAgeHours() > 0
            ? snapshotStore.loadNewest(directory)
            : snapshotStore.loadAll(directory));
        if (!existing.isEmpty() && !isStale(directory)) {
            logger.info("Metadata for {} unique papers found in {}, skipping listing crawl",
                existing.size(), directory);
            return existing;
        }

        List<CanonicalRecord> crawled = crawl(1);
        snapshotStore.write(directory, crawled);
        return crawled;
    }

    /**
     * Walks the listing from the given page until the pager stops advancing.
     *
     * @return the deduplicated records in listing order
     * @throws IOException if any page cannot be fetched or parsed
     */
    public List<CanonicalRecord> crawl(int startPage) throws IOException {
        logger.info("Starting listing crawl at page {}", startPage);
        List<CanonicalRecord> papers = new ArrayList<>();
        ListingCursor cursor = ListingCursor.startAt(startPage);

        while (!cursor.isFinished()) {
            ListingPage page = fetchPage(cursor.getCurrentPage());
            papers.addAll(page.getPayload());
            logger.info("Page {}: {} listings, {} collected so far",
                cursor.getCurrentPage(), page.getPayload().size(), papers.size());
            cursor = cursor.advance(page.nextPage());
        }

        List<CanonicalRecord> unique = deduplicate(papers);
        logger.info("Listing crawl finished at page {}: {} listings, {} unique",
            cursor.getCurrentPage(), papers.size(), unique.size());
        return unique;
    }

    ListingPage fetchPage(int page) throws IOException {
        String url = pageUrl(page);
        logger.info("Requesting listing page {}", url);
        acquire(url);

        HttpGet request = new HttpGet(url);
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int status = response.getCode();
            if (status < 200 || status >= 300) {
                throw new IOException("Listing page " + url + " returned HTTP " + status);
            }
            HttpEntity entity = response.getEntity();
            if (entity == null) {
                throw new IOException("No content received from: " + url);
            }
            try (InputStream content = entity.getContent()) {
                ListingPage listingPage = objectMapper.readValue(content, ListingPage.class);
                if (listingPage.getPager() == null) {
                    logger.warn("Listing page {} has no pager, treating it as the last page", page);
                }
                return listingPage;
            }
        }
    }

    String pageUrl(int page) {
        String base = config.getListingUrl();
        return base + (base.contains("?") ? "&" : "?") + "page=" + page;
    }

    /**
     * Keeps the first record of every distinct canonical serialization, preserving order.
     */
    public static List<CanonicalRecord> deduplicate(List<CanonicalRecord> records) {
        Map<String, CanonicalRecord> unique = new LinkedHashMap<>();
        for (CanonicalRecord record : records) {
            unique.putIfAbsent(canonicalForm(record), record);
        }
        return new ArrayList<>(unique.values());
    }

    /**
     * Returns the stable, key-ordered JSON form of a record.
     */
    public static String canonicalForm(CanonicalRecord record) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize " + record, e);
        }
    }

    private boolean isStale(Path directory) throws IOException {
        int maxAgeHours = config.getSnapshotMaxAgeHours();
        if (maxAgeHours <= 0) {
            return false;
        }
        Optional<FileTime> newest = snapshotStore.newestModification(directory);
        if (newest.isEmpty()) {
            return true;
        }
        Duration age = Duration.between(newest.get().toInstant(), Instant.now());
        if (age.toHours() >= maxAgeHours) {
            logger.info("Newest metadata snapshot is {} hours old (limit {}), crawling again",
                age.toHours(), maxAgeHours);
            return true;
        }
        return false;
    }

    private void acquire(String url) throws InterruptedIOException {
        try {
            throttle.acquire(url);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting to request " + url);
        }
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
