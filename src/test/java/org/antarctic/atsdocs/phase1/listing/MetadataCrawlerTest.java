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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.antarctic.atsdocs.shared.CanonicalRecord;
import org.antarctic.atsdocs.shared.Configuration;
import org.antarctic.atsdocs.shared.LocalHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Phase 1 - listing crawl against a local listing endpoint.
 */
public class MetadataCrawlerTest {

    private static final String JSON = "application/json";

    @TempDir
    Path tempDir;

    private LocalHttpServer server;
    private MetadataCrawler crawler;
    private final MetadataSnapshotStore store = new MetadataSnapshotStore();

    @BeforeEach
    public void setUp() throws IOException {
        server = LocalHttpServer.start();
        Configuration config = new Configuration();
        config.setListingUrl(server.baseUrl() + "/listing");
        config.setRequestIntervalMs(0);
        crawler = new MetadataCrawler(config);
    }

    @AfterEach
    public void tearDown() {
        crawler.close();
        server.close();
    }

    private static String paper(int id, int number) {
        return "{\"Paper_id\": " + id + ", \"Meeting_type\": \"ATCM\", \"Meeting_number\": \"40\", "
            + "\"Abbreviation\": \"WP\", \"Number\": " + number + ", \"Revision\": 0, \"Type\": \"pdf\", "
            + "\"Name\": \"Paper " + id + "\", \"Parties\": [{\"Name\": \"Chile\"}]}";
    }

    private static String page(Integer next, String... papers) {
        String pager = next != null ? "{\"next\": " + next + ", \"count\": 3}" : "{}";
        return "{\"payload\": [" + String.join(", ", papers) + "], \"pager\": " + pager + "}";
    }

    private static List<String> paperIds(List<CanonicalRecord> records) {
        return records.stream().map(CanonicalRecord::getPaperId).collect(Collectors.toList());
    }

    @Test
    public void testCrawlFollowsPagerAndDeduplicates() throws IOException {
        server.serve("/listing?page=1", 200, JSON, page(2, paper(1, 1), paper(2, 2)));
        server.serve("/listing?page=2", 200, JSON, page(3, paper(2, 2), paper(3, 3)));
        // The last page points back to an earlier one
        server.serve("/listing?page=3", 200, JSON, page(2, paper(3, 3)));

        List<CanonicalRecord> records = crawler.crawl(1);

        assertEquals(List.of("1", "2", "3"), paperIds(records));
        assertEquals(List.of("/listing?page=1", "/listing?page=2", "/listing?page=3"), server.getRequests());
        assertEquals("Chile", records.get(0).getPartyNames());
    }

    @Test
    public void testPageWithoutPagerIsTheLast() throws IOException {
        server.serve("/listing?page=1", 200, JSON, page(null, paper(1, 1)));

        List<CanonicalRecord> records = crawler.crawl(1);

        assertEquals(1, records.size());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    public void testFailedPageAbortsWithoutSnapshot() throws IOException {
        server.serve("/listing?page=1", 200, JSON, page(2, paper(1, 1)));
        server.serve("/listing?page=2", 500, JSON, "{}");

        assertThrows(IOException.class, () -> crawler.collect(tempDir));

        assertTrue(store.list(tempDir).isEmpty());
    }

    @Test
    public void testUnparseableJsonAbortsCrawl() {
        server.serve("/listing?page=1", 200, JSON, "<html>maintenance</html>");

        assertThrows(IOException.class, () -> crawler.crawl(1));
    }

    @Test
    public void testCollectWritesSnapshotAndReusesIt() throws IOException {
        server.serve("/listing?page=1", 200, JSON, page(null, paper(1, 1), paper(2, 2)));

        List<CanonicalRecord> first = crawler.collect(tempDir);
        assertEquals(1, store.list(tempDir).size());
        assertEquals(1, server.getRequestCount());

        List<CanonicalRecord> second = crawler.collect(tempDir);

        assertEquals(1, server.getRequestCount());
        assertEquals(paperIds(first), paperIds(second));
    }

    @Test
    public void testExistingSnapshotsAreCombinedWithoutRequests() throws IOException {
        Files.writeString(tempDir.resolve("2023-01-01-00-00-00_papers_metadata.json"),
            "[" + paper(1, 1) + ", " + paper(2, 2) + "]");
        Files.writeString(tempDir.resolve("2023-02-01-00-00-00_papers_metadata.json"),
            "[" + paper(2, 2) + ", " + paper(3, 3) + "]");

        List<CanonicalRecord> records = crawler.collect(tempDir);

        assertEquals(0, server.getRequestCount());
        assertEquals(List.of("1", "2", "3"), paperIds(records));
    }

    @Test
    public void testEmptySnapshotDoesNotShortCircuit() throws IOException {
        Files.writeString(tempDir.resolve("2023-01-01-00-00-00_papers_metadata.json"), "[]");
        server.serve("/listing?page=1", 200, JSON, page(null, paper(1, 1)));

        List<CanonicalRecord> records = crawler.collect(tempDir);

        assertEquals(1, records.size());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    public void testStaleSnapshotIsReplacedByNewerVersion() throws IOException {
        Configuration config = new Configuration();
        config.setListingUrl(server.baseUrl() + "/listing");
        config.setRequestIntervalMs(0);
        config.setSnapshotMaxAgeHours(1);
        MetadataCrawler refreshingCrawler = new MetadataCrawler(config);
        try {
            Path old = tempDir.resolve("2023-01-01-00-00-00_papers_metadata.json");
            Files.writeString(old, "[" + paper(1, 7).replace("Paper 1", "Old title") + "]");
            Files.setLastModifiedTime(old, FileTime.from(Instant.now().minus(5, ChronoUnit.HOURS)));
            server.serve("/listing?page=1", 200, JSON, page(null, paper(1, 7).replace("Paper 1", "New title")));

            List<CanonicalRecord> crawled = refreshingCrawler.collect(tempDir);
            assertEquals(1, server.getRequestCount());
            assertEquals(2, store.list(tempDir).size());
            assertEquals(1, crawled.size());

            // Within the age limit only the newest snapshot is read, so the paper is not duplicated
            List<CanonicalRecord> reloaded = refreshingCrawler.collect(tempDir);
            assertEquals(1, server.getRequestCount());
            assertEquals(1, reloaded.size());
            assertEquals("New title", reloaded.get(0).getName());
        } finally {
            refreshingCrawler.close();
        }
    }

    @Test
    public void testFreshSnapshotWithinAgeLimitSkipsCrawl() throws IOException {
        Configuration config = new Configuration();
        config.setListingUrl(server.baseUrl() + "/listing");
        config.setRequestIntervalMs(0);
        config.setSnapshotMaxAgeHours(24);
        MetadataCrawler refreshingCrawler = new MetadataCrawler(config);
        try {
            Files.writeString(tempDir.resolve("2023-01-01-00-00-00_papers_metadata.json"), "[" + paper(1, 1) + "]");

            List<CanonicalRecord> records = refreshingCrawler.collect(tempDir);

            assertEquals(0, server.getRequestCount());
            assertEquals(List.of("1"), paperIds(records));
        } finally {
            refreshingCrawler.close();
        }
    }

    @Test
    public void testMissingDirectoryFailsBeforeAnyRequest() {
        assertThrows(NoSuchFileException.class, () -> crawler.collect(tempDir.resolve("missing")));
        assertEquals(0, server.getRequestCount());
    }

    @Test
    public void testCanonicalFormIgnoresKeyOrderAndKeepsUnknownFields() throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        CanonicalRecord a = mapper.readValue(
            "{\"Paper_id\": 9, \"Type\": \"pdf\", \"Extra\": {\"b\": 1, \"a\": 2}, \"Number\": 4}", CanonicalRecord.class);
        CanonicalRecord b = mapper.readValue(
            "{\"Number\": 4, \"Extra\": {\"a\": 2, \"b\": 1}, \"Type\": \"pdf\", \"Paper_id\": 9}", CanonicalRecord.class);
        CanonicalRecord c = mapper.readValue(
            "{\"Number\": 4, \"Extra\": {\"a\": 3, \"b\": 1}, \"Type\": \"pdf\", \"Paper_id\": 9}", CanonicalRecord.class);

        assertEquals(MetadataCrawler.canonicalForm(a), MetadataCrawler.canonicalForm(b));
        assertNotEquals(MetadataCrawler.canonicalForm(a), MetadataCrawler.canonicalForm(c));
        assertEquals(1, MetadataCrawler.deduplicate(List.of(a, b)).size());
        assertSame(a, MetadataCrawler.deduplicate(List.of(a, b)).get(0));
    }

    @Test
    public void testPageUrl() {
        assertEquals(server.baseUrl() + "/listing?page=7", crawler.pageUrl(7));
    }
}
