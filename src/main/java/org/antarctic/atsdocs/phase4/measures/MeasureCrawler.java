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
package org.antarctic.atsdocs.phase4.measures;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.core5.http.HttpEntity;
import org.antarctic.atsdocs.shared.Configuration;
import org.antarctic.atsdocs.shared.HttpClientFactory;
import org.antarctic.atsdocs.shared.OutputFiles;
import org.antarctic.atsdocs.shared.RequestThrottle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Phase 4: Crawls measure pages addressed by dense numeric ids.
 * <p>
 * Each scraped measure is written to its own file as soon as it is parsed, so an interrupted
 * walk keeps everything collected so far. Ids the server does not know are skipped.
 */
public class MeasureCrawler {

    private static final Logger logger = LoggerFactory.getLogger(MeasureCrawler.class);

    private static final Pattern MEASURE_FILE = Pattern.compile(".+_measure_(\\d{1,9})\\.json");

    private final Configuration config;
    private final CloseableHttpClient httpClient;
    private final RequestThrottle throttle;
    private final MeasurePageParser parser;
    private final ObjectMapper objectMapper;

    public MeasureCrawler(Configuration config) {
        this(config, new RequestThrottle(config.getRequestIntervalMs()));
    }

    public MeasureCrawler(Configuration config, RequestThrottle throttle) {
        this.config = config;
        this.throttle = throttle;
        this.parser = new MeasurePageParser();
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.httpClient = HttpClientFactory.create(
                config.getConnectTimeoutMs(), config.getReadTimeoutMs(), config.getUserAgent(), 1);
    }

    /**
     * Fetches and parses one measure.
     *
     * @return the record, or empty when the server answers with a non-2xx status
     * @throws IOException on a transport error
     */
    public Optional<MeasureRecord> crawl(int id) throws IOException {
        String url = measureUrl(id);
        logger.info("Beginning scrape of measure {} at {}", id, url);
        acquire(url);

        HttpGet request = new HttpGet(url);
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int status = response.getCode();
            logger.info("Scrape of measure {} returned {}", id, status);
            HttpEntity entity = response.getEntity();
            if (status < 200 || status >= 300 || entity == null) {
                return Optional.empty();
            }
            try (InputStream content = entity.getContent()) {
                MeasureRecord record = parser.parse(content, url, id);
                record.setScrapedAt(LocalDateTime.now());
                return Optional.of(record);
            }
        }
    }

    /**
     * Walks {@code first..last} and writes every scraped measure into the directory.
     *
     * @return the files written during this walk
     * @throws IOException if the output directory is missing or a measure file cannot be written
     */
    public List<Path> crawlRange(int first, int last, Path outputDir) throws IOException {
        OutputFiles.requireDirectory(outputDir);
        Set<Integer> existing = config.isSkipExisting() ? existingMeasureIds(outputDir) : Set.of();
        logger.info("Crawling measures {} to {} into {} ({} already present)", first, last, outputDir, existing.size());

        List<Path> written = new ArrayList<>();
        int missing = 0;
        int failed = 0;
        MeasureCursor cursor = MeasureCursor.range(first, last);
        while (!cursor.isFinished()) {
            int id = cursor.getCurrentId();
            cursor = cursor.advance();
            if (existing.contains(id)) {
                logger.debug("Measure {} already present, skipping", id);
                continue;
            }

            MDC.put("measureId", String.valueOf(id));
            try {
                Optional<MeasureRecord> record;
                try {
                    record = crawl(id);
                } catch (IOException e) {
                    // Timeouts are InterruptedIOExceptions as well, only the interrupt flag ends the walk
                    if (Thread.currentThread().isInterrupted()) {
                        logger.warn("Measure crawl interrupted at id {}", id);
                        break;
                    }
                    failed++;
                    logger.error("Failed to scrape measure {}: {}", id, e.getMessage());
                    continue;
                }
                if (record.isPresent()) {
                    // Write errors are not per-measure failures and end the walk
                    written.add(write(record.get(), outputDir));
                } else {
                    missing++;
                }
            } finally {
                MDC.remove("measureId");
            }
        }

        logger.info("Measure crawl finished: {} written, {} not available, {} failed, {} skipped",
            written.size(), missing, failed, existing.size());
        return written;
    }

    Path write(MeasureRecord record, Path outputDir) throws IOException {
        Path target = outputDir.resolve(OutputFiles.timestamp() + "_measure_" + record.getMeasureNumber() + ".json");
        logger.info("Saving scrape of measure {} to {}", record.getMeasureNumber(), target);
        OutputFiles.writeAtomically(target, objectMapper.writeValueAsBytes(record));
        return target;
    }

    /**
     * Reads a measure file written by this crawler.
     */
    public MeasureRecord read(Path file) throws IOException {
        return objectMapper.readValue(file.toFile(), MeasureRecord.class);
    }

    /**
     * Returns the ids that already have a {@code *_measure_{id}.json} file in the directory.
     */
    static Set<Integer> existingMeasureIds(Path directory) throws IOException {
        Set<Integer> ids = new HashSet<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(Files::isRegularFile)
                .map(path -> MEASURE_FILE.matcher(path.getFileName().toString()))
                .filter(Matcher::matches)
                .forEach(matcher -> ids.add(Integer.parseInt(matcher.group(1))));
        }
        return ids;
    }

    String measureUrl(int id) {
        String base = config.getMeasureBaseUrl();
        return base.endsWith("/") ? base + id : base + "/" + id;
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
