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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration management for the ATS document corpus collector.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Configuration {

    private static final Logger logger = LoggerFactory.getLogger(Configuration.class);

    public static final String DEFAULT_CONFIG_FILE = "config.json";

    // Default values
    private static final String DEFAULT_LISTING_URL = "https://www.ats.aq/devAS/Meetings/SearchDocDatabase";
    private static final String DEFAULT_MEASURE_BASE_URL = "https://www.ats.aq/devAS/Meetings/Measure";
    private static final String DEFAULT_DATA_BASE_PATH = "data/raw";
    private static final String DEFAULT_REPORTS_BASE_PATH = "data/reports";
    private static final int DEFAULT_CONNECT_TIMEOUT_MS = 30000;
    private static final int DEFAULT_READ_TIMEOUT_MS = 60000;
    private static final int DEFAULT_DOCUMENT_CONNECT_TIMEOUT_MS = 2000;
    private static final int DEFAULT_DOCUMENT_READ_TIMEOUT_MS = 5000;
    private static final int DEFAULT_FETCH_CONCURRENCY = 1;
    private static final long DEFAULT_REQUEST_INTERVAL_MS = 250;
    private static final int DEFAULT_FIRST_MEASURE_ID = 1;
    private static final int DEFAULT_LAST_MEASURE_ID = 999;
    private static final String DEFAULT_USER_AGENT = "ats-document-corpus/1.0";

    private String listingUrl;
    private String documentBaseUrl;
    private String measureBaseUrl;
    private String dataBasePath;        // Raw documents, snapshots and measures live below this path
    private String reportsBasePath;     // CSV reports
    private int connectTimeoutMs;       // Listing and measure pages
    private int readTimeoutMs;
    private int documentConnectTimeoutMs;
    private int documentReadTimeoutMs;
    private boolean skipExisting;
    private Long shuffleSeed;           // null means a fresh random order on every run
    private int fetchConcurrency;
    private long requestIntervalMs;     // Minimum gap between two requests to the same host
    private int abortAfterConsecutiveFailures;  // 0 disables the circuit breaker
    private int snapshotMaxAgeHours;    // 0 means any snapshot short-circuits the listing crawl
    private int firstMeasureId;
    private int lastMeasureId;
    private List<String> documentExtensions;
    private boolean writeLatestCopy;
    private String userAgent;

    // Default constructor for Jackson
    public Configuration() {
        this.listingUrl = DEFAULT_LISTING_URL;
        this.documentBaseUrl = UrlResolver.DEFAULT_BASE_URL;
        this.measureBaseUrl = DEFAULT_MEASURE_BASE_URL;
        this.dataBasePath = DEFAULT_DATA_BASE_PATH;
        this.reportsBasePath = DEFAULT_REPORTS_BASE_PATH;
        this.connectTimeoutMs = DEFAULT_CONNECT_TIMEOUT_MS;
        this.readTimeoutMs = DEFAULT_READ_TIMEOUT_MS;
        this.documentConnectTimeoutMs = DEFAULT_DOCUMENT_CONNECT_TIMEOUT_MS;
        this.documentReadTimeoutMs = DEFAULT_DOCUMENT_READ_TIMEOUT_MS;
        this.skipExisting = true;
        this.shuffleSeed = null;
        this.fetchConcurrency = DEFAULT_FETCH_CONCURRENCY;
        this.requestIntervalMs = DEFAULT_REQUEST_INTERVAL_MS;
        this.abortAfterConsecutiveFailures = 0;
        this.snapshotMaxAgeHours = 0;
        this.firstMeasureId = DEFAULT_FIRST_MEASURE_ID;
        this.lastMeasureId = DEFAULT_LAST_MEASURE_ID;
        this.documentExtensions = new ArrayList<>(List.of("pdf", "doc"));
        this.writeLatestCopy = true;
        this.userAgent = DEFAULT_USER_AGENT;
    }

    /**
     * Loads configuration from config.json in the working directory or creates the default configuration.
     */
    public static Configuration load() throws IOException {
        return load(Paths.get(DEFAULT_CONFIG_FILE));
    }

    /**
     * Loads configuration from the given file. Missing keys keep their defaults.
     * A default file is written when none exists so the user has something to edit.
     */
    public static Configuration load(Path configFile) throws IOException {
        if (Files.exists(configFile) && Files.size(configFile) > 0) {
            logger.info("Loading configuration from {}", configFile);
            try {
                ObjectMapper mapper = new ObjectMapper();
                mapper.registerModule(new JavaTimeModule());
                return mapper.readValue(configFile.toFile(), Configuration.class);
            } catch (IOException e) {
                logger.warn("Error reading {}, using defaults: {}", configFile, e.getMessage());
            }
        }

        logger.info("No valid {} found, using default configuration", configFile);
        Configuration config = new Configuration();

        if (!Files.exists(configFile)) {
            config.save(configFile);
        }

        return config;
    }

    /**
     * Saves configuration to the specified file path.
     */
    public void save(Path configFile) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.writerWithDefaultPrettyPrinter()
              .writeValue(configFile.toFile(), this);
        logger.info("Configuration saved to {}", configFile);
    }

    // Getters and setters
    public String getListingUrl() {
        return listingUrl;
    }

    public void setListingUrl(String listingUrl) {
        this.listingUrl = listingUrl;
    }

    public String getDocumentBaseUrl() {
        return documentBaseUrl;
    }

    public void setDocumentBaseUrl(String documentBaseUrl) {
        this.documentBaseUrl = documentBaseUrl;
    }

    public String getMeasureBaseUrl() {
        return measureBaseUrl;
    }

    public void setMeasureBaseUrl(String measureBaseUrl) {
        this.measureBaseUrl = measureBaseUrl;
    }

    public String getDataBasePath() {
        return dataBasePath;
    }

    public void setDataBasePath(String dataBasePath) {
        this.dataBasePath = dataBasePath;
    }

    public String getReportsBasePath() {
        return reportsBasePath;
    }

    public void setReportsBasePath(String reportsBasePath) {
        this.reportsBasePath = reportsBasePath;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public int getDocumentConnectTimeoutMs() {
        return documentConnectTimeoutMs;
    }

    public void setDocumentConnectTimeoutMs(int documentConnectTimeoutMs) {
        this.documentConnectTimeoutMs = documentConnectTimeoutMs;
    }

    public int getDocumentReadTimeoutMs() {
        return documentReadTimeoutMs;
    }

    public void setDocumentReadTimeoutMs(int documentReadTimeoutMs) {
        this.documentReadTimeoutMs = documentReadTimeoutMs;
    }

    public boolean isSkipExisting() {
        return skipExisting;
    }

    public void setSkipExisting(boolean skipExisting) {
        this.skipExisting = skipExisting;
    }

    public Long getShuffleSeed() {
        return shuffleSeed;
    }

    public void setShuffleSeed(Long shuffleSeed) {
        this.shuffleSeed = shuffleSeed;
    }

    public int getFetchConcurrency() {
        return fetchConcurrency;
    }

    public void setFetchConcurrency(int fetchConcurrency) {
        this.fetchConcurrency = fetchConcurrency;
    }

    public long getRequestIntervalMs() {
        return requestIntervalMs;
    }

    public void setRequestIntervalMs(long requestIntervalMs) {
        this.requestIntervalMs = requestIntervalMs;
    }

    public int getAbortAfterConsecutiveFailures() {
        return abortAfterConsecutiveFailures;
    }

    public void setAbortAfterConsecutiveFailures(int abortAfterConsecutiveFailures) {
        this.abortAfterConsecutiveFailures = abortAfterConsecutiveFailures;
    }

    public int getSnapshotMaxAgeHours() {
        return snapshotMaxAgeHours;
    }

    public void setSnapshotMaxAgeHours(int snapshotMaxAgeHours) {
        this.snapshotMaxAgeHours = snapshotMaxAgeHours;
    }

    public int getFirstMeasureId() {
        return firstMeasureId;
    }

    public void setFirstMeasureId(int firstMeasureId) {
        this.firstMeasureId = firstMeasureId;
    }

    public int getLastMeasureId() {
        return lastMeasureId;
    }

    public void setLastMeasureId(int lastMeasureId) {
        this.lastMeasureId = lastMeasureId;
    }

    public List<String> getDocumentExtensions() {
        return documentExtensions;
    }

    public void setDocumentExtensions(List<String> documentExtensions) {
        this.documentExtensions = documentExtensions;
    }

    public boolean isWriteLatestCopy() {
        return writeLatestCopy;
    }

    public void setWriteLatestCopy(boolean writeLatestCopy) {
        this.writeLatestCopy = writeLatestCopy;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    /**
     * Returns the directory holding metadata snapshots and fetched documents.
     * Snapshots sit beside the documents so a single directory captures one corpus.
     */
    @JsonIgnore
    public Path getDocumentsPath() {
        return Paths.get(dataBasePath, "documents");
    }

    /**
     * Returns the directory holding one JSON file per scraped measure.
     */
    @JsonIgnore
    public Path getMeasuresPath() {
        return Paths.get(dataBasePath, "measures");
    }

    /**
     * Returns the directory for fetch and reconciliation CSV reports.
     */
    @JsonIgnore
    public Path getReportsPath() {
        return Paths.get(reportsBasePath);
    }
}
