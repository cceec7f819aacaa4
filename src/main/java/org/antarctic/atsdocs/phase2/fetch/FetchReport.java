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

import org.antarctic.atsdocs.shared.CanonicalRecord;
import org.antarctic.atsdocs.shared.ReportCsvWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate of the record outcomes of one fetch batch. Safe to fill from worker threads.
 */
public class FetchReport {

    private static final Logger logger = LoggerFactory.getLogger(FetchReport.class);

    private static final String[] FETCH_HEADERS = {
        "paper_id", "filename", "url", "status", "http_status", "bytes", "error"
    };

    private final List<RecordOutcome> outcomes = new ArrayList<>();
    private int consecutiveFailures;
    private boolean aborted;

    /**
     * Adds an outcome and returns the current run of consecutive failed records.
     */
    synchronized int add(RecordOutcome outcome) {
        outcomes.add(outcome);
        if (outcome.getStatus() == RecordOutcome.Status.FAILED) {
            consecutiveFailures++;
        } else {
            consecutiveFailures = 0;
        }
        return consecutiveFailures;
    }

    synchronized void markAborted() {
        aborted = true;
    }

    public synchronized boolean isAborted() {
        return aborted;
    }

    public synchronized List<RecordOutcome> getOutcomes() {
        return List.copyOf(outcomes);
    }

    public synchronized long count(RecordOutcome.Status status) {
        return outcomes.stream().filter(outcome -> outcome.getStatus() == status).count();
    }

    public synchronized long countFiles(FetchResult.Status status) {
        return outcomes.stream().mapToLong(outcome -> outcome.count(status)).sum();
    }

    /**
     * Logs a one-line summary of the batch.
     */
    public void logSummary() {
        logger.info("Fetch batch{}: {} records fetched, {} skipped, {} failed; {} files written, {} already present, {} not found, {} timed out",
            isAborted() ? " (aborted)" : "",
            count(RecordOutcome.Status.FETCHED),
            count(RecordOutcome.Status.SKIPPED),
            count(RecordOutcome.Status.FAILED),
            countFiles(FetchResult.Status.FETCHED),
            countFiles(FetchResult.Status.SKIPPED_EXISTING),
            countFiles(FetchResult.Status.NOT_FOUND),
            countFiles(FetchResult.Status.TIMED_OUT));
    }

    /**
     * Writes one CSV row per variant (or per failed record) to {@code fetch-*.csv}.
     */
    public Path writeCsv(Path reportsDir, boolean writeLatestCopy) throws IOException {
        List<String[]> rows = new ArrayList<>();
        for (RecordOutcome outcome : getOutcomes()) {
            CanonicalRecord record = outcome.getRecord();
            if (outcome.getResults().isEmpty()) {
                rows.add(new String[]{
                    ReportCsvWriter.cell(record.getPaperId()), "", "", outcome.getStatus().name(), "", "",
                    ReportCsvWriter.cell(outcome.getError())
                });
                continue;
            }
            for (FetchResult result : outcome.getResults()) {
                rows.add(new String[]{
                    ReportCsvWriter.cell(record.getPaperId()),
                    result.getVariant().getFilename(),
                    result.getVariant().getUrl(),
                    result.getStatus().name(),
                    result.getHttpStatus() > 0 ? String.valueOf(result.getHttpStatus()) : "",
                    result.getBytes() > 0 ? String.valueOf(result.getBytes()) : "",
                    ""
                });
            }
        }
        Path csvPath = new ReportCsvWriter(reportsDir, writeLatestCopy).write("fetch", FETCH_HEADERS, rows);
        logger.info("Wrote {} fetch records to: {}", rows.size(), csvPath);
        return csvPath;
    }
}
