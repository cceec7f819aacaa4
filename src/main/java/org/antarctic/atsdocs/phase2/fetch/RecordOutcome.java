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

import java.util.List;

/**
 * Outcome of fetching all variants of one record, as seen by the batch driver.
 */
public final class RecordOutcome {

    public enum Status {
        /** At least one file was written. */
        FETCHED,
        /** Nothing written and nothing went wrong: every variant existed, was missing or timed out. */
        SKIPPED,
        /** The fetch raised an error; the batch moved on. */
        FAILED
    }

    private final CanonicalRecord record;
    private final Status status;
    private final List<FetchResult> results;
    private final String error;

    private RecordOutcome(CanonicalRecord record, Status status, List<FetchResult> results, String error) {
        this.record = record;
        this.status = status;
        this.results = List.copyOf(results);
        this.error = error;
    }

    static RecordOutcome completed(CanonicalRecord record, List<FetchResult> results) {
        boolean wroteAny = results.stream().anyMatch(result -> result.getStatus() == FetchResult.Status.FETCHED);
        return new RecordOutcome(record, wroteAny ? Status.FETCHED : Status.SKIPPED, results, null);
    }

    static RecordOutcome failed(CanonicalRecord record, Exception error) {
        String message = error.getClass().getSimpleName() + ": " + error.getMessage();
        return new RecordOutcome(record, Status.FAILED, List.of(), message);
    }

    static RecordOutcome aborted(CanonicalRecord record) {
        return new RecordOutcome(record, Status.SKIPPED, List.of(), "batch aborted");
    }

    public CanonicalRecord getRecord() {
        return record;
    }

    public Status getStatus() {
        return status;
    }

    public List<FetchResult> getResults() {
        return results;
    }

    public String getError() {
        return error;
    }

    public long count(FetchResult.Status status) {
        return results.stream().filter(result -> result.getStatus() == status).count();
    }
}
