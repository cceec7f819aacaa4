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

import org.antarctic.atsdocs.shared.DocumentVariant;

/**
 * Outcome of fetching one language variant.
 */
public final class FetchResult {

    public enum Status {
        FETCHED,
        SKIPPED_EXISTING,
        NOT_FOUND,
        TIMED_OUT
    }

    private final DocumentVariant variant;
    private final Status status;
    private final int httpStatus;   // 0 when no response was received
    private final long bytes;

    private FetchResult(DocumentVariant variant, Status status, int httpStatus, long bytes) {
        this.variant = variant;
        this.status = status;
        this.httpStatus = httpStatus;
        this.bytes = bytes;
    }

    static FetchResult fetched(DocumentVariant variant, int httpStatus, long bytes) {
        return new FetchResult(variant, Status.FETCHED, httpStatus, bytes);
    }

    static FetchResult skippedExisting(DocumentVariant variant) {
        return new FetchResult(variant, Status.SKIPPED_EXISTING, 0, 0);
    }

    static FetchResult notFound(DocumentVariant variant, int httpStatus) {
        return new FetchResult(variant, Status.NOT_FOUND, httpStatus, 0);
    }

    static FetchResult timedOut(DocumentVariant variant) {
        return new FetchResult(variant, Status.TIMED_OUT, 0, 0);
    }

    public DocumentVariant getVariant() {
        return variant;
    }

    public Status getStatus() {
        return status;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public long getBytes() {
        return bytes;
    }

    @Override
    public String toString() {
        return variant.getFilename() + ": " + status;
    }
}
