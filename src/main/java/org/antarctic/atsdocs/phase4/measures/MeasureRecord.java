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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A scraped measure page, persisted as {@code {timestamp}_measure_{id}.json}.
 */
@JsonPropertyOrder({"raw_title", "raw_text", "characteristics", "approvals", "measure_number", "scraped_at"})
public class MeasureRecord {

    @JsonProperty("raw_title")
    private String rawTitle;            // null when the page has no h1.title

    @JsonProperty("raw_text")
    private String rawText;             // null when the page has no text container

    @JsonProperty("characteristics")
    private Map<String, String> characteristics = new LinkedHashMap<>();

    @JsonProperty("approvals")
    private List<Approval> approvals = new ArrayList<>();

    @JsonProperty("measure_number")
    private int measureNumber;

    @JsonProperty("scraped_at")
    private LocalDateTime scrapedAt;

    /**
     * Default constructor for Jackson deserialization.
     */
    public MeasureRecord() {
    }

    public MeasureRecord(int measureNumber) {
        this.measureNumber = measureNumber;
    }

    public String getRawTitle() {
        return rawTitle;
    }

    public void setRawTitle(String rawTitle) {
        this.rawTitle = rawTitle;
    }

    public String getRawText() {
        return rawText;
    }

    public void setRawText(String rawText) {
        this.rawText = rawText;
    }

    /**
     * Returns the characteristics keyed by their normalized label, in page order.
     */
    public Map<String, String> getCharacteristics() {
        return characteristics;
    }

    public void setCharacteristics(Map<String, String> characteristics) {
        this.characteristics = characteristics != null ? new LinkedHashMap<>(characteristics) : new LinkedHashMap<>();
    }

    public List<Approval> getApprovals() {
        return approvals;
    }

    public void setApprovals(List<Approval> approvals) {
        this.approvals = approvals != null ? new ArrayList<>(approvals) : new ArrayList<>();
    }

    public int getMeasureNumber() {
        return measureNumber;
    }

    public void setMeasureNumber(int measureNumber) {
        this.measureNumber = measureNumber;
    }

    public LocalDateTime getScrapedAt() {
        return scrapedAt;
    }

    public void setScrapedAt(LocalDateTime scrapedAt) {
        this.scrapedAt = scrapedAt;
    }

    @Override
    public String toString() {
        return "MeasureRecord{" +
                "measureNumber=" + measureNumber +
                ", rawTitle='" + rawTitle + '\'' +
                ", characteristics=" + characteristics.size() +
                ", approvals=" + approvals.size() +
                '}';
    }
}
