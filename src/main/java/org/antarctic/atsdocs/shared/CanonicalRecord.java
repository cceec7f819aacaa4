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

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * One working paper as listed by the ATS document database.
 * JSON property names follow the listing endpoint. Keys this class does not model are kept
 * in {@link #getAdditionalFields()} so snapshots round-trip without loss.
 */
public class CanonicalRecord {

    @JsonProperty("Paper_id")
    private final String paperId;

    @JsonProperty("Meeting_type")
    private final String meetingType;       // e.g. "ATCM", "CEP"

    @JsonProperty("Meeting_number")
    private final String meetingNumber;     // concatenated to the meeting type, e.g. "ATCM" + "40"

    @JsonProperty("Abbreviation")
    private final String abbreviation;      // paper type, e.g. "WP", "IP"

    @JsonProperty("Number")
    private final Integer number;

    @JsonProperty("Revision")
    private final int revision;             // 0 = no revision

    @JsonProperty("Type")
    private final String type;              // file extension of the primary document

    @JsonProperty("Name")
    private final String name;

    @JsonProperty("Meeting_year")
    private final Integer meetingYear;

    @JsonProperty("Meeting_id")
    private final Integer meetingId;

    @JsonProperty("Meeting_name")
    private final String meetingName;

    @JsonProperty("Pap_type_id")
    private final Integer paperTypeId;

    @JsonProperty("Parties")
    private final List<Party> parties;

    private final Map<String, Object> additionalFields = new TreeMap<>();

    @JsonCreator
    public CanonicalRecord(@JsonProperty("Paper_id") String paperId,
                           @JsonProperty("Meeting_type") String meetingType,
                           @JsonProperty("Meeting_number") String meetingNumber,
                           @JsonProperty("Abbreviation") String abbreviation,
                           @JsonProperty("Number") Integer number,
                           @JsonProperty("Revision") Integer revision,
                           @JsonProperty("Type") String type,
                           @JsonProperty("Name") String name,
                           @JsonProperty("Meeting_year") Integer meetingYear,
                           @JsonProperty("Meeting_id") Integer meetingId,
                           @JsonProperty("Meeting_name") String meetingName,
                           @JsonProperty("Pap_type_id") Integer paperTypeId,
                           @JsonProperty("Parties") List<Party> parties) {
        this.paperId = paperId;
        this.meetingType = meetingType;
        this.meetingNumber = meetingNumber;
        this.abbreviation = abbreviation;
        this.number = number;
        this.revision = revision != null ? revision : 0;
        this.type = type;
        this.name = name;
        this.meetingYear = meetingYear;
        this.meetingId = meetingId;
        this.meetingName = meetingName;
        this.paperTypeId = paperTypeId;
        this.parties = parties != null ? List.copyOf(parties) : List.of();
    }

    /**
     * Creates a record carrying only the identifying fields.
     */
    public CanonicalRecord(String paperId, String meetingType, String meetingNumber,
                           String abbreviation, int number, int revision, String type) {
        this(paperId, meetingType, meetingNumber, abbreviation, number, revision, type,
             null, null, null, null, null, null);
    }

    @JsonAnySetter
    void putAdditionalField(String key, Object value) {
        additionalFields.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getAdditionalFields() {
        return Collections.unmodifiableMap(additionalFields);
    }

    public String getPaperId() {
        return paperId;
    }

    public String getMeetingType() {
        return meetingType;
    }

    public String getMeetingNumber() {
        return meetingNumber;
    }

    /**
     * Returns the meeting code used in document paths, e.g. "ATCM40".
     */
    @JsonIgnore
    public String getMeetingCode() {
        return Objects.toString(meetingType, "") + Objects.toString(meetingNumber, "");
    }

    public String getAbbreviation() {
        return abbreviation;
    }

    public Integer getNumber() {
        return number;
    }

    public int getRevision() {
        return revision;
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public Integer getMeetingYear() {
        return meetingYear;
    }

    public Integer getMeetingId() {
        return meetingId;
    }

    public String getMeetingName() {
        return meetingName;
    }

    public Integer getPaperTypeId() {
        return paperTypeId;
    }

    public List<Party> getParties() {
        return parties;
    }

    /**
     * Returns the comma-joined non-empty party names.
     */
    @JsonIgnore
    public String getPartyNames() {
        return parties.stream()
            .map(Party::getName)
            .filter(partyName -> partyName != null && !partyName.isEmpty())
            .collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return "CanonicalRecord{" + paperId + ": " + getMeetingCode() + " " + abbreviation + " " + number
            + (revision > 0 ? " rev" + revision : "") + " (" + type + ")}";
    }
}
