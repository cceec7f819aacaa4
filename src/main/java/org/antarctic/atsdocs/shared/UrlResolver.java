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

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the per-language document URLs of a working paper from its metadata.
 * <p>
 * Filenames follow {@code {meeting}_{abbreviation}{number:03d}[_rev{revision}]_{language}.{type}},
 * e.g. {@code ATCM40_WP007_rev2_e.pdf}. The revision segment is present only when the revision
 * is greater than zero. No network access is involved; a variant is produced for every
 * language even when the server has no such file.
 */
public class UrlResolver {

    public static final String DEFAULT_BASE_URL = "https://documents.ats.aq";

    /** English, Spanish, French, Russian, in the order documents are requested. */
    public static final List<String> LANGUAGES = List.of("e", "s", "f", "r");

    private final String baseUrl;

    public UrlResolver() {
        this(DEFAULT_BASE_URL);
    }

    public UrlResolver(String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    /**
     * Returns exactly four variants, one per language code.
     *
     * @throws IllegalArgumentException if the record lacks a field the naming scheme needs
     */
    public List<DocumentVariant> resolve(CanonicalRecord record) {
        String meeting = record.getMeetingCode();
        String directory = baseUrl + "/" + meeting + "/" + record.getAbbreviation() + "/";
        List<DocumentVariant> variants = new ArrayList<>(LANGUAGES.size());
        for (String language : LANGUAGES) {
            String filename = filename(record, language);
            variants.add(new DocumentVariant(language, filename, directory + filename));
        }
        return variants;
    }

    /**
     * Returns the four filenames a record can produce, without URLs.
     */
    public static List<String> filenames(CanonicalRecord record) {
        List<String> names = new ArrayList<>(LANGUAGES.size());
        for (String language : LANGUAGES) {
            names.add(filename(record, language));
        }
        return names;
    }

    /**
     * Builds the filename of one language variant.
     */
    public static String filename(CanonicalRecord record, String language) {
        requireField(record.getMeetingType(), "Meeting_type", record);
        requireField(record.getAbbreviation(), "Abbreviation", record);
        requireField(record.getNumber(), "Number", record);
        requireField(record.getType(), "Type", record);

        StringBuilder name = new StringBuilder();
        name.append(record.getMeetingCode())
            .append('_')
            .append(record.getAbbreviation())
            .append(String.format("%03d", record.getNumber()));
        if (record.getRevision() > 0) {
            name.append("_rev").append(record.getRevision());
        }
        name.append('_').append(language)
            .append('.').append(record.getType());
        return name.toString();
    }

    private static void requireField(Object value, String field, CanonicalRecord record) {
        if (value == null) {
            throw new IllegalArgumentException("Record " + record.getPaperId() + " has no " + field);
        }
    }
}
