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
package org.antarctic.atsdocs.phase3.reconcile;

import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A fetched document file and the attributes parsed back out of its filename.
 * <p>
 * Parsing is the inverse of the naming scheme used for fetching:
 * {@code ATCM40_WP007_rev2_e.pdf} yields meeting {@code ATCM40}, abbreviation {@code WP},
 * paper number {@code 007}, revision 2, language {@code e} and extension {@code pdf}.
 */
public final class RawArtifact {

    private static final Pattern PAPER_TOKEN = Pattern.compile("(\\D+)(\\d+)");
    private static final Pattern REVISION_TOKEN = Pattern.compile("rev(\\d+)");

    private final Path path;
    private final String filename;
    private final String extension;
    private final String meeting;
    private final String abbreviation;
    private final String paperNumber;
    private final int revision;
    private final String language;

    private RawArtifact(Path path, String filename, String extension, String meeting, String abbreviation,
                        String paperNumber, int revision, String language) {
        this.path = path;
        this.filename = filename;
        this.extension = extension;
        this.meeting = meeting;
        this.abbreviation = abbreviation;
        this.paperNumber = paperNumber;
        this.revision = revision;
        this.language = language;
    }

    public static RawArtifact parse(Path path) {
        return parse(path, path.getFileName().toString());
    }

    public static RawArtifact parse(String filename) {
        return parse(null, filename);
    }

    /**
     * @throws IllegalArgumentException if the filename does not follow the naming scheme
     */
    private static RawArtifact parse(Path path, String filename) {
        int lastDot = filename.lastIndexOf('.');
        if (lastDot <= 0 || lastDot == filename.length() - 1) {
            throw new IllegalArgumentException("No extension in " + filename);
        }
        String extension = filename.substring(lastDot + 1);
        String[] parts = filename.substring(0, lastDot).split("_");
        if (parts.length < 3) {
            throw new IllegalArgumentException("Expected meeting, paper and language segments in " + filename);
        }

        Matcher paper = PAPER_TOKEN.matcher(parts[1]);
        if (!paper.matches()) {
            throw new IllegalArgumentException("Cannot read paper type and number from " + filename);
        }

        int revision = 0;
        for (int i = 2; i < parts.length - 1; i++) {
            if (parts[i].startsWith("rev")) {
                Matcher rev = REVISION_TOKEN.matcher(parts[i]);
                if (!rev.matches()) {
                    throw new IllegalArgumentException("Malformed revision segment in " + filename);
                }
                revision = Integer.parseInt(rev.group(1));
            }
        }

        String paperNumber = paper.group(2);
        if (paperNumber.length() > 9) {
            throw new IllegalArgumentException("Paper number out of range in " + filename);
        }
        return new RawArtifact(path, filename, extension, parts[0], paper.group(1), paperNumber,
                revision, parts[parts.length - 1]);
    }

    public Path getPath() {
        return path;
    }

    public String getFilename() {
        return filename;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Returns the meeting code, e.g. {@code ATCM40}.
     */
    public String getMeeting() {
        return meeting;
    }

    public String getAbbreviation() {
        return abbreviation;
    }

    /**
     * Returns the paper number as written in the filename, zero padded.
     */
    public String getPaperNumber() {
        return paperNumber;
    }

    /**
     * Returns the paper number with leading zeros stripped.
     */
    public int getPaperNumberValue() {
        return Integer.parseInt(paperNumber);
    }

    public int getRevision() {
        return revision;
    }

    public String getLanguage() {
        return language;
    }

    @Override
    public String toString() {
        return filename;
    }
}
