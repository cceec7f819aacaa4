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

import org.antarctic.atsdocs.shared.ArtifactIndex;
import org.antarctic.atsdocs.shared.CanonicalRecord;
import org.antarctic.atsdocs.shared.ReportCsvWriter;
import org.antarctic.atsdocs.shared.UrlResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Phase 3: Attributes fetched files to their metadata record.
 * <p>
 * Candidates are narrowed by a conjunctive filter chain: extension, paper type, paper number,
 * meeting type, revision and finally the exact filename the record would produce. Only a single
 * survivor counts as a match. Several survivors mean the metadata itself is ambiguous, and the
 * file is left unresolved instead of guessing.
 */
public class Reconciler {

    private static final Logger logger = LoggerFactory.getLogger(Reconciler.class);

    private static final String[] RECONCILED_HEADERS = {
        "filename", "extension", "meeting", "paper_type_abbreviation", "paper_number", "paper_revision",
        "paper_language_abbreviation", "match_status", "candidates", "meeting_year", "paper_name", "paper_id",
        "paper_type_id", "meeting_type", "meeting_id", "meeting_number", "meeting_name", "parties"
    };

    /**
     * Returns the only metadata record matching the artifact, or empty when none or several match.
     */
    public Optional<CanonicalRecord> match(RawArtifact artifact, List<CanonicalRecord> corpus) {
        List<CanonicalRecord> candidates = candidates(artifact, corpus);
        return candidates.size() == 1 ? Optional.of(candidates.get(0)) : Optional.empty();
    }

    /**
     * Reconciles one artifact, keeping the reason when it stays unresolved.
     */
    public ReconciledRecord reconcile(RawArtifact artifact, List<CanonicalRecord> corpus) {
        List<CanonicalRecord> candidates = candidates(artifact, corpus);
        ReconciledRecord reconciled = ReconciledRecord.fromCandidates(
            artifact, candidates.size(), candidates.size() == 1 ? candidates.get(0) : null);
        if (reconciled.getStatus() == ReconciledRecord.MatchStatus.AMBIGUOUS) {
            logger.warn("{} metadata records match {}, leaving it for manual review: {}",
                candidates.size(), artifact.getFilename(),
                candidates.stream().map(CanonicalRecord::getPaperId).collect(Collectors.toList()));
        } else if (reconciled.getStatus() == ReconciledRecord.MatchStatus.NO_MATCH) {
            logger.warn("No metadata record matches {}", artifact.getFilename());
        }
        return reconciled;
    }

    /**
     * Reconciles every document file of the index against the corpus.
     */
    public List<ReconciledRecord> reconcileDirectory(ArtifactIndex index, Collection<String> extensions,
                                                     List<CanonicalRecord> corpus) {
        List<Path> files = index.filesWithExtension(extensions);
        logger.info("Reconciling {} documents in {} against {} metadata records",
            files.size(), index.getDirectory(), corpus.size());

        // The number filter is applied up front by bucketing; the chain is conjunctive so the outcome is the same
        Map<Integer, List<CanonicalRecord>> byNumber = new HashMap<>();
        for (CanonicalRecord record : corpus) {
            if (record.getNumber() != null) {
                byNumber.computeIfAbsent(record.getNumber(), number -> new ArrayList<>()).add(record);
            }
        }

        List<ReconciledRecord> results = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            Path file = files.get(i);
            logger.debug("Processing {} ({}/{})", file.getFileName(), i + 1, files.size());
            RawArtifact artifact;
            try {
                artifact = RawArtifact.parse(file);
            } catch (IllegalArgumentException e) {
                logger.warn("Cannot parse {}: {}", file.getFileName(), e.getMessage());
                results.add(ReconciledRecord.unparseable(file.getFileName().toString()));
                continue;
            }
            List<CanonicalRecord> bucket = byNumber.getOrDefault(artifact.getPaperNumberValue(), List.of());
            results.add(reconcile(artifact, bucket));
        }

        long matched = results.stream().filter(ReconciledRecord::isResolved).count();
        logger.info("Reconciled {} of {} documents, {} left unresolved", matched, results.size(), results.size() - matched);
        return results;
    }

    List<CanonicalRecord> candidates(RawArtifact artifact, List<CanonicalRecord> corpus) {
        logger.debug("Matching {} against {} metadata records", artifact.getFilename(), corpus.size());
        List<CanonicalRecord> candidates = corpus;
        candidates = narrow(candidates, "extension",
            record -> artifact.getExtension().equals(record.getType()));
        candidates = narrow(candidates, "paper type abbreviation",
            record -> artifact.getAbbreviation().equals(record.getAbbreviation()));
        candidates = narrow(candidates, "paper number",
            record -> record.getNumber() != null && record.getNumber() == artifact.getPaperNumberValue());
        candidates = narrow(candidates, "meeting type",
            record -> record.getMeetingType() != null && artifact.getMeeting().contains(record.getMeetingType()));
        candidates = narrow(candidates, "revision",
            record -> record.getRevision() == artifact.getRevision());
        candidates = narrow(candidates, "filename",
            record -> UrlResolver.filenames(record).contains(artifact.getFilename()));
        return candidates;
    }

    private static List<CanonicalRecord> narrow(List<CanonicalRecord> candidates, String stage,
                                                Predicate<CanonicalRecord> filter) {
        List<CanonicalRecord> narrowed = candidates.stream().filter(filter).collect(Collectors.toList());
        logger.debug("After filtering for {}: {} candidates", stage, narrowed.size());
        return narrowed;
    }

    /**
     * Writes all results to {@code reconciled-*.csv} and the unresolved ones to {@code unresolved-*.csv}.
     */
    public void writeReports(List<ReconciledRecord> results, Path reportsDir, boolean writeLatestCopy) throws IOException {
        List<String[]> all = new ArrayList<>();
        List<String[]> unresolved = new ArrayList<>();
        for (ReconciledRecord result : results) {
            String[] row = toRow(result);
            all.add(row);
            if (!result.isResolved()) {
                unresolved.add(row);
            }
        }
        ReportCsvWriter writer = new ReportCsvWriter(reportsDir, writeLatestCopy);
        Path reconciledCsv = writer.write("reconciled", RECONCILED_HEADERS, all);
        Path unresolvedCsv = writer.write("unresolved", RECONCILED_HEADERS, unresolved);
        logger.info("Wrote {} reconciled documents to {} and {} for manual review to {}",
            all.size(), reconciledCsv, unresolved.size(), unresolvedCsv);
    }

    private static String[] toRow(ReconciledRecord result) {
        RawArtifact artifact = result.getArtifact().orElse(null);
        CanonicalRecord match = result.getMatch().orElse(null);
        return new String[]{
            result.getFilename(),
            artifact != null ? artifact.getExtension() : "",
            artifact != null ? artifact.getMeeting() : "",
            artifact != null ? artifact.getAbbreviation() : "",
            artifact != null ? artifact.getPaperNumber() : "",
            artifact != null ? String.valueOf(artifact.getRevision()) : "",
            artifact != null ? artifact.getLanguage() : "",
            result.getStatus().name(),
            String.valueOf(result.getCandidateCount()),
            match != null ? ReportCsvWriter.cell(match.getMeetingYear()) : "",
            match != null ? ReportCsvWriter.cell(match.getName()) : "",
            match != null ? ReportCsvWriter.cell(match.getPaperId()) : "",
            match != null ? ReportCsvWriter.cell(match.getPaperTypeId()) : "",
            match != null ? ReportCsvWriter.cell(match.getMeetingType()) : "",
            match != null ? ReportCsvWriter.cell(match.getMeetingId()) : "",
            match != null ? ReportCsvWriter.cell(match.getMeetingNumber()) : "",
            match != null ? ReportCsvWriter.cell(match.getMeetingName()) : "",
            match != null ? match.getPartyNames() : ""
        };
    }
}
