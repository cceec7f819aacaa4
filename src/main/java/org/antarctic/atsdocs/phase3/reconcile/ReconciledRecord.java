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

import org.antarctic.atsdocs.shared.CanonicalRecord;

import java.util.Optional;

/**
 * A fetched file joined with at most one metadata record.
 * The record is attached only for {@link MatchStatus#MATCHED}; every other status carries none.
 */
public final class ReconciledRecord {

    public enum MatchStatus {
        /** Exactly one metadata record survived the filter chain. */
        MATCHED,
        /** No metadata record survived. */
        NO_MATCH,
        /** Several records survived; left for manual review rather than picking one. */
        AMBIGUOUS,
        /** The filename does not follow the naming scheme. */
        UNPARSEABLE
    }

    private final String filename;
    private final RawArtifact artifact;     // null when UNPARSEABLE
    private final MatchStatus status;
    private final int candidateCount;
    private final CanonicalRecord match;

    private ReconciledRecord(String filename, RawArtifact artifact, MatchStatus status,
                             int candidateCount, CanonicalRecord match) {
        this.filename = filename;
        this.artifact = artifact;
        this.status = status;
        this.candidateCount = candidateCount;
        this.match = match;
    }

    static ReconciledRecord fromCandidates(RawArtifact artifact, int candidateCount, CanonicalRecord onlyCandidate) {
        if (candidateCount == 1) {
            return new ReconciledRecord(artifact.getFilename(), artifact, MatchStatus.MATCHED, 1, onlyCandidate);
        }
        MatchStatus status = candidateCount == 0 ? MatchStatus.NO_MATCH : MatchStatus.AMBIGUOUS;
        return new ReconciledRecord(artifact.getFilename(), artifact, status, candidateCount, null);
    }

    static ReconciledRecord unparseable(String filename) {
        return new ReconciledRecord(filename, null, MatchStatus.UNPARSEABLE, 0, null);
    }

    public String getFilename() {
        return filename;
    }

    public Optional<RawArtifact> getArtifact() {
        return Optional.ofNullable(artifact);
    }

    public MatchStatus getStatus() {
        return status;
    }

    public boolean isResolved() {
        return status == MatchStatus.MATCHED;
    }

    public int getCandidateCount() {
        return candidateCount;
    }

    public Optional<CanonicalRecord> getMatch() {
        return Optional.ofNullable(match);
    }
}
