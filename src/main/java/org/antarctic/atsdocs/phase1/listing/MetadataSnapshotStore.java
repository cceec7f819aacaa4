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
package org.antarctic.atsdocs.phase1.listing;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.antarctic.atsdocs.shared.CanonicalRecord;
import org.antarctic.atsdocs.shared.OutputFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads and writes {@code {timestamp}_papers_metadata.json} snapshots of the listing.
 */
public class MetadataSnapshotStore {

    private static final Logger logger = LoggerFactory.getLogger(MetadataSnapshotStore.class);

    public static final String SNAPSHOT_SUFFIX = "_papers_metadata.json";
    private static final Pattern SNAPSHOT_PATTERN = Pattern.compile(".+" + Pattern.quote(SNAPSHOT_SUFFIX));

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Lists snapshot files in the directory, oldest name first.
     */
    public List<Path> list(Path directory) throws IOException {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                .filter(Files::isRegularFile)
                .filter(path -> SNAPSHOT_PATTERN.matcher(path.getFileName().toString()).matches())
                .sorted()
                .collect(Collectors.toList());
        }
    }

    /**
     * Reads every snapshot in the directory and returns their concatenated records.
     * Duplicates across snapshots are kept; callers deduplicate.
     */
    public List<CanonicalRecord> loadAll(Path directory) throws IOException {
        List<CanonicalRecord> records = new ArrayList<>();
        for (Path snapshot : list(directory)) {
            logger.info("Reading metadata from {}", snapshot);
            List<CanonicalRecord> fromFile = objectMapper.readValue(snapshot.toFile(),
                new TypeReference<List<CanonicalRecord>>() {});
            logger.info("{} papers found in {}", fromFile.size(), snapshot.getFileName());
            records.addAll(fromFile);
        }
        return records;
    }

    /**
     * Reads only the most recently modified snapshot. Older snapshots may hold outdated versions
     * of the same papers, which would survive deduplication as distinct records.
     */
    public List<CanonicalRecord> loadNewest(Path directory) throws IOException {
        Optional<Path> newest = newest(directory);
        if (newest.isEmpty()) {
            return new ArrayList<>();
        }
        logger.info("Reading metadata from newest snapshot {}", newest.get());
        return objectMapper.readValue(newest.get().toFile(), new TypeReference<List<CanonicalRecord>>() {});
    }

    /**
     * Returns the modification time of the newest snapshot, if any.
     */
    public Optional<FileTime> newestModification(Path directory) throws IOException {
        Optional<Path> newest = newest(directory);
        return newest.isPresent() ? Optional.of(Files.getLastModifiedTime(newest.get())) : Optional.empty();
    }

    private Optional<Path> newest(Path directory) throws IOException {
        Path newest = null;
        FileTime newestTime = null;
        for (Path snapshot : list(directory)) {
            FileTime modified = Files.getLastModifiedTime(snapshot);
            // Ties go to the later name, which carries the later timestamp
            if (newestTime == null || modified.compareTo(newestTime) >= 0) {
                newest = snapshot;
                newestTime = modified;
            }
        }
        return Optional.ofNullable(newest);
    }

    /**
     * Writes the records as a new timestamped snapshot.
     */
    public Path write(Path directory, List<CanonicalRecord> records) throws IOException {
        Path target = directory.resolve(OutputFiles.timestamp() + SNAPSHOT_SUFFIX);
        byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(records);
        OutputFiles.writeAtomically(target, json);
        logger.info("Saved {} papers to {}", records.size(), target.toAbsolutePath());
        return target;
    }
}
