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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Tracks which output files already exist in a flat output directory.
 * <p>
 * The directory listing is the source of truth: the index is filled from it on {@link #scan(Path)}
 * and extended with every file written afterwards. Files still carrying the
 * {@link OutputFiles#TEMP_SUFFIX} are never indexed, so an interrupted write is fetched again
 * on the next run. Safe for concurrent use by fetch workers.
 */
public class ArtifactIndex {

    private static final Logger logger = LoggerFactory.getLogger(ArtifactIndex.class);

    private final Path directory;
    private final Set<String> filenames = ConcurrentHashMap.newKeySet();

    private ArtifactIndex(Path directory) {
        this.directory = directory;
    }

    /**
     * Builds an index from the current content of the directory.
     */
    public static ArtifactIndex scan(Path directory) throws IOException {
        ArtifactIndex index = new ArtifactIndex(OutputFiles.requireDirectory(directory));
        index.refresh();
        return index;
    }

    /**
     * Re-reads the directory listing, replacing what the index knew before.
     */
    public void refresh() throws IOException {
        Set<String> found;
        try (Stream<Path> entries = Files.list(directory)) {
            found = entries
                .filter(Files::isRegularFile)
                .map(path -> path.getFileName().toString())
                .filter(name -> !name.endsWith(OutputFiles.TEMP_SUFFIX))
                .collect(Collectors.toSet());
        }
        filenames.clear();
        filenames.addAll(found);
        logger.info("Indexed {} existing files in {}", filenames.size(), directory.toAbsolutePath());
    }

    public boolean contains(String filename) {
        return filenames.contains(filename);
    }

    /**
     * Registers a file after it has been written.
     */
    public void record(String filename) {
        filenames.add(filename);
    }

    public Path getDirectory() {
        return directory;
    }

    public Path resolve(String filename) {
        return directory.resolve(filename);
    }

    public int size() {
        return filenames.size();
    }

    /**
     * Returns the indexed files whose extension is one of the given ones, sorted by name.
     */
    public List<Path> filesWithExtension(Collection<String> extensions) {
        Set<String> wanted = extensions.stream()
            .map(extension -> extension.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
        return filenames.stream()
            .filter(name -> wanted.contains(extensionOf(name)))
            .sorted()
            .map(directory::resolve)
            .collect(Collectors.toList());
    }

    static String extensionOf(String filename) {
        int lastDot = filename.lastIndexOf('.');
        if (lastDot >= 0 && lastDot < filename.length() - 1) {
            return filename.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        }
        return "";
    }
}
