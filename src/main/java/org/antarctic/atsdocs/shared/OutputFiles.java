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
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * File helpers shared by the crawlers: timestamped names, write-then-rename and directory preconditions.
 */
public final class OutputFiles {

    private static final Logger logger = LoggerFactory.getLogger(OutputFiles.class);

    /** Suffix of files still being written. Never counted as existing output. */
    public static final String TEMP_SUFFIX = ".part";

    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm-ss");

    private OutputFiles() {
    }

    /**
     * Returns the timestamp used as filename prefix of snapshots and measure files.
     */
    public static String timestamp() {
        return LocalDateTime.now().format(TIMESTAMP_FORMATTER);
    }

    /**
     * Fails fast when an output directory is missing, instead of failing deep inside a crawl loop.
     */
    public static Path requireDirectory(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            throw new NoSuchFileException(directory.toAbsolutePath().toString(), null, "output directory does not exist");
        }
        if (!Files.isDirectory(directory)) {
            throw new NotDirectoryException(directory.toAbsolutePath().toString());
        }
        return directory;
    }

    /**
     * Writes bytes to a temporary sibling and renames it onto the target.
     */
    public static void writeAtomically(Path target, byte[] content) throws IOException {
        Path temp = createTempSibling(target);
        try {
            Files.write(temp, content);
            moveIntoPlace(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Streams content to a temporary sibling and renames it onto the target.
     *
     * @return the number of bytes written
     */
    public static long writeAtomically(Path target, InputStream content) throws IOException {
        return write(target, content, true);
    }

    /**
     * Like {@link #writeAtomically(Path, InputStream)}, but an empty stream leaves the target untouched.
     *
     * @return the number of bytes written, {@code 0} when nothing was moved into place
     */
    public static long writeNonEmptyAtomically(Path target, InputStream content) throws IOException {
        return write(target, content, false);
    }

    private static long write(Path target, InputStream content, boolean keepEmpty) throws IOException {
        Path temp = createTempSibling(target);
        try {
            long written = Files.copy(content, temp, StandardCopyOption.REPLACE_EXISTING);
            if (written > 0 || keepEmpty) {
                moveIntoPlace(temp, target);
            }
            return written;
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    // Files.createTempFile would restrict the file to its owner, and the rename keeps those permissions
    private static Path createTempSibling(Path target) throws IOException {
        Path directory = target.toAbsolutePath().getParent();
        String name = target.getFileName().toString() + "." + UUID.randomUUID() + TEMP_SUFFIX;
        return Files.createFile(directory.resolve(name));
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
