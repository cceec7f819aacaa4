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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Unit tests for write-then-rename output and directory preconditions.
 */
public class OutputFilesTest {

    @TempDir
    Path tempDir;

    @Test
    public void testWriteAtomicallyLeavesNoTemporaryFile() throws IOException {
        Path target = tempDir.resolve("ATCM40_WP007_e.pdf");

        long bytes = OutputFiles.writeAtomically(target, new ByteArrayInputStream(new byte[]{1, 2, 3}));

        assertEquals(3, bytes);
        assertArrayEquals(new byte[]{1, 2, 3}, Files.readAllBytes(target));
        try (Stream<Path> entries = Files.list(tempDir)) {
            assertEquals(1, entries.count());
        }
    }

    @Test
    public void testWriteAtomicallyReplacesExistingFile() throws IOException {
        Path target = tempDir.resolve("snapshot.json");
        Files.write(target, new byte[]{9});

        OutputFiles.writeAtomically(target, "[]".getBytes());

        assertEquals("[]", Files.readString(target));
    }

    @Test
    public void testFailedWriteKeepsNoPartialFile() throws IOException {
        Path target = tempDir.resolve("ATCM40_WP007_s.pdf");
        InputStream broken = new InputStream() {
            private int served;

            @Override
            public int read() throws IOException {
                if (served++ < 10) {
                    return 1;
                }
                throw new IOException("connection reset");
            }
        };

        assertThrows(IOException.class, () -> OutputFiles.writeAtomically(target, broken));

        assertFalse(Files.exists(target));
        try (Stream<Path> entries = Files.list(tempDir)) {
            assertEquals(0, entries.count());
        }
    }

    @Test
    public void testEmptyStreamLeavesTargetUntouched() throws IOException {
        Path target = tempDir.resolve("ATCM40_WP007_r.pdf");

        long bytes = OutputFiles.writeNonEmptyAtomically(target, new ByteArrayInputStream(new byte[0]));

        assertEquals(0, bytes);
        try (Stream<Path> entries = Files.list(tempDir)) {
            assertEquals(0, entries.count());
        }
    }

    @Test
    public void testWrittenFileGetsDefaultPermissions() throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path reference = Files.createFile(tempDir.resolve("reference.txt"));
        Path target = tempDir.resolve("ATCM40_WP007_e.pdf");

        OutputFiles.writeAtomically(target, new ByteArrayInputStream(new byte[]{1}));

        assertEquals(Files.getPosixFilePermissions(reference), Files.getPosixFilePermissions(target));
    }

    @Test
    public void testRequireDirectory() throws IOException {
        Path file = Files.write(tempDir.resolve("plain.txt"), new byte[0]);

        assertEquals(tempDir, OutputFiles.requireDirectory(tempDir));
        assertThrows(NotDirectoryException.class, () -> OutputFiles.requireDirectory(file));
        assertThrows(IOException.class, () -> OutputFiles.requireDirectory(tempDir.resolve("absent")));
    }

    @Test
    public void testTimestampFormat() {
        assertTrue(OutputFiles.timestamp().matches("\\d{4}-\\d{2}-\\d{2}-\\d{2}-\\d{2}-\\d{2}"));
    }
}
