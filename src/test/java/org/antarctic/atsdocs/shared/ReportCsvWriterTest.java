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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the run report CSV files.
 */
public class ReportCsvWriterTest {

    private static final String[] HEADERS = {"filename", "paper_name", "parties"};

    @TempDir
    Path tempDir;

    @Test
    public void testQuotesEveryCellAndWritesLatestCopy() throws IOException {
        List<String[]> rows = List.<String[]>of(
            new String[]{"ATCM40_WP007_e.pdf", "Krill fisheries, an update", "Chile, Norway"});

        Path report = new ReportCsvWriter(tempDir, true).write("reconciled", HEADERS, rows);

        assertTrue(report.getFileName().toString().matches("reconciled-\\d{4}-\\d{2}-\\d{2}-\\d{2}-\\d{2}-\\d{2}\\.csv"));
        List<String> lines = Files.readAllLines(report);
        assertEquals("\"filename\",\"paper_name\",\"parties\"", lines.get(0));
        assertEquals("\"ATCM40_WP007_e.pdf\",\"Krill fisheries, an update\",\"Chile, Norway\"", lines.get(1));
        assertEquals(lines, Files.readAllLines(tempDir.resolve("reconciled-latest.csv")));
    }

    @Test
    public void testLatestCopyCanBeDisabled() throws IOException {
        new ReportCsvWriter(tempDir, false).write("fetch", HEADERS, List.of());

        try (Stream<Path> entries = Files.list(tempDir)) {
            List<String> names = entries.map(path -> path.getFileName().toString()).collect(Collectors.toList());
            assertEquals(1, names.size());
            assertTrue(names.get(0).startsWith("fetch-"));
            assertFalse(names.get(0).endsWith("-latest.csv"));
        }
    }

    @Test
    public void testMissingReportsDirectoryFails() {
        ReportCsvWriter writer = new ReportCsvWriter(tempDir.resolve("missing"), true);

        assertThrows(NoSuchFileException.class, () -> writer.write("fetch", HEADERS, List.of()));
    }

    @Test
    public void testCellRendersNullAsEmpty() {
        assertEquals("", ReportCsvWriter.cell(null));
        assertEquals("2017", ReportCsvWriter.cell(2017));
    }
}
