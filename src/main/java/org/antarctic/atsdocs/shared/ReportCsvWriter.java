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

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the run reports of the reports directory.
 * <p>
 * Each report lands in {@code {name}-{timestamp}.csv} and, when enabled, in {@code {name}-latest.csv}
 * so consecutive runs can be diffed. Every cell is quoted, since paper titles and party lists
 * routinely contain commas. Reports are written atomically like every other output file.
 */
public class ReportCsvWriter {

    private static final Logger logger = LoggerFactory.getLogger(ReportCsvWriter.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setQuoteMode(QuoteMode.ALL)
        .setRecordSeparator(System.lineSeparator())
        .build();

    private final Path reportsDir;
    private final boolean writeLatestCopy;

    public ReportCsvWriter(Path reportsDir, boolean writeLatestCopy) {
        this.reportsDir = reportsDir;
        this.writeLatestCopy = writeLatestCopy;
    }

    /**
     * Writes one report.
     *
     * @return the timestamped file
     * @throws IOException if the reports directory is missing or a file cannot be written
     */
    public Path write(String reportName, String[] headers, List<String[]> rows) throws IOException {
        OutputFiles.requireDirectory(reportsDir);
        byte[] content = render(headers, rows);

        Path report = reportsDir.resolve(reportName + "-" + OutputFiles.timestamp() + ".csv");
        OutputFiles.writeAtomically(report, content);
        logger.debug("Wrote {} rows to {}", rows.size(), report);

        if (writeLatestCopy) {
            Path latest = reportsDir.resolve(reportName + "-latest.csv");
            OutputFiles.writeAtomically(latest, content);
            logger.debug("Wrote {} copy: {}", latest.getFileName(), latest);
        }
        return report;
    }

    static byte[] render(String[] headers, List<String[]> rows) throws IOException {
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, FORMAT.builder().setHeader(headers).build())) {
            for (String[] row : rows) {
                printer.printRecord((Object[]) row);
            }
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Renders a nullable value as a CSV cell.
     */
    public static String cell(Object value) {
        return value != null ? value.toString() : "";
    }
}
