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

import org.antarctic.atsdocs.phase2.fetch.FetchReport;
import org.antarctic.atsdocs.phase3.reconcile.ReconciledRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry point. Runs one phase or all of them.
 */
public class PhaseRunner {

    private static final Logger logger = LoggerFactory.getLogger(PhaseRunner.class);

    private static final String USAGE = "Usage: PhaseRunner [init|metadata|documents|reconcile|measures|all]";

    public static void main(String[] args) {
        String phase = args.length > 0 ? args[0].toLowerCase() : "all";
        try {
            Configuration config = Configuration.load();
            if ("init".equals(phase)) {
                createDirectories(config);
                return;
            }
            if (!isKnownPhase(phase)) {
                System.out.println(USAGE);
                return;
            }

            CorpusPipeline pipeline = new CorpusPipeline(config);
            try {
                run(pipeline, phase);
            } finally {
                pipeline.close();
            }
        } catch (Exception e) {
            logger.error("Error running phase '{}': {}", phase, e.getMessage(), e);
            System.exit(1);
        }
    }

    static boolean isKnownPhase(String phase) {
        switch (phase) {
            case "metadata":
            case "documents":
            case "reconcile":
            case "measures":
            case "all":
                return true;
            default:
                return false;
        }
    }

    private static void run(CorpusPipeline pipeline, String phase) throws IOException {
        switch (phase) {
            case "metadata":
                pipeline.collectMetadata();
                break;
            case "documents": {
                FetchReport report = pipeline.fetchDocuments(pipeline.collectMetadata());
                logger.info("Documents phase complete{}", report.isAborted() ? " (aborted)" : "");
                break;
            }
            case "reconcile": {
                List<ReconciledRecord> results = pipeline.reconcile(pipeline.collectMetadata());
                long unresolved = results.stream().filter(result -> !result.isResolved()).count();
                logger.info("Reconcile phase complete. {} documents need manual review.", unresolved);
                break;
            }
            case "measures":
                pipeline.crawlMeasures();
                break;
            default:
                pipeline.runAll();
        }
    }

    private static void createDirectories(Configuration config) throws IOException {
        logger.info("Creating data directories...");
        for (Path directory : List.of(config.getDocumentsPath(), config.getMeasuresPath(), config.getReportsPath())) {
            Files.createDirectories(directory);
            logger.info("  {}", directory.toAbsolutePath());
        }
    }
}
