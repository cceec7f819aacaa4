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

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for document URL derivation.
 */
public class UrlResolverTest {

    @Test
    public void testResolveProducesFourVariantsInLanguageOrder() {
        CanonicalRecord record = new CanonicalRecord("1", "ATCM", "40", "WP", 7, 0, "pdf");

        List<DocumentVariant> variants = new UrlResolver().resolve(record);

        assertEquals(4, variants.size());
        assertEquals("e", variants.get(0).getLanguage());
        assertEquals("s", variants.get(1).getLanguage());
        assertEquals("f", variants.get(2).getLanguage());
        assertEquals("r", variants.get(3).getLanguage());
        assertEquals("https://documents.ats.aq/ATCM40/WP/ATCM40_WP007_e.pdf", variants.get(0).getUrl());
        assertEquals("ATCM40_WP007_r.pdf", variants.get(3).getFilename());
    }

    @Test
    public void testRevisionSegmentOnlyWhenPositive() {
        CanonicalRecord revised = new CanonicalRecord("2", "ATCM", "40", "WP", 7, 2, "doc");
        CanonicalRecord original = new CanonicalRecord("3", "ATCM", "40", "WP", 7, 0, "doc");

        assertEquals("ATCM40_WP007_rev2_s.doc", UrlResolver.filename(revised, "s"));
        assertEquals("ATCM40_WP007_s.doc", UrlResolver.filename(original, "s"));
        for (String name : UrlResolver.filenames(original)) {
            assertFalse(name.contains("rev"), name);
        }
    }

    @Test
    public void testNumberIsZeroPaddedToThreeDigits() {
        assertEquals("CEP12_IP001_e.pdf",
            UrlResolver.filename(new CanonicalRecord("4", "CEP", "12", "IP", 1, 0, "pdf"), "e"));
        assertEquals("CEP12_IP1234_e.pdf",
            UrlResolver.filename(new CanonicalRecord("5", "CEP", "12", "IP", 1234, 0, "pdf"), "e"));
    }

    @Test
    public void testConfiguredBaseUrlWithTrailingSlash() {
        CanonicalRecord record = new CanonicalRecord("6", "SATCM", "3", "WP", 10, 1, "pdf");

        List<DocumentVariant> variants = new UrlResolver("http://127.0.0.1:8080/").resolve(record);

        assertEquals("http://127.0.0.1:8080/SATCM3/WP/SATCM3_WP010_rev1_e.pdf", variants.get(0).getUrl());
    }

    @Test
    public void testMissingFieldIsRejected() {
        CanonicalRecord record = new CanonicalRecord("7", null, "40", "WP", 7, 0, "pdf");

        assertThrows(IllegalArgumentException.class, () -> new UrlResolver().resolve(record));
    }
}
