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
package org.antarctic.atsdocs.phase4.measures;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for measure page parsing.
 */
public class MeasurePageParserTest {

    static final String FULL_PAGE = "<html><body>"
        + "<h1 class=\"title\">Measure 4 (2004) - ATCM XXVII, Cape Town</h1>"
        + "<div class=\"text-container\">First paragraph<br/>Second paragraph<br>Third</div>"
        + "<ul class=\"characteristics__list\">"
        + "<li class=\"characteristics__item\"><h2 class=\"characteristics__item__title\">Meeting</h2>"
        + "<p class=\"characteristics__item__text\"> ATCM XXVII </p></li>"
        + "<li class=\"characteristics__item\"><h2 class=\"characteristics__item__title\">Date of entry into force</h2>"
        + "<p class=\"characteristics__item__text\">24/05/2017</p></li>"
        + "<li class=\"characteristics__item\"><h2 class=\"characteristics__item__title\">Status</h2>"
        + "<p class=\"characteristics__item__text\"></p></li>"
        + "<li class=\"characteristics__item\"><h2 class=\"characteristics__item__title\">Topics</h2></li>"
        + "</ul>"
        + "<table class=\"approvals\">"
        + "<tr><th>Country</th></tr>"
        + "<tr><th>Argentina</th><td>03/02/2005</td></tr>"
        + "<tr><th> Chile </th><td> 12/07/2006 </td></tr>"
        + "</table>"
        + "</body></html>";

    private final MeasurePageParser parser = new MeasurePageParser();

    @Test
    public void testParseFullPage() {
        MeasureRecord record = parser.parse(FULL_PAGE, 4);

        assertEquals(4, record.getMeasureNumber());
        assertEquals("Measure 4 (2004) - ATCM XXVII, Cape Town", record.getRawTitle());
        assertEquals("First paragraph\nSecond paragraph\nThird", record.getRawText());

        Map<String, String> characteristics = record.getCharacteristics();
        assertEquals(List.of("meeting", "date_of_entry_into_force"), List.copyOf(characteristics.keySet()));
        assertEquals("ATCM XXVII", characteristics.get("meeting"));

        List<Approval> approvals = record.getApprovals();
        assertEquals(2, approvals.size());
        assertEquals("Argentina", approvals.get(0).getCountry());
        assertEquals("03/02/2005", approvals.get(0).getDate());
        assertEquals("Chile", approvals.get(1).getCountry());
        assertEquals("12/07/2006", approvals.get(1).getDate());
    }

    @Test
    public void testMissingSectionsDegradeGracefully() {
        MeasureRecord record = parser.parse("<html><body><p>Nothing here</p></body></html>", 12);

        assertNull(record.getRawTitle());
        assertNull(record.getRawText());
        assertTrue(record.getCharacteristics().isEmpty());
        assertTrue(record.getApprovals().isEmpty());
    }

    @Test
    public void testBodyKeepsInnerMarkup() {
        MeasureRecord record = parser.parse(
            "<div class=\"text-container\"> <p>Annex A</p><br />Done </div>"
                + "<div class=\"text-container\">ignored</div>", 1);

        assertEquals("<p>Annex A</p>\nDone", record.getRawText());
    }

    @Test
    public void testNormalizeLabel() {
        assertEquals("date_of_entry_into_force", MeasurePageParser.normalizeLabel("Date Of Entry Into Force"));
    }
}
