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

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Extracts a {@link MeasureRecord} from a measure page.
 * <p>
 * Every section is optional. A page missing a section yields a degraded record
 * (null title or text, empty characteristics or approvals) rather than an error.
 */
public class MeasurePageParser {

    private static final Logger logger = LoggerFactory.getLogger(MeasurePageParser.class);

    private static final Pattern LINE_BREAK = Pattern.compile("<br\\s*/?>", Pattern.CASE_INSENSITIVE);

    public MeasureRecord parse(InputStream content, String baseUri, int measureNumber) throws IOException {
        Document doc = Jsoup.parse(content, StandardCharsets.UTF_8.name(), baseUri);
        return parse(doc, measureNumber);
    }

    public MeasureRecord parse(String html, int measureNumber) {
        return parse(Jsoup.parse(html), measureNumber);
    }

    private MeasureRecord parse(Document doc, int measureNumber) {
        // Keep the markup as served so that line breaks survive extraction of the body
        doc.outputSettings().prettyPrint(false);

        MeasureRecord record = new MeasureRecord(measureNumber);
        record.setRawTitle(extractTitle(doc));
        record.setRawText(extractBodyText(doc));
        record.setCharacteristics(extractCharacteristics(doc));
        record.setApprovals(extractApprovals(doc));

        if (record.getRawTitle() == null) {
            logger.warn("Measure {} has no title", measureNumber);
        }
        logger.debug("Parsed measure {}: {} characteristics, {} approvals",
            measureNumber, record.getCharacteristics().size(), record.getApprovals().size());
        return record;
    }

    String extractTitle(Document doc) {
        Element title = doc.selectFirst("h1.title");
        return title != null ? title.text() : null;
    }

    /**
     * Returns the inner markup of the first text container with line breaks turned into newlines.
     */
    String extractBodyText(Document doc) {
        Element container = doc.selectFirst("div.text-container");
        if (container == null) {
            return null;
        }
        return LINE_BREAK.matcher(container.html()).replaceAll("\n").trim();
    }

    Map<String, String> extractCharacteristics(Document doc) {
        Map<String, String> characteristics = new LinkedHashMap<>();
        Element list = doc.selectFirst("ul.characteristics__list");
        if (list == null) {
            return characteristics;
        }
        for (Element item : list.select("li.characteristics__item")) {
            Element title = item.selectFirst("h2.characteristics__item__title");
            if (title == null) {
                continue;
            }
            Element text = item.selectFirst("p.characteristics__item__text");
            String value = text != null ? text.text().trim() : "";
            if (!value.isEmpty()) {
                characteristics.put(normalizeLabel(title.text()), value);
            }
        }
        return characteristics;
    }

    List<Approval> extractApprovals(Document doc) {
        List<Approval> approvals = new ArrayList<>();
        Element table = doc.selectFirst("table.approvals");
        if (table == null) {
            return approvals;
        }
        Elements rows = table.select("tr");
        for (Element row : rows) {
            Element country = row.selectFirst("th");
            Element date = row.selectFirst("td");
            if (country != null && date != null) {
                approvals.add(new Approval(country.text().trim(), date.text().trim()));
            }
        }
        return approvals;
    }

    /**
     * Lower-cases a characteristic label and replaces spaces with underscores, e.g. "Date of entry" becomes "date_of_entry".
     */
    static String normalizeLabel(String label) {
        return label.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
