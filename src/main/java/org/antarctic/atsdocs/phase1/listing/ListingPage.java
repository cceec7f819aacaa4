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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.antarctic.atsdocs.shared.CanonicalRecord;

import java.util.List;

/**
 * One response of the listing endpoint: {@code {"payload": [...], "pager": {"next": n}}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ListingPage {

    private List<CanonicalRecord> payload;
    private Pager pager;

    public List<CanonicalRecord> getPayload() {
        return payload != null ? payload : List.of();
    }

    public void setPayload(List<CanonicalRecord> payload) {
        this.payload = payload;
    }

    public Pager getPager() {
        return pager;
    }

    public void setPager(Pager pager) {
        this.pager = pager;
    }

    /**
     * Returns the next page number reported by the pager, or null when there is none.
     */
    public Integer nextPage() {
        return pager != null ? pager.getNext() : null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Pager {

        private Integer next;

        public Integer getNext() {
            return next;
        }

        public void setNext(Integer next) {
            this.next = next;
        }
    }
}
