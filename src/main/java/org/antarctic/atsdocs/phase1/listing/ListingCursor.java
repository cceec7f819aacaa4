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

/**
 * Position in the paginated listing. Immutable; {@link #advance(Integer)} is the step function.
 * <p>
 * The walk ends as soon as the pager reports a page that is not strictly greater than the
 * current one, which also guards against servers looping back to an earlier page.
 */
public final class ListingCursor {

    private final int currentPage;
    private final boolean finished;

    private ListingCursor(int currentPage, boolean finished) {
        this.currentPage = currentPage;
        this.finished = finished;
    }

    public static ListingCursor startAt(int page) {
        return new ListingCursor(page, false);
    }

    /**
     * Returns the cursor after the current page has been processed.
     *
     * @param reportedNext the pager's {@code next} value, null when the response carried none
     */
    public ListingCursor advance(Integer reportedNext) {
        if (finished || reportedNext == null || reportedNext <= currentPage) {
            return new ListingCursor(currentPage, true);
        }
        return new ListingCursor(reportedNext, false);
    }

    public int getCurrentPage() {
        return currentPage;
    }

    public boolean isFinished() {
        return finished;
    }

    @Override
    public String toString() {
        return finished ? "ListingCursor{finished at " + currentPage + "}" : "ListingCursor{page " + currentPage + "}";
    }
}
