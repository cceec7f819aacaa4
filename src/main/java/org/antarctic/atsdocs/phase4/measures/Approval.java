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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of a measure's approval table: the approving party and the date as printed.
 */
public class Approval {

    private final String country;
    private final String date;

    @JsonCreator
    public Approval(@JsonProperty("country") String country, @JsonProperty("date") String date) {
        this.country = country;
        this.date = date;
    }

    public String getCountry() {
        return country;
    }

    public String getDate() {
        return date;
    }

    @Override
    public String toString() {
        return country + " (" + date + ")";
    }
}
