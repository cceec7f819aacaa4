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

/**
 * Position in a dense range of measure ids. Immutable; {@link #advance()} is the step function.
 */
public final class MeasureCursor {

    private final int currentId;
    private final int lastId;

    private MeasureCursor(int currentId, int lastId) {
        this.currentId = currentId;
        this.lastId = lastId;
    }

    /**
     * Creates a cursor over {@code first..last}, both inclusive. An empty range is finished right away.
     */
    public static MeasureCursor range(int first, int last) {
        if (first < 1) {
            throw new IllegalArgumentException("Measure ids start at 1, got " + first);
        }
        return new MeasureCursor(first, last);
    }

    public MeasureCursor advance() {
        return new MeasureCursor(currentId + 1, lastId);
    }

    public int getCurrentId() {
        return currentId;
    }

    public boolean isFinished() {
        return currentId > lastId;
    }

    @Override
    public String toString() {
        return "MeasureCursor{" + currentId + ".." + lastId + "}";
    }
}
