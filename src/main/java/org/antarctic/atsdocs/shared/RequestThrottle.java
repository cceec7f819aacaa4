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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;

/**
 * Fixed-interval rate limiter per remote host.
 * Requests to the same host are spaced at least {@code intervalMs} apart, across all threads.
 */
public class RequestThrottle {

    private static final Logger logger = LoggerFactory.getLogger(RequestThrottle.class);

    private final long intervalMs;
    private final Map<String, Long> nextSlotByHost = new HashMap<>();

    public RequestThrottle(long intervalMs) {
        this.intervalMs = Math.max(0, intervalMs);
    }

    /**
     * Blocks until a request to the host of the given URL may be issued.
     */
    public void acquire(String url) throws InterruptedException {
        if (intervalMs == 0) {
            return;
        }
        String host = hostOf(url);
        long waitMs;
        synchronized (nextSlotByHost) {
            long now = System.currentTimeMillis();
            long slot = Math.max(now, nextSlotByHost.getOrDefault(host, now));
            nextSlotByHost.put(host, slot + intervalMs);
            waitMs = slot - now;
        }
        if (waitMs > 0) {
            logger.debug("Waiting {} ms before next request to {}", waitMs, host);
            Thread.sleep(waitMs);
        }
    }

    private static String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host : url;
        } catch (IllegalArgumentException e) {
            return url;
        }
    }
}
