package io.nosqlbench.downloads.history;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.downloads.target.VisitCountResult;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/// Visit history kept in memory, keyed by host.
public class InMemoryVisitHistory implements VisitHistory {

    private final Map<String, List<Instant>> visitsByHost = new ConcurrentHashMap<>();

    /// Records a visible visit.
    /// @param url the visited URL
    /// @param when the time of the visit
    public void recordVisit(URI url, Instant when) {
        String host = host(url);
        if (host.isEmpty()) {
            throw new IllegalArgumentException("URL has no host: " + url);
        }
        visitsByHost.computeIfAbsent(host, h -> new CopyOnWriteArrayList<>()).add(when);
    }

    @Override
    public CompletionStage<VisitCountResult> visibleVisitCountToHost(URI url) {
        String host = host(url);
        if (host.isEmpty()) {
            return CompletableFuture.completedFuture(VisitCountResult.failed());
        }
        List<Instant> visits = visitsByHost.getOrDefault(host, List.of());
        if (visits.isEmpty()) {
            return CompletableFuture.completedFuture(VisitCountResult.none());
        }
        Instant first = visits.stream().min(Instant::compareTo).orElseThrow();
        return CompletableFuture.completedFuture(new VisitCountResult(true, visits.size(), first));
    }

    private static String host(URI url) {
        return url.getHost() == null ? "" : url.getHost().toLowerCase(Locale.ROOT);
    }
}
