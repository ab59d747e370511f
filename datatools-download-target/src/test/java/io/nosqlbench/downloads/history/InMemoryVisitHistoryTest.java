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
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryVisitHistoryTest {

    private final InMemoryVisitHistory history = new InMemoryVisitHistory();

    private VisitCountResult count(String url) {
        return history.visibleVisitCountToHost(URI.create(url)).toCompletableFuture().join();
    }

    @Test
    void testCountsVisitsByHost() {
        Instant early = Instant.parse("2026-01-02T08:00:00Z");
        Instant late = Instant.parse("2026-03-01T08:00:00Z");
        history.recordVisit(URI.create("https://Example.com/one"), late);
        history.recordVisit(URI.create("https://example.com/two"), early);
        history.recordVisit(URI.create("https://other.org/"), late);

        assertThat(count("https://example.com/anything")).isEqualTo(new VisitCountResult(true, 2, early));
    }

    @Test
    void testUnknownHostHasNoVisits() {
        assertThat(count("https://never.example/")).isEqualTo(VisitCountResult.none());
    }

    @Test
    void testHostlessUrl() {
        assertThat(count("data:text/plain,hi").success()).isFalse();
        assertThatThrownBy(() -> history.recordVisit(URI.create("data:text/plain,hi"), Instant.EPOCH))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
