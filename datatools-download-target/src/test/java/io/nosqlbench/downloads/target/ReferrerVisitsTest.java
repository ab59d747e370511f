package io.nosqlbench.downloads.target;

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

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class ReferrerVisitsTest {

    // 01:30 on March 10 in Berlin
    private final Clock berlin = Clock.fixed(Instant.parse("2026-03-10T00:30:00Z"), ZoneId.of("Europe/Berlin"));

    @Test
    void testVisitsBeforeTodayCount() {
        VisitCountResult lastWeek = new VisitCountResult(true, 4, Instant.parse("2026-03-03T10:00:00Z"));
        assertThat(ReferrerVisits.fromHistory(lastWeek, berlin)).isEqualTo(ReferrerVisits.VISITED_REFERRER);
    }

    @Test
    void testTodayIsJudgedInLocalTime() {
        // 23:30 UTC on March 9 is already March 10 in Berlin
        VisitCountResult lateYesterdayUtc = new VisitCountResult(true, 1, Instant.parse("2026-03-09T23:30:00Z"));
        VisitCountResult earlyYesterday = new VisitCountResult(true, 1, Instant.parse("2026-03-09T12:00:00Z"));

        assertThat(ReferrerVisits.fromHistory(lateYesterdayUtc, berlin)).isEqualTo(ReferrerVisits.NO_VISITS_TO_REFERRER);
        assertThat(ReferrerVisits.fromHistory(earlyYesterday, berlin)).isEqualTo(ReferrerVisits.VISITED_REFERRER);
    }

    @Test
    void testFailedOrEmptyLookups() {
        assertThat(ReferrerVisits.fromHistory(VisitCountResult.failed(), berlin))
            .isEqualTo(ReferrerVisits.NO_VISITS_TO_REFERRER);
        assertThat(ReferrerVisits.fromHistory(VisitCountResult.none(), berlin))
            .isEqualTo(ReferrerVisits.NO_VISITS_TO_REFERRER);
        assertThat(ReferrerVisits.fromHistory(null, berlin)).isEqualTo(ReferrerVisits.NO_VISITS_TO_REFERRER);
    }
}
