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

import java.time.Clock;
import java.time.LocalDate;

/// Whether the user visited the referrer's host before today.
public enum ReferrerVisits {
    NO_VISITS_TO_REFERRER,
    VISITED_REFERRER;

    /// A visit counts only if it happened before the start of the current local day, so
    /// a page visited for the first time today does not vouch for its own downloads.
    /// @param result the history lookup result
    /// @param clock supplies the current time and zone
    /// @return the visit classification
    public static ReferrerVisits fromHistory(VisitCountResult result, Clock clock) {
        if (result == null || !result.success() || result.count() <= 0 || result.firstVisit() == null) {
            return NO_VISITS_TO_REFERRER;
        }
        LocalDate firstVisitDay = result.firstVisit().atZone(clock.getZone()).toLocalDate();
        LocalDate today = LocalDate.now(clock);
        return firstVisitDay.isBefore(today) ? VISITED_REFERRER : NO_VISITS_TO_REFERRER;
    }
}
