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

import java.time.Instant;

/// Visible visits recorded in history for the host of a URL.
///
/// @param success whether the lookup itself succeeded
/// @param count number of visible visits
/// @param firstVisit time of the earliest visit, or null when there is none
public record VisitCountResult(boolean success, int count, Instant firstVisit) {

    public static VisitCountResult failed() {
        return new VisitCountResult(false, 0, null);
    }

    public static VisitCountResult none() {
        return new VisitCountResult(true, 0, null);
    }
}
