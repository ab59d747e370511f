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

import java.nio.file.Path;
import java.util.Objects;

/// Result of asking the path reservation service for a target.
///
/// @param result how the reservation went
/// @param path the reserved path; may differ from the requested one
public record PathReservation(PathValidationResult result, Path path) {
    public PathReservation {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(path, "path");
    }
}
