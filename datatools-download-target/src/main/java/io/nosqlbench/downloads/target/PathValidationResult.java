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

/// Outcome of reserving a target path.
public enum PathValidationResult {
    /// The requested path is reserved as is
    SUCCESS,
    /// A conflict was resolved by picking a different name
    SUCCESS_RESOLVED_CONFLICT,
    /// The target is the file being downloaded
    SAME_AS_SOURCE,
    /// The directory is missing or read-only; a fallback location may have been returned
    PATH_NOT_WRITABLE,
    /// The name cannot be shortened enough for the filesystem
    NAME_TOO_LONG,
    /// The path is taken and the conflict action did not allow resolving it
    CONFLICT;

    /// @return true if the returned path can be used without asking the user
    public boolean isSuccess() {
        return this == SUCCESS || this == SUCCESS_RESOLVED_CONFLICT || this == SAME_AS_SOURCE;
    }
}
