package io.nosqlbench.downloads.item;

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

/// Outcome of the insecure (mixed content / plain http) download classification.
public enum InsecureDownloadStatus {
    /// Not yet determined
    UNKNOWN,
    /// Delivered securely, or not subject to blocking
    SAFE,
    /// The user has already accepted the insecure download
    VALIDATED,
    /// Allowed, with a visible warning
    WARN,
    /// Blocked, the user may override
    BLOCK,
    /// Blocked without any user visible trace; ends target resolution immediately
    SILENT_BLOCK
}
